package io.github.panghy.indexbuild.node;

import java.time.Instant;

/**
 * Point-in-time view of a registered worker.
 *
 * @param nodeId        worker id, never 0
 * @param address       address the worker was registered with
 * @param capacity      configured build parallelism of the worker
 * @param freeSlots     free task slots last reported by the worker (or assumed after placement)
 * @param lastHeartbeat time of the last lease renewal
 * @param state         liveness state
 */
public record NodeInfo(
    long nodeId, String address, int capacity, int freeSlots, Instant lastHeartbeat, NodeState state) {}
