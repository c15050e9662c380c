package io.github.panghy.indexbuild.node;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.GetJobStatsRequest;
import io.github.panghy.indexbuild.proto.GetJobStatsResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lease-based registry of index-build workers used for placement.
 *
 * <p>Workers register with an address, a capacity and a client handle, then renew a lease through
 * {@link #heartbeat(long)}. A worker whose lease is older than {@code leaseTtl}, or whose health
 * check has failed continuously for {@code healthFailureWindow}, is removed and reported to every
 * {@link NodeListener}. A worker that called {@link #markStopping(long)} stays addressable so its
 * in-flight jobs can be polled, but receives no new placements.</p>
 *
 * <p>The registry lock guards only the node map; listeners and worker health checks run outside it.</p>
 */
public final class NodeRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(NodeRegistry.class);

  private final Duration leaseTtl;
  private final Duration healthFailureWindow;
  private final InstantSource clock;

  private final Object lock = new Object();
  // guarded by lock; insertion order drives round-robin tie breaking
  private final Map<Long, Entry> nodes = new LinkedHashMap<>();
  private final AtomicLong cursor = new AtomicLong();
  private final List<NodeListener> listeners = new CopyOnWriteArrayList<>();

  public NodeRegistry(Duration leaseTtl, Duration healthFailureWindow, InstantSource clock) {
    this.leaseTtl = Objects.requireNonNull(leaseTtl, "leaseTtl");
    this.healthFailureWindow = Objects.requireNonNull(healthFailureWindow, "healthFailureWindow");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (leaseTtl.isZero() || leaseTtl.isNegative()) throw new IllegalArgumentException("leaseTtl must be positive");
    if (healthFailureWindow.isNegative()) {
      throw new IllegalArgumentException("healthFailureWindow must not be negative");
    }
  }

  public void addListener(NodeListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Registers (or re-registers) a worker. Re-registration resets the node to {@link NodeState#LIVE}
   * with a fresh lease and replaces its client.
   */
  public void register(long nodeId, String address, int capacity, IndexNodeClient client) {
    if (nodeId == 0) throw new IllegalArgumentException("nodeId 0 is reserved");
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
    Objects.requireNonNull(client, "client");
    synchronized (lock) {
      nodes.put(nodeId, new Entry(nodeId, address, capacity, client, clock.instant()));
    }
    LOG.info("index node registered nodeID={} address={} capacity={}", nodeId, address, capacity);
  }

  /** Renews the lease of a node. Returns {@code false} if the node is not registered. */
  public boolean heartbeat(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      if (e == null) return false;
      e.lastHeartbeat = clock.instant();
      return true;
    }
  }

  /** Excludes a node from placement while keeping it addressable. */
  public boolean markStopping(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      if (e == null) return false;
      e.state = NodeState.STOPPING;
    }
    LOG.info("index node stopping nodeID={}", nodeId);
    return true;
  }

  /** Removes a node explicitly, notifying listeners. Returns {@code false} if it was unknown. */
  public boolean unregister(long nodeId) {
    Entry removed;
    synchronized (lock) {
      removed = nodes.remove(nodeId);
    }
    if (removed == null) return false;
    LOG.info("index node unregistered nodeID={}", nodeId);
    notifyRemoved(removed);
    return true;
  }

  /**
   * Removes every node whose lease is older than the configured TTL.
   *
   * @return ids of the removed nodes
   */
  public List<Long> expireLeases() {
    Instant deadline = clock.instant().minus(leaseTtl);
    List<Entry> expired = new ArrayList<>();
    synchronized (lock) {
      nodes.values().removeIf(e -> {
        if (e.lastHeartbeat.isBefore(deadline)) {
          expired.add(e);
          return true;
        }
        return false;
      });
    }
    List<Long> ids = new ArrayList<>();
    for (Entry e : expired) {
      LOG.warn("index node lease expired nodeID={} lastHeartbeat={}", e.nodeId, e.lastHeartbeat);
      ids.add(e.nodeId);
      notifyRemoved(e);
    }
    return ids;
  }

  /**
   * Picks the live node with the most free task slots; ties rotate round-robin.
   *
   * @throws IndexBuildException with {@code NO_AVAILABLE_NODE} when no live node has a free slot
   */
  public long pickNode() {
    synchronized (lock) {
      List<Entry> candidates = new ArrayList<>();
      for (Entry e : nodes.values()) {
        if (e.state == NodeState.LIVE && e.freeSlots > 0) candidates.add(e);
      }
      if (candidates.isEmpty()) {
        throw new IndexBuildException(ErrorCode.NO_AVAILABLE_NODE, "no available index node");
      }
      int best = candidates.stream().mapToInt(e -> e.freeSlots).max().getAsInt();
      candidates.removeIf(e -> e.freeSlots < best);
      candidates.sort(Comparator.comparingLong(e -> e.nodeId));
      int idx = (int) Math.floorMod(cursor.getAndIncrement(), (long) candidates.size());
      return candidates.get(idx).nodeId;
    }
  }

  /** Records that a job was placed on the node, until the next health check refreshes its slots. */
  public void consumeSlot(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      if (e != null && e.freeSlots > 0) e.freeSlots--;
    }
  }

  /** True when the node is registered and {@link NodeState#LIVE}. */
  public boolean isHealthy(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      return e != null && e.state == NodeState.LIVE;
    }
  }

  /** True when the node is registered, live or stopping. */
  public boolean isAlive(long nodeId) {
    synchronized (lock) {
      return nodes.containsKey(nodeId);
    }
  }

  /** Returns the client of a registered node, or {@code null}. */
  public IndexNodeClient client(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      return e == null ? null : e.client;
    }
  }

  /** Returns the view of a registered node, or {@code null}. */
  public NodeInfo get(long nodeId) {
    synchronized (lock) {
      Entry e = nodes.get(nodeId);
      return e == null ? null : e.view();
    }
  }

  /** Snapshot of every registered node. */
  public List<NodeInfo> nodes() {
    synchronized (lock) {
      List<NodeInfo> out = new ArrayList<>(nodes.size());
      for (Entry e : nodes.values()) out.add(e.view());
      return out;
    }
  }

  /**
   * Checks every registered node with {@code GetJobStats}. Successful checks refresh the free-slot
   * count; a node failing continuously for longer than the health failure window is removed.
   */
  public CompletableFuture<Void> checkHealth() {
    List<Entry> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(nodes.values());
    }
    List<CompletableFuture<Void>> checks = new ArrayList<>(snapshot.size());
    for (Entry e : snapshot) {
      checks.add(checkNode(e));
    }
    return CompletableFuture.allOf(checks.toArray(CompletableFuture[]::new));
  }

  private CompletableFuture<Void> checkNode(Entry e) {
    CompletableFuture<GetJobStatsResponse> call;
    try {
      call = e.client.getJobStats(GetJobStatsRequest.getDefaultInstance());
    } catch (RuntimeException ex) {
      call = CompletableFuture.failedFuture(ex);
    }
    return call.handle((resp, ex) -> {
      if (ex == null && resp.getStatus().getErrorCode() == ErrorCode.SUCCESS) {
        synchronized (lock) {
          e.failingSince = null;
          e.freeSlots = (int) Math.max(0, resp.getTaskSlots());
        }
      } else {
        onCheckFailure(
            e,
            ex != null
                ? String.valueOf(IndexBuildException.unwrap(ex).getMessage())
                : resp.getStatus().getReason());
      }
      return null;
    });
  }

  private void onCheckFailure(Entry e, String reason) {
    Instant now = clock.instant();
    boolean remove = false;
    synchronized (lock) {
      if (nodes.get(e.nodeId) != e) return;
      if (e.failingSince == null) e.failingSince = now;
      if (!now.isBefore(e.failingSince.plus(healthFailureWindow))) {
        nodes.remove(e.nodeId);
        remove = true;
      }
    }
    if (remove) {
      LOG.warn("index node failed health checks since {}, removing nodeID={} reason={}",
          e.failingSince, e.nodeId, reason);
      notifyRemoved(e);
    } else {
      LOG.warn("index node health check failed nodeID={} reason={}", e.nodeId, reason);
    }
  }

  private void notifyRemoved(Entry e) {
    NodeInfo gone;
    synchronized (lock) {
      e.state = NodeState.GONE;
      gone = e.view();
    }
    for (NodeListener l : listeners) {
      try {
        l.onNodeRemoved(gone);
      } catch (RuntimeException ex) {
        LOG.warn("node listener failed for nodeID={}", e.nodeId, ex);
      }
    }
  }

  private static final class Entry {
    final long nodeId;
    final String address;
    final int capacity;
    final IndexNodeClient client;
    Instant lastHeartbeat;
    NodeState state = NodeState.LIVE;
    int freeSlots;
    Instant failingSince;

    Entry(long nodeId, String address, int capacity, IndexNodeClient client, Instant now) {
      this.nodeId = nodeId;
      this.address = address;
      this.capacity = capacity;
      this.client = client;
      this.lastHeartbeat = now;
      this.freeSlots = capacity;
    }

    NodeInfo view() {
      return new NodeInfo(nodeId, address, capacity, freeSlots, lastHeartbeat, state);
    }
  }
}
