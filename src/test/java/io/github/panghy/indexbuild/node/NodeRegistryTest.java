package io.github.panghy.indexbuild.node;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.Statuses;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.GetJobStatsResponse;
import io.github.panghy.indexbuild.testutil.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link NodeRegistry}: placement, leases, graceful stop and health probing.
 */
class NodeRegistryTest {

  MutableClock clock;
  NodeRegistry registry;
  List<Long> removed;

  @BeforeEach
  void setup() {
    clock = new MutableClock();
    registry = new NodeRegistry(Duration.ofSeconds(30), Duration.ofSeconds(20), clock);
    removed = new ArrayList<>();
    registry.addListener(node -> removed.add(node.nodeId()));
  }

  static IndexNodeClient clientWithSlots(long slots) {
    IndexNodeClient client = mock(IndexNodeClient.class);
    when(client.getJobStats(any())).thenReturn(completedFuture(
        GetJobStatsResponse.newBuilder().setStatus(Statuses.success()).setTaskSlots(slots).build()));
    return client;
  }

  @Test
  void pick_prefers_most_free_slots() {
    registry.register(1, "n1", 1, clientWithSlots(1));
    registry.register(2, "n2", 4, clientWithSlots(4));

    assertThat(registry.pickNode()).isEqualTo(2);
    registry.consumeSlot(2);
    registry.consumeSlot(2);
    registry.consumeSlot(2);
    // both now have one free slot
    assertThat(List.of(registry.pickNode(), registry.pickNode())).containsExactlyInAnyOrder(1L, 2L);
  }

  @Test
  void ties_rotate_round_robin() {
    registry.register(1, "n1", 2, clientWithSlots(2));
    registry.register(2, "n2", 2, clientWithSlots(2));

    List<Long> picks = new ArrayList<>();
    for (int i = 0; i < 4; i++) picks.add(registry.pickNode());

    assertThat(picks).containsExactly(1L, 2L, 1L, 2L);
  }

  @Test
  void no_node_when_empty_or_full() {
    assertThatThrownBy(() -> registry.pickNode())
        .isInstanceOf(IndexBuildException.class)
        .satisfies(e -> assertThat(((IndexBuildException) e).getErrorCode()).isEqualTo(ErrorCode.NO_AVAILABLE_NODE));

    registry.register(1, "n1", 1, clientWithSlots(1));
    registry.consumeSlot(1);
    assertThatThrownBy(() -> registry.pickNode()).isInstanceOf(IndexBuildException.class);
  }

  @Test
  void health_check_refreshes_slots() throws Exception {
    registry.register(1, "n1", 4, clientWithSlots(0));
    assertThat(registry.get(1).freeSlots()).isEqualTo(4);

    registry.checkHealth().get(5, TimeUnit.SECONDS);

    assertThat(registry.get(1).freeSlots()).isZero();
    assertThatThrownBy(() -> registry.pickNode()).isInstanceOf(IndexBuildException.class);
  }

  @Test
  void stopping_node_is_not_picked_but_stays_addressable() {
    registry.register(1, "n1", 1, clientWithSlots(1));
    registry.register(2, "n2", 1, clientWithSlots(1));

    assertThat(registry.markStopping(1)).isTrue();

    assertThat(registry.pickNode()).isEqualTo(2);
    assertThat(registry.pickNode()).isEqualTo(2);
    assertThat(registry.isAlive(1)).isTrue();
    assertThat(registry.isHealthy(1)).isFalse();
    assertThat(registry.client(1)).isNotNull();
    assertThat(registry.get(1).state()).isEqualTo(NodeState.STOPPING);
  }

  @Test
  void lease_expiry_removes_and_notifies() {
    registry.register(1, "n1", 1, clientWithSlots(1));
    registry.register(2, "n2", 1, clientWithSlots(1));

    clock.advance(Duration.ofSeconds(20));
    assertThat(registry.heartbeat(2)).isTrue();
    clock.advance(Duration.ofSeconds(15));

    assertThat(registry.expireLeases()).containsExactly(1L);
    assertThat(removed).containsExactly(1L);
    assertThat(registry.isAlive(1)).isFalse();
    assertThat(registry.client(1)).isNull();
    assertThat(registry.heartbeat(1)).isFalse();
    assertThat(registry.nodes()).extracting(NodeInfo::nodeId).containsExactly(2L);
  }

  @Test
  void failing_health_check_removes_node_after_window() throws Exception {
    IndexNodeClient client = mock(IndexNodeClient.class);
    when(client.getJobStats(any())).thenReturn(failedFuture(new IOException("connection refused")));
    registry.register(1, "n1", 1, client);

    registry.checkHealth().get(5, TimeUnit.SECONDS);
    assertThat(registry.isAlive(1)).isTrue();

    clock.advance(Duration.ofSeconds(10));
    registry.checkHealth().get(5, TimeUnit.SECONDS);
    assertThat(registry.isAlive(1)).isTrue();

    clock.advance(Duration.ofSeconds(10));
    registry.checkHealth().get(5, TimeUnit.SECONDS);
    assertThat(registry.isAlive(1)).isFalse();
    assertThat(removed).containsExactly(1L);
  }

  @Test
  void successful_health_check_resets_failure_window() throws Exception {
    IndexNodeClient client = mock(IndexNodeClient.class);
    GetJobStatsResponse ok =
        GetJobStatsResponse.newBuilder().setStatus(Statuses.success()).setTaskSlots(1).build();
    when(client.getJobStats(any()))
        .thenReturn(failedFuture(new IOException("timeout")))
        .thenReturn(completedFuture(ok))
        .thenReturn(failedFuture(new IOException("timeout")));
    registry.register(1, "n1", 1, client);

    registry.checkHealth().get(5, TimeUnit.SECONDS);
    clock.advance(Duration.ofSeconds(15));
    registry.checkHealth().get(5, TimeUnit.SECONDS);
    clock.advance(Duration.ofSeconds(15));
    registry.checkHealth().get(5, TimeUnit.SECONDS);

    assertThat(registry.isAlive(1)).isTrue();
  }

  @Test
  void unregister_notifies_listener_once() {
    registry.register(1, "n1", 1, clientWithSlots(1));

    assertThat(registry.unregister(1)).isTrue();
    assertThat(registry.unregister(1)).isFalse();
    assertThat(removed).containsExactly(1L);
  }

  @Test
  void rejects_reserved_id_and_bad_capacity() {
    assertThatThrownBy(() -> registry.register(0, "n0", 1, clientWithSlots(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.register(1, "n1", 0, clientWithSlots(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
