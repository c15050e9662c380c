package io.github.panghy.indexbuild.coord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.indexbuild.config.ConfigManager;
import io.github.panghy.indexbuild.config.MapConfigSource;
import io.github.panghy.indexbuild.dispatch.BuildRetryPolicy;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndexCoordinatorConfigTest {

  @Test
  void defaults() {
    IndexCoordinatorConfig c = IndexCoordinatorConfig.builder().build();

    assertThat(c.getClusterId()).isEqualTo("by-dev");
    assertThat(c.getServerId()).isEqualTo(1);
    assertThat(c.getMinSegmentRowsToEnableIndex()).isEqualTo(1024);
    assertThat(c.getGcInterval()).isEqualTo(Duration.ofMinutes(10));
    assertThat(c.getGcMetaInterval()).isEqualTo(Duration.ofMinutes(1));
    assertThat(c.getRetryPolicy()).isEqualTo(BuildRetryPolicy.defaults());
    assertThat(c.getNodeLeaseTtl()).isEqualTo(Duration.ofSeconds(30));
    assertThat(c.getSegmentCacheTtl()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void reads_config_keys_with_their_units() {
    ConfigManager config = new ConfigManager();
    config.addSource(new MapConfigSource("test", 10, Map.of(
        "common.clusterId", "prod",
        "indexCoord.serverId", "12",
        "indexCoord.scheduler.interval", "250",
        "indexCoord.scheduler.pollInterval", "PT2S",
        "indexCoord.minSegmentNumRowsToEnableIndex", "0",
        "indexCoord.gc.interval", "120",
        "indexCoord.build.maxAttempts", "5",
        "indexCoord.build.retryBackoff", "3",
        "indexCoord.node.healthFailureWindow", "0")));

    IndexCoordinatorConfig c = IndexCoordinatorConfig.fromConfig(config);

    assertThat(c.getClusterId()).isEqualTo("prod");
    assertThat(c.getServerId()).isEqualTo(12);
    assertThat(c.getAssignInterval()).isEqualTo(Duration.ofMillis(250));
    assertThat(c.getPollInterval()).isEqualTo(Duration.ofSeconds(2));
    assertThat(c.getMinSegmentRowsToEnableIndex()).isZero();
    assertThat(c.getGcInterval()).isEqualTo(Duration.ofMinutes(2));
    assertThat(c.getGcMetaInterval()).isEqualTo(Duration.ofMinutes(1));
    assertThat(c.getRetryPolicy()).isEqualTo(new BuildRetryPolicy(5, Duration.ofSeconds(3)));
    assertThat(c.getNodeHealthFailureWindow()).isZero();
  }

  @Test
  void validation() {
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder().clusterId(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder().serverId(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder().assignInterval(Duration.ZERO).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder().minSegmentRowsToEnableIndex(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder()
            .nodeHealthFailureWindow(Duration.ofSeconds(-1))
            .build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexCoordinatorConfig.builder().retryPolicy(null).build())
        .isInstanceOf(NullPointerException.class);
  }
}
