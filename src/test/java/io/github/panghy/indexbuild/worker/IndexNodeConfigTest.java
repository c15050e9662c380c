package io.github.panghy.indexbuild.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.indexbuild.config.ConfigManager;
import io.github.panghy.indexbuild.config.MapConfigSource;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndexNodeConfigTest {

  @Test
  void defaults() {
    IndexNodeConfig c = IndexNodeConfig.builder(1).build();

    assertThat(c.getNodeId()).isEqualTo(1);
    assertThat(c.getBuildParallel()).isEqualTo(1);
    assertThat(c.getMaxQueueLength()).isEqualTo(1024);
    assertThat(c.getGracefulStopTimeout()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void reads_config_keys() {
    ConfigManager config = new ConfigManager();
    config.addSource(new MapConfigSource("test", 10, Map.of(
        "indexNode.scheduler.buildParallel", "4",
        "indexNode.scheduler.maxQueueLength", "16",
        "indexNode.gracefulStopTimeout", "5")));

    IndexNodeConfig c = IndexNodeConfig.fromConfig(config, 9);

    assertThat(c.getNodeId()).isEqualTo(9);
    assertThat(c.getBuildParallel()).isEqualTo(4);
    assertThat(c.getMaxQueueLength()).isEqualTo(16);
    assertThat(c.getGracefulStopTimeout()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void validation() {
    assertThatThrownBy(() -> IndexNodeConfig.builder(0).build()).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexNodeConfig.builder(1).buildParallel(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexNodeConfig.builder(1).maxQueueLength(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexNodeConfig.builder(1).gracefulStopTimeout(Duration.ofSeconds(-1)).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
