package io.github.panghy.indexbuild.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BuildRetryPolicyTest {

  @Test
  void attempts_are_bounded_by_version() {
    BuildRetryPolicy policy = new BuildRetryPolicy(3, Duration.ofSeconds(10));

    assertThat(policy.canRebuild(1)).isTrue();
    assertThat(policy.canRebuild(2)).isTrue();
    assertThat(policy.canRebuild(3)).isFalse();
  }

  @Test
  void first_attempt_is_always_due() {
    BuildRetryPolicy policy = new BuildRetryPolicy(3, Duration.ofSeconds(10));

    assertThat(policy.isDue(1, 1_000, 1_000)).isTrue();
    assertThat(policy.isDue(2, 1_000, 10_999)).isFalse();
    assertThat(policy.isDue(2, 1_000, 11_000)).isTrue();
  }

  @Test
  void validation() {
    assertThat(BuildRetryPolicy.defaults().maxAttempts()).isEqualTo(3);
    assertThatThrownBy(() -> new BuildRetryPolicy(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BuildRetryPolicy(1, Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
