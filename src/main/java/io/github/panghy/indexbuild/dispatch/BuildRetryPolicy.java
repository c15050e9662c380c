package io.github.panghy.indexbuild.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * How often, and how soon, a build lost with its worker is re-issued.
 *
 * <p>Attempts are counted by index version: the first build of a segment index is attempt 1 and
 * every rebuild increments it. Once {@code maxAttempts} builds were lost the attempt is marked
 * {@code FAILED} instead of being rebuilt. A rebuilt attempt is not dispatched before
 * {@code backoff} has passed since it was created.</p>
 *
 * @param maxAttempts total build attempts allowed per segment index, at least 1
 * @param backoff     minimum delay before dispatching a rebuilt attempt
 */
public record BuildRetryPolicy(int maxAttempts, Duration backoff) {

  public BuildRetryPolicy {
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
  }

  public static BuildRetryPolicy defaults() {
    return new BuildRetryPolicy(3, Duration.ofSeconds(10));
  }

  /** True when an attempt at {@code indexVersion} may be rebuilt once more. */
  public boolean canRebuild(long indexVersion) {
    return indexVersion < maxAttempts;
  }

  /** True when an attempt created at {@code createTimeMillis} may be dispatched at {@code nowMillis}. */
  public boolean isDue(long indexVersion, long createTimeMillis, long nowMillis) {
    return indexVersion <= 1 || nowMillis - createTimeMillis >= backoff.toMillis();
  }
}
