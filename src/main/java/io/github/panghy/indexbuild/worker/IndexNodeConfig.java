package io.github.panghy.indexbuild.worker;

import io.github.panghy.indexbuild.config.ConfigManager;
import java.time.Duration;
import java.time.InstantSource;
import java.util.Objects;

/**
 * Configuration of an index-build worker.
 *
 * <p>Built with a validating builder and exposed through getters only. {@link #fromConfig} reads
 * the {@code indexNode.*} keys of a {@link ConfigManager}.</p>
 */
public final class IndexNodeConfig {

  public static final String BUILD_PARALLEL_KEY = "indexNode.scheduler.buildParallel";
  public static final String MAX_QUEUE_LENGTH_KEY = "indexNode.scheduler.maxQueueLength";
  public static final String GRACEFUL_STOP_TIMEOUT_KEY = "indexNode.gracefulStopTimeout";

  private final long nodeId;
  private final int buildParallel;
  private final int maxQueueLength;
  private final Duration gracefulStopTimeout;
  private final InstantSource instantSource;

  private IndexNodeConfig(Builder b) {
    if (b.nodeId <= 0) throw new IllegalArgumentException("nodeId must be positive");
    this.nodeId = b.nodeId;
    if (b.buildParallel <= 0) throw new IllegalArgumentException("buildParallel must be positive");
    this.buildParallel = b.buildParallel;
    if (b.maxQueueLength <= 0) throw new IllegalArgumentException("maxQueueLength must be positive");
    this.maxQueueLength = b.maxQueueLength;
    if (b.gracefulStopTimeout == null || b.gracefulStopTimeout.isNegative()) {
      throw new IllegalArgumentException("gracefulStopTimeout must not be negative");
    }
    this.gracefulStopTimeout = b.gracefulStopTimeout;
    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
  }

  /** Returns the worker id, unique in the cluster. */
  public long getNodeId() {
    return nodeId;
  }

  /** Returns the number of builds that run concurrently. */
  public int getBuildParallel() {
    return buildParallel;
  }

  /** Returns how many accepted jobs may wait for a build slot. */
  public int getMaxQueueLength() {
    return maxQueueLength;
  }

  /** Returns how long {@code stop()} waits for queued and running builds. */
  public Duration getGracefulStopTimeout() {
    return gracefulStopTimeout;
  }

  public InstantSource getInstantSource() {
    return instantSource;
  }

  public static Builder builder(long nodeId) {
    return new Builder(nodeId);
  }

  /** Reads {@code indexNode.*} keys, falling back to the builder defaults. */
  public static IndexNodeConfig fromConfig(ConfigManager config, long nodeId) {
    Builder defaults = new Builder(nodeId);
    return builder(nodeId)
        .buildParallel(config.getInt(BUILD_PARALLEL_KEY, defaults.buildParallel))
        .maxQueueLength(config.getInt(MAX_QUEUE_LENGTH_KEY, defaults.maxQueueLength))
        .gracefulStopTimeout(
            config.getDuration(GRACEFUL_STOP_TIMEOUT_KEY, Duration.ofSeconds(1), defaults.gracefulStopTimeout))
        .build();
  }

  /** Builder for {@link IndexNodeConfig}. */
  public static final class Builder {
    private final long nodeId;
    private int buildParallel = 1;
    private int maxQueueLength = 1024;
    private Duration gracefulStopTimeout = Duration.ofSeconds(30);
    private InstantSource instantSource = InstantSource.system();

    private Builder(long nodeId) {
      this.nodeId = nodeId;
    }

    public Builder buildParallel(int buildParallel) {
      this.buildParallel = buildParallel;
      return this;
    }

    public Builder maxQueueLength(int maxQueueLength) {
      this.maxQueueLength = maxQueueLength;
      return this;
    }

    public Builder gracefulStopTimeout(Duration gracefulStopTimeout) {
      this.gracefulStopTimeout = gracefulStopTimeout;
      return this;
    }

    /** Sets the time source (injectable for tests). */
    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    public IndexNodeConfig build() {
      return new IndexNodeConfig(this);
    }
  }
}
