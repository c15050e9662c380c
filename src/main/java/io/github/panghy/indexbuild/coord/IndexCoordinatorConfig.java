package io.github.panghy.indexbuild.coord;

import io.github.panghy.indexbuild.config.ConfigManager;
import io.github.panghy.indexbuild.dispatch.BuildRetryPolicy;
import java.time.Duration;
import java.time.InstantSource;
import java.util.Objects;

/**
 * Configuration of the index coordinator, its dispatcher, collector and node registry.
 *
 * <p>Built with a validating builder and exposed through getters only. {@link #fromConfig} reads
 * the {@code indexCoord.*} keys of a {@link ConfigManager}; durations given as plain numbers are
 * interpreted in seconds except for the scheduler and poll intervals, which are milliseconds.</p>
 */
public final class IndexCoordinatorConfig {

  public static final String CLUSTER_ID_KEY = "common.clusterId";
  public static final String SERVER_ID_KEY = "indexCoord.serverId";
  public static final String ASSIGN_INTERVAL_KEY = "indexCoord.scheduler.interval";
  public static final String POLL_INTERVAL_KEY = "indexCoord.scheduler.pollInterval";
  public static final String MIN_SEGMENT_ROWS_KEY = "indexCoord.minSegmentNumRowsToEnableIndex";
  public static final String GC_INTERVAL_KEY = "indexCoord.gc.interval";
  public static final String GC_META_INTERVAL_KEY = "indexCoord.gc.metaInterval";
  public static final String MAX_BUILD_ATTEMPTS_KEY = "indexCoord.build.maxAttempts";
  public static final String BUILD_RETRY_BACKOFF_KEY = "indexCoord.build.retryBackoff";
  public static final String NODE_LEASE_TTL_KEY = "indexCoord.node.leaseTtl";
  public static final String NODE_HEALTH_CHECK_INTERVAL_KEY = "indexCoord.node.healthCheckInterval";
  public static final String NODE_HEALTH_FAILURE_WINDOW_KEY = "indexCoord.node.healthFailureWindow";
  public static final String SEGMENT_CACHE_TTL_KEY = "indexCoord.segmentCache.ttl";

  private final String clusterId;
  private final long serverId;
  private final Duration assignInterval;
  private final Duration pollInterval;
  private final long minSegmentRowsToEnableIndex;
  private final Duration gcInterval;
  private final Duration gcMetaInterval;
  private final BuildRetryPolicy retryPolicy;
  private final Duration nodeLeaseTtl;
  private final Duration nodeHealthCheckInterval;
  private final Duration nodeHealthFailureWindow;
  private final Duration segmentCacheTtl;
  private final InstantSource instantSource;

  private IndexCoordinatorConfig(Builder b) {
    if (b.clusterId == null || b.clusterId.isBlank()) {
      throw new IllegalArgumentException("clusterId must not be blank");
    }
    this.clusterId = b.clusterId;
    if (b.serverId <= 0) throw new IllegalArgumentException("serverId must be positive");
    this.serverId = b.serverId;
    this.assignInterval = requirePositive(b.assignInterval, "assignInterval");
    this.pollInterval = requirePositive(b.pollInterval, "pollInterval");
    if (b.minSegmentRowsToEnableIndex < 0) {
      throw new IllegalArgumentException("minSegmentRowsToEnableIndex must be >= 0");
    }
    this.minSegmentRowsToEnableIndex = b.minSegmentRowsToEnableIndex;
    this.gcInterval = requirePositive(b.gcInterval, "gcInterval");
    this.gcMetaInterval = requirePositive(b.gcMetaInterval, "gcMetaInterval");
    this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy must not be null");
    this.nodeLeaseTtl = requirePositive(b.nodeLeaseTtl, "nodeLeaseTtl");
    this.nodeHealthCheckInterval = requirePositive(b.nodeHealthCheckInterval, "nodeHealthCheckInterval");
    if (b.nodeHealthFailureWindow == null || b.nodeHealthFailureWindow.isNegative()) {
      throw new IllegalArgumentException("nodeHealthFailureWindow must not be negative");
    }
    this.nodeHealthFailureWindow = b.nodeHealthFailureWindow;
    this.segmentCacheTtl = requirePositive(b.segmentCacheTtl, "segmentCacheTtl");
    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
  }

  private static Duration requirePositive(Duration d, String name) {
    if (d == null) throw new IllegalArgumentException(name + " must not be null");
    if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    return d;
  }

  /** Returns the cluster id stamped on every job sent to workers. */
  public String getClusterId() {
    return clusterId;
  }

  /** Returns the id this coordinator reports itself under, e.g. in system info metrics. */
  public long getServerId() {
    return serverId;
  }

  /** Returns the delay between dispatcher assign passes. */
  public Duration getAssignInterval() {
    return assignInterval;
  }

  /** Returns the delay between dispatcher poll passes. */
  public Duration getPollInterval() {
    return pollInterval;
  }

  /** Returns the row count below which a segment is marked indexed without building. */
  public long getMinSegmentRowsToEnableIndex() {
    return minSegmentRowsToEnableIndex;
  }

  /** Returns the delay between index file reconciliation passes. */
  public Duration getGcInterval() {
    return gcInterval;
  }

  /** Returns the delay between metadata reconciliation passes. */
  public Duration getGcMetaInterval() {
    return gcMetaInterval;
  }

  public BuildRetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  /** Returns how long a worker may go without heartbeat before it is removed. */
  public Duration getNodeLeaseTtl() {
    return nodeLeaseTtl;
  }

  public Duration getNodeHealthCheckInterval() {
    return nodeHealthCheckInterval;
  }

  /** Returns how long a worker may fail health checks before it is treated as gone. */
  public Duration getNodeHealthFailureWindow() {
    return nodeHealthFailureWindow;
  }

  /** Returns how long segment info fetched from the segment authority is reused. */
  public Duration getSegmentCacheTtl() {
    return segmentCacheTtl;
  }

  /** Returns the time source (injectable for tests). */
  public InstantSource getInstantSource() {
    return instantSource;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads {@code indexCoord.*} keys, falling back to the builder defaults. */
  public static IndexCoordinatorConfig fromConfig(ConfigManager config) {
    Builder d = new Builder();
    Duration ms = Duration.ofMillis(1);
    Duration s = Duration.ofSeconds(1);
    return builder()
        .clusterId(config.getString(CLUSTER_ID_KEY, d.clusterId))
        .serverId(config.getLong(SERVER_ID_KEY, d.serverId))
        .assignInterval(config.getDuration(ASSIGN_INTERVAL_KEY, ms, d.assignInterval))
        .pollInterval(config.getDuration(POLL_INTERVAL_KEY, ms, d.pollInterval))
        .minSegmentRowsToEnableIndex(config.getLong(MIN_SEGMENT_ROWS_KEY, d.minSegmentRowsToEnableIndex))
        .gcInterval(config.getDuration(GC_INTERVAL_KEY, s, d.gcInterval))
        .gcMetaInterval(config.getDuration(GC_META_INTERVAL_KEY, s, d.gcMetaInterval))
        .retryPolicy(new BuildRetryPolicy(
            config.getInt(MAX_BUILD_ATTEMPTS_KEY, d.retryPolicy.maxAttempts()),
            config.getDuration(BUILD_RETRY_BACKOFF_KEY, s, d.retryPolicy.backoff())))
        .nodeLeaseTtl(config.getDuration(NODE_LEASE_TTL_KEY, s, d.nodeLeaseTtl))
        .nodeHealthCheckInterval(config.getDuration(NODE_HEALTH_CHECK_INTERVAL_KEY, s, d.nodeHealthCheckInterval))
        .nodeHealthFailureWindow(config.getDuration(NODE_HEALTH_FAILURE_WINDOW_KEY, s, d.nodeHealthFailureWindow))
        .segmentCacheTtl(config.getDuration(SEGMENT_CACHE_TTL_KEY, s, d.segmentCacheTtl))
        .build();
  }

  /** Builder for {@link IndexCoordinatorConfig}. */
  public static final class Builder {
    private String clusterId = "by-dev";
    private long serverId = 1;
    private Duration assignInterval = Duration.ofSeconds(1);
    private Duration pollInterval = Duration.ofSeconds(1);
    private long minSegmentRowsToEnableIndex = 1024;
    private Duration gcInterval = Duration.ofMinutes(10);
    private Duration gcMetaInterval = Duration.ofMinutes(1);
    private BuildRetryPolicy retryPolicy = BuildRetryPolicy.defaults();
    private Duration nodeLeaseTtl = Duration.ofSeconds(30);
    private Duration nodeHealthCheckInterval = Duration.ofSeconds(10);
    private Duration nodeHealthFailureWindow = Duration.ofSeconds(30);
    private Duration segmentCacheTtl = Duration.ofSeconds(30);
    private InstantSource instantSource = InstantSource.system();

    private Builder() {}

    public Builder clusterId(String clusterId) {
      this.clusterId = clusterId;
      return this;
    }

    public Builder serverId(long serverId) {
      this.serverId = serverId;
      return this;
    }

    public Builder assignInterval(Duration assignInterval) {
      this.assignInterval = assignInterval;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** Sets the row count below which segments are not indexed. */
    public Builder minSegmentRowsToEnableIndex(long rows) {
      this.minSegmentRowsToEnableIndex = rows;
      return this;
    }

    public Builder gcInterval(Duration gcInterval) {
      this.gcInterval = gcInterval;
      return this;
    }

    public Builder gcMetaInterval(Duration gcMetaInterval) {
      this.gcMetaInterval = gcMetaInterval;
      return this;
    }

    public Builder retryPolicy(BuildRetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder nodeLeaseTtl(Duration nodeLeaseTtl) {
      this.nodeLeaseTtl = nodeLeaseTtl;
      return this;
    }

    public Builder nodeHealthCheckInterval(Duration interval) {
      this.nodeHealthCheckInterval = interval;
      return this;
    }

    public Builder nodeHealthFailureWindow(Duration window) {
      this.nodeHealthFailureWindow = window;
      return this;
    }

    public Builder segmentCacheTtl(Duration ttl) {
      this.segmentCacheTtl = ttl;
      return this;
    }

    /** Sets the time source used to obtain the current time. */
    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    public IndexCoordinatorConfig build() {
      return new IndexCoordinatorConfig(this);
    }
  }
}
