package io.github.panghy.indexbuild.util;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for index build coordination, workers and garbage collection.
 *
 * <p>Instruments are bound when the instance is created, so components pick up whatever
 * {@link OpenTelemetry} is installed globally at construction time.</p>
 */
public final class BuildMetrics {
  private static final String INSTRUMENTATION_NAME = "io.github.panghy.indexbuild";

  public static final AttributeKey<Long> NODE_ID = AttributeKey.longKey("nodeId");
  public static final AttributeKey<String> KIND = AttributeKey.stringKey("kind");

  private final LongCounter jobsDispatched;
  private final LongCounter jobsFinished;
  private final LongCounter jobsFailed;
  private final LongCounter jobsRebuilt;
  private final LongCounter jobsReleased;
  private final LongCounter gcRemoved;
  private final DoubleHistogram buildDurationMs;

  public BuildMetrics() {
    this(GlobalOpenTelemetry.get());
  }

  public BuildMetrics(OpenTelemetry otel) {
    Meter meter = otel.getMeter(INSTRUMENTATION_NAME);
    this.jobsDispatched = meter.counterBuilder("indexbuild.jobs.dispatched").build();
    this.jobsFinished = meter.counterBuilder("indexbuild.jobs.finished").build();
    this.jobsFailed = meter.counterBuilder("indexbuild.jobs.failed").build();
    this.jobsRebuilt = meter.counterBuilder("indexbuild.jobs.rebuilt").build();
    this.jobsReleased = meter.counterBuilder("indexbuild.jobs.released").build();
    this.gcRemoved = meter.counterBuilder("indexbuild.gc.removed").build();
    this.buildDurationMs = meter.histogramBuilder("indexbuild.build.duration_ms")
        .setUnit("ms")
        .build();
  }

  public void jobDispatched(long nodeId) {
    jobsDispatched.add(1, Attributes.of(NODE_ID, nodeId));
  }

  public void jobFinished(long nodeId) {
    jobsFinished.add(1, Attributes.of(NODE_ID, nodeId));
  }

  public void jobFailed(long nodeId) {
    jobsFailed.add(1, Attributes.of(NODE_ID, nodeId));
  }

  public void jobRebuilt() {
    jobsRebuilt.add(1);
  }

  public void jobReleased(long nodeId) {
    jobsReleased.add(1, Attributes.of(NODE_ID, nodeId));
  }

  /**
   * Counts physical removals by the collector; {@code kind} is {@code index}, {@code segment-index},
   * {@code file} or {@code build-files} (a whole build directory).
   */
  public void gcRemoved(String kind, long count) {
    if (count > 0) gcRemoved.add(count, Attributes.of(KIND, kind));
  }

  public void buildDuration(long nodeId, long millis) {
    buildDurationMs.record((double) millis, Attributes.of(NODE_ID, nodeId));
  }
}
