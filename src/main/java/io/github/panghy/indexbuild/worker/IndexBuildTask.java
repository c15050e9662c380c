package io.github.panghy.indexbuild.worker;

import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.util.BuildMetrics;
import java.time.InstantSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One queued build: runs the {@link IndexBuilder} and records the outcome on its {@link TaskInfo}.
 */
final class IndexBuildTask implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(IndexBuildTask.class);

  private final TaskInfo info;
  private final IndexBuilder builder;
  private final ObjectStore objectStore;
  private final InstantSource clock;
  private final BuildMetrics metrics;
  private final long nodeId;

  IndexBuildTask(
      TaskInfo info,
      IndexBuilder builder,
      ObjectStore objectStore,
      InstantSource clock,
      BuildMetrics metrics,
      long nodeId) {
    this.info = info;
    this.builder = builder;
    this.objectStore = objectStore;
    this.clock = clock;
    this.metrics = metrics;
    this.nodeId = nodeId;
  }

  TaskInfo info() {
    return info;
  }

  @Override
  public void run() {
    if (info.isCancelled()) {
      LOG.debug("skipping dropped build buildID={}", info.buildId());
      return;
    }
    long start = clock.millis();
    info.markStarted(start);
    LOG.info("index build started clusterID={} buildID={}", info.clusterId(), info.buildId());
    try {
      BuildResult result =
          builder.build(new BuildContext(info.request(), objectStore, info::isCancelled));
      info.finish(result, clock.millis());
      LOG.info(
          "index build finished buildID={} files={} size={}",
          info.buildId(),
          result.fileKeys().size(),
          result.serializedSize());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      info.fail("index build interrupted", clock.millis());
      LOG.warn("index build interrupted buildID={}", info.buildId());
    } catch (Exception e) {
      info.fail(e.getMessage() == null ? e.getClass().getName() : e.getMessage(), clock.millis());
      LOG.warn("index build failed buildID={}", info.buildId(), e);
    } finally {
      metrics.buildDuration(nodeId, clock.millis() - start);
    }
  }
}
