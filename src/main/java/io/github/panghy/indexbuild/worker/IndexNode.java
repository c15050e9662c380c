package io.github.panghy.indexbuild.worker;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.Statuses;
import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.node.IndexNodeClient;
import io.github.panghy.indexbuild.proto.CreateJobRequest;
import io.github.panghy.indexbuild.proto.DropJobsRequest;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.GetJobStatsRequest;
import io.github.panghy.indexbuild.proto.ComponentInfos;
import io.github.panghy.indexbuild.proto.GetJobStatsResponse;
import io.github.panghy.indexbuild.proto.GetMetricsRequest;
import io.github.panghy.indexbuild.proto.GetMetricsResponse;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.IndexTaskInfo;
import io.github.panghy.indexbuild.proto.JobInfo;
import io.github.panghy.indexbuild.proto.QueryJobsRequest;
import io.github.panghy.indexbuild.proto.QueryJobsResponse;
import io.github.panghy.indexbuild.proto.StateCode;
import io.github.panghy.indexbuild.proto.Status;
import io.github.panghy.indexbuild.util.BuildMetrics;
import io.github.panghy.indexbuild.util.SystemInfoMetrics;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Index-build worker: accepts jobs from a coordinator, queues them on a {@link JobScheduler} and
 * reports their progress.
 *
 * <p>Jobs are tracked in memory by {@code (clusterID, buildID)}. {@link #createJob} only admits
 * jobs while {@link StateCode#HEALTHY}; queries, drops and statistics are also served while
 * {@link StateCode#STOPPING} so a coordinator can collect the results of a draining worker. Any
 * other state answers {@code NOT_READY_SERVE}.</p>
 */
public final class IndexNode implements IndexNodeClient, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(IndexNode.class);

  private final IndexNodeConfig config;
  private final IndexBuilder builder;
  private final ObjectStore objectStore;
  private final BuildMetrics metrics;
  private final JobScheduler scheduler;
  private final ConcurrentMap<TaskKey, TaskInfo> tasks = new ConcurrentHashMap<>();
  private final AtomicReference<StateCode> state = new AtomicReference<>(StateCode.INITIALIZING);
  private volatile long startedAt;

  public IndexNode(IndexNodeConfig config, IndexBuilder builder, ObjectStore objectStore) {
    this(config, builder, objectStore, new BuildMetrics());
  }

  public IndexNode(IndexNodeConfig config, IndexBuilder builder, ObjectStore objectStore, BuildMetrics metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.builder = Objects.requireNonNull(builder, "builder");
    this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.scheduler = new JobScheduler(config.getMaxQueueLength());
  }

  /** Starts the build threads and begins accepting jobs. */
  public synchronized void start() {
    if (state.get() != StateCode.INITIALIZING) return;
    scheduler.start(config.getBuildParallel());
    startedAt = config.getInstantSource().millis();
    state.set(StateCode.HEALTHY);
    LOG.info(
        "index node started nodeID={} buildParallel={} maxQueueLength={}",
        config.getNodeId(),
        config.getBuildParallel(),
        config.getMaxQueueLength());
  }

  /**
   * Stops accepting jobs, waits up to the graceful stop timeout for queued and running builds,
   * then shuts the build threads down and cancels whatever is left.
   */
  public synchronized void stop() {
    StateCode current = state.get();
    if (current == StateCode.ABNORMAL) return;
    state.set(StateCode.STOPPING);
    Duration timeout = config.getGracefulStopTimeout();
    LOG.info("index node stopping nodeID={} timeout={}", config.getNodeId(), timeout);
    try {
      if (!scheduler.awaitIdle(timeout)) {
        LOG.warn(
            "index node did not drain in {}, queued={} active={}", timeout, scheduler.queued(), scheduler.active());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("interrupted while draining index node nodeID={}", config.getNodeId());
    }
    scheduler.close();
    tasks.values().forEach(TaskInfo::cancel);
    state.set(StateCode.ABNORMAL);
    LOG.info("index node stopped nodeID={}", config.getNodeId());
  }

  @Override
  public void close() {
    stop();
  }

  public StateCode stateCode() {
    return state.get();
  }

  public long nodeId() {
    return config.getNodeId();
  }

  JobScheduler scheduler() {
    return scheduler;
  }

  @Override
  public CompletableFuture<Status> createJob(CreateJobRequest request) {
    if (state.get() != StateCode.HEALTHY) {
      LOG.warn("index node not ready to accept jobs nodeID={} state={}", config.getNodeId(), state.get());
      return completedFuture(Statuses.of(ErrorCode.NOT_READY_SERVE, "state code is not healthy: " + state.get()));
    }
    TaskKey key = new TaskKey(request.getClusterId(), request.getBuildId());
    TaskInfo info = new TaskInfo(request);
    if (tasks.putIfAbsent(key, info) != null) {
      LOG.warn("duplicated index build task clusterID={} buildID={}", key.clusterId(), key.buildId());
      return completedFuture(Statuses.of(ErrorCode.BUILD_INDEX_ERROR, Statuses.DUPLICATED_TASK));
    }
    IndexBuildTask task = new IndexBuildTask(
        info, builder, objectStore, config.getInstantSource(), metrics, config.getNodeId());
    if (!scheduler.offer(task)) {
      tasks.remove(key, info);
      LOG.warn("index build queue full, rejecting buildID={} queued={}", key.buildId(), scheduler.queued());
      return completedFuture(Statuses.of(ErrorCode.QUEUE_FULL, "index build queue is full"));
    }
    LOG.info(
        "index build job enqueued clusterID={} buildID={} segmentID={} indexID={}",
        key.clusterId(),
        key.buildId(),
        request.getSegmentId(),
        request.getIndexId());
    return completedFuture(Statuses.success());
  }

  @Override
  public CompletableFuture<QueryJobsResponse> queryJobs(QueryJobsRequest request) {
    if (!healthyOrStopping()) {
      return completedFuture(QueryJobsResponse.newBuilder()
          .setStatus(Statuses.of(ErrorCode.NOT_READY_SERVE, "state code is not healthy: " + state.get()))
          .build());
    }
    QueryJobsResponse.Builder resp = QueryJobsResponse.newBuilder()
        .setStatus(Statuses.success())
        .setClusterId(request.getClusterId());
    for (long buildId : request.getBuildIdsList()) {
      TaskInfo info = tasks.get(new TaskKey(request.getClusterId(), buildId));
      resp.addIndexInfos(
          info == null
              ? IndexTaskInfo.newBuilder()
                  .setBuildId(buildId)
                  .setState(IndexState.INDEX_STATE_NONE)
                  .build()
              : info.toTaskInfo());
    }
    return completedFuture(resp.build());
  }

  @Override
  public CompletableFuture<Status> dropJobs(DropJobsRequest request) {
    if (!healthyOrStopping()) {
      return completedFuture(Statuses.of(ErrorCode.NOT_READY_SERVE, "state code is not healthy: " + state.get()));
    }
    for (long buildId : request.getBuildIdsList()) {
      TaskInfo info = tasks.remove(new TaskKey(request.getClusterId(), buildId));
      if (info != null) {
        boolean dequeued = scheduler.remove(info);
        info.cancel();
        LOG.info(
            "index build job dropped clusterID={} buildID={} state={} dequeued={}",
            request.getClusterId(),
            buildId,
            info.state(),
            dequeued);
      }
    }
    return completedFuture(Statuses.success());
  }

  @Override
  public CompletableFuture<GetJobStatsResponse> getJobStats(GetJobStatsRequest request) {
    if (!healthyOrStopping()) {
      return completedFuture(GetJobStatsResponse.newBuilder()
          .setStatus(Statuses.of(ErrorCode.NOT_READY_SERVE, "state code is not healthy: " + state.get()))
          .build());
    }
    int unissued = scheduler.queued();
    int active = scheduler.active();
    int slots = Math.max(0, config.getBuildParallel() - unissued - active);
    GetJobStatsResponse.Builder resp = GetJobStatsResponse.newBuilder()
        .setStatus(Statuses.success())
        .setTotalJobNum(unissued + active)
        .setInProgressJobNum(active)
        .setEnqueueJobNum(unissued)
        .setTaskSlots(slots);
    for (TaskInfo info : tasks.values()) {
      JobInfo job = info.toJobInfo(config.getNodeId());
      if (job != null) resp.addJobInfos(job);
    }
    LOG.debug("index job stats unissued={} active={} slots={}", unissued, active, slots);
    return completedFuture(resp.build());
  }

  @Override
  public CompletableFuture<GetMetricsResponse> getMetrics(GetMetricsRequest request) {
    String name = SystemInfoMetrics.componentName(SystemInfoMetrics.INDEX_NODE_ROLE, config.getNodeId());
    if (!healthyOrStopping()) {
      return completedFuture(GetMetricsResponse.newBuilder()
          .setStatus(Statuses.of(ErrorCode.NOT_READY_SERVE, "state code is not healthy: " + state.get()))
          .setComponentName(name)
          .build());
    }
    try {
      SystemInfoMetrics.checkMetricType(request);
    } catch (IndexBuildException e) {
      LOG.warn(
          "index node metrics request rejected nodeID={} metricType={}", config.getNodeId(), request.getMetricType());
      return completedFuture(GetMetricsResponse.newBuilder()
          .setStatus(Statuses.fromThrowable(e))
          .setComponentName(name)
          .build());
    }
    ComponentInfos self = ComponentInfos.newBuilder()
        .setName(name)
        .setId(config.getNodeId())
        .setType(SystemInfoMetrics.INDEX_NODE_ROLE)
        .setHardware(SystemInfoMetrics.hardware())
        .setCreatedTime(startedAt)
        .setUpdatedTime(config.getInstantSource().millis())
        .addAllSystemConfigurations(SystemInfoMetrics.configurations(Map.of(
            "buildParallel", String.valueOf(config.getBuildParallel()),
            "maxQueueLength", String.valueOf(config.getMaxQueueLength()),
            "gracefulStopTimeout", config.getGracefulStopTimeout().toString())))
        .build();
    return completedFuture(GetMetricsResponse.newBuilder()
        .setStatus(Statuses.success())
        .setComponentName(name)
        .setSelf(self)
        .build());
  }

  private boolean healthyOrStopping() {
    StateCode s = state.get();
    return s == StateCode.HEALTHY || s == StateCode.STOPPING;
  }

  record TaskKey(String clusterId, long buildId) {}
}
