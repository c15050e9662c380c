package io.github.panghy.indexbuild.worker;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.indexbuild.Statuses;
import io.github.panghy.indexbuild.broker.IndexFilePaths;
import io.github.panghy.indexbuild.broker.LocalObjectStore;
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
import io.github.panghy.indexbuild.proto.KeyValuePair;
import io.github.panghy.indexbuild.proto.QueryJobsRequest;
import io.github.panghy.indexbuild.proto.QueryJobsResponse;
import io.github.panghy.indexbuild.proto.StateCode;
import io.github.panghy.indexbuild.proto.Status;
import io.github.panghy.indexbuild.testutil.Await;
import io.github.panghy.indexbuild.util.SystemInfoMetrics;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link IndexNode}: admission, duplicate detection, queue limits, queries, drops and
 * shutdown.
 */
class IndexNodeTest {
  static final String CLUSTER = "by-dev";

  @TempDir
  Path dir;

  LocalObjectStore store;
  CountDownLatch release;
  AtomicInteger started;
  IndexNode node;

  @BeforeEach
  void setup() {
    store = new LocalObjectStore(dir, "files");
    release = new CountDownLatch(1);
    started = new AtomicInteger();
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    if (node != null) node.stop();
  }

  /** Builder that writes one file once released. */
  IndexBuilder blockingBuilder() {
    return ctx -> {
      started.incrementAndGet();
      release.await();
      ctx.writeFile("IVF", "ivf".getBytes(UTF_8)).get(5, TimeUnit.SECONDS);
      return new BuildResult(List.of("IVF"), 3);
    };
  }

  IndexNode startNode(IndexBuilder builder, int parallel, int queue) {
    node = new IndexNode(
        IndexNodeConfig.builder(7)
            .buildParallel(parallel)
            .maxQueueLength(queue)
            .gracefulStopTimeout(Duration.ofMillis(200))
            .build(),
        builder,
        store);
    node.start();
    return node;
  }

  static CreateJobRequest job(long buildId) {
    return CreateJobRequest.newBuilder()
        .setClusterId(CLUSTER)
        .setBuildId(buildId)
        .setIndexVersion(1)
        .setIndexFilePrefix("files/index_files")
        .setCollectionId(1)
        .setPartitionId(2)
        .setSegmentId(3)
        .setNumRows(10000)
        .addTypeParams(KeyValuePair.newBuilder().setKey("dim").setValue("128"))
        .addIndexParams(KeyValuePair.newBuilder().setKey("index_type").setValue("IVF_FLAT"))
        .build();
  }

  IndexTaskInfo query(long buildId) throws Exception {
    QueryJobsResponse resp = node.queryJobs(
            QueryJobsRequest.newBuilder().setClusterId(CLUSTER).addBuildIds(buildId).build())
        .get(5, TimeUnit.SECONDS);
    assertThat(Statuses.isSuccess(resp.getStatus())).isTrue();
    assertThat(resp.getClusterId()).isEqualTo(CLUSTER);
    return resp.getIndexInfos(0);
  }

  @Test
  void build_finishes_and_writes_files() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    release.countDown();

    Status status = node.createJob(job(10)).get(5, TimeUnit.SECONDS);
    assertThat(Statuses.isSuccess(status)).isTrue();

    Await.until(() -> node.queryJobs(QueryJobsRequest.newBuilder()
            .setClusterId(CLUSTER).addBuildIds(10).build()).join()
        .getIndexInfos(0).getState() == IndexState.FINISHED, Duration.ofSeconds(5));
    IndexTaskInfo info = query(10);
    assertThat(info.getIndexFileKeysList()).containsExactly("IVF");
    assertThat(info.getSerializedSize_()).isEqualTo(3);
    byte[] data = store.read(IndexFilePaths.filePath("files", 10, 1, 2, 3, "IVF")).get(5, TimeUnit.SECONDS);
    assertThat(new String(data, UTF_8)).isEqualTo("ivf");
  }

  @Test
  void duplicate_job_is_rejected_while_first_keeps_running() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    assertThat(Statuses.isSuccess(node.createJob(job(10)).get(5, TimeUnit.SECONDS))).isTrue();
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));

    Status second = node.createJob(job(10)).get(5, TimeUnit.SECONDS);

    assertThat(second.getErrorCode()).isEqualTo(ErrorCode.BUILD_INDEX_ERROR);
    assertThat(second.getReason()).isEqualTo("duplicated index build task");
    assertThat(Statuses.isDuplicatedTask(second)).isTrue();
    assertThat(query(10).getState()).isEqualTo(IndexState.IN_PROGRESS);

    release.countDown();
    Await.until(() -> node.scheduler().active() == 0, Duration.ofSeconds(5));
    assertThat(query(10).getState()).isEqualTo(IndexState.FINISHED);
    assertThat(started.get()).isEqualTo(1);
  }

  @Test
  void same_build_id_in_another_cluster_is_a_different_job() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    node.createJob(job(10)).get(5, TimeUnit.SECONDS);

    Status other = node.createJob(job(10).toBuilder().setClusterId("other").build()).get(5, TimeUnit.SECONDS);

    assertThat(Statuses.isSuccess(other)).isTrue();
  }

  @Test
  void full_queue_rejects_jobs() throws Exception {
    startNode(blockingBuilder(), 1, 1);
    node.createJob(job(1)).get(5, TimeUnit.SECONDS);
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));
    assertThat(Statuses.isSuccess(node.createJob(job(2)).get(5, TimeUnit.SECONDS))).isTrue();

    Status rejected = node.createJob(job(3)).get(5, TimeUnit.SECONDS);

    assertThat(rejected.getErrorCode()).isEqualTo(ErrorCode.QUEUE_FULL);
    assertThat(query(3).getState()).isEqualTo(IndexState.INDEX_STATE_NONE);
  }

  @Test
  void stats_report_queue_and_slots() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    node.createJob(job(1)).get(5, TimeUnit.SECONDS);
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));
    node.createJob(job(2)).get(5, TimeUnit.SECONDS);

    GetJobStatsResponse stats = node.getJobStats(GetJobStatsRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS);

    assertThat(stats.getTotalJobNum()).isEqualTo(2);
    assertThat(stats.getInProgressJobNum()).isEqualTo(1);
    assertThat(stats.getEnqueueJobNum()).isEqualTo(1);
    assertThat(stats.getTaskSlots()).isZero();
    assertThat(stats.getJobInfosList()).singleElement().satisfies(j -> {
      assertThat(j.getBuildId()).isEqualTo(1);
      assertThat(j.getDim()).isEqualTo(128);
      assertThat(j.getNodeId()).isEqualTo(7);
    });
  }

  @Test
  void idle_node_reports_free_slots() throws Exception {
    startNode(blockingBuilder(), 3, 4);

    GetJobStatsResponse stats = node.getJobStats(GetJobStatsRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS);

    assertThat(stats.getTaskSlots()).isEqualTo(3);
    assertThat(stats.getTotalJobNum()).isZero();
  }

  @Test
  void unknown_build_reports_none() throws Exception {
    startNode(blockingBuilder(), 1, 4);

    assertThat(query(99).getState()).isEqualTo(IndexState.INDEX_STATE_NONE);
  }

  @Test
  void dropped_job_is_forgotten() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    node.createJob(job(10)).get(5, TimeUnit.SECONDS);
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));

    Status status = node.dropJobs(DropJobsRequest.newBuilder().setClusterId(CLUSTER).addBuildIds(10).addBuildIds(11).build())
        .get(5, TimeUnit.SECONDS);
    release.countDown();

    assertThat(Statuses.isSuccess(status)).isTrue();
    assertThat(query(10).getState()).isEqualTo(IndexState.INDEX_STATE_NONE);
    // the build id can be submitted again once dropped
    assertThat(Statuses.isSuccess(node.createJob(job(10)).get(5, TimeUnit.SECONDS))).isTrue();
  }

  @Test
  void dropping_queued_jobs_frees_their_slots() throws Exception {
    startNode(blockingBuilder(), 1, 2);
    node.createJob(job(1)).get(5, TimeUnit.SECONDS);
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));
    node.createJob(job(2)).get(5, TimeUnit.SECONDS);
    node.createJob(job(3)).get(5, TimeUnit.SECONDS);
    assertThat(node.createJob(job(4)).get(5, TimeUnit.SECONDS).getErrorCode()).isEqualTo(ErrorCode.QUEUE_FULL);

    node.dropJobs(DropJobsRequest.newBuilder().setClusterId(CLUSTER).addBuildIds(2).addBuildIds(3).build())
        .get(5, TimeUnit.SECONDS);

    GetJobStatsResponse stats = node.getJobStats(GetJobStatsRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS);
    assertThat(stats.getEnqueueJobNum()).isZero();
    assertThat(stats.getInProgressJobNum()).isEqualTo(1);
    assertThat(stats.getTotalJobNum()).isEqualTo(1);
    assertThat(Statuses.isSuccess(node.createJob(job(4)).get(5, TimeUnit.SECONDS))).isTrue();
    assertThat(node.scheduler().queued()).isEqualTo(1);
  }

  @Test
  void builder_failure_is_reported() throws Exception {
    startNode(ctx -> {
      throw new IllegalStateException("out of memory");
    }, 1, 4);

    node.createJob(job(10)).get(5, TimeUnit.SECONDS);
    Await.until(() -> node.queryJobs(QueryJobsRequest.newBuilder()
            .setClusterId(CLUSTER).addBuildIds(10).build()).join()
        .getIndexInfos(0).getState() == IndexState.FAILED, Duration.ofSeconds(5));

    assertThat(query(10).getFailReason()).isEqualTo("out of memory");
    assertThat(query(10).getIndexFileKeysList()).isEmpty();
  }

  @Test
  void not_ready_before_start_and_after_stop() throws Exception {
    node = new IndexNode(IndexNodeConfig.builder(7).build(), blockingBuilder(), store);

    assertThat(node.stateCode()).isEqualTo(StateCode.INITIALIZING);
    assertThat(node.createJob(job(1)).get(5, TimeUnit.SECONDS).getErrorCode())
        .isEqualTo(ErrorCode.NOT_READY_SERVE);
    assertThat(node.queryJobs(QueryJobsRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS)
            .getStatus().getErrorCode())
        .isEqualTo(ErrorCode.NOT_READY_SERVE);

    node.start();
    assertThat(node.stateCode()).isEqualTo(StateCode.HEALTHY);
    node.stop();

    assertThat(node.stateCode()).isEqualTo(StateCode.ABNORMAL);
    assertThat(node.createJob(job(1)).get(5, TimeUnit.SECONDS).getErrorCode())
        .isEqualTo(ErrorCode.NOT_READY_SERVE);
    assertThat(node.getJobStats(GetJobStatsRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS)
            .getStatus().getErrorCode())
        .isEqualTo(ErrorCode.NOT_READY_SERVE);
  }

  @Test
  void system_info_metrics_describe_the_node() throws Exception {
    startNode(blockingBuilder(), 2, 5);

    GetMetricsResponse resp = node.getMetrics(
            GetMetricsRequest.newBuilder().setMetricType(SystemInfoMetrics.SYSTEM_INFO).build())
        .get(5, TimeUnit.SECONDS);

    assertThat(Statuses.isSuccess(resp.getStatus())).isTrue();
    assertThat(resp.getComponentName()).isEqualTo("indexnode-7");
    ComponentInfos self = resp.getSelf();
    assertThat(self.getName()).isEqualTo("indexnode-7");
    assertThat(self.getId()).isEqualTo(7);
    assertThat(self.getType()).isEqualTo("indexnode");
    assertThat(self.getHasError()).isFalse();
    assertThat(self.getHardware().getCpuCoreCount()).isPositive();
    assertThat(self.getHardware().getMemory()).isPositive();
    assertThat(self.getCreatedTime()).isPositive().isLessThanOrEqualTo(self.getUpdatedTime());
    assertThat(self.getSystemConfigurationsList())
        .contains(
            KeyValuePair.newBuilder().setKey("buildParallel").setValue("2").build(),
            KeyValuePair.newBuilder().setKey("maxQueueLength").setValue("5").build());
  }

  @Test
  void other_metric_types_are_not_served() throws Exception {
    startNode(blockingBuilder(), 1, 1);

    GetMetricsResponse resp = node.getMetrics(
            GetMetricsRequest.newBuilder().setMetricType("system_load").build())
        .get(5, TimeUnit.SECONDS);

    assertThat(resp.getStatus().getErrorCode()).isEqualTo(ErrorCode.UNEXPECTED_ERROR);
    assertThat(resp.getStatus().getReason()).isEqualTo(SystemInfoMetrics.UNIMPLEMENTED_METRIC);
    assertThat(resp.hasSelf()).isFalse();
  }

  @Test
  void metrics_are_not_served_before_start() throws Exception {
    node = new IndexNode(IndexNodeConfig.builder(7).build(), blockingBuilder(), store);

    GetMetricsResponse resp = node.getMetrics(
            GetMetricsRequest.newBuilder().setMetricType(SystemInfoMetrics.SYSTEM_INFO).build())
        .get(5, TimeUnit.SECONDS);

    assertThat(resp.getStatus().getErrorCode()).isEqualTo(ErrorCode.NOT_READY_SERVE);
  }

  @Test
  void stop_gives_up_on_stuck_builds_after_timeout() throws Exception {
    startNode(blockingBuilder(), 1, 4);
    node.createJob(job(10)).get(5, TimeUnit.SECONDS);
    Await.until(() -> started.get() == 1, Duration.ofSeconds(5));

    long start = System.nanoTime();
    node.stop();

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    assertThat(node.stateCode()).isEqualTo(StateCode.ABNORMAL);
  }
}
