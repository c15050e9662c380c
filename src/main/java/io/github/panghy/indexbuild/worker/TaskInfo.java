package io.github.panghy.indexbuild.worker;

import io.github.panghy.indexbuild.proto.CreateJobRequest;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.IndexTaskInfo;
import io.github.panghy.indexbuild.proto.JobInfo;
import java.util.List;

/**
 * Worker-local state of one accepted job, keyed by cluster and build id.
 *
 * <p>Not persisted: a restarted worker forgets its tasks and the coordinator re-issues them. The
 * state moves {@code IN_PROGRESS -> FINISHED | FAILED}; once cancelled a task never reports a
 * result.</p>
 */
public final class TaskInfo {
  private final String clusterId;
  private final long buildId;
  private final CreateJobRequest request;

  private IndexState state = IndexState.IN_PROGRESS;
  private List<String> fileKeys = List.of();
  private long serializedSize;
  private String failReason = "";
  private boolean cancelled;
  private long startTime;
  private long endTime;

  TaskInfo(CreateJobRequest request) {
    this.clusterId = request.getClusterId();
    this.buildId = request.getBuildId();
    this.request = request;
  }

  public String clusterId() {
    return clusterId;
  }

  public long buildId() {
    return buildId;
  }

  CreateJobRequest request() {
    return request;
  }

  public synchronized IndexState state() {
    return state;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  synchronized void cancel() {
    cancelled = true;
  }

  synchronized void markStarted(long nowMillis) {
    startTime = nowMillis;
  }

  synchronized void finish(BuildResult result, long nowMillis) {
    if (cancelled || state != IndexState.IN_PROGRESS) return;
    state = IndexState.FINISHED;
    fileKeys = result.fileKeys();
    serializedSize = result.serializedSize();
    endTime = nowMillis;
  }

  synchronized void fail(String reason, long nowMillis) {
    if (cancelled || state != IndexState.IN_PROGRESS) return;
    state = IndexState.FAILED;
    failReason = reason == null ? "" : reason;
    endTime = nowMillis;
  }

  /** Snapshot reported by {@code QueryJobs}. */
  synchronized IndexTaskInfo toTaskInfo() {
    return IndexTaskInfo.newBuilder()
        .setBuildId(buildId)
        .setState(state)
        .addAllIndexFileKeys(fileKeys)
        .setSerializedSize_(serializedSize)
        .setFailReason(failReason)
        .build();
  }

  /** Statistics reported by {@code GetJobStats}; {@code null} until the build started. */
  synchronized JobInfo toJobInfo(long nodeId) {
    if (startTime == 0) return null;
    long dim = 0;
    for (var kv : request.getTypeParamsList()) {
      if ("dim".equals(kv.getKey())) {
        try {
          dim = Long.parseLong(kv.getValue());
        } catch (NumberFormatException e) {
          dim = 0;
        }
      }
    }
    return JobInfo.newBuilder()
        .setBuildId(buildId)
        .setNumRows(request.getNumRows())
        .setDim(dim)
        .setStartTime(startTime)
        .setEndTime(endTime)
        .addAllIndexParams(request.getIndexParamsList())
        .setNodeId(nodeId)
        .build();
  }
}
