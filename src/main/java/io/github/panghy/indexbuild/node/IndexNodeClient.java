package io.github.panghy.indexbuild.node;

import io.github.panghy.indexbuild.proto.CreateJobRequest;
import io.github.panghy.indexbuild.proto.DropJobsRequest;
import io.github.panghy.indexbuild.proto.GetJobStatsRequest;
import io.github.panghy.indexbuild.proto.GetJobStatsResponse;
import io.github.panghy.indexbuild.proto.GetMetricsRequest;
import io.github.panghy.indexbuild.proto.GetMetricsResponse;
import io.github.panghy.indexbuild.proto.QueryJobsRequest;
import io.github.panghy.indexbuild.proto.QueryJobsResponse;
import io.github.panghy.indexbuild.proto.Status;
import java.util.concurrent.CompletableFuture;

/**
 * Operations a coordinator invokes on an index-build worker.
 *
 * <p>Failures are reported through the returned {@link Status}; a future completing exceptionally
 * means the worker could not be reached.</p>
 */
public interface IndexNodeClient {

  /** Submits a build; completes as soon as the job is queued. */
  CompletableFuture<Status> createJob(CreateJobRequest request);

  /** Point-in-time state of the requested builds. Unknown builds report {@code INDEX_STATE_NONE}. */
  CompletableFuture<QueryJobsResponse> queryJobs(QueryJobsRequest request);

  /** Cancels and forgets the requested builds, whatever their state. */
  CompletableFuture<Status> dropJobs(DropJobsRequest request);

  /** Queue, activity and free-slot counters. */
  CompletableFuture<GetJobStatsResponse> getJobStats(GetJobStatsRequest request);

  /** Component information of the worker; only the {@code system_info} metric type is served. */
  CompletableFuture<GetMetricsResponse> getMetrics(GetMetricsRequest request);
}
