package io.github.panghy.indexbuild.dispatch;

import static io.github.panghy.indexbuild.util.AsyncLocks.withPermit;
import static java.util.concurrent.CompletableFuture.completedFuture;

import com.github.benmanes.caffeine.cache.AsyncCacheLoader;
import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ibm.asyncutil.locks.AsyncSemaphore;
import com.ibm.asyncutil.locks.FairAsyncSemaphore;
import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.Statuses;
import io.github.panghy.indexbuild.broker.IndexFilePaths;
import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.broker.SegmentBroker;
import io.github.panghy.indexbuild.coord.IndexCoordinatorConfig;
import io.github.panghy.indexbuild.meta.IdAllocator;
import io.github.panghy.indexbuild.meta.IndexStates;
import io.github.panghy.indexbuild.meta.MetaTable;
import io.github.panghy.indexbuild.node.IndexNodeClient;
import io.github.panghy.indexbuild.node.NodeInfo;
import io.github.panghy.indexbuild.node.NodeListener;
import io.github.panghy.indexbuild.node.NodeRegistry;
import io.github.panghy.indexbuild.proto.CreateJobRequest;
import io.github.panghy.indexbuild.proto.DropJobsRequest;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.IndexTaskInfo;
import io.github.panghy.indexbuild.proto.QueryJobsRequest;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;
import io.github.panghy.indexbuild.proto.SegmentInfo;
import io.github.panghy.indexbuild.proto.SegmentState;
import io.github.panghy.indexbuild.proto.StorageConfig;
import io.github.panghy.indexbuild.util.BuildMetrics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinator-side half of index building: hands {@code UNISSUED} segment indexes to workers and
 * reconciles what the workers report.
 *
 * <p>Two loops run on a private scheduler. The assign loop ({@link #assignOnce()}) sends
 * {@code CreateJob} to the worker picked by the {@link NodeRegistry} and records the owner once
 * the worker accepted the job. The poll loop ({@link #pollOnce()}) queries the owners of assigned
 * builds, writes their outcome back to the {@link MetaTable} and releases the rows. Builds lost
 * with their worker are re-issued under a fresh build id according to the
 * {@link BuildRetryPolicy}.</p>
 *
 * <p>Passes of the same loop never overlap. Every per-row failure is logged and left for the next
 * pass.</p>
 */
public final class IndexBuildDispatcher implements NodeListener, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(IndexBuildDispatcher.class);

  static final String MAX_ATTEMPTS_REASON = "index build lost too many times, attempts: ";

  private final IndexCoordinatorConfig config;
  private final MetaTable meta;
  private final NodeRegistry registry;
  private final ObjectStore objectStore;
  private final IdAllocator idAllocator;
  private final BuildMetrics metrics;
  private final AsyncLoadingCache<Long, SegmentInfo> segments;

  private final AsyncSemaphore assignLock = new FairAsyncSemaphore(1);
  private final AsyncSemaphore pollLock = new FairAsyncSemaphore(1);
  private final AtomicBoolean pollRequested = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final ScheduledThreadPoolExecutor scheduler;

  public IndexBuildDispatcher(
      IndexCoordinatorConfig config,
      MetaTable meta,
      NodeRegistry registry,
      SegmentBroker broker,
      ObjectStore objectStore,
      IdAllocator idAllocator,
      BuildMetrics metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.meta = Objects.requireNonNull(meta, "meta");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
    this.idAllocator = Objects.requireNonNull(idAllocator, "idAllocator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(broker, "broker");
    this.segments = Caffeine.newBuilder()
        .maximumSize(100_000)
        .expireAfterWrite(config.getSegmentCacheTtl())
        .buildAsync(new AsyncCacheLoader<>() {
          @Override
          public CompletableFuture<SegmentInfo> asyncLoad(Long segmentId, Executor executor) {
            return broker.getSegmentInfo(List.of(segmentId))
                .thenApply(infos -> infos.stream()
                    .filter(s -> s.getId() == segmentId)
                    .findFirst()
                    .orElse(null));
          }

          @Override
          public CompletableFuture<Map<Long, SegmentInfo>> asyncLoadAll(
              Set<? extends Long> keys, Executor executor) {
            return broker.getSegmentInfo(new ArrayList<>(keys)).thenApply(infos -> {
              Map<Long, SegmentInfo> out = new HashMap<>(infos.size());
              for (SegmentInfo s : infos) out.put(s.getId(), s);
              return out;
            });
          }
        });
    this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "indexbuild-dispatcher");
      t.setDaemon(true);
      return t;
    });
    registry.addListener(this);
  }

  /** Schedules the assign and poll loops. */
  public void start() {
    if (!started.compareAndSet(false, true)) return;
    long assignMs = config.getAssignInterval().toMillis();
    long pollMs = config.getPollInterval().toMillis();
    scheduler.scheduleWithFixedDelay(this::runAssign, assignMs, assignMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(this::runPoll, pollMs, pollMs, TimeUnit.MILLISECONDS);
    LOG.info("index build dispatcher started assignInterval={} pollInterval={}",
        config.getAssignInterval(), config.getPollInterval());
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    LOG.info("index build dispatcher stopped");
  }

  /** Forgets cached segment info, e.g. after the segment was flushed again or dropped. */
  public void invalidateSegment(long segmentId) {
    segments.synchronous().invalidate(segmentId);
  }

  /** Polls immediately so builds held by the removed worker are released without waiting. */
  @Override
  public void onNodeRemoved(NodeInfo node) {
    LOG.info("index node removed, scheduling poll nodeID={}", node.nodeId());
    if (!pollRequested.compareAndSet(false, true)) return;
    try {
      scheduler.execute(() -> {
        pollRequested.set(false);
        runPoll();
      });
    } catch (RejectedExecutionException e) {
      pollRequested.set(false);
      LOG.debug("dispatcher is stopped, skipping poll for removed nodeID={}", node.nodeId());
    }
  }

  private void runAssign() {
    assignOnce().exceptionally(e -> {
      LOG.warn("index build assign pass failed", IndexBuildException.unwrap(e));
      return null;
    });
  }

  private void runPoll() {
    pollOnce().exceptionally(e -> {
      LOG.warn("index build poll pass failed", IndexBuildException.unwrap(e));
      return null;
    });
  }

  // ============= assign =============

  /**
   * Runs one assign pass over every dispatchable row.
   *
   * @return future completing with the number of jobs accepted by workers
   */
  public CompletableFuture<Integer> assignOnce() {
    return withPermit(assignLock, () -> {
      long now = config.getInstantSource().millis();
      List<SegmentIndexMeta> rows = new ArrayList<>();
      for (SegmentIndexMeta row : meta.getAllSegIndexes()) {
        if (isDispatchable(row) && config.getRetryPolicy().isDue(row.getIndexVersion(), row.getCreateTime(), now)) {
          rows.add(row);
        }
      }
      if (rows.isEmpty()) return completedFuture(0);
      rows.sort(Comparator.comparingLong(SegmentIndexMeta::getBuildId));
      Set<Long> segmentIds = new LinkedHashSet<>();
      for (SegmentIndexMeta row : rows) segmentIds.add(row.getSegmentId());
      LOG.debug("index build assign pass rows={} segments={}", rows.size(), segmentIds.size());
      return segments.getAll(segmentIds).thenCompose(infos -> {
        AtomicInteger dispatched = new AtomicInteger();
        AtomicBoolean noNode = new AtomicBoolean();
        CompletableFuture<Void> chain = completedFuture(null);
        for (SegmentIndexMeta row : rows) {
          chain = chain.thenCompose(v -> {
            if (noNode.get()) return completedFuture(null);
            return assign(row.getBuildId(), infos.get(row.getSegmentId()), dispatched, noNode)
                .exceptionally(e -> {
                  LOG.warn("failed to assign buildID={}", row.getBuildId(), IndexBuildException.unwrap(e));
                  return null;
                });
          });
        }
        return chain.thenApply(v -> dispatched.get());
      });
    });
  }

  private boolean isDispatchable(SegmentIndexMeta row) {
    return row.getState() == IndexState.UNISSUED
        && row.getNodeId() == 0
        && !row.getDeleted()
        && !meta.isIndexDeleted(row.getCollectionId(), row.getIndexId());
  }

  private CompletableFuture<Void> assign(
      long buildId, SegmentInfo segment, AtomicInteger dispatched, AtomicBoolean noNode) {
    // the row may have moved since the pass started
    SegmentIndexMeta row = meta.getSegmentIndexByBuildId(buildId);
    if (row == null || !isDispatchable(row)) return completedFuture(null);
    if (segment == null || segment.getState() != SegmentState.FLUSHED) {
      LOG.debug("segment is not flushed, skipping buildID={} segmentID={}", buildId, row.getSegmentId());
      return completedFuture(null);
    }
    if (segment.getNumRows() < config.getMinSegmentRowsToEnableIndex()) {
      LOG.info(
          "segment has too few rows to build an index, marking finished buildID={} segmentID={} rows={}",
          buildId,
          row.getSegmentId(),
          segment.getNumRows());
      return meta.updateState(buildId, IndexState.FINISHED, "", List.of(), 0);
    }
    IndexMeta index = meta.getIndex(row.getCollectionId(), row.getIndexId());
    if (index == null) return completedFuture(null);

    long nodeId;
    try {
      nodeId = registry.pickNode();
    } catch (IndexBuildException e) {
      if (e.getErrorCode() != ErrorCode.NO_AVAILABLE_NODE) throw e;
      LOG.info("no index node has a free slot, postponing buildID={}", buildId);
      noNode.set(true);
      return completedFuture(null);
    }
    IndexNodeClient client = registry.client(nodeId);
    if (client == null) return completedFuture(null);

    CreateJobRequest request = createJobRequest(row, index, segment);
    return client.createJob(request).thenCompose(status -> {
      if (!Statuses.isSuccess(status) && !Statuses.isDuplicatedTask(status)) {
        LOG.warn(
            "index node rejected job buildID={} nodeID={} code={} reason={}",
            buildId,
            nodeId,
            status.getErrorCode(),
            status.getReason());
        return completedFuture(null);
      }
      return meta.assignNode(buildId, nodeId)
          .thenAccept(v -> {
            registry.consumeSlot(nodeId);
            metrics.jobDispatched(nodeId);
            dispatched.incrementAndGet();
            LOG.info(
                "index build job dispatched buildID={} segmentID={} nodeID={} version={}",
                buildId,
                row.getSegmentId(),
                nodeId,
                row.getIndexVersion());
          })
          .exceptionallyCompose(e -> {
            LOG.warn("failed to record assignment, dropping job buildID={} nodeID={}", buildId, nodeId,
                IndexBuildException.unwrap(e));
            return dropQuietly(client, nodeId, List.of(buildId));
          });
    });
  }

  private CreateJobRequest createJobRequest(SegmentIndexMeta row, IndexMeta index, SegmentInfo segment) {
    String root = objectStore.rootPath();
    return CreateJobRequest.newBuilder()
        .setClusterId(config.getClusterId())
        .setIndexFilePrefix(IndexFilePaths.indexFilePrefix(root))
        .setBuildId(row.getBuildId())
        .addAllDataPaths(segment.getBinlogPathsList())
        .setIndexVersion(row.getIndexVersion())
        .setIndexId(index.getIndexId())
        .setIndexName(index.getIndexName())
        .setStorageConfig(StorageConfig.newBuilder().setRootPath(root).build())
        .addAllIndexParams(index.getIndexParamsList())
        .addAllTypeParams(index.getTypeParamsList())
        .setNumRows(segment.getNumRows())
        .setCollectionId(row.getCollectionId())
        .setPartitionId(row.getPartitionId())
        .setSegmentId(row.getSegmentId())
        .setFieldId(index.getFieldId())
        .build();
  }

  // ============= poll =============

  /**
   * Runs one poll pass over every row owned by a worker.
   *
   * @return future completing with the number of rows released
   */
  public CompletableFuture<Integer> pollOnce() {
    return withPermit(pollLock, () -> {
      Map<Long, List<SegmentIndexMeta>> byNode = new TreeMap<>();
      for (SegmentIndexMeta row : meta.getAllSegIndexes()) {
        if (row.getNodeId() != 0) byNode.computeIfAbsent(row.getNodeId(), k -> new ArrayList<>()).add(row);
      }
      if (byNode.isEmpty()) return completedFuture(0);
      LOG.debug("index build poll pass nodes={}", byNode.keySet());
      AtomicInteger released = new AtomicInteger();
      CompletableFuture<Void> chain = completedFuture(null);
      for (Map.Entry<Long, List<SegmentIndexMeta>> e : byNode.entrySet()) {
        long nodeId = e.getKey();
        chain = chain.thenCompose(v -> pollNode(nodeId, e.getValue(), released).exceptionally(ex -> {
          LOG.warn("failed to poll index node nodeID={}", nodeId, IndexBuildException.unwrap(ex));
          return null;
        }));
      }
      return chain.thenApply(v -> released.get());
    });
  }

  private CompletableFuture<Void> pollNode(long nodeId, List<SegmentIndexMeta> rows, AtomicInteger released) {
    IndexNodeClient client = registry.isAlive(nodeId) ? registry.client(nodeId) : null;
    if (client == null) return reclaimFromDeadNode(nodeId, rows, released);

    List<Long> garbage = new ArrayList<>();
    List<Long> running = new ArrayList<>();
    for (SegmentIndexMeta row : rows) {
      if (isGarbage(row) || IndexStates.isTerminal(row.getState())) {
        garbage.add(row.getBuildId());
      } else {
        running.add(row.getBuildId());
      }
    }
    CompletableFuture<Void> done = completedFuture(null);
    if (!garbage.isEmpty()) {
      done = drop(client, nodeId, garbage).thenCompose(v -> releaseAll(nodeId, garbage, released));
    }
    if (running.isEmpty()) return done;
    return done.thenCompose(v -> client.queryJobs(QueryJobsRequest.newBuilder()
            .setClusterId(config.getClusterId())
            .addAllBuildIds(running)
            .build()))
        .thenCompose(resp -> {
          if (!Statuses.isSuccess(resp.getStatus())) {
            LOG.warn(
                "query jobs failed nodeID={} code={} reason={}",
                nodeId,
                resp.getStatus().getErrorCode(),
                resp.getStatus().getReason());
            return completedFuture(null);
          }
          Map<Long, IndexTaskInfo> reported = new HashMap<>();
          for (IndexTaskInfo info : resp.getIndexInfosList()) reported.put(info.getBuildId(), info);
          CompletableFuture<Void> chain = completedFuture(null);
          for (long buildId : running) {
            IndexTaskInfo info = reported.getOrDefault(
                buildId,
                IndexTaskInfo.newBuilder().setBuildId(buildId).setState(IndexState.INDEX_STATE_NONE).build());
            chain = chain.thenCompose(v -> reconcile(client, nodeId, info, released).exceptionally(ex -> {
              LOG.warn("failed to reconcile buildID={} nodeID={}", buildId, nodeId, IndexBuildException.unwrap(ex));
              return null;
            }));
          }
          return chain;
        });
  }

  private CompletableFuture<Void> reconcile(
      IndexNodeClient client, long nodeId, IndexTaskInfo info, AtomicInteger released) {
    long buildId = info.getBuildId();
    SegmentIndexMeta row = meta.getSegmentIndexByBuildId(buildId);
    if (row == null || row.getNodeId() != nodeId) return completedFuture(null);
    switch (info.getState()) {
      case FINISHED:
        return meta.updateState(buildId, IndexState.FINISHED, "", info.getIndexFileKeysList(), info.getSerializedSize_())
            .thenCompose(v -> {
              metrics.jobFinished(nodeId);
              LOG.info("index build finished buildID={} nodeID={} files={}",
                  buildId, nodeId, info.getIndexFileKeysCount());
              return drop(client, nodeId, List.of(buildId));
            })
            .thenCompose(v -> release(nodeId, buildId, released));
      case FAILED:
        return meta.updateState(buildId, IndexState.FAILED, info.getFailReason(), List.of(), 0)
            .thenCompose(v -> {
              metrics.jobFailed(nodeId);
              LOG.warn("index build failed buildID={} nodeID={} reason={}", buildId, nodeId, info.getFailReason());
              return drop(client, nodeId, List.of(buildId));
            })
            .thenCompose(v -> release(nodeId, buildId, released));
      case INDEX_STATE_NONE:
        LOG.warn("index node lost build, re-issuing buildID={} nodeID={}", buildId, nodeId);
        return recoverLostBuild(row, released);
      default:
        return completedFuture(null);
    }
  }

  private CompletableFuture<Void> reclaimFromDeadNode(
      long nodeId, List<SegmentIndexMeta> rows, AtomicInteger released) {
    LOG.info("index node is gone, reclaiming builds nodeID={} rows={}", nodeId, rows.size());
    CompletableFuture<Void> chain = completedFuture(null);
    for (SegmentIndexMeta row : rows) {
      long buildId = row.getBuildId();
      chain = chain.thenCompose(v -> {
        CompletableFuture<Void> step = !isGarbage(row) && !IndexStates.isTerminal(row.getState())
            ? recoverLostBuild(row, released)
            : release(nodeId, buildId, released);
        return step.exceptionally(ex -> {
          LOG.warn("failed to reclaim buildID={} from nodeID={}", buildId, nodeId, IndexBuildException.unwrap(ex));
          return null;
        });
      });
    }
    return chain;
  }

  /**
   * Re-issues a build whose worker no longer holds it, or marks it {@code FAILED} once the retry
   * policy is exhausted.
   */
  private CompletableFuture<Void> recoverLostBuild(SegmentIndexMeta row, AtomicInteger released) {
    long buildId = row.getBuildId();
    long nodeId = row.getNodeId();
    if (!config.getRetryPolicy().canRebuild(row.getIndexVersion())) {
      String reason = MAX_ATTEMPTS_REASON + row.getIndexVersion();
      return meta.updateState(buildId, IndexState.FAILED, reason, List.of(), 0)
          .thenCompose(v -> {
            metrics.jobFailed(nodeId);
            LOG.warn("index build exhausted retries buildID={} segmentID={} attempts={}",
                buildId, row.getSegmentId(), row.getIndexVersion());
            return release(nodeId, buildId, released);
          });
    }
    return idAllocator.allocateId()
        .thenCompose(newBuildId -> meta.rebuildSegmentIndex(buildId, newBuildId, config.getInstantSource().millis()))
        .thenAccept(next -> {
          metrics.jobRebuilt();
          metrics.jobReleased(nodeId);
          released.incrementAndGet();
          LOG.info("index build re-issued buildID={} -> {} version={}",
              buildId, next.getBuildId(), next.getIndexVersion());
        });
  }

  private CompletableFuture<Void> releaseAll(long nodeId, List<Long> buildIds, AtomicInteger released) {
    CompletableFuture<Void> chain = completedFuture(null);
    for (long buildId : buildIds) {
      chain = chain.thenCompose(v -> release(nodeId, buildId, released));
    }
    return chain;
  }

  private CompletableFuture<Void> release(long nodeId, long buildId, AtomicInteger released) {
    return meta.releaseNode(buildId).thenAccept(v -> {
      metrics.jobReleased(nodeId);
      released.incrementAndGet();
    });
  }

  private CompletableFuture<Void> drop(IndexNodeClient client, long nodeId, List<Long> buildIds) {
    return client.dropJobs(DropJobsRequest.newBuilder()
            .setClusterId(config.getClusterId())
            .addAllBuildIds(buildIds)
            .build())
        .thenAccept(status -> {
          if (!Statuses.isSuccess(status)) {
            throw new IndexBuildException(
                status.getErrorCode(), "drop jobs failed on node " + nodeId + ": " + status.getReason());
          }
        });
  }

  private CompletableFuture<Void> dropQuietly(IndexNodeClient client, long nodeId, List<Long> buildIds) {
    return drop(client, nodeId, buildIds).exceptionally(e -> {
      LOG.warn("failed to drop jobs {} on nodeID={}", buildIds, nodeId, IndexBuildException.unwrap(e));
      return null;
    });
  }

  private boolean isGarbage(SegmentIndexMeta row) {
    return row.getDeleted() || meta.isIndexDeleted(row.getCollectionId(), row.getIndexId());
  }
}
