package io.github.panghy.indexbuild.coord;

import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.Statuses;
import io.github.panghy.indexbuild.broker.IndexFilePaths;
import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.broker.SegmentBroker;
import io.github.panghy.indexbuild.dispatch.IndexBuildDispatcher;
import io.github.panghy.indexbuild.gc.GarbageCollector;
import io.github.panghy.indexbuild.kv.MetaKv;
import io.github.panghy.indexbuild.meta.IdAllocator;
import io.github.panghy.indexbuild.meta.KvIdAllocator;
import io.github.panghy.indexbuild.meta.MetaTable;
import io.github.panghy.indexbuild.node.IndexNodeClient;
import io.github.panghy.indexbuild.node.NodeInfo;
import io.github.panghy.indexbuild.node.NodeRegistry;
import io.github.panghy.indexbuild.proto.ComponentInfos;
import io.github.panghy.indexbuild.proto.CreateIndexRequest;
import io.github.panghy.indexbuild.proto.CreateIndexResponse;
import io.github.panghy.indexbuild.proto.DescribeIndexRequest;
import io.github.panghy.indexbuild.proto.DescribeIndexResponse;
import io.github.panghy.indexbuild.proto.DropIndexRequest;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.GetIndexBuildProgressRequest;
import io.github.panghy.indexbuild.proto.GetIndexBuildProgressResponse;
import io.github.panghy.indexbuild.proto.GetIndexInfosRequest;
import io.github.panghy.indexbuild.proto.GetIndexInfosResponse;
import io.github.panghy.indexbuild.proto.GetIndexStateRequest;
import io.github.panghy.indexbuild.proto.GetIndexStateResponse;
import io.github.panghy.indexbuild.proto.GetMetricsRequest;
import io.github.panghy.indexbuild.proto.GetMetricsResponse;
import io.github.panghy.indexbuild.proto.GetSegmentIndexStateRequest;
import io.github.panghy.indexbuild.proto.GetSegmentIndexStateResponse;
import io.github.panghy.indexbuild.proto.IndexFilePathInfo;
import io.github.panghy.indexbuild.proto.IndexInfo;
import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.SegmentIndexInfo;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;
import io.github.panghy.indexbuild.proto.SegmentIndexState;
import io.github.panghy.indexbuild.proto.SegmentInfo;
import io.github.panghy.indexbuild.proto.StateCode;
import io.github.panghy.indexbuild.proto.Status;
import io.github.panghy.indexbuild.util.BuildMetrics;
import io.github.panghy.indexbuild.util.SystemInfoMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the index coordinator.
 *
 * <p>Serves index definition and progress requests from the {@link MetaTable}, creates one
 * {@code UNISSUED} segment index per flushed segment and live index, and owns the background
 * components: the {@link IndexBuildDispatcher}, the {@link GarbageCollector} and the lease and
 * health loops of the {@link NodeRegistry}.</p>
 *
 * <p>Requests never complete exceptionally. Failures are reported in the response {@link Status};
 * every request answers {@code NOT_READY_SERVE} unless the coordinator is
 * {@link StateCode#HEALTHY}.</p>
 */
public final class IndexCoordinator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(IndexCoordinator.class);

  static final String AMBIGUOUS_INDEX =
      "there are multiple indexes, please specify the index name";

  private final IndexCoordinatorConfig config;
  private final MetaTable meta;
  private final NodeRegistry registry;
  private final SegmentBroker broker;
  private final ObjectStore objectStore;
  private final IdAllocator idAllocator;
  private final IndexBuildDispatcher dispatcher;
  private final GarbageCollector garbageCollector;
  private final ScheduledThreadPoolExecutor nodeMaintenance;
  private final AtomicReference<StateCode> state = new AtomicReference<>(StateCode.INITIALIZING);
  private volatile long startedAt;

  public IndexCoordinator(
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
    this.broker = Objects.requireNonNull(broker, "broker");
    this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
    this.idAllocator = Objects.requireNonNull(idAllocator, "idAllocator");
    this.dispatcher = new IndexBuildDispatcher(config, meta, registry, broker, objectStore, idAllocator, metrics);
    this.garbageCollector = new GarbageCollector(config, meta, broker, objectStore, metrics);
    this.nodeMaintenance = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "indexbuild-node-maintenance");
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Loads the metadata from {@code kv} and wires a coordinator with a KV-backed id allocator and a
   * fresh node registry.
   */
  public static CompletableFuture<IndexCoordinator> open(
      IndexCoordinatorConfig config, MetaKv kv, SegmentBroker broker, ObjectStore objectStore) {
    NodeRegistry registry = new NodeRegistry(
        config.getNodeLeaseTtl(), config.getNodeHealthFailureWindow(), config.getInstantSource());
    return MetaTable.load(kv).thenApply(meta -> new IndexCoordinator(
        config, meta, registry, broker, objectStore, new KvIdAllocator(kv), new BuildMetrics()));
  }

  /** Starts the background loops and begins serving requests. */
  public synchronized void start() {
    if (state.get() != StateCode.INITIALIZING) return;
    long healthMs = config.getNodeHealthCheckInterval().toMillis();
    long leaseMs = Math.max(1, config.getNodeLeaseTtl().toMillis() / 2);
    nodeMaintenance.scheduleWithFixedDelay(this::expireLeases, leaseMs, leaseMs, TimeUnit.MILLISECONDS);
    nodeMaintenance.scheduleWithFixedDelay(this::checkNodeHealth, healthMs, healthMs, TimeUnit.MILLISECONDS);
    dispatcher.start();
    garbageCollector.start();
    startedAt = now();
    state.set(StateCode.HEALTHY);
    LOG.info("index coordinator started clusterID={}", config.getClusterId());
  }

  /** Stops the background loops; subsequent requests answer {@code NOT_READY_SERVE}. */
  public synchronized void stop() {
    if (state.get() == StateCode.ABNORMAL) return;
    state.set(StateCode.STOPPING);
    nodeMaintenance.shutdownNow();
    dispatcher.close();
    garbageCollector.close();
    state.set(StateCode.ABNORMAL);
    LOG.info("index coordinator stopped clusterID={}", config.getClusterId());
  }

  @Override
  public void close() {
    stop();
  }

  public StateCode stateCode() {
    return state.get();
  }

  public NodeRegistry nodeRegistry() {
    return registry;
  }

  public IndexBuildDispatcher dispatcher() {
    return dispatcher;
  }

  public GarbageCollector garbageCollector() {
    return garbageCollector;
  }

  private void expireLeases() {
    try {
      List<Long> expired = registry.expireLeases();
      if (!expired.isEmpty()) LOG.info("index node leases expired nodeIDs={}", expired);
    } catch (RuntimeException e) {
      LOG.warn("failed to expire index node leases", e);
    }
  }

  private void checkNodeHealth() {
    registry.checkHealth().exceptionally(e -> {
      LOG.warn("index node health check failed", IndexBuildException.unwrap(e));
      return null;
    });
  }

  // ============= CreateIndex =============

  /**
   * Registers an index definition and creates a segment index for every flushed segment of the
   * collection. Repeating the request with the same definition returns the existing index id.
   */
  public CompletableFuture<CreateIndexResponse> createIndex(CreateIndexRequest req) {
    return serve(
        () -> {
          LOG.info("receive create index request collectionID={} fieldID={} indexName={}",
              req.getCollectionId(), req.getFieldId(), req.getIndexName());
          return idAllocator.allocateId()
              .thenCompose(indexId -> meta.createIndex(IndexMeta.newBuilder()
                  .setCollectionId(req.getCollectionId())
                  .setFieldId(req.getFieldId())
                  .setIndexId(indexId)
                  .setIndexName(req.getIndexName())
                  .addAllTypeParams(req.getTypeParamsList())
                  .addAllIndexParams(req.getIndexParamsList())
                  .addAllUserIndexParams(req.getUserIndexParamsList())
                  .setIsAutoIndex(req.getIsAutoIndex())
                  .setCreateTime(req.getTimestamp() != 0 ? req.getTimestamp() : now())
                  .build()))
              .thenCompose(indexId -> broker.getFlushedSegments(req.getCollectionId(), SegmentBroker.ALL_PARTITIONS)
                  .thenCompose(segments -> addSegmentIndexes(indexId, segments))
                  .thenApply(v -> CreateIndexResponse.newBuilder()
                      .setStatus(Statuses.success())
                      .setIndexId(indexId)
                      .build()));
        },
        status -> CreateIndexResponse.newBuilder().setStatus(status).build());
  }

  private CompletableFuture<Void> addSegmentIndexes(long indexId, List<SegmentInfo> segments) {
    CompletableFuture<Void> chain = completedFuture(null);
    for (SegmentInfo segment : segments) {
      chain = chain.thenCompose(v -> addSegmentIndex(indexId, segment));
    }
    return chain;
  }

  private CompletableFuture<Void> addSegmentIndex(long indexId, SegmentInfo segment) {
    if (meta.getSegmentIndex(segment.getId(), indexId) != null) return completedFuture(null);
    return idAllocator.allocateId()
        .thenCompose(buildId -> meta.addSegmentIndex(SegmentIndexMeta.newBuilder()
            .setCollectionId(segment.getCollectionId())
            .setPartitionId(segment.getPartitionId())
            .setSegmentId(segment.getId())
            .setNumRows(segment.getNumRows())
            .setIndexId(indexId)
            .setBuildId(buildId)
            .setIndexVersion(1)
            .setCreateTime(now())
            .build()))
        .thenAccept(added -> {
          if (added) {
            LOG.debug("segment index created segmentID={} indexID={}", segment.getId(), indexId);
          }
        });
  }

  /**
   * Creates segment indexes for a newly flushed segment, one per live index of its collection.
   */
  public CompletableFuture<Status> onSegmentFlushed(SegmentInfo segment) {
    return serve(
        () -> {
          dispatcher.invalidateSegment(segment.getId());
          CompletableFuture<Void> chain = completedFuture(null);
          for (IndexMeta index : meta.getIndexes(segment.getCollectionId())) {
            chain = chain.thenCompose(v -> addSegmentIndex(index.getIndexId(), segment));
          }
          return chain.thenApply(v -> Statuses.success());
        },
        Function.identity());
  }

  // ============= state and progress =============

  /**
   * Aggregates the state of one index over its current segment indexes: any {@code FAILED} wins,
   * then any unfinished build, otherwise {@code FINISHED}.
   */
  public CompletableFuture<GetIndexStateResponse> getIndexState(GetIndexStateRequest req) {
    return serve(
        () -> {
          IndexMeta index = resolveSingle(req.getCollectionId(), req.getIndexName());
          IndexState aggregate = IndexState.FINISHED;
          String failReason = "";
          for (SegmentIndexMeta row : currentRows(index.getIndexId())) {
            if (row.getState() == IndexState.FAILED) {
              aggregate = IndexState.FAILED;
              failReason = row.getFailReason();
              break;
            }
            if (row.getState() != IndexState.FINISHED) aggregate = IndexState.IN_PROGRESS;
          }
          LOG.debug("index state collectionID={} indexName={} state={}",
              req.getCollectionId(), index.getIndexName(), aggregate);
          return completedFuture(GetIndexStateResponse.newBuilder()
              .setStatus(Statuses.success())
              .setState(aggregate)
              .setFailReason(failReason)
              .build());
        },
        status -> GetIndexStateResponse.newBuilder().setStatus(status).build());
  }

  /** Reports the current build state of each requested segment for one index. */
  public CompletableFuture<GetSegmentIndexStateResponse> getSegmentIndexState(GetSegmentIndexStateRequest req) {
    return serve(
        () -> {
          IndexMeta index = resolveSingle(req.getCollectionId(), req.getIndexName());
          GetSegmentIndexStateResponse.Builder resp =
              GetSegmentIndexStateResponse.newBuilder().setStatus(Statuses.success());
          for (long segmentId : req.getSegmentIdsList()) {
            SegmentIndexMeta row = meta.getSegmentIndex(segmentId, index.getIndexId());
            resp.addStates(SegmentIndexState.newBuilder()
                .setSegmentId(segmentId)
                .setState(row == null ? IndexState.INDEX_STATE_NONE : row.getState())
                .setFailReason(row == null ? "" : row.getFailReason())
                .build());
          }
          return completedFuture(resp.build());
        },
        status -> GetSegmentIndexStateResponse.newBuilder().setStatus(status).build());
  }

  /** Counts rows of flushed segments and rows already covered by a finished build. */
  public CompletableFuture<GetIndexBuildProgressResponse> getIndexBuildProgress(GetIndexBuildProgressRequest req) {
    return serve(
        () -> {
          IndexMeta index = resolveSingle(req.getCollectionId(), req.getIndexName());
          return progress(index).thenApply(p -> GetIndexBuildProgressResponse.newBuilder()
              .setStatus(Statuses.success())
              .setIndexedRows(p.indexedRows())
              .setTotalRows(p.totalRows())
              .build());
        },
        status -> GetIndexBuildProgressResponse.newBuilder().setStatus(status).build());
  }

  /** Describes the requested index with its parameters, progress and aggregate state. */
  public CompletableFuture<DescribeIndexResponse> describeIndex(DescribeIndexRequest req) {
    return serve(
        () -> {
          IndexMeta index = resolveSingle(req.getCollectionId(), req.getIndexName());
          return getIndexState(GetIndexStateRequest.newBuilder()
                  .setCollectionId(req.getCollectionId())
                  .setIndexName(index.getIndexName())
                  .build())
              .thenCompose(st -> progress(index).thenApply(p -> DescribeIndexResponse.newBuilder()
                  .setStatus(Statuses.success())
                  .addIndexInfos(IndexInfo.newBuilder()
                      .setCollectionId(index.getCollectionId())
                      .setFieldId(index.getFieldId())
                      .setIndexName(index.getIndexName())
                      .setIndexId(index.getIndexId())
                      .addAllTypeParams(index.getTypeParamsList())
                      .addAllIndexParams(index.getIndexParamsList())
                      .addAllUserIndexParams(index.getUserIndexParamsList())
                      .setIsAutoIndex(index.getIsAutoIndex())
                      .setIndexedRows(p.indexedRows())
                      .setTotalRows(p.totalRows())
                      .setState(st.getState())
                      .setIndexStateFailReason(st.getFailReason())
                      .build())
                  .build()));
        },
        status -> DescribeIndexResponse.newBuilder().setStatus(status).build());
  }

  /**
   * Lists the index files of finished builds for each requested segment. An empty index name
   * selects every live index of the collection.
   */
  public CompletableFuture<GetIndexInfosResponse> getIndexInfos(GetIndexInfosRequest req) {
    return serve(
        () -> {
          Set<Long> indexIds = meta.getIndexIdByName(req.getCollectionId(), req.getIndexName());
          String root = objectStore.rootPath();
          GetIndexInfosResponse.Builder resp = GetIndexInfosResponse.newBuilder().setStatus(Statuses.success());
          for (long segmentId : req.getSegmentIdsList()) {
            SegmentIndexInfo.Builder info = SegmentIndexInfo.newBuilder()
                .setCollectionId(req.getCollectionId())
                .setSegmentId(segmentId);
            for (long indexId : indexIds) {
              SegmentIndexMeta row = meta.getSegmentIndex(segmentId, indexId);
              if (row == null || row.getState() != IndexState.FINISHED) continue;
              IndexMeta index = meta.getIndex(req.getCollectionId(), indexId);
              List<String> paths = new ArrayList<>(row.getIndexFileKeysCount());
              for (String fileKey : row.getIndexFileKeysList()) {
                paths.add(IndexFilePaths.filePath(
                    root, row.getBuildId(), row.getIndexVersion(), row.getPartitionId(), segmentId, fileKey));
              }
              info.setEnableIndex(true).addIndexInfos(IndexFilePathInfo.newBuilder()
                  .setSegmentId(segmentId)
                  .setFieldId(index.getFieldId())
                  .setIndexId(indexId)
                  .setBuildId(row.getBuildId())
                  .setIndexName(index.getIndexName())
                  .addAllIndexParams(index.getIndexParamsList())
                  .addAllIndexFilePaths(paths)
                  .setSerializedSize_(row.getSerializedSize_())
                  .setIndexVersion(row.getIndexVersion())
                  .setNumRows(row.getNumRows())
                  .build());
            }
            resp.putSegmentInfo(segmentId, info.build());
          }
          return completedFuture(resp.build());
        },
        status -> GetIndexInfosResponse.newBuilder().setStatus(status).build());
  }

  // ============= DropIndex =============

  /**
   * Soft-deletes the named index, or every index of the collection with {@code drop_all}. With
   * partition ids only the segment indexes of those partitions are dropped. Dropping an index that
   * does not exist succeeds.
   */
  public CompletableFuture<Status> dropIndex(DropIndexRequest req) {
    return serve(
        () -> {
          LOG.info("receive drop index request collectionID={} indexName={} partitionIDs={} dropAll={}",
              req.getCollectionId(), req.getIndexName(), req.getPartitionIdsList(), req.getDropAll());
          Set<Long> indexIds = meta.getIndexIdByName(req.getCollectionId(), req.getIndexName());
          if (indexIds.isEmpty()) {
            LOG.info("drop index, but index does not exist collectionID={} indexName={}",
                req.getCollectionId(), req.getIndexName());
            return completedFuture(Statuses.success());
          }
          if (!req.getDropAll() && indexIds.size() > 1) {
            throw IndexBuildException.unexpected(AMBIGUOUS_INDEX);
          }
          CompletableFuture<Void> drop = req.getPartitionIdsCount() == 0
              ? meta.markIndexDeleted(req.getCollectionId(), indexIds)
              : meta.markPartitionIndexesDeleted(req.getPartitionIdsList(), indexIds);
          return drop.thenApply(v -> {
            LOG.info("index dropped collectionID={} indexIDs={}", req.getCollectionId(), indexIds);
            return Statuses.success();
          });
        },
        Function.identity());
  }

  // ============= GetMetrics =============

  /**
   * Reports the coordinator and every registered worker. A worker that cannot be reached or answers
   * with an error is listed with {@code has_error} and the reason instead of failing the request.
   */
  public CompletableFuture<GetMetricsResponse> getMetrics(GetMetricsRequest req) {
    String name = SystemInfoMetrics.componentName(SystemInfoMetrics.INDEX_COORD_ROLE, config.getServerId());
    return serve(
        () -> {
          SystemInfoMetrics.checkMetricType(req);
          List<NodeInfo> nodes = registry.nodes();
          List<CompletableFuture<ComponentInfos>> calls = new ArrayList<>(nodes.size());
          for (NodeInfo node : nodes) {
            calls.add(nodeMetrics(node.nodeId(), req));
          }
          return CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new)).thenApply(v -> {
            GetMetricsResponse.Builder resp = GetMetricsResponse.newBuilder()
                .setStatus(Statuses.success())
                .setComponentName(name)
                .setSelf(selfInfo(name));
            calls.forEach(c -> resp.addConnectedNodes(c.join()));
            LOG.debug("index coordinator metrics collected nodes={}", nodes.size());
            return resp.build();
          });
        },
        status -> GetMetricsResponse.newBuilder().setStatus(status).setComponentName(name).build());
  }

  private CompletableFuture<ComponentInfos> nodeMetrics(long nodeId, GetMetricsRequest req) {
    String name = SystemInfoMetrics.componentName(SystemInfoMetrics.INDEX_NODE_ROLE, nodeId);
    IndexNodeClient client = registry.client(nodeId);
    if (client == null) return completedFuture(errorInfo(nodeId, name, "index node is no longer registered"));
    CompletableFuture<GetMetricsResponse> call;
    try {
      call = client.getMetrics(req);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    return call.handle((resp, ex) -> {
      if (ex != null) {
        Throwable cause = IndexBuildException.unwrap(ex);
        LOG.warn("failed to get metrics of index node nodeID={}", nodeId, cause);
        return errorInfo(nodeId, name, String.valueOf(cause.getMessage()));
      }
      if (!Statuses.isSuccess(resp.getStatus())) {
        LOG.warn("index node metrics returned error nodeID={} reason={}", nodeId, resp.getStatus().getReason());
        return errorInfo(nodeId, resp.getComponentName().isEmpty() ? name : resp.getComponentName(),
            resp.getStatus().getReason());
      }
      return resp.getSelf();
    });
  }

  private static ComponentInfos errorInfo(long nodeId, String name, String reason) {
    return ComponentInfos.newBuilder()
        .setName(name)
        .setId(nodeId)
        .setType(SystemInfoMetrics.INDEX_NODE_ROLE)
        .setHasError(true)
        .setErrorReason(reason)
        .build();
  }

  private ComponentInfos selfInfo(String name) {
    return ComponentInfos.newBuilder()
        .setName(name)
        .setId(config.getServerId())
        .setType(SystemInfoMetrics.INDEX_COORD_ROLE)
        .setHardware(SystemInfoMetrics.hardware())
        .setCreatedTime(startedAt)
        .setUpdatedTime(now())
        .addAllSystemConfigurations(SystemInfoMetrics.configurations(Map.of(
            "clusterId", config.getClusterId(),
            "minSegmentNumRowsToEnableIndex", String.valueOf(config.getMinSegmentRowsToEnableIndex()),
            "assignInterval", config.getAssignInterval().toString(),
            "gcInterval", config.getGcInterval().toString(),
            "gcMetaInterval", config.getGcMetaInterval().toString())))
        .build();
  }

  // ============= helpers =============

  private IndexMeta resolveSingle(long collectionId, String indexName) {
    Set<Long> ids = meta.getIndexIdByName(collectionId, indexName);
    if (ids.isEmpty()) {
      throw IndexBuildException.indexNotExist(
          "there is no index on collection " + collectionId + " with the index name \"" + indexName + "\"");
    }
    if (ids.size() > 1) throw IndexBuildException.unexpected(AMBIGUOUS_INDEX);
    return meta.getIndex(collectionId, ids.iterator().next());
  }

  /** Current (non-deleted, highest version) row per segment for an index. */
  private List<SegmentIndexMeta> currentRows(long indexId) {
    List<SegmentIndexMeta> out = new ArrayList<>();
    for (long buildId : meta.getBuildIdsFromIndexId(indexId)) {
      SegmentIndexMeta row = meta.getSegmentIndexByBuildId(buildId);
      if (row == null || row.getDeleted()) continue;
      SegmentIndexMeta current = meta.getSegmentIndex(row.getSegmentId(), indexId);
      if (current != null && current.getBuildId() == buildId) out.add(row);
    }
    return out;
  }

  private CompletableFuture<Progress> progress(IndexMeta index) {
    return broker.getFlushedSegments(index.getCollectionId(), SegmentBroker.ALL_PARTITIONS)
        .thenApply(segments -> {
          long total = 0;
          long indexed = 0;
          for (SegmentInfo segment : segments) {
            total += segment.getNumRows();
            SegmentIndexMeta row = meta.getSegmentIndex(segment.getId(), index.getIndexId());
            if (row != null && row.getState() == IndexState.FINISHED) indexed += segment.getNumRows();
          }
          return new Progress(indexed, total);
        });
  }

  private <T> CompletableFuture<T> serve(
      Supplier<CompletableFuture<T>> handler, Function<Status, T> onError) {
    StateCode current = state.get();
    if (current != StateCode.HEALTHY) {
      return completedFuture(
          onError.apply(Statuses.of(ErrorCode.NOT_READY_SERVE, "index coordinator is not healthy: " + current)));
    }
    CompletableFuture<T> result;
    try {
      result = handler.get();
    } catch (RuntimeException e) {
      result = CompletableFuture.failedFuture(e);
    }
    return result.exceptionally(e -> {
      Status status = Statuses.fromThrowable(e);
      LOG.warn("index coordinator request failed code={} reason={}", status.getErrorCode(), status.getReason());
      return onError.apply(status);
    });
  }

  private long now() {
    return config.getInstantSource().millis();
  }

  private record Progress(long indexedRows, long totalRows) {}
}
