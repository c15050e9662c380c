package io.github.panghy.indexbuild.meta;

import static io.github.panghy.indexbuild.util.AsyncLocks.withPermit;
import static java.util.concurrent.CompletableFuture.completedFuture;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ibm.asyncutil.locks.AsyncSemaphore;
import com.ibm.asyncutil.locks.FairAsyncSemaphore;
import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.kv.MetaKv;
import io.github.panghy.indexbuild.kv.MetaKvException;
import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.KeyValuePair;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative store of {@link IndexMeta} and {@link SegmentIndexMeta} rows.
 *
 * <p>Rows live durably in a {@link MetaKv} and are mirrored in memory for lock-free reads. Every
 * mutation is written through to the store first; the mirror is updated only after the write
 * succeeded, so a failed write leaves no partial visibility. A failed write completes the returned
 * future with an {@link IndexBuildException} carrying {@code UNEXPECTED_ERROR}.</p>
 *
 * <p>Mutations of the index map and of the segment-index map are serialized by two independent
 * async locks. Operations spanning many rows (dropping every index of a collection, tombstoning
 * every row of a vanished segment) are written in one store transaction per call but are not
 * atomic with respect to other calls; each is idempotent on retry.</p>
 *
 * <p>Soft delete is a tombstone ({@code deleted = true}); physical removal is left to
 * {@link #removeIndex} and {@link #removeSegmentIndex}, which refuse rows that are still live or
 * still owned by a worker.</p>
 */
public final class MetaTable {
  private static final Logger LOG = LoggerFactory.getLogger(MetaTable.class);

  private final MetaKv kv;

  private final AsyncSemaphore indexLock = new FairAsyncSemaphore(1);
  private final AsyncSemaphore segmentIndexLock = new FairAsyncSemaphore(1);

  // collectionID -> indexID -> index
  private final Map<Long, Map<Long, IndexMeta>> indexes = new ConcurrentHashMap<>();
  // buildID -> segment index
  private final Map<Long, SegmentIndexMeta> segmentIndexes = new ConcurrentHashMap<>();
  // indexID -> buildIDs
  private final Map<Long, Set<Long>> buildsByIndex = new ConcurrentHashMap<>();
  // segmentID -> buildIDs
  private final Map<Long, Set<Long>> buildsBySegment = new ConcurrentHashMap<>();

  private MetaTable(MetaKv kv) {
    this.kv = Objects.requireNonNull(kv, "kv");
  }

  /**
   * Loads every persisted row into a new table. Used at start-up so that state survives
   * coordinator restarts.
   */
  public static CompletableFuture<MetaTable> load(MetaKv kv) {
    MetaTable table = new MetaTable(kv);
    return kv.loadWithPrefix(MetaKeys.INDEX_PREFIX)
        .thenCompose(idx -> {
          for (Map.Entry<String, byte[]> e : idx.entrySet()) {
            IndexMeta index = parseIndex(e.getKey(), e.getValue());
            table.putIndex(index);
          }
          return kv.loadWithPrefix(MetaKeys.SEGMENT_INDEX_PREFIX);
        })
        .thenApply(segs -> {
          for (Map.Entry<String, byte[]> e : segs.entrySet()) {
            table.putSegmentIndex(parseSegmentIndex(e.getKey(), e.getValue()));
          }
          LOG.info(
              "meta table loaded indexes={} segmentIndexes={}",
              table.indexes.values().stream().mapToInt(Map::size).sum(),
              table.segmentIndexes.size());
          return table;
        });
  }

  // ============= Index rows =============

  /**
   * Registers an index definition.
   *
   * <p>Idempotent: if a non-deleted index with the same name already exists on the collection with
   * identical field and parameters, its id is returned and nothing is written. A same-named index
   * with different parameters, or a differently named index on the same field, fails with
   * {@code ALREADY_EXISTS}.</p>
   *
   * @param index index row; {@code index_id} must already be allocated
   * @return future completing with the id of the (new or existing) index
   */
  public CompletableFuture<Long> createIndex(IndexMeta index) {
    return withPermit(indexLock, () -> {
      for (IndexMeta existing : liveIndexes(index.getCollectionId())) {
        if (existing.getIndexName().equals(index.getIndexName())) {
          if (sameDefinition(existing, index)) {
            LOG.info(
                "index already exists collectionID={} indexName={} indexID={}",
                index.getCollectionId(),
                index.getIndexName(),
                existing.getIndexId());
            return completedFuture(existing.getIndexId());
          }
          throw IndexBuildException.alreadyExists("index already exist, but parameters are inconsistent: "
              + index.getIndexName());
        }
        if (existing.getFieldId() == index.getFieldId()) {
          throw IndexBuildException.alreadyExists("at most one distinct index is allowed per field, field "
              + index.getFieldId() + " already has index " + existing.getIndexName());
        }
      }
      IndexMeta row = index.toBuilder().setDeleted(false).build();
      return persist(kv.save(MetaKeys.indexKey(row), row.toByteArray()), "create index " + row.getIndexName())
          .thenApply(v -> {
            putIndex(row);
            LOG.info(
                "index created collectionID={} indexID={} indexName={}",
                row.getCollectionId(),
                row.getIndexId(),
                row.getIndexName());
            return row.getIndexId();
          });
    });
  }

  /**
   * Resolves index names to ids among non-deleted indexes; an empty name matches every index of
   * the collection. Callers that need exactly one index must treat more than one result as an
   * ambiguous reference.
   */
  public Set<Long> getIndexIdByName(long collectionId, String indexName) {
    Set<Long> ids = new HashSet<>();
    for (IndexMeta index : liveIndexes(collectionId)) {
      if (indexName == null || indexName.isEmpty() || index.getIndexName().equals(indexName)) {
        ids.add(index.getIndexId());
      }
    }
    return ids;
  }

  /**
   * Tombstones the given indexes. Ids that are unknown or already deleted are skipped; if nothing
   * remains the call is a successful no-op.
   */
  public CompletableFuture<Void> markIndexDeleted(long collectionId, Collection<Long> indexIds) {
    return withPermit(indexLock, () -> {
      Map<String, byte[]> saves = new LinkedHashMap<>();
      List<IndexMeta> updated = new ArrayList<>();
      Map<Long, IndexMeta> byId = indexes.getOrDefault(collectionId, Map.of());
      for (Long id : indexIds) {
        IndexMeta index = byId.get(id);
        if (index == null || index.getDeleted()) continue;
        IndexMeta row = index.toBuilder().setDeleted(true).build();
        saves.put(MetaKeys.indexKey(row), row.toByteArray());
        updated.add(row);
      }
      if (saves.isEmpty()) return completedFuture(null);
      return persist(kv.multiSave(saves), "mark indexes deleted " + indexIds).thenApply(v -> {
        updated.forEach(this::putIndex);
        LOG.info("indexes marked deleted collectionID={} indexIDs={}", collectionId, indexIds);
        return null;
      });
    });
  }

  /**
   * Tombstones one index ({@code indexId != null}) or, with {@code dropAll}, every non-deleted index
   * of the collection. Dropping an index that is not live is a successful no-op.
   */
  public CompletableFuture<Void> markIndexDeleted(long collectionId, Long indexId, boolean dropAll) {
    if (indexId != null) return markIndexDeleted(collectionId, List.of(indexId));
    if (!dropAll) return completedFuture(null);
    return markIndexDeleted(collectionId, getIndexIdByName(collectionId, ""));
  }

  /**
   * Physically removes a tombstoned index. Rejected while the index is live or still referenced by
   * any segment-index row. Removing an unknown index succeeds.
   */
  public CompletableFuture<Void> removeIndex(long collectionId, long indexId) {
    return withPermit(indexLock, () -> {
      IndexMeta index = getIndex(collectionId, indexId);
      if (index == null) return completedFuture(null);
      if (!index.getDeleted()) {
        throw IndexBuildException.unexpected("index " + indexId + " is not deleted, refusing to remove");
      }
      if (!getBuildIdsFromIndexId(indexId).isEmpty()) {
        throw IndexBuildException.unexpected(
            "index " + indexId + " is still referenced by segment indexes, refusing to remove");
      }
      return persist(kv.remove(MetaKeys.indexKey(collectionId, indexId)), "remove index " + indexId)
          .thenApply(v -> {
            Map<Long, IndexMeta> byId = indexes.get(collectionId);
            if (byId != null) {
              byId.remove(indexId);
              if (byId.isEmpty()) indexes.remove(collectionId, byId);
            }
            LOG.info("index removed collectionID={} indexID={}", collectionId, indexId);
            return null;
          });
    });
  }

  /** Returns the index row (deleted or not), or {@code null}. */
  public IndexMeta getIndex(long collectionId, long indexId) {
    return indexes.getOrDefault(collectionId, Map.of()).get(indexId);
  }

  /** Returns the non-deleted indexes of a collection. */
  public List<IndexMeta> getIndexes(long collectionId) {
    return liveIndexes(collectionId);
  }

  /** Returns every tombstoned index. */
  public List<IndexMeta> getDeletedIndexes() {
    List<IndexMeta> out = new ArrayList<>();
    for (Map<Long, IndexMeta> byId : indexes.values()) {
      for (IndexMeta index : byId.values()) {
        if (index.getDeleted()) out.add(index);
      }
    }
    return out;
  }

  /** True when the index is tombstoned or unknown. */
  public boolean isIndexDeleted(long collectionId, long indexId) {
    IndexMeta index = getIndex(collectionId, indexId);
    return index == null || index.getDeleted();
  }

  // ============= Segment-index rows =============

  /**
   * Adds an {@code UNISSUED} row for one build attempt. No-op (completing with {@code false}) when
   * the build id is known or a row for the same segment, index and version already exists.
   */
  public CompletableFuture<Boolean> addSegmentIndex(SegmentIndexMeta segIdx) {
    return withPermit(segmentIndexLock, () -> {
      if (segmentIndexes.containsKey(segIdx.getBuildId())) return completedFuture(false);
      for (SegmentIndexMeta existing : rowsOf(segIdx.getSegmentId())) {
        if (existing.getIndexId() == segIdx.getIndexId()
            && existing.getIndexVersion() == segIdx.getIndexVersion()) {
          return completedFuture(false);
        }
      }
      SegmentIndexMeta row = segIdx.toBuilder()
          .setState(IndexState.UNISSUED)
          .setNodeId(0)
          .setDeleted(false)
          .clearIndexFileKeys()
          .setFailReason("")
          .build();
      return persist(kv.save(MetaKeys.segmentIndexKey(row), row.toByteArray()), "add segment index " + row.getBuildId())
          .thenApply(v -> {
            putSegmentIndex(row);
            LOG.debug(
                "segment index added segmentID={} indexID={} buildID={}",
                row.getSegmentId(),
                row.getIndexId(),
                row.getBuildId());
            return true;
          });
    });
  }

  /**
   * Moves a build attempt to {@code newState}, enforcing {@link IndexStates#canTransition}.
   *
   * <p>{@code FINISHED} records the file keys and serialized size; {@code FAILED} records the
   * reason.</p>
   */
  public CompletableFuture<Void> updateState(
      long buildId, IndexState newState, String failReason, List<String> fileKeys, long serializedSize) {
    return withPermit(segmentIndexLock, () -> {
      SegmentIndexMeta row = requireRow(buildId);
      if (!IndexStates.canTransition(row.getState(), newState)) {
        throw IndexBuildException.unexpected(
            "invalid index state transition " + row.getState() + " -> " + newState + " for buildID " + buildId);
      }
      SegmentIndexMeta.Builder b = row.toBuilder().setState(newState);
      switch (newState) {
        case FINISHED:
          b.clearIndexFileKeys()
              .addAllIndexFileKeys(fileKeys == null ? List.of() : fileKeys)
              .setSerializedSize_(serializedSize)
              .setFailReason("");
          break;
        case FAILED:
          b.clearIndexFileKeys().setFailReason(failReason == null ? "" : failReason);
          break;
        default:
          break;
      }
      SegmentIndexMeta updated = b.build();
      if (updated.equals(row)) return completedFuture(null);
      return save(updated, "update state of buildID " + buildId).thenApply(v -> {
        LOG.info("segment index state updated buildID={} {} -> {}", buildId, row.getState(), newState);
        return null;
      });
    });
  }

  /**
   * Records that {@code nodeId} accepted the build: {@code UNISSUED -> IN_PROGRESS} with owner set.
   * Rejected when the row is tombstoned, already owned or not in {@code UNISSUED}.
   */
  public CompletableFuture<Void> assignNode(long buildId, long nodeId) {
    return withPermit(segmentIndexLock, () -> {
      SegmentIndexMeta row = requireRow(buildId);
      if (row.getDeleted() || row.getNodeId() != 0 || row.getState() != IndexState.UNISSUED) {
        throw IndexBuildException.unexpected("segment index buildID " + buildId + " is not assignable, state="
            + row.getState() + " nodeID=" + row.getNodeId() + " deleted=" + row.getDeleted());
      }
      SegmentIndexMeta updated =
          row.toBuilder().setNodeId(nodeId).setState(IndexState.IN_PROGRESS).build();
      return save(updated, "assign buildID " + buildId).thenApply(v -> {
        LOG.info("segment index assigned buildID={} nodeID={}", buildId, nodeId);
        return null;
      });
    });
  }

  /** Clears the worker reference of a build, making it eligible for removal or re-dispatch. */
  public CompletableFuture<Void> releaseNode(long buildId) {
    return withPermit(segmentIndexLock, () -> {
      SegmentIndexMeta row = requireRow(buildId);
      if (row.getNodeId() == 0) return completedFuture(null);
      return save(row.toBuilder().setNodeId(0).build(), "release buildID " + buildId).thenApply(v -> {
        LOG.debug("segment index released buildID={} nodeID={}", buildId, row.getNodeId());
        return null;
      });
    });
  }

  /**
   * Supersedes a build attempt with a new one under {@code newBuildId}.
   *
   * <p>The old row is tombstoned with its owner cleared; the new row starts {@code UNISSUED} at
   * {@code index_version + 1}. Both writes happen in one store transaction.</p>
   *
   * @return future completing with the new row
   */
  public CompletableFuture<SegmentIndexMeta> rebuildSegmentIndex(long buildId, long newBuildId, long createTime) {
    return withPermit(segmentIndexLock, () -> {
      SegmentIndexMeta row = requireRow(buildId);
      if (segmentIndexes.containsKey(newBuildId)) {
        throw IndexBuildException.unexpected("buildID " + newBuildId + " is already in use");
      }
      SegmentIndexMeta retired = row.toBuilder().setDeleted(true).setNodeId(0).build();
      SegmentIndexMeta next = row.toBuilder()
          .setBuildId(newBuildId)
          .setIndexVersion(row.getIndexVersion() + 1)
          .setState(IndexState.UNISSUED)
          .setNodeId(0)
          .setFailReason("")
          .clearIndexFileKeys()
          .setSerializedSize_(0)
          .setDeleted(false)
          .setCreateTime(createTime)
          .build();
      Map<String, byte[]> saves = new LinkedHashMap<>();
      saves.put(MetaKeys.segmentIndexKey(retired), retired.toByteArray());
      saves.put(MetaKeys.segmentIndexKey(next), next.toByteArray());
      return persist(kv.multiSave(saves), "rebuild buildID " + buildId).thenApply(v -> {
        putSegmentIndex(retired);
        putSegmentIndex(next);
        LOG.info(
            "segment index rebuilt segmentID={} indexID={} buildID={} -> {} version={}",
            row.getSegmentId(),
            row.getIndexId(),
            buildId,
            newBuildId,
            next.getIndexVersion());
        return next;
      });
    });
  }

  /** Tombstones every live row of the given segments. */
  public CompletableFuture<Void> markSegmentIndexesDeleted(Collection<Long> segmentIds) {
    return withPermit(segmentIndexLock, () -> {
      Map<String, byte[]> saves = new LinkedHashMap<>();
      List<SegmentIndexMeta> updated = new ArrayList<>();
      for (Long segmentId : segmentIds) {
        for (SegmentIndexMeta row : rowsOf(segmentId)) {
          if (row.getDeleted()) continue;
          SegmentIndexMeta tomb = row.toBuilder().setDeleted(true).build();
          saves.put(MetaKeys.segmentIndexKey(tomb), tomb.toByteArray());
          updated.add(tomb);
        }
      }
      if (saves.isEmpty()) return completedFuture(null);
      return persist(kv.multiSave(saves), "mark segment indexes deleted " + segmentIds).thenApply(v -> {
        updated.forEach(this::putSegmentIndex);
        LOG.info("segment indexes marked deleted segmentIDs={} rows={}", segmentIds, updated.size());
        return null;
      });
    });
  }

  /**
   * Tombstones the live rows of the given indexes that belong to the given partitions. Used when an
   * index is dropped for some partitions only; the index definition stays live.
   */
  public CompletableFuture<Void> markPartitionIndexesDeleted(
      Collection<Long> partitionIds, Collection<Long> indexIds) {
    return withPermit(segmentIndexLock, () -> {
      Set<Long> partitions = new HashSet<>(partitionIds);
      Map<String, byte[]> saves = new LinkedHashMap<>();
      List<SegmentIndexMeta> updated = new ArrayList<>();
      for (Long indexId : indexIds) {
        for (Long buildId : getBuildIdsFromIndexId(indexId)) {
          SegmentIndexMeta row = segmentIndexes.get(buildId);
          if (row == null || row.getDeleted() || !partitions.contains(row.getPartitionId())) continue;
          SegmentIndexMeta tomb = row.toBuilder().setDeleted(true).build();
          saves.put(MetaKeys.segmentIndexKey(tomb), tomb.toByteArray());
          updated.add(tomb);
        }
      }
      if (saves.isEmpty()) return completedFuture(null);
      return persist(kv.multiSave(saves), "mark partition indexes deleted " + partitionIds).thenApply(v -> {
        updated.forEach(this::putSegmentIndex);
        LOG.info(
            "segment indexes marked deleted partitionIDs={} indexIDs={} rows={}",
            partitionIds,
            indexIds,
            updated.size());
        return null;
      });
    });
  }

  /**
   * Physically removes a build attempt. Only tombstoned rows or rows of a deleted index may be
   * removed, and only once no worker owns them ({@code node_id == 0}). Unknown build ids succeed.
   */
  public CompletableFuture<Void> removeSegmentIndex(long buildId) {
    return withPermit(segmentIndexLock, () -> {
      SegmentIndexMeta row = segmentIndexes.get(buildId);
      if (row == null) return completedFuture(null);
      if (!row.getDeleted() && !isIndexDeleted(row.getCollectionId(), row.getIndexId())) {
        throw IndexBuildException.unexpected("segment index buildID " + buildId + " is live, refusing to remove");
      }
      if (row.getNodeId() != 0) {
        throw IndexBuildException.unexpected(
            "segment index buildID " + buildId + " is still owned by node " + row.getNodeId());
      }
      return persist(kv.remove(MetaKeys.segmentIndexKey(row)), "remove segment index " + buildId)
          .thenApply(v -> {
            dropSegmentIndex(row);
            LOG.info("segment index removed buildID={} segmentID={}", buildId, row.getSegmentId());
            return null;
          });
    });
  }

  /** Returns every build id (live or tombstoned) that belongs to the index. */
  public Set<Long> getBuildIdsFromIndexId(long indexId) {
    Set<Long> ids = buildsByIndex.get(indexId);
    return ids == null ? Set.of() : Set.copyOf(ids);
  }

  /** Returns the row for a build id, or {@code null}. */
  public SegmentIndexMeta getSegmentIndexByBuildId(long buildId) {
    return segmentIndexes.get(buildId);
  }

  public boolean hasBuildId(long buildId) {
    return segmentIndexes.containsKey(buildId);
  }

  /** Snapshot of every row, live and tombstoned. */
  public List<SegmentIndexMeta> getAllSegIndexes() {
    return new ArrayList<>(segmentIndexes.values());
  }

  /** Non-deleted rows of a segment. */
  public List<SegmentIndexMeta> getSegmentIndexes(long segmentId) {
    List<SegmentIndexMeta> out = new ArrayList<>();
    for (SegmentIndexMeta row : rowsOf(segmentId)) {
      if (!row.getDeleted()) out.add(row);
    }
    return out;
  }

  /**
   * Current attempt for a segment and index: the non-deleted row with the highest version, or
   * {@code null}.
   */
  public SegmentIndexMeta getSegmentIndex(long segmentId, long indexId) {
    return getSegmentIndexes(segmentId).stream()
        .filter(r -> r.getIndexId() == indexId)
        .max(Comparator.comparingLong(SegmentIndexMeta::getIndexVersion))
        .orElse(null);
  }

  // ============= internals =============

  private List<IndexMeta> liveIndexes(long collectionId) {
    List<IndexMeta> out = new ArrayList<>();
    for (IndexMeta index : indexes.getOrDefault(collectionId, Map.of()).values()) {
      if (!index.getDeleted()) out.add(index);
    }
    return out;
  }

  private List<SegmentIndexMeta> rowsOf(long segmentId) {
    Set<Long> ids = buildsBySegment.get(segmentId);
    if (ids == null) return List.of();
    List<SegmentIndexMeta> out = new ArrayList<>(ids.size());
    for (Long id : ids) {
      SegmentIndexMeta row = segmentIndexes.get(id);
      if (row != null) out.add(row);
    }
    return out;
  }

  private SegmentIndexMeta requireRow(long buildId) {
    SegmentIndexMeta row = segmentIndexes.get(buildId);
    if (row == null) {
      throw IndexBuildException.unexpected("segment index not found for buildID " + buildId);
    }
    return row;
  }

  private CompletableFuture<Void> save(SegmentIndexMeta row, String what) {
    return persist(kv.save(MetaKeys.segmentIndexKey(row), row.toByteArray()), what)
        .thenApply(v -> {
          putSegmentIndex(row);
          return null;
        });
  }

  private void putIndex(IndexMeta index) {
    indexes.computeIfAbsent(index.getCollectionId(), k -> new ConcurrentHashMap<>())
        .put(index.getIndexId(), index);
  }

  private void putSegmentIndex(SegmentIndexMeta row) {
    segmentIndexes.put(row.getBuildId(), row);
    buildsByIndex.computeIfAbsent(row.getIndexId(), k -> ConcurrentHashMap.newKeySet()).add(row.getBuildId());
    buildsBySegment.computeIfAbsent(row.getSegmentId(), k -> ConcurrentHashMap.newKeySet()).add(row.getBuildId());
  }

  private void dropSegmentIndex(SegmentIndexMeta row) {
    segmentIndexes.remove(row.getBuildId());
    Set<Long> byIndex = buildsByIndex.get(row.getIndexId());
    if (byIndex != null) {
      byIndex.remove(row.getBuildId());
      if (byIndex.isEmpty()) buildsByIndex.remove(row.getIndexId(), byIndex);
    }
    Set<Long> bySegment = buildsBySegment.get(row.getSegmentId());
    if (bySegment != null) {
      bySegment.remove(row.getBuildId());
      if (bySegment.isEmpty()) buildsBySegment.remove(row.getSegmentId(), bySegment);
    }
  }

  private static boolean sameDefinition(IndexMeta a, IndexMeta b) {
    return a.getFieldId() == b.getFieldId()
        && toMap(a.getTypeParamsList()).equals(toMap(b.getTypeParamsList()))
        && toMap(a.getIndexParamsList()).equals(toMap(b.getIndexParamsList()));
  }

  private static Map<String, String> toMap(List<KeyValuePair> params) {
    Map<String, String> m = new HashMap<>();
    for (KeyValuePair kv : params) m.put(kv.getKey(), kv.getValue());
    return m;
  }

  private static CompletableFuture<Void> persist(CompletableFuture<Void> write, String what) {
    return write.handle((v, ex) -> {
      if (ex == null) return null;
      Throwable cause = IndexBuildException.unwrap(ex);
      LOG.warn("meta write failed: {}", what, cause);
      throw IndexBuildException.unexpected("failed to persist meta: " + what, cause);
    });
  }

  private static IndexMeta parseIndex(String key, byte[] bytes) {
    try {
      return IndexMeta.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new MetaKvException("corrupt index record at " + key, e);
    }
  }

  private static SegmentIndexMeta parseSegmentIndex(String key, byte[] bytes) {
    try {
      return SegmentIndexMeta.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new MetaKvException("corrupt segment index record at " + key, e);
    }
  }
}
