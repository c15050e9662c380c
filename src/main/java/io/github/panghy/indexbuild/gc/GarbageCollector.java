package io.github.panghy.indexbuild.gc;

import static io.github.panghy.indexbuild.util.AsyncLocks.withPermit;
import static java.util.concurrent.CompletableFuture.completedFuture;

import com.ibm.asyncutil.locks.AsyncSemaphore;
import com.ibm.asyncutil.locks.FairAsyncSemaphore;
import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.broker.IndexFilePaths;
import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.broker.SegmentBroker;
import io.github.panghy.indexbuild.coord.IndexCoordinatorConfig;
import io.github.panghy.indexbuild.meta.IndexStates;
import io.github.panghy.indexbuild.meta.MetaTable;
import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;
import io.github.panghy.indexbuild.proto.SegmentInfo;
import io.github.panghy.indexbuild.util.BuildMetrics;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reclaims index metadata and index files that are no longer referenced.
 *
 * <p>Three independent passes run on a private scheduler:</p>
 * <ul>
 *   <li>{@link #recycleUnusedIndexes()} removes tombstoned indexes once their segment rows are gone,
 *   and removes those segment rows as soon as no worker owns them;</li>
 *   <li>{@link #recycleSegIndexesMeta()} tombstones rows of segments the segment authority no longer
 *   reports as flushed and removes tombstoned rows that no worker owns;</li>
 *   <li>{@link #recycleUnusedIndexFiles()} deletes build directories unknown to the metadata and, for
 *   settled builds, every file that is not one of the recorded index files.</li>
 * </ul>
 *
 * <p>Rows still referenced by a worker ({@code node_id != 0}) are never removed. A failure on one
 * item is logged and the pass moves on; the item is retried on the next pass. At most one run of
 * each pass is in flight; a run requested meanwhile starts when the current one completes.</p>
 */
public final class GarbageCollector implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(GarbageCollector.class);

  static final String KIND_INDEX = "index";
  static final String KIND_SEGMENT_INDEX = "segment-index";
  static final String KIND_FILE = "file";
  static final String KIND_BUILD_FILES = "build-files";

  private final IndexCoordinatorConfig config;
  private final MetaTable meta;
  private final SegmentBroker broker;
  private final ObjectStore objectStore;
  private final BuildMetrics metrics;
  private final AtomicBoolean started = new AtomicBoolean();
  private final ScheduledThreadPoolExecutor scheduler;
  private final AsyncSemaphore indexesLock = new FairAsyncSemaphore(1);
  private final AsyncSemaphore segIndexesLock = new FairAsyncSemaphore(1);
  private final AsyncSemaphore filesLock = new FairAsyncSemaphore(1);

  public GarbageCollector(
      IndexCoordinatorConfig config,
      MetaTable meta,
      SegmentBroker broker,
      ObjectStore objectStore,
      BuildMetrics metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.meta = Objects.requireNonNull(meta, "meta");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "indexbuild-gc");
      t.setDaemon(true);
      return t;
    });
  }

  public void start() {
    if (!started.compareAndSet(false, true)) return;
    long metaMs = config.getGcMetaInterval().toMillis();
    long fileMs = config.getGcInterval().toMillis();
    scheduler.scheduleWithFixedDelay(
        () -> run("unused indexes", recycleUnusedIndexes()), metaMs, metaMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(
        () -> run("segment index meta", recycleSegIndexesMeta()), metaMs, metaMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(
        () -> run("index files", recycleUnusedIndexFiles()), fileMs, fileMs, TimeUnit.MILLISECONDS);
    LOG.info("garbage collector started metaInterval={} fileInterval={}",
        config.getGcMetaInterval(), config.getGcInterval());
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    LOG.info("garbage collector stopped");
  }

  private static void run(String what, CompletableFuture<Integer> pass) {
    pass.whenComplete((n, e) -> {
      if (e != null) {
        LOG.warn("garbage collection of {} failed", what, IndexBuildException.unwrap(e));
      } else {
        LOG.debug("garbage collection of {} done removed={}", what, n);
      }
    });
  }

  /**
   * Removes tombstoned indexes whose segment rows are all gone, and the released segment rows of
   * tombstoned indexes.
   *
   * @return future completing with the number of rows removed
   */
  public CompletableFuture<Integer> recycleUnusedIndexes() {
    return withPermit(indexesLock, this::recycleUnusedIndexesPass);
  }

  private CompletableFuture<Integer> recycleUnusedIndexesPass() {
    AtomicInteger removed = new AtomicInteger();
    CompletableFuture<Void> chain = completedFuture(null);
    for (IndexMeta index : meta.getDeletedIndexes()) {
      chain = chain.thenCompose(v -> {
        Set<Long> buildIds = meta.getBuildIdsFromIndexId(index.getIndexId());
        if (buildIds.isEmpty()) {
          return logged(
              meta.removeIndex(index.getCollectionId(), index.getIndexId()).thenAccept(x -> {
                removed.incrementAndGet();
                metrics.gcRemoved(KIND_INDEX, 1);
                LOG.info("index removed collectionID={} indexID={}", index.getCollectionId(), index.getIndexId());
              }),
              "remove index " + index.getIndexId());
        }
        return removeReleased(buildIds, removed);
      });
    }
    return chain.thenApply(v -> removed.get());
  }

  /**
   * Tombstones rows of segments that are no longer flushed, then removes every tombstoned row (or
   * row of a deleted index) that no worker owns.
   *
   * @return future completing with the number of rows removed
   */
  public CompletableFuture<Integer> recycleSegIndexesMeta() {
    return withPermit(segIndexesLock, this::recycleSegIndexesMetaPass);
  }

  private CompletableFuture<Integer> recycleSegIndexesMetaPass() {
    Map<Long, Set<Long>> segmentsByCollection = new TreeMap<>();
    for (SegmentIndexMeta row : meta.getAllSegIndexes()) {
      if (row.getDeleted()) continue;
      segmentsByCollection
          .computeIfAbsent(row.getCollectionId(), k -> new HashSet<>())
          .add(row.getSegmentId());
    }
    CompletableFuture<Void> chain = completedFuture(null);
    for (Map.Entry<Long, Set<Long>> e : segmentsByCollection.entrySet()) {
      long collectionId = e.getKey();
      chain = chain.thenCompose(v -> logged(
          markVanishedSegments(collectionId, e.getValue()), "check flushed segments of collection " + collectionId));
    }
    AtomicInteger removed = new AtomicInteger();
    return chain
        .thenCompose(v -> {
          Set<Long> garbage = new HashSet<>();
          for (SegmentIndexMeta row : meta.getAllSegIndexes()) {
            if (row.getDeleted() || meta.isIndexDeleted(row.getCollectionId(), row.getIndexId())) {
              garbage.add(row.getBuildId());
            }
          }
          return removeReleased(garbage, removed);
        })
        .thenApply(v -> removed.get());
  }

  private CompletableFuture<Void> markVanishedSegments(long collectionId, Set<Long> segmentIds) {
    return broker.getFlushedSegments(collectionId, SegmentBroker.ALL_PARTITIONS).thenCompose(flushed -> {
      Set<Long> present = new HashSet<>();
      for (SegmentInfo s : flushed) present.add(s.getId());
      List<Long> vanished = new ArrayList<>();
      for (Long segmentId : segmentIds) {
        if (!present.contains(segmentId)) vanished.add(segmentId);
      }
      if (vanished.isEmpty()) return completedFuture(null);
      LOG.info("segments no longer exist, marking their indexes deleted collectionID={} segmentIDs={}",
          collectionId, vanished);
      return meta.markSegmentIndexesDeleted(vanished);
    });
  }

  private CompletableFuture<Void> removeReleased(Set<Long> buildIds, AtomicInteger removed) {
    CompletableFuture<Void> chain = completedFuture(null);
    for (Long buildId : buildIds) {
      chain = chain.thenCompose(v -> {
        SegmentIndexMeta row = meta.getSegmentIndexByBuildId(buildId);
        // owned rows wait until the dispatcher releases them
        if (row == null || row.getNodeId() != 0) return completedFuture(null);
        return logged(
            meta.removeSegmentIndex(buildId).thenAccept(x -> {
              removed.incrementAndGet();
              metrics.gcRemoved(KIND_SEGMENT_INDEX, 1);
            }),
            "remove segment index " + buildId);
      });
    }
    return chain;
  }

  /**
   * Reconciles object storage with the metadata. Build directories unknown to the metadata are
   * removed entirely; for a settled build ({@code FINISHED} or {@code FAILED}, released) every file
   * that is not a recorded index file is removed. Builds still in flight are left alone.
   *
   * @return future completing with the number of objects or build directories removed
   */
  public CompletableFuture<Integer> recycleUnusedIndexFiles() {
    return withPermit(filesLock, this::recycleUnusedIndexFilesPass);
  }

  private CompletableFuture<Integer> recycleUnusedIndexFilesPass() {
    String root = objectStore.rootPath();
    String prefix = IndexFilePaths.indexFilePrefix(root) + "/";
    AtomicInteger removedBuilds = new AtomicInteger();
    AtomicInteger removedFiles = new AtomicInteger();
    return objectStore.listWithPrefix(prefix, false)
        .thenCompose(keys -> {
          CompletableFuture<Void> chain = completedFuture(null);
          for (String key : keys) {
            chain = chain.thenCompose(v -> logged(
                recycleBuildFiles(root, key, removedBuilds, removedFiles), "recycle files of " + key));
          }
          return chain;
        })
        .thenApply(v -> {
          metrics.gcRemoved(KIND_BUILD_FILES, removedBuilds.get());
          metrics.gcRemoved(KIND_FILE, removedFiles.get());
          return removedBuilds.get() + removedFiles.get();
        });
  }

  private CompletableFuture<Void> recycleBuildFiles(
      String root, String key, AtomicInteger removedBuilds, AtomicInteger removedFiles) {
    long buildId;
    try {
      buildId = IndexFilePaths.parseBuildId(key);
    } catch (IllegalArgumentException e) {
      LOG.warn("unexpected key under index files, skipping key={}", key);
      return completedFuture(null);
    }
    if (!meta.hasBuildId(buildId)) {
      LOG.info("build no longer exists in meta, removing index files buildID={} prefix={}", buildId, key);
      return objectStore.removeWithPrefix(key).thenAccept(v -> removedBuilds.incrementAndGet());
    }
    SegmentIndexMeta row = meta.getSegmentIndexByBuildId(buildId);
    if (row == null || row.getNodeId() != 0 || !IndexStates.isTerminal(row.getState())) {
      LOG.debug("build is still in flight, keeping its files buildID={}", buildId);
      return completedFuture(null);
    }
    Set<String> expected = new HashSet<>();
    for (String fileKey : row.getIndexFileKeysList()) {
      expected.add(IndexFilePaths.filePath(
          root, row.getBuildId(), row.getIndexVersion(), row.getPartitionId(), row.getSegmentId(), fileKey));
    }
    return objectStore.listWithPrefix(key, true).thenCompose(files -> {
      CompletableFuture<Void> chain = completedFuture(null);
      int before = removedFiles.get();
      for (String file : files) {
        if (expected.contains(file)) continue;
        chain = chain.thenCompose(v -> logged(
            objectStore.remove(file).thenAccept(x -> removedFiles.incrementAndGet()), "remove index file " + file));
      }
      return chain.thenAccept(v -> LOG.info(
          "index files recycled buildID={} metaFiles={} storedFiles={} removed={}",
          buildId,
          expected.size(),
          files.size(),
          removedFiles.get() - before));
    });
  }

  private static CompletableFuture<Void> logged(CompletableFuture<Void> step, String what) {
    return step.exceptionally(e -> {
      LOG.warn("garbage collector failed to {}, will retry", what, IndexBuildException.unwrap(e));
      return null;
    });
  }
}
