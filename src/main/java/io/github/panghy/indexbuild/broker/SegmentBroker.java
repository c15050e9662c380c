package io.github.panghy.indexbuild.broker;

import io.github.panghy.indexbuild.proto.SegmentInfo;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Call boundary to the authority that owns segment existence and flush state.
 */
public interface SegmentBroker {

  /** Partition id meaning every partition of the collection. */
  long ALL_PARTITIONS = -1L;

  /**
   * Lists the flushed segments of a collection that have not been dropped or compacted away.
   *
   * @param partitionId a partition id, or {@link #ALL_PARTITIONS}
   */
  CompletableFuture<List<SegmentInfo>> getFlushedSegments(long collectionId, long partitionId);

  /** Looks up segments by id; ids the authority does not know are omitted from the result. */
  CompletableFuture<List<SegmentInfo>> getSegmentInfo(Collection<Long> segmentIds);
}
