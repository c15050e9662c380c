package io.github.panghy.indexbuild.meta;

import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;

/**
 * Key scheme for metadata rows in the {@link io.github.panghy.indexbuild.kv.MetaKv}.
 *
 * <ul>
 *   <li>{@code indexes/<collectionID>/<indexID>}</li>
 *   <li>{@code segment-indexes/<collectionID>/<indexID>/<buildID>}</li>
 *   <li>{@code ids/next}</li>
 * </ul>
 *
 * <p>Segment-index rows sort under their index, so every attempt of one index can be listed or
 * removed by prefix.</p>
 */
public final class MetaKeys {
  public static final String INDEX_PREFIX = "indexes/";
  public static final String SEGMENT_INDEX_PREFIX = "segment-indexes/";
  public static final String ID_ALLOCATOR_KEY = "ids/next";

  private MetaKeys() {}

  public static String indexKey(long collectionId, long indexId) {
    return INDEX_PREFIX + collectionId + "/" + indexId;
  }

  public static String indexKey(IndexMeta index) {
    return indexKey(index.getCollectionId(), index.getIndexId());
  }

  public static String segmentIndexKey(long collectionId, long indexId, long buildId) {
    return segmentIndexPrefix(collectionId, indexId) + buildId;
  }

  public static String segmentIndexKey(SegmentIndexMeta segIdx) {
    return segmentIndexKey(segIdx.getCollectionId(), segIdx.getIndexId(), segIdx.getBuildId());
  }

  /** Prefix covering every segment-index row of one index. */
  public static String segmentIndexPrefix(long collectionId, long indexId) {
    return SEGMENT_INDEX_PREFIX + collectionId + "/" + indexId + "/";
  }
}
