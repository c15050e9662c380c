package io.github.panghy.indexbuild.meta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.IndexMeta;
import io.github.panghy.indexbuild.proto.IndexState;
import io.github.panghy.indexbuild.proto.KeyValuePair;
import io.github.panghy.indexbuild.proto.SegmentIndexMeta;
import io.github.panghy.indexbuild.testutil.FailingMetaKv;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetaTable}: index uniqueness, the segment-index state machine, tombstones and
 * write-through persistence.
 */
class MetaTableTest {
  static final long COLL = 1L;
  static final long FIELD = 10L;

  FailingMetaKv kv;
  MetaTable meta;

  @BeforeEach
  void setup() throws Exception {
    kv = new FailingMetaKv();
    meta = MetaTable.load(kv).get(5, TimeUnit.SECONDS);
  }

  static IndexMeta index(long indexId, long fieldId, String name, String indexType) {
    return IndexMeta.newBuilder()
        .setCollectionId(COLL)
        .setFieldId(fieldId)
        .setIndexId(indexId)
        .setIndexName(name)
        .addTypeParams(KeyValuePair.newBuilder().setKey("dim").setValue("128"))
        .addIndexParams(KeyValuePair.newBuilder().setKey("index_type").setValue(indexType))
        .build();
  }

  static SegmentIndexMeta segIdx(long segmentId, long indexId, long buildId) {
    return SegmentIndexMeta.newBuilder()
        .setCollectionId(COLL)
        .setPartitionId(2)
        .setSegmentId(segmentId)
        .setNumRows(10250)
        .setIndexId(indexId)
        .setBuildId(buildId)
        .setIndexVersion(1)
        .build();
  }

  static ErrorCode codeOf(ExecutionException e) {
    return ((IndexBuildException) IndexBuildException.unwrap(e)).getErrorCode();
  }

  @Test
  void create_index_is_idempotent_for_same_definition() throws Exception {
    long id = meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    long again = meta.createIndex(index(101, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    assertThat(id).isEqualTo(100);
    assertThat(again).isEqualTo(100);
    assertThat(meta.getIndexes(COLL)).hasSize(1);
  }

  @Test
  void create_index_with_different_params_fails_and_keeps_original() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.createIndex(index(101, FIELD, "idx", "HNSW")).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .satisfies(e -> assertThat(codeOf((ExecutionException) e)).isEqualTo(ErrorCode.ALREADY_EXISTS));

    assertThat(meta.getIndex(COLL, 100).getIndexParams(0).getValue()).isEqualTo("IVF_FLAT");
    assertThat(meta.getIndex(COLL, 101)).isNull();
  }

  @Test
  void second_index_on_same_field_is_rejected() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.createIndex(index(101, FIELD, "other", "IVF_FLAT")).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .satisfies(e -> assertThat(codeOf((ExecutionException) e)).isEqualTo(ErrorCode.ALREADY_EXISTS));
  }

  @Test
  void name_can_be_reused_after_drop() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.markIndexDeleted(COLL, 100L, false).get(5, TimeUnit.SECONDS);

    long id = meta.createIndex(index(101, FIELD, "idx", "HNSW")).get(5, TimeUnit.SECONDS);

    assertThat(id).isEqualTo(101);
    assertThat(meta.getIndexIdByName(COLL, "idx")).containsExactly(101L);
    assertThat(meta.getDeletedIndexes()).extracting(IndexMeta::getIndexId).containsExactly(100L);
  }

  @Test
  void empty_name_resolves_every_live_index() throws Exception {
    meta.createIndex(index(100, FIELD, "a", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.createIndex(index(101, FIELD + 1, "b", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    assertThat(meta.getIndexIdByName(COLL, "")).containsExactlyInAnyOrder(100L, 101L);
    assertThat(meta.getIndexIdByName(COLL, "a")).containsExactly(100L);
    assertThat(meta.getIndexIdByName(COLL, "missing")).isEmpty();
  }

  @Test
  void drop_all_twice_succeeds() throws Exception {
    meta.createIndex(index(100, FIELD, "a", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.createIndex(index(101, FIELD + 1, "b", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    meta.markIndexDeleted(COLL, null, true).get(5, TimeUnit.SECONDS);
    meta.markIndexDeleted(COLL, null, true).get(5, TimeUnit.SECONDS);

    assertThat(meta.getIndexes(COLL)).isEmpty();
    assertThat(meta.isIndexDeleted(COLL, 100)).isTrue();
    assertThat(meta.isIndexDeleted(COLL, 101)).isTrue();
  }

  @Test
  void add_segment_index_starts_unissued_and_is_idempotent() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);

    assertThat(meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(meta.addSegmentIndex(segIdx(7, 100, 1001)).get(5, TimeUnit.SECONDS)).isFalse();

    SegmentIndexMeta row = meta.getSegmentIndex(7, 100);
    assertThat(row.getBuildId()).isEqualTo(1000);
    assertThat(row.getState()).isEqualTo(IndexState.UNISSUED);
    assertThat(row.getNodeId()).isZero();
    assertThat(meta.hasBuildId(1001)).isFalse();
  }

  @Test
  void state_moves_forward_only() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);
    meta.updateState(1000, IndexState.FINISHED, "", List.of("a", "b"), 42).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.updateState(1000, IndexState.IN_PROGRESS, "", List.of(), 0)
            .get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IndexBuildException.class);

    SegmentIndexMeta row = meta.getSegmentIndexByBuildId(1000);
    assertThat(row.getState()).isEqualTo(IndexState.FINISHED);
    assertThat(row.getIndexFileKeysList()).containsExactly("a", "b");
    assertThat(row.getSerializedSize_()).isEqualTo(42);
    assertThat(row.getNodeId()).isEqualTo(5);
  }

  @Test
  void failed_attempt_is_retried_under_a_new_build_id() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);
    meta.updateState(1000, IndexState.FAILED, "oom", List.of(), 0).get(5, TimeUnit.SECONDS);
    meta.releaseNode(1000).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.updateState(1000, IndexState.UNISSUED, "", List.of(), 0).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);
    assertThat(meta.getSegmentIndexByBuildId(1000).getState()).isEqualTo(IndexState.FAILED);

    SegmentIndexMeta retry = meta.rebuildSegmentIndex(1000, 1001, 0).get(5, TimeUnit.SECONDS);

    assertThat(retry.getBuildId()).isEqualTo(1001);
    assertThat(retry.getState()).isEqualTo(IndexState.UNISSUED);
    assertThat(retry.getFailReason()).isEmpty();
    assertThat(retry.getIndexVersion()).isEqualTo(2);
    assertThat(meta.getSegmentIndexByBuildId(1000).getDeleted()).isTrue();
    assertThat(meta.getSegmentIndex(7, 100).getBuildId()).isEqualTo(1001);
  }

  @Test
  void assign_rejects_owned_rows() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.assignNode(1000, 6).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);
    assertThat(meta.getSegmentIndexByBuildId(1000).getNodeId()).isEqualTo(5);
  }

  @Test
  void rebuild_tombstones_old_attempt_and_bumps_version() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);

    SegmentIndexMeta next = meta.rebuildSegmentIndex(1000, 2000, 99).get(5, TimeUnit.SECONDS);

    assertThat(next.getBuildId()).isEqualTo(2000);
    assertThat(next.getIndexVersion()).isEqualTo(2);
    assertThat(next.getState()).isEqualTo(IndexState.UNISSUED);
    assertThat(next.getCreateTime()).isEqualTo(99);
    SegmentIndexMeta old = meta.getSegmentIndexByBuildId(1000);
    assertThat(old.getDeleted()).isTrue();
    assertThat(old.getNodeId()).isZero();
    assertThat(meta.getSegmentIndex(7, 100).getBuildId()).isEqualTo(2000);
    assertThat(meta.getBuildIdsFromIndexId(100)).containsExactlyInAnyOrder(1000L, 2000L);
  }

  @Test
  void remove_segment_index_refuses_live_or_owned_rows() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.removeSegmentIndex(1000).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);

    meta.markSegmentIndexesDeleted(List.of(7L)).get(5, TimeUnit.SECONDS);
    assertThatThrownBy(() -> meta.removeSegmentIndex(1000).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);

    meta.releaseNode(1000).get(5, TimeUnit.SECONDS);
    meta.removeSegmentIndex(1000).get(5, TimeUnit.SECONDS);
    assertThat(meta.hasBuildId(1000)).isFalse();
    assertThat(meta.getBuildIdsFromIndexId(100)).isEmpty();
  }

  @Test
  void remove_index_requires_tombstone_and_no_rows() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> meta.removeIndex(COLL, 100).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);

    meta.markIndexDeleted(COLL, List.of(100L)).get(5, TimeUnit.SECONDS);
    assertThatThrownBy(() -> meta.removeIndex(COLL, 100).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);

    // rows of a deleted index are garbage even without their own tombstone
    meta.removeSegmentIndex(1000).get(5, TimeUnit.SECONDS);
    meta.removeIndex(COLL, 100).get(5, TimeUnit.SECONDS);
    assertThat(meta.getIndex(COLL, 100)).isNull();
  }

  @Test
  void partition_drop_tombstones_only_that_partition() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(8, 100, 1001).toBuilder().setPartitionId(3).build()).get(5, TimeUnit.SECONDS);

    meta.markPartitionIndexesDeleted(List.of(3L), List.of(100L)).get(5, TimeUnit.SECONDS);

    assertThat(meta.getSegmentIndex(7, 100)).isNotNull();
    assertThat(meta.getSegmentIndex(8, 100)).isNull();
    assertThat(meta.isIndexDeleted(COLL, 100)).isFalse();
  }

  @Test
  void state_survives_reload() throws Exception {
    meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS);

    MetaTable reloaded = MetaTable.load(kv).get(5, TimeUnit.SECONDS);

    assertThat(reloaded.getIndexIdByName(COLL, "idx")).containsExactly(100L);
    SegmentIndexMeta row = reloaded.getSegmentIndexByBuildId(1000);
    assertThat(row.getState()).isEqualTo(IndexState.IN_PROGRESS);
    assertThat(row.getNodeId()).isEqualTo(5);
  }

  @Test
  void segment_index_rows_are_keyed_under_their_index() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(8, 100, 1001)).get(5, TimeUnit.SECONDS);
    meta.addSegmentIndex(segIdx(7, 200, 2000)).get(5, TimeUnit.SECONDS);

    assertThat(kv.loadWithPrefix(MetaKeys.segmentIndexPrefix(COLL, 100)).get(5, TimeUnit.SECONDS))
        .containsOnlyKeys("segment-indexes/1/100/1000", "segment-indexes/1/100/1001");

    meta.rebuildSegmentIndex(1000, 1002, 0).get(5, TimeUnit.SECONDS);

    assertThat(kv.loadWithPrefix(MetaKeys.segmentIndexPrefix(COLL, 100)).get(5, TimeUnit.SECONDS))
        .containsOnlyKeys("segment-indexes/1/100/1000", "segment-indexes/1/100/1001", "segment-indexes/1/100/1002");
  }

  @Test
  void failed_write_leaves_mirror_untouched() throws Exception {
    meta.addSegmentIndex(segIdx(7, 100, 1000)).get(5, TimeUnit.SECONDS);
    kv.failWrites(true);

    assertThatThrownBy(() -> meta.assignNode(1000, 5).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .satisfies(e -> assertThat(codeOf((ExecutionException) e)).isEqualTo(ErrorCode.UNEXPECTED_ERROR));
    assertThatThrownBy(() -> meta.createIndex(index(100, FIELD, "idx", "IVF_FLAT")).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class);

    SegmentIndexMeta row = meta.getSegmentIndexByBuildId(1000);
    assertThat(row.getState()).isEqualTo(IndexState.UNISSUED);
    assertThat(row.getNodeId()).isZero();
    assertThat(meta.getIndexes(COLL)).isEmpty();
  }
}
