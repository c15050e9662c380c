package io.github.panghy.indexbuild.meta;

import io.github.panghy.indexbuild.proto.IndexState;

/**
 * Transition rules for {@link IndexState}.
 *
 * <p>{@code UNISSUED -> IN_PROGRESS -> {FINISHED, FAILED}}. Transitions only move forward (skipping
 * a step is allowed, e.g. tiny segments finish without a build) and re-reporting the current state
 * is accepted. There is no backward edge: a retry is a new attempt under a new build id, see
 * {@link MetaTable#rebuildSegmentIndex}.</p>
 */
public final class IndexStates {
  private IndexStates() {}

  public static boolean isTerminal(IndexState state) {
    return state == IndexState.FINISHED || state == IndexState.FAILED;
  }

  public static boolean canTransition(IndexState from, IndexState to) {
    if (from == IndexState.UNRECOGNIZED || to == IndexState.UNRECOGNIZED) return false;
    if (to == IndexState.INDEX_STATE_NONE) return false;
    if (from == to) return true;
    if (isTerminal(from)) return false;
    return rank(to) > rank(from);
  }

  private static int rank(IndexState state) {
    switch (state) {
      case UNISSUED:
        return 1;
      case IN_PROGRESS:
        return 2;
      case FINISHED:
      case FAILED:
        return 3;
      default:
        return 0;
    }
  }
}
