package io.github.panghy.indexbuild;

import io.github.panghy.indexbuild.proto.ErrorCode;
import io.github.panghy.indexbuild.proto.Status;

/**
 * Builders for the {@link Status} carried by every response.
 */
public final class Statuses {
  /** Reason reported by a worker for a job it already holds. */
  public static final String DUPLICATED_TASK = "duplicated index build task";

  private static final Status SUCCESS = Status.newBuilder().setErrorCode(ErrorCode.SUCCESS).build();

  private Statuses() {}

  public static Status success() {
    return SUCCESS;
  }

  public static Status of(ErrorCode code, String reason) {
    return Status.newBuilder().setErrorCode(code).setReason(reason == null ? "" : reason).build();
  }

  /**
   * Translates a failure into a status: {@link IndexBuildException}s keep their code, anything else
   * becomes {@code UNEXPECTED_ERROR}.
   */
  public static Status fromThrowable(Throwable t) {
    Throwable cause = IndexBuildException.unwrap(t);
    if (cause instanceof IndexBuildException ibe) return of(ibe.getErrorCode(), ibe.getMessage());
    String reason = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    return of(ErrorCode.UNEXPECTED_ERROR, reason);
  }

  public static boolean isSuccess(Status status) {
    return status.getErrorCode() == ErrorCode.SUCCESS;
  }

  /** True when a worker rejected a job because it already holds it. */
  public static boolean isDuplicatedTask(Status status) {
    return status.getErrorCode() == ErrorCode.BUILD_INDEX_ERROR && DUPLICATED_TASK.equals(status.getReason());
  }
}
