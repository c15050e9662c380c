package io.github.panghy.indexbuild;

import io.github.panghy.indexbuild.proto.ErrorCode;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Unchecked exception carrying the {@link ErrorCode} that is reported to callers.
 *
 * <p>Caller errors (param mismatch, ambiguous names, missing indexes) and state-machine rejections
 * are raised with this type. Service handlers translate it into a {@code Status} instead of
 * propagating it.</p>
 */
public class IndexBuildException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;

  public IndexBuildException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public IndexBuildException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /** Returns the error code reported for this failure. */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public static IndexBuildException alreadyExists(String message) {
    return new IndexBuildException(ErrorCode.ALREADY_EXISTS, message);
  }

  public static IndexBuildException indexNotExist(String message) {
    return new IndexBuildException(ErrorCode.INDEX_NOT_EXIST, message);
  }

  public static IndexBuildException unexpected(String message) {
    return new IndexBuildException(ErrorCode.UNEXPECTED_ERROR, message);
  }

  public static IndexBuildException unexpected(String message, Throwable cause) {
    return new IndexBuildException(ErrorCode.UNEXPECTED_ERROR, message, cause);
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by futures.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable c = t;
    while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
      c = c.getCause();
    }
    return c;
  }
}
