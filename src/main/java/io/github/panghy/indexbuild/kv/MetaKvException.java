package io.github.panghy.indexbuild.kv;

/**
 * Raised when the durable metadata store cannot complete a read or write.
 */
public class MetaKvException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MetaKvException(String message) {
    super(message);
  }

  public MetaKvException(String message, Throwable cause) {
    super(message, cause);
  }
}
