package io.github.panghy.indexbuild.util;

import com.ibm.asyncutil.locks.AsyncSemaphore;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Helpers for running asynchronous critical sections under an {@link AsyncSemaphore}.
 */
public final class AsyncLocks {

  private AsyncLocks() {}

  /**
   * Runs {@code body} once a permit is acquired and releases it when the returned future
   * completes. A {@link RuntimeException} thrown synchronously by {@code body} fails the future.
   */
  public static <T> CompletableFuture<T> withPermit(AsyncSemaphore lock, Supplier<CompletableFuture<T>> body) {
    return lock.acquire()
        .toCompletableFuture()
        .thenCompose(permit -> {
          try {
            return body.get();
          } catch (RuntimeException e) {
            return CompletableFuture.<T>failedFuture(e);
          }
        })
        .whenComplete((v, ex) -> lock.release());
  }
}
