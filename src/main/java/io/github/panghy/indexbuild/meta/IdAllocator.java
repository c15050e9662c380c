package io.github.panghy.indexbuild.meta;

import java.util.concurrent.CompletableFuture;

/**
 * Source of globally unique, never reused ids for indexes and build attempts.
 */
public interface IdAllocator {

  /** Allocates one id. Ids are positive and strictly increasing per allocator. */
  CompletableFuture<Long> allocateId();
}
