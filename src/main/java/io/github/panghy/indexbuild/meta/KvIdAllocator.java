package io.github.panghy.indexbuild.meta;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.ibm.asyncutil.locks.AsyncSemaphore;
import com.ibm.asyncutil.locks.FairAsyncSemaphore;
import io.github.panghy.indexbuild.IndexBuildException;
import io.github.panghy.indexbuild.kv.MetaKv;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdAllocator} that reserves batches of ids from a high-water mark stored in a
 * {@link MetaKv}.
 *
 * <p>Each reservation advances the mark with compare-and-swap so that concurrent coordinators
 * never hand out the same id. Ids left in a batch when the process dies are skipped, never
 * reused. Contention is retried up to {@code maxAttempts} times before the allocation fails with
 * {@code UNEXPECTED_ERROR}.</p>
 */
public final class KvIdAllocator implements IdAllocator {
  private static final Logger LOG = LoggerFactory.getLogger(KvIdAllocator.class);

  private final MetaKv kv;
  private final String key;
  private final int batchSize;
  private final int maxAttempts;
  private final AsyncSemaphore reserveLock = new FairAsyncSemaphore(1);

  // next id to hand out and the exclusive end of the reserved batch; guarded by reserveLock
  private long next;
  private long end;

  public KvIdAllocator(MetaKv kv) {
    this(kv, MetaKeys.ID_ALLOCATOR_KEY, 200, 5);
  }

  public KvIdAllocator(MetaKv kv, String key, int batchSize, int maxAttempts) {
    this.kv = Objects.requireNonNull(kv, "kv");
    this.key = Objects.requireNonNull(key, "key");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
    this.batchSize = batchSize;
    this.maxAttempts = maxAttempts;
  }

  @Override
  public CompletableFuture<Long> allocateId() {
    return reserveLock.acquire()
        .toCompletableFuture()
        .thenCompose(permit -> {
          if (next < end) return completedFuture(next++);
          return reserve(1).thenApply(start -> {
            next = start;
            end = start + batchSize;
            return next++;
          });
        })
        .whenComplete((v, ex) -> reserveLock.release());
  }

  private CompletableFuture<Long> reserve(int attempt) {
    return kv.load(key).thenCompose(current -> {
      long start = current == null ? 1L : ByteArrayUtil.decodeInt(current);
      byte[] updated = ByteArrayUtil.encodeInt(start + batchSize);
      return kv.compareAndSwap(key, current, updated).thenCompose(swapped -> {
        if (swapped) {
          LOG.debug("reserved id batch [{}, {})", start, start + batchSize);
          return completedFuture(start);
        }
        if (attempt >= maxAttempts) {
          throw IndexBuildException.unexpected(
              "failed to allocate ids after " + maxAttempts + " attempts: concurrent updates on " + key);
        }
        return reserve(attempt + 1);
      });
    });
  }
}
