package io.github.panghy.indexbuild.worker;

import io.github.panghy.indexbuild.broker.IndexFilePaths;
import io.github.panghy.indexbuild.broker.ObjectStore;
import io.github.panghy.indexbuild.proto.CreateJobRequest;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Everything an {@link IndexBuilder} needs for one build attempt.
 */
public final class BuildContext {
  private final CreateJobRequest request;
  private final ObjectStore objectStore;
  private final BooleanSupplier cancelled;

  BuildContext(CreateJobRequest request, ObjectStore objectStore, BooleanSupplier cancelled) {
    this.request = request;
    this.objectStore = objectStore;
    this.cancelled = cancelled;
  }

  public CreateJobRequest request() {
    return request;
  }

  public ObjectStore objectStore() {
    return objectStore;
  }

  /** True once the coordinator dropped the job. */
  public boolean isCancelled() {
    return cancelled.getAsBoolean();
  }

  /** Object key of an index file of this build attempt. */
  public String filePath(String fileKey) {
    return IndexFilePaths.filePath(
        objectStore.rootPath(),
        request.getBuildId(),
        request.getIndexVersion(),
        request.getPartitionId(),
        request.getSegmentId(),
        fileKey);
  }

  /** Writes one index file of this build attempt. */
  public CompletableFuture<Void> writeFile(String fileKey, byte[] data) {
    return objectStore.write(filePath(fileKey), data);
  }
}
