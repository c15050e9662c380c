package io.github.panghy.indexbuild.broker;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal object storage client used for index files.
 *
 * <p>Keys are {@code /}-separated paths. A non-recursive listing returns the immediate children of
 * a prefix, with "directories" reported as keys ending in {@code /}; a recursive listing returns
 * every object key below the prefix.</p>
 */
public interface ObjectStore {

  /** Root path under which this store keeps its objects. */
  String rootPath();

  CompletableFuture<Void> write(String key, byte[] data);

  /** Reads an object; completes exceptionally if it does not exist. */
  CompletableFuture<byte[]> read(String key);

  CompletableFuture<List<String>> listWithPrefix(String prefix, boolean recursive);

  /** Removes an object. Removing a missing object succeeds. */
  CompletableFuture<Void> remove(String key);

  /** Removes every object whose key starts with {@code prefix}. */
  CompletableFuture<Void> removeWithPrefix(String prefix);
}
