package io.github.panghy.indexbuild.kv;

import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Durable, linearizable key-value store holding coordinator metadata.
 *
 * <p>Keys are UTF-8 strings laid out hierarchically with {@code /} separators so that related rows
 * can be listed and removed by prefix. Values are opaque bytes (serialized protobuf records).
 * Every multi-key mutation is applied atomically. Failures complete the returned future
 * exceptionally with {@link MetaKvException}.</p>
 */
public interface MetaKv extends AutoCloseable {

  /** Loads a single value, completing with {@code null} when the key is absent. */
  CompletableFuture<byte[]> load(String key);

  /** Loads every key starting with {@code prefix}, ordered by key. */
  CompletableFuture<NavigableMap<String, byte[]>> loadWithPrefix(String prefix);

  CompletableFuture<Void> save(String key, byte[] value);

  /** Saves all entries in one transaction. */
  CompletableFuture<Void> multiSave(Map<String, byte[]> kvs);

  CompletableFuture<Void> remove(String key);

  /** Removes all keys in one transaction. */
  CompletableFuture<Void> multiRemove(Collection<String> keys);

  CompletableFuture<Void> removeWithPrefix(String prefix);

  /** Applies {@code saves} and {@code removals} in one transaction. */
  CompletableFuture<Void> multiSaveAndRemove(Map<String, byte[]> saves, Collection<String> removals);

  /**
   * Atomically replaces the value of {@code key} with {@code value} if its current value equals
   * {@code expected} ({@code null} meaning absent).
   *
   * @return future completing with {@code true} when the swap happened
   */
  CompletableFuture<Boolean> compareAndSwap(String key, byte[] expected, byte[] value);

  /**
   * Registers a listener for changes below {@code prefix}. Events are delivered in commit order
   * per watch; a watch never reports changes that happened before it was registered.
   */
  Watch watchWithPrefix(String prefix, Consumer<WatchEvent> listener);

  @Override
  void close();

  /** Kind of change reported by a watch. */
  enum EventType {
    PUT,
    DELETE
  }

  /** A single key change; {@code value} is {@code null} for deletions. */
  record WatchEvent(EventType type, String key, byte[] value) {}

  /** Handle for a registered watch. */
  interface Watch extends AutoCloseable {
    @Override
    void close();
  }
}
