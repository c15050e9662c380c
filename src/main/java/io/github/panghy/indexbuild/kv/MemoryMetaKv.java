package io.github.panghy.indexbuild.kv;

import static java.util.concurrent.CompletableFuture.completedFuture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link MetaKv} backed by a sorted map.
 *
 * <p>Used for embedded single-process deployments and tests. All operations complete
 * synchronously. Watch listeners are invoked on the writing thread while the store lock is held,
 * so they observe changes in commit order and must not call back into the store.</p>
 */
public class MemoryMetaKv implements MetaKv {
  private static final Logger LOG = LoggerFactory.getLogger(MemoryMetaKv.class);

  private final TreeMap<String, byte[]> data = new TreeMap<>();
  private final List<PrefixWatch> watches = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  @Override
  public synchronized CompletableFuture<byte[]> load(String key) {
    if (closed) return closedFailure();
    byte[] v = data.get(key);
    return completedFuture(v == null ? null : v.clone());
  }

  @Override
  public synchronized CompletableFuture<NavigableMap<String, byte[]>> loadWithPrefix(String prefix) {
    if (closed) return closedFailure();
    TreeMap<String, byte[]> out = new TreeMap<>();
    for (Map.Entry<String, byte[]> e : prefixView(prefix).entrySet()) {
      out.put(e.getKey(), e.getValue().clone());
    }
    return completedFuture(out);
  }

  @Override
  public CompletableFuture<Void> save(String key, byte[] value) {
    return multiSaveAndRemove(Map.of(key, value), List.of());
  }

  @Override
  public CompletableFuture<Void> multiSave(Map<String, byte[]> kvs) {
    return multiSaveAndRemove(kvs, List.of());
  }

  @Override
  public CompletableFuture<Void> remove(String key) {
    return multiSaveAndRemove(Map.of(), List.of(key));
  }

  @Override
  public CompletableFuture<Void> multiRemove(Collection<String> keys) {
    return multiSaveAndRemove(Map.of(), keys);
  }

  @Override
  public synchronized CompletableFuture<Void> removeWithPrefix(String prefix) {
    if (closed) return closedFailure();
    List<WatchEvent> events = new ArrayList<>();
    NavigableMap<String, byte[]> view = prefixView(prefix);
    for (String key : view.keySet()) {
      events.add(new WatchEvent(EventType.DELETE, key, null));
    }
    view.clear();
    publish(events);
    return completedFuture(null);
  }

  @Override
  public synchronized CompletableFuture<Void> multiSaveAndRemove(
      Map<String, byte[]> saves, Collection<String> removals) {
    if (closed) return closedFailure();
    List<WatchEvent> events = new ArrayList<>(saves.size() + removals.size());
    for (Map.Entry<String, byte[]> e : saves.entrySet()) {
      byte[] v = Objects.requireNonNull(e.getValue(), "value").clone();
      data.put(e.getKey(), v);
      events.add(new WatchEvent(EventType.PUT, e.getKey(), v.clone()));
    }
    for (String key : removals) {
      if (data.remove(key) != null) {
        events.add(new WatchEvent(EventType.DELETE, key, null));
      }
    }
    publish(events);
    return completedFuture(null);
  }

  @Override
  public synchronized CompletableFuture<Boolean> compareAndSwap(String key, byte[] expected, byte[] value) {
    if (closed) return closedFailure();
    byte[] current = data.get(key);
    boolean matches = expected == null ? current == null : Arrays.equals(current, expected);
    if (!matches) return completedFuture(false);
    data.put(key, value.clone());
    publish(List.of(new WatchEvent(EventType.PUT, key, value.clone())));
    return completedFuture(true);
  }

  @Override
  public Watch watchWithPrefix(String prefix, Consumer<WatchEvent> listener) {
    PrefixWatch w = new PrefixWatch(prefix, listener);
    watches.add(w);
    return () -> watches.remove(w);
  }

  @Override
  public void close() {
    closed = true;
    watches.clear();
  }

  /** Number of stored keys; test visibility only. */
  public synchronized int size() {
    return data.size();
  }

  private NavigableMap<String, byte[]> prefixView(String prefix) {
    if (prefix.isEmpty()) return data;
    return data.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
  }

  private void publish(List<WatchEvent> events) {
    if (events.isEmpty() || watches.isEmpty()) return;
    for (PrefixWatch w : watches) {
      for (WatchEvent e : events) {
        if (!e.key().startsWith(w.prefix)) continue;
        try {
          w.listener.accept(e);
        } catch (RuntimeException ex) {
          LOG.warn("watch listener failed prefix={} key={}", w.prefix, e.key(), ex);
        }
      }
    }
  }

  private static <T> CompletableFuture<T> closedFailure() {
    return CompletableFuture.failedFuture(new MetaKvException("meta kv is closed"));
  }

  private record PrefixWatch(String prefix, Consumer<WatchEvent> listener) {}
}
