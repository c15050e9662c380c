package io.github.panghy.indexbuild.kv;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.completedFuture;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.MutationType;
import com.apple.foundationdb.Range;
import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.async.AsyncUtil;
import com.apple.foundationdb.directory.DirectoryLayer;
import com.apple.foundationdb.directory.DirectorySubspace;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.tuple.Tuple;
import io.github.panghy.indexbuild.IndexBuildException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetaKv} stored in FoundationDB under a DirectoryLayer directory.
 *
 * <p>Layout below the directory:
 * <ul>
 *   <li>{@code ("d") + utf8(key)} holds the value for {@code key}. Keys are appended raw so that
 *       string prefixes map to byte prefixes and can be scanned with {@link Range#startsWith}.</li>
 *   <li>{@code ("rev")} is a little-endian counter bumped with an atomic {@code ADD} by every
 *       mutating transaction. Prefix watches are FDB watches on this key followed by a re-read and
 *       diff of the watched prefix.</li>
 * </ul>
 *
 * <p>FoundationDB supplies the linearizability and transactional multi-key writes; this class
 * only maps the string key space onto it. The {@link Database} is owned by the caller.</p>
 */
public final class FdbMetaKv implements MetaKv {
  private static final Logger LOG = LoggerFactory.getLogger(FdbMetaKv.class);

  private static final byte[] ONE = new byte[] {1, 0, 0, 0, 0, 0, 0, 0}; // 1, little-endian
  private static final long WATCH_RETRY_DELAY_MS = 1_000L;

  private final Database db;
  private final DirectorySubspace dir;
  private final byte[] dataPrefix;
  private final byte[] revisionKey;
  private final List<PrefixWatch> watches = new CopyOnWriteArrayList<>();

  public FdbMetaKv(Database db, DirectorySubspace dir) {
    this.db = Objects.requireNonNull(db, "db");
    this.dir = Objects.requireNonNull(dir, "dir");
    this.dataPrefix = dir.get("d").getKey();
    this.revisionKey = dir.pack(Tuple.from("rev"));
  }

  /** Creates (or opens) the directory at {@code path} and returns a store rooted there. */
  public static CompletableFuture<FdbMetaKv> open(Database db, List<String> path) {
    return DirectoryLayer.getDefault().createOrOpen(db, path).thenApply(d -> new FdbMetaKv(db, d));
  }

  /** Returns the directory holding this store. */
  public DirectorySubspace directory() {
    return dir;
  }

  @Override
  public CompletableFuture<byte[]> load(String key) {
    return translate(db.readAsync(tr -> tr.get(dataKey(key))), "load", key);
  }

  @Override
  public CompletableFuture<NavigableMap<String, byte[]>> loadWithPrefix(String prefix) {
    return translate(
        db.readAsync(tr -> tr.getRange(Range.startsWith(dataKey(prefix))).asList())
            .thenApply(this::toMap),
        "loadWithPrefix",
        prefix);
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
  public CompletableFuture<Void> removeWithPrefix(String prefix) {
    return translate(
        db.runAsync(tr -> {
          tr.clear(Range.startsWith(dataKey(prefix)));
          bumpRevision(tr);
          return completedFuture(null);
        }),
        "removeWithPrefix",
        prefix);
  }

  @Override
  public CompletableFuture<Void> multiSaveAndRemove(Map<String, byte[]> saves, Collection<String> removals) {
    return translate(
        db.runAsync(tr -> {
          for (Map.Entry<String, byte[]> e : saves.entrySet()) {
            tr.set(dataKey(e.getKey()), Objects.requireNonNull(e.getValue(), "value"));
          }
          for (String key : removals) {
            tr.clear(dataKey(key));
          }
          bumpRevision(tr);
          return completedFuture(null);
        }),
        "multiSaveAndRemove",
        saves.size() + " saves/" + removals.size() + " removals");
  }

  @Override
  public CompletableFuture<Boolean> compareAndSwap(String key, byte[] expected, byte[] value) {
    return translate(
        db.runAsync(tr -> tr.get(dataKey(key)).thenApply(current -> {
          boolean matches = expected == null ? current == null : Arrays.equals(current, expected);
          if (!matches) return false;
          tr.set(dataKey(key), value);
          bumpRevision(tr);
          return true;
        })),
        "compareAndSwap",
        key);
  }

  @Override
  public Watch watchWithPrefix(String prefix, Consumer<WatchEvent> listener) {
    PrefixWatch w = new PrefixWatch(prefix, listener);
    watches.add(w);
    w.start();
    return () -> {
      w.stop();
      watches.remove(w);
    };
  }

  @Override
  public void close() {
    for (PrefixWatch w : watches) {
      w.stop();
    }
    watches.clear();
  }

  private byte[] dataKey(String key) {
    return ByteArrayUtil.join(dataPrefix, key.getBytes(UTF_8));
  }

  private NavigableMap<String, byte[]> toMap(List<KeyValue> kvs) {
    TreeMap<String, byte[]> out = new TreeMap<>();
    for (KeyValue kv : kvs) {
      byte[] raw = kv.getKey();
      out.put(new String(raw, dataPrefix.length, raw.length - dataPrefix.length, UTF_8), kv.getValue());
    }
    return out;
  }

  private void bumpRevision(Transaction tr) {
    tr.mutate(MutationType.ADD, revisionKey, ONE);
  }

  private static <T> CompletableFuture<T> translate(CompletableFuture<T> f, String op, String what) {
    return f.handle((v, ex) -> {
      if (ex == null) return v;
      Throwable cause = IndexBuildException.unwrap(ex);
      if (cause instanceof MetaKvException mke) throw mke;
      throw new MetaKvException(op + " failed for " + what, cause);
    });
  }

  /**
   * Snapshot of a prefix read in the same transaction that armed the watch, so no commit between
   * the read and the watch can be missed.
   */
  private record Armed(NavigableMap<String, byte[]> snapshot, CompletableFuture<Void> trigger) {}

  private final class PrefixWatch {
    private final String prefix;
    private final Consumer<WatchEvent> listener;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final AtomicReference<CompletableFuture<Void>> pending = new AtomicReference<>();
    private NavigableMap<String, byte[]> last;

    PrefixWatch(String prefix, Consumer<WatchEvent> listener) {
      this.prefix = prefix;
      this.listener = listener;
    }

    void start() {
      AsyncUtil.whileTrue(() -> {
            if (!active.get()) return completedFuture(false);
            return arm().thenCompose(armed -> {
                  if (last != null) diff(last, armed.snapshot());
                  last = armed.snapshot();
                  pending.set(armed.trigger());
                  return active.get() ? armed.trigger() : CompletableFuture.<Void>completedFuture(null);
                })
                .handle((v, ex) -> {
                  if (ex != null && active.get()) {
                    LOG.warn("watch on prefix={} failed, re-arming", prefix, IndexBuildException.unwrap(ex));
                    return CompletableFuture.supplyAsync(
                        () -> true,
                        CompletableFuture.delayedExecutor(WATCH_RETRY_DELAY_MS, TimeUnit.MILLISECONDS));
                  }
                  return completedFuture(active.get());
                })
                .thenCompose(f -> f);
          })
          .whenComplete((v, ex) -> LOG.debug("watch on prefix={} stopped", prefix));
    }

    void stop() {
      active.set(false);
      CompletableFuture<Void> p = pending.get();
      if (p != null) p.cancel(true);
    }

    private CompletableFuture<Armed> arm() {
      return db.runAsync(tr -> {
        CompletableFuture<Void> trigger = tr.watch(revisionKey);
        return tr.getRange(Range.startsWith(dataKey(prefix)))
            .asList()
            .thenApply(kvs -> new Armed(toMap(kvs), trigger));
      });
    }

    private void diff(NavigableMap<String, byte[]> before, NavigableMap<String, byte[]> after) {
      for (Map.Entry<String, byte[]> e : after.entrySet()) {
        byte[] old = before.get(e.getKey());
        if (old == null || !Arrays.equals(old, e.getValue())) {
          emit(new WatchEvent(EventType.PUT, e.getKey(), e.getValue()));
        }
      }
      for (String key : before.keySet()) {
        if (!after.containsKey(key)) emit(new WatchEvent(EventType.DELETE, key, null));
      }
    }

    private void emit(WatchEvent event) {
      try {
        listener.accept(event);
      } catch (RuntimeException ex) {
        LOG.warn("watch listener failed prefix={} key={}", prefix, event.key(), ex);
      }
    }
  }
}
