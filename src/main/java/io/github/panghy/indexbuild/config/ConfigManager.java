package io.github.panghy.indexbuild.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges several {@link ConfigSource}s into one view of string configuration.
 *
 * <p>Each key resolves to the source with the numerically lowest priority that defines it; on
 * equal priority the source registered first keeps the key. Runtime overlays set through
 * {@link #setConfig} take precedence over every source; {@link #deleteConfig} hides a key until
 * {@link #resetConfig} removes the overlay again.</p>
 *
 * <p>Change events from sources are resolved against the current owner of the key: events from a
 * lower-priority source than the owner are ignored, deletes hand the key to the next best source.
 * Accepted events are forwarded to listeners after the manager lock is released.</p>
 *
 * <p>Keys are case-insensitive.</p>
 */
public final class ConfigManager implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigManager.class);

  static final String TOMB_VALUE = "__TOMB__";

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  // all guarded by lock
  private final Map<String, ConfigSource> sources = new LinkedHashMap<>();
  private final Map<String, String> keySource = new HashMap<>();
  private final Map<String, String> overlays = new HashMap<>();

  private final List<Consumer<ConfigEvent>> listeners = new CopyOnWriteArrayList<>();

  /**
   * Adds a source and resolves its keys against the existing ones.
   *
   * @throws IllegalArgumentException if a source with the same name was already added
   */
  public void addSource(ConfigSource source) {
    lock.writeLock().lock();
    try {
      if (sources.containsKey(source.name())) {
        throw new IllegalArgumentException("duplicate config source: " + source.name());
      }
      sources.put(source.name(), source);
      for (String key : source.getConfigurations().keySet()) {
        String k = ConfigKeys.normalize(key);
        String owner = keySource.get(k);
        if (owner == null || !sources.containsKey(owner) || sources.get(owner).priority() > source.priority()) {
          keySource.put(k, source.name());
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    source.setEventHandler(this::onEvent);
    LOG.info("config source added name={} priority={}", source.name(), source.priority());
  }

  /** Registers a listener for accepted configuration changes. */
  public void addListener(Consumer<ConfigEvent> listener) {
    listeners.add(listener);
  }

  /** Resolved value of a key, honoring overlays. */
  public Optional<String> getConfig(String key) {
    String k = ConfigKeys.normalize(key);
    lock.readLock().lock();
    try {
      String overlay = overlays.get(k);
      if (overlay != null) {
        return TOMB_VALUE.equals(overlay) ? Optional.empty() : Optional.of(overlay);
      }
      String owner = keySource.get(k);
      if (owner == null) return Optional.empty();
      ConfigSource source = sources.get(owner);
      return source == null ? Optional.empty() : Optional.ofNullable(source.get(k));
    } finally {
      lock.readLock().unlock();
    }
  }

  public String getString(String key, String defaultValue) {
    return getConfig(key).orElse(defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    return getConfig(key).map(v -> parse(key, v, Integer::parseInt)).orElse(defaultValue);
  }

  public long getLong(String key, long defaultValue) {
    return getConfig(key).map(v -> parse(key, v, Long::parseLong)).orElse(defaultValue);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return getConfig(key).map(v -> Boolean.parseBoolean(v.trim())).orElse(defaultValue);
  }

  /**
   * Reads a duration given either as an ISO-8601 string ({@code PT10S}) or as a number of
   * {@code unitIfNumber} units.
   */
  public Duration getDuration(String key, Duration unitIfNumber, Duration defaultValue) {
    Optional<String> v = getConfig(key);
    if (v.isEmpty()) return defaultValue;
    String s = v.get().trim();
    if (s.startsWith("P") || s.startsWith("p")) return parse(key, s, Duration::parse);
    return unitIfNumber.multipliedBy(parse(key, s, Long::parseLong));
  }

  /**
   * Returns the resolved entries whose keys pass every filter. A filter returns the (possibly
   * rewritten) key to keep the entry or {@code null} to drop it.
   */
  @SafeVarargs
  public final Map<String, String> getBy(UnaryOperator<String>... filters) {
    Map<String, String> out = new HashMap<>();
    for (Map.Entry<String, String> e : getConfigs().entrySet()) {
      String key = e.getKey();
      for (UnaryOperator<String> f : filters) {
        key = f.apply(key);
        if (key == null) break;
      }
      if (key != null) out.put(key, e.getValue());
    }
    return out;
  }

  /** Keeps keys starting with {@code prefix}. */
  public static UnaryOperator<String> withPrefix(String prefix) {
    String p = ConfigKeys.normalize(prefix);
    return k -> k.startsWith(p) ? k : null;
  }

  /** Keeps keys containing {@code substring}. */
  public static UnaryOperator<String> withSubstring(String substring) {
    String s = ConfigKeys.normalize(substring);
    return k -> k.contains(s) ? k : null;
  }

  /** Strips the first occurrence of {@code prefix} from keys. */
  public static UnaryOperator<String> removePrefix(String prefix) {
    String p = ConfigKeys.normalize(prefix);
    return k -> k.startsWith(p) ? k.substring(p.length()) : k;
  }

  /** Every resolved entry, overlays applied. */
  public Map<String, String> getConfigs() {
    lock.readLock().lock();
    try {
      Map<String, String> out = new HashMap<>();
      for (Map.Entry<String, String> e : keySource.entrySet()) {
        ConfigSource source = sources.get(e.getValue());
        String v = source == null ? null : source.get(e.getKey());
        if (v != null) out.put(e.getKey(), v);
      }
      for (Map.Entry<String, String> e : overlays.entrySet()) {
        if (TOMB_VALUE.equals(e.getValue())) {
          out.remove(e.getKey());
        } else {
          out.put(e.getKey(), e.getValue());
        }
      }
      return out;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Overrides a key at runtime, above every source. */
  public void setConfig(String key, String value) {
    withWriteLock(() -> overlays.put(ConfigKeys.normalize(key), value));
  }

  /** Hides a key at runtime until {@link #resetConfig} is called. */
  public void deleteConfig(String key) {
    withWriteLock(() -> overlays.put(ConfigKeys.normalize(key), TOMB_VALUE));
  }

  /** Drops a runtime overlay so the key resolves from its sources again. */
  public void resetConfig(String key) {
    withWriteLock(() -> overlays.remove(ConfigKeys.normalize(key)));
  }

  @Override
  public void close() {
    List<ConfigSource> toClose;
    lock.readLock().lock();
    try {
      toClose = new ArrayList<>(sources.values());
    } finally {
      lock.readLock().unlock();
    }
    for (ConfigSource s : toClose) s.close();
  }

  void onEvent(ConfigEvent event) {
    ConfigEvent accepted;
    lock.writeLock().lock();
    try {
      accepted = resolve(event);
    } finally {
      lock.writeLock().unlock();
    }
    if (accepted == null) return;
    LOG.debug("config changed source={} type={} key={}", accepted.source(), accepted.type(), accepted.key());
    for (Consumer<ConfigEvent> l : listeners) {
      try {
        l.accept(accepted);
      } catch (RuntimeException e) {
        LOG.warn("config listener failed for key={}", accepted.key(), e);
      }
    }
  }

  private ConfigEvent resolve(ConfigEvent event) {
    String key = ConfigKeys.normalize(event.key());
    String owner = keySource.get(key);
    switch (event.type()) {
      case CREATE:
      case UPDATE:
        if (owner == null) {
          keySource.put(key, event.source());
          return event.withType(ConfigEvent.Type.CREATE);
        }
        if (owner.equals(event.source())) return event.withType(ConfigEvent.Type.UPDATE);
        ConfigSource current = sources.get(owner);
        ConfigSource incoming = sources.get(event.source());
        if (incoming == null || (current != null && current.priority() <= incoming.priority())) {
          LOG.info("ignoring change of key={} from source={}, owned by {}", key, event.source(), owner);
          return null;
        }
        keySource.put(key, event.source());
        return event.withType(ConfigEvent.Type.UPDATE);
      case DELETE:
        if (owner == null || !owner.equals(event.source())) {
          LOG.info("ignoring delete of key={} from source={}, owned by {}", key, event.source(), owner);
          return null;
        }
        ConfigSource next = nextBestSource(key, owner);
        if (next == null) {
          keySource.remove(key);
          return event;
        }
        keySource.put(key, next.name());
        return new ConfigEvent(next.name(), ConfigEvent.Type.UPDATE, key, next.get(key));
      default:
        return null;
    }
  }

  private ConfigSource nextBestSource(String key, String excluded) {
    ConfigSource best = null;
    for (ConfigSource s : sources.values()) {
      if (s.name().equals(excluded) || s.get(key) == null) continue;
      if (best == null || s.priority() < best.priority()) best = s;
    }
    return best;
  }

  private void withWriteLock(Runnable r) {
    lock.writeLock().lock();
    try {
      r.run();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private static <T> T parse(String key, String value, java.util.function.Function<String, T> parser) {
    try {
      return parser.apply(value.trim());
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("invalid value for config " + key + ": " + value, e);
    }
  }
}
