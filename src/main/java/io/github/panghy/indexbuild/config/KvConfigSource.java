package io.github.panghy.indexbuild.config;

import io.github.panghy.indexbuild.kv.MetaKv;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConfigSource} reading UTF-8 values stored under a prefix of a {@link MetaKv}. The key of
 * an entry is its store key with the prefix removed; a prefix watch keeps the view current.
 */
public final class KvConfigSource implements ConfigSource {
  private static final Logger LOG = LoggerFactory.getLogger(KvConfigSource.class);

  private final String name;
  private final int priority;
  private final String prefix;
  private final Map<String, String> values = new ConcurrentHashMap<>();
  private volatile Consumer<ConfigEvent> handler = e -> {};
  private volatile MetaKv.Watch watch;

  private KvConfigSource(String name, int priority, String prefix) {
    this.name = name;
    this.priority = priority;
    this.prefix = prefix;
  }

  /** Loads the prefix and starts watching it. */
  public static CompletableFuture<KvConfigSource> open(MetaKv kv, String prefix, String name, int priority) {
    Objects.requireNonNull(kv, "kv");
    KvConfigSource source = new KvConfigSource(name, priority, Objects.requireNonNull(prefix, "prefix"));
    return kv.loadWithPrefix(prefix).thenApply(entries -> {
      entries.forEach((k, v) -> source.values.put(source.localKey(k), new String(v, StandardCharsets.UTF_8)));
      source.watch = kv.watchWithPrefix(prefix, source::onWatchEvent);
      LOG.info("kv config source opened name={} prefix={} keys={}", name, prefix, source.values.size());
      return source;
    });
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int priority() {
    return priority;
  }

  @Override
  public Map<String, String> getConfigurations() {
    return new HashMap<>(values);
  }

  @Override
  public String get(String key) {
    return values.get(ConfigKeys.normalize(key));
  }

  @Override
  public void setEventHandler(Consumer<ConfigEvent> handler) {
    this.handler = handler;
  }

  @Override
  public void close() {
    MetaKv.Watch w = watch;
    if (w != null) w.close();
  }

  private void onWatchEvent(MetaKv.WatchEvent event) {
    String key = localKey(event.key());
    if (event.type() == MetaKv.EventType.DELETE) {
      if (values.remove(key) != null) handler.accept(new ConfigEvent(name, ConfigEvent.Type.DELETE, key, null));
      return;
    }
    String value = new String(event.value(), StandardCharsets.UTF_8);
    String previous = values.put(key, value);
    if (value.equals(previous)) return;
    handler.accept(new ConfigEvent(
        name, previous == null ? ConfigEvent.Type.CREATE : ConfigEvent.Type.UPDATE, key, value));
  }

  private String localKey(String storeKey) {
    return ConfigKeys.normalize(storeKey.substring(prefix.length()));
  }
}
