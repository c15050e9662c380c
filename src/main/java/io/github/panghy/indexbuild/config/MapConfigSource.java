package io.github.panghy.indexbuild.config;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory {@link ConfigSource} for defaults and programmatic settings. Updates through
 * {@link #put} and {@link #remove} are reported to the installed handler.
 */
public final class MapConfigSource implements ConfigSource {
  private final String name;
  private final int priority;
  private final Map<String, String> values = new ConcurrentHashMap<>();
  private volatile Consumer<ConfigEvent> handler = e -> {};

  public MapConfigSource(String name, int priority, Map<String, String> initial) {
    this.name = name;
    this.priority = priority;
    initial.forEach((k, v) -> values.put(ConfigKeys.normalize(k), v));
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

  public void put(String key, String value) {
    String k = ConfigKeys.normalize(key);
    String previous = values.put(k, value);
    handler.accept(new ConfigEvent(
        name, previous == null ? ConfigEvent.Type.CREATE : ConfigEvent.Type.UPDATE, k, value));
  }

  public void remove(String key) {
    String k = ConfigKeys.normalize(key);
    if (values.remove(k) != null) handler.accept(new ConfigEvent(name, ConfigEvent.Type.DELETE, k, null));
  }

  @Override
  public void close() {}
}
