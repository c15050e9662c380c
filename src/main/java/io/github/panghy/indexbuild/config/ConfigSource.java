package io.github.panghy.indexbuild.config;

import java.util.Map;
import java.util.function.Consumer;

/**
 * A named, prioritized provider of string configuration.
 *
 * <p>When several sources define a key the one with the numerically lowest priority wins.</p>
 */
public interface ConfigSource extends AutoCloseable {

  String name();

  int priority();

  /** Snapshot of every key this source currently defines. */
  Map<String, String> getConfigurations();

  /** Value of one key, or {@code null} if this source does not define it. */
  String get(String key);

  /** Installs the callback receiving this source's change events. */
  void setEventHandler(Consumer<ConfigEvent> handler);

  @Override
  void close();
}
