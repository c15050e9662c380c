package io.github.panghy.indexbuild.config;

/**
 * Change of one configuration key reported by a {@link ConfigSource}.
 *
 * @param source name of the source that produced the change
 * @param type   kind of change
 * @param key    normalized key
 * @param value  new value, {@code null} for deletes
 */
public record ConfigEvent(String source, Type type, String key, String value) {

  public enum Type {
    CREATE,
    UPDATE,
    DELETE
  }

  ConfigEvent withType(Type newType) {
    return new ConfigEvent(source, newType, key, value);
  }
}
