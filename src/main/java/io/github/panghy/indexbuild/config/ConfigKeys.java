package io.github.panghy.indexbuild.config;

import java.util.Locale;

/**
 * Key normalization shared by the configuration sources and the manager.
 */
final class ConfigKeys {
  private ConfigKeys() {}

  static String normalize(String key) {
    return key.trim().toLowerCase(Locale.ROOT);
  }
}
