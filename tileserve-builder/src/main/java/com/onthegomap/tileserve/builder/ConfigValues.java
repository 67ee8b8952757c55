package com.onthegomap.tileserve.builder;

import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.util.YAML;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for reading fields out of the loosely-typed maps produced by parsing a JSON or YAML configuration.
 */
class ConfigValues {

  private ConfigValues() {}

  /**
   * Returns {@code value} as a map with string keys.
   *
   * @throws ConfigurationException if {@code value} is not a map
   */
  static Map<String, Object> asMap(Object value, String what) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new ConfigurationException(what + " must be an object, not: " + json(value));
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (var entry : map.entrySet()) {
      result.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return result;
  }

  /** Returns the object under {@code key}, or an empty map if it is missing. */
  static Map<String, Object> getMap(Map<String, Object> spec, String key, String what) {
    Object value = spec.get(key);
    return value == null ? Map.of() : asMap(value, what);
  }

  /** Returns the value under {@code key} as a string, or {@code null} if it is missing. */
  static String getString(Map<String, Object> spec, String key) {
    Object value = spec.get(key);
    return value == null ? null : value.toString();
  }

  /**
   * Returns the value under {@code key} as a string.
   *
   * @throws ConfigurationException if it is missing
   */
  static String requireString(Map<String, Object> spec, String key, String what) {
    return require(spec, key, what).toString();
  }

  /**
   * Returns the value under {@code key}.
   *
   * @throws ConfigurationException if it is missing
   */
  static Object require(Map<String, Object> spec, String key, String what) {
    Object value = spec.get(key);
    if (value == null) {
      throw new ConfigurationException("Missing required \"" + key + "\" for " + what + ": " + json(spec));
    }
    return value;
  }

  static String json(Object value) {
    return YAML.toJson(value);
  }
}
