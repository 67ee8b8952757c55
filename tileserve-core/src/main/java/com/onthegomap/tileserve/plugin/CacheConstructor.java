package com.onthegomap.tileserve.plugin;

import java.util.Map;

/**
 * Creates a cache backend from the {@code kwargs} of a {@code class} cache configuration.
 * <p>
 * Plugins can expose an instance of this as a public static field instead of a class with a matching constructor.
 */
@FunctionalInterface
public interface CacheConstructor {

  @SuppressWarnings("java:S112")
  Object create(Map<String, Object> kwargs) throws Exception;
}
