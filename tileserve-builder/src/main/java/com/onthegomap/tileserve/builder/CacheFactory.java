package com.onthegomap.tileserve.builder;

import static com.onthegomap.tileserve.builder.ConfigValues.json;

import com.onthegomap.tileserve.cache.Cache;
import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.plugin.PluginSymbol;
import com.onthegomap.tileserve.util.Parse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Cache} from the {@code "cache"} section of a configuration.
 * <p>
 * The section selects a builtin cache with {@code "name"} ({@code "null"}, {@code "test"}, {@code "disk"},
 * {@code "multi"}, {@code "memcache"} or {@code "s3"}) or a plugin with {@code "class"} and optional {@code "kwargs"}.
 */
public class CacheFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheFactory.class);
  private static final Logger TEST_CACHE_LOGGER = LoggerFactory.getLogger(Cache.Test.class);

  private CacheFactory() {}

  /**
   * Returns the cache described by {@code spec}.
   *
   * @param spec    the cache section
   * @param dirPath directory or URL the configuration came from, used to resolve relative disk cache paths
   * @throws ConfigurationException if the section does not describe a valid cache
   */
  public static Cache build(Map<String, Object> spec, String dirPath) {
    if (spec.containsKey("name")) {
      String name = String.valueOf(spec.get("name"));
      Cache cache = switch (name.strip().toLowerCase(Locale.ROOT)) {
        case "null" -> new Cache.Null();
        case "test" -> test(spec);
        case "disk" -> disk(spec, dirPath);
        case "multi" -> multi(spec, dirPath);
        case "memcache" -> memcache(spec);
        case "s3" -> s3(spec);
        default -> throw new ConfigurationException("Unknown cache: " + name);
      };
      LOGGER.debug("Built {} cache: {}", name, cache);
      return cache;
    } else if (spec.containsKey("class")) {
      return custom(spec);
    }
    throw new ConfigurationException("Missing required cache name or class: " + json(spec));
  }

  private static Cache test(Map<String, Object> spec) {
    boolean verbose = Parse.bool(spec.get("verbose"));
    return new Cache.Test(verbose ? TEST_CACHE_LOGGER::info : null);
  }

  private static Cache disk(Map<String, Object> spec, String dirPath) {
    String path = PathResolver.enforcedLocalPath(
      ConfigValues.requireString(spec, "path", "disk cache"), dirPath, "Disk cache path");
    int umask = spec.containsKey("umask") ? Parse.octal(spec.get("umask")) : Cache.Disk.DEFAULT_UMASK;
    String dirs = spec.containsKey("dirs") ? (String) spec.get("dirs") : Cache.Disk.DEFAULT_DIRS;
    List<String> gzip = spec.containsKey("gzip") ? strings((List<?>) spec.get("gzip")) : Cache.Disk.DEFAULT_GZIP;
    return new Cache.Disk(path, umask, dirs, gzip);
  }

  private static Cache multi(Map<String, Object> spec, String dirPath) {
    Object tiers = ConfigValues.require(spec, "tiers", "multi cache");
    if (!(tiers instanceof List<?> list)) {
      throw new ConfigurationException("Multi cache tiers must be a list, not: " + json(tiers));
    } else if (list.isEmpty()) {
      throw new ConfigurationException("Multi cache needs at least one tier: " + json(spec));
    }
    List<Cache> result = new ArrayList<>(list.size());
    for (Object tier : list) {
      result.add(build(ConfigValues.asMap(tier, "Multi cache tier"), dirPath));
    }
    return new Cache.Multi(result);
  }

  private static Cache memcache(Map<String, Object> spec) {
    List<String> servers = spec.containsKey("servers") ? strings((List<?>) spec.get("servers")) :
      Cache.Memcache.DEFAULT_SERVERS;
    int lifespan = spec.containsKey("lifespan") ? Parse.toInt(spec.get("lifespan")) : 0;
    int revision = spec.containsKey("revision") ? Parse.toInt(spec.get("revision")) : 0;
    return new Cache.Memcache(servers, lifespan, revision);
  }

  private static Cache s3(Map<String, Object> spec) {
    return new Cache.S3(
      ConfigValues.requireString(spec, "bucket", "s3 cache"),
      ConfigValues.getString(spec, "access"),
      ConfigValues.getString(spec, "secret")
    );
  }

  private static Cache custom(Map<String, Object> spec) {
    PluginSymbol symbol = ClassPathLoader.resolve(String.valueOf(spec.get("class")));
    Map<String, Object> kwargs = ConfigValues.getMap(spec, "kwargs", "Cache kwargs");
    Object backend = symbol.newCache(kwargs);
    LOGGER.debug("Built cache {} from {}", backend, symbol.specifier());
    return new Cache.Custom(symbol, kwargs, backend);
  }

  private static List<String> strings(List<?> values) {
    return values.stream().map(String::valueOf).toList();
  }
}
