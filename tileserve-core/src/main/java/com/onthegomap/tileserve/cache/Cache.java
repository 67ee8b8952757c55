package com.onthegomap.tileserve.cache;

import com.onthegomap.tileserve.plugin.PluginSymbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Where rendered tiles get stored and looked up, along with the settings for that storage backend.
 * <p>
 * Builtin backends are selected by {@code name} in a configuration file. {@link Custom} wraps a backend loaded from
 * the classpath by {@code class}.
 */
public sealed interface Cache {

  /** Does not store anything, every tile gets rendered on every request. */
  record Null() implements Cache {}

  /**
   * Does not store anything, but reports what it is asked to do.
   *
   * @param logSink receives one message per cache operation, or {@code null} to stay quiet
   */
  record Test(Consumer<String> logSink) implements Cache {

    public boolean isVerbose() {
      return logSink != null;
    }

    public void log(String message) {
      if (logSink != null) {
        logSink.accept(message);
      }
    }
  }

  /**
   * Stores tiles as files under a local directory.
   *
   * @param path  absolute or working-directory-relative local directory
   * @param umask permission bits to clear on created files and directories
   * @param dirs  directory layout: {@code safe}, {@code portable} or {@code quadtile}
   * @param gzip  file extensions to store gzip-compressed
   */
  record Disk(String path, int umask, String dirs, List<String> gzip) implements Cache {

    public static final int DEFAULT_UMASK = 0022;
    public static final String DEFAULT_DIRS = "safe";
    public static final List<String> DEFAULT_GZIP = List.of("txt", "text", "json", "xml");

    public Disk {
      Objects.requireNonNull(path, "path");
      dirs = dirs == null ? DEFAULT_DIRS : dirs;
      gzip = gzip == null ? DEFAULT_GZIP : List.copyOf(gzip);
    }

    public Disk(String path) {
      this(path, DEFAULT_UMASK, null, null);
    }
  }

  /**
   * Chains several caches together, fastest/smallest first. Reads check each tier in order, writes go to all of them.
   */
  record Multi(List<Cache> tiers) implements Cache {

    public Multi {
      if (tiers == null || tiers.isEmpty()) {
        throw new IllegalArgumentException("Multi cache needs at least one tier");
      }
      tiers = List.copyOf(tiers);
    }
  }

  /**
   * Stores tiles in a memcached cluster.
   *
   * @param servers  {@code host:port} of each server
   * @param lifespan seconds before a stored tile expires, 0 for never
   * @param revision number mixed into every key so that bumping it invalidates everything
   */
  record Memcache(List<String> servers, int lifespan, int revision) implements Cache {

    public static final List<String> DEFAULT_SERVERS = List.of("127.0.0.1:11211");

    public Memcache {
      servers = servers == null ? DEFAULT_SERVERS : List.copyOf(servers);
    }
  }

  /**
   * Stores tiles in an S3 bucket.
   *
   * @param bucket name of the bucket
   * @param access access key id, or {@code null} to use credentials from the environment
   * @param secret secret access key, or {@code null} to use credentials from the environment
   */
  record S3(String bucket, String access, String secret) implements Cache {

    public S3 {
      Objects.requireNonNull(bucket, "bucket");
    }

    @Override
    public String toString() {
      return "S3[bucket=" + bucket + ", access=" + access + ", secret=" + (secret == null ? null : "****") + "]";
    }
  }

  /**
   * A cache implementation loaded from the classpath.
   *
   * @param symbol  what the {@code class} specifier resolved to
   * @param kwargs  parameters the backend was constructed with
   * @param backend the constructed cache backend
   */
  record Custom(PluginSymbol symbol, Map<String, Object> kwargs, Object backend) implements Cache {

    public Custom {
      kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }
  }
}
