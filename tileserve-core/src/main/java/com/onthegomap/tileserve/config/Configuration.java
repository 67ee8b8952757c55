package com.onthegomap.tileserve.config;

import com.onthegomap.tileserve.cache.Cache;
import java.util.Objects;
import java.util.function.Function;

/**
 * A complete tile service: one {@link Cache} shared by every layer, and the collection of {@link Layers} it serves.
 * <p>
 * Instances are never modified after construction. To pick up configuration changes, build a new one and discard the
 * old one.
 */
public class Configuration {

  private final Cache cache;
  private final String dirPath;
  private final Layers layers;

  /**
   * Creates a configuration whose layers are created by {@code layersFactory}, which receives the configuration itself
   * so that each layer can refer back to it.
   * <p>
   * {@link #layers()} returns {@code null} until {@code layersFactory} completes.
   *
   * @param cache         the cache for every layer
   * @param dirPath       local directory or URL the configuration was read from, used to resolve relative paths
   * @param layersFactory creates the layers of this configuration
   */
  public Configuration(Cache cache, String dirPath, Function<Configuration, ? extends Layers> layersFactory) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.dirPath = Objects.requireNonNull(dirPath, "dirPath");
    this.layers = Objects.requireNonNull(layersFactory.apply(this), "layers");
  }

  public Cache cache() {
    return cache;
  }

  public String dirPath() {
    return dirPath;
  }

  public Layers layers() {
    return layers;
  }

  @Override
  public String toString() {
    return "Configuration{cache=" + cache + ", dirPath='" + dirPath + "', layers=" + layers + '}';
  }
}
