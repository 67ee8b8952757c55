package com.onthegomap.tileserve.builder;

import com.onthegomap.tileserve.cache.Cache;
import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.config.StaticLayers;
import com.onthegomap.tileserve.layer.Layer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the parsed contents of a configuration file into a {@link Configuration}.
 * <p>
 * The configuration has a {@code "cache"} section, built by {@link CacheFactory}, and a {@code "layers"} section
 * mapping layer names to layer sections, built by {@link LayerFactory} in the order they appear.
 */
public class ConfigurationBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationBuilder.class);

  private ConfigurationBuilder() {}

  /** Returns the configuration described by {@code spec}, resolving relative paths against the working directory. */
  public static Configuration build(Map<String, Object> spec) {
    return build(spec, ".");
  }

  /**
   * Returns the configuration described by {@code spec}.
   *
   * @param spec    parsed configuration
   * @param dirPath directory or URL the configuration came from, used to resolve relative paths
   * @throws ConfigurationException if any part of the configuration is invalid
   */
  public static Configuration build(Map<String, Object> spec, String dirPath) {
    Map<String, Object> cacheSpec = ConfigValues.getMap(spec, "cache", "Configuration cache");
    Map<String, Object> layersSpec = ConfigValues.getMap(spec, "layers", "Configuration layers");

    Cache cache = CacheFactory.build(cacheSpec, dirPath);
    Configuration config = new Configuration(cache, dirPath, self -> {
      Map<String, Layer> layers = new LinkedHashMap<>();
      for (var entry : layersSpec.entrySet()) {
        String name = entry.getKey();
        LOGGER.debug("Building layer {}", name);
        layers.put(name, LayerFactory.build(ConfigValues.asMap(entry.getValue(), "Layer " + name), self, dirPath));
      }
      return StaticLayers.of(layers);
    });
    LOGGER.info("Built configuration with {} cache and {} layers: {}", cache.getClass().getSimpleName(),
      config.layers().names().size(), config.layers().names());
    return config;
  }
}
