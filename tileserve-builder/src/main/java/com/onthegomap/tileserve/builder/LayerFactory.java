package com.onthegomap.tileserve.builder;

import static com.onthegomap.tileserve.builder.ConfigValues.json;

import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.geo.Projection;
import com.onthegomap.tileserve.geo.Projections;
import com.onthegomap.tileserve.layer.Bounds;
import com.onthegomap.tileserve.layer.EncoderOptions;
import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.layer.LayerOptions;
import com.onthegomap.tileserve.layer.Metatile;
import com.onthegomap.tileserve.util.Parse;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Layer} from one entry of the {@code "layers"} section of a configuration.
 */
public class LayerFactory {

  private static final List<String> BOUNDS_KEYS = List.of("north", "south", "east", "west", "high", "low");

  private LayerFactory() {}

  /**
   * Returns the layer described by {@code spec}, along with its provider.
   * <p>
   * {@code "write cache"} is read with {@link Parse#bool}, so the strings {@code "false"}, {@code "no"} and {@code "0"}
   * turn caching off even though they are non-empty.
   *
   * @param spec    the layer's section
   * @param config  the configuration the layer belongs to
   * @param dirPath directory or URL the configuration came from
   * @throws ConfigurationException if the section does not describe a valid layer
   */
  public static Layer build(Map<String, Object> spec, Configuration config, String dirPath) {
    Projection projection = projection(ConfigValues.getString(spec, "projection"));
    LayerOptions options = new LayerOptions(
      spec.containsKey("cache lifespan") ? Parse.toInt(spec.get("cache lifespan")) : null,
      spec.containsKey("stale lock timeout") ? Parse.toInt(spec.get("stale lock timeout")) : null,
      spec.containsKey("write cache") ? Parse.bool(spec.get("write cache")) : null,
      ConfigValues.getString(spec, "allowed origin"),
      spec.containsKey("preview") ? preview(ConfigValues.getMap(spec, "preview", "Layer preview")) : null
    );
    Bounds bounds = spec.containsKey("bounds") ? bounds(spec.get("bounds"), projection) : null;
    Metatile metatile = metatile(ConfigValues.getMap(spec, "metatile", "Layer metatile"));
    EncoderOptions encoderOptions = new EncoderOptions(
      ConfigValues.getMap(spec, "jpeg options", "Layer jpeg options"),
      ConfigValues.getMap(spec, "png options", "Layer png options")
    );
    Object providerSpec = spec.get("provider");
    if (providerSpec == null) {
      throw new ConfigurationException("Missing required provider for layer: " + json(spec));
    }
    Map<String, Object> providerMap = ConfigValues.asMap(providerSpec, "Layer provider");
    return new Layer(config, projection, metatile, bounds, options, encoderOptions,
      layer -> ProviderFactory.build(providerMap, layer));
  }

  /**
   * Returns the projection called {@code name}: a builtin like {@code "spherical mercator"} or {@code "WGS84"}, or a
   * plugin specifier like {@code "com.example.Projections:Albers"}.
   */
  static Projection projection(String name) {
    if (name == null) {
      return Projections.builtin(Projections.DEFAULT);
    }
    Projection builtin = Projections.builtin(name);
    if (builtin != null) {
      return builtin;
    } else if (name.contains(":")) {
      return ClassPathLoader.resolve(name).newInstance(Projection.class);
    }
    throw new ConfigurationException("Unknown projection: \"" + name + "\"");
  }

  private static LayerOptions.Preview preview(Map<String, Object> spec) {
    return new LayerOptions.Preview(
      spec.containsKey("lat") ? Parse.toDouble(spec.get("lat")) : null,
      spec.containsKey("lon") ? Parse.toDouble(spec.get("lon")) : null,
      spec.containsKey("zoom") ? Parse.toInt(spec.get("zoom")) : null,
      ConfigValues.getString(spec, "ext")
    );
  }

  private static Bounds bounds(Object value, Projection projection) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new ConfigurationException("Layer bounds must be a dictionary, not: " + json(value));
    }
    for (String key : BOUNDS_KEYS) {
      if (!(map.get(key) instanceof Number)) {
        throw new ConfigurationException(
          "Missing part of bounds for layer, need north, south, east, west, high, and low: " + json(value));
      }
    }
    int high = ((Number) map.get("high")).intValue();
    int low = ((Number) map.get("low")).intValue();
    if (high < low) {
      throw new ConfigurationException("Layer bounds high zoom must not be lower than low zoom: " + json(value));
    }
    return Bounds.fromLatLon(projection,
      ((Number) map.get("north")).doubleValue(),
      ((Number) map.get("west")).doubleValue(),
      ((Number) map.get("south")).doubleValue(),
      ((Number) map.get("east")).doubleValue(),
      high, low);
  }

  private static Metatile metatile(Map<String, Object> spec) {
    Integer buffer = spec.containsKey("buffer") ? Parse.toInt(spec.get("buffer")) : null;
    Integer rows = spec.containsKey("rows") ? Parse.toInt(spec.get("rows")) : null;
    Integer columns = spec.containsKey("columns") ? Parse.toInt(spec.get("columns")) : null;
    try {
      return Metatile.of(buffer, rows, columns);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid metatile " + json(spec) + ": " + e.getMessage(), e);
    }
  }
}
