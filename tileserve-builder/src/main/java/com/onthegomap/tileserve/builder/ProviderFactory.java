package com.onthegomap.tileserve.builder;

import static com.onthegomap.tileserve.builder.ConfigValues.json;

import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.plugin.PluginSymbol;
import com.onthegomap.tileserve.provider.ClipMode;
import com.onthegomap.tileserve.provider.Provider;
import com.onthegomap.tileserve.util.Parse;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link Provider} for a layer from the layer's {@code "provider"} section.
 */
public class ProviderFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderFactory.class);

  private ProviderFactory() {}

  /**
   * Returns the provider described by {@code spec}, owned by {@code layer}.
   * <p>
   * Flags like {@code "projected"} and {@code "verbose"} are read with {@link Parse#bool}: the strings {@code "false"},
   * {@code "no"} and {@code "0"} are false.
   *
   * @throws ConfigurationException if the section does not describe a valid provider
   */
  public static Provider build(Map<String, Object> spec, Layer layer) {
    if (spec.containsKey("name")) {
      String name = String.valueOf(spec.get("name"));
      return switch (name.strip().toLowerCase(Locale.ROOT)) {
        case "mapnik" -> new Provider.Mapnik(layer,
          ConfigValues.requireString(spec, "mapfile", "mapnik provider"),
          ConfigValues.getString(spec, "fonts"));
        case "proxy" -> new Provider.Proxy(layer,
          ConfigValues.getString(spec, "url"),
          ConfigValues.getString(spec, "provider"));
        case "url template" -> new Provider.UrlTemplate(layer,
          ConfigValues.requireString(spec, "template", "url template provider"));
        case "vector" -> vector(spec, layer);
        case "mbtiles" -> new Provider.MBTiles(layer,
          ConfigValues.requireString(spec, "tileset", "mbtiles provider"));
        default -> throw new ConfigurationException("Unknown provider name: \"" + name + "\"");
      };
    } else if (spec.containsKey("class")) {
      return custom(spec, layer);
    }
    throw new ConfigurationException("Missing required provider name or class: " + json(spec));
  }

  private static Provider vector(Map<String, Object> spec, Layer layer) {
    ConfigValues.require(spec, "parameters", "vector provider");
    return new Provider.Vector(
      layer,
      ConfigValues.requireString(spec, "driver", "vector provider"),
      ConfigValues.getMap(spec, "parameters", "Vector provider parameters"),
      spec.get("properties"),
      Parse.bool(spec.get("projected")),
      Parse.bool(spec.get("verbose")),
      spec.containsKey("spacing") ? Parse.toDouble(spec.get("spacing")) : null,
      spec.containsKey("clipped") ? ClipMode.from(spec.get("clipped")) : ClipMode.ON
    );
  }

  private static Provider custom(Map<String, Object> spec, Layer layer) {
    PluginSymbol symbol = ClassPathLoader.resolve(String.valueOf(spec.get("class")));
    Map<String, Object> kwargs = ConfigValues.getMap(spec, "kwargs", "Provider kwargs");
    Object backend = symbol.newProvider(layer, kwargs);
    LOGGER.debug("Built provider {} from {}", backend, symbol.specifier());
    return new Provider.Custom(layer, symbol, kwargs, backend);
  }
}
