package com.onthegomap.tileserve.provider;

import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.plugin.PluginSymbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Produces tile content for a {@link Layer}, along with the settings for that provider.
 * <p>
 * Every provider refers back to the layer that owns it, which gives it access to the layer's projection and to the
 * rest of the configuration.
 */
public sealed interface Provider {

  /** Returns the layer this provider produces tiles for. */
  Layer layer();

  /**
   * Renders tiles from a Mapnik style file.
   *
   * @param mapfile path or URL of the XML style file
   * @param fonts   directory with additional fonts, or {@code null}
   */
  record Mapnik(Layer layer, String mapfile, String fonts) implements Provider {

    public Mapnik {
      Objects.requireNonNull(mapfile, "mapfile");
    }
  }

  /**
   * Fetches tiles from somewhere else: either a tile URL template or another provider by name.
   *
   * @param url          tile URL template, or {@code null}
   * @param providerName name of a well-known tile provider, or {@code null}
   */
  record Proxy(Layer layer, String url, String providerName) implements Provider {}

  /**
   * Fetches tiles from a URL template like {@code https://example.com/{Z}/{X}/{Y}.png}.
   *
   * @param template tile URL template
   */
  record UrlTemplate(Layer layer, String template) implements Provider {

    public UrlTemplate {
      Objects.requireNonNull(template, "template");
    }
  }

  /**
   * Serves vector features read through an OGR driver.
   *
   * @param driver     OGR driver name, like {@code PostgreSQL} or {@code GeoJSON}
   * @param parameters driver-specific connection parameters
   * @param properties list of feature properties to keep, or map from property name to output name, or {@code null}
   *                   to keep them all
   * @param projected  {@code true} to return projected instead of latitude/longitude coordinates
   * @param verbose    {@code true} to log queries
   * @param spacing    minimum distance in pixels between points, or {@code null} to skip simplification
   * @param clipped    how features are clipped to tile edges
   */
  record Vector(
    Layer layer,
    String driver,
    Map<String, Object> parameters,
    Object properties,
    boolean projected,
    boolean verbose,
    Double spacing,
    ClipMode clipped
  ) implements Provider {

    public Vector {
      Objects.requireNonNull(driver, "driver");
      parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
      clipped = clipped == null ? ClipMode.ON : clipped;
    }
  }

  /**
   * Reads pre-rendered tiles from an MBTiles archive.
   *
   * @param tileset path of the archive
   */
  record MBTiles(Layer layer, String tileset) implements Provider {

    public MBTiles {
      Objects.requireNonNull(tileset, "tileset");
    }
  }

  /**
   * A provider implementation loaded from the classpath.
   *
   * @param symbol  what the {@code class} specifier resolved to
   * @param kwargs  parameters the backend was constructed with
   * @param backend the constructed provider backend
   */
  record Custom(Layer layer, PluginSymbol symbol, Map<String, Object> kwargs, Object backend) implements Provider {

    public Custom {
      kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }
  }
}
