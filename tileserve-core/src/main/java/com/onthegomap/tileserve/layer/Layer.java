package com.onthegomap.tileserve.layer;

import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.config.Layers;
import com.onthegomap.tileserve.geo.Projection;
import com.onthegomap.tileserve.geo.TileCoord;
import com.onthegomap.tileserve.provider.Provider;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named unit of tile serving: a {@link Provider} that produces tiles, the {@link Projection} they are addressed in,
 * and the settings that control metatiling, caching and bounds.
 * <p>
 * The provider is created by the layer's constructor, after every other field is set, so that it can hold a reference
 * back to its owning layer.
 */
public class Layer {

  private final Configuration config;
  private final Projection projection;
  private final Metatile metatile;
  private final Bounds bounds;
  private final LayerOptions options;
  private final EncoderOptions encoderOptions;
  private final Provider provider;

  public Layer(Configuration config, Projection projection, Metatile metatile, Bounds bounds, LayerOptions options,
    EncoderOptions encoderOptions, Function<Layer, ? extends Provider> providerFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.projection = Objects.requireNonNull(projection, "projection");
    this.metatile = metatile == null ? Metatile.DEFAULT : metatile;
    this.bounds = bounds;
    this.options = options == null ? LayerOptions.DEFAULT : options;
    this.encoderOptions = encoderOptions == null ? EncoderOptions.NONE : encoderOptions;
    this.provider = Objects.requireNonNull(providerFactory.apply(this), "provider");
  }

  public Configuration config() {
    return config;
  }

  public Projection projection() {
    return projection;
  }

  public Metatile metatile() {
    return metatile;
  }

  /** Returns the region this layer is limited to, or {@code null} to serve every tile. */
  public Bounds bounds() {
    return bounds;
  }

  public LayerOptions options() {
    return options;
  }

  public EncoderOptions encoderOptions() {
    return encoderOptions;
  }

  public Provider provider() {
    return provider;
  }

  /** Returns {@code true} if requests for {@code tile} should be honored. */
  public boolean serves(TileCoord tile) {
    return bounds == null || !bounds.excludes(tile);
  }

  /** Returns the name this layer is registered under in its configuration, or {@code null} if it is not registered. */
  public String name() {
    Layers layers = config.layers();
    if (layers == null) {
      return null;
    }
    for (Map.Entry<String, Layer> entry : layers.entries()) {
      if (entry.getValue() == this) {
        return entry.getKey();
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Layer{" +
      "projection=" + projection +
      ", metatile=" + metatile +
      ", bounds=" + bounds +
      ", provider=" + (provider == null ? null : provider.getClass().getSimpleName()) +
      '}';
  }
}
