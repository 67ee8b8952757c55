package com.onthegomap.tileserve.config;

import com.onthegomap.tileserve.layer.Layer;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * The collection of layers served by a {@link Configuration}.
 * <p>
 * {@link StaticLayers} holds a fixed set parsed from a configuration file, but implementations may compute layers on
 * the fly, for example from an external catalog.
 */
public interface Layers {

  /** Returns the layer called {@code name}, or empty if there is no such layer. */
  Optional<Layer> get(String name);

  /** Returns the names of every layer. */
  Collection<String> names();

  /** Returns every layer paired with its name. */
  Collection<Map.Entry<String, Layer>> entries();

  /** Returns {@code true} if there is a layer called {@code name}. */
  default boolean contains(String name) {
    return get(name).isPresent();
  }
}
