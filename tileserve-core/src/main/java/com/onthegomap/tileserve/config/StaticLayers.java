package com.onthegomap.tileserve.config;

import com.onthegomap.tileserve.layer.Layer;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** A fixed set of layers backed by a map, in insertion order. */
public class StaticLayers implements Layers {

  public static final StaticLayers EMPTY = new StaticLayers(Map.of());

  private final Map<String, Layer> layers;

  private StaticLayers(Map<String, Layer> layers) {
    this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
  }

  public static StaticLayers of(Map<String, Layer> layers) {
    return new StaticLayers(layers);
  }

  @Override
  public Optional<Layer> get(String name) {
    return Optional.ofNullable(layers.get(name));
  }

  @Override
  public boolean contains(String name) {
    return layers.containsKey(name);
  }

  @Override
  public Collection<String> names() {
    return layers.keySet();
  }

  @Override
  public Collection<Map.Entry<String, Layer>> entries() {
    return layers.entrySet();
  }

  @Override
  public String toString() {
    return "StaticLayers" + layers.keySet();
  }
}
