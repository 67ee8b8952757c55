package com.onthegomap.tileserve.config;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tileserve.cache.Cache;
import com.onthegomap.tileserve.geo.SphericalMercator;
import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.provider.Provider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigurationTest {

  @Test
  void testLayersSeeOwningConfiguration() {
    Configuration config = new Configuration(new Cache.Null(), "/cfg", self -> {
      Map<String, Layer> layers = new LinkedHashMap<>();
      for (String name : List.of("b", "a", "c")) {
        layers.put(name, new Layer(self, new SphericalMercator(), null, null, null, null,
          layer -> new Provider.MBTiles(layer, name + ".mbtiles")));
      }
      return StaticLayers.of(layers);
    });
    assertEquals(List.of("b", "a", "c"), List.copyOf(config.layers().names()));
    assertEquals("/cfg", config.dirPath());
    for (var entry : config.layers().entries()) {
      assertSame(config, entry.getValue().config());
      assertSame(config.cache(), entry.getValue().config().cache());
    }
  }

  @Test
  void testStaticLayers() {
    StaticLayers layers = StaticLayers.EMPTY;
    assertTrue(layers.names().isEmpty());
    assertFalse(layers.contains("osm"));
    assertTrue(layers.get("osm").isEmpty());
  }

  @Test
  void testStaticLayersAreUnmodifiable() {
    Map<String, Layer> source = new LinkedHashMap<>();
    StaticLayers layers = StaticLayers.of(source);
    source.put("osm", null);
    assertFalse(layers.contains("osm"));
    assertThrows(UnsupportedOperationException.class, () -> layers.names().clear());
  }

  @Test
  void testRequiresCacheAndLayers() {
    assertThrows(NullPointerException.class, () -> new Configuration(null, ".", self -> StaticLayers.EMPTY));
    assertThrows(NullPointerException.class, () -> new Configuration(new Cache.Null(), ".", self -> null));
  }
}
