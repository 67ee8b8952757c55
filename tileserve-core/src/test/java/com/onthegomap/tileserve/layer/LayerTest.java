package com.onthegomap.tileserve.layer;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tileserve.cache.Cache;
import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.config.StaticLayers;
import com.onthegomap.tileserve.geo.SphericalMercator;
import com.onthegomap.tileserve.geo.TileCoord;
import com.onthegomap.tileserve.provider.Provider;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class LayerTest {

  private static Layer layer(Configuration config, Bounds bounds) {
    return new Layer(config, new SphericalMercator(), null, bounds, null, null,
      layer -> new Provider.UrlTemplate(layer, "https://example.com/{Z}/{X}/{Y}.png"));
  }

  @Test
  void testDefaults() {
    Configuration config = new Configuration(new Cache.Null(), ".", self -> StaticLayers.EMPTY);
    Layer layer = layer(config, null);
    assertSame(config, layer.config());
    assertEquals(Metatile.DEFAULT, layer.metatile());
    assertEquals(LayerOptions.DEFAULT, layer.options());
    assertEquals(EncoderOptions.NONE, layer.encoderOptions());
    assertEquals(15, layer.options().staleLockTimeout());
    assertTrue(layer.options().writeCache());
    assertNull(layer.options().cacheLifespan());
    assertEquals("png", layer.options().preview().ext());
    assertEquals(37.80, layer.options().preview().lat());
    assertEquals(-122.26, layer.options().preview().lon());
    assertEquals(10, layer.options().preview().zoom());
  }

  @Test
  void testProviderRefersBackToLayer() {
    Configuration config = new Configuration(new Cache.Null(), ".", self -> StaticLayers.EMPTY);
    Layer layer = layer(config, null);
    assertSame(layer, layer.provider().layer());
  }

  @Test
  void testName() {
    AtomicReference<String> nameDuringBuild = new AtomicReference<>("unset");
    Configuration config = new Configuration(new Cache.Null(), ".", self -> {
      Map<String, Layer> layers = new LinkedHashMap<>();
      Layer osm = layer(self, null);
      nameDuringBuild.set(osm.name());
      layers.put("osm", osm);
      layers.put("roads", layer(self, null));
      return StaticLayers.of(layers);
    });
    assertNull(nameDuringBuild.get());
    assertEquals("osm", config.layers().get("osm").orElseThrow().name());
    assertEquals("roads", config.layers().get("roads").orElseThrow().name());

    Configuration other = new Configuration(new Cache.Null(), ".", self -> StaticLayers.EMPTY);
    assertNull(layer(other, null).name());
  }

  @Test
  void testServes() {
    Configuration config = new Configuration(new Cache.Null(), ".", self -> StaticLayers.EMPTY);
    Bounds bounds = new Bounds(TileCoord.ofXYZ(5, 5, 10), TileCoord.ofXYZ(1, 1, 8));
    assertTrue(layer(config, null).serves(TileCoord.ofXYZ(0, 0, 20)));
    assertTrue(layer(config, bounds).serves(TileCoord.ofXYZ(2, 2, 9)));
    assertFalse(layer(config, bounds).serves(TileCoord.ofXYZ(0, 0, 8)));
  }

  @Test
  void testExplicitOptions() {
    LayerOptions options = new LayerOptions(300, 30, false, "*", new LayerOptions.Preview(1.0, 2.0, 3, "jpg"));
    assertEquals(300, options.cacheLifespan());
    assertEquals(30, options.staleLockTimeout());
    assertFalse(options.writeCache());
    assertEquals("*", options.allowedOrigin());
    assertEquals(new LayerOptions.Preview(1.0, 2.0, 3, "jpg"), options.preview());
  }
}
