package com.onthegomap.tileserve.plugin;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tileserve.cache.Cache;
import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.config.StaticLayers;
import com.onthegomap.tileserve.geo.LatLonProjection;
import com.onthegomap.tileserve.geo.Projection;
import com.onthegomap.tileserve.geo.SphericalMercator;
import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.provider.Provider;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PluginSymbolTest {

  public static class MapBackend {
    public final Map<String, Object> kwargs;

    public MapBackend(Map<String, Object> kwargs) {
      this.kwargs = kwargs;
    }
  }

  public static class NoArgBackend {
    public NoArgBackend() {}
  }

  public static class LayerBackend {
    public final Layer layer;

    public LayerBackend(Layer layer) {
      this.layer = layer;
    }
  }

  public static class LayerAndMapBackend {
    public final Layer layer;
    public final Map<String, Object> kwargs;

    public LayerAndMapBackend(Layer layer, Map<String, Object> kwargs) {
      this.layer = layer;
      this.kwargs = kwargs;
    }

    public LayerAndMapBackend(Map<String, Object> kwargs) {
      this(null, kwargs);
    }
  }

  public static class StringBackend {
    public StringBackend(String value) {}
  }

  public static class FailingBackend {
    public FailingBackend() throws Exception {
      throw new Exception("can not connect");
    }
  }

  public abstract static class AbstractBackend {}

  private static Layer layer() {
    Configuration config = new Configuration(new Cache.Null(), ".", self -> StaticLayers.EMPTY);
    return new Layer(config, new SphericalMercator(), null, null, null, null,
      layer -> new Provider.MBTiles(layer, "x.mbtiles"));
  }

  @Test
  void testCacheFromMapConstructor() {
    var symbol = new PluginSymbol("test:MapBackend", MapBackend.class);
    Object backend = symbol.newCache(Map.of("a", 1));
    assertEquals(Map.of("a", 1), ((MapBackend) backend).kwargs);
  }

  @Test
  void testCacheFromNoArgConstructor() {
    var symbol = new PluginSymbol("test:NoArgBackend", NoArgBackend.class);
    assertInstanceOf(NoArgBackend.class, symbol.newCache(Map.of()));
  }

  @Test
  void testCacheFromConstructorFunction() {
    CacheConstructor constructor = kwargs -> "cache with " + kwargs.get("host");
    var symbol = new PluginSymbol("test:CONSTRUCTOR", constructor);
    assertEquals("cache with localhost", symbol.newCache(Map.of("host", "localhost")));
  }

  @Test
  void testProviderPrefersLayerAndMap() {
    Layer layer = layer();
    var symbol = new PluginSymbol("test:LayerAndMapBackend", LayerAndMapBackend.class);
    var backend = (LayerAndMapBackend) symbol.newProvider(layer, Map.of("k", "v"));
    assertSame(layer, backend.layer);
    assertEquals(Map.of("k", "v"), backend.kwargs);
  }

  @Test
  void testProviderFromLayerConstructor() {
    Layer layer = layer();
    var backend = (LayerBackend) new PluginSymbol("test:LayerBackend", LayerBackend.class).newProvider(layer, Map.of());
    assertSame(layer, backend.layer);
  }

  @Test
  void testProviderFromConstructorFunction() {
    Layer layer = layer();
    ProviderConstructor constructor = (l, kwargs) -> l;
    assertSame(layer, new PluginSymbol("test:CONSTRUCTOR", constructor).newProvider(layer, Map.of()));
  }

  @Test
  void testNoMatchingConstructor() {
    var symbol = new PluginSymbol("test:StringBackend", StringBackend.class);
    var exception = assertThrows(ConfigurationException.class, () -> symbol.newCache(Map.of()));
    assertTrue(exception.getMessage().contains("test:StringBackend"), exception.getMessage());
  }

  @Test
  void testAbstractClass() {
    var symbol = new PluginSymbol("test:AbstractBackend", AbstractBackend.class);
    assertThrows(ConfigurationException.class, () -> symbol.newCache(Map.of()));
  }

  @Test
  void testNotAClass() {
    var symbol = new PluginSymbol("test:VALUE", "just a string");
    assertThrows(ConfigurationException.class, () -> symbol.newCache(Map.of()));
  }

  @Test
  void testConstructorFailurePropagates() {
    var symbol = new PluginSymbol("test:FailingBackend", FailingBackend.class);
    var exception = assertThrows(RuntimeException.class, () -> symbol.newCache(Map.of()));
    assertEquals("can not connect", exception.getCause().getMessage());
  }

  @Test
  void testNewInstance() {
    Projection instance = new LatLonProjection();
    assertSame(instance, new PluginSymbol("test:P", instance).newInstance(Projection.class));
    assertInstanceOf(SphericalMercator.class,
      new PluginSymbol("test:P", SphericalMercator.class).newInstance(Projection.class));
    assertThrows(ConfigurationException.class,
      () -> new PluginSymbol("test:P", String.class).newInstance(Projection.class));
  }
}
