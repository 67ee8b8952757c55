package com.onthegomap.tileserve.plugin;

import static com.onthegomap.tileserve.util.Exceptions.throwFatalException;

import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.layer.Layer;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A class or object that a plugin specifier like {@code "com.example.Tiles:MyCache"} resolved to, that can construct
 * cache, provider, or projection backends.
 *
 * @param specifier the specifier string from the configuration
 * @param value     the resolved class, or the value of the resolved static field
 */
public record PluginSymbol(String specifier, Object value) {

  /**
   * Returns a new cache backend, either from a {@link CacheConstructor} or from a public constructor with signature
   * {@code (Map)} or {@code ()}.
   */
  public Object newCache(Map<String, Object> kwargs) {
    if (value instanceof CacheConstructor constructor) {
      return invoke(() -> constructor.create(kwargs));
    }
    return instantiate(List.of(
      new Signature(new Class<?>[]{Map.class}, new Object[]{kwargs}),
      new Signature(new Class<?>[0], new Object[0])
    ));
  }

  /**
   * Returns a new provider backend for {@code layer}, either from a {@link ProviderConstructor} or from a public
   * constructor with signature {@code (Layer, Map)}, {@code (Map)}, {@code (Layer)} or {@code ()}.
   */
  public Object newProvider(Layer layer, Map<String, Object> kwargs) {
    if (value instanceof ProviderConstructor constructor) {
      return invoke(() -> constructor.create(layer, kwargs));
    }
    return instantiate(List.of(
      new Signature(new Class<?>[]{Layer.class, Map.class}, new Object[]{layer, kwargs}),
      new Signature(new Class<?>[]{Map.class}, new Object[]{kwargs}),
      new Signature(new Class<?>[]{Layer.class}, new Object[]{layer}),
      new Signature(new Class<?>[0], new Object[0])
    ));
  }

  /**
   * Returns {@link #value()} if it is already an instance of {@code type}, or a new instance created by the no-argument
   * constructor if it is a subclass of {@code type}.
   */
  public <T> T newInstance(Class<T> type) {
    if (type.isInstance(value)) {
      return type.cast(value);
    } else if (value instanceof Class<?> clazz && type.isAssignableFrom(clazz)) {
      return type.cast(instantiate(List.of(new Signature(new Class<?>[0], new Object[0]))));
    }
    throw new ConfigurationException(specifier + " resolved to " + value + ", which is not a " + type.getSimpleName());
  }

  private Object instantiate(List<Signature> signatures) {
    if (!(value instanceof Class<?> clazz)) {
      throw new ConfigurationException(specifier + " resolved to " + value + ", which is not a class or constructor");
    }
    if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
      throw new ConfigurationException(specifier + " resolved to abstract type " + clazz.getName());
    }
    for (Signature signature : signatures) {
      Constructor<?> constructor;
      try {
        constructor = clazz.getConstructor(signature.types);
      } catch (NoSuchMethodException e) {
        continue;
      }
      return invoke(() -> constructor.newInstance(signature.args));
    }
    throw new ConfigurationException(clazz.getName() + " from " + specifier + " needs a public constructor with one of: " +
      signatures.stream().map(Signature::toString).collect(Collectors.joining(", ")));
  }

  private Object invoke(Construction construction) {
    try {
      return construction.run();
    } catch (InvocationTargetException e) {
      return throwFatalException(e.getCause());
    } catch (IllegalAccessException e) {
      throw new ConfigurationException("Unable to construct " + specifier + ": " + e, e);
    } catch (Exception e) {
      return throwFatalException(e);
    }
  }

  @FunctionalInterface
  private interface Construction {
    @SuppressWarnings("java:S112")
    Object run() throws Exception;
  }

  private record Signature(Class<?>[] types, Object[] args) {

    @Override
    public String toString() {
      return Arrays.stream(types).map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")"));
    }
  }
}
