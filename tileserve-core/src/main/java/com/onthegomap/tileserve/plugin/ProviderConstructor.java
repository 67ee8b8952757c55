package com.onthegomap.tileserve.plugin;

import com.onthegomap.tileserve.layer.Layer;
import java.util.Map;

/**
 * Creates a provider backend for {@code layer} from the {@code kwargs} of a {@code class} provider configuration.
 * <p>
 * Plugins can expose an instance of this as a public static field instead of a class with a matching constructor.
 */
@FunctionalInterface
public interface ProviderConstructor {

  @SuppressWarnings("java:S112")
  Object create(Layer layer, Map<String, Object> kwargs) throws Exception;
}
