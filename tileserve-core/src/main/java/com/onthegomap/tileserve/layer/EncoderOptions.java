package com.onthegomap.tileserve.layer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options passed through untouched to the JPEG and PNG image encoders, for example {@code quality} or
 * {@code optimize}.
 */
public record EncoderOptions(Map<String, Object> jpeg, Map<String, Object> png) {

  public static final EncoderOptions NONE = new EncoderOptions(Map.of(), Map.of());

  public EncoderOptions {
    jpeg = copy(jpeg);
    png = copy(png);
  }

  // values may be null so Map.copyOf does not work here
  private static Map<String, Object> copy(Map<String, Object> options) {
    return options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }
}
