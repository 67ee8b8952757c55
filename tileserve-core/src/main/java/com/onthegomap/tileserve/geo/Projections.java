package com.onthegomap.tileserve.geo;

import java.util.Locale;
import java.util.Map;

/** Registry of the projections that can be referred to by name. */
public class Projections {

  public static final String DEFAULT = SphericalMercator.NAME;

  private static final Map<String, Projection> BUILTIN = Map.of(
    SphericalMercator.NAME, new SphericalMercator(),
    LatLonProjection.NAME.toLowerCase(Locale.ROOT), new LatLonProjection()
  );

  private Projections() {}

  /** Returns the builtin projection called {@code name} (case-insensitive), or {@code null} if there is none. */
  public static Projection builtin(String name) {
    return name == null ? null : BUILTIN.get(name.strip().toLowerCase(Locale.ROOT));
  }
}
