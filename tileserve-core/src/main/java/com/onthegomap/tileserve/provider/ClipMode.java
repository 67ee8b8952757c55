package com.onthegomap.tileserve.provider;

import com.onthegomap.tileserve.util.Parse;

/** How vector features are clipped to the edges of a tile. */
public enum ClipMode {
  /** Features are returned whole. */
  OFF,
  /** Features are clipped to the tile. */
  ON,
  /** Features are clipped to the tile plus a small buffer. */
  PADDED;

  /**
   * Returns the clip mode for a configuration value: {@code "padded"} selects {@link #PADDED} and anything else is read
   * as a boolean, so {@code null} means {@link #OFF}.
   */
  public static ClipMode from(Object value) {
    if ("padded".equals(value)) {
      return PADDED;
    }
    return Parse.bool(value) ? ON : OFF;
  }
}
