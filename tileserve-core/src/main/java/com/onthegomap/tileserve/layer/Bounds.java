package com.onthegomap.tileserve.layer;

import com.onthegomap.tileserve.geo.Projection;
import com.onthegomap.tileserve.geo.TileCoord;
import net.jcip.annotations.Immutable;

/**
 * A region of the tile pyramid that a layer is allowed to serve, defined by two inclusive corners at possibly different
 * zoom levels.
 *
 * @param upperLeftHigh left-most column, upper-most row, at the highest (most detailed) zoom level served
 * @param lowerRightLow right-most column, lowest row, at the lowest zoom level served
 */
@Immutable
public record Bounds(TileCoord upperLeftHigh, TileCoord lowerRightLow) {

  public Bounds {
    if (upperLeftHigh.zoom() < lowerRightLow.zoom()) {
      throw new IllegalArgumentException(
        "high zoom " + upperLeftHigh.zoom() + " must be at least low zoom " + lowerRightLow.zoom());
    }
  }

  /**
   * Returns bounds for a latitude/longitude box that is served from zoom {@code low} through {@code high}.
   * <p>
   * The north-west corner is projected at zoom {@code high} and the south-east corner at zoom {@code low}.
   */
  public static Bounds fromLatLon(Projection projection, double north, double west, double south, double east,
    int high, int low) {
    return new Bounds(
      projection.locationCoordinate(north, west).zoomTo(high),
      projection.locationCoordinate(south, east).zoomTo(low)
    );
  }

  /** Returns {@code true} if {@code tile} falls outside these bounds. */
  public boolean excludes(TileCoord tile) {
    if (tile.zoom() > upperLeftHigh.zoom() || tile.zoom() < lowerRightLow.zoom()) {
      return true;
    }

    // top-left corner of the tile against the lower-right bound
    TileCoord nearCorner = tile.zoomTo(lowerRightLow.zoom());
    if (nearCorner.column() > lowerRightLow.column() || nearCorner.row() > lowerRightLow.row()) {
      return true;
    }

    // bottom-right corner of the tile against the upper-left bound
    TileCoord farCorner = tile.right().down().zoomTo(upperLeftHigh.zoom());
    return farCorner.column() < upperLeftHigh.column() || farCorner.row() < upperLeftHigh.row();
  }

  @Override
  public String toString() {
    return "Bound " + upperLeftHigh + " - " + lowerRightLow;
  }
}
