package com.onthegomap.tileserve.geo;

import net.jcip.annotations.Immutable;

/**
 * A position in the tile pyramid.
 * <p>
 * Column and row are fractional so that a projected point (like the corner of a bounding box) can be expressed
 * precisely at any zoom level, and the whole-number coordinate of a tile refers to its top-left corner.
 *
 * @param column x coordinate where 0 is the western edge of the map and {@code 2^zoom} is the eastern edge
 * @param row    y coordinate where 0 is the northern edge of the map and {@code 2^zoom} is the southern edge
 * @param zoom   zoom level
 */
@Immutable
public record TileCoord(double column, double row, int zoom) {

  public static TileCoord ofXYZ(double x, double y, int z) {
    return new TileCoord(x, y, z);
  }

  /**
   * Returns the same position expressed at zoom level {@code z}, doubling column and row for each level zoomed in and
   * halving them for each level zoomed out.
   */
  public TileCoord zoomTo(int z) {
    double factor = Math.pow(2, z - zoom);
    return new TileCoord(column * factor, row * factor, z);
  }

  /** Returns the coordinate one column to the east. */
  public TileCoord right() {
    return new TileCoord(column + 1, row, zoom);
  }

  /** Returns the coordinate one column to the west. */
  public TileCoord left() {
    return new TileCoord(column - 1, row, zoom);
  }

  /** Returns the coordinate one row to the south. */
  public TileCoord down() {
    return new TileCoord(column, row + 1, zoom);
  }

  /** Returns the coordinate one row to the north. */
  public TileCoord up() {
    return new TileCoord(column, row - 1, zoom);
  }

  /** Returns the whole tile that contains this position. */
  public TileCoord container() {
    return new TileCoord(Math.floor(column), Math.floor(row), zoom);
  }

  @Override
  public String toString() {
    return "{x=" + format(column) + " y=" + format(row) + " z=" + zoom + '}';
  }

  private static String format(double d) {
    return d % 1 == 0 ? Long.toString((long) d) : Double.toString(d);
  }
}
