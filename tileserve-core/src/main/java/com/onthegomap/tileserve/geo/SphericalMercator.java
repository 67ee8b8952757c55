package com.onthegomap.tileserve.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * The web mercator projection used by most slippy maps, with a single tile covering the world at zoom 0.
 * <p>
 * At zoom 0, column 0 is the antimeridian on the west side and row 0 is the northern edge of the map at about 85.0511
 * degrees north.
 */
public class SphericalMercator implements Projection {

  public static final String NAME = "spherical mercator";

  // rows past the edges of the map, so points near the poles stay finite
  private static final double MIN_ROW = -0.1;
  private static final double MAX_ROW = 1.1;
  private static final double NORTH_LIMIT = latitude(MIN_ROW);
  private static final double SOUTH_LIMIT = latitude(MAX_ROW);

  static double column(double longitude) {
    return (longitude + 180) / 360;
  }

  static double row(double latitude) {
    if (latitude >= NORTH_LIMIT) {
      return MIN_ROW;
    } else if (latitude <= SOUTH_LIMIT) {
      return MAX_ROW;
    }
    double sin = Math.sin(Math.toRadians(latitude));
    return 0.5 - Math.log((1 + sin) / (1 - sin)) / (4 * Math.PI);
  }

  static double longitude(double column) {
    return column * 360 - 180;
  }

  static double latitude(double row) {
    return Math.toDegrees(Math.atan(Math.sinh(Math.PI * (1 - 2 * row))));
  }

  @Override
  public TileCoord locationCoordinate(Coordinate location) {
    return new TileCoord(column(location.getX()), row(location.getY()), 0);
  }

  @Override
  public Coordinate coordinateLocation(TileCoord coord) {
    TileCoord world = coord.zoomTo(0);
    return new CoordinateXY(longitude(world.column()), latitude(world.row()));
  }

  @Override
  public String toString() {
    return NAME;
  }
}
