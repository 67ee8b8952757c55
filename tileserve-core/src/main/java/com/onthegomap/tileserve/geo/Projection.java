package com.onthegomap.tileserve.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * Transforms between geographic locations and positions in a tile pyramid.
 * <p>
 * Locations are JTS {@link Coordinate Coordinates} where {@code x} is longitude and {@code y} is latitude.
 */
public interface Projection {

  /** Returns the tile-pyramid position of {@code location} at the projection's base zoom level. */
  TileCoord locationCoordinate(Coordinate location);

  /** Returns the geographic location of a tile-pyramid position. */
  Coordinate coordinateLocation(TileCoord coord);

  default TileCoord locationCoordinate(double lat, double lon) {
    return locationCoordinate(new CoordinateXY(lon, lat));
  }
}
