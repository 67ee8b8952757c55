package com.onthegomap.tileserve.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * Unprojected latitude/longitude (WGS84) tiles, where zoom 0 is two square tiles side by side: the western and eastern
 * hemispheres.
 */
public class LatLonProjection implements Projection {

  public static final String NAME = "WGS84";

  @Override
  public TileCoord locationCoordinate(Coordinate location) {
    return new TileCoord((location.getX() + 180) / 180, (90 - location.getY()) / 180, 0);
  }

  @Override
  public Coordinate coordinateLocation(TileCoord coord) {
    TileCoord world = coord.zoomTo(0);
    return new CoordinateXY(world.column() * 180 - 180, 90 - world.row() * 180);
  }

  @Override
  public String toString() {
    return NAME;
  }
}
