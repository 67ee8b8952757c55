package com.onthegomap.tileserve.geo;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TileCoordTest {

  @Test
  void testZoomTo() {
    assertEquals(TileCoord.ofXYZ(4, 6, 3), TileCoord.ofXYZ(2, 3, 2).zoomTo(3));
    assertEquals(TileCoord.ofXYZ(0.5, 0.75, 0), TileCoord.ofXYZ(2, 3, 2).zoomTo(0));
  }

  @Test
  void testNeighbors() {
    TileCoord tile = TileCoord.ofXYZ(2, 3, 4);
    assertEquals(TileCoord.ofXYZ(3, 3, 4), tile.right());
    assertEquals(TileCoord.ofXYZ(1, 3, 4), tile.left());
    assertEquals(TileCoord.ofXYZ(2, 4, 4), tile.down());
    assertEquals(TileCoord.ofXYZ(2, 2, 4), tile.up());
  }

  @Test
  void testContainer() {
    assertEquals(TileCoord.ofXYZ(2, 3, 4), TileCoord.ofXYZ(2.7, 3.1, 4).container());
  }

  @Test
  void testToString() {
    assertEquals("{x=2 y=3 z=4}", TileCoord.ofXYZ(2, 3, 4).toString());
    assertEquals("{x=2.5 y=3 z=4}", TileCoord.ofXYZ(2.5, 3, 4).toString());
  }
}
