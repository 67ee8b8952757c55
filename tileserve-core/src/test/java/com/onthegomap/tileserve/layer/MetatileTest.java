package com.onthegomap.tileserve.layer;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tileserve.geo.TileCoord;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetatileTest {

  @Test
  void testDefaults() {
    assertEquals(new Metatile(0, 1, 1), Metatile.of(null, null, null));
    assertEquals(new Metatile(64, 1, 1), Metatile.of(64, null, null));
    assertFalse(Metatile.DEFAULT.isForReal());
    assertTrue(Metatile.of(null, 2, null).isForReal());
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> new Metatile(-1, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new Metatile(0, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new Metatile(0, 1, 0));
  }

  @Test
  void testSingleTile() {
    TileCoord tile = TileCoord.ofXYZ(5, 7, 4);
    assertEquals(tile, Metatile.DEFAULT.firstCoord(tile));
    assertEquals(List.of(tile), Metatile.DEFAULT.allCoords(tile));
  }

  @Test
  void testGroup() {
    Metatile metatile = new Metatile(0, 2, 3);
    TileCoord tile = TileCoord.ofXYZ(5, 7, 4);
    assertEquals(TileCoord.ofXYZ(3, 6, 4), metatile.firstCoord(tile));
    assertEquals(List.of(
      TileCoord.ofXYZ(3, 6, 4),
      TileCoord.ofXYZ(4, 6, 4),
      TileCoord.ofXYZ(5, 6, 4),
      TileCoord.ofXYZ(3, 7, 4),
      TileCoord.ofXYZ(4, 7, 4),
      TileCoord.ofXYZ(5, 7, 4)
    ), metatile.allCoords(tile));
  }
}
