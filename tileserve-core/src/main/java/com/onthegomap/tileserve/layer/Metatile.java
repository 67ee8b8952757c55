package com.onthegomap.tileserve.layer;

import com.onthegomap.tileserve.geo.TileCoord;
import java.util.ArrayList;
import java.util.List;
import net.jcip.annotations.Immutable;

/**
 * Groups adjacent tiles so they get rendered together in one pass.
 *
 * @param buffer  extra pixels to render around the outside of the group
 * @param rows    number of tile rows rendered together
 * @param columns number of tile columns rendered together
 */
@Immutable
public record Metatile(int buffer, int rows, int columns) {

  public static final Metatile DEFAULT = new Metatile(0, 1, 1);

  public Metatile {
    if (buffer < 0 || rows < 1 || columns < 1) {
      throw new IllegalArgumentException(
        "Metatile needs buffer >= 0 and at least 1 row and column, got buffer=" + buffer + " rows=" + rows +
          " columns=" + columns);
    }
  }

  /** Returns a metatile using defaults for any {@code null} argument. */
  public static Metatile of(Integer buffer, Integer rows, Integer columns) {
    return new Metatile(
      buffer == null ? DEFAULT.buffer : buffer,
      rows == null ? DEFAULT.rows : rows,
      columns == null ? DEFAULT.columns : columns
    );
  }

  /** Returns {@code true} if this groups more than one tile together. */
  public boolean isForReal() {
    return rows > 1 || columns > 1;
  }

  /** Returns the top-left tile of the group that contains {@code tile}. */
  public TileCoord firstCoord(TileCoord tile) {
    TileCoord whole = tile.container();
    return new TileCoord(
      Math.floor(whole.column() / columns) * columns,
      Math.floor(whole.row() / rows) * rows,
      tile.zoom()
    );
  }

  /** Returns every tile in the group that contains {@code tile}, row by row. */
  public List<TileCoord> allCoords(TileCoord tile) {
    TileCoord first = firstCoord(tile);
    List<TileCoord> result = new ArrayList<>(rows * columns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        result.add(new TileCoord(first.column() + column, first.row() + row, tile.zoom()));
      }
    }
    return result;
  }
}
