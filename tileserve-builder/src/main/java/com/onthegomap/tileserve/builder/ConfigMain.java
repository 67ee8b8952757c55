package com.onthegomap.tileserve.builder;

import com.onthegomap.tileserve.config.Arguments;
import com.onthegomap.tileserve.config.Configuration;
import com.onthegomap.tileserve.geo.TileCoord;
import com.onthegomap.tileserve.layer.Layer;
import com.onthegomap.tileserve.util.LogUtil;
import java.io.PrintStream;
import java.util.Map;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tool that loads a configuration, prints the cache and layers it describes, and optionally reports
 * whether a layer serves a tile.
 * <p>
 * Usage: {@code config=path/or/url.yml [tile=z/x/y layer=name]}
 */
public class ConfigMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigMain.class);

  private ConfigMain() {}

  public static void main(String... args) {
    int status = run(Arguments.fromEnvOrArgs(args), System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool and returns the process exit status. */
  static int run(Arguments arguments, PrintStream output) {
    LogUtil.setStage("config");
    try {
      LOGGER.debug("Arguments: {}", arguments.toMap());
      String location = arguments.getString("config", "path or http(s) URL of the JSON or YAML configuration");
      String tile = arguments.getString("tile", "z/x/y of a tile to check against the layers", null);
      String layerName = arguments.getString("layer", "only check this layer", null);

      Configuration config = ConfigLoader.load(location);
      output.println("cache: " + config.cache());
      for (Map.Entry<String, Layer> entry : config.layers().entries()) {
        Layer layer = entry.getValue();
        output.println("layer " + entry.getKey() + ": " + layer);
      }

      if (tile != null) {
        TileCoord coord = parseTile(tile);
        for (Map.Entry<String, Layer> entry : config.layers().entries()) {
          if (layerName == null || layerName.equals(entry.getKey())) {
            output.println(entry.getKey() + (entry.getValue().serves(coord) ? " serves " : " excludes ") + coord);
          }
        }
        if (layerName != null && !config.layers().contains(layerName)) {
          output.println("No layer named " + layerName);
          return 1;
        }
      }
      return 0;
    } catch (RuntimeException e) {
      LOGGER.debug("Invalid configuration", e);
      output.println("Invalid configuration: " + e.getMessage());
      Throwable rootCause = ExceptionUtils.getRootCause(e);
      if (rootCause != e) {
        output.println("  caused by " + ExceptionUtils.getRootCauseMessage(e));
      }
      return 1;
    } finally {
      LogUtil.clearStage();
    }
  }

  /** Returns the tile for a {@code z/x/y} string. */
  static TileCoord parseTile(String tile) {
    String[] parts = tile.strip().split("/");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Expected tile as z/x/y, got: " + tile);
    }
    return TileCoord.ofXYZ(Integer.parseInt(parts[1]), Integer.parseInt(parts[2]), Integer.parseInt(parts[0]));
  }
}
