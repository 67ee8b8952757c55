package com.onthegomap.tileserve.layer;

/**
 * Cache-behavior and preview settings for a layer. Accessors fill in defaults for settings that were not provided.
 *
 * @param cacheLifespan    seconds that a cached tile stays valid, or {@code null} to keep tiles forever
 * @param staleLockTimeout seconds after which a tile lock is considered abandoned
 * @param writeCache       whether rendered tiles get written to the cache
 * @param allowedOrigin    value for the {@code Access-Control-Allow-Origin} response header, or {@code null}
 * @param preview          where the preview page is centered
 */
public record LayerOptions(
  Integer cacheLifespan,
  Integer staleLockTimeout,
  Boolean writeCache,
  String allowedOrigin,
  Preview preview
) {

  public static final int DEFAULT_STALE_LOCK_TIMEOUT = 15;
  public static final LayerOptions DEFAULT = new LayerOptions(null, null, null, null, null);

  @Override
  public Integer staleLockTimeout() {
    return staleLockTimeout == null ? DEFAULT_STALE_LOCK_TIMEOUT : staleLockTimeout;
  }

  @Override
  public Boolean writeCache() {
    return writeCache == null || writeCache;
  }

  @Override
  public Preview preview() {
    return preview == null ? Preview.DEFAULT : preview;
  }

  /** Initial view of the preview page: center latitude/longitude, zoom level and tile file extension. */
  public record Preview(Double lat, Double lon, Integer zoom, String ext) {

    public static final Preview DEFAULT = new Preview(null, null, null, null);

    @Override
    public Double lat() {
      return lat == null ? 37.80 : lat;
    }

    @Override
    public Double lon() {
      return lon == null ? -122.26 : lon;
    }

    @Override
    public Integer zoom() {
      return zoom == null ? 10 : zoom;
    }

    @Override
    public String ext() {
      return ext == null ? "png" : ext;
    }
  }
}
