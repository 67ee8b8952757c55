package com.onthegomap.tileserve.config;

/**
 * Error reported to the user when a tile service configuration can not be turned into a {@link Configuration}.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
