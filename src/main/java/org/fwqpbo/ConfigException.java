package org.fwqpbo;

/**
 * A configuration value is missing, malformed or inconsistent.
 */
public class ConfigException extends FatWaterException {
  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
