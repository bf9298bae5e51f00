package org.fwqpbo;

/**
 * Base class for failures that abort a water-fat separation job.
 */
public class FatWaterException extends Exception {
  public FatWaterException(String message) {
    super(message);
  }

  public FatWaterException(String message, Throwable cause) {
    super(message, cause);
  }
}
