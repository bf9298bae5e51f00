package org.fwqpbo;

/**
 * The input images cannot be used for water-fat separation.
 */
public class InvalidDatasetException extends FatWaterException {
  public InvalidDatasetException(String message) {
    super(message);
  }
}
