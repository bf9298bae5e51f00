package org.fwqpbo;

/**
 * The external water-fat solver is unavailable or failed.
 */
public class SolverException extends FatWaterException {
  public SolverException(String message) {
    super(message);
  }

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }
}
