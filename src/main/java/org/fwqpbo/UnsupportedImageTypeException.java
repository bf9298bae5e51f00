package org.fwqpbo;

/**
 * The mix of magnitude, phase, real and imaginary frames is not one of the supported patterns.
 */
public class UnsupportedImageTypeException extends InvalidDatasetException {
  public UnsupportedImageTypeException(int numReal, int numImag, int numMagn, int numPhase) {
    super(String.format("Unknown combination of image types: %d real, %d imag, %d magn, %d phase",
        numReal, numImag, numMagn, numPhase));
  }
}
