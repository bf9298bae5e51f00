package org.fwqpbo;

/**
 * Contents of a MAT file in the ISMRM fat-water toolbox layout. The image is kept in MATLAB's
 * column-major order over (row, column, slice, coil, echo).
 */
public class MatlabDataset {
  public int rows;
  public int columns;
  public int slices;
  public int coils;
  public int echoes;
  public double[] real;
  public double[] imag;
  /** [sec] */
  public double[] echoTimes;
  /** [T] */
  public double fieldStrength;
  public double precessionIsClockwise;

  /**
   * Linear index of element (row, column, slice, coil, echo).
   */
  public int index(int row, int column, int slice, int coil, int echo) {
    return row + rows * (column + columns * (slice + slices * (coil + coils * echo)));
  }
}
