package org.fwqpbo;

/**
 * Derived image series: output subdirectory, series description, series number, and the rescale
 * intercept/slope used when storing them as unsigned 16-bit pixels.
 */
public enum OutputSeries {
  WATER("wat", "Water-only", 101, 0.0, 1.0),
  FAT("fat", "Fat-only", 102, 0.0, 1.0),
  IN_PHASE("ip", "In-phase", 103, 0.0, 1.0),
  OPPOSED_PHASE("op", "Opposed-phase", 104, 0.0, 1.0),
  FAT_FRACTION("ff", "Fat Fraction", 105, 0.0, 1 / 1000.0),
  R2_MAP("R2map", "R2*", 106, 0.0, 1.0),
  B0_MAP("B0map", "Off-resonance (ppb)", 107, 0.0, 1 / 1000.0),
  CHAIN_LENGTH("CL", "FAC Chain length (1/100)", 108, 0.0, 1 / 100.0),
  UNSATURATION_DEGREE("UD", "FAC Unsaturation degree (1/100)", 109, 0.0, 1 / 100.0),
  POLYUNSATURATION_DEGREE("PUD", "FAC Polyunsaturation degree (1/100)", 110, 0.0, 1 / 100.0);

  public final String directory;
  public final String description;
  public final int seriesNumber;
  public final double rescaleIntercept;
  /** Null would mean: derive from the image maximum. */
  public final Double rescaleSlope;

  OutputSeries(String directory, String description, int seriesNumber, double rescaleIntercept,
      Double rescaleSlope) {
    this.directory = directory;
    this.description = description;
    this.seriesNumber = seriesNumber;
    this.rescaleIntercept = rescaleIntercept;
    this.rescaleSlope = rescaleSlope;
  }
}
