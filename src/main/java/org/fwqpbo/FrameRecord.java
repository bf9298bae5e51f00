package org.fwqpbo;

import java.io.File;

/**
 * Holds the reconstruction-relevant attributes of one image frame. For multi-frame files
 * {@code frameIndex} addresses the frame inside {@code source}; it is null for single-frame files.
 */
public class FrameRecord {
  public File source;
  public Integer frameIndex;

  public FrameType type;
  // [msec]
  public double echoTime;
  public double sliceLocation;

  // Scan-wide constants; must agree across a dataset.
  // [MHz]
  public double imagingFrequency;
  public int rows;
  public int columns;
  public double pixelSpacingRow;
  public double pixelSpacingColumn;
  public double sliceThickness;

  @Override
  public String toString() {
    return source.getName() + (frameIndex == null ? "" : "#" + frameIndex)
        + " " + type.code + " TE=" + echoTime + " loc=" + sliceLocation;
  }
}
