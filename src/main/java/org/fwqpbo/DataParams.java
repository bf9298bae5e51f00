package org.fwqpbo;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One reconstruction job: geometry, timing and the assembled image, laid out as
 * (echo, slice, row, column) with the column index running fastest.
 */
public class DataParams {
  public int nx;
  public int ny;
  public int nz;
  // [mm]
  public double dx;
  public double dy;
  public double dz;
  /** Field strength [T]. */
  public double B0;
  /** Echoes in the source. */
  public int totalN;
  /** Echoes selected for processing. */
  public int N;
  public List<Integer> echoes;
  public List<Integer> sliceList;
  /** Selected echo times [sec]. */
  public double[] echoTimes;
  // [sec]
  public double t1;
  public double dt;
  public double reScale = 1.0;
  /** [deg C], null when no temperature correction is wanted. */
  public Double temperature;
  public File outDir;
  public boolean inOppPhase;
  /** Canonically ordered frames; empty for data that did not come from DICOM. */
  public List<FrameRecord> frameList = new ArrayList<FrameRecord>();
  /** Null for data that did not come from DICOM. */
  public EchoImageType imageType;
  public ComplexImage img;

  public int voxelCount() {
    return nx * ny * nz;
  }

  public boolean hasDicomSource() {
    return !frameList.isEmpty();
  }

  /**
   * A source consisting of one file is treated as multi-frame.
   */
  public boolean isMultiFrameSource() {
    if (frameList.isEmpty()) return false;
    Set<File> sources = new HashSet<File>();
    for (FrameRecord frame : frameList) {
      sources.add(frame.source);
    }
    return sources.size() == 1;
  }

  /**
   * Copy of all scalar fields; lists are copied, the image is shared.
   */
  public DataParams copy() {
    DataParams copy = new DataParams();
    copy.nx = nx;
    copy.ny = ny;
    copy.nz = nz;
    copy.dx = dx;
    copy.dy = dy;
    copy.dz = dz;
    copy.B0 = B0;
    copy.totalN = totalN;
    copy.N = N;
    copy.echoes = echoes == null ? null : new ArrayList<Integer>(echoes);
    copy.sliceList = sliceList == null ? null : new ArrayList<Integer>(sliceList);
    copy.echoTimes = echoTimes == null ? null : echoTimes.clone();
    copy.t1 = t1;
    copy.dt = dt;
    copy.reScale = reScale;
    copy.temperature = temperature;
    copy.outDir = outDir;
    copy.inOppPhase = inOppPhase;
    copy.frameList = new ArrayList<FrameRecord>(frameList);
    copy.imageType = imageType;
    copy.img = img;
    return copy;
  }
}
