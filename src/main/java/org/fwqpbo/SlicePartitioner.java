package org.fwqpbo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a volume job into independent single-slice jobs.
 */
public final class SlicePartitioner {
  private SlicePartitioner() {
  }

  /**
   * Job for the z:th selected slice. Scalars are copied from {@code dPar}; the image is a new
   * (echo, row, column) array.
   */
  public static DataParams sliceDataParams(DataParams dPar, int z) {
    if (z < 0 || z >= dPar.nz) {
      throw new IndexOutOfBoundsException("Slice index " + z + " outside [0, " + dPar.nz + ")");
    }
    int pixels = dPar.nx * dPar.ny;
    ComplexImage img = new ComplexImage(dPar.N * pixels);
    for (int n = 0; n < dPar.N; ++n) {
      int src = (n * dPar.nz + z) * pixels;
      System.arraycopy(dPar.img.real, src, img.real, n * pixels, pixels);
      System.arraycopy(dPar.img.imag, src, img.imag, n * pixels, pixels);
    }
    DataParams slice = dPar.copy();
    slice.sliceList = Collections.singletonList(dPar.sliceList.get(z));
    slice.nz = 1;
    slice.img = img;
    return slice;
  }

  public static List<DataParams> partition(DataParams dPar) {
    List<DataParams> slices = new ArrayList<DataParams>();
    for (int z = 0; z < dPar.nz; ++z) {
      slices.add(sliceDataParams(dPar, z));
    }
    return slices;
  }
}
