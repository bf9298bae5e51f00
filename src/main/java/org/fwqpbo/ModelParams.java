package org.fwqpbo;

/**
 * Signal model handed to the solver: resonance frequencies and how the components weight them.
 */
public class ModelParams {
  /** Chemical shifts [ppm]; index 0 is water. */
  public float[] cs;
  /** Number of resonances. */
  public int nResonances;
  /** Number of independently resolved fatty acid composition parameters (0..3). */
  public int nFAC;
  /** Number of components (water plus fat components). */
  public int nComponents;
  /** Relative amplitudes, nComponents x nResonances; row 0 is water. */
  public float[][] alpha;

  // Composition values used for the constrained first pass when nFAC > 0.
  public double cl = FattyAcidModel.DEFAULT_CL;
  public double p2u = FattyAcidModel.DEFAULT_P2U;

  /**
   * Alpha flattened row by row.
   */
  public float[] flatAlpha() {
    float[] flat = new float[nComponents * nResonances];
    for (int m = 0; m < nComponents; ++m) {
      System.arraycopy(alpha[m], 0, flat, m * nResonances, nResonances);
    }
    return flat;
  }

  /**
   * Total fat weight of component m, i.e. the sum of its fat resonance amplitudes.
   */
  public double fatWeight(int m) {
    double sum = 0;
    for (int p = 1; p < nResonances; ++p) {
      sum += alpha[m][p];
    }
    return sum;
  }

  /**
   * Copy with a different alpha matrix (and component count).
   */
  public ModelParams withAlpha(float[][] newAlpha) {
    ModelParams copy = copy();
    copy.alpha = newAlpha;
    copy.nComponents = newAlpha.length;
    return copy;
  }

  /**
   * Copy with the water chemical shift replaced.
   */
  public ModelParams withWaterShift(double watCS) {
    ModelParams copy = copy();
    copy.cs[0] = (float) watCS;
    return copy;
  }

  private ModelParams copy() {
    ModelParams copy = new ModelParams();
    copy.cs = cs.clone();
    copy.nResonances = nResonances;
    copy.nFAC = nFAC;
    copy.nComponents = nComponents;
    copy.alpha = new float[alpha.length][];
    for (int m = 0; m < alpha.length; ++m) {
      copy.alpha[m] = alpha[m].clone();
    }
    copy.cl = cl;
    copy.p2u = p2u;
    return copy;
  }
}
