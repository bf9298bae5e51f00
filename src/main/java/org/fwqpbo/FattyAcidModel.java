package org.fwqpbo;

/**
 * Relative amplitudes of the ten triglyceride resonances (A..J) as linear combinations of the
 * fatty acid composition: chain length CL, unsaturation degree UD and polyunsaturation to
 * unsaturation ratio P2U. Every composition parameter that is not given becomes an extra fat
 * component for the solver to resolve.
 */
public final class FattyAcidModel {
  /** One water and ten triglyceride resonances. */
  public static final int RESONANCES = 11;

  public static final double DEFAULT_CL = 17.4;
  public static final double DEFAULT_P2U = 0.2;
  /** Unsaturation degree assumed when only B0 and R2* are wanted (Lundbom 2010). */
  public static final double FIRST_PASS_UD = 2.6;

  private FattyAcidModel() {
  }

  /**
   * Builds the alpha matrix. Supported combinations are all known, only UD unknown, only CL
   * known, and nothing known; they give 2, 3, 4 and 5 components respectively.
   */
  public static float[][] alphas(Double cl, Double p2u, Double ud) {
    int unknown = (cl == null ? 1 : 0) + (p2u == null ? 1 : 0) + (ud == null ? 1 : 0);
    int m = unknown + 2;
    float[][] alpha = new float[m][RESONANCES];
    alpha[0][0] = 1f;
    if (m == 2) {
      // F = 9A+(6(CL-4)+UD(2P2U-8))B+6C+4UDD+6E+2UDP2UF+2G+2H+I+UD(2P2U+2)J
      setFat(alpha[1], 9, 6 * (cl - 4) + ud * (2 * p2u - 8), 6, 4 * ud, 6, 2 * ud * p2u, 2, 2, 1,
          ud * (2 * p2u + 2));
    } else if (m == 3) {
      require(cl != null && p2u != null, "only UD may be unknown with two fat components");
      // F1 = 9A+6(CL-4)B+6C+6E+2G+2H+I
      // F2 = (2P2U-8)B+4D+2P2UF+(2P2U+2)J
      setFat(alpha[1], 9, 6 * (cl - 4), 6, 0, 6, 0, 2, 2, 1, 0);
      setFat(alpha[2], 0, 2 * p2u - 8, 0, 4, 0, 2 * p2u, 0, 0, 0, 2 * p2u + 2);
    } else if (m == 4) {
      require(cl != null, "CL must be known with three fat components");
      // F1 = 9A+6(CL-4)B+6C+6E+2G+2H+I
      // F2 = -8B+4D+2J
      // F3 = 2B+2F+2J
      setFat(alpha[1], 9, 6 * (cl - 4), 6, 0, 6, 0, 2, 2, 1, 0);
      setFat(alpha[2], 0, -8, 0, 4, 0, 0, 0, 0, 0, 2);
      setFat(alpha[3], 0, 2, 0, 0, 0, 2, 0, 0, 0, 2);
    } else {
      // F1 = 9A+6C+6E+2G+2H+I
      // F2 = 2B
      // F3 = 4D+2J
      // F4 = 2F+2J
      setFat(alpha[1], 9, 0, 6, 0, 6, 0, 2, 2, 1, 0);
      setFat(alpha[2], 0, 2, 0, 0, 0, 0, 0, 0, 0, 0);
      setFat(alpha[3], 0, 0, 0, 4, 0, 0, 0, 0, 0, 2);
      setFat(alpha[4], 0, 0, 0, 0, 0, 2, 0, 0, 0, 2);
    }
    return alpha;
  }

  private static void setFat(float[] row, double... coefficients) {
    for (int p = 0; p < coefficients.length; ++p) {
      row[p + 1] = (float) coefficients[p];
    }
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new IllegalArgumentException("Unsupported fatty acid parameter combination: " + message);
    }
  }
}
