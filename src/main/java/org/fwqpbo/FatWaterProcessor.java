package org.fwqpbo;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the solver on one job and turns its raw output into the derived maps.
 */
public final class FatWaterProcessor {
  private static final Logger logger = LoggerFactory.getLogger(FatWaterProcessor.class);

  static final double EPS = Math.ulp(1.0);

  private FatWaterProcessor() {
  }

  /**
   * Water-only, fat-only, fat fraction and field maps, plus in/opposed phase when requested and
   * fatty acid composition maps when {@code mPar.nFAC > 0}.
   */
  public static FatWaterResult process(DataParams dPar, AlgoParams aPar, ModelParams mPar,
      FatWaterSolver solver) throws SolverException {
    if (dPar.temperature != null) {
      // Hernando 2014
      mPar = mPar.withWaterShift(waterShiftAt(dPar.temperature));
    }
    int nVxl = dPar.voxelCount();

    // With FAC, B0 and R2* come from a constrained fat-water pass first.
    ModelParams firstPass = mPar.nFAC > 0
        ? mPar.withAlpha(FattyAcidModel.alphas(mPar.cl, mPar.p2u, FattyAcidModel.FIRST_PASS_UD))
        : mPar;
    SolverBuffers buffers = SolverBuffers.allocate(nVxl, firstPass.nComponents);
    solver.solve(SolverRequest.of(dPar, aPar, firstPass), buffers);

    ComplexImage wat = buffers.component(0);
    ComplexImage fat = totalFat(buffers, firstPass);
    FatWaterResult result = new FatWaterResult(nVxl);
    result.put(OutputSeries.WATER, abs(wat));
    result.put(OutputSeries.FAT, abs(fat));
    if (dPar.inOppPhase) {
      result.put(OutputSeries.IN_PHASE, combine(wat, fat, 1));
      result.put(OutputSeries.OPPOSED_PHASE, combine(wat, fat, -1));
    }
    result.put(OutputSeries.FAT_FRACTION, fatFraction(wat, fat));

    if (mPar.nFAC > 0) {
      AlgoParams fixedMaps = aPar.copy();
      fixedMaps.nICMiter = 0;
      fixedMaps.graphcutLevel = AlgoParamsDeriver.NO_GRAPHCUT_LEVEL;
      SolverRequest request = SolverRequest.of(dPar, fixedMaps, mPar);
      request.fixedFieldMaps = true;
      SolverBuffers facBuffers = buffers.withComponents(mPar.nComponents);
      solver.solve(request, facBuffers);
      putFattyAcidMaps(result, facBuffers, mPar.nFAC);
    }

    if (aPar.nR2 > 1) {
      result.put(OutputSeries.R2_MAP, buffers.r2Map.clone());
    } else {
      logger.warn("Skipping {} map: R2* is not estimated with nR2 = {}",
          OutputSeries.R2_MAP.description, aPar.nR2);
    }
    float[] b0 = buffers.b0Map.clone();
    if (aPar.shiftB0Map) {
      shiftB0Map(b0, dPar.dt, dPar.B0);
    }
    result.put(OutputSeries.B0_MAP, b0);
    return result;
  }

  /** Water chemical shift [ppm] at {@code temperature} [deg C]. */
  static double waterShiftAt(double temperature) {
    return 1.3 + 3.748 - .01085 * temperature;
  }

  /**
   * Sum of the fat components, each weighted by its total fat amplitude.
   */
  static ComplexImage totalFat(SolverBuffers buffers, ModelParams mPar) {
    int nVxl = buffers.voxels;
    ComplexImage fat = new ComplexImage(nVxl);
    for (int m = 1; m < mPar.nComponents; ++m) {
      double weight = mPar.fatWeight(m);
      int offset = m * nVxl;
      for (int i = 0; i < nVxl; ++i) {
        fat.real[i] += weight * buffers.xReal[offset + i];
        fat.imag[i] += weight * buffers.xImag[offset + i];
      }
    }
    return fat;
  }

  static float[] fatFraction(ComplexImage wat, ComplexImage fat) {
    float[] ff = new float[wat.length()];
    for (int i = 0; i < ff.length; ++i) {
      double w = wat.abs(i);
      double f = fat.abs(i);
      ff[i] = (float) (f / (w + f + EPS));
    }
    return ff;
  }

  /**
   * Half-period shift of the B0 map: adds Omega/2 and wraps values above Omega.
   */
  static void shiftB0Map(float[] b0, double dt, double fieldStrength) {
    double omega = 1.0 / dt / DataParamsLoader.GYRO / fieldStrength;
    for (int i = 0; i < b0.length; ++i) {
      b0[i] += omega / 2;
      if (b0[i] > omega) {
        b0[i] -= omega;
      }
    }
  }

  private static void putFattyAcidMaps(FatWaterResult result, SolverBuffers x, int nFAC) {
    int nVxl = x.voxels;
    float[] ud = new float[nVxl];
    float[] pud = nFAC > 1 ? new float[nVxl] : null;
    float[] cl = nFAC > 2 ? new float[nVxl] : null;
    for (int i = 0; i < nVxl; ++i) {
      Complex f1 = component(x, 1, i).add(EPS);
      Complex f2 = component(x, 2, i);
      if (nFAC == 1) {
        // UD = F2/F1
        ud[i] = (float) f2.divide(f1).abs();
      } else if (nFAC == 2) {
        // UD = (F2+F3)/F1, PUD = F3/F1
        Complex f3 = component(x, 3, i);
        ud[i] = (float) f2.add(f3).divide(f1).abs();
        pud[i] = (float) f3.divide(f1).abs();
      } else {
        // CL = 4+(F2+4F3+3F4)/3F1, UD = (F3+F4)/F1, PUD = F4/F1
        Complex f3 = component(x, 3, i);
        Complex f4 = component(x, 4, i);
        Complex f1x3 = component(x, 1, i).multiply(3).add(EPS);
        cl[i] = (float) (4 + f2.add(f3.multiply(4)).add(f4.multiply(3)).divide(f1x3).abs());
        ud[i] = (float) f3.add(f4).divide(f1).abs();
        pud[i] = (float) f4.divide(f1).abs();
      }
    }
    if (cl != null) result.put(OutputSeries.CHAIN_LENGTH, cl);
    result.put(OutputSeries.UNSATURATION_DEGREE, ud);
    if (pud != null) result.put(OutputSeries.POLYUNSATURATION_DEGREE, pud);
    logger.debug("Derived fatty acid composition maps for nFAC={}", nFAC);
  }

  private static Complex component(SolverBuffers x, int m, int i) {
    int k = m * x.voxels + i;
    return new Complex(x.xReal[k], x.xImag[k]);
  }

  private static float[] abs(ComplexImage c) {
    float[] out = new float[c.length()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = c.abs(i);
    }
    return out;
  }

  private static float[] combine(ComplexImage wat, ComplexImage fat, int sign) {
    float[] out = new float[wat.length()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = (float) Math.hypot(wat.real[i] + sign * fat.real[i], wat.imag[i] + sign * fat.imag[i]);
    }
    return out;
  }
}
