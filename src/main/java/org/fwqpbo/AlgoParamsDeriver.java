package org.fwqpbo;

import java.util.TreeSet;

/**
 * Turns the algorithm configuration into {@link AlgoParams}.
 */
public final class AlgoParamsDeriver {
  public static final int GRAPHCUT_LEVEL = 0;
  public static final int NO_GRAPHCUT_LEVEL = 100;

  private AlgoParamsDeriver() {
  }

  public static AlgoParams derive(AlgoConfig config) throws ConfigException {
    AlgoParams params = new AlgoParams();
    params.nR2 = config.nR2;
    params.r2Max = config.r2Max;
    params.r2Step = params.nR2 > 1 ? params.r2Max / (params.nR2 - 1) : 1.0;
    params.iR2cand = r2CandidateIndices(config, params.r2Step);
    params.nR2cand = params.iR2cand.length;
    params.fibSearch = config.fibSearch;
    params.mu = config.mu;
    params.nB0 = config.nB0;
    params.nICMiter = config.nICMiter;
    params.graphcutLevel = config.graphcut ? GRAPHCUT_LEVEL : NO_GRAPHCUT_LEVEL;
    params.multiScale = config.multiScale;
    params.use3D = config.use3D;
    params.shiftB0Map = config.shiftB0Map;
    // Half-even rounding.
    params.maxICMupdate = (int) Math.rint(params.nB0 / 10.0);
    return params;
  }

  static int[] r2CandidateIndices(AlgoConfig config, double r2Step) throws ConfigException {
    TreeSet<Integer> indices = new TreeSet<Integer>();
    for (Double r2 : config.r2Cand) {
      if (r2 < 0) {
        throw new ConfigException("R2* candidates must not be negative: " + r2);
      }
      indices.add(Math.min(config.nR2 - 1, (int) (r2 / r2Step)));
    }
    int[] out = new int[indices.size()];
    int i = 0;
    for (Integer index : indices) {
      out[i++] = index;
    }
    return out;
  }
}
