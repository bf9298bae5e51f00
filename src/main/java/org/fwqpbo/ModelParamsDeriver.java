package org.fwqpbo;

import java.util.List;

/**
 * Derives {@link ModelParams} from the model configuration.
 */
public final class ModelParamsDeriver {
  private ModelParamsDeriver() {
  }

  public static ModelParams derive(ModelConfig config) throws ConfigException {
    ModelParams params = new ModelParams();
    params.nResonances = 1 + config.fatCS.size();
    params.cs = new float[params.nResonances];
    params.cs[0] = (float) config.watCS;
    for (int p = 1; p < params.nResonances; ++p) {
      params.cs[p] = config.fatCS.get(p - 1).floatValue();
    }

    params.nFAC = config.nFAC;
    if (params.nFAC < 0 || params.nFAC > 3) {
      throw new ConfigException("Unknown number of FAC parameters: " + params.nFAC);
    }
    if (params.nFAC > 0 && params.nResonances != FattyAcidModel.RESONANCES) {
      throw new ConfigException("FAC expects exactly one water and ten triglyceride resonances, got "
          + params.nResonances + " resonances");
    }
    params.nComponents = 2 + params.nFAC;
    if (config.cl != null) params.cl = config.cl;
    if (config.p2u != null) params.p2u = config.p2u;

    switch (params.nFAC) {
      case 0:
        params.alpha = fatWaterAlpha(params.nResonances, config.relAmps);
        break;
      case 1:
        params.alpha = FattyAcidModel.alphas(params.cl, params.p2u, null);
        break;
      case 2:
        params.alpha = FattyAcidModel.alphas(params.cl, null, null);
        break;
      default:
        params.alpha = FattyAcidModel.alphas(null, null, null);
        break;
    }
    return params;
  }

  /**
   * Two-component alpha: pure water, and fat spread over the fat resonances by the configured
   * relative amplitudes or uniformly.
   */
  static float[][] fatWaterAlpha(int nResonances, List<Double> relAmps) throws ConfigException {
    float[][] alpha = new float[2][nResonances];
    alpha[0][0] = 1f;
    if (relAmps != null) {
      if (relAmps.size() != nResonances - 1) {
        throw new ConfigException("Expected " + (nResonances - 1)
            + " relative amplitudes (one per fat resonance), got " + relAmps.size());
      }
      for (int p = 1; p < nResonances; ++p) {
        alpha[1][p] = relAmps.get(p - 1).floatValue();
      }
    } else {
      for (int p = 1; p < nResonances; ++p) {
        alpha[1][p] = 1f / (nResonances - 1);
      }
    }
    return alpha;
  }
}
