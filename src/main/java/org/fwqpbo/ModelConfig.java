package org.fwqpbo;

import java.util.Collections;
import java.util.List;

/**
 * The {@code [model parameters]} section as written by the user. Optional values are null when
 * absent.
 */
public class ModelConfig {
  public static final String SECTION = "model parameters";

  // [ppm]
  public double watCS = 4.7;
  // [ppm]
  public List<Double> fatCS = Collections.singletonList(1.3);
  public int nFAC;
  /** Fatty acid chain length. */
  public Double cl;
  /** Polyunsaturation to unsaturation ratio. */
  public Double p2u;
  /** Relative amplitudes of the fat resonances (nFAC = 0 only). */
  public List<Double> relAmps;

  public static ModelConfig parse(ConfigSection section) throws ConfigException {
    ModelConfig config = new ModelConfig();
    config.watCS = section.getDouble("watcs", config.watCS);
    List<Double> fatCS = section.getDoubleList("fatcs");
    if (fatCS != null) config.fatCS = fatCS;
    config.nFAC = section.getInt("nfac", 0);
    config.cl = section.getOptionalDouble("cl");
    config.p2u = section.getOptionalDouble("p2u");
    config.relAmps = section.getDoubleList("relamps");
    return config;
  }
}
