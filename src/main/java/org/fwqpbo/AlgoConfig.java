package org.fwqpbo;

import java.util.Collections;
import java.util.List;

/**
 * The {@code [algorithm parameters]} section as written by the user.
 */
public class AlgoConfig {
  public static final String SECTION = "algorithm parameters";

  public int nR2 = 1;
  // [sec-1]
  public double r2Max = 100.0;
  public List<Double> r2Cand = Collections.singletonList(0.0);
  public boolean fibSearch;
  public double mu = 1.0;
  public int nB0 = 100;
  public int nICMiter;
  public boolean graphcut;
  public boolean multiScale;
  public boolean use3D;
  public boolean shiftB0Map;

  public static AlgoConfig parse(ConfigSection section) throws ConfigException {
    AlgoConfig config = new AlgoConfig();
    config.nR2 = section.getInt("nr2", config.nR2);
    config.r2Max = section.getDouble("r2max", config.r2Max);
    List<Double> r2Cand = section.getDoubleList("r2cand");
    if (r2Cand != null) config.r2Cand = r2Cand;
    config.fibSearch = section.getFlag("fibsearch");
    config.mu = section.getDouble("mu", config.mu);
    config.nB0 = section.getInt("nb0", config.nB0);
    config.nICMiter = section.getInt("nicmiter", config.nICMiter);
    config.graphcut = section.getFlag("graphcut");
    config.multiScale = section.getFlag("multiscale");
    config.use3D = section.getFlag("use3d");
    config.shiftB0Map = section.getFlag("shiftb0map");
    if (config.nR2 < 1) {
      throw new ConfigException("nR2 must be at least 1, got " + config.nR2);
    }
    if (config.nB0 < 1) {
      throw new ConfigException("nB0 must be at least 1, got " + config.nB0);
    }
    return config;
  }
}
