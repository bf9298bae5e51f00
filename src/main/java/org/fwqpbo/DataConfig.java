package org.fwqpbo;

import java.io.File;
import java.util.List;

/**
 * The {@code [data parameters]} section: where the images are and which part of them to use.
 */
public class DataConfig {
  public static final String SECTION = "data parameters";

  /** Explicit input files; null when {@code dirs} is used. */
  public List<File> files;
  /** Input directories; null when {@code files} is used. */
  public List<File> dirs;
  public File outDir;
  /** Selected echo indices, or null for all. */
  public List<Integer> echoes;
  /** Selected slice indices, or null for all. */
  public List<Integer> sliceList;
  /** [deg C], or null for no temperature correction. */
  public Double temperature;
  public double reScale = 1.0;
  /** Also write synthetic in-phase / opposed-phase images. */
  public boolean inOppPhase;

  public static DataConfig parse(ConfigSection section) throws ConfigException {
    DataConfig config = new DataConfig();
    config.files = section.getFileList("files");
    config.dirs = section.getFileList("dirs");
    if (config.files == null && config.dirs == null) {
      throw new ConfigException("No \"files\" or \"dirs\" found in [" + SECTION + "]");
    }
    if (config.files != null && config.dirs != null) {
      throw new ConfigException("Only one of \"files\" and \"dirs\" may be given in [" + SECTION + "]");
    }
    config.outDir = section.getFile("outdir");
    if (config.outDir == null) {
      throw new ConfigException("No \"outdir\" found in [" + SECTION + "]");
    }
    config.echoes = section.getIntList("echoes");
    config.sliceList = section.getIntList("slicelist");
    config.temperature = section.getOptionalDouble("temp");
    config.reScale = section.getDouble("rescale", 1.0);
    config.inOppPhase = section.getFlag("ipop");
    return config;
  }
}
