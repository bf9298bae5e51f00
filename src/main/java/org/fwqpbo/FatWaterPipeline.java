package org.fwqpbo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the three configuration files, loads the data, runs the solver on the whole volume or
 * slice by slice, and writes the derived series.
 */
public class FatWaterPipeline {
  private static final Logger logger = LoggerFactory.getLogger(FatWaterPipeline.class);

  private final FatWaterSolver solver;

  public FatWaterPipeline(FatWaterSolver solver) {
    this.solver = solver;
  }

  public FatWaterResult run(File dataParamFile, File algoParamFile, File modelParamFile)
      throws IOException, FatWaterException {
    DataConfig dataConfig =
        DataConfig.parse(ConfigFile.read(dataParamFile).section(DataConfig.SECTION));
    AlgoConfig algoConfig =
        AlgoConfig.parse(ConfigFile.read(algoParamFile).section(AlgoConfig.SECTION));
    ModelConfig modelConfig =
        ModelConfig.parse(ConfigFile.read(modelParamFile).section(ModelConfig.SECTION));

    // Derive the cheap parts first so configuration errors surface before any image is read.
    AlgoParams aPar = AlgoParamsDeriver.derive(algoConfig);
    ModelParams mPar = ModelParamsDeriver.derive(modelConfig);
    DataParams dPar = DataParamsLoader.load(dataConfig);
    return run(dPar, aPar, mPar);
  }

  public FatWaterResult run(DataParams dPar, AlgoParams aPar, ModelParams mPar)
      throws IOException, FatWaterException {
    logSummary(dPar);
    FatWaterResult result;
    if (aPar.use3D || dPar.sliceList.size() == 1) {
      result = FatWaterProcessor.process(dPar, aPar, mPar, solver);
    } else {
      List<FatWaterResult> slices = new ArrayList<FatWaterResult>();
      for (int z = 0; z < dPar.sliceList.size(); ++z) {
        logger.info("Processing slice {} ({}/{})...",
            dPar.sliceList.get(z) + 1, z + 1, dPar.sliceList.size());
        DataParams sliceDataParams = SlicePartitioner.sliceDataParams(dPar, z);
        slices.add(FatWaterProcessor.process(sliceDataParams, aPar, mPar, solver));
      }
      result = FatWaterResult.stack(slices);
    }
    ImageSynthesizer.saveAll(result, dPar);
    return result;
  }

  private static void logSummary(DataParams dPar) {
    logger.info("B0 = {}", round(dPar.B0));
    logger.info("N = {}", dPar.N);
    logger.info("t1/dt = {}/{} msec", round(dPar.t1 * 1000), round(dPar.dt * 1000));
    logger.info("nx,ny,nz = {},{},{}", dPar.nx, dPar.ny, dPar.nz);
    logger.info("dx,dy,dz = {},{},{}", round(dPar.dx), round(dPar.dy), round(dPar.dz));
  }

  private static String round(double v) {
    return String.format(Locale.ROOT, "%.2f", v);
  }
}
