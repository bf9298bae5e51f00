package org.fwqpbo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Command-line entry point: {@code FatWaterTool <data params> <algorithm params> <model params>}.
 */
public class FatWaterTool {
  private static final Logger logger = LoggerFactory.getLogger(FatWaterTool.class);

  public static void main(String[] args) {
    if (args.length != 3) {
      System.err.println("Usage: java -jar fwqpbo-1.0.jar <data parameter file> "
          + "<algorithm parameter file> <model parameter file>");
      System.exit(1);
    }
    try {
      FatWaterPipeline pipeline = new FatWaterPipeline(loadSolver());
      pipeline.run(new File(args[0]), new File(args[1]), new File(args[2]));
    } catch (FatWaterException e) {
      logger.error("Fat-water separation failed: {}", e.getMessage(), e);
      System.exit(1);
    } catch (IOException e) {
      logger.error("I/O error: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /**
   * The first {@link FatWaterSolver} registered on the class path.
   */
  static FatWaterSolver loadSolver() throws SolverException {
    Iterator<FatWaterSolver> solvers = ServiceLoader.load(FatWaterSolver.class).iterator();
    if (!solvers.hasNext()) {
      throw new SolverException("No " + FatWaterSolver.class.getName()
          + " implementation found on the class path");
    }
    FatWaterSolver solver = solvers.next();
    logger.info("Using solver {}", solver.getClass().getName());
    return solver;
  }
}
