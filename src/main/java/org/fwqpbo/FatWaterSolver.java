package org.fwqpbo;

/**
 * The voxel-wise estimator of water, fat, R2* and B0. Implementations are found through
 * {@link java.util.ServiceLoader}.
 */
public interface FatWaterSolver {
  /**
   * Solves one job and writes component maps, the R2* map and the B0 map into {@code buffers}.
   * When {@link SolverRequest#fixedFieldMaps} is set, the R2* and B0 maps already in the buffers
   * are used as given.
   */
  void solve(SolverRequest request, SolverBuffers buffers) throws SolverException;
}
