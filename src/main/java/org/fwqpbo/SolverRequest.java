package org.fwqpbo;

/**
 * Everything the solver reads: measured signal, geometry, timing, signal model and search
 * settings. Arrays are flat; the signal is (echo, slice, row, column).
 */
public class SolverRequest {
  public float[] yReal;
  public float[] yImag;
  public int N;
  public int nx;
  public int ny;
  public int nz;
  public float dx;
  public float dy;
  public float dz;
  public float t1;
  public float dt;
  public float B0;
  public float[] cs;
  /** M x P relative amplitudes, row-major. */
  public float[] alpha;
  public int M;
  public int P;
  public float r2Step;
  public int nR2;
  public int[] iR2cand;
  public int nR2cand;
  public boolean fibSearch;
  public float mu;
  public int nB0;
  public int nICMiter;
  public int maxICMupdate;
  public int graphcutLevel;
  public boolean multiScale;
  /** Keep the R2* and B0 maps passed in the buffers instead of estimating them. */
  public boolean fixedFieldMaps;

  public static SolverRequest of(DataParams dPar, AlgoParams aPar, ModelParams mPar) {
    SolverRequest r = new SolverRequest();
    r.yReal = dPar.img.real;
    r.yImag = dPar.img.imag;
    r.N = dPar.N;
    r.nx = dPar.nx;
    r.ny = dPar.ny;
    r.nz = dPar.nz;
    r.dx = (float) dPar.dx;
    r.dy = (float) dPar.dy;
    r.dz = (float) dPar.dz;
    r.t1 = (float) dPar.t1;
    r.dt = (float) dPar.dt;
    r.B0 = (float) dPar.B0;
    r.cs = mPar.cs.clone();
    r.alpha = mPar.flatAlpha();
    r.M = mPar.nComponents;
    r.P = mPar.nResonances;
    r.r2Step = (float) aPar.r2Step;
    r.nR2 = aPar.nR2;
    r.iR2cand = aPar.iR2cand.clone();
    r.nR2cand = aPar.nR2cand;
    r.fibSearch = aPar.fibSearch;
    r.mu = (float) aPar.mu;
    r.nB0 = aPar.nB0;
    r.nICMiter = aPar.nICMiter;
    r.maxICMupdate = aPar.maxICMupdate;
    r.graphcutLevel = aPar.graphcutLevel;
    r.multiScale = aPar.multiScale;
    return r;
  }

  public int voxelCount() {
    return nx * ny * nz;
  }
}
