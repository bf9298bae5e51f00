package org.fwqpbo;

/**
 * Discretized solver configuration. Built once by {@link AlgoParamsDeriver} and not changed
 * afterwards, except for the second fatty acid pass which works on a copy.
 */
public class AlgoParams {
  public int nR2;
  public double r2Max;
  /** R2* grid step [sec-1]. */
  public double r2Step;
  /** Sorted unique R2* candidate indices on the grid. */
  public int[] iR2cand;
  public int nR2cand;
  public boolean fibSearch;
  public double mu;
  public int nB0;
  public int nICMiter;
  /** 0 runs the graph cut, 100 means no cut. */
  public int graphcutLevel;
  public boolean multiScale;
  public boolean use3D;
  public boolean shiftB0Map;
  /** Largest B0 index change allowed per ICM update. */
  public int maxICMupdate;

  public AlgoParams copy() {
    AlgoParams copy = new AlgoParams();
    copy.nR2 = nR2;
    copy.r2Max = r2Max;
    copy.r2Step = r2Step;
    copy.iR2cand = iR2cand.clone();
    copy.nR2cand = nR2cand;
    copy.fibSearch = fibSearch;
    copy.mu = mu;
    copy.nB0 = nB0;
    copy.nICMiter = nICMiter;
    copy.graphcutLevel = graphcutLevel;
    copy.multiScale = multiScale;
    copy.use3D = use3D;
    copy.shiftB0Map = shiftB0Map;
    copy.maxICMupdate = maxICMupdate;
    return copy;
  }
}
