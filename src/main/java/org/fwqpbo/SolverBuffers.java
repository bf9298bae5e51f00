package org.fwqpbo;

/**
 * Output buffers the solver writes into. Component maps hold M consecutive blocks of one value
 * per voxel.
 */
public class SolverBuffers {
  public final int voxels;
  public final int components;
  public final float[] xReal;
  public final float[] xImag;
  public final float[] r2Map;
  public final float[] b0Map;

  private SolverBuffers(int voxels, int components, float[] r2Map, float[] b0Map) {
    this.voxels = voxels;
    this.components = components;
    this.xReal = new float[voxels * components];
    this.xImag = new float[voxels * components];
    this.r2Map = r2Map;
    this.b0Map = b0Map;
  }

  public static SolverBuffers allocate(int voxels, int components) {
    return new SolverBuffers(voxels, components, new float[voxels], new float[voxels]);
  }

  /**
   * New component buffers for a different component count, sharing this R2* and B0 map.
   */
  public SolverBuffers withComponents(int newComponents) {
    return new SolverBuffers(voxels, newComponents, r2Map, b0Map);
  }

  /**
   * Component m as a complex image of one value per voxel.
   */
  public ComplexImage component(int m) {
    return new ComplexImage(xReal, xImag).range(m * voxels, voxels);
  }
}
