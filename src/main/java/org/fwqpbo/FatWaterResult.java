package org.fwqpbo;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Real-valued output maps of one job, one value per voxel in (slice, row, column) order.
 */
public class FatWaterResult {
  public final int voxels;
  private final Map<OutputSeries, float[]> maps = new EnumMap<OutputSeries, float[]>(OutputSeries.class);

  public FatWaterResult(int voxels) {
    this.voxels = voxels;
  }

  public void put(OutputSeries series, float[] map) {
    if (map.length != voxels) {
      throw new IllegalArgumentException(
          series + " has " + map.length + " values, expected " + voxels);
    }
    maps.put(series, map);
  }

  public float[] get(OutputSeries series) {
    return maps.get(series);
  }

  public boolean has(OutputSeries series) {
    return maps.containsKey(series);
  }

  public Set<OutputSeries> series() {
    return maps.keySet();
  }

  /**
   * Concatenates per-slice results into one volume result. All parts must hold the same series.
   */
  public static FatWaterResult stack(List<FatWaterResult> parts) {
    int voxels = 0;
    for (FatWaterResult part : parts) {
      voxels += part.voxels;
    }
    FatWaterResult volume = new FatWaterResult(voxels);
    if (parts.isEmpty()) return volume;
    for (OutputSeries series : parts.get(0).series()) {
      float[] map = new float[voxels];
      int offset = 0;
      for (FatWaterResult part : parts) {
        float[] slice = part.get(series);
        if (slice == null) {
          throw new IllegalArgumentException("Slice result is missing " + series);
        }
        System.arraycopy(slice, 0, map, offset, part.voxels);
        offset += part.voxels;
      }
      volume.put(series, map);
    }
    return volume;
  }
}
