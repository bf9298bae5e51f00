package org.fwqpbo;

import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Works out the echo image encoding of a frame set and puts the frames in the canonical order:
 * slice location first, then echo time, then frame type.
 */
public final class FrameClassifier {
  private static final Logger logger = LoggerFactory.getLogger(FrameClassifier.class);

  /** Relative deviation of any echo spacing from the mean spacing that triggers a warning. */
  public static final double ECHO_SPACING_TOLERANCE = 0.05;

  private FrameClassifier() {
  }

  /**
   * Classifies the frame types of {@code frames}.
   *
   * @throws UnsupportedImageTypeException unless the counts form a clean MP, RI or MRI pattern
   */
  public static EchoImageType classify(List<FrameRecord> frames)
      throws UnsupportedImageTypeException {
    int numR = 0;
    int numI = 0;
    int numM = 0;
    int numP = 0;
    for (FrameRecord frame : frames) {
      switch (frame.type) {
        case REAL: ++numR; break;
        case IMAGINARY: ++numI; break;
        case MAGNITUDE: ++numM; break;
        case PHASE: ++numP; break;
        default: break;
      }
    }
    return classify(numR, numI, numM, numP);
  }

  public static EchoImageType classify(int numR, int numI, int numM, int numP)
      throws UnsupportedImageTypeException {
    if (numM + numP == 0 && numR + numI > 0 && numR == numI) {
      return EchoImageType.RI;
    } else if (numM + numP > 0 && numR + numI == 0 && numM == numP) {
      return EchoImageType.MP;
    } else if (numP == 0 && numM + numR + numI > 0 && numM == numR && numR == numI) {
      return EchoImageType.MRI;
    }
    throw new UnsupportedImageTypeException(numR, numI, numM, numP);
  }

  /**
   * Returns the frames in canonical order. Three stable sorts are applied, by type, then echo
   * time, then slice location, so slice location ends up as the dominant key. The input is first
   * put in (file, frame) order so the result does not depend on discovery order.
   */
  public static List<FrameRecord> sort(List<FrameRecord> frames) {
    List<FrameRecord> sorted = new ArrayList<FrameRecord>(frames);
    Collections.sort(sorted, new Comparator<FrameRecord>() {
      @Override
      public int compare(FrameRecord a, FrameRecord b) {
        int c = a.source.getPath().compareTo(b.source.getPath());
        if (c != 0) return c;
        int fa = a.frameIndex == null ? -1 : a.frameIndex;
        int fb = b.frameIndex == null ? -1 : b.frameIndex;
        return Integer.compare(fa, fb);
      }
    });
    Collections.sort(sorted, new Comparator<FrameRecord>() {
      @Override
      public int compare(FrameRecord a, FrameRecord b) {
        return a.type.compareTo(b.type);
      }
    });
    Collections.sort(sorted, new Comparator<FrameRecord>() {
      @Override
      public int compare(FrameRecord a, FrameRecord b) {
        return Double.compare(a.echoTime, b.echoTime);
      }
    });
    Collections.sort(sorted, new Comparator<FrameRecord>() {
      @Override
      public int compare(FrameRecord a, FrameRecord b) {
        return Double.compare(a.sliceLocation, b.sliceLocation);
      }
    });
    return sorted;
  }

  /**
   * Sorted distinct echo times of the frames, in milliseconds.
   */
  public static List<Double> distinctEchoTimes(List<FrameRecord> frames) {
    TreeSet<Double> echoTimes = new TreeSet<Double>();
    for (FrameRecord frame : frames) {
      echoTimes.add(frame.echoTime);
    }
    return new ArrayList<Double>(echoTimes);
  }

  /**
   * Sorted distinct slice locations of the frames.
   */
  public static List<Double> distinctSliceLocations(List<FrameRecord> frames) {
    TreeSet<Double> locations = new TreeSet<Double>();
    for (FrameRecord frame : frames) {
      locations.add(frame.sliceLocation);
    }
    return new ArrayList<Double>(locations);
  }

  /**
   * Mean spacing of ascending echo times.
   */
  public static double meanEchoSpacing(double[] echoTimes) {
    double[] diffs = diffs(echoTimes);
    return diffs.length == 0 ? 0.0 : StatUtils.mean(diffs);
  }

  /**
   * False, with a logged warning, when the largest or smallest spacing deviates from the mean by
   * more than 5%. Jitter is tolerated; callers carry on either way.
   */
  public static boolean isEchoSpacingUniform(double[] echoTimes) {
    double[] diffs = diffs(echoTimes);
    if (diffs.length == 0) return true;
    double dt = StatUtils.mean(diffs);
    boolean uniform = StatUtils.max(diffs) / dt <= 1 + ECHO_SPACING_TOLERANCE
        && StatUtils.min(diffs) / dt >= 1 - ECHO_SPACING_TOLERANCE;
    if (!uniform) {
      logger.warn("Echo inter-spacing varies more than 5%: {}", Arrays.toString(echoTimes));
    }
    return uniform;
  }

  private static double[] diffs(double[] values) {
    if (values.length < 2) return new double[0];
    double[] out = new double[values.length - 1];
    for (int i = 1; i < values.length; ++i) {
      out[i - 1] = values[i] - values[i - 1];
    }
    return out;
  }
}
