package org.fwqpbo;

import ij.ImageStack;
import ij.process.ShortProcessor;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.dcm4che3.util.UIDUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Writes real-valued maps as DICOM series. Headers come from the source frames when there are
 * any, otherwise they are built from scratch.
 */
public final class ImageSynthesizer {
  private static final Logger logger = LoggerFactory.getLogger(ImageSynthesizer.class);

  static final int MAX_PIXEL_VALUE = 65535;
  static final String PROTOCOL_NAME = "Derived Image";

  private ImageSynthesizer() {
  }

  /**
   * Saves every map of {@code result} under {@code dPar.outDir}.
   */
  public static void saveAll(FatWaterResult result, DataParams dPar) throws IOException {
    for (OutputSeries series : result.series()) {
      save(new File(dPar.outDir, series.directory), result.get(series), dPar,
          series.rescaleIntercept, series.rescaleSlope, series.description, series.seriesNumber);
    }
  }

  /**
   * Writes one series. Pixels are stored as (value - intercept) / slope, truncated at zero. A
   * null slope is derived so the image maximum maps to 2^15.
   */
  public static void save(File outDir, float[] image, DataParams dPar, double reScaleIntercept,
      Double reScaleSlope, String seriesDescription, int seriesNumber) throws IOException {
    logger.info("Writing image{} to \"{}\"", dPar.nz > 1 ? "s" : "", outDir);
    int pixels = dPar.nx * dPar.ny;
    if (image.length != pixels * dPar.nz) {
      throw new IllegalArgumentException("Image has " + image.length + " values, expected "
          + pixels * dPar.nz);
    }
    if (reScaleSlope == null) {
      reScaleSlope = autoSlope(image);
      logger.info("Rescale slope calculated to: {}", reScaleSlope);
    }
    if (!outDir.isDirectory() && !outDir.mkdirs()) {
      throw new IOException("Could not create directory " + outDir);
    }

    String seriesInstanceUid = UIDUtils.createUID();
    String studyInstanceUid = dPar.hasDicomSource() ? null : UIDUtils.createUID();
    boolean multiFrame = dPar.isMultiFrameSource();
    DicomObject volume = null;
    ImageStack stack = new ImageStack(dPar.nx, dPar.ny);
    List<Integer> frames = new ArrayList<Integer>();
    if (multiFrame) {
      volume = DicomFileReader.read(dPar.frameList.get(0).source);
      if (!volume.isMultiFrame()) {
        throw new IOException("Expected a multi-frame DICOM file: " + volume);
      }
    }

    for (int z = 0; z < dPar.nz; ++z) {
      int slice = dPar.sliceList.get(z);
      ShortProcessor ip = toPixels(image, z * pixels, dPar.nx, dPar.ny, reScaleIntercept, reScaleSlope);
      double[] window = percentileWindow(ip);

      DicomObject ds;
      Integer iFrame;
      if (dPar.hasDicomSource()) {
        // First frame of this slice.
        FrameRecord frame = dPar.frameList.get(dPar.totalN * slice * dPar.imageType.slotCount());
        iFrame = frame.frameIndex;
        ds = multiFrame ? volume : DicomFileReader.read(frame.source);
      } else {
        iFrame = null;
        ds = newSecondaryCapture(dPar.nx, dPar.ny, studyInstanceUid);
      }

      TagAccessor.set(ds, Tag.SOPInstanceUID, UIDUtils.createUID(), iFrame, VR.UI);
      TagAccessor.set(ds, Tag.SOPClassUID, UID.SecondaryCaptureImageStorage, iFrame, VR.UI);
      TagAccessor.set(ds, Tag.SeriesInstanceUID, seriesInstanceUid, iFrame, VR.UI);
      TagAccessor.set(ds, Tag.SeriesNumber, seriesNumber, iFrame, VR.IS);
      TagAccessor.set(ds, Tag.EchoTime, 0.0, iFrame, VR.DS);
      TagAccessor.set(ds, Tag.ProtocolName, PROTOCOL_NAME, iFrame, VR.LO);
      TagAccessor.set(ds, Tag.SeriesDescription, seriesDescription, iFrame, VR.LO);
      // Only updated where the source already has them.
      TagAccessor.set(ds, Tag.SmallestImagePixelValue, (int) ip.getMin(), iFrame, null);
      TagAccessor.set(ds, Tag.LargestImagePixelValue, (int) ip.getMax(), iFrame, null);
      TagAccessor.set(ds, Tag.WindowCenter, (int) window[0], iFrame, VR.DS);
      TagAccessor.set(ds, Tag.WindowWidth, (int) window[1], iFrame, VR.DS);
      TagAccessor.set(ds, Tag.RescaleIntercept, reScaleIntercept, iFrame, VR.DS);
      TagAccessor.set(ds, Tag.RescaleSlope, reScaleSlope, iFrame, VR.DS);

      if (multiFrame) {
        stack.addSlice(ip);
        frames.add(iFrame);
      } else {
        ImageStack single = new ImageStack(dPar.nx, dPar.ny);
        single.addSlice(ip);
        PixelDataCodec.setPixelData(ds.dataset, single);
        DicomFileWriter.write(ds, new File(outDir, slice + ".dcm"));
      }
    }

    if (multiFrame) {
      // The file meta group is built from the dataset-level SOP UIDs.
      volume.dataset.setString(Tag.SOPInstanceUID, VR.UI, UIDUtils.createUID());
      volume.dataset.setString(Tag.SOPClassUID, VR.UI, UID.SecondaryCaptureImageStorage);
      volume.dataset.setInt(Tag.NumberOfFrames, VR.IS, frames.size());
      volume.retainFrames(frames);
      PixelDataCodec.setPixelData(volume.dataset, stack);
      DicomFileWriter.write(volume, new File(outDir, "0.dcm"));
    }
  }

  /**
   * Display window (center, width) spanning the 2.5th to 97.5th percentile of the pixels.
   */
  public static double[] percentileWindow(ShortProcessor ip) {
    double[] values = new double[ip.getPixelCount()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = ip.get(i);
    }
    return percentileWindow(values);
  }

  public static double[] percentileWindow(double[] values) {
    Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    percentile.setData(values);
    double lo = percentile.evaluate(2.5);
    double hi = percentile.evaluate(97.5);
    double width = hi - lo;
    return new double[] {width / 2 + lo, width};
  }

  static double autoSlope(float[] image) {
    double[] values = new double[image.length];
    for (int i = 0; i < image.length; ++i) {
      values[i] = image[i];
    }
    double max = values.length == 0 ? 0.0 : StatUtils.max(values);
    return max > 0 ? max / (1 << 15) : 1.0;
  }

  /**
   * One slice of {@code image} as unsigned 16-bit pixels.
   */
  static ShortProcessor toPixels(float[] image, int offset, int nx, int ny, double intercept,
      double slope) {
    short[] out = new short[nx * ny];
    for (int k = 0; k < out.length; ++k) {
      double v = Math.max(0.0, (image[offset + k] - intercept) / slope);
      out[k] = (short) (int) Math.min(MAX_PIXEL_VALUE, v);
    }
    ShortProcessor ip = new ShortProcessor(nx, ny, out, null);
    ip.resetMinAndMax();
    return ip;
  }

  /**
   * Header for a derived image without a DICOM source.
   */
  static DicomObject newSecondaryCapture(int nx, int ny, String studyInstanceUid) {
    Attributes ds = new Attributes();
    Date now = new Date();
    ds.setString(Tag.Modality, VR.CS, "WSD");
    ds.setDate(Tag.ContentDate, VR.DA, now);
    ds.setDate(Tag.ContentTime, VR.TM, now);
    ds.setInt(Tag.SamplesPerPixel, VR.US, 1);
    ds.setString(Tag.PhotometricInterpretation, VR.CS, "MONOCHROME2");
    ds.setInt(Tag.PixelRepresentation, VR.US, 0);
    ds.setInt(Tag.HighBit, VR.US, 15);
    ds.setInt(Tag.BitsStored, VR.US, 16);
    ds.setInt(Tag.BitsAllocated, VR.US, 16);
    ds.setInt(Tag.SmallestImagePixelValue, VR.US, 0);
    ds.setInt(Tag.LargestImagePixelValue, VR.US, MAX_PIXEL_VALUE);
    ds.setInt(Tag.Columns, VR.US, nx);
    ds.setInt(Tag.Rows, VR.US, ny);
    DicomObject object = new DicomObject(null, ds);
    TagAccessor.set(object, Tag.StudyInstanceUID, studyInstanceUid, null, VR.UI);
    return object;
  }
}
