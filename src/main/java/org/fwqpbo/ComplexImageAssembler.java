package org.fwqpbo;

import ij.process.ImageProcessor;
import org.apache.commons.math3.complex.ComplexUtils;
import org.apache.commons.math3.util.FastMath;
import org.dcm4che3.data.Tag;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the complex (echo, slice, row, column) image from DICOM frames or a MATLAB dataset.
 */
public final class ComplexImageAssembler {
  private ComplexImageAssembler() {
  }

  /**
   * Assembles the selected echoes and slices from canonically sorted frames.
   *
   * @param frames frames in canonical order (see {@link FrameClassifier#sort})
   * @param totalN number of echoes in the source
   */
  public static ComplexImage assembleDicom(List<FrameRecord> frames, EchoImageType type,
      int totalN, List<Integer> echoes, List<Integer> slices, int nx, int ny, double reScale)
      throws IOException, InvalidDatasetException {
    int pixels = nx * ny;
    ComplexImage img = new ComplexImage(echoes.size() * slices.size() * pixels);
    FrameLoader loader = new FrameLoader();
    int slots = type.slotCount();
    int offset = 0;
    for (Integer n : echoes) {
      for (Integer slice : slices) {
        int i = (totalN * slice + n) * slots;
        switch (type) {
          case MP:
            assembleMagnitudePhase(loader,
                frames.get(i + type.slotOf(FrameType.MAGNITUDE)),
                frames.get(i + type.slotOf(FrameType.PHASE)), img, offset);
            break;
          default:
            assembleRealImaginary(loader,
                frames.get(i + type.slotOf(FrameType.REAL)),
                frames.get(i + type.slotOf(FrameType.IMAGINARY)), img, offset);
            break;
        }
        offset += pixels;
      }
    }
    if (offset != img.length()) {
      throw new InvalidDatasetException("Frame size does not match " + nx + "x" + ny);
    }
    img.scale(reScale);
    return img;
  }

  private static void assembleMagnitudePhase(FrameLoader loader, FrameRecord magnFrame,
      FrameRecord phaseFrame, ComplexImage img, int offset)
      throws IOException, InvalidDatasetException {
    float[] magn = loader.pixels(magnFrame);
    float[] phase = loader.pixels(phaseFrame);
    // The phase frame's intercept acts as the phase scale; its sign is vendor dependent.
    Double intercept = TagAccessor.getDouble(
        loader.object(phaseFrame), Tag.RescaleIntercept, phaseFrame.frameIndex);
    if (intercept == null || intercept == 0.0) {
      throw new InvalidDatasetException("Phase frame needs a non-zero Rescale Intercept: " + phaseFrame);
    }
    double scale = 2 * FastMath.PI / FastMath.abs(intercept);
    checkLength(magn, phase, img, offset, magnFrame);
    for (int k = 0; k < magn.length; ++k) {
      img.set(offset + k, ComplexUtils.polar2Complex(magn[k], phase[k] * scale));
    }
  }

  private static void assembleRealImaginary(FrameLoader loader, FrameRecord realFrame,
      FrameRecord imagFrame, ComplexImage img, int offset)
      throws IOException, InvalidDatasetException {
    float[] realPart = loader.pixels(realFrame);
    float[] imagPart = loader.pixels(imagFrame);
    // Real and imaginary frames are assumed to share rescale parameters.
    DicomObject object = loader.object(realFrame);
    Double intercept = TagAccessor.getDouble(
        object, Tag.RescaleIntercept, realFrame.frameIndex);
    Double slope = TagAccessor.getDouble(object, Tag.RescaleSlope, realFrame.frameIndex);
    double rescaleOffset = (intercept == null ? 0.0 : intercept) / (slope == null ? 1.0 : slope);
    checkLength(realPart, imagPart, img, offset, realFrame);
    for (int k = 0; k < realPart.length; ++k) {
      img.real[offset + k] = (float) (realPart[k] + rescaleOffset);
      img.imag[offset + k] = (float) (imagPart[k] + rescaleOffset);
    }
  }

  private static void checkLength(float[] a, float[] b, ComplexImage img, int offset,
      FrameRecord frame) throws InvalidDatasetException {
    if (a.length != b.length || offset + a.length > img.length()) {
      throw new InvalidDatasetException("Unexpected pixel count in " + frame);
    }
  }

  /**
   * Reorders a MATLAB (row, col, slice, coil, echo) array into the selected
   * (echo, slice, row, column) layout.
   *
   * @throws InvalidDatasetException for more than one coil
   */
  public static ComplexImage assembleMatlab(MatlabDataset data, List<Integer> slices,
      List<Integer> echoes, double reScale) throws InvalidDatasetException {
    if (data.coils > 1) {
      throw new InvalidDatasetException(
          "More than one coil (" + data.coils + ") in MATLAB data; coil combination is not supported");
    }
    int ny = data.rows;
    int nx = data.columns;
    ComplexImage img = new ComplexImage(echoes.size() * slices.size() * ny * nx);
    int i = 0;
    for (Integer n : echoes) {
      for (Integer z : slices) {
        for (int y = 0; y < ny; ++y) {
          for (int x = 0; x < nx; ++x) {
            int src = data.index(y, x, z, 0, n);
            img.real[i] = (float) (data.real[src] * reScale);
            img.imag[i] = (float) (data.imag[src] * reScale);
            ++i;
          }
        }
      }
    }
    return img;
  }

  /**
   * Reads pixel data of frames. A multi-frame file is read once and kept; single-frame files are
   * read when needed.
   */
  private static class FrameLoader {
    private final Map<File, DicomObject> multiFrameObjects = new HashMap<File, DicomObject>();
    private File lastFile;
    private DicomObject lastObject;

    DicomObject object(FrameRecord frame) throws IOException {
      if (frame.frameIndex != null) {
        DicomObject object = multiFrameObjects.get(frame.source);
        if (object == null) {
          object = DicomFileReader.read(frame.source);
          multiFrameObjects.put(frame.source, object);
        }
        return object;
      }
      if (!frame.source.equals(lastFile)) {
        lastObject = DicomFileReader.read(frame.source);
        lastFile = frame.source;
      }
      return lastObject;
    }

    float[] pixels(FrameRecord frame) throws IOException {
      DicomObject object = object(frame);
      int index = frame.frameIndex == null ? 0 : frame.frameIndex;
      ImageProcessor ip = PixelDataCodec.readFrame(object, index);
      return PixelDataCodec.toFloats(ip);
    }
  }
}
