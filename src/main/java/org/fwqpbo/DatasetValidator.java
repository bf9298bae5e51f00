package org.fwqpbo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a set of DICOM files holds what water-fat separation needs.
 */
public final class DatasetValidator {
  private static final Logger logger = LoggerFactory.getLogger(DatasetValidator.class);

  /** Fewest distinct echo times a dataset may have. */
  public static final int MIN_ECHOES = 3;

  private DatasetValidator() {
  }

  /**
   * Keeps the files that can be read and carry every required attribute. Other files are
   * skipped with a warning.
   */
  public static List<File> getValidFiles(List<File> files) {
    List<File> valid = new ArrayList<File>();
    for (File file : files) {
      DicomObject object;
      try {
        object = DicomFileReader.readHeader(file);
      } catch (IOException e) {
        logger.warn("Could not read file: {} ({})", file, e.getMessage());
        continue;
      }
      List<String> missing = FrameRecordReader.missingAttributes(object);
      if (!missing.isEmpty()) {
        logger.warn("File {} is missing required DICOM tags: {}", file, missing);
        continue;
      }
      valid.add(file);
    }
    return valid;
  }

  /**
   * Validates a candidate file set.
   *
   * @throws IOException if a file cannot be read at all
   * @throws InvalidDatasetException if the set mixes a multi-frame file with other files
   */
  public static ValidationResult validate(List<File> files)
      throws IOException, InvalidDatasetException {
    if (files.isEmpty()) {
      return ValidationResult.fail("No files in dataset");
    }
    List<DicomObject> objects = readHeaders(files);
    for (DicomObject object : objects) {
      List<String> missing = FrameRecordReader.missingAttributes(object);
      if (!missing.isEmpty()) {
        return ValidationResult.fail(
            "File " + object.source + " is missing required DICOM tags: " + missing);
      }
    }
    List<FrameRecord> frames = new ArrayList<FrameRecord>();
    for (DicomObject object : objects) {
      frames.addAll(FrameRecordReader.toFrameRecords(object));
    }
    return validateFrames(frames);
  }

  /**
   * Reads the headers of {@code files}, enforcing that a multi-frame file comes alone.
   */
  public static List<DicomObject> readHeaders(List<File> files)
      throws IOException, InvalidDatasetException {
    List<DicomObject> objects = new ArrayList<DicomObject>();
    for (File file : files) {
      DicomObject object = DicomFileReader.readHeader(file);
      if (object.isMultiFrame() && files.size() > 1) {
        throw new InvalidDatasetException(
            "Support for multiple multi-frame DICOM files is not implemented: " + file);
      }
      logger.debug("{}: {} frame(s)", file, object.frameCount());
      objects.add(object);
    }
    return objects;
  }

  /**
   * Type composition, echo count and scan-wide consistency checks over extracted frames.
   */
  public static ValidationResult validateFrames(List<FrameRecord> frames) {
    try {
      FrameClassifier.classify(frames);
    } catch (UnsupportedImageTypeException e) {
      return ValidationResult.fail(e.getMessage());
    }
    if (FrameClassifier.distinctEchoTimes(frames).size() < MIN_ECHOES) {
      return ValidationResult.fail("Less than three echo times in dataset");
    }
    Set<Double> frequencies = new HashSet<Double>();
    Set<Integer> rows = new HashSet<Integer>();
    Set<Integer> columns = new HashSet<Integer>();
    Set<Double> spacingRows = new HashSet<Double>();
    Set<Double> spacingColumns = new HashSet<Double>();
    Set<Double> thicknesses = new HashSet<Double>();
    for (FrameRecord frame : frames) {
      frequencies.add(frame.imagingFrequency);
      rows.add(frame.rows);
      columns.add(frame.columns);
      spacingRows.add(frame.pixelSpacingRow);
      spacingColumns.add(frame.pixelSpacingColumn);
      thicknesses.add(frame.sliceThickness);
    }
    if (frequencies.size() > 1) {
      return ValidationResult.fail("Multiple imaging frequencies in dataset");
    }
    if (rows.size() > 1) {
      return ValidationResult.fail("Multiple image sizes (rows) in dataset");
    }
    if (columns.size() > 1) {
      return ValidationResult.fail("Multiple image sizes (columns) in dataset");
    }
    if (spacingRows.size() > 1) {
      return ValidationResult.fail("Multiple voxel sizes (row spacing) in dataset");
    }
    if (spacingColumns.size() > 1) {
      return ValidationResult.fail("Multiple voxel sizes (column spacing) in dataset");
    }
    if (thicknesses.size() > 1) {
      return ValidationResult.fail("Multiple slice thicknesses in dataset");
    }
    return ValidationResult.pass();
  }
}
