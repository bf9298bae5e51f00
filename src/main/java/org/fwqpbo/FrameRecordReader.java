package org.fwqpbo;

import org.dcm4che3.data.Tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Extracts {@link FrameRecord}s from DICOM headers.
 */
public final class FrameRecordReader {
  /** Attributes water-fat separation cannot do without. */
  public static final List<Integer> REQUIRED_ATTRIBUTES = Collections.unmodifiableList(
      Arrays.asList(
          Tag.ImageType,
          Tag.EchoTime,
          Tag.SliceLocation,
          Tag.ImagingFrequency,
          Tag.Columns,
          Tag.Rows,
          Tag.PixelSpacing,
          Tag.SliceThickness));

  private FrameRecordReader() {
  }

  /**
   * Resolved value of a required attribute: Image Type becomes a {@link FrameType}, Slice
   * Location falls back to the z component of Image Position (Patient), Pixel Spacing becomes a
   * {row, column} pair and everything else a Double. Null when absent or unusable.
   */
  public static Object getAttribute(DicomObject object, int tag, Integer frame) {
    switch (tag) {
      case Tag.ImageType: {
        String[] values = TagAccessor.getStrings(object, tag, frame);
        return values == null ? null : FrameType.fromImageType(values);
      }
      case Tag.SliceLocation: {
        Double location = TagAccessor.getDouble(object, tag, frame);
        if (location == null) {
          location = TagAccessor.getDouble(object, Tag.ImagePositionPatient, frame, 2);
        }
        return location;
      }
      case Tag.PixelSpacing: {
        Double row = TagAccessor.getDouble(object, tag, frame, 0);
        Double column = TagAccessor.getDouble(object, tag, frame, 1);
        if (row == null || column == null) return null;
        return new double[] {row, column};
      }
      default:
        return TagAccessor.getDouble(object, tag, frame);
    }
  }

  /**
   * True when the attribute is available at dataset level or, for multi-frame objects, in every
   * frame.
   */
  public static boolean hasAttribute(DicomObject object, int tag) {
    if (getAttribute(object, tag, null) != null) return true;
    if (!object.isMultiFrame()) return false;
    for (int frame = 0; frame < object.frameCount(); ++frame) {
      if (getAttribute(object, tag, frame) == null) return false;
    }
    return true;
  }

  /**
   * Keywords of the required attributes {@code object} lacks, e.g. "EchoTime".
   */
  public static List<String> missingAttributes(DicomObject object) {
    List<String> missing = new ArrayList<String>();
    for (int tag : REQUIRED_ATTRIBUTES) {
      if (!hasAttribute(object, tag)) {
        missing.add(TagAccessor.keywordOf(tag));
      }
    }
    return missing;
  }

  /**
   * One record per frame of {@code object}.
   *
   * @throws InvalidDatasetException if a frame lacks a required attribute
   */
  public static List<FrameRecord> toFrameRecords(DicomObject object)
      throws InvalidDatasetException {
    List<FrameRecord> records = new ArrayList<FrameRecord>();
    if (object.isMultiFrame()) {
      for (int frame = 0; frame < object.frameCount(); ++frame) {
        records.add(toFrameRecord(object, frame));
      }
    } else {
      records.add(toFrameRecord(object, null));
    }
    return records;
  }

  static FrameRecord toFrameRecord(DicomObject object, Integer frame)
      throws InvalidDatasetException {
    FrameRecord record = new FrameRecord();
    record.source = object.source;
    record.frameIndex = frame;
    record.type = (FrameType) require(object, Tag.ImageType, frame);
    record.echoTime = (Double) require(object, Tag.EchoTime, frame);
    record.sliceLocation = (Double) require(object, Tag.SliceLocation, frame);
    record.imagingFrequency = (Double) require(object, Tag.ImagingFrequency, frame);
    record.rows = (int) Math.round((Double) require(object, Tag.Rows, frame));
    record.columns = (int) Math.round((Double) require(object, Tag.Columns, frame));
    double[] spacing = (double[]) require(object, Tag.PixelSpacing, frame);
    record.pixelSpacingRow = spacing[0];
    record.pixelSpacingColumn = spacing[1];
    record.sliceThickness = (Double) require(object, Tag.SliceThickness, frame);
    return record;
  }

  private static Object require(DicomObject object, int tag, Integer frame)
      throws InvalidDatasetException {
    Object value = getAttribute(object, tag, frame);
    if (value == null) {
      throw new InvalidDatasetException("Missing " + TagAccessor.keywordOf(tag) + " in " + object
          + (frame == null ? "" : " frame " + frame));
    }
    return value;
  }
}
