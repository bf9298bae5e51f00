package org.fwqpbo;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Fragments;
import org.dcm4che3.data.Tag;
import org.dcm4che3.io.DicomInputStream;
import org.dcm4che3.io.DicomInputStream.IncludeBulkData;

import java.io.File;
import java.io.IOException;

/**
 * Reads DICOM Part 10 files into {@link DicomObject}s. Any transfer syntax dcm4che can parse is
 * accepted for headers; pixel data must be native (not encapsulated) and little endian.
 */
public final class DicomFileReader {
  private DicomFileReader() {
  }

  /**
   * Reads the whole file, pixel data included.
   */
  public static DicomObject read(File file) throws IOException {
    Attributes dataset = readDataset(file, -1);
    if (dataset.getValue(Tag.PixelData) instanceof Fragments) {
      throw new IOException("Encapsulated (compressed) pixel data is not supported: " + file);
    }
    if (dataset.bigEndian()) {
      throw new IOException("Big endian pixel data is not supported: " + file);
    }
    return new DicomObject(file, dataset);
  }

  /**
   * Reads all attributes up to, but not including, the pixel data.
   */
  public static DicomObject readHeader(File file) throws IOException {
    return new DicomObject(file, readDataset(file, Tag.PixelData));
  }

  private static Attributes readDataset(File file, int stopTag) throws IOException {
    try (DicomInputStream dis = new DicomInputStream(file)) {
      dis.setIncludeBulkData(IncludeBulkData.YES);
      return dis.readDataset(-1, stopTag);
    } catch (RuntimeException e) {
      // Garbled streams can surface as unchecked exceptions from the parser.
      throw new IOException("Malformed DICOM file " + file + ": " + e, e);
    }
  }
}
