package org.fwqpbo;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.UID;
import org.dcm4che3.io.DicomOutputStream;

import java.io.File;
import java.io.IOException;

/**
 * Writes datasets as DICOM Part 10 files in Explicit VR Little Endian. The file meta group is
 * regenerated from the SOP Class and SOP Instance UIDs on every write.
 */
public final class DicomFileWriter {
  private DicomFileWriter() {
  }

  public static void write(DicomObject object, File file) throws IOException {
    write(object.dataset, file);
  }

  public static void write(Attributes dataset, File file) throws IOException {
    Attributes fmi = dataset.createFileMetaInformation(UID.ExplicitVRLittleEndian);
    try (DicomOutputStream dos = new DicomOutputStream(file)) {
      dos.writeDataset(fmi, dataset);
    }
  }
}
