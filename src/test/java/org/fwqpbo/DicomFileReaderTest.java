package org.fwqpbo;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Fragments;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.dcm4che3.io.DicomInputStream;
import org.dcm4che3.io.DicomOutputStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DicomFileReaderTest {
  private static final String JPEG_BASELINE = "1.2.840.10008.1.2.4.50";

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testSingleFrameRoundTrip() throws IOException {
    File file = TestDicomFiles.writeSingleFrame(folder.newFile("im.dcm"), FrameType.PHASE, 2.3,
        -12.5, 2, 3, TestDicomFiles.ramp(6), -2048, 1);

    DicomObject object = DicomFileReader.read(file);
    assertFalse(object.isMultiFrame());
    assertEquals(file, object.source);
    assertArrayEquals(new String[] {"ORIGINAL", "PRIMARY", "P", "ND"},
        object.dataset.getStrings(Tag.ImageType));
    assertEquals(2.3, object.dataset.getDouble(Tag.EchoTime, 0), 0);
    assertEquals(-12.5, object.dataset.getDouble(Tag.SliceLocation, 0), 0);
    assertEquals(-2048, object.dataset.getDouble(Tag.RescaleIntercept, 0), 0);
    assertEquals(2, object.dataset.getInt(Tag.Rows, -1));
    assertEquals(3, object.dataset.getInt(Tag.Columns, -1));

    ImageProcessor ip = PixelDataCodec.readFrame(object, 0);
    assertTrue(ip instanceof ShortProcessor);
    assertEquals(3, ip.getWidth());
    assertEquals(2, ip.getHeight());
    assertArrayEquals(new float[] {0, 1, 2, 3, 4, 5}, PixelDataCodec.toFloats(ip), 0);
  }

  @Test
  public void testWriterUsesExplicitVrLittleEndian() throws IOException {
    File file = TestDicomFiles.writeSingleFrame(folder.newFile("im.dcm"), FrameType.MAGNITUDE,
        2.3, 0, 2, 2, TestDicomFiles.ramp(4), 0, 1);
    try (DicomInputStream dis = new DicomInputStream(file)) {
      Attributes fmi = dis.readFileMetaInformation();
      assertEquals(UID.ExplicitVRLittleEndian, fmi.getString(Tag.TransferSyntaxUID));
      assertEquals(UID.MRImageStorage, fmi.getString(Tag.MediaStorageSOPClassUID));
    }
  }

  @Test
  public void testReadHeaderStopsBeforePixelData() throws IOException {
    File file = TestDicomFiles.writeSingleFrame(folder.newFile("im.dcm"), FrameType.MAGNITUDE,
        2.3, 0, 2, 2, TestDicomFiles.ramp(4), 0, 1);
    DicomObject header = DicomFileReader.readHeader(file);
    assertFalse(header.dataset.contains(Tag.PixelData));
    assertEquals(2.3, header.dataset.getDouble(Tag.EchoTime, 0), 0);
  }

  @Test
  public void testImplicitVrTemplateKeepsVrsOnRewrite() throws IOException {
    Attributes ds = TestDicomFiles.singleFrame(
        FrameType.MAGNITUDE, 2.3, 0, 2, 2, TestDicomFiles.ramp(4), 0, 1);
    ds.setString(Tag.PatientName, VR.PN, "Doe^Jane");
    ds.setDouble(Tag.ImageOrientationPatient, VR.DS, 1, 0, 0, 0, 1, 0);
    ds.setString(Tag.FrameOfReferenceUID, VR.UI, "1.2.3.4.5");
    File file = TestDicomFiles.writeImplicitVr(folder.newFile("implicit.dcm"), ds);

    DicomObject object = DicomFileReader.read(file);
    assertEquals(2.3, TagAccessor.getDouble(object, Tag.EchoTime, null), 0);
    assertTrue(FrameRecordReader.missingAttributes(object).isEmpty());
    File out = folder.newFile("explicit.dcm");
    DicomFileWriter.write(object, out);

    Attributes reread = DicomFileReader.read(out).dataset;
    assertEquals(VR.PN, reread.getVR(Tag.PatientName));
    assertEquals(VR.DS, reread.getVR(Tag.ImageOrientationPatient));
    assertEquals(VR.UI, reread.getVR(Tag.FrameOfReferenceUID));
    assertEquals("Doe^Jane", reread.getString(Tag.PatientName));
    assertEquals(6, reread.getDoubles(Tag.ImageOrientationPatient).length);
    assertArrayEquals(new float[] {0, 1, 2, 3},
        PixelDataCodec.toFloats(PixelDataCodec.readFrame(DicomFileReader.read(out), 0)), 0);
  }

  @Test
  public void testReadsSignedVeryLongElement() throws IOException {
    Attributes ds = TestDicomFiles.singleFrame(
        FrameType.MAGNITUDE, 2.3, 0, 2, 2, TestDicomFiles.ramp(4), 0, 1);
    byte[] value = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(-5L).array();
    ds.setString(0x00090010, VR.LO, "FWQPBO");
    ds.setBytes(0x00091001, VR.SV, value);
    File file = folder.newFile("sv.dcm");
    DicomFileWriter.write(ds, file);

    DicomObject object = DicomFileReader.read(file);
    assertEquals(VR.SV, object.dataset.getVR(0x00091001));
    assertArrayEquals(value, object.dataset.getBytes(0x00091001));
    assertEquals(2.3, TagAccessor.getDouble(object, Tag.EchoTime, null), 0);
  }

  @Test
  public void testRejectsEncapsulatedPixelData() throws IOException {
    Attributes ds = TestDicomFiles.imageAttributes(2, 2);
    ds.addAll(TestDicomFiles.frameAttributes(FrameType.MAGNITUDE, 2.3, 0, 0, 1));
    Fragments fragments = ds.newFragments(Tag.PixelData, VR.OB, 2);
    fragments.add(new byte[0]);
    fragments.add(new byte[] {1, 2, 3, 4});
    File file = folder.newFile("jpeg.dcm");
    try (DicomOutputStream dos = new DicomOutputStream(file)) {
      dos.writeDataset(ds.createFileMetaInformation(JPEG_BASELINE), ds);
    }

    // Headers are still usable for validation.
    assertTrue(FrameRecordReader.missingAttributes(DicomFileReader.readHeader(file)).isEmpty());
    try {
      DicomFileReader.read(file);
      fail("Expected IOException");
    } catch (IOException expected) {
      assertTrue(expected.getMessage().startsWith("Encapsulated"));
    }
  }

  @Test
  public void testMultiFrameNestedSequences() throws IOException {
    List<Attributes> frames = Arrays.asList(
        TestDicomFiles.frameAttributes(FrameType.MAGNITUDE, 1.1, 0, 0, 1),
        TestDicomFiles.frameAttributes(FrameType.PHASE, 1.1, 0, 3141, 1),
        TestDicomFiles.frameAttributes(FrameType.MAGNITUDE, 2.2, 0, 0, 1));
    short[] pixels = TestDicomFiles.ramp(12);
    File file = TestDicomFiles.writeMultiFrame(folder.newFile("mf.dcm"), frames, 2, 2, pixels);

    DicomObject object = DicomFileReader.read(file);
    assertTrue(object.isMultiFrame());
    assertEquals(3, object.frameCount());
    assertEquals(3141, TagAccessor.getDouble(object, Tag.RescaleIntercept, 1), 0);
    assertEquals(2.2, TagAccessor.getDouble(object, Tag.EchoTime, 2), 0);
    // Shared attributes are reachable from every frame.
    assertEquals(TestDicomFiles.IMAGING_FREQUENCY,
        TagAccessor.getDouble(object, Tag.ImagingFrequency, 2), 0);

    assertArrayEquals(new float[] {8, 9, 10, 11},
        PixelDataCodec.toFloats(PixelDataCodec.readFrame(object, 2)), 0);
  }

  @Test
  public void testRetainFramesSurvivesRewrite() throws IOException {
    List<Attributes> frames = Arrays.asList(
        TestDicomFiles.frameAttributes(FrameType.MAGNITUDE, 1.1, 0, 0, 1),
        TestDicomFiles.frameAttributes(FrameType.PHASE, 1.1, 0, 0, 1),
        TestDicomFiles.frameAttributes(FrameType.MAGNITUDE, 2.2, 5, 0, 1));
    File file = TestDicomFiles.writeMultiFrame(
        folder.newFile("mf.dcm"), frames, 1, 1, TestDicomFiles.ramp(3));
    DicomObject object = DicomFileReader.read(file);
    object.retainFrames(Arrays.asList(2, 0));
    object.dataset.setInt(Tag.NumberOfFrames, VR.IS, 2);
    File out = folder.newFile("out.dcm");
    DicomFileWriter.write(object, out);

    DicomObject reread = DicomFileReader.read(out);
    assertEquals(2, reread.frameCount());
    assertEquals(5, TagAccessor.getDouble(reread, Tag.SliceLocation, 0), 0);
    assertEquals(0, TagAccessor.getDouble(reread, Tag.SliceLocation, 1), 0);
  }

  @Test
  public void testRejectsNonDicomFile() throws IOException {
    File file = folder.newFile("notes.txt");
    FileOutputStream out = new FileOutputStream(file);
    try {
      out.write("not a DICOM file".getBytes("US-ASCII"));
    } finally {
      out.close();
    }
    try {
      DicomFileReader.readHeader(file);
      fail("Expected IOException");
    } catch (IOException expected) {
      // not a DICOM stream
    }
  }
}
