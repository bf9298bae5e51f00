package org.fwqpbo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DataParamsLoaderTest {
  private static final double DELTA = 1e-9;

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private DataConfig dirConfig(File dir) {
    DataConfig config = new DataConfig();
    config.dirs = Arrays.asList(dir);
    config.outDir = new File(folder.getRoot(), "out");
    return config;
  }

  @Test
  public void testLoadDicomDirectory() throws Exception {
    File dir = folder.newFolder("series");
    TestDicomFiles.writeMagnitudePhaseSeries(dir, new double[] {1.0, 2.0, 3.0, 4.0},
        new double[] {-5, 5}, 2, 3, 100, 0, 2048);
    DataConfig config = dirConfig(dir);
    config.echoes = Arrays.asList(1, 2, 3);
    config.sliceList = Arrays.asList(1);
    config.reScale = 2.0;

    DataParams dPar = DataParamsLoader.load(config);
    assertEquals(EchoImageType.MP, dPar.imageType);
    assertEquals(3, dPar.nx);
    assertEquals(2, dPar.ny);
    assertEquals(1, dPar.nz);
    assertEquals(TestDicomFiles.PIXEL_SPACING_COLUMN, dPar.dx, DELTA);
    assertEquals(TestDicomFiles.PIXEL_SPACING_ROW, dPar.dy, DELTA);
    assertEquals(TestDicomFiles.SLICE_THICKNESS, dPar.dz, DELTA);
    assertEquals(TestDicomFiles.IMAGING_FREQUENCY / DataParamsLoader.GYRO, dPar.B0, DELTA);
    assertEquals(4, dPar.totalN);
    assertEquals(3, dPar.N);
    assertEquals(0.002, dPar.t1, DELTA);
    assertEquals(0.001, dPar.dt, DELTA);
    assertEquals(16, dPar.frameList.size());
    assertFalse(dPar.isMultiFrameSource());
    assertEquals(3 * 1 * 6, dPar.img.length());
    // Zero phase: magnitude times rescale factor.
    assertEquals(200, dPar.img.real[0], 1e-4);
    assertEquals(0, dPar.img.imag[0], 1e-4);
  }

  @Test
  public void testEchoSelectionOutOfRange() throws Exception {
    File dir = folder.newFolder("series");
    TestDicomFiles.writeMagnitudePhaseSeries(dir, new double[] {1.0, 2.0, 3.0},
        new double[] {0}, 1, 1, 100, 0, 2048);
    DataConfig config = dirConfig(dir);
    config.echoes = Arrays.asList(0, 3);
    try {
      DataParamsLoader.load(config);
      fail("Expected ConfigException");
    } catch (ConfigException expected) {
      assertTrue(expected.getMessage().contains("echoes"));
    }
  }

  @Test
  public void testSingleEchoSelectionRejected() throws Exception {
    File dir = folder.newFolder("series");
    TestDicomFiles.writeMagnitudePhaseSeries(dir, new double[] {1.0, 2.0, 3.0},
        new double[] {0}, 1, 1, 100, 0, 2048);
    DataConfig config = dirConfig(dir);
    config.echoes = Arrays.asList(2);
    try {
      DataParamsLoader.load(config);
      fail("Expected ConfigException");
    } catch (ConfigException expected) {
      assertTrue(expected.getMessage().contains("two echoes"));
    }
  }

  @Test
  public void testNoValidFiles() throws Exception {
    File dir = folder.newFolder("empty");
    try {
      DataParamsLoader.load(dirConfig(dir));
      fail("Expected InvalidDatasetException");
    } catch (InvalidDatasetException expected) {
      assertEquals("No valid files found", expected.getMessage());
    }
  }

  @Test
  public void testIncompleteGridRejected() throws Exception {
    List<FrameRecord> frames = Arrays.asList(
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 0, "a"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 0, "b"),
        TestDicomFiles.frame(FrameType.MAGNITUDE, 2, 0, "c"),
        TestDicomFiles.frame(FrameType.PHASE, 2, 0, "d"),
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 5, "e"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 5, "f"));
    List<FrameRecord> sorted = FrameClassifier.sort(frames);
    try {
      DataParamsLoader.checkFrameGrid(sorted, EchoImageType.MP, Arrays.asList(1.0, 2.0),
          Arrays.asList(0.0, 5.0));
      fail("Expected InvalidDatasetException");
    } catch (InvalidDatasetException expected) {
      assertTrue(expected.getMessage().startsWith("Expected 8 frames"));
    }
    DataParamsLoader.checkFrameGrid(sorted.subList(0, 4), EchoImageType.MP,
        Arrays.asList(1.0, 2.0), Arrays.asList(0.0));
  }

  @Test
  public void testDuplicatedEchoCannotStandInForMissingOne() throws Exception {
    // Each pair is internally consistent, but echo 1.0 appears twice and echo 2.0 never.
    List<FrameRecord> frames = Arrays.asList(
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 0, "a"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 0, "b"),
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 0, "c"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 0, "d"));
    try {
      DataParamsLoader.checkFrameGrid(frames, EchoImageType.MP, Arrays.asList(1.0, 2.0),
          Arrays.asList(0.0));
      fail("Expected InvalidDatasetException");
    } catch (InvalidDatasetException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().contains("expected echo time 2.0"));
    }
  }

  @Test
  public void testDuplicatedSliceCannotStandInForMissingOne() throws Exception {
    List<FrameRecord> frames = Arrays.asList(
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 0, "a"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 0, "b"),
        TestDicomFiles.frame(FrameType.MAGNITUDE, 1, 0, "c"),
        TestDicomFiles.frame(FrameType.PHASE, 1, 0, "d"));
    try {
      DataParamsLoader.checkFrameGrid(frames, EchoImageType.MP, Arrays.asList(1.0),
          Arrays.asList(0.0, 5.0));
      fail("Expected InvalidDatasetException");
    } catch (InvalidDatasetException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().contains("at slice location 5.0"));
    }
  }

  @Test
  public void testFromMatlab() throws Exception {
    MatlabDataset data = ComplexImageAssemblerTest.matlabDataset(4, 3, 2, 1, 4);
    DataConfig config = new DataConfig();
    config.outDir = folder.getRoot();
    config.echoes = Arrays.asList(0, 1, 2);

    DataParams dPar = DataParamsLoader.fromMatlab(config, data);
    assertEquals(3, dPar.nx);
    assertEquals(4, dPar.ny);
    assertEquals(2, dPar.nz);
    assertEquals(Arrays.asList(0, 1), dPar.sliceList);
    assertEquals(4, dPar.totalN);
    assertEquals(3, dPar.N);
    assertEquals(3.0, dPar.B0, 0);
    assertEquals(0.0012, dPar.t1, DELTA);
    assertEquals(0.0011, dPar.dt, DELTA);
    assertEquals(1.5, dPar.dx, 0);
    assertEquals(5.0, dPar.dz, 0);
    assertFalse(dPar.hasDicomSource());
    assertEquals(3 * 2 * 12, dPar.img.length());
    // (echo 0, slice 0, row 0, column 1) sits at linear MATLAB index rows*1.
    assertEquals(4, dPar.img.real[1], 0);
  }

  @Test
  public void testFromMatlabRejectsCounterClockwise() {
    MatlabDataset data = ComplexImageAssemblerTest.matlabDataset(2, 2, 1, 1, 3);
    data.precessionIsClockwise = -1;
    DataConfig config = new DataConfig();
    try {
      DataParamsLoader.fromMatlab(config, data);
      fail("Expected InvalidDatasetException");
    } catch (FatWaterException expected) {
      assertTrue(expected instanceof InvalidDatasetException);
      assertTrue(expected.getMessage().contains("clockwise"));
    }
  }
}
