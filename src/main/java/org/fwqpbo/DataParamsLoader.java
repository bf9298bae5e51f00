package org.fwqpbo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds {@link DataParams} from the data configuration: finds the input files, validates them,
 * orders the frames and assembles the complex image.
 */
public final class DataParamsLoader {
  private static final Logger logger = LoggerFactory.getLogger(DataParamsLoader.class);

  /** 1H gyromagnetic ratio [MHz/T]. */
  public static final double GYRO = 42.58;

  // Voxel size assumed for MATLAB data, which does not carry one [mm].
  static final double MATLAB_DX = 1.5;
  static final double MATLAB_DY = 1.5;
  static final double MATLAB_DZ = 5.0;

  private DataParamsLoader() {
  }

  public static DataParams load(DataConfig config) throws IOException, FatWaterException {
    List<File> candidates = config.files != null ? config.files : listFiles(config.dirs);
    List<File> validFiles = DatasetValidator.getValidFiles(candidates);
    if (!validFiles.isEmpty()) {
      return loadDicom(config, validFiles);
    }
    if (config.files != null && config.files.size() == 1
        && config.files.get(0).getName().toLowerCase(Locale.ROOT).endsWith(".mat")) {
      return loadMatlab(config, config.files.get(0));
    }
    throw new InvalidDatasetException("No valid files found");
  }

  /**
   * Regular files of each directory, sorted by name within a directory.
   */
  static List<File> listFiles(List<File> dirs) throws IOException {
    List<File> files = new ArrayList<File>();
    for (File dir : dirs) {
      File[] entries = dir.listFiles();
      if (entries == null) {
        throw new IOException("Not a readable directory: " + dir);
      }
      Arrays.sort(entries);
      for (File entry : entries) {
        if (entry.isFile()) {
          files.add(entry);
        }
      }
    }
    return files;
  }

  static DataParams loadDicom(DataConfig config, List<File> files)
      throws IOException, FatWaterException {
    ValidationResult validation = DatasetValidator.validate(files);
    if (!validation.valid) {
      throw new InvalidDatasetException(validation.reason);
    }
    List<FrameRecord> frames = new ArrayList<FrameRecord>();
    for (DicomObject object : DatasetValidator.readHeaders(files)) {
      frames.addAll(FrameRecordReader.toFrameRecords(object));
    }
    frames = FrameClassifier.sort(frames);
    EchoImageType type = FrameClassifier.classify(frames);
    logger.info("Image type: {}", type);
    if (logger.isDebugEnabled()) {
      for (FrameRecord frame : frames) {
        logger.debug("{}", frame);
      }
    }

    DataParams dPar = newDataParams(config);
    FrameRecord first = frames.get(0);
    dPar.dx = first.pixelSpacingColumn;
    dPar.dy = first.pixelSpacingRow;
    dPar.dz = first.sliceThickness;
    dPar.B0 = first.imagingFrequency / GYRO;
    dPar.nx = first.columns;
    dPar.ny = first.rows;

    List<Double> echoTimesMs = FrameClassifier.distinctEchoTimes(frames);
    dPar.totalN = echoTimesMs.size();
    List<Double> sliceLocations = FrameClassifier.distinctSliceLocations(frames);
    int nSlices = sliceLocations.size();
    checkFrameGrid(frames, type, echoTimesMs, sliceLocations);

    double[] allEchoTimes = new double[dPar.totalN];
    for (int n = 0; n < dPar.totalN; ++n) {
      allEchoTimes[n] = echoTimesMs.get(n) / 1000.0;
    }
    selectEchoes(dPar, config.echoes, allEchoTimes);
    dPar.sliceList = select("slicelist", config.sliceList, nSlices);
    dPar.nz = dPar.sliceList.size();

    dPar.frameList = frames;
    dPar.imageType = type;
    dPar.img = ComplexImageAssembler.assembleDicom(frames, type, dPar.totalN, dPar.echoes,
        dPar.sliceList, dPar.nx, dPar.ny, dPar.reScale);
    return dPar;
  }

  static DataParams loadMatlab(DataConfig config, File file)
      throws IOException, FatWaterException {
    return fromMatlab(config, MatlabDataReader.read(file));
  }

  static DataParams fromMatlab(DataConfig config, MatlabDataset data) throws FatWaterException {
    if (data.precessionIsClockwise != 1) {
      throw new InvalidDatasetException("Not clockwise precession; only clockwise precession is supported");
    }
    if (data.echoTimes.length != data.echoes) {
      throw new InvalidDatasetException(
          "TE holds " + data.echoTimes.length + " values for " + data.echoes + " echoes");
    }
    DataParams dPar = newDataParams(config);
    dPar.B0 = data.fieldStrength;
    dPar.ny = data.rows;
    dPar.nx = data.columns;
    dPar.totalN = data.echoes;
    dPar.sliceList = select("slicelist", config.sliceList, data.slices);
    dPar.nz = dPar.sliceList.size();
    selectEchoes(dPar, config.echoes, data.echoTimes);
    dPar.dx = MATLAB_DX;
    dPar.dy = MATLAB_DY;
    dPar.dz = MATLAB_DZ;
    dPar.img = ComplexImageAssembler.assembleMatlab(data, dPar.sliceList, dPar.echoes, dPar.reScale);
    return dPar;
  }

  private static DataParams newDataParams(DataConfig config) {
    DataParams dPar = new DataParams();
    dPar.outDir = config.outDir;
    dPar.reScale = config.reScale;
    dPar.temperature = config.temperature;
    dPar.inOppPhase = config.inOppPhase;
    return dPar;
  }

  /**
   * Picks the configured echoes out of {@code allEchoTimes} [sec] and sets N, t1 and dt.
   */
  static void selectEchoes(DataParams dPar, List<Integer> configured, double[] allEchoTimes)
      throws ConfigException {
    dPar.echoes = select("echoes", configured, allEchoTimes.length);
    if (dPar.echoes.size() < 2) {
      throw new ConfigException("At least two echoes must be selected, got " + dPar.echoes);
    }
    dPar.N = dPar.echoes.size();
    dPar.echoTimes = new double[dPar.N];
    for (int n = 0; n < dPar.N; ++n) {
      dPar.echoTimes[n] = allEchoTimes[dPar.echoes.get(n)];
    }
    dPar.t1 = dPar.echoTimes[0];
    dPar.dt = FrameClassifier.meanEchoSpacing(dPar.echoTimes);
    FrameClassifier.isEchoSpacingUniform(dPar.echoTimes);
  }

  static List<Integer> select(String key, List<Integer> configured, int available)
      throws ConfigException {
    if (configured == null) {
      List<Integer> all = new ArrayList<Integer>();
      for (int i = 0; i < available; ++i) {
        all.add(i);
      }
      return all;
    }
    for (Integer index : configured) {
      if (index < 0 || index >= available) {
        throw new ConfigException(
            "Index " + index + " in \"" + key + "\" is out of range [0, " + available + ")");
      }
    }
    return new ArrayList<Integer>(configured);
  }

  /**
   * The assembler indexes frames as (slice, echo, slot); the sorted frames must fill that grid.
   * Group (z, n) must hold the n-th distinct echo time at the z-th distinct slice location.
   */
  static void checkFrameGrid(List<FrameRecord> frames, EchoImageType type,
      List<Double> echoTimes, List<Double> sliceLocations) throws InvalidDatasetException {
    int slots = type.slotCount();
    int totalN = echoTimes.size();
    int nSlices = sliceLocations.size();
    int expected = nSlices * totalN * slots;
    if (frames.size() != expected) {
      throw new InvalidDatasetException("Expected " + expected + " frames (" + nSlices
          + " slices x " + totalN + " echoes x " + slots + " image types), found " + frames.size());
    }
    for (int g = 0; g < nSlices * totalN; ++g) {
      double echoTime = echoTimes.get(g % totalN);
      double sliceLocation = sliceLocations.get(g / totalN);
      for (int s = 0; s < slots; ++s) {
        FrameRecord frame = frames.get(g * slots + s);
        if (type.slotOf(frame.type) != s
            || frame.echoTime != echoTime
            || frame.sliceLocation != sliceLocation) {
          throw new InvalidDatasetException("Incomplete echo/slice grid at frame " + frame
              + ": expected echo time " + echoTime + " at slice location " + sliceLocation);
        }
      }
    }
  }
}
