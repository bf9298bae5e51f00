package org.fwqpbo;

import us.hebi.matlab.mat.format.Mat5;
import us.hebi.matlab.mat.types.MatFile;
import us.hebi.matlab.mat.types.Matrix;
import us.hebi.matlab.mat.types.Struct;

import java.io.File;
import java.io.IOException;

/**
 * Reads the {@code imDataParams} struct of the ISMRM fat-water toolbox from a MAT file.
 */
public final class MatlabDataReader {
  public static final String STRUCT_NAME = "imDataParams";

  private MatlabDataReader() {
  }

  public static MatlabDataset read(File file) throws IOException, InvalidDatasetException {
    MatFile mat;
    try {
      mat = Mat5.readFromFile(file);
    } catch (IOException e) {
      throw new IOException("Could not read MATLAB file " + file, e);
    }
    Struct data;
    try {
      data = mat.getStruct(STRUCT_NAME);
    } catch (RuntimeException e) {
      throw new InvalidDatasetException("No " + STRUCT_NAME + " struct in " + file);
    }

    MatlabDataset out = new MatlabDataset();
    Matrix images = field(data, "images", file);
    int[] dims = images.getDimensions();
    if (dims.length > 5) {
      throw new InvalidDatasetException("Expected (row,col,slice,coil,echo) images in " + file
          + ", got " + dims.length + " dimensions");
    }
    // MATLAB drops trailing singleton dimensions.
    int[] shape = {1, 1, 1, 1, 1};
    System.arraycopy(dims, 0, shape, 0, dims.length);
    out.rows = shape[0];
    out.columns = shape[1];
    out.slices = shape[2];
    out.coils = shape[3];
    out.echoes = shape[4];
    int n = images.getNumElements();
    out.real = new double[n];
    out.imag = new double[n];
    boolean complex = images.isComplex();
    for (int i = 0; i < n; ++i) {
      out.real[i] = images.getDouble(i);
      out.imag[i] = complex ? images.getImaginaryDouble(i) : 0.0;
    }

    Matrix te = field(data, "TE", file);
    out.echoTimes = new double[te.getNumElements()];
    for (int i = 0; i < out.echoTimes.length; ++i) {
      out.echoTimes[i] = te.getDouble(i);
    }
    out.fieldStrength = field(data, "FieldStrength", file).getDouble(0);
    out.precessionIsClockwise = field(data, "PrecessionIsClockwise", file).getDouble(0);
    return out;
  }

  private static Matrix field(Struct data, String name, File file) throws InvalidDatasetException {
    try {
      return data.getMatrix(name);
    } catch (RuntimeException e) {
      throw new InvalidDatasetException("Missing field " + STRUCT_NAME + "." + name + " in " + file);
    }
  }
}
