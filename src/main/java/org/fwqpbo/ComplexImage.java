package org.fwqpbo;

import org.apache.commons.math3.complex.Complex;

/**
 * Flat complex voxel array held as separate single-precision real and imaginary parts, the form
 * the solver consumes.
 */
public class ComplexImage {
  public final float[] real;
  public final float[] imag;

  public ComplexImage(int length) {
    this(new float[length], new float[length]);
  }

  public ComplexImage(float[] real, float[] imag) {
    if (real.length != imag.length) {
      throw new IllegalArgumentException(
          "Real and imaginary parts differ in length: " + real.length + " vs " + imag.length);
    }
    this.real = real;
    this.imag = imag;
  }

  public int length() {
    return real.length;
  }

  public Complex get(int i) {
    return new Complex(real[i], imag[i]);
  }

  public void set(int i, Complex c) {
    real[i] = (float) c.getReal();
    imag[i] = (float) c.getImaginary();
  }

  public float abs(int i) {
    return (float) Math.hypot(real[i], imag[i]);
  }

  public void scale(double factor) {
    for (int i = 0; i < real.length; ++i) {
      real[i] *= factor;
      imag[i] *= factor;
    }
  }

  /**
   * Copy of {@code length} values starting at {@code offset}.
   */
  public ComplexImage range(int offset, int length) {
    ComplexImage out = new ComplexImage(length);
    System.arraycopy(real, offset, out.real, 0, length);
    System.arraycopy(imag, offset, out.imag, 0, length);
    return out;
  }
}
