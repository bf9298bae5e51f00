package org.fwqpbo;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.VR;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Converts between native (uncompressed, little-endian) DICOM pixel data and ImageJ processors.
 */
public final class PixelDataCodec {
  private PixelDataCodec() {
  }

  /**
   * Decodes one frame into an image processor: unsigned 8/16-bit data as byte/short processors,
   * signed or 32-bit data as a float processor holding the stored values.
   */
  public static ImageProcessor readFrame(DicomObject object, int frame) throws IOException {
    Attributes ds = object.dataset;
    int rows = ds.getInt(Tag.Rows, -1);
    int columns = ds.getInt(Tag.Columns, -1);
    int bitsAllocated = ds.getInt(Tag.BitsAllocated, 16);
    int pixelRepresentation = ds.getInt(Tag.PixelRepresentation, 0);
    int samplesPerPixel = ds.getInt(Tag.SamplesPerPixel, 1);
    if (rows <= 0 || columns <= 0) {
      throw new IOException("Missing image dimensions in " + object);
    }
    if (samplesPerPixel != 1) {
      throw new IOException("Only single-sample (grayscale) pixel data is supported: " + object);
    }
    byte[] bytes = ds.getBytes(Tag.PixelData);
    if (bytes == null) {
      throw new IOException("No pixel data in " + object);
    }
    int bytesPerPixel = bitsAllocated / 8;
    int pixels = rows * columns;
    long offset = (long) frame * pixels * bytesPerPixel;
    if (offset + (long) pixels * bytesPerPixel > bytes.length) {
      throw new IOException("Frame " + frame + " lies beyond the pixel data of " + object);
    }
    ByteBuffer b = ByteBuffer.wrap(bytes, (int) offset, pixels * bytesPerPixel)
        .order(ByteOrder.LITTLE_ENDIAN);
    boolean signed = pixelRepresentation == 1;

    switch (bitsAllocated) {
      case 8: {
        byte[] out = new byte[pixels];
        b.get(out);
        if (!signed) {
          return new ByteProcessor(columns, rows, out);
        }
        float[] values = new float[pixels];
        for (int i = 0; i < pixels; ++i) values[i] = out[i];
        return new FloatProcessor(columns, rows, values);
      }
      case 16: {
        short[] out = new short[pixels];
        b.asShortBuffer().get(out);
        if (!signed) {
          return new ShortProcessor(columns, rows, out, null);
        }
        float[] values = new float[pixels];
        for (int i = 0; i < pixels; ++i) values[i] = out[i];
        return new FloatProcessor(columns, rows, values);
      }
      case 32: {
        float[] values = new float[pixels];
        for (int i = 0; i < pixels; ++i) {
          int v = b.getInt();
          values[i] = signed ? v : (float) (v & 0xffffffffL);
        }
        return new FloatProcessor(columns, rows, values);
      }
      default:
        throw new IOException("Unsupported Bits Allocated " + bitsAllocated + " in " + object);
    }
  }

  /**
   * Flattens a processor row by row into stored pixel values.
   */
  public static float[] toFloats(ImageProcessor ip) {
    int n = ip.getPixelCount();
    float[] out = new float[n];
    for (int i = 0; i < n; ++i) {
      out[i] = ip.getf(i);
    }
    return out;
  }

  /**
   * Replaces the image pixel module of {@code ds} with unsigned 16-bit grayscale pixels from
   * {@code stack}, one frame per slice.
   */
  public static void setPixelData(Attributes ds, ImageStack stack) {
    ds.setInt(Tag.Rows, VR.US, stack.getHeight());
    ds.setInt(Tag.Columns, VR.US, stack.getWidth());
    ds.setInt(Tag.SamplesPerPixel, VR.US, 1);
    ds.setInt(Tag.BitsAllocated, VR.US, 16);
    ds.setInt(Tag.BitsStored, VR.US, 16);
    ds.setInt(Tag.HighBit, VR.US, 15);
    ds.setInt(Tag.PixelRepresentation, VR.US, 0);
    ds.setBytes(Tag.PixelData, VR.OW, encode(stack));
  }

  /**
   * Little-endian unsigned 16-bit pixel data for every slice of the stack, in stack order.
   */
  public static byte[] encode(ImageStack stack) {
    int pixels = stack.getWidth() * stack.getHeight();
    ByteBuffer b = ByteBuffer.allocate(stack.getSize() * pixels * 2).order(ByteOrder.LITTLE_ENDIAN);
    for (int z = 1; z <= stack.getSize(); z++) {
      short[] slice = (short[]) stack.getProcessor(z).convertToShort(false).getPixels();
      b.asShortBuffer().put(slice);
      b.position(b.position() + slice.length * 2);
    }
    return b.array();
  }
}
