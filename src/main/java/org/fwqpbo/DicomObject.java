package org.fwqpbo;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;

import java.io.File;
import java.util.List;

/**
 * A DICOM file held in memory, either a classic single-frame image or a multi-frame image whose
 * per-frame functional group items carry attribute overrides.
 */
public class DicomObject {
  /**
   * Philips stores per-frame overrides in a single-item private sequence inside each item of the
   * per-frame functional group sequence.
   */
  public static final int PRIVATE_FRAME_GROUP = 0x2005140F;

  /** Where the object was read from; null for objects built from scratch. */
  public final File source;
  public final Attributes dataset;

  public DicomObject(File source, Attributes dataset) {
    this.source = source;
    this.dataset = dataset;
  }

  /**
   * Multi-frame when Number of Frames is greater than one and a per-frame functional group
   * sequence is present.
   */
  public static boolean isMultiFrame(Attributes dataset) {
    try {
      return dataset.getInt(Tag.NumberOfFrames, 1) > 1
          && dataset.contains(Tag.PerFrameFunctionalGroupsSequence);
    } catch (NumberFormatException e) {
      return false;
    }
  }

  public boolean isMultiFrame() {
    return isMultiFrame(dataset);
  }

  public int frameCount() {
    if (!isMultiFrame()) return 1;
    return dataset.getSequence(Tag.PerFrameFunctionalGroupsSequence).size();
  }

  /**
   * The nested group holding overrides for {@code frame}, or null when the frame has none.
   */
  public Attributes frameGroup(int frame) {
    if (!isMultiFrame()) return null;
    Attributes item = dataset.getNestedDataset(Tag.PerFrameFunctionalGroupsSequence, frame);
    return item == null ? null : item.getNestedDataset(PRIVATE_FRAME_GROUP);
  }

  /**
   * Keeps only the listed per-frame items, in the given order.
   */
  public void retainFrames(List<Integer> frames) {
    Sequence items = dataset.getSequence(Tag.PerFrameFunctionalGroupsSequence);
    if (items == null) {
      throw new IllegalStateException("No per-frame functional groups in " + this);
    }
    Attributes[] kept = new Attributes[frames.size()];
    for (int i = 0; i < kept.length; ++i) {
      kept[i] = new Attributes(items.get(frames.get(i)));
    }
    Sequence retained = dataset.newSequence(Tag.PerFrameFunctionalGroupsSequence, kept.length);
    for (Attributes item : kept) {
      retained.add(item);
    }
  }

  @Override
  public String toString() {
    return (source == null ? "<synthetic>" : source.getPath())
        + (isMultiFrame() ? " [" + frameCount() + " frames]" : "");
  }
}
