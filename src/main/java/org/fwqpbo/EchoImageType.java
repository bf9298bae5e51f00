package org.fwqpbo;

/**
 * How each echo of a dataset is encoded, and where each component sits among the frames of one
 * echo once frames are sorted.
 */
public enum EchoImageType {
  /** Magnitude/phase pairs. */
  MP(FrameType.MAGNITUDE, FrameType.PHASE),
  /** Real/imaginary pairs. */
  RI(FrameType.IMAGINARY, FrameType.REAL),
  /** Magnitude/real/imaginary triplets. */
  MRI(FrameType.IMAGINARY, FrameType.MAGNITUDE, FrameType.REAL);

  // In sort order, i.e. ascending FrameType order.
  private final FrameType[] slots;

  EchoImageType(FrameType... slots) {
    this.slots = slots;
  }

  /** Number of frames per (slice, echo). */
  public int slotCount() {
    return slots.length;
  }

  /**
   * Offset of {@code type} within the frames of one (slice, echo).
   */
  public int slotOf(FrameType type) {
    for (int i = 0; i < slots.length; ++i) {
      if (slots[i] == type) return i;
    }
    throw new IllegalArgumentException(type + " is not part of " + this);
  }
}
