package org.fwqpbo;

import java.util.Locale;

/**
 * Echo image component carried by one frame. Declaration order is the alphabetical order of the
 * one-letter codes, which fixes the slot order within an echo after sorting.
 */
public enum FrameType {
  IMAGINARY('I'),
  MAGNITUDE('M'),
  PHASE('P'),
  REAL('R');

  // Order in which Image Type values are searched.
  private static final FrameType[] LOOKUP_ORDER = {MAGNITUDE, PHASE, REAL, IMAGINARY};

  public final char code;

  FrameType(char code) {
    this.code = code;
  }

  /**
   * Maps the values of an Image Type attribute to a frame type. The first of M, P, R, I found
   * among the values wins; the full component names are accepted too.
   *
   * @return null if no value names a component
   */
  public static FrameType fromImageType(String[] values) {
    for (FrameType type : LOOKUP_ORDER) {
      for (String value : values) {
        if (value == null) continue;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals(String.valueOf(type.code)) || v.equals(type.name())) {
          return type;
        }
      }
    }
    return null;
  }
}
