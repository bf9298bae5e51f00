package org.fwqpbo;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.ElementDictionary;
import org.dcm4che3.data.VR;

/**
 * Reads and writes attributes on a {@link DicomObject}, resolving per-frame overrides of
 * multi-frame objects before falling back to the shared dataset-level value. Tags are the
 * {@link org.dcm4che3.data.Tag} constants.
 */
public final class TagAccessor {
  private TagAccessor() {
  }

  /**
   * Returns the attribute set that holds {@code tag}, or null if it is absent. With a frame index
   * on a multi-frame object the frame's override group is consulted first.
   */
  public static Attributes get(DicomObject object, int tag, Integer frame) {
    if (frame != null) {
      Attributes group = object.frameGroup(frame);
      if (group != null && group.contains(tag)) {
        return group;
      }
    }
    return object.dataset.contains(tag) ? object.dataset : null;
  }

  public static Attributes get(DicomObject object, int tag) {
    return get(object, tag, null);
  }

  public static String getString(DicomObject object, int tag, Integer frame) {
    Attributes attrs = get(object, tag, frame);
    return attrs == null ? null : attrs.getString(tag);
  }

  public static String[] getStrings(DicomObject object, int tag, Integer frame) {
    Attributes attrs = get(object, tag, frame);
    return attrs == null ? null : attrs.getStrings(tag);
  }

  /**
   * First numeric value of the attribute, or null when absent, empty or not numeric.
   */
  public static Double getDouble(DicomObject object, int tag, Integer frame) {
    return getDouble(object, tag, frame, 0);
  }

  public static Double getDouble(DicomObject object, int tag, Integer frame, int index) {
    Attributes attrs = get(object, tag, frame);
    if (attrs == null) return null;
    try {
      double value = attrs.getDouble(tag, index, Double.NaN);
      return Double.isNaN(value) ? null : value;
    } catch (IllegalArgumentException | UnsupportedOperationException e) {
      return null;
    }
  }

  /**
   * Overwrites the attribute where it is found (frame override first, then dataset level),
   * keeping its VR. When it is found nowhere a new attribute is created, in the frame's override
   * group if there is one, but only if {@code vr} is given.
   *
   * @return false if nothing was written
   */
  public static boolean set(DicomObject object, int tag, Object value, Integer frame, VR vr) {
    Attributes group = frame == null ? null : object.frameGroup(frame);
    Attributes target;
    if (group != null && group.contains(tag)) {
      target = group;
    } else if (object.dataset.contains(tag)) {
      target = object.dataset;
    } else if (vr == null) {
      return false;
    } else {
      target = group != null ? group : object.dataset;
    }
    VR existing = target.getVR(tag);
    setValue(target, tag, existing != null ? existing : vr, value);
    return true;
  }

  public static boolean set(DicomObject object, int tag, Object value) {
    return set(object, tag, value, null, null);
  }

  private static void setValue(Attributes attrs, int tag, VR vr, Object value) {
    if (value == null) {
      attrs.setNull(tag, vr);
    } else if (value instanceof Number) {
      Number number = (Number) value;
      switch (vr) {
        case DS:
        case FD:
        case FL:
          attrs.setDouble(tag, vr, number.doubleValue());
          break;
        case IS:
        case SS:
        case US:
        case SL:
        case UL:
          attrs.setInt(tag, vr, (int) Math.round(number.doubleValue()));
          break;
        default:
          attrs.setString(tag, vr, number.toString());
          break;
      }
    } else if (value instanceof byte[]) {
      attrs.setBytes(tag, vr, (byte[]) value);
    } else {
      attrs.setString(tag, vr, value.toString());
    }
  }

  /**
   * Dictionary keyword of a tag, e.g. "EchoTime", for messages.
   */
  public static String keywordOf(int tag) {
    String keyword = ElementDictionary.keywordOf(tag, null);
    return keyword == null || keyword.isEmpty()
        ? String.format("(%04X,%04X)", tag >>> 16, tag & 0xffff)
        : keyword;
  }
}
