package org.fwqpbo;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.VR;

import org.junit.Before;
import org.junit.Test;

public class TagAccessorTest {
  private DicomObject multiFrame;
  private DicomObject singleFrame;

  @Before
  public void setUp() {
    Attributes shared = TestDicomFiles.imageAttributes(2, 2);
    shared.setDouble(Tag.EchoTime, VR.DS, 1.0);
    shared.setInt(Tag.NumberOfFrames, VR.IS, 2);
    Sequence items = shared.newSequence(Tag.PerFrameFunctionalGroupsSequence, 2);
    // Frame 0 overrides echo time, frame 1 has an empty override group.
    Attributes override = new Attributes();
    override.setDouble(Tag.EchoTime, VR.DS, 4.6);
    items.add(item(override));
    items.add(item(new Attributes()));
    multiFrame = new DicomObject(null, shared);

    Attributes single = TestDicomFiles.imageAttributes(2, 2);
    single.setDouble(Tag.EchoTime, VR.DS, 2.3);
    singleFrame = new DicomObject(null, single);
  }

  private static Attributes item(Attributes group) {
    Attributes item = new Attributes();
    item.newSequence(DicomObject.PRIVATE_FRAME_GROUP, 1).add(group);
    return item;
  }

  @Test
  public void testGetPrefersFrameOverride() {
    assertTrue(multiFrame.isMultiFrame());
    assertEquals(2, multiFrame.frameCount());
    assertEquals(4.6, TagAccessor.getDouble(multiFrame, Tag.EchoTime, 0), 0);
    assertEquals(1.0, TagAccessor.getDouble(multiFrame, Tag.EchoTime, 1), 0);
    assertEquals(1.0, TagAccessor.getDouble(multiFrame, Tag.EchoTime, null), 0);
    assertSame(multiFrame.frameGroup(0), TagAccessor.get(multiFrame, Tag.EchoTime, 0));
  }

  @Test
  public void testGetSingleFrame() {
    assertFalse(singleFrame.isMultiFrame());
    assertNull(singleFrame.frameGroup(0));
    assertEquals(2.3, TagAccessor.getDouble(singleFrame, Tag.EchoTime, null), 0);
    assertNull(TagAccessor.get(singleFrame, Tag.WindowCenter));
    assertEquals(TestDicomFiles.PIXEL_SPACING_COLUMN,
        TagAccessor.getDouble(singleFrame, Tag.PixelSpacing, null, 1), 0);
    assertNull(TagAccessor.getDouble(singleFrame, Tag.PixelSpacing, null, 2));
  }

  @Test
  public void testGetDoubleOfNonNumericValue() {
    assertNull(TagAccessor.getDouble(singleFrame, Tag.Modality, null));
  }

  @Test
  public void testSetOverwritesFrameOverride() {
    assertTrue(TagAccessor.set(multiFrame, Tag.EchoTime, 0.0, 0, null));
    assertEquals(0.0, multiFrame.frameGroup(0).getDouble(Tag.EchoTime, -1), 0);
    // Shared value untouched.
    assertEquals(1.0, multiFrame.dataset.getDouble(Tag.EchoTime, -1), 0);
  }

  @Test
  public void testSetFallsBackToSharedValue() {
    assertTrue(TagAccessor.set(multiFrame, Tag.EchoTime, 9.0, 1, null));
    assertEquals(9.0, multiFrame.dataset.getDouble(Tag.EchoTime, -1), 0);
    assertFalse(multiFrame.frameGroup(1).contains(Tag.EchoTime));
  }

  @Test
  public void testSetWithoutVrFailsForMissingAttribute() {
    assertFalse(TagAccessor.set(singleFrame, Tag.WindowWidth, 100, null, null));
    assertFalse(singleFrame.dataset.contains(Tag.WindowWidth));
  }

  @Test
  public void testSetCreatesAttribute() {
    assertTrue(TagAccessor.set(singleFrame, Tag.WindowWidth, 100, null, VR.DS));
    assertEquals(VR.DS, singleFrame.dataset.getVR(Tag.WindowWidth));
    assertEquals(100, singleFrame.dataset.getDouble(Tag.WindowWidth, -1), 0);

    // Created inside the frame group when the frame has one.
    assertTrue(TagAccessor.set(multiFrame, Tag.WindowCenter, 50, 1, VR.DS));
    assertTrue(multiFrame.frameGroup(1).contains(Tag.WindowCenter));
    assertFalse(multiFrame.dataset.contains(Tag.WindowCenter));
  }

  @Test
  public void testSetKeepsExistingVr() {
    // An integer written into a DS attribute stays a decimal string.
    assertTrue(TagAccessor.set(singleFrame, Tag.EchoTime, 0, null, VR.IS));
    assertEquals(VR.DS, singleFrame.dataset.getVR(Tag.EchoTime));
    assertEquals(0.0, singleFrame.dataset.getDouble(Tag.EchoTime, -1), 0);
  }

  @Test
  public void testSetIsNumber() {
    TagAccessor.set(singleFrame, Tag.SeriesNumber, 105, null, VR.IS);
    assertArrayEquals(new String[] {"105"}, singleFrame.dataset.getStrings(Tag.SeriesNumber));
  }

  @Test
  public void testKeywordOf() {
    assertEquals("EchoTime", TagAccessor.keywordOf(Tag.EchoTime));
    assertEquals("(2005,140F)", TagAccessor.keywordOf(DicomObject.PRIVATE_FRAME_GROUP));
  }
}
