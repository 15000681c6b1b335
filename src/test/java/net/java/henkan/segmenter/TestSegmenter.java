package net.java.henkan.segmenter;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import net.java.henkan.CorruptTableException;
import net.java.henkan.HenkanTestUtil;

public class TestSegmenter {

  /**
   * Three ids folded into a 2x2 table: ids 1 and 2 share a row, id 2 has a
   * column of its own. Only (row 1, column 1) is a boundary.
   */
  private static byte[] compressed(int[] lTable, int[] prefix, int[] suffix) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeInt(Segmenter.MAGIC);
    out.writeShort(3);
    out.writeShort(2);
    out.writeShort(2);
    for (int l : lTable) {
      out.writeShort(l);
    }
    out.writeShort(0);
    out.writeShort(0);
    out.writeShort(1);
    out.writeLong(1L << 3);
    out.writeLong(0L);
    // id 2 is functional
    out.writeLong(1L << 2);
    for (int p : prefix) {
      out.writeShort(p);
    }
    for (int s : suffix) {
      out.writeShort(s);
    }
    out.flush();
    return bytes.toByteArray();
  }

  private static Segmenter load(byte[] bytes) throws IOException {
    return Segmenter.load(new ByteArrayInputStream(bytes));
  }

  private static void assertCorrupt(byte[] bytes) throws IOException {
    try {
      load(bytes);
      fail("expected CorruptTableException");
    } catch (CorruptTableException e) {
      // expected
    }
  }

  @Test
  public void testBoundary() throws IOException {
    Segmenter segmenter = HenkanTestUtil.newSegmenter();
    assertEquals(HenkanTestUtil.ID_SIZE, segmenter.getIdSize());
    assertTrue(segmenter.isBoundary(HenkanTestUtil.NOUN, HenkanTestUtil.NOUN));
    assertFalse(segmenter.isBoundary(HenkanTestUtil.NOUN, HenkanTestUtil.PARTICLE));
    assertTrue(segmenter.isBoundary(HenkanTestUtil.PARTICLE, HenkanTestUtil.NOUN));
  }

  @Test
  public void testBosAndEosAreBoundaries() throws IOException {
    Segmenter segmenter = HenkanTestUtil.newSegmenter();
    assertTrue(segmenter.isBoundary(HenkanTestUtil.BOS, HenkanTestUtil.PARTICLE));
    assertTrue(segmenter.isBoundary(HenkanTestUtil.PARTICLE, HenkanTestUtil.BOS));
    assertTrue(segmenter.isBoundary(HenkanTestUtil.NOUN, HenkanTestUtil.ID_SIZE));
  }

  @Test
  public void testForbidden() throws IOException {
    Segmenter segmenter = HenkanTestUtil.newSegmenter();
    assertTrue(segmenter.isForbidden(HenkanTestUtil.PARTICLE, HenkanTestUtil.PARTICLE));
    assertFalse(segmenter.isForbidden(HenkanTestUtil.NOUN, HenkanTestUtil.PARTICLE));
    assertFalse(segmenter.isForbidden(HenkanTestUtil.BOS, HenkanTestUtil.PARTICLE));
  }

  @Test
  public void testFunctional() throws IOException {
    Segmenter segmenter = HenkanTestUtil.newSegmenter();
    assertTrue(segmenter.isFunctional(HenkanTestUtil.PARTICLE));
    assertFalse(segmenter.isFunctional(HenkanTestUtil.NOUN));
    assertFalse(segmenter.isFunctional(HenkanTestUtil.BOS));
    assertFalse(segmenter.isFunctional(-1));
  }

  @Test
  public void testCompressedTable() throws IOException {
    Segmenter segmenter = load(compressed(new int[] {0, 1, 1}, new int[] {0, 10, 20}, new int[] {0, 0, 5}));
    assertEquals(2, segmenter.getCompressedLSize());
    assertTrue(segmenter.isBoundary(1, 2));
    assertTrue(segmenter.isBoundary(2, 2));
    assertFalse(segmenter.isBoundary(1, 1));
    assertFalse(segmenter.isBoundary(2, 1));
    assertTrue(segmenter.isFunctional(2));
    assertFalse(segmenter.isFunctional(1));
  }

  @Test
  public void testPenalties() throws IOException {
    Segmenter segmenter = load(compressed(new int[] {0, 1, 1}, new int[] {0, 10, 20}, new int[] {0, 0, 5}));
    assertEquals(10, segmenter.getPrefixPenalty(1));
    assertEquals(20, segmenter.getPrefixPenalty(2));
    assertEquals(5, segmenter.getSuffixPenalty(2));
    assertEquals(0, segmenter.getPrefixPenalty(0));
    assertEquals(0, segmenter.getSuffixPenalty(3));
  }

  @Test
  public void testCorruptTables() throws IOException {
    // row index out of the compressed range
    assertCorrupt(compressed(new int[] {0, 2, 1}, new int[3], new int[3]));
    assertCorrupt(compressed(new int[] {0, 1, 1}, new int[] {0, -1, 0}, new int[3]));

    byte[] bytes = HenkanTestUtil.segmenterBytes();
    assertCorrupt(Arrays.copyOf(bytes, bytes.length - 2));
    bytes[3] ^= 1;
    assertCorrupt(bytes);
  }

  private static byte[] header(int idSize, int compressedLSize, int compressedRSize, int[] tables) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeInt(Segmenter.MAGIC);
    out.writeShort(idSize);
    out.writeShort(compressedLSize);
    out.writeShort(compressedRSize);
    for (int t : tables) {
      out.writeShort(t);
    }
    out.flush();
    return bytes.toByteArray();
  }

  @Test
  public void testCompressedSizeLargerThanIdSize() throws IOException {
    // a 3x1 table for two ids, otherwise complete
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.write(header(2, 3, 1, new int[] {0, 2, 0, 0}));
    out.writeLong(0L);
    out.writeLong(0L);
    out.writeLong(0L);
    for (int i = 0; i < 4; i++) {
      out.writeShort(0);
    }
    out.flush();
    assertCorrupt(bytes.toByteArray());

    // 65535 x 65535 cells do not fit an int
    assertCorrupt(header(1, 65535, 65535, new int[] {0, 0}));
  }
}
