package net.java.henkan.connector;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import net.java.henkan.CorruptTableException;
import net.java.henkan.HenkanTestUtil;

public class TestConnector {

  private static Connector load(byte[] bytes) throws IOException {
    return Connector.load(new ByteArrayInputStream(bytes));
  }

  /**
   * A 1x1 table with one explicit cost.
   */
  private static byte[] singleCell(int resolution, int count, long word, int value) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    out.writeInt(Connector.MAGIC);
    out.writeShort(1);
    out.writeShort(1);
    out.writeInt(resolution);
    out.writeInt(5000);
    out.writeInt(count);
    out.writeLong(word);
    out.writeShort(value);
    out.flush();
    return bytes.toByteArray();
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
  public void testTransitionCosts() throws IOException {
    Connector connector = HenkanTestUtil.newConnector();
    assertEquals(HenkanTestUtil.ID_SIZE, connector.getLeftSize());
    assertEquals(HenkanTestUtil.ID_SIZE, connector.getRightSize());
    assertEquals(HenkanTestUtil.TRANSITIONS.length, connector.getEntryCount());
    for (int[] t : HenkanTestUtil.TRANSITIONS) {
      assertEquals(t[2], connector.getTransitionCost(t[0], t[1]));
    }
    assertEquals(0, connector.getTransitionCost(HenkanTestUtil.DASH, HenkanTestUtil.ARROW));
  }

  @Test
  public void testDefaultCost() throws IOException {
    Connector connector = HenkanTestUtil.newConnector();
    assertEquals(HenkanTestUtil.DEFAULT_COST, connector.getDefaultCost());
    assertEquals(HenkanTestUtil.DEFAULT_COST,
        connector.getTransitionCost(HenkanTestUtil.UNKNOWN, HenkanTestUtil.UNKNOWN));
    assertEquals(HenkanTestUtil.DEFAULT_COST, connector.getTransitionCost(-1, HenkanTestUtil.NOUN));
    assertEquals(HenkanTestUtil.DEFAULT_COST, connector.getTransitionCost(HenkanTestUtil.NOUN, 1000));
  }

  @Test
  public void testResolution() throws IOException {
    Connector connector = load(singleCell(2, 1, 1L, 7));
    assertEquals(2, connector.getResolution());
    assertEquals(14, connector.getTransitionCost(0, 0));
  }

  @Test
  public void testBadMagic() throws IOException {
    byte[] bytes = HenkanTestUtil.connectorBytes();
    bytes[0] = 0;
    assertCorrupt(bytes);
  }

  @Test
  public void testTruncated() throws IOException {
    byte[] bytes = HenkanTestUtil.connectorBytes();
    assertCorrupt(Arrays.copyOf(bytes, bytes.length - 1));
    assertCorrupt(Arrays.copyOf(bytes, 6));
  }

  @Test
  public void testCountMismatch() throws IOException {
    assertCorrupt(singleCell(1, 2, 1L, 7));
  }

  @Test
  public void testBitsPastRow() throws IOException {
    // the count matches the popcount but the bit lies past column 0
    assertCorrupt(singleCell(1, 1, 1L << 5, 7));
  }

  @Test
  public void testInvalidResolution() throws IOException {
    assertCorrupt(singleCell(0, 1, 1L, 7));
    // the largest packed cost times the resolution must stay finite
    assertCorrupt(singleCell(32769, 1, 1L, 7));
    assertEquals(0xFFFF * 32768, load(singleCell(32768, 1, 1L, 0xFFFF)).getTransitionCost(0, 0));
  }

  @Test
  public void testDefaultCostRange() throws IOException {
    assertCorrupt(HenkanTestUtil.connectorBytes(1, -1, new int[0][]));
    assertCorrupt(HenkanTestUtil.connectorBytes(1, Integer.MAX_VALUE, new int[0][]));
    Connector connector = load(HenkanTestUtil.connectorBytes(1, Integer.MAX_VALUE - 1, new int[0][]));
    assertEquals(Integer.MAX_VALUE - 1, connector.getTransitionCost(0, 0));
  }
}
