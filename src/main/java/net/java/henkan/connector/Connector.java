package net.java.henkan.connector;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import org.apache.lucene.util.ArrayUtil;

import net.java.henkan.CorruptTableException;
import net.java.henkan.lattice.Node;
import net.java.henkan.util.RankedBitVector;

/**
 * Transition costs between the right id of a node and the left id of the
 * node that follows it.
 * <p>
 * Each row of the table is stored as a {@link RankedBitVector} marking the
 * columns that carry an explicit cost, plus the packed costs of those
 * columns. Every other pair costs {@link #getDefaultCost()}, which is large
 * but finite so that the lattice never becomes disconnected.
 * <p>
 * <b>Thread Safety:</b> instances are immutable once loaded.
 */
public final class Connector {

  public static final int MAGIC = 0x484E4331;

  private final int leftSize;
  private final int rightSize;
  private final int resolution;
  private final int defaultCost;
  private final RankedBitVector[] rows;
  private final int[] rowOffsets;
  private final char[] values;

  private Connector(int leftSize, int rightSize, int resolution, int defaultCost,
                    RankedBitVector[] rows, int[] rowOffsets, char[] values) {
    this.leftSize = leftSize;
    this.rightSize = rightSize;
    this.resolution = resolution;
    this.defaultCost = defaultCost;
    this.rows = rows;
    this.rowOffsets = rowOffsets;
    this.values = values;
  }

  /**
   * Reads a compiled table. The stream is not closed.
   *
   * @throws CorruptTableException if the data is malformed or truncated
   */
  public static Connector load(InputStream stream) throws IOException {
    DataInputStream in = new DataInputStream(new BufferedInputStream(stream));
    try {
      int magic = in.readInt();
      if (magic != MAGIC) {
        throw new CorruptTableException("Bad connector magic: 0x" + Integer.toHexString(magic));
      }
      int leftSize = in.readUnsignedShort();
      int rightSize = in.readUnsignedShort();
      int resolution = in.readInt();
      int defaultCost = in.readInt();
      if (leftSize == 0 || rightSize == 0) {
        throw new CorruptTableException("Empty connector table: " + leftSize + "x" + rightSize);
      }
      // a single transition must stay a finite cost
      if (resolution < 1 || (long) Character.MAX_VALUE * resolution > Node.MAX_COST) {
        throw new CorruptTableException("Invalid resolution: " + resolution);
      }
      if (defaultCost < 0 || defaultCost > Node.MAX_COST) {
        throw new CorruptTableException("Default cost out of range: " + defaultCost);
      }

      RankedBitVector[] rows = new RankedBitVector[leftSize];
      int[] rowOffsets = new int[leftSize + 1];
      char[] values = new char[0];
      for (int l = 0; l < leftSize; l++) {
        int count = in.readInt();
        RankedBitVector row = RankedBitVector.read(in, rightSize);
        if (count < 0 || count != row.cardinality()) {
          throw new CorruptTableException("Row " + l + " declares " + count + " entries but indexes " + row.cardinality());
        }
        if (row.hasBitsPastSize()) {
          throw new CorruptTableException("Row " + l + " has entries past column " + rightSize);
        }
        int offset = rowOffsets[l];
        if (offset + count > values.length) {
          values = ArrayUtil.grow(values, offset + count);
        }
        for (int i = 0; i < count; i++) {
          values[offset + i] = in.readChar();
        }
        rows[l] = row;
        rowOffsets[l + 1] = offset + count;
      }
      return new Connector(leftSize, rightSize, resolution, defaultCost, rows, rowOffsets, values);
    } catch (EOFException e) {
      throw new CorruptTableException("Truncated connector table", e);
    }
  }

  /**
   * @param leftId  right id of the preceding node
   * @param rightId left id of the following node
   * @return the transition cost, never negative
   */
  public int getTransitionCost(int leftId, int rightId) {
    if (leftId < 0 || leftId >= leftSize || rightId < 0 || rightId >= rightSize) {
      return defaultCost;
    }
    RankedBitVector row = rows[leftId];
    if (!row.get(rightId)) {
      return defaultCost;
    }
    return values[rowOffsets[leftId] + row.rank(rightId)] * resolution;
  }

  public int getLeftSize() {
    return leftSize;
  }

  public int getRightSize() {
    return rightSize;
  }

  public int getResolution() {
    return resolution;
  }

  public int getDefaultCost() {
    return defaultCost;
  }

  /**
   * Number of explicitly stored pairs.
   */
  public int getEntryCount() {
    return rowOffsets[leftSize];
  }
}
