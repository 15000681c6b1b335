package net.java.henkan.segmenter;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import net.java.henkan.CorruptTableException;
import net.java.henkan.util.RankedBitVector;

/**
 * Segment boundary rules between adjacent boundary classes.
 * <p>
 * Ids are first folded into compressed rows (by the right id of the
 * preceding node) and columns (by the left id of the following node); a
 * pair of bit tables over the compressed space says whether a segment
 * boundary is required and whether the pair can never co-occur. Id 0 is
 * reserved for the BOS/EOS node and is always a boundary.
 * <p>
 * <b>Thread Safety:</b> instances are immutable once loaded.
 */
public final class Segmenter {

  public static final int MAGIC = 0x484E5331;

  private final int idSize;
  private final int compressedLSize;
  private final int compressedRSize;
  private final char[] lTable;
  private final char[] rTable;
  private final RankedBitVector boundary;
  private final RankedBitVector forbidden;
  private final RankedBitVector functional;
  private final short[] prefixPenalty;
  private final short[] suffixPenalty;

  private Segmenter(int idSize, int compressedLSize, int compressedRSize, char[] lTable, char[] rTable,
                    RankedBitVector boundary, RankedBitVector forbidden, RankedBitVector functional,
                    short[] prefixPenalty, short[] suffixPenalty) {
    this.idSize = idSize;
    this.compressedLSize = compressedLSize;
    this.compressedRSize = compressedRSize;
    this.lTable = lTable;
    this.rTable = rTable;
    this.boundary = boundary;
    this.forbidden = forbidden;
    this.functional = functional;
    this.prefixPenalty = prefixPenalty;
    this.suffixPenalty = suffixPenalty;
  }

  /**
   * Reads a compiled boundary table. The stream is not closed.
   *
   * @throws CorruptTableException if the data is malformed or truncated
   */
  public static Segmenter load(InputStream stream) throws IOException {
    DataInputStream in = new DataInputStream(new BufferedInputStream(stream));
    try {
      int magic = in.readInt();
      if (magic != MAGIC) {
        throw new CorruptTableException("Bad segmenter magic: 0x" + Integer.toHexString(magic));
      }
      int idSize = in.readUnsignedShort();
      int compressedLSize = in.readUnsignedShort();
      int compressedRSize = in.readUnsignedShort();
      if (idSize == 0 || compressedLSize == 0 || compressedRSize == 0) {
        throw new CorruptTableException("Empty segmenter table");
      }
      if (compressedLSize > idSize || compressedRSize > idSize) {
        throw new CorruptTableException("Compressed size " + compressedLSize + "x" + compressedRSize
            + " exceeds id size " + idSize);
      }
      long cellCount = (long) compressedLSize * compressedRSize;
      if (cellCount > Integer.MAX_VALUE) {
        throw new CorruptTableException("Too many boundary cells: " + cellCount);
      }
      int cells = (int) cellCount;

      char[] lTable = readTable(in, idSize, compressedLSize, "lTable");
      char[] rTable = readTable(in, idSize, compressedRSize, "rTable");

      RankedBitVector boundary = RankedBitVector.read(in, cells);
      RankedBitVector forbidden = RankedBitVector.read(in, cells);
      RankedBitVector functional = RankedBitVector.read(in, idSize);
      if (boundary.hasBitsPastSize() || forbidden.hasBitsPastSize() || functional.hasBitsPastSize()) {
        throw new CorruptTableException("Segmenter bit table has bits past its size");
      }

      short[] prefixPenalty = readPenalties(in, idSize, "prefix");
      short[] suffixPenalty = readPenalties(in, idSize, "suffix");
      return new Segmenter(idSize, compressedLSize, compressedRSize, lTable, rTable,
          boundary, forbidden, functional, prefixPenalty, suffixPenalty);
    } catch (EOFException e) {
      throw new CorruptTableException("Truncated segmenter table", e);
    }
  }

  private static char[] readTable(DataInputStream in, int idSize, int limit, String name) throws IOException {
    char[] table = new char[idSize];
    for (int i = 0; i < idSize; i++) {
      table[i] = in.readChar();
      if (table[i] >= limit) {
        throw new CorruptTableException(name + "[" + i + "]=" + (int) table[i] + " exceeds " + limit);
      }
    }
    return table;
  }

  private static short[] readPenalties(DataInputStream in, int idSize, String name) throws IOException {
    short[] penalties = new short[idSize];
    for (int i = 0; i < idSize; i++) {
      penalties[i] = in.readShort();
      if (penalties[i] < 0) {
        throw new CorruptTableException("Negative " + name + " penalty for id " + i);
      }
    }
    return penalties;
  }

  private boolean inRange(int id) {
    return id > 0 && id < idSize;
  }

  /**
   * @param rid right id of the preceding node
   * @param lid left id of the following node
   * @return true if a segment boundary must separate the two nodes
   */
  public boolean isBoundary(int rid, int lid) {
    if (!inRange(rid) || !inRange(lid)) {
      return true;
    }
    return boundary.get(lTable[rid] * compressedRSize + rTable[lid]);
  }

  /**
   * @return true if the two classes never appear next to each other
   */
  public boolean isForbidden(int rid, int lid) {
    if (!inRange(rid) || !inRange(lid)) {
      return false;
    }
    return forbidden.get(lTable[rid] * compressedRSize + rTable[lid]);
  }

  /**
   * @return true if a node with this left id is a functional word (particle,
   *         auxiliary, suffix) that attaches to the content word before it
   */
  public boolean isFunctional(int lid) {
    return inRange(lid) && functional.get(lid);
  }

  /**
   * Extra cost of starting a segment with this left id.
   */
  public int getPrefixPenalty(int lid) {
    return inRange(lid) ? prefixPenalty[lid] : 0;
  }

  /**
   * Extra cost of ending a segment with this right id.
   */
  public int getSuffixPenalty(int rid) {
    return inRange(rid) ? suffixPenalty[rid] : 0;
  }

  public int getIdSize() {
    return idSize;
  }

  public int getCompressedLSize() {
    return compressedLSize;
  }
}
