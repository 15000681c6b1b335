package net.java.henkan.util;

import java.io.DataInput;
import java.io.IOException;

/**
 * A read-only bit vector with a rank directory, so that the number of set
 * bits before any position can be answered in constant time. Used to index
 * sparse rows of the cost table: the rank of a set bit is the position of
 * its value in a packed value array.
 */
public final class RankedBitVector {

  private final long[] words;
  private final int[] ranks;
  private final int size;

  /**
   * @param words backing words, bit {@code i} lives in {@code words[i >>> 6]}
   * @param size  number of addressable bits
   */
  public RankedBitVector(long[] words, int size) {
    if (size < 0 || words.length != wordCount(size)) {
      throw new IllegalArgumentException("size=" + size + " does not fit " + words.length + " words");
    }
    this.words = words;
    this.size = size;
    this.ranks = new int[words.length + 1];
    for (int i = 0; i < words.length; i++) {
      ranks[i + 1] = ranks[i] + Long.bitCount(words[i]);
    }
  }

  /**
   * Reads {@link #wordCount(int)} big-endian words.
   */
  public static RankedBitVector read(DataInput in, int size) throws IOException {
    long[] words = new long[wordCount(size)];
    for (int i = 0; i < words.length; i++) {
      words[i] = in.readLong();
    }
    return new RankedBitVector(words, size);
  }

  public static int wordCount(int size) {
    return (size + 63) >>> 6;
  }

  public int size() {
    return size;
  }

  public boolean get(int index) {
    if (index < 0 || index >= size) {
      return false;
    }
    return (words[index >>> 6] & (1L << index)) != 0;
  }

  /**
   * Number of set bits in {@code [0, index)}.
   */
  public int rank(int index) {
    int word = index >>> 6;
    int bit = index & 63;
    int rank = ranks[word];
    if (bit != 0) {
      rank += Long.bitCount(words[word] & ((1L << bit) - 1));
    }
    return rank;
  }

  public int cardinality() {
    return ranks[words.length];
  }

  /**
   * True when a bit at or beyond {@link #size()} is set in the last word.
   */
  public boolean hasBitsPastSize() {
    int tail = size & 63;
    if (tail == 0 || words.length == 0) {
      return false;
    }
    return (words[words.length - 1] >>> tail) != 0;
  }
}
