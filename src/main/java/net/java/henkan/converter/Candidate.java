package net.java.henkan.converter;

import java.util.NoSuchElementException;

import com.carrotsearch.hppc.IntArrayList;

/**
 * One conversion result for a segment.
 * <p>
 * Besides the surface value, a candidate records where its content word
 * ends ({@link #getContentValue()} is the value without trailing functional
 * words) and its inner segment boundaries: the word-level structure the
 * session layer needs for partial commits. Each inner segment is packed into
 * one int holding the key length, value length, content key length and
 * content value length in 8 bits each.
 */
public final class Candidate {

  /** Every node on the path was a synthesized fallback */
  public static final int UNKNOWN_WORD = 1;
  /** The path contains a word found through a corrected key */
  public static final int KEY_CORRECTED = 1 << 1;
  /** Raw reading or its katakana form added after the N-best list */
  public static final int READING_FALLBACK = 1 << 2;

  private static final int MAX_INNER_LENGTH = 0xFF;

  private String key = "";
  private String value = "";
  private String contentKey = "";
  private String contentValue = "";
  private int cost;
  private int wcost;
  private int structureCost;
  private int lid;
  private int rid;
  private int attributes;
  private final IntArrayList innerSegmentBoundary = new IntArrayList(0);

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }

  public String getContentKey() {
    return contentKey;
  }

  public void setContentKey(String contentKey) {
    this.contentKey = contentKey;
  }

  public String getContentValue() {
    return contentValue;
  }

  public void setContentValue(String contentValue) {
    this.contentValue = contentValue;
  }

  /**
   * Total path cost, BOS through the node following the segment.
   */
  public int getCost() {
    return cost;
  }

  public void setCost(int cost) {
    this.cost = cost;
  }

  /**
   * Sum of the word costs of the candidate's own words.
   */
  public int getWcost() {
    return wcost;
  }

  public void setWcost(int wcost) {
    this.wcost = wcost;
  }

  /**
   * Sum of the transition costs between the candidate's own words.
   */
  public int getStructureCost() {
    return structureCost;
  }

  public void setStructureCost(int structureCost) {
    this.structureCost = structureCost;
  }

  public int getLid() {
    return lid;
  }

  public void setLid(int lid) {
    this.lid = lid;
  }

  public int getRid() {
    return rid;
  }

  public void setRid(int rid) {
    this.rid = rid;
  }

  public int getAttributes() {
    return attributes;
  }

  public void setAttributes(int attributes) {
    this.attributes = attributes;
  }

  public void addAttributes(int attributes) {
    this.attributes |= attributes;
  }

  public boolean hasAttribute(int attribute) {
    return (attributes & attribute) != 0;
  }

  /**
   * Appends one inner segment.
   *
   * @return false if a length does not fit in 8 bits; the caller should
   *         then clear the boundary list
   */
  public boolean pushBackInnerSegmentBoundary(int keyLength, int valueLength,
                                              int contentKeyLength, int contentValueLength) {
    if (keyLength > MAX_INNER_LENGTH || valueLength > MAX_INNER_LENGTH
        || contentKeyLength > MAX_INNER_LENGTH || contentValueLength > MAX_INNER_LENGTH) {
      return false;
    }
    innerSegmentBoundary.add(keyLength << 24 | valueLength << 16 | contentKeyLength << 8 | contentValueLength);
    return true;
  }

  public void clearInnerSegmentBoundary() {
    innerSegmentBoundary.clear();
  }

  public int getInnerSegmentCount() {
    return innerSegmentBoundary.size();
  }

  /**
   * The encoded boundaries; see the class documentation.
   */
  public int[] getInnerSegmentBoundary() {
    return innerSegmentBoundary.toArray();
  }

  /**
   * Checks that the encoded lengths add up to the key and value.
   */
  public boolean isValidInnerSegmentBoundary() {
    if (innerSegmentBoundary.isEmpty()) {
      return true;
    }
    int keyLength = 0;
    int valueLength = 0;
    for (int i = 0; i < innerSegmentBoundary.size(); i++) {
      int encoded = innerSegmentBoundary.get(i);
      keyLength += encoded >>> 24;
      valueLength += (encoded >>> 16) & 0xFF;
      if (((encoded >>> 8) & 0xFF) > encoded >>> 24 || (encoded & 0xFF) > ((encoded >>> 16) & 0xFF)) {
        return false;
      }
    }
    return keyLength == key.length() && valueLength == value.length();
  }

  public InnerSegmentIterator innerSegments() {
    return new InnerSegmentIterator();
  }

  /**
   * Walks the inner segments of this candidate. When no boundary was
   * recorded the whole candidate is the single inner segment.
   */
  public final class InnerSegmentIterator {
    private int index = 0;
    private int keyOffset = 0;
    private int valueOffset = 0;
    private int keyLength = 0;
    private int valueLength = 0;
    private int contentKeyLength = 0;
    private int contentValueLength = 0;

    private InnerSegmentIterator() {
    }

    public boolean hasNext() {
      return innerSegmentBoundary.isEmpty() ? index == 0 : index < innerSegmentBoundary.size();
    }

    /**
     * Advances to the next inner segment.
     */
    public void next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      keyOffset += keyLength;
      valueOffset += valueLength;
      if (innerSegmentBoundary.isEmpty()) {
        keyLength = key.length();
        valueLength = value.length();
        contentKeyLength = contentKey.length();
        contentValueLength = contentValue.length();
      } else {
        int encoded = innerSegmentBoundary.get(index);
        keyLength = encoded >>> 24;
        valueLength = (encoded >>> 16) & 0xFF;
        contentKeyLength = (encoded >>> 8) & 0xFF;
        contentValueLength = encoded & 0xFF;
      }
      index++;
    }

    public String getKey() {
      return key.substring(keyOffset, keyOffset + keyLength);
    }

    public String getValue() {
      return value.substring(valueOffset, valueOffset + valueLength);
    }

    public String getContentKey() {
      return key.substring(keyOffset, keyOffset + contentKeyLength);
    }

    public String getContentValue() {
      return value.substring(valueOffset, valueOffset + contentValueLength);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(key).append(" -> ").append(value)
        .append(" (content ").append(contentKey).append('/').append(contentValue)
        .append(", cost=").append(cost)
        .append(", wcost=").append(wcost)
        .append(", structure=").append(structureCost)
        .append(", lid=").append(lid)
        .append(", rid=").append(rid)
        .append(", attributes=").append(attributes);
    if (!innerSegmentBoundary.isEmpty()) {
      sb.append(", inner=[");
      for (int i = 0; i < innerSegmentBoundary.size(); i++) {
        if (i > 0) {
          sb.append(',');
        }
        sb.append(Integer.toHexString(innerSegmentBoundary.get(i)));
      }
      sb.append(']');
    }
    return sb.append(')').toString();
  }
}
