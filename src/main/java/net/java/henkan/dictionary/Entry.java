package net.java.henkan.dictionary;

/**
 * One dictionary word: a reading, its surface value, the boundary classes
 * on both sides and an intrinsic word cost.
 */
public final class Entry {

  private final String key;
  private final String value;
  private final int lid;
  private final int rid;
  private final int cost;

  public Entry(String key, String value, int lid, int rid, int cost) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Entry key must not be empty");
    }
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Entry value must not be empty: key=" + key);
    }
    if (cost < 0) {
      throw new IllegalArgumentException("Entry cost must not be negative: key=" + key + " cost=" + cost);
    }
    this.key = key;
    this.value = value;
    this.lid = lid;
    this.rid = rid;
    this.cost = cost;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public int getLid() {
    return lid;
  }

  public int getRid() {
    return rid;
  }

  public int getCost() {
    return cost;
  }

  /**
   * Length of the key in chars, i.e. how much of the input the word spans.
   */
  public int getSpanLength() {
    return key.length();
  }

  @Override
  public String toString() {
    return key + "\t" + lid + "\t" + rid + "\t" + cost + "\t" + value;
  }
}
