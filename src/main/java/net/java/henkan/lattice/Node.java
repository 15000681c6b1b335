package net.java.henkan.lattice;

/**
 * A candidate word covering {@code [begin, end)} of the lattice key.
 * <p>
 * Nodes are owned by their {@link Lattice}. The word attributes are fixed at
 * insertion; {@link #getCost()} and {@link #getPrev()} are written by the
 * forward shortest-path pass.
 */
public final class Node {

  public enum Type {
    /** Virtual start node, ends at offset 0 */
    BOS,
    /** Virtual end node, begins at the end of the key */
    EOS,
    /** Dictionary word */
    NORMAL,
    /** Synthesized single character fallback */
    UNKNOWN,
    /** Already committed text preceding the conversion */
    HISTORY,
    /** Value fixed by the user for a segment */
    FIXED_VALUE
  }

  /** Accumulated cost of a node no path reaches */
  public static final int UNREACHABLE = Integer.MAX_VALUE;

  /** Largest finite cost; path sums saturate here */
  public static final int MAX_COST = UNREACHABLE - 1;

  /**
   * Sum of two non-negative costs, clamped to {@link #MAX_COST} so that a
   * long path never wraps around or reads as {@link #UNREACHABLE}.
   */
  public static int addCost(int a, int b) {
    long sum = (long) a + b;
    return sum >= MAX_COST ? MAX_COST : (int) sum;
  }

  private final int id;
  private final Type type;
  private final int begin;
  private final int end;
  private final String key;
  private final String value;
  private final int lid;
  private final int rid;
  private final int wcost;
  private final boolean keyCorrected;

  private int cost = UNREACHABLE;
  private int prev = -1;

  Node(int id, Type type, int begin, int end, String key, String value,
       int lid, int rid, int wcost, boolean keyCorrected) {
    this.id = id;
    this.type = type;
    this.begin = begin;
    this.end = end;
    this.key = key;
    this.value = value;
    this.lid = lid;
    this.rid = rid;
    this.wcost = wcost;
    this.keyCorrected = keyCorrected;
  }

  public int getId() {
    return id;
  }

  public Type getType() {
    return type;
  }

  public int getBegin() {
    return begin;
  }

  public int getEnd() {
    return end;
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

  /**
   * Intrinsic cost of the word itself.
   */
  public int getWcost() {
    return wcost;
  }

  public boolean isUnknown() {
    return type == Type.UNKNOWN;
  }

  /**
   * True if the word was found through a corrected key; its key is still
   * the original span.
   */
  public boolean isKeyCorrected() {
    return keyCorrected;
  }

  /**
   * Minimum cost from BOS up to and including this node, or
   * {@link #UNREACHABLE}.
   */
  public int getCost() {
    return cost;
  }

  public void setCost(int cost) {
    this.cost = cost;
  }

  public boolean isReachable() {
    return cost != UNREACHABLE;
  }

  /**
   * Id of the best predecessor, -1 for BOS or before the forward pass.
   */
  public int getPrev() {
    return prev;
  }

  public void setPrev(int prev) {
    this.prev = prev;
  }

  @Override
  public String toString() {
    return "Node{" + id + ":" + type + " [" + begin + "," + end + ") " + key + "/" + value
        + " lid=" + lid + " rid=" + rid + " wcost=" + wcost + " cost=" + cost + "}";
  }
}
