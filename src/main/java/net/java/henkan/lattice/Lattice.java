package net.java.henkan.lattice;

import org.apache.lucene.util.ArrayUtil;

import com.carrotsearch.hppc.IntArrayList;

/**
 * The word graph of one key.
 * <p>
 * Nodes live in an arena addressed by id (ids follow insertion order) and
 * are reachable through two bucket arrays, one per begin offset and one per
 * end offset. All edges go forward in offset space, so a single pass over
 * the offsets in increasing order visits the graph in topological order.
 * <p>
 * <b>Thread Safety:</b> a lattice belongs to the conversion call that built
 * it and must not be shared.
 */
public final class Lattice {

  private final String key;
  private Node[] nodes = new Node[16];
  private int size = 0;
  private final IntArrayList[] beginNodes;
  private final IntArrayList[] endNodes;
  private final Node bos;
  private final Node eos;

  public Lattice(String key) {
    this.key = key;
    int length = key.length();
    this.beginNodes = new IntArrayList[length + 1];
    this.endNodes = new IntArrayList[length + 1];
    for (int i = 0; i <= length; i++) {
      beginNodes[i] = new IntArrayList(0);
      endNodes[i] = new IntArrayList(0);
    }
    bos = add(new Node(size, Node.Type.BOS, 0, 0, "", "BOS", 0, 0, 0, false));
    bos.setCost(0);
    endNodes[0].add(bos.getId());
    eos = add(new Node(size, Node.Type.EOS, length, length, "", "EOS", 0, 0, 0, false));
    beginNodes[length].add(eos.getId());
  }

  private Node add(Node node) {
    nodes = ArrayUtil.grow(nodes, size + 1);
    nodes[size++] = node;
    return node;
  }

  /**
   * Adds a word over {@code [begin, end)}.
   *
   * @throws IllegalArgumentException if the range is empty or leaves the key
   */
  public Node insert(Node.Type type, int begin, int end, String value, int lid, int rid, int wcost,
                     boolean keyCorrected) {
    if (begin < 0 || end > key.length() || begin >= end) {
      throw new IllegalArgumentException("Invalid node range [" + begin + "," + end + ") for key of length " + key.length());
    }
    if (type == Node.Type.BOS || type == Node.Type.EOS) {
      throw new IllegalArgumentException("BOS/EOS are created by the lattice");
    }
    if (wcost < 0) {
      throw new IllegalArgumentException("Negative word cost: " + wcost);
    }
    Node node = add(new Node(size, type, begin, end, key.substring(begin, end), value, lid, rid, wcost, keyCorrected));
    beginNodes[begin].add(node.getId());
    endNodes[end].add(node.getId());
    return node;
  }

  public String getKey() {
    return key;
  }

  public Node getBosNode() {
    return bos;
  }

  public Node getEosNode() {
    return eos;
  }

  public Node getNode(int id) {
    return nodes[id];
  }

  public int getNodeCount() {
    return size;
  }

  /**
   * Ids of the nodes beginning at {@code pos}, in insertion order. The
   * returned list must not be modified.
   */
  public IntArrayList getBeginNodes(int pos) {
    return beginNodes[pos];
  }

  /**
   * Ids of the nodes ending at {@code pos}, in insertion order. The returned
   * list must not be modified.
   */
  public IntArrayList getEndNodes(int pos) {
    return endNodes[pos];
  }

  public boolean hasNodesBeginningAt(int pos) {
    // EOS does not count as a word
    return pos < key.length() && !beginNodes[pos].isEmpty();
  }

  /**
   * Lowest accumulated cost of any node ending at {@code pos}, or
   * {@link Node#UNREACHABLE}.
   */
  public int getBestCostEndingAt(int pos) {
    int best = Node.UNREACHABLE;
    IntArrayList ids = endNodes[pos];
    for (int i = 0; i < ids.size(); i++) {
      best = Math.min(best, nodes[ids.get(i)].getCost());
    }
    return best;
  }

  /**
   * Returns true if some node with the same span, value and ids exists.
   */
  public boolean contains(int begin, int end, String value, int lid, int rid) {
    IntArrayList ids = beginNodes[begin];
    for (int i = 0; i < ids.size(); i++) {
      Node node = nodes[ids.get(i)];
      if (node.getEnd() == end && node.getLid() == lid && node.getRid() == rid && node.getValue().equals(value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Resets every accumulated cost so the forward pass can run again.
   */
  public void clearCosts() {
    for (int i = 0; i < size; i++) {
      nodes[i].setCost(Node.UNREACHABLE);
      nodes[i].setPrev(-1);
    }
    bos.setCost(0);
  }

  public String debugString() {
    StringBuilder sb = new StringBuilder();
    for (int pos = 0; pos <= key.length(); pos++) {
      IntArrayList ids = beginNodes[pos];
      for (int i = 0; i < ids.size(); i++) {
        sb.append(nodes[ids.get(i)]).append('\n');
      }
    }
    return sb.toString();
  }
}
