package net.java.henkan.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import com.carrotsearch.hppc.IntArrayList;

import net.java.henkan.connector.Connector;
import net.java.henkan.lattice.Lattice;
import net.java.henkan.lattice.Node;
import net.java.henkan.segmenter.Segmenter;

/**
 * Enumerates the paths of one segment span in non-decreasing cost order.
 * <p>
 * The search runs backwards from the node following the segment towards
 * the node preceding it. A partial path from node {@code x} to the end is
 * ranked by its exact cost plus {@code x.getCost()}, the forward cost the
 * Viterbi pass already computed. That forward cost never overestimates and
 * satisfies the triangle inequality along every edge the search may take,
 * so complete paths leave the queue cheapest first.
 * <p>
 * A generator is reusable through {@link #reset}, but one enumeration
 * cannot be restarted; it is not thread safe.
 */
public final class NBestGenerator {

  /**
   * Which segmenter boundaries a path must respect.
   */
  public enum BoundaryCheck {
    /** No boundary inside the span, a boundary at both of its edges */
    STRICT,
    /** No boundary inside the span; the edges were fixed by the user */
    ONLY_MID,
    /** Anything goes */
    NONE
  }

  /**
   * One enumerated path and the candidate built from it.
   */
  public static final class Path {
    private final Candidate candidate;
    private final List<Node> nodes;

    Path(Candidate candidate, List<Node> nodes) {
      this.candidate = candidate;
      this.nodes = nodes;
    }

    public Candidate getCandidate() {
      return candidate;
    }

    /**
     * The words of the candidate, left to right.
     */
    public List<Node> getNodes() {
      return nodes;
    }
  }

  private static final class QueueElement {
    final Node node;
    // toward the end of the segment
    final QueueElement next;
    // estimated total cost
    final int fx;
    // exact cost from node (inclusive) to the end
    final int gx;
    final int structureGx;
    final int wGx;
    final long seq;
    final boolean complete;

    QueueElement(Node node, QueueElement next, int fx, int gx, int structureGx, int wGx, long seq, boolean complete) {
      this.node = node;
      this.next = next;
      this.fx = fx;
      this.gx = gx;
      this.structureGx = structureGx;
      this.wGx = wGx;
      this.seq = seq;
      this.complete = complete;
    }
  }

  private static final Comparator<QueueElement> ORDER = new Comparator<QueueElement>() {
    @Override
    public int compare(QueueElement a, QueueElement b) {
      if (a.fx != b.fx) {
        return Integer.compare(a.fx, b.fx);
      }
      if (a.gx != b.gx) {
        return Integer.compare(a.gx, b.gx);
      }
      return Long.compare(a.seq, b.seq);
    }
  };

  private final Connector connector;
  private final Segmenter segmenter;
  private final int maxExpansions;
  private final PriorityQueue<QueueElement> agenda = new PriorityQueue<QueueElement>(64, ORDER);

  private Lattice lattice;
  private Node beginNode;
  private Node endNode;
  private BoundaryCheck check;
  private boolean pruneForbidden;
  private long seq;
  private int expansions;

  public NBestGenerator(Connector connector, Segmenter segmenter, int maxExpansions) {
    this.connector = connector;
    this.segmenter = segmenter;
    this.maxExpansions = maxExpansions;
  }

  /**
   * Starts a new enumeration of the paths strictly between two nodes of a
   * lattice whose forward pass has run.
   *
   * @param beginNode      the node ending where the segment begins (BOS at the start)
   * @param endNode        the node beginning where the segment ends (EOS at the end)
   * @param pruneForbidden whether never co-occurring pairs were pruned in the forward pass
   */
  public void reset(Lattice lattice, Node beginNode, Node endNode, BoundaryCheck check, boolean pruneForbidden) {
    if (beginNode.getEnd() >= endNode.getBegin()) {
      throw new IllegalArgumentException("Empty span between " + beginNode + " and " + endNode);
    }
    this.lattice = lattice;
    this.beginNode = beginNode;
    this.endNode = endNode;
    this.check = check;
    this.pruneForbidden = pruneForbidden;
    this.seq = 0;
    this.expansions = 0;
    agenda.clear();
    agenda.add(new QueueElement(endNode, null, 0, endNode.getWcost(), 0, 0, seq++, false));
  }

  /**
   * @return the next cheapest path, or null when the paths or the expansion
   *         budget are exhausted
   */
  public Path next() {
    while (!agenda.isEmpty()) {
      if (++expansions > maxExpansions) {
        agenda.clear();
        return null;
      }
      QueueElement top = agenda.poll();
      if (top.complete) {
        return makePath(top);
      }
      expand(top);
    }
    return null;
  }

  private void expand(QueueElement top) {
    Node rnode = top.node;
    int segmentBegin = beginNode.getEnd();

    if (rnode != endNode && rnode.getBegin() == segmentBegin) {
      if (!isValid(beginNode, rnode, true)) {
        return;
      }
      int cost = Node.addCost(connector.getTransitionCost(beginNode.getRid(), rnode.getLid()),
          segmenter.getPrefixPenalty(rnode.getLid()));
      int gx = Node.addCost(top.gx, cost);
      agenda.add(new QueueElement(beginNode, top, Node.addCost(beginNode.getCost(), gx), gx,
          top.structureGx, top.wGx, seq++, true));
      return;
    }

    IntArrayList ids = lattice.getEndNodes(rnode.getBegin());
    boolean atEnd = rnode == endNode;
    for (int i = 0; i < ids.size(); i++) {
      Node lnode = lattice.getNode(ids.get(i));
      if (lnode.getBegin() < segmentBegin || !lnode.isReachable()) {
        continue;
      }
      if (!isValid(lnode, rnode, atEnd)) {
        continue;
      }
      int transition = connector.getTransitionCost(lnode.getRid(), rnode.getLid());
      int cost = Node.addCost(transition, atEnd ? segmenter.getSuffixPenalty(lnode.getRid()) : 0);
      int gx = Node.addCost(Node.addCost(top.gx, lnode.getWcost()), cost);
      int structureGx = atEnd ? top.structureGx : Node.addCost(top.structureGx, transition);
      // a saturated forward cost may be below the true one, never below zero
      int prefix = Math.max(0, lnode.getCost() - lnode.getWcost());
      agenda.add(new QueueElement(lnode, top, Node.addCost(prefix, gx), gx,
          structureGx, Node.addCost(top.wGx, lnode.getWcost()), seq++, false));
    }
  }

  private boolean isValid(Node lnode, Node rnode, boolean isEdge) {
    if (pruneForbidden && ImmutableConverter.isForbiddenEdge(segmenter, lnode, rnode)) {
      return false;
    }
    switch (check) {
      case STRICT: {
        boolean boundary = segmenter.isBoundary(lnode.getRid(), rnode.getLid());
        return isEdge ? boundary : !boundary;
      }
      case ONLY_MID:
        return isEdge || !segmenter.isBoundary(lnode.getRid(), rnode.getLid());
      default:
        return true;
    }
  }

  private Path makePath(QueueElement complete) {
    List<Node> nodes = new ArrayList<Node>();
    for (QueueElement e = complete.next; e != null && e.node != endNode; e = e.next) {
      nodes.add(e.node);
    }

    StringBuilder key = new StringBuilder();
    StringBuilder value = new StringBuilder();
    int contentEnd = nodes.size();
    boolean allUnknown = true;
    boolean corrected = false;
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      key.append(node.getKey());
      value.append(node.getValue());
      if (i > 0 && contentEnd == nodes.size() && segmenter.isFunctional(node.getLid())) {
        contentEnd = i;
      }
      allUnknown &= node.isUnknown();
      corrected |= node.isKeyCorrected();
    }
    StringBuilder contentKey = new StringBuilder();
    StringBuilder contentValue = new StringBuilder();
    for (int i = 0; i < contentEnd; i++) {
      contentKey.append(nodes.get(i).getKey());
      contentValue.append(nodes.get(i).getValue());
    }

    Candidate candidate = new Candidate();
    candidate.setKey(key.toString());
    candidate.setValue(value.toString());
    candidate.setContentKey(contentKey.toString());
    candidate.setContentValue(contentValue.toString());
    candidate.setCost(complete.fx);
    candidate.setWcost(complete.wGx);
    candidate.setStructureCost(complete.structureGx);
    candidate.setLid(nodes.get(0).getLid());
    candidate.setRid(nodes.get(nodes.size() - 1).getRid());
    if (allUnknown) {
      candidate.addAttributes(Candidate.UNKNOWN_WORD);
    }
    if (corrected) {
      candidate.addAttributes(Candidate.KEY_CORRECTED);
    }
    setInnerSegmentBoundary(candidate, nodes);
    return new Path(candidate, Collections.unmodifiableList(nodes));
  }

  /**
   * Every content word starts an inner segment that also holds the
   * functional words following it.
   */
  private void setInnerSegmentBoundary(Candidate candidate, List<Node> nodes) {
    int i = 0;
    while (i < nodes.size()) {
      Node content = nodes.get(i);
      int keyLength = content.getKey().length();
      int valueLength = content.getValue().length();
      int j = i + 1;
      while (j < nodes.size() && segmenter.isFunctional(nodes.get(j).getLid())) {
        keyLength += nodes.get(j).getKey().length();
        valueLength += nodes.get(j).getValue().length();
        j++;
      }
      if (!candidate.pushBackInnerSegmentBoundary(keyLength, valueLength,
          content.getKey().length(), content.getValue().length())) {
        candidate.clearInnerSegmentBoundary();
        return;
      }
      i = j;
    }
  }
}
