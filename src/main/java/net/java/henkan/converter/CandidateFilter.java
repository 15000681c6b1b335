package net.java.henkan.converter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.java.henkan.ConverterOptions;
import net.java.henkan.lattice.Node;
import net.java.henkan.util.TextUtil;

/**
 * Decides which enumerated candidates reach a segment. It only accepts or
 * rejects, so the enumeration order is the ranking order. One filter serves
 * one segment; call {@link #reset()} before reusing it.
 */
public final class CandidateFilter {

  public enum ResultType {
    /** Append the candidate */
    KEEP,
    /** Skip the candidate and continue */
    DROP,
    /** Skip the candidate and end the enumeration */
    STOP
  }

  private final ConverterOptions options;
  private final Set<String> seen = new HashSet<String>();
  private int kept = 0;
  private int topCost = 0;
  private boolean hasKnownCandidate = false;

  public CandidateFilter(ConverterOptions options) {
    this.options = options;
  }

  public void reset() {
    seen.clear();
    kept = 0;
    topCost = 0;
    hasKnownCandidate = false;
  }

  /**
   * @param candidate the candidate built from {@code nodes}
   * @param nodes     the words of the candidate, left to right
   */
  public ResultType filter(Candidate candidate, List<Node> nodes) {
    if (kept >= options.getMaxCandidates()) {
      return ResultType.STOP;
    }
    if (kept > 0 && candidate.getCost() - topCost > options.getCostOffset()) {
      // candidates arrive in cost order, nothing after this can be better
      return ResultType.STOP;
    }
    if (seen.contains(candidate.getValue())) {
      return ResultType.DROP;
    }
    if (!TextUtil.isAcceptableAsCandidate(candidate.getValue())) {
      return ResultType.DROP;
    }

    boolean allUnknown = !nodes.isEmpty();
    for (Node node : nodes) {
      if (!node.isUnknown()) {
        allUnknown = false;
        break;
      }
    }
    if (allUnknown && hasKnownCandidate) {
      return ResultType.DROP;
    }
    if (kept > 0 && nodes.size() > 1 && candidate.getStructureCost() > options.getStructureCostOffset()) {
      return ResultType.DROP;
    }

    if (kept == 0) {
      topCost = candidate.getCost();
    }
    if (!allUnknown) {
      hasKnownCandidate = true;
    }
    seen.add(candidate.getValue());
    kept++;
    return ResultType.KEEP;
  }

  public int getKeptCount() {
    return kept;
  }
}
