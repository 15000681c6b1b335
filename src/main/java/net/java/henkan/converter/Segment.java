package net.java.henkan.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One editing unit of the converted key and its ranked candidates; index 0
 * is the best candidate.
 */
public final class Segment {

  public enum SegmentType {
    /** Boundaries and candidates are chosen by the converter */
    FREE,
    /** Boundaries were set by the user, candidates are regenerated */
    FIXED_BOUNDARY,
    /** The user picked the top candidate; it is kept as is */
    FIXED_VALUE,
    /** Already committed text used only as left context */
    HISTORY
  }

  private String key = "";
  private SegmentType segmentType = SegmentType.FREE;
  private final List<Candidate> candidates = new ArrayList<Candidate>();

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public SegmentType getSegmentType() {
    return segmentType;
  }

  public void setSegmentType(SegmentType segmentType) {
    this.segmentType = segmentType;
  }

  public int getCandidatesSize() {
    return candidates.size();
  }

  public Candidate getCandidate(int i) {
    return candidates.get(i);
  }

  public List<Candidate> getCandidates() {
    return Collections.unmodifiableList(candidates);
  }

  public Candidate addCandidate() {
    Candidate candidate = new Candidate();
    candidates.add(candidate);
    return candidate;
  }

  public void pushBackCandidate(Candidate candidate) {
    candidates.add(candidate);
  }

  public void insertCandidate(int i, Candidate candidate) {
    candidates.add(i, candidate);
  }

  public Candidate removeCandidate(int i) {
    return candidates.remove(i);
  }

  /**
   * Moves the candidate at {@code from} to {@code to}, shifting the ones in
   * between.
   */
  public void moveCandidate(int from, int to) {
    candidates.add(to, candidates.remove(from));
  }

  public void clearCandidates() {
    candidates.clear();
  }

  public boolean hasCandidateValue(String value) {
    for (Candidate candidate : candidates) {
      if (candidate.getValue().equals(value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Replaces this segment's key, type and candidates by those of
   * {@code other}; {@code other} should not be used afterwards.
   */
  void assign(Segment other) {
    this.key = other.key;
    this.segmentType = other.segmentType;
    this.candidates.clear();
    this.candidates.addAll(other.candidates);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("[").append(segmentType).append("] ").append(key).append('\n');
    for (int i = 0; i < candidates.size(); i++) {
      sb.append("  ").append(i).append(": ").append(candidates.get(i)).append('\n');
    }
    return sb.toString();
  }
}
