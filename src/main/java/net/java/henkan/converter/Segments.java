package net.java.henkan.converter;

import java.util.ArrayList;
import java.util.List;

/**
 * The segmented conversion of a key: zero or more history segments followed
 * by the conversion segments. Conversion segment indexes given to the
 * converter never count the history.
 * <p>
 * <b>Thread Safety:</b> not synchronized; one writer at a time.
 */
public final class Segments {

  private final List<Segment> segments = new ArrayList<Segment>();

  public int getSegmentsSize() {
    return segments.size();
  }

  public Segment getSegment(int i) {
    return segments.get(i);
  }

  public int getHistorySegmentsSize() {
    int size = 0;
    for (Segment segment : segments) {
      if (segment.getSegmentType() != Segment.SegmentType.HISTORY) {
        break;
      }
      size++;
    }
    return size;
  }

  public int getConversionSegmentsSize() {
    return segments.size() - getHistorySegmentsSize();
  }

  public Segment getConversionSegment(int i) {
    return segments.get(getHistorySegmentsSize() + i);
  }

  public List<Segment> getConversionSegments() {
    return new ArrayList<Segment>(segments.subList(getHistorySegmentsSize(), segments.size()));
  }

  public Segment addSegment() {
    Segment segment = new Segment();
    segments.add(segment);
    return segment;
  }

  /**
   * Adds a history segment holding {@code value} as its only candidate. It
   * is inserted after the existing history.
   */
  public Segment addHistorySegment(String key, String value) {
    Segment segment = new Segment();
    segment.setKey(key);
    segment.setSegmentType(Segment.SegmentType.HISTORY);
    Candidate candidate = segment.addCandidate();
    candidate.setKey(key);
    candidate.setValue(value);
    candidate.setContentKey(key);
    candidate.setContentValue(value);
    segments.add(getHistorySegmentsSize(), segment);
    return segment;
  }

  public Segment insertSegment(int i) {
    Segment segment = new Segment();
    segments.add(i, segment);
    return segment;
  }

  public void eraseSegment(int i) {
    segments.remove(i);
  }

  public void clearConversionSegments() {
    int history = getHistorySegmentsSize();
    while (segments.size() > history) {
      segments.remove(segments.size() - 1);
    }
  }

  public void clearHistorySegments() {
    int history = getHistorySegmentsSize();
    for (int i = 0; i < history; i++) {
      segments.remove(0);
    }
  }

  public void clear() {
    segments.clear();
  }

  /**
   * Concatenated keys of the conversion segments.
   */
  public String getConversionKey() {
    StringBuilder sb = new StringBuilder();
    for (int i = getHistorySegmentsSize(); i < segments.size(); i++) {
      sb.append(segments.get(i).getKey());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      sb.append("segment ").append(i).append(' ').append(segments.get(i));
    }
    return sb.toString();
  }
}
