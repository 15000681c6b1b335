package net.java.henkan.converter;

import static org.junit.Assert.*;

import org.junit.Test;

public class TestSegments {

  private static Segments newSegments() {
    Segments segments = new Segments();
    segments.addSegment().setKey("わたしは");
    segments.addSegment().setKey("がくせい");
    segments.addHistorySegment("きょう", "今日");
    return segments;
  }

  @Test
  public void testHistoryGoesFirst() {
    Segments segments = newSegments();
    assertEquals(3, segments.getSegmentsSize());
    assertEquals(1, segments.getHistorySegmentsSize());
    assertEquals(2, segments.getConversionSegmentsSize());
    assertEquals(Segment.SegmentType.HISTORY, segments.getSegment(0).getSegmentType());
    assertEquals("今日", segments.getSegment(0).getCandidate(0).getValue());
    assertEquals("わたしは", segments.getConversionSegment(0).getKey());
    assertEquals("わたしはがくせい", segments.getConversionKey());

    segments.addHistorySegment("ー", "ー");
    assertEquals(2, segments.getHistorySegmentsSize());
    assertEquals("ー", segments.getSegment(1).getKey());
  }

  @Test
  public void testClear() {
    Segments segments = newSegments();
    segments.clearConversionSegments();
    assertEquals(1, segments.getSegmentsSize());
    assertEquals("", segments.getConversionKey());

    segments = newSegments();
    segments.clearHistorySegments();
    assertEquals(0, segments.getHistorySegmentsSize());
    assertEquals(2, segments.getConversionSegmentsSize());

    segments.clear();
    assertEquals(0, segments.getSegmentsSize());
  }

  @Test
  public void testInsertAndErase() {
    Segments segments = newSegments();
    segments.insertSegment(2).setKey("x");
    assertEquals("わたしはxがくせい", segments.getConversionKey());
    segments.eraseSegment(1);
    assertEquals("xがくせい", segments.getConversionKey());
    assertEquals(2, segments.getConversionSegments().size());
  }

  @Test
  public void testMoveCandidate() {
    Segment segment = new Segment();
    segment.addCandidate().setValue("a");
    segment.addCandidate().setValue("b");
    segment.addCandidate().setValue("c");
    segment.moveCandidate(2, 0);
    assertEquals("c", segment.getCandidate(0).getValue());
    assertEquals("a", segment.getCandidate(1).getValue());
    assertEquals("b", segment.getCandidate(2).getValue());
    assertTrue(segment.hasCandidateValue("b"));
    segment.removeCandidate(2);
    assertFalse(segment.hasCandidateValue("b"));
    assertEquals(2, segment.getCandidatesSize());
  }
}
