package net.java.henkan.converter;

import static org.junit.Assert.*;

import java.util.NoSuchElementException;

import org.junit.Test;

public class TestCandidate {

  private static Candidate newCandidate() {
    Candidate candidate = new Candidate();
    candidate.setKey("わたしはがくせい");
    candidate.setValue("私は学生");
    candidate.setContentKey("わたし");
    candidate.setContentValue("私");
    return candidate;
  }

  @Test
  public void testAttributes() {
    Candidate candidate = new Candidate();
    assertFalse(candidate.hasAttribute(Candidate.UNKNOWN_WORD));
    candidate.addAttributes(Candidate.UNKNOWN_WORD);
    candidate.addAttributes(Candidate.KEY_CORRECTED);
    assertTrue(candidate.hasAttribute(Candidate.UNKNOWN_WORD));
    assertTrue(candidate.hasAttribute(Candidate.KEY_CORRECTED));
    assertFalse(candidate.hasAttribute(Candidate.READING_FALLBACK));
    candidate.setAttributes(Candidate.READING_FALLBACK);
    assertEquals(Candidate.READING_FALLBACK, candidate.getAttributes());
  }

  @Test
  public void testInnerSegments() {
    Candidate candidate = newCandidate();
    assertTrue(candidate.pushBackInnerSegmentBoundary(4, 2, 3, 1));
    assertTrue(candidate.pushBackInnerSegmentBoundary(4, 2, 4, 2));
    assertEquals(2, candidate.getInnerSegmentCount());
    assertTrue(candidate.isValidInnerSegmentBoundary());
    assertEquals(0x04020301, candidate.getInnerSegmentBoundary()[0]);

    Candidate.InnerSegmentIterator it = candidate.innerSegments();
    assertTrue(it.hasNext());
    it.next();
    assertEquals("わたしは", it.getKey());
    assertEquals("私は", it.getValue());
    assertEquals("わたし", it.getContentKey());
    assertEquals("私", it.getContentValue());
    assertTrue(it.hasNext());
    it.next();
    assertEquals("がくせい", it.getKey());
    assertEquals("学生", it.getValue());
    assertEquals("学生", it.getContentValue());
    assertFalse(it.hasNext());
    try {
      it.next();
      fail();
    } catch (NoSuchElementException e) {
      // expected
    }
  }

  @Test
  public void testWholeCandidateWithoutBoundary() {
    Candidate candidate = newCandidate();
    assertTrue(candidate.isValidInnerSegmentBoundary());
    Candidate.InnerSegmentIterator it = candidate.innerSegments();
    it.next();
    assertEquals("わたしはがくせい", it.getKey());
    assertEquals("私", it.getContentValue());
    assertFalse(it.hasNext());
  }

  @Test
  public void testInvalidBoundary() {
    Candidate candidate = newCandidate();
    candidate.pushBackInnerSegmentBoundary(4, 2, 3, 1);
    assertFalse(candidate.isValidInnerSegmentBoundary());
    // content longer than the segment
    candidate.clearInnerSegmentBoundary();
    candidate.pushBackInnerSegmentBoundary(4, 2, 5, 1);
    candidate.pushBackInnerSegmentBoundary(4, 2, 4, 2);
    assertFalse(candidate.isValidInnerSegmentBoundary());
  }

  @Test
  public void testTooLong() {
    Candidate candidate = newCandidate();
    assertFalse(candidate.pushBackInnerSegmentBoundary(256, 1, 1, 1));
    assertEquals(0, candidate.getInnerSegmentCount());
  }
}
