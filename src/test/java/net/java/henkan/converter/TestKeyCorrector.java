package net.java.henkan.converter;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class TestKeyCorrector {

  private final KeyCorrector corrector = new KeyCorrector();

  private KeyCorrector.CorrectedKey correct(String key) {
    List<KeyCorrector.CorrectedKey> keys = corrector.correct(key);
    assertEquals(1, keys.size());
    assertEquals(key, keys.get(0).getOriginalKey());
    return keys.get(0);
  }

  @Test
  public void testIdentity() {
    KeyCorrector.CorrectedKey key = correct("てんき");
    assertTrue(key.isIdentity());
    for (int i = 0; i <= 3; i++) {
      assertEquals(i, key.getOriginalOffset(i));
    }
    assertEquals(-1, key.getOriginalOffset(4));
  }

  @Test
  public void testDoubleN() {
    KeyCorrector.CorrectedKey key = correct("かんんじ");
    assertEquals("かんじ", key.getCorrectedKey());
    assertEquals(0, key.getOriginalOffset(0));
    assertEquals(1, key.getOriginalOffset(1));
    assertEquals(3, key.getOriginalOffset(2));
    assertEquals(4, key.getOriginalOffset(3));

    assertEquals("ほん", correct("ほんん").getCorrectedKey());
  }

  @Test
  public void testNBeforeVowel() {
    KeyCorrector.CorrectedKey key = correct("こんいちは");
    assertEquals("こんにちは", key.getCorrectedKey());
    assertEquals(1, key.getOriginalOffset(1));
    assertEquals(2, key.getOriginalOffset(2));
    assertEquals(5, key.getOriginalOffset(5));
    // a leading ん is left alone
    assertTrue(correct("んあ").isIdentity());
  }

  @Test
  public void testDoubleSmallTsu() {
    KeyCorrector.CorrectedKey key = correct("かっった");
    assertEquals("かった", key.getCorrectedKey());
    assertEquals(3, key.getOriginalOffset(2));
  }

  @Test
  public void testLargeYa() {
    assertEquals("きょう", correct("きよう").getCorrectedKey());
    assertEquals("しゅう", correct("しゆう").getCorrectedKey());
    // without the trailing う it is a plain reading
    assertTrue(correct("きよ").isIdentity());
  }
}
