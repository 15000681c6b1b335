package net.java.henkan.dictionary;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import net.java.henkan.HenkanTestUtil;

public class TestFstDictionary {

  private static FstDictionary dictionary;

  @BeforeClass
  public static void beforeClass() throws IOException {
    dictionary = HenkanTestUtil.newDictionary();
  }

  private static List<String> values(List<Entry> entries) {
    List<String> values = new ArrayList<String>();
    for (Entry entry : entries) {
      values.add(entry.getValue());
    }
    return values;
  }

  @Test
  public void testSize() {
    assertEquals(15, dictionary.size());
  }

  @Test
  public void testLookupPrefix() {
    // shortest key first, values of one key in file order
    assertEquals(Arrays.asList("手", "天", "点", "転"), values(dictionary.lookupPrefix("てんき", 0)));
    assertEquals(Arrays.asList("は"), values(dictionary.lookupPrefix("わたしは", 3)));
    assertEquals(Arrays.asList("私"), values(dictionary.lookupPrefix("わたしは", 0)));
    assertTrue(dictionary.lookupPrefix("ぬ", 0).isEmpty());
    assertTrue(dictionary.lookupPrefix("てん", 2).isEmpty());
  }

  @Test
  public void testLookupExact() {
    assertEquals(Arrays.asList("今日", "京"), values(dictionary.lookupExact("きょう", 0)));
    assertEquals(Arrays.asList("天", "点", "転"), values(dictionary.lookupExact("xてん", 1)));
    assertTrue(dictionary.lookupExact("てんき", 0).isEmpty());
    assertTrue(dictionary.lookupExact("てん", 2).isEmpty());
  }

  @Test
  public void testSupplementaryKey() throws IOException {
    FstDictionary d = FstDictionary.build(Arrays.asList(
        new Entry("😀", "smile", 1, 1, 100),
        new Entry("😀😀", "grin", 1, 1, 100)));
    assertEquals(Arrays.asList("smile", "grin"), values(d.lookupPrefix("😀😀x", 0)));
    assertEquals(Arrays.asList("smile"), values(d.lookupExact("x😀", 1)));
  }

  @Test
  public void testUnsortedInput() throws IOException {
    FstDictionary d = FstDictionary.build(Arrays.asList(
        new Entry("んb", "2", 1, 1, 100),
        new Entry("a", "0", 1, 1, 100),
        new Entry("ん", "1", 1, 1, 100),
        new Entry("a", "3", 1, 1, 100)));
    assertEquals(4, d.size());
    assertEquals(Arrays.asList("0", "3"), values(d.lookupExact("a", 0)));
    assertEquals(Arrays.asList("1", "2"), values(d.lookupPrefix("んb", 0)));
  }

  @Test
  public void testEmpty() throws IOException {
    FstDictionary d = FstDictionary.build(Collections.<Entry>emptyList());
    assertEquals(0, d.size());
    assertTrue(d.lookupPrefix("てん", 0).isEmpty());
    assertTrue(d.lookupExact("てん", 0).isEmpty());
  }
}
