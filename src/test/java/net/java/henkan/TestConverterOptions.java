package net.java.henkan;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Test;

public class TestConverterOptions {

  @Test
  public void testDefaults() {
    ConverterOptions options = ConverterOptions.DEFAULT;
    assertEquals(20, options.getMaxCandidates());
    assertEquals(10000, options.getMaxExpansions());
    assertTrue(options.isKeyCorrection());
    assertEquals(3000, options.getCorrectionPenalty());
    assertEquals(10000, options.getUnknownWordCost());
    assertEquals(1, options.getUnknownPosId());
    assertEquals(6907, options.getCostOffset());
    assertEquals(3453, options.getStructureCostOffset());
    assertTrue(options.isReadingCandidates());
  }

  @Test
  public void testFromProperties() {
    Properties props = new Properties();
    props.setProperty(ConverterOptions.MAX_CANDIDATES, " 5 ");
    props.setProperty(ConverterOptions.KEY_CORRECTION, "FALSE");
    props.setProperty("unrelated.key", "x");
    ConverterOptions options = ConverterOptions.fromProperties(props);
    assertEquals(5, options.getMaxCandidates());
    assertFalse(options.isKeyCorrection());
    assertEquals(ConverterOptions.DEFAULT.getCostOffset(), options.getCostOffset());
  }

  @Test
  public void testLoad() throws IOException {
    String text = "# tuning\nhenkan.unknownWordCost=12000\nhenkan.readingCandidates=false\n";
    ConverterOptions options = ConverterOptions.load(
        new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)));
    assertEquals(12000, options.getUnknownWordCost());
    assertFalse(options.isReadingCandidates());
  }

  @Test
  public void testToBuilder() {
    ConverterOptions options = ConverterOptions.builder().maxCandidates(3).costOffset(10).build();
    ConverterOptions copy = options.toBuilder().maxExpansions(7).build();
    assertEquals(3, copy.getMaxCandidates());
    assertEquals(10, copy.getCostOffset());
    assertEquals(7, copy.getMaxExpansions());
    assertEquals(options.toBuilder().build().toString(), options.toString());
  }

  @Test
  public void testInvalidValues() {
    String[][] invalid = {
        {ConverterOptions.MAX_CANDIDATES, "0"},
        {ConverterOptions.MAX_EXPANSIONS, "-1"},
        {ConverterOptions.UNKNOWN_POS_ID, "0"},
        {ConverterOptions.COST_OFFSET, "-5"},
        {ConverterOptions.MAX_CANDIDATES, "many"},
        {ConverterOptions.KEY_CORRECTION, "yes"},
    };
    for (String[] kv : invalid) {
      Properties props = new Properties();
      props.setProperty(kv[0], kv[1]);
      try {
        ConverterOptions.fromProperties(props);
        fail("accepted " + kv[0] + "=" + kv[1]);
      } catch (IllegalArgumentException e) {
        assertTrue(e.getMessage(), e.getMessage().contains(kv[0]));
      }
    }
  }
}
