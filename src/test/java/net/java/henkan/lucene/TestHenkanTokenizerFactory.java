package net.java.henkan.lucene;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import net.java.henkan.HenkanTestUtil;

import org.apache.lucene.analysis.BaseTokenStreamTestCase;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.FilesystemResourceLoader;
import org.apache.lucene.analysis.util.TokenizerFactory;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TestHenkanTokenizerFactory extends BaseTokenStreamTestCase {

  @Rule
  public ExpectedException expectedException = ExpectedException.none();

  private Path newDataDir() throws IOException {
    Path dir = createTempDir();
    HenkanTestUtil.writeDataDir(dir);
    return dir;
  }

  private static void assertTen(Tokenizer tokenizer) throws IOException {
    tokenizer.setReader(new StringReader("てん"));
    assertTokenStreamContents(tokenizer,
        new String[] {"天"},
        new int[] {0},
        new int[] {2},
        2);
  }

  /**
   * Test that bogus arguments result in exception
   */
  @Test
  public void testBogusArguments() throws IOException {
    expectedException.expect(IllegalArgumentException.class);
    expectedException.expectMessage("Unknown parameters");

    new HenkanTokenizerFactory(new HashMap<String, String>() {{
      put("bogusArg", "bogusValue");
    }});
  }

  @Test
  public void testDataDir() throws IOException {
    Path dir = newDataDir();
    Map<String, String> args = new HashMap<>();
    args.put("dataDir", dir.toString());
    HenkanTokenizerFactory factory = new HenkanTokenizerFactory(args);
    factory.inform(new FilesystemResourceLoader(dir, getClass().getClassLoader()));
    assertTen(factory.create(newAttributeFactory()));
  }

  @Test
  public void testResourceLoader() throws IOException {
    Path dir = newDataDir();
    Map<String, String> args = new HashMap<>();
    args.put("maxCandidates", "2");
    args.put("keyCorrection", "false");
    HenkanTokenizerFactory factory = new HenkanTokenizerFactory(args);
    factory.inform(new FilesystemResourceLoader(dir, getClass().getClassLoader()));

    Tokenizer tokenizer = factory.create(newAttributeFactory());
    CharTermAttribute termAtt = tokenizer.getAttribute(CharTermAttribute.class);
    tokenizer.setReader(new StringReader("かんんじ"));
    tokenizer.reset();
    // without correction no token is 漢字
    while (tokenizer.incrementToken()) {
      assertFalse("漢字".equals(termAtt.toString()));
    }
    tokenizer.end();
    tokenizer.close();
  }

  @Test
  public void testLookupByName() throws IOException {
    Path dir = newDataDir();
    Map<String, String> args = new HashMap<>();
    args.put("dataDir", dir.toString());
    TokenizerFactory factory = TokenizerFactory.forName(HenkanTokenizerFactory.NAME, args);
    assertTrue(factory instanceof HenkanTokenizerFactory);
    ((HenkanTokenizerFactory) factory).inform(new FilesystemResourceLoader(dir, getClass().getClassLoader()));
    assertTen(factory.create(newAttributeFactory()));
  }

  @Test
  public void testCreateBeforeInform() {
    expectedException.expect(IllegalStateException.class);
    new HenkanTokenizerFactory(new HashMap<String, String>()).create(newAttributeFactory());
  }
}
