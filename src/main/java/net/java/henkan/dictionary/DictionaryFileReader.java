package net.java.henkan.dictionary;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dictionary source lines of the form
 * <pre>key&lt;TAB&gt;lid&lt;TAB&gt;rid&lt;TAB&gt;cost&lt;TAB&gt;value</pre>
 * Blank lines and lines starting with {@code #} are skipped.
 */
public class DictionaryFileReader {

  private final List<Entry> entries = new ArrayList<Entry>();

  /**
   * Reads every entry from the stream. The stream is not closed.
   *
   * @throws IOException if a line is malformed
   */
  public DictionaryFileReader read(InputStream in, Charset encoding) throws IOException {
    BufferedReader breader = new BufferedReader(new InputStreamReader(in, encoding));

    String line;
    int lineNumber = 0;
    while ((line = breader.readLine()) != null) {
      lineNumber++;
      if (line.trim().length() == 0 || line.charAt(0) == '#') {
        continue;
      }
      entries.add(parseLine(line, lineNumber));
    }
    return this;
  }

  private static Entry parseLine(String line, int lineNumber) throws IOException {
    String[] fields = line.split("\t", -1);
    if (fields.length != 5) {
      throw new IOException("line " + lineNumber + ": expected 5 tab separated fields but got " + fields.length);
    }
    try {
      return new Entry(fields[0], fields[4],
          Integer.parseInt(fields[1].trim()),
          Integer.parseInt(fields[2].trim()),
          Integer.parseInt(fields[3].trim()));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException too
      throw new IOException("line " + lineNumber + ": " + e.getMessage(), e);
    }
  }

  public List<Entry> getEntries() {
    return entries;
  }
}
