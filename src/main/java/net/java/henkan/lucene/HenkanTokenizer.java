/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.java.henkan.lucene;

import java.io.IOException;
import java.io.Reader;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import net.java.henkan.converter.Candidate;
import net.java.henkan.converter.ImmutableConverter;
import net.java.henkan.converter.Segment;
import net.java.henkan.converter.Segments;
import net.java.henkan.lucene.tokenattributes.CostAttribute;
import net.java.henkan.lucene.tokenattributes.ReadingAttribute;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.util.CharArrayIterator;
import org.apache.lucene.util.AttributeFactory;

/**
 * A tokenizer that converts kana text into kanji.
 * <p>
 * The text is split into sentences, each sentence is converted and every
 * segment of the conversion that is not blank becomes one token. The term is
 * the best candidate of the segment, and these attributes are set as well:
 * <ul>
 * <li>{@link ReadingAttribute}: the segment key and all candidate values
 * <li>{@link CostAttribute}: the word cost of the best candidate
 * </ul>
 */
public final class HenkanTokenizer extends Tokenizer {

  private final ImmutableConverter converter;
  private final Segments segments = new Segments();

  private static final int IOBUFFER = 4096;
  private final char buffer[] = new char[IOBUFFER];

  // Term attributes
  private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
  private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);

  // conversion attributes
  private final ReadingAttribute readingAtt = addAttribute(ReadingAttribute.class);
  private final CostAttribute costAtt = addAttribute(CostAttribute.class);

  // true length of text in the buffer
  private int length = 0;
  // length in buffer that can be evaluated safely, up to a safe end point
  private int usableLength = 0;
  // accumulated offset of previous buffers for this reader, for offsetAtt
  private int accumulateOffset = 0;

  private final CharArrayIterator iterator = CharArrayIterator.newSentenceInstance();
  private final BreakIterator breaker = BreakIterator.getSentenceInstance(Locale.JAPANESE);

  private final List<ConvertedToken> tokens = new ArrayList<ConvertedToken>();
  private int tokenIndex = 0;

  private static final class ConvertedToken {
    final String term;
    final String reading;
    final String[] candidates;
    final int cost;
    final int start;
    final int end;

    ConvertedToken(Segment segment, int start, int end) {
      Candidate top = segment.getCandidate(0);
      this.term = top.getValue();
      this.reading = segment.getKey();
      this.candidates = new String[segment.getCandidatesSize()];
      for (int i = 0; i < candidates.length; i++) {
        candidates[i] = segment.getCandidate(i).getValue();
      }
      this.cost = top.getWcost();
      this.start = start;
      this.end = end;
    }
  }

  public HenkanTokenizer(ImmutableConverter converter) {
    this(DEFAULT_TOKEN_ATTRIBUTE_FACTORY, converter);
  }

  public HenkanTokenizer(AttributeFactory factory, ImmutableConverter converter) {
    super(factory);
    this.converter = converter;
  }

  @Override
  public boolean incrementToken() throws IOException {
    ConvertedToken token = next();
    if (token == null) {
      return false;
    }
    clearAttributes();
    termAtt.setEmpty().append(token.term);
    readingAtt.setReading(token.reading);
    readingAtt.setCandidates(token.candidates);
    costAtt.setCost(token.cost);
    offsetAtt.setOffset(correctOffset(token.start), correctOffset(token.end));
    return true;
  }

  @Override
  public void close() throws IOException {
    super.close();
    resetBuffers();
  }

  @Override
  public void reset() throws IOException {
    super.reset();
    resetBuffers();
  }

  @Override
  public void end() throws IOException {
    super.end();
    // Set finalOffset value
    int tmpFinalOffset = (length < 0) ? accumulateOffset : accumulateOffset + length;
    final int finalOffset = correctOffset(tmpFinalOffset);
    offsetAtt.setOffset(finalOffset, finalOffset);
  }

  //-----------------------------------------------------------------------------------------------------------------

  private ConvertedToken next() throws IOException {
    if (tokenIndex >= tokens.size()) {
      if (length == 0) {
        refill();
      }
      while (!incrementTokenBuffer()) {
        refill();
        if (length <= 0) {
          // no more chars to read;
          return null;
        }
      }
    }
    return tokens.get(tokenIndex++);
  }

  private void refill() throws IOException {
    accumulateOffset += usableLength;

    int leftover = length - usableLength;
    System.arraycopy(buffer, usableLength, buffer, 0, leftover);

    int requested = buffer.length - leftover;
    int returned = read(input, buffer, leftover, requested);
    length = returned < 0 ? leftover : returned + leftover;
    if (returned < requested) {
      /* reader has been emptied, process the rest */
      usableLength = length;
    } else {
      /* still more data to be read, find a safe-stopping place */
      usableLength = findSafeEnd();
      if (usableLength < 0) {
        usableLength = length;
        /* more than IOBUFFER of text without breaks,
         * gonna possibly split a conversion
         */
      }
    }

    iterator.setText(buffer, 0, Math.max(0, usableLength));
    breaker.setText(iterator);
  }

  private static int read(Reader input, char[] buffer, int offset, int length) throws IOException {
    assert length >= 0 : "length must not be negative: " + length;

    int remaining = length;
    while (remaining > 0) {
      int location = length - remaining;
      int count = input.read(buffer, offset + location, remaining);
      if (-1 == count) { // EOF
        break;
      }
      remaining -= count;
    }
    return length - remaining;
  }

  private boolean incrementTokenBuffer() {
    while (true) {
      int start = breaker.current();
      if (start == BreakIterator.DONE) {
        return false; // BreakIterator exhausted
      }

      // find the next set of boundaries
      int end = breaker.next();
      if (end == BreakIterator.DONE) {
        return false; // BreakIterator exhausted
      }

      String text = new String(buffer, start, end - start);
      tokens.clear();
      tokenIndex = 0;
      if (!converter.startConversion(segments, text)) {
        continue;
      }
      int offset = start + accumulateOffset;
      for (Segment segment : segments.getConversionSegments()) {
        int segmentEnd = offset + segment.getKey().length();
        if (!isBlank(segment.getKey())) {
          tokens.add(new ConvertedToken(segment, offset, segmentEnd));
        }
        offset = segmentEnd;
      }
      if (!tokens.isEmpty()) {
        return true;
      }
    }
  }

  private static boolean isBlank(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isWhitespace(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private void resetBuffers() {
    iterator.setText(buffer, 0, 0);
    breaker.setText(iterator);
    length = usableLength = accumulateOffset = tokenIndex = 0;
    tokens.clear();
    segments.clear();
  }

  private int findSafeEnd() {
    for (int i = length - 1; i >= 0; i--) {
      if (isSafeEnd(buffer[i])) {
        return i + 1;
      }
    }
    return -1;
  }

  private boolean isSafeEnd(char ch) {
    switch (ch) {
      case 0x000D:
      case 0x000A:
      case 0x0085:
      case 0x2028:
      case 0x2029:
        return true;
      default:
        return false;
    }
  }
}
