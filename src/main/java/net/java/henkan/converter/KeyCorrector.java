package net.java.henkan.converter;

import java.util.Collections;
import java.util.List;

import com.carrotsearch.hppc.IntArrayList;

/**
 * Rewrites a hiragana key to undo common romaji typing slips:
 * <ul>
 * <li>{@code んん} before a consonant or at the end becomes {@code ん}
 *     ("kannji" typed as かんんじ)</li>
 * <li>{@code ん} followed by a vowel becomes {@code ん} plus the な row
 *     ("konnichiha" typed as こんいちは)</li>
 * <li>{@code っっ} becomes {@code っ}</li>
 * <li>an い-row consonant followed by a large {@code や/ゆ/よ} and {@code う}
 *     gets the small kana ("kyou" typed as きよう)</li>
 * </ul>
 * The corrected key comes with a map from corrected offsets back to original
 * offsets so that words found in it can be placed over the original span.
 * <p>
 * <b>Thread Safety:</b> stateless, thread safe.
 */
public final class KeyCorrector {

  private static final String VOWELS = "あいうえお";
  private static final String NA_ROW = "なにぬねの";
  private static final String I_ROW = "きしちにひみりぎじぢびぴ";
  private static final String LARGE_YA = "やゆよ";
  private static final String SMALL_YA = "ゃゅょ";

  /**
   * A corrected key and its alignment with the original key.
   */
  public static final class CorrectedKey {
    private final String original;
    private final String corrected;
    // original offset for every corrected offset 0..corrected.length(), -1 inside a rewrite
    private final int[] originalOffsets;

    CorrectedKey(String original, String corrected, int[] originalOffsets) {
      this.original = original;
      this.corrected = corrected;
      this.originalOffsets = originalOffsets;
    }

    public String getOriginalKey() {
      return original;
    }

    public String getCorrectedKey() {
      return corrected;
    }

    /**
     * @return the original offset aligned with {@code correctedOffset}, or
     *         -1 if the offset falls inside a rewritten unit
     */
    public int getOriginalOffset(int correctedOffset) {
      if (correctedOffset < 0 || correctedOffset >= originalOffsets.length) {
        return -1;
      }
      return originalOffsets[correctedOffset];
    }

    public boolean isIdentity() {
      return original.equals(corrected);
    }

    @Override
    public String toString() {
      return original + " => " + corrected;
    }
  }

  /**
   * @return the corrected key, or the original key with the identity map
   *         when no rule applies
   */
  public List<CorrectedKey> correct(String key) {
    StringBuilder corrected = new StringBuilder(key.length());
    IntArrayList offsets = new IntArrayList(key.length() + 1);

    int i = 0;
    while (i < key.length()) {
      int consumed = rewrite(key, i, corrected, offsets);
      if (consumed == 0) {
        offsets.add(i);
        corrected.append(key.charAt(i));
        consumed = 1;
      }
      i += consumed;
    }
    offsets.add(key.length());
    return Collections.singletonList(new CorrectedKey(key, corrected.toString(), offsets.toArray()));
  }

  /**
   * Tries every rule at {@code pos}.
   *
   * @return the number of original chars consumed, 0 if no rule matched
   */
  private static int rewrite(String key, int pos, StringBuilder out, IntArrayList offsets) {
    char ch = key.charAt(pos);
    char next = pos + 1 < key.length() ? key.charAt(pos + 1) : 0;
    char third = pos + 2 < key.length() ? key.charAt(pos + 2) : 0;

    if (ch == 'ん' && next == 'ん' && (third == 0 || (VOWELS.indexOf(third) < 0 && third != 'ん'))) {
      // んん -> ん
      append(out, offsets, pos, "ん", 2);
      return 2;
    }
    if (ch == 'ん' && pos > 0 && next != 0 && VOWELS.indexOf(next) >= 0) {
      // んあ -> んな
      append(out, offsets, pos, "ん" + NA_ROW.charAt(VOWELS.indexOf(next)), 2);
      return 2;
    }
    if (ch == 'っ' && next == 'っ') {
      append(out, offsets, pos, "っ", 2);
      return 2;
    }
    if (I_ROW.indexOf(ch) >= 0 && next != 0 && LARGE_YA.indexOf(next) >= 0 && third == 'う') {
      append(out, offsets, pos, String.valueOf(ch) + SMALL_YA.charAt(LARGE_YA.indexOf(next)), 2);
      return 2;
    }
    return 0;
  }

  /**
   * Writes a replacement for {@code consumed} original chars starting at
   * {@code pos}; only the start of the replacement is aligned.
   */
  private static void append(StringBuilder out, IntArrayList offsets, int pos, String replacement, int consumed) {
    if (replacement.length() == consumed) {
      // same length rewrites keep every offset aligned
      for (int i = 0; i < consumed; i++) {
        offsets.add(pos + i);
      }
    } else {
      offsets.add(pos);
      for (int i = 1; i < replacement.length(); i++) {
        offsets.add(-1);
      }
    }
    out.append(replacement);
  }
}
