package net.java.henkan.util;

/**
 * Character helpers shared by the converter. "Characters" here are Unicode
 * code points, which is what a user sees as one letter of a reading.
 */
public final class TextUtil {

  public enum ScriptType {
    HIRAGANA, KATAKANA, KANJI, NUMBER, ALPHABET, EMOJI, UNKNOWN
  }

  private TextUtil() {
  }

  /**
   * Number of code points in {@code text}.
   */
  public static int charsLength(CharSequence text) {
    return Character.codePointCount(text, 0, text.length());
  }

  /**
   * The first {@code chars} code points of {@code text}, or all of it when it
   * is shorter.
   */
  public static String prefixByChars(String text, int chars) {
    if (chars <= 0) {
      return "";
    }
    if (chars >= text.length()) {
      return text;
    }
    int end = 0;
    for (int i = 0; i < chars && end < text.length(); i++) {
      end += Character.charCount(text.codePointAt(end));
    }
    return text.substring(0, end);
  }

  /**
   * Hiragana to full width katakana; everything else is copied as is.
   */
  public static String hiraganaToKatakana(CharSequence text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      // ぁ..ゖ and ゝゞ shift by 0x60 into the katakana block
      if ((ch >= 'ぁ' && ch <= 'ゖ') || ch == 'ゝ' || ch == 'ゞ') {
        sb.append((char) (ch + 0x60));
      } else {
        sb.append(ch);
      }
    }
    return sb.toString();
  }

  public static ScriptType getScriptType(int codePoint) {
    if ((codePoint >= 0x3041 && codePoint <= 0x309F) || codePoint == 0x30FC) {
      return ScriptType.HIRAGANA;
    }
    if ((codePoint >= 0x30A1 && codePoint <= 0x30FA) || (codePoint >= 0x30FD && codePoint <= 0x30FF)
        || (codePoint >= 0x31F0 && codePoint <= 0x31FF) || (codePoint >= 0xFF66 && codePoint <= 0xFF9D)) {
      return ScriptType.KATAKANA;
    }
    if ((codePoint >= 0x4E00 && codePoint <= 0x9FFF) || (codePoint >= 0x3400 && codePoint <= 0x4DBF)
        || (codePoint >= 0xF900 && codePoint <= 0xFAFF) || (codePoint >= 0x20000 && codePoint <= 0x2FFFF)
        || codePoint == 0x3005) {
      return ScriptType.KANJI;
    }
    if ((codePoint >= '0' && codePoint <= '9') || (codePoint >= 0xFF10 && codePoint <= 0xFF19)) {
      return ScriptType.NUMBER;
    }
    if ((codePoint >= 'A' && codePoint <= 'Z') || (codePoint >= 'a' && codePoint <= 'z')
        || (codePoint >= 0xFF21 && codePoint <= 0xFF3A) || (codePoint >= 0xFF41 && codePoint <= 0xFF5A)) {
      return ScriptType.ALPHABET;
    }
    if ((codePoint >= 0x1F000 && codePoint <= 0x1FAFF) || (codePoint >= 0x2600 && codePoint <= 0x27BF)) {
      return ScriptType.EMOJI;
    }
    return ScriptType.UNKNOWN;
  }

  /**
   * @return true if every character of {@code text} has the given script type
   */
  public static boolean isScriptType(CharSequence text, ScriptType type) {
    if (text.length() == 0) {
      return false;
    }
    for (int i = 0; i < text.length(); ) {
      int cp = Character.codePointAt(text, i);
      if (getScriptType(cp) != type) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }

  /**
   * Control characters and unpaired surrogates never make it into a
   * candidate value.
   */
  public static boolean isAcceptableCharacterAsCandidate(int codePoint) {
    if (Character.isISOControl(codePoint)) {
      return false;
    }
    if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
      return false;
    }
    // bidi overrides
    return codePoint < 0x202A || codePoint > 0x202E;
  }

  public static boolean isAcceptableAsCandidate(CharSequence text) {
    for (int i = 0; i < text.length(); ) {
      int cp = Character.codePointAt(text, i);
      if (!isAcceptableCharacterAsCandidate(cp)) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }
}
