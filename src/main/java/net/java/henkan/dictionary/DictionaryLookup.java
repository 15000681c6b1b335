package net.java.henkan.dictionary;

import java.util.List;

/**
 * Source of words for lattice construction. Implementations must return the
 * same entries in the same order for the same key and offset for as long as
 * they live.
 */
public interface DictionaryLookup {

  /**
   * @return every entry whose key equals {@code key.substring(offset, offset + n)}
   *         for some {@code n > 0}, shortest keys first
   */
  List<Entry> lookupPrefix(CharSequence key, int offset);

  /**
   * @return the entries whose key equals {@code key.substring(offset)}
   */
  List<Entry> lookupExact(CharSequence key, int offset);
}
