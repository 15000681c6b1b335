package net.java.henkan.dictionary;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.Builder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;

/**
 * In-memory {@link DictionaryLookup} over a Lucene {@link FST}.
 * <p>
 * Keys are compiled as UTF-32 label sequences; the output of a key is the
 * ordinal of its entry group, so prefix lookups are a single walk along the
 * arcs of the key, collecting a group at every final arc.
 * <p>
 * <b>Thread Safety:</b> lookups are thread safe, every call takes its own
 * {@link FST.BytesReader}.
 */
public final class FstDictionary implements DictionaryLookup {

  private final FST<Long> fst;
  private final List<List<Entry>> groups;
  private final int size;

  private FstDictionary(FST<Long> fst, List<List<Entry>> groups, int size) {
    this.fst = fst;
    this.groups = groups;
    this.size = size;
  }

  /**
   * Compiles the given entries. Entries sharing a key keep their relative
   * order.
   */
  public static FstDictionary build(Collection<Entry> entries) throws IOException {
    Map<String, List<Entry>> byKey = new LinkedHashMap<String, List<Entry>>();
    for (Entry entry : entries) {
      List<Entry> group = byKey.get(entry.getKey());
      if (group == null) {
        group = new ArrayList<Entry>();
        byKey.put(entry.getKey(), group);
      }
      group.add(entry);
    }

    List<KeyedGroup> sorted = new ArrayList<KeyedGroup>(byKey.size());
    for (Map.Entry<String, List<Entry>> e : byKey.entrySet()) {
      IntsRef input = Util.toUTF32(e.getKey(), new IntsRefBuilder());
      sorted.add(new KeyedGroup(input, Collections.unmodifiableList(e.getValue())));
    }
    // the builder needs its inputs in label order
    Collections.sort(sorted, INPUT_ORDER);

    Builder<Long> builder = new Builder<Long>(FST.INPUT_TYPE.BYTE4, PositiveIntOutputs.getSingleton());
    List<List<Entry>> groups = new ArrayList<List<Entry>>(sorted.size());
    for (KeyedGroup group : sorted) {
      builder.add(group.input, Long.valueOf(groups.size()));
      groups.add(group.entries);
    }
    // null when there are no entries
    FST<Long> fst = builder.finish();
    return new FstDictionary(fst, groups, entries.size());
  }

  private static final Comparator<KeyedGroup> INPUT_ORDER = new Comparator<KeyedGroup>() {
    @Override
    public int compare(KeyedGroup a, KeyedGroup b) {
      return a.input.compareTo(b.input);
    }
  };

  private static final class KeyedGroup {
    final IntsRef input;
    final List<Entry> entries;

    KeyedGroup(IntsRef input, List<Entry> entries) {
      this.input = input;
      this.entries = entries;
    }
  }

  @Override
  public List<Entry> lookupPrefix(CharSequence key, int offset) {
    if (fst == null) {
      return Collections.emptyList();
    }
    List<Entry> result = null;
    try {
      FST.BytesReader reader = fst.getBytesReader();
      FST.Arc<Long> arc = fst.getFirstArc(new FST.Arc<Long>());
      Long output = fst.outputs.getNoOutput();
      int i = offset;
      while (i < key.length()) {
        int label = Character.codePointAt(key, i);
        if (fst.findTargetArc(label, arc, arc, reader) == null) {
          break;
        }
        output = fst.outputs.add(output, arc.output());
        i += Character.charCount(label);
        if (arc.isFinal()) {
          long ordinal = fst.outputs.add(output, arc.nextFinalOutput());
          if (result == null) {
            result = new ArrayList<Entry>();
          }
          result.addAll(groups.get((int) ordinal));
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result == null ? Collections.<Entry>emptyList() : result;
  }

  @Override
  public List<Entry> lookupExact(CharSequence key, int offset) {
    if (fst == null || offset >= key.length()) {
      return Collections.emptyList();
    }
    try {
      Long ordinal = Util.get(fst, Util.toUTF32(key.subSequence(offset, key.length()), new IntsRefBuilder()));
      return ordinal == null ? Collections.<Entry>emptyList() : groups.get(ordinal.intValue());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Number of entries, counting every value of a shared key.
   */
  public int size() {
    return size;
  }
}
