package net.java.henkan.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.java.henkan.ConverterOptions;
import net.java.henkan.connector.Connector;
import net.java.henkan.dictionary.DictionaryLookup;
import net.java.henkan.dictionary.Entry;
import net.java.henkan.lattice.Lattice;
import net.java.henkan.lattice.Node;
import net.java.henkan.segmenter.Segmenter;
import net.java.henkan.util.TextUtil;

import com.carrotsearch.hppc.IntArrayList;

/**
 * Converts the key held by a {@link Segments} into segments and ranked
 * candidates.
 * <p>
 * A conversion builds one lattice over the history keys followed by the
 * conversion key, runs a forward shortest path pass over it, cuts the best
 * path into segments where the segmenter requires a boundary and fills each
 * segment from an {@link NBestGenerator} bounded by a {@link CandidateFilter}.
 * <p>
 * <b>Thread Safety:</b> the converter only holds immutable tables and is
 * thread safe. A {@link Segments} must not be converted by two threads at
 * once.
 */
public final class ImmutableConverter {

  private static final Logger log = LoggerFactory.getLogger(ImmutableConverter.class);

  private final Connector connector;
  private final Segmenter segmenter;
  private final DictionaryLookup dictionary;
  private final ConverterOptions options;
  private final KeyCorrector keyCorrector = new KeyCorrector();

  /**
   * A span of the lattice key that is treated as a unit while building the
   * lattice. Region edges are hard boundaries no word may cross.
   */
  private static final class Region {
    final int begin;
    final int end;
    final Segment.SegmentType type;
    // the segment the region came from, null for merged free segments
    final Segment source;

    Region(int begin, int end, Segment.SegmentType type, Segment source) {
      this.begin = begin;
      this.end = end;
      this.type = type;
      this.source = source;
    }
  }

  public ImmutableConverter(Connector connector, Segmenter segmenter, DictionaryLookup dictionary,
                            ConverterOptions options) {
    this.connector = connector;
    this.segmenter = segmenter;
    this.dictionary = dictionary;
    this.options = options;
  }

  public ConverterOptions getOptions() {
    return options;
  }

  /**
   * Replaces the conversion segments by a fresh conversion of {@code key}.
   * History segments are kept and used as left context.
   *
   * @return true on success; an empty key leaves zero conversion segments
   */
  public boolean startConversion(Segments segments, String key) {
    segments.clearConversionSegments();
    if (key == null || key.isEmpty()) {
      return true;
    }
    Segment segment = segments.addSegment();
    segment.setKey(key);
    segment.setSegmentType(Segment.SegmentType.FREE);
    return convert(segments);
  }

  /**
   * Reconverts the conversion segments. Adjacent free segments are merged and
   * segmented again, fixed boundary segments keep their keys and get new
   * candidates, fixed value segments are kept as they are.
   *
   * @return true on success
   */
  public boolean convert(Segments segments) {
    StringBuilder key = new StringBuilder();
    List<Region> regions = new ArrayList<Region>();

    for (int i = 0; i < segments.getHistorySegmentsSize(); i++) {
      Segment history = segments.getSegment(i);
      if (history.getKey().isEmpty() || history.getCandidatesSize() == 0) {
        continue;
      }
      int begin = key.length();
      key.append(history.getKey());
      regions.add(new Region(begin, key.length(), Segment.SegmentType.HISTORY, history));
    }
    int conversionBegin = key.length();

    Region free = null;
    for (Segment segment : segments.getConversionSegments()) {
      if (segment.getKey().isEmpty()) {
        continue;
      }
      int begin = key.length();
      key.append(segment.getKey());
      Segment.SegmentType type = segment.getSegmentType();
      if (type == Segment.SegmentType.FIXED_VALUE && segment.getCandidatesSize() == 0) {
        type = Segment.SegmentType.FIXED_BOUNDARY;
      }
      if (type == Segment.SegmentType.FREE || type == Segment.SegmentType.HISTORY) {
        if (free != null) {
          regions.remove(regions.size() - 1);
          begin = free.begin;
        }
        free = new Region(begin, key.length(), Segment.SegmentType.FREE, null);
        regions.add(free);
      } else {
        free = null;
        regions.add(new Region(begin, key.length(), type, segment));
      }
    }

    if (key.length() == conversionBegin) {
      segments.clearConversionSegments();
      return true;
    }

    Lattice lattice = buildLattice(key.toString(), regions);
    boolean pruneForbidden = runViterbi(lattice);
    Node[] endingAt = new Node[key.length() + 1];
    Node[] beginningAt = new Node[key.length() + 1];
    List<Node> path = bestPath(lattice, endingAt, beginningAt);

    NBestGenerator generator = new NBestGenerator(connector, segmenter, options.getMaxExpansions());
    CandidateFilter filter = new CandidateFilter(options);
    List<Segment> result = new ArrayList<Segment>();

    for (Region region : regions) {
      switch (region.type) {
        case HISTORY:
          break;
        case FIXED_VALUE:
          result.add(region.source);
          break;
        case FIXED_BOUNDARY: {
          Segment segment = newSegment(lattice, region.begin, region.end, Segment.SegmentType.FIXED_BOUNDARY);
          fillCandidates(lattice, endingAt[region.begin], beginningAt[region.end], segment,
              NBestGenerator.BoundaryCheck.ONLY_MID, pruneForbidden, generator, filter);
          result.add(segment);
          break;
        }
        default:
          segmentFreeRegion(lattice, region, path, endingAt, beginningAt, pruneForbidden, generator, filter, result);
          break;
      }
    }

    segments.clearConversionSegments();
    for (Segment segment : result) {
      segments.addSegment().assign(segment);
    }
    if (log.isDebugEnabled()) {
      log.debug("Converted {} into {} segments", key.substring(conversionBegin), result.size());
    }
    return true;
  }

  /**
   * Moves the boundary between conversion segment {@code index} and its
   * successor so that segment {@code index} holds {@code newLength}
   * characters. Shrinking the last segment creates a new segment holding the
   * rest. Only the two touched segments change.
   *
   * @return false, leaving {@code segments} untouched, if the index is out of
   *         range, {@code newLength} is not positive or the neighbour would
   *         be left empty
   */
  public boolean resizeSegment(Segments segments, int index, int newLength) {
    int size = segments.getConversionSegmentsSize();
    if (index < 0 || index >= size || newLength <= 0) {
      return false;
    }
    Segment segment = segments.getConversionSegment(index);
    int currentLength = TextUtil.charsLength(segment.getKey());
    if (newLength == currentLength) {
      return true;
    }

    boolean last = index == size - 1;
    String combined;
    if (last) {
      if (newLength > currentLength) {
        return false;
      }
      combined = segment.getKey();
    } else {
      combined = segment.getKey() + segments.getConversionSegment(index + 1).getKey();
      if (newLength >= TextUtil.charsLength(combined)) {
        return false;
      }
    }
    int split = TextUtil.prefixByChars(combined, newLength).length();

    List<Region> regions = new ArrayList<Region>();
    regions.add(new Region(0, split, Segment.SegmentType.FIXED_BOUNDARY, null));
    regions.add(new Region(split, combined.length(), Segment.SegmentType.FIXED_BOUNDARY, null));
    Lattice lattice = buildLattice(combined, regions);
    boolean pruneForbidden = runViterbi(lattice);
    Node[] endingAt = new Node[combined.length() + 1];
    Node[] beginningAt = new Node[combined.length() + 1];
    bestPath(lattice, endingAt, beginningAt);

    NBestGenerator generator = new NBestGenerator(connector, segmenter, options.getMaxExpansions());
    CandidateFilter filter = new CandidateFilter(options);
    Segment left = newSegment(lattice, 0, split, Segment.SegmentType.FIXED_BOUNDARY);
    fillCandidates(lattice, lattice.getBosNode(), beginningAt[split], left,
        NBestGenerator.BoundaryCheck.ONLY_MID, pruneForbidden, generator, filter);
    Segment right = newSegment(lattice, split, combined.length(), Segment.SegmentType.FREE);
    fillCandidates(lattice, endingAt[split], lattice.getEosNode(), right,
        NBestGenerator.BoundaryCheck.ONLY_MID, pruneForbidden, generator, filter);

    // everything is built, nothing can fail past this point
    segment.assign(left);
    if (last) {
      segments.insertSegment(segments.getHistorySegmentsSize() + index + 1).assign(right);
    } else {
      segments.getConversionSegment(index + 1).assign(right);
    }
    log.debug("Resized segment {} to {} characters", index, newLength);
    return true;
  }

  /**
   * Moves candidate {@code candidateIndex} of conversion segment
   * {@code index} to the top and fixes the segment's value.
   *
   * @return false, leaving {@code segments} untouched, if an index is out of
   *         range
   */
  public boolean commitSegmentValue(Segments segments, int index, int candidateIndex) {
    if (index < 0 || index >= segments.getConversionSegmentsSize()) {
      return false;
    }
    Segment segment = segments.getConversionSegment(index);
    if (candidateIndex < 0 || candidateIndex >= segment.getCandidatesSize()) {
      return false;
    }
    segment.moveCandidate(candidateIndex, 0);
    segment.setSegmentType(Segment.SegmentType.FIXED_VALUE);
    return true;
  }

  /**
   * Builds the lattice of a key converted as one free region.
   */
  Lattice buildLattice(String key) {
    return buildLattice(key, Collections.singletonList(new Region(0, key.length(), Segment.SegmentType.FREE, null)));
  }

  private Lattice buildLattice(String key, List<Region> regions) {
    Lattice lattice = new Lattice(key);
    for (Region region : regions) {
      switch (region.type) {
        case HISTORY:
          insertHistoryNode(lattice, region);
          break;
        case FIXED_VALUE: {
          Candidate top = region.source.getCandidate(0);
          lattice.insert(Node.Type.FIXED_VALUE, region.begin, region.end, top.getValue(),
              top.getLid(), top.getRid(), Math.max(0, top.getWcost()), false);
          break;
        }
        default:
          insertWords(lattice, region.begin, region.end);
          if (options.isKeyCorrection()) {
            insertCorrectedWords(lattice, region.begin, region.end);
          }
          insertUnknownWords(lattice, region.begin, region.end);
          break;
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("Lattice for {} has {} nodes", key, lattice.getNodeCount());
    }
    return lattice;
  }

  /**
   * A history candidate without ids borrows those of the dictionary word
   * with the same key and value.
   */
  private void insertHistoryNode(Lattice lattice, Region region) {
    Candidate top = region.source.getCandidate(0);
    int lid = top.getLid();
    int rid = top.getRid();
    if (lid == 0 && rid == 0) {
      lid = options.getUnknownPosId();
      rid = options.getUnknownPosId();
      for (Entry entry : dictionary.lookupExact(region.source.getKey(), 0)) {
        if (entry.getValue().equals(top.getValue())) {
          lid = entry.getLid();
          rid = entry.getRid();
          break;
        }
      }
    }
    lattice.insert(Node.Type.HISTORY, region.begin, region.end, top.getValue(), lid, rid, 0, false);
  }

  private void insertWords(Lattice lattice, int begin, int end) {
    // lookups stop at the region end so no word crosses it
    String key = lattice.getKey().substring(0, end);
    for (int p = begin; p < end; p += Character.charCount(key.codePointAt(p))) {
      for (Entry entry : dictionary.lookupPrefix(key, p)) {
        lattice.insert(Node.Type.NORMAL, p, p + entry.getSpanLength(), entry.getValue(),
            entry.getLid(), entry.getRid(), entry.getCost(), false);
      }
      for (Entry entry : dictionary.lookupExact(key, p)) {
        if (!lattice.contains(p, end, entry.getValue(), entry.getLid(), entry.getRid())) {
          lattice.insert(Node.Type.NORMAL, p, end, entry.getValue(),
              entry.getLid(), entry.getRid(), entry.getCost(), false);
        }
      }
    }
  }

  /**
   * Adds the words of the corrected keys over the original span they map
   * to. Words whose original span reads the same as their key were already
   * found by {@link #insertWords}.
   */
  private void insertCorrectedWords(Lattice lattice, int begin, int end) {
    String original = lattice.getKey().substring(begin, end);
    for (KeyCorrector.CorrectedKey correctedKey : keyCorrector.correct(original)) {
      if (correctedKey.isIdentity()) {
        continue;
      }
      String corrected = correctedKey.getCorrectedKey();
      log.debug("Corrected key {}", correctedKey);
      for (int p = 0; p < corrected.length(); p += Character.charCount(corrected.codePointAt(p))) {
        int originalBegin = correctedKey.getOriginalOffset(p);
        if (originalBegin < 0) {
          continue;
        }
        for (Entry entry : dictionary.lookupPrefix(corrected, p)) {
          int originalEnd = correctedKey.getOriginalOffset(p + entry.getSpanLength());
          if (originalEnd <= originalBegin
              || original.substring(originalBegin, originalEnd).equals(entry.getKey())
              || lattice.contains(begin + originalBegin, begin + originalEnd, entry.getValue(),
                                  entry.getLid(), entry.getRid())) {
            continue;
          }
          int cost = Node.addCost(entry.getCost(), options.getCorrectionPenalty());
          lattice.insert(Node.Type.NORMAL, begin + originalBegin, begin + originalEnd, entry.getValue(),
              entry.getLid(), entry.getRid(), cost, true);
        }
      }
    }
  }

  private void insertUnknownWords(Lattice lattice, int begin, int end) {
    String key = lattice.getKey();
    int posId = options.getUnknownPosId();
    for (int p = begin; p < end; ) {
      int codePoint = key.codePointAt(p);
      int next = p + Character.charCount(codePoint);
      if (!lattice.hasNodesBeginningAt(p)) {
        lattice.insert(Node.Type.UNKNOWN, p, next, key.substring(p, next), posId, posId,
            options.getUnknownWordCost(), false);
      }
      p = next;
    }
  }

  /**
   * Runs the forward pass, first excluding never co-occurring pairs and, if
   * that disconnects the lattice, again without excluding them.
   *
   * @return whether the pass that reached EOS excluded those pairs
   */
  boolean runViterbi(Lattice lattice) {
    if (viterbi(lattice, true)) {
      return true;
    }
    log.debug("EOS unreachable for {}, retrying without pruning", lattice.getKey());
    if (!viterbi(lattice, false)) {
      // every offset starts a word, so this means a broken lattice
      throw new IllegalStateException("Lattice is not connected: " + lattice.getKey());
    }
    return false;
  }

  private boolean viterbi(Lattice lattice, boolean pruneForbidden) {
    lattice.clearCosts();
    int length = lattice.getKey().length();
    for (int pos = 0; pos <= length; pos++) {
      IntArrayList ends = lattice.getEndNodes(pos);
      IntArrayList begins = lattice.getBeginNodes(pos);
      for (int i = 0; i < begins.size(); i++) {
        Node rnode = lattice.getNode(begins.get(i));
        int best = Node.UNREACHABLE;
        int prev = -1;
        for (int j = 0; j < ends.size(); j++) {
          Node lnode = lattice.getNode(ends.get(j));
          if (!lnode.isReachable() || (pruneForbidden && isForbiddenEdge(segmenter, lnode, rnode))) {
            continue;
          }
          int cost = Node.addCost(lnode.getCost(), connector.getTransitionCost(lnode.getRid(), rnode.getLid()));
          if (cost < best) {
            best = cost;
            prev = lnode.getId();
          }
        }
        if (prev >= 0) {
          rnode.setCost(Node.addCost(best, rnode.getWcost()));
          rnode.setPrev(prev);
        }
      }
    }
    return lattice.getEosNode().isReachable();
  }

  /**
   * Whether an edge is excluded when never co-occurring pairs are pruned.
   * Edges touching BOS, EOS, history, unknown or fixed nodes never are.
   */
  static boolean isForbiddenEdge(Segmenter segmenter, Node lnode, Node rnode) {
    if (!isPrunable(lnode) || !isPrunable(rnode)) {
      return false;
    }
    return segmenter.isForbidden(lnode.getRid(), rnode.getLid());
  }

  private static boolean isPrunable(Node node) {
    return node.getType() == Node.Type.NORMAL;
  }

  /**
   * Backtracks from EOS and indexes the best path by offset.
   *
   * @return the path without BOS and EOS
   */
  private static List<Node> bestPath(Lattice lattice, Node[] endingAt, Node[] beginningAt) {
    List<Node> path = new ArrayList<Node>();
    Node eos = lattice.getEosNode();
    beginningAt[eos.getBegin()] = eos;
    endingAt[0] = lattice.getBosNode();
    for (Node node = lattice.getNode(eos.getPrev()); node.getType() != Node.Type.BOS;
         node = lattice.getNode(node.getPrev())) {
      path.add(0, node);
      endingAt[node.getEnd()] = node;
      beginningAt[node.getBegin()] = node;
    }
    return path;
  }

  /**
   * Cuts the best path inside a free region where the segmenter requires a
   * boundary and fills one segment per piece.
   */
  private void segmentFreeRegion(Lattice lattice, Region region, List<Node> path,
                                 Node[] endingAt, Node[] beginningAt, boolean pruneForbidden,
                                 NBestGenerator generator, CandidateFilter filter, List<Segment> result) {
    int length = lattice.getKey().length();
    int start = region.begin;
    // true when the piece start is BOS or a segmenter boundary, not a hard one
    boolean startDerived = region.begin == 0;
    for (Node node : path) {
      if (node.getBegin() < region.begin || node.getEnd() >= region.end) {
        continue;
      }
      Node next = beginningAt[node.getEnd()];
      if (!segmenter.isBoundary(node.getRid(), next.getLid())) {
        continue;
      }
      result.add(makeSegment(lattice, start, node.getEnd(), startDerived, true,
          endingAt, beginningAt, pruneForbidden, generator, filter));
      start = node.getEnd();
      startDerived = true;
    }
    result.add(makeSegment(lattice, start, region.end, startDerived, region.end == length,
        endingAt, beginningAt, pruneForbidden, generator, filter));
  }

  private Segment makeSegment(Lattice lattice, int begin, int end, boolean startDerived, boolean endDerived,
                              Node[] endingAt, Node[] beginningAt, boolean pruneForbidden,
                              NBestGenerator generator, CandidateFilter filter) {
    Segment segment = newSegment(lattice, begin, end, Segment.SegmentType.FREE);
    NBestGenerator.BoundaryCheck check = startDerived && endDerived
        ? NBestGenerator.BoundaryCheck.STRICT : NBestGenerator.BoundaryCheck.ONLY_MID;
    fillCandidates(lattice, endingAt[begin], beginningAt[end], segment, check, pruneForbidden, generator, filter);
    return segment;
  }

  private static Segment newSegment(Lattice lattice, int begin, int end, Segment.SegmentType type) {
    Segment segment = new Segment();
    segment.setKey(lattice.getKey().substring(begin, end));
    segment.setSegmentType(type);
    return segment;
  }

  private void fillCandidates(Lattice lattice, Node beginNode, Node endNode, Segment segment,
                              NBestGenerator.BoundaryCheck check, boolean pruneForbidden,
                              NBestGenerator generator, CandidateFilter filter) {
    segment.clearCandidates();
    generateCandidates(lattice, beginNode, endNode, segment, check, pruneForbidden, generator, filter);
    if (segment.getCandidatesSize() == 0 && check != NBestGenerator.BoundaryCheck.NONE) {
      log.debug("No {} candidates for {}, retrying without boundary check", check, segment.getKey());
      generateCandidates(lattice, beginNode, endNode, segment, NBestGenerator.BoundaryCheck.NONE,
          pruneForbidden, generator, filter);
    }
    addReadingCandidates(segment);
  }

  private void generateCandidates(Lattice lattice, Node beginNode, Node endNode, Segment segment,
                                  NBestGenerator.BoundaryCheck check, boolean pruneForbidden,
                                  NBestGenerator generator, CandidateFilter filter) {
    generator.reset(lattice, beginNode, endNode, check, pruneForbidden);
    filter.reset();
    NBestGenerator.Path path;
    while ((path = generator.next()) != null) {
      CandidateFilter.ResultType result = filter.filter(path.getCandidate(), path.getNodes());
      if (result == CandidateFilter.ResultType.STOP) {
        break;
      }
      if (result == CandidateFilter.ResultType.KEEP) {
        segment.pushBackCandidate(path.getCandidate());
        if (filter.getKeptCount() >= options.getMaxCandidates()) {
          break;
        }
      }
    }
  }

  /**
   * Appends the reading and, for an all hiragana reading, its katakana form
   * when the N-best list lacks them. These come on top of the
   * {@link ConverterOptions#getMaxCandidates()} ranked candidates. A segment
   * left without candidates always gets the reading.
   */
  private void addReadingCandidates(Segment segment) {
    String reading = segment.getKey();
    if (options.isReadingCandidates()) {
      addReadingCandidate(segment, reading);
      if (TextUtil.isScriptType(reading, TextUtil.ScriptType.HIRAGANA)) {
        addReadingCandidate(segment, TextUtil.hiraganaToKatakana(reading));
      }
    } else if (segment.getCandidatesSize() == 0) {
      addReadingCandidate(segment, reading);
    }
  }

  private void addReadingCandidate(Segment segment, String value) {
    if (segment.hasCandidateValue(value)) {
      return;
    }
    int cost = segment.getCandidatesSize() == 0 ? 0
        : segment.getCandidate(segment.getCandidatesSize() - 1).getCost();
    Candidate candidate = segment.addCandidate();
    candidate.setKey(segment.getKey());
    candidate.setValue(value);
    candidate.setContentKey(segment.getKey());
    candidate.setContentValue(value);
    candidate.setCost(cost);
    candidate.setLid(options.getUnknownPosId());
    candidate.setRid(options.getUnknownPosId());
    candidate.addAttributes(Candidate.READING_FALLBACK);
  }
}
