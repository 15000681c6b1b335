package net.java.henkan;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables of the converter. Instances are immutable; use {@link #builder()}
 * or {@link #fromProperties(Properties)}.
 */
public final class ConverterOptions {

  public static final String MAX_CANDIDATES = "henkan.maxCandidates";
  public static final String MAX_EXPANSIONS = "henkan.maxExpansions";
  public static final String KEY_CORRECTION = "henkan.keyCorrection";
  public static final String CORRECTION_PENALTY = "henkan.correctionPenalty";
  public static final String UNKNOWN_WORD_COST = "henkan.unknownWordCost";
  public static final String UNKNOWN_POS_ID = "henkan.unknownPosId";
  public static final String COST_OFFSET = "henkan.costOffset";
  public static final String STRUCTURE_COST_OFFSET = "henkan.structureCostOffset";
  public static final String READING_CANDIDATES = "henkan.readingCandidates";

  public static final ConverterOptions DEFAULT = builder().build();

  private final int maxCandidates;
  private final int maxExpansions;
  private final boolean keyCorrection;
  private final int correctionPenalty;
  private final int unknownWordCost;
  private final int unknownPosId;
  private final int costOffset;
  private final int structureCostOffset;
  private final boolean readingCandidates;

  private ConverterOptions(Builder builder) {
    this.maxCandidates = builder.maxCandidates;
    this.maxExpansions = builder.maxExpansions;
    this.keyCorrection = builder.keyCorrection;
    this.correctionPenalty = builder.correctionPenalty;
    this.unknownWordCost = builder.unknownWordCost;
    this.unknownPosId = builder.unknownPosId;
    this.costOffset = builder.costOffset;
    this.structureCostOffset = builder.structureCostOffset;
    this.readingCandidates = builder.readingCandidates;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .maxCandidates(maxCandidates)
        .maxExpansions(maxExpansions)
        .keyCorrection(keyCorrection)
        .correctionPenalty(correctionPenalty)
        .unknownWordCost(unknownWordCost)
        .unknownPosId(unknownPosId)
        .costOffset(costOffset)
        .structureCostOffset(structureCostOffset)
        .readingCandidates(readingCandidates);
  }

  /**
   * Reads the {@code henkan.*} keys; missing keys keep their defaults.
   *
   * @throws IllegalArgumentException on a malformed or out of range value
   */
  public static ConverterOptions fromProperties(Properties props) {
    Builder b = builder();
    b.maxCandidates(getInt(props, MAX_CANDIDATES, b.maxCandidates));
    b.maxExpansions(getInt(props, MAX_EXPANSIONS, b.maxExpansions));
    b.keyCorrection(getBoolean(props, KEY_CORRECTION, b.keyCorrection));
    b.correctionPenalty(getInt(props, CORRECTION_PENALTY, b.correctionPenalty));
    b.unknownWordCost(getInt(props, UNKNOWN_WORD_COST, b.unknownWordCost));
    b.unknownPosId(getInt(props, UNKNOWN_POS_ID, b.unknownPosId));
    b.costOffset(getInt(props, COST_OFFSET, b.costOffset));
    b.structureCostOffset(getInt(props, STRUCTURE_COST_OFFSET, b.structureCostOffset));
    b.readingCandidates(getBoolean(props, READING_CANDIDATES, b.readingCandidates));
    return b.build();
  }

  /**
   * Loads a properties file; the stream is not closed.
   */
  public static ConverterOptions load(InputStream in) throws IOException {
    Properties props = new Properties();
    props.load(in);
    return fromProperties(props);
  }

  private static int getInt(Properties props, String name, int defaultValue) {
    String value = props.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
    }
  }

  private static boolean getBoolean(Properties props, String name, boolean defaultValue) {
    String value = props.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    value = value.trim();
    if ("true".equalsIgnoreCase(value)) {
      return true;
    } else if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid boolean for " + name + ": " + value);
  }

  /**
   * Ranked candidates kept per segment before the N-best enumeration stops.
   * The reading fallbacks of {@link #isReadingCandidates()} are appended
   * after that, so a segment may hold up to two more entries.
   */
  public int getMaxCandidates() {
    return maxCandidates;
  }

  /**
   * Queue pops one N-best enumeration may spend.
   */
  public int getMaxExpansions() {
    return maxExpansions;
  }

  public boolean isKeyCorrection() {
    return keyCorrection;
  }

  /**
   * Added to the word cost of nodes found through a corrected key.
   */
  public int getCorrectionPenalty() {
    return correctionPenalty;
  }

  public int getUnknownWordCost() {
    return unknownWordCost;
  }

  /**
   * Left and right id given to synthesized unknown nodes.
   */
  public int getUnknownPosId() {
    return unknownPosId;
  }

  /**
   * Candidates costing more than the top candidate plus this offset end the
   * enumeration.
   */
  public int getCostOffset() {
    return costOffset;
  }

  /**
   * Multi-word candidates whose structure cost exceeds this are dropped.
   */
  public int getStructureCostOffset() {
    return structureCostOffset;
  }

  /**
   * Whether the raw reading and, for a hiragana reading, its katakana form
   * are appended to every segment.
   */
  public boolean isReadingCandidates() {
    return readingCandidates;
  }

  @Override
  public String toString() {
    return "ConverterOptions{maxCandidates=" + maxCandidates
        + ", maxExpansions=" + maxExpansions
        + ", keyCorrection=" + keyCorrection
        + ", correctionPenalty=" + correctionPenalty
        + ", unknownWordCost=" + unknownWordCost
        + ", unknownPosId=" + unknownPosId
        + ", costOffset=" + costOffset
        + ", structureCostOffset=" + structureCostOffset
        + ", readingCandidates=" + readingCandidates + "}";
  }

  public static final class Builder {
    private int maxCandidates = 20;
    private int maxExpansions = 10000;
    private boolean keyCorrection = true;
    private int correctionPenalty = 3000;
    private int unknownWordCost = 10000;
    private int unknownPosId = 1;
    private int costOffset = 6907;
    private int structureCostOffset = 3453;
    private boolean readingCandidates = true;

    private Builder() {
    }

    public Builder maxCandidates(int maxCandidates) {
      this.maxCandidates = maxCandidates;
      return this;
    }

    public Builder maxExpansions(int maxExpansions) {
      this.maxExpansions = maxExpansions;
      return this;
    }

    public Builder keyCorrection(boolean keyCorrection) {
      this.keyCorrection = keyCorrection;
      return this;
    }

    public Builder correctionPenalty(int correctionPenalty) {
      this.correctionPenalty = correctionPenalty;
      return this;
    }

    public Builder unknownWordCost(int unknownWordCost) {
      this.unknownWordCost = unknownWordCost;
      return this;
    }

    public Builder unknownPosId(int unknownPosId) {
      this.unknownPosId = unknownPosId;
      return this;
    }

    public Builder costOffset(int costOffset) {
      this.costOffset = costOffset;
      return this;
    }

    public Builder structureCostOffset(int structureCostOffset) {
      this.structureCostOffset = structureCostOffset;
      return this;
    }

    public Builder readingCandidates(boolean readingCandidates) {
      this.readingCandidates = readingCandidates;
      return this;
    }

    public ConverterOptions build() {
      requirePositive(MAX_CANDIDATES, maxCandidates);
      requirePositive(MAX_EXPANSIONS, maxExpansions);
      requireNonNegative(CORRECTION_PENALTY, correctionPenalty);
      requireNonNegative(UNKNOWN_WORD_COST, unknownWordCost);
      requirePositive(UNKNOWN_POS_ID, unknownPosId);
      requireNonNegative(COST_OFFSET, costOffset);
      requireNonNegative(STRUCTURE_COST_OFFSET, structureCostOffset);
      return new ConverterOptions(this);
    }

    private static void requirePositive(String name, int value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive: " + value);
      }
    }

    private static void requireNonNegative(String name, int value) {
      if (value < 0) {
        throw new IllegalArgumentException(name + " must not be negative: " + value);
      }
    }
  }
}
