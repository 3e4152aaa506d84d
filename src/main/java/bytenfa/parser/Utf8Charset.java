package bytenfa.parser;

import bytenfa.graph.UTnfa;
import bytenfa.graph.Utf8Sequences;
import bytenfa.util.IntRange;
import bytenfa.util.IntRanges;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Set of unicode code points to be matched as UTF-8.
 *
 * The set is a list of code point ranges, optionally inverted (in which case
 * it denotes every code point not in any of the ranges). It gets built up
 * incrementally and then compiled into a byte-level fragment with
 * {@link #toNfa}.
 */
public final class Utf8Charset {

  private final List<IntRange> ranges = new ArrayList<>();
  private boolean invert = false;

  private Utf8Charset() { }

  /**
   * Set containing no code points (until some are added).
   */
  public static Utf8Charset empty() {
    return new Utf8Charset();
  }

  /**
   * Parse a character class literal.
   *
   * @see CharClassParser
   * @param literal class body, such as {@code ^a-z_}
   */
  public static Utf8Charset parse(String literal) throws PatternSyntaxException {
    return CharClassParser.parse(literal);
  }

  /**
   * Parse a character class literal straight into a fragment.
   *
   * @param literal class body, such as {@code ^a-z_}
   */
  public static UTnfa compile(String literal) throws PatternSyntaxException {
    return parse(literal).toNfa();
  }

  /**
   * Set whether the set is inverted.
   *
   * @param invert match the code points outside the ranges instead
   * @return this set
   */
  public Utf8Charset invert(boolean invert) {
    this.invert = invert;
    return this;
  }

  /**
   * Add a single code point.
   *
   * @param codePoint code point to add
   * @return this set
   */
  public Utf8Charset addChar(int codePoint) {
    return addRange(codePoint, codePoint);
  }

  /**
   * Add every code point in {@code lo..hi} (inclusive).
   *
   * An inverted range ({@code lo > hi}) adds nothing.
   *
   * @param lo first code point in the range
   * @param hi last code point in the range
   * @return this set
   */
  public Utf8Charset addRange(int lo, int hi) {
    CodePoints.checkCodePoint(lo);
    CodePoints.checkCodePoint(hi);
    final IntRange range = IntRange.betweenOrNull(lo, hi);
    if (range != null) {
      ranges.add(range);
    }
    return this;
  }

  public boolean isInverted() {
    return invert;
  }

  /**
   * Ranges as they were added (ignoring inversion).
   */
  public List<IntRange> ranges() {
    return Collections.unmodifiableList(ranges);
  }

  /**
   * Ranges of code points actually in the set.
   *
   * If the set is not inverted, these are the ranges as added. Otherwise,
   * they are the sorted and disjoint ranges left after removing every added
   * range from {@link CodePoints#UNICODE_RANGE}.
   */
  public List<IntRange> codePointRanges() {
    if (invert) {
      return IntRanges.subtract(List.of(CodePoints.UNICODE_RANGE), ranges);
    } else {
      return List.copyOf(ranges);
    }
  }

  /**
   * Compile the set into a fragment accepting exactly the UTF-8 encodings of
   * its code points.
   */
  public UTnfa toNfa() {
    return Utf8Sequences.compile(codePointRanges());
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("Utf8Charset(");
    if (invert) {
      builder.append('^');
    }
    boolean needsSpace = false;
    for (IntRange range : ranges) {
      if (needsSpace) {
        builder.append(", ");
      } else {
        needsSpace = true;
      }
      builder.append(CodePoints.toDisplayString(range.lowerBound()));
      if (range.lowerBound() != range.upperBound()) {
        builder.append('-').append(CodePoints.toDisplayString(range.upperBound()));
      }
    }
    builder.append(')');
    return builder.toString();
  }
}
