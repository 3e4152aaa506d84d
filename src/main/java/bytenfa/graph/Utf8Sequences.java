package bytenfa.graph;

import bytenfa.parser.CodePoints;
import bytenfa.util.IntRange;
import bytenfa.util.IntRanges;
import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

/**
 * Compiles sets of code points into automata over their UTF-8 encodings.
 *
 * Code points are turned into one to four 8-bit code units. A range of code
 * points is broken down into sub-ranges such that every sub-range is exactly
 * the cartesian product of one byte range per position. For instance,
 * {@code U+0080-U+07FF} is the single sequence {@code [C2-DF][80-BF]}, while
 * {@code U+0400-U+04FF} is {@code [D0-D3][80-BF]}, and {@code U+00FF-U+0100}
 * needs two sequences, {@code [C3][BF]} and {@code [C4][80]}.
 */
public final class Utf8Sequences {

  private Utf8Sequences() { }

  // Ranges of code points taking 1, 2, 3, and 4 code units
  static final IntRange ONE_BYTE_RANGE = IntRange.between(0, 0x7F);
  static final IntRange TWO_BYTE_RANGE = IntRange.between(0x80, 0x7FF);
  static final IntRange THREE_BYTE_RANGE = IntRange.between(0x800, 0xFFFF);
  static final IntRange FOUR_BYTE_RANGE = IntRange.between(0x10000, 0x10FFFF);

  private static final List<IntRange> LENGTH_CLASSES =
    List.of(ONE_BYTE_RANGE, TWO_BYTE_RANGE, THREE_BYTE_RANGE, FOUR_BYTE_RANGE);

  /**
   * Sequence of byte sets, one per position of an encoding.
   *
   * @param positions accepted bytes at each position
   */
  public record Sequence(List<Charset> positions) {

    public Sequence {
      positions = List.copyOf(positions);
    }

    /**
     * Does the byte string match the sequence position by position?
     *
     * @param bytes input bytes
     */
    public boolean matches(byte[] bytes) {
      if (bytes.length != positions.size()) {
        return false;
      }
      for (int i = 0; i < bytes.length; i++) {
        if (!positions.get(i).contains(bytes[i] & 0xFF)) {
          return false;
        }
      }
      return true;
    }

    /**
     * Fragment matching the sequence: the single byte fragments concatenated
     * in order.
     */
    public UTnfa toNfa() {
      final UTnfa output = UTnfa.charset(positions.get(0));
      for (int i = 1; i < positions.size(); i++) {
        output.concat(UTnfa.charset(positions.get(i)));
      }
      return output;
    }
  }

  /**
   * Compile code point ranges into one fragment.
   *
   * The fragment accepts exactly the UTF-8 encodings of the code points in the
   * ranges. Surrogate code points are skipped since they have no encoding.
   * When the ranges contain no encodable code point, the fragment accepts
   * nothing (not even the empty input).
   *
   * @param codePointRanges ranges of code points, in any order
   * @return fragment accepting the encodings
   */
  public static UTnfa compile(List<IntRange> codePointRanges) {
    UTnfa output = null;
    for (IntRange range : codePointRanges) {
      for (Sequence sequence : sequences(range)) {
        if (output == null) {
          output = sequence.toNfa();
        } else {
          output.union(sequence.toNfa());
        }
      }
    }
    return output == null ? UTnfa.charset(Charset.empty()) : output;
  }

  /**
   * Break a code point range into byte sequences.
   *
   * The range is first split along the boundaries between encoding lengths,
   * then further split wherever the leading bytes of the two endpoints
   * diverge before the last position. The output is sorted and the sequences
   * match disjoint sets of byte strings.
   *
   * @param codePoints range of code points
   * @return byte sequences whose union is the encoding of the range
   */
  public static List<Sequence> sequences(IntRange codePoints) {
    final var output = new ArrayList<Sequence>();
    final List<IntRange> scalarRanges =
      IntRanges.subtract(List.of(codePoints), List.of(CodePoints.SURROGATE_RANGE));

    for (IntRange scalarRange : scalarRanges) {
      for (IntRange lengthClass : LENGTH_CLASSES) {
        final IntRange sameLength = scalarRange.intersect(lengthClass);
        if (sameLength != null) {
          splitSameLength(sameLength, output);
        }
      }
    }
    return output;
  }

  /**
   * Break a range whose code points all have the same encoding length.
   */
  private static void splitSameLength(IntRange range, List<Sequence> output) {
    final var toSplit = new Stack<IntRange>();
    toSplit.push(range);

    splitting:
    while (!toSplit.isEmpty()) {
      final IntRange next = toSplit.pop();
      final int lo = next.lowerBound();
      final int hi = next.upperBound();

      // Continuation bytes carry 6 bits each: find a position where a split is needed
      for (int i = 1; i < encodedLength(lo); i++) {
        final int mask = (1 << (6 * i)) - 1;
        if ((lo & ~mask) != (hi & ~mask)) {
          if ((lo & mask) != 0) {
            toSplit.push(IntRange.between((lo | mask) + 1, hi));
            toSplit.push(IntRange.between(lo, lo | mask));
            continue splitting;
          }
          if ((hi & mask) != mask) {
            toSplit.push(IntRange.between(hi & ~mask, hi));
            toSplit.push(IntRange.between(lo, (hi & ~mask) - 1));
            continue splitting;
          }
        }
      }

      final int[] loBytes = encode(lo);
      final int[] hiBytes = encode(hi);
      final var positions = new ArrayList<Charset>(loBytes.length);
      for (int i = 0; i < loBytes.length; i++) {
        positions.add(Charset.range(loBytes[i], hiBytes[i]));
      }
      output.add(new Sequence(positions));
    }
  }

  /**
   * Number of bytes in the UTF-8 encoding of a code point.
   *
   * @param codePoint unicode code point
   */
  public static int encodedLength(int codePoint) {
    if (codePoint <= ONE_BYTE_RANGE.upperBound()) {
      return 1;
    } else if (codePoint <= TWO_BYTE_RANGE.upperBound()) {
      return 2;
    } else if (codePoint <= THREE_BYTE_RANGE.upperBound()) {
      return 3;
    } else {
      return 4;
    }
  }

  /**
   * Encode a code point into UTF-8.
   *
   * Surrogates are encoded like any other 3-byte code point, even though the
   * result is not well-formed UTF-8.
   *
   * @param codePoint unicode code point
   * @return unsigned code units
   */
  public static int[] encode(int codePoint) {
    CodePoints.checkCodePoint(codePoint);
    switch (encodedLength(codePoint)) {
      case 1:
        return new int[] { codePoint };
      case 2:
        return new int[] {
          0xC0 | (codePoint >>> 6),
          0x80 | (codePoint & 0x3F)
        };
      case 3:
        return new int[] {
          0xE0 | (codePoint >>> 12),
          0x80 | ((codePoint >>> 6) & 0x3F),
          0x80 | (codePoint & 0x3F)
        };
      default:
        return new int[] {
          0xF0 | (codePoint >>> 18),
          0x80 | ((codePoint >>> 12) & 0x3F),
          0x80 | ((codePoint >>> 6) & 0x3F),
          0x80 | (codePoint & 0x3F)
        };
    }
  }
}
