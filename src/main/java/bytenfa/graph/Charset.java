package bytenfa.graph;

import bytenfa.util.IntRange;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Set of byte values {@code 0x00-0xFF}.
 *
 * This is the label on every input-consuming transition of a {@link UTnfa}.
 * Multi-byte characters are not representable here: they are spelled out as
 * sequences of transitions (see {@link Utf8Sequences}).
 *
 * Instances are immutable. Bytes are passed around as unsigned {@code int}
 * values since Java's {@code byte} is signed.
 */
public final class Charset implements Iterable<Integer> {

  /**
   * Set containing no bytes.
   */
  public static final Charset EMPTY = new Charset(0L, 0L, 0L, 0L);

  /**
   * Set containing every byte.
   */
  public static final Charset FULL = new Charset(-1L, -1L, -1L, -1L);

  // Bit `i` of `words[i >>> 6]` is set when byte `i` is a member
  private final long[] words;

  private Charset(long w0, long w1, long w2, long w3) {
    this.words = new long[] { w0, w1, w2, w3 };
  }

  private Charset(long[] words) {
    this.words = words;
  }

  public static Charset empty() {
    return EMPTY;
  }

  /**
   * Set containing just one byte.
   *
   * @param b unsigned byte value
   */
  public static Charset ofByte(int b) {
    return range(b, b);
  }

  /**
   * Set containing every byte in {@code lo..hi} (inclusive).
   *
   * An inverted range ({@code lo > hi}) produces the empty set.
   *
   * @param lo first byte in the range
   * @param hi last byte in the range
   */
  public static Charset range(int lo, int hi) {
    checkByte(lo);
    checkByte(hi);
    final var words = new long[4];
    for (int b = lo; b <= hi; b++) {
      words[b >>> 6] |= 1L << (b & 63);
    }
    return new Charset(words);
  }

  /**
   * Set containing exactly the bytes listed.
   *
   * @param bytes unsigned byte values
   */
  public static Charset of(int... bytes) {
    final var words = new long[4];
    for (int b : bytes) {
      checkByte(b);
      words[b >>> 6] |= 1L << (b & 63);
    }
    return new Charset(words);
  }

  /**
   * Is the byte in the set?
   *
   * @param b unsigned byte value
   */
  public boolean contains(int b) {
    checkByte(b);
    return (words[b >>> 6] & (1L << (b & 63))) != 0;
  }

  public Charset union(Charset other) {
    final var output = new long[4];
    for (int i = 0; i < 4; i++) {
      output[i] = words[i] | other.words[i];
    }
    return new Charset(output);
  }

  public Charset intersection(Charset other) {
    final var output = new long[4];
    for (int i = 0; i < 4; i++) {
      output[i] = words[i] & other.words[i];
    }
    return new Charset(output);
  }

  public boolean isEmpty() {
    return (words[0] | words[1] | words[2] | words[3]) == 0;
  }

  /**
   * Number of bytes in the set.
   */
  public int cardinality() {
    int count = 0;
    for (long word : words) {
      count += Long.bitCount(word);
    }
    return count;
  }

  /**
   * Member bytes, in ascending order.
   *
   * Every call produces a fresh stream.
   */
  public IntStream stream() {
    return IntStream.range(0, 256).filter(this::contains);
  }

  @Override
  public Iterator<Integer> iterator() {
    return stream().iterator();
  }

  /**
   * Maximal runs of consecutive member bytes, in ascending order.
   */
  public List<IntRange> ranges() {
    final var output = new ArrayList<IntRange>();
    int b = 0;
    while (b < 256) {
      if (!contains(b)) {
        b++;
        continue;
      }
      final int start = b;
      while (b < 256 && contains(b)) {
        b++;
      }
      output.add(IntRange.between(start, b - 1));
    }
    return output;
  }

  /**
   * Label for the set when rendered in a DOT graph.
   */
  public String dotLabel() {
    final var builder = new StringBuilder();
    boolean needsSpace = false;
    for (var range : ranges()) {
      if (needsSpace) {
        builder.append(", ");
      } else {
        needsSpace = true;
      }
      builder.append(byteString(range.lowerBound()));
      if (range.lowerBound() != range.upperBound()) {
        builder.append('-');
        builder.append(byteString(range.upperBound()));
      }
    }
    return builder.toString();
  }

  /**
   * Print a byte as a string.
   *
   * Prints alphanumeric ascii characters as themselves and everything else
   * escaped.
   */
  private static String byteString(int b) {
    if (b <= 127 && Character.isLetterOrDigit(b)) {
      return String.format("<font face=\"courier\">%c</font>", b);
    } else {
      return String.format("<font face=\"courier\">\\\\x%02X</font>", b);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Charset charset)) {
      return false;
    }
    for (int i = 0; i < 4; i++) {
      if (words[i] != charset.words[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(words[0])
      ^ 31 * Long.hashCode(words[1])
      ^ 961 * Long.hashCode(words[2])
      ^ 29791 * Long.hashCode(words[3]);
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("Charset(");
    boolean needsSpace = false;
    for (var range : ranges()) {
      if (needsSpace) {
        builder.append(", ");
      } else {
        needsSpace = true;
      }
      builder.append(range.compactString());
    }
    builder.append(')');
    return builder.toString();
  }

  private static void checkByte(int b) {
    if (b < 0 || b > 0xFF) {
      throw new IllegalArgumentException("Not an unsigned byte value: " + b);
    }
  }
}
