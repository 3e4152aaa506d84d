package bytenfa.parser;

import bytenfa.util.IntRange;

/**
 * Utility class for code point constants and checks.
 */
public final class CodePoints {

  private CodePoints() { }

  /**
   * Range of unicode code points: {@code U+0000-U+10FFFF}.
   */
  final public static IntRange UNICODE_RANGE = IntRange.between(Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);

  /**
   * Range of surrogate code points: {@code U+D800-U+DFFF}.
   *
   * These are not unicode scalar values and have no UTF-8 encoding.
   */
  final public static IntRange SURROGATE_RANGE = IntRange.between(Character.MIN_SURROGATE, Character.MAX_SURROGATE);

  /**
   * Reject integers that are not code points.
   *
   * @param codePoint integer to check
   * @return the same code point
   * @throws IllegalArgumentException if the integer is outside {@link #UNICODE_RANGE}
   */
  public static int checkCodePoint(int codePoint) {
    if (!UNICODE_RANGE.contains(codePoint)) {
      throw new IllegalArgumentException(String.format("Not a code point: 0x%X", codePoint));
    }
    return codePoint;
  }

  /**
   * Render a code point in {@code U+XXXX} notation.
   */
  public static String toDisplayString(int codePoint) {
    return String.format("U+%04X", codePoint);
  }
}
