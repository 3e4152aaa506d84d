package bytenfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Parser for character class literals.
 *
 * A literal is the body of a bracket class without the brackets: a sequence
 * of characters and {@code lo-hi} ranges, optionally preceded by {@code ^} to
 * invert the class. Some examples:
 *
 *   - {@code a-z0-9_} matches lowercase ASCII letters, digits, and underscore
 *   - {@code ^\n} matches any code point other than a newline
 *   - {@code -+} matches a minus or a plus (a leading or trailing {@code -} is literal)
 *   - {@code \x{1F600}-\x{1F64F}} matches the emoticons block
 *
 * Supported escapes are {@code \t}, {@code \n}, {@code \r}, {@code \f},
 * {@code \a}, {@code \e}, {@code \xhh}, {@code \x{h...h}}, <code>&#92;uhhhh</code>,
 * and a backslash followed by any ASCII punctuation (which is then literal).
 * Characters outside the basic multilingual plane may also be written
 * directly.
 *
 * A range whose bounds are reversed ({@code z-a}) is not an error, but adds
 * nothing to the class.
 */
public final class CharClassParser {

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  /**
   * Parse a character class literal.
   *
   * @param input class literal
   * @return code point set described by the literal
   */
  public static Utf8Charset parse(String input) throws PatternSyntaxException {
    final var parser = new CharClassParser(input);
    return parser.parseClass();
  }

  private CharClassParser(String input) {
    this.input = input;
    this.length = input.length();
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private Utf8Charset parseClass() throws PatternSyntaxException {
    final Utf8Charset charset = Utf8Charset.empty();
    if (position < length && input.charAt(position) == '^') {
      position++;
      charset.invert(true);
    }

    while (position < length) {
      final int lo = parseCodePoint();

      // `-` only makes a range if something follows it
      if (position + 1 < length && input.charAt(position) == '-') {
        position++;
        final int hi = parseCodePoint();
        charset.addRange(lo, hi);
      } else {
        charset.addChar(lo);
      }
    }

    return charset;
  }

  /**
   * Parse one (possibly escaped) code point.
   *
   * Called on non-empty input.
   */
  private int parseCodePoint() throws PatternSyntaxException {
    final int codePoint = input.codePointAt(position);
    position += Character.charCount(codePoint);
    if (codePoint != '\\') {
      return codePoint;
    }

    if (position >= length) {
      throw error("Class literal may not end with backslash");
    }
    final char c = input.charAt(position++);
    switch (c) {
      case 't':
        return '\t';
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      case 'f':
        return '\f';

      // Bell character
      case 'a':
        return '\u0007';

      // Escape character
      case 'e':
        return '\u001B';

      // Hexadecimal escape `\xhh` or `\x{h...h}`
      case 'x':
        if (position < length && input.charAt(position) == '{') {
          position++;
          return parseBracedHex();
        }
        return parseFixedHex(2);

      // Unicode escape, four hexadecimal characters
      case 'u':
        return parseFixedHex(4);

      default:
        if (c < 128 && !Character.isLetterOrDigit(c) && !Character.isISOControl(c)) {
          return c;
        }
        position--;
        throw error("Unknown escape sequence");
    }
  }

  /**
   * Parse exactly {@code digits} hexadecimal characters.
   */
  private int parseFixedHex(int digits) throws PatternSyntaxException {
    int codePoint = 0;
    for (int i = 0; i < digits; i++) {
      codePoint = codePoint * 16 + parseHexadecimalCharacter();
    }
    return codePoint;
  }

  /**
   * Parse hexadecimal characters up to a closing {@code '}'}.
   */
  private int parseBracedHex() throws PatternSyntaxException {
    final int start = position;
    int codePoint = 0;
    while (position < length && input.charAt(position) != '}') {
      codePoint = codePoint * 16 + parseHexadecimalCharacter();
      if (codePoint > Character.MAX_CODE_POINT) {
        throw error("Hexadecimal code point is too big");
      }
    }
    if (position >= length) {
      throw error("Expected '}' to close hexadecimal escape");
    }
    if (position == start) {
      throw error("Expected at least one hexadecimal character");
    }
    position++;
    return codePoint;
  }

  /**
   * Parse a hexadecimal character from the input.
   */
  private int parseHexadecimalCharacter() throws PatternSyntaxException {
    final int h = position < length ? Character.digit(input.charAt(position), 16) : -1;
    if (h < 0) {
      throw error("Expected a hexadecimal character");
    }
    position++;
    return h;
  }
}
