package bytenfa.util;

import java.util.stream.IntStream;

/**
 * Inclusive (and therefore non-empty) range of integers.
 *
 * Unless otherwise stated, `null` values of `IntRange` get treated as
 * empty ranges.
 *
 * @param lowerBound smallest integer in the range
 * @param upperBound largest integer in the range
 */
public record IntRange(
  int lowerBound,
  int upperBound
) {

  /**
   * Make a range (equivalent to the constructor, but more informatively named).
   *
   * @param lowerBound smallest integer in the range
   * @param upperBound largest integer in the range
   */
  public static IntRange between(int lowerBound, int upperBound) {
    return new IntRange(lowerBound, upperBound);
  }

  /**
   * Make a range containing only a single integer.
   *
   * @param integer integer in the range
   */
  public static IntRange single(int integer) {
    return new IntRange(integer, integer);
  }

  /**
   * Make a range, unless the bounds are inverted.
   *
   * @param lowerBound smallest integer in the range
   * @param upperBound largest integer in the range
   * @return range or else `null` if {@code lowerBound > upperBound}
   */
  public static IntRange betweenOrNull(int lowerBound, int upperBound) {
    return lowerBound > upperBound ? null : new IntRange(lowerBound, upperBound);
  }

  public IntRange {
    if (lowerBound > upperBound) {
      throw new IllegalArgumentException(
        "Range lower bound " + lowerBound + " exceeds upper bound " + upperBound
      );
    }
  }

  @Override
  public String toString() {
    return "IntRange(" + compactString() + ")";
  }

  public String compactString() {
    return (lowerBound == upperBound) ? "" + lowerBound : "" + lowerBound + ".." + upperBound;
  }

  public IntStream stream() {
    return IntStream.rangeClosed(lowerBound, upperBound);
  }

  /**
   * Number of integers in the range.
   */
  public long size() {
    return (long) upperBound - lowerBound + 1;
  }

  /**
   * Does this range contain the integer?
   *
   * @param integer integer
   * @return whether the integer is in this range
   */
  public boolean contains(int integer) {
    return lowerBound <= integer && integer <= upperBound;
  }

  /**
   * Try to intersect this range with another range.
   *
   * @param other other range (`null` gets treated as an empty range)
   * @return intersected range, or else `null` if the ranges have no intersection
   */
  public IntRange intersect(IntRange other) {
    if (overlapsWith(other)) {
      return new IntRange(
        Math.max(lowerBound, other.lowerBound),
        Math.min(upperBound, other.upperBound)
      );
    } else {
      return null;
    }
  }

  /**
   * Does this range overlap with another range?
   *
   * @param other other range
   * @return whether the ranges overlap
   */
  public boolean overlapsWith(IntRange other) {
    return other != null && lowerBound <= other.upperBound && other.lowerBound <= upperBound;
  }
}
