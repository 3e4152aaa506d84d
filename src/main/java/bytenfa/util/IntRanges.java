package bytenfa.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations over plain lists of ranges.
 *
 * Unlike a canonical range set, the lists here are allowed to be unsorted,
 * overlapping, or contiguous. Operations preserve the relative order of the
 * ranges they are given.
 */
public final class IntRanges {

  private IntRanges() { }

  /**
   * Remove integers from a list of candidate ranges.
   *
   * Each subtracted range is applied in turn against the current candidates:
   * a candidate it does not touch is kept as is, and a candidate it overlaps
   * is replaced by the (zero, one, or two) pieces left on either side of the
   * overlap. The subtracted ranges may come in any order and may overlap each
   * other.
   *
   * If the candidates are sorted and disjoint, so is the output.
   *
   * @param candidates ranges to subtract from
   * @param subtracted ranges to remove
   * @return remaining ranges, in the order of the candidates they came from
   */
  public static List<IntRange> subtract(List<IntRange> candidates, List<IntRange> subtracted) {
    List<IntRange> current = new ArrayList<>(candidates);
    List<IntRange> next = new ArrayList<>(candidates.size() + 1);

    for (IntRange removed : subtracted) {
      next.clear();
      for (IntRange candidate : current) {
        final IntRange overlap = candidate.intersect(removed);
        if (overlap == null) {
          next.add(candidate);
          continue;
        }
        if (candidate.lowerBound() < overlap.lowerBound()) {
          next.add(IntRange.between(candidate.lowerBound(), overlap.lowerBound() - 1));
        }
        if (overlap.upperBound() < candidate.upperBound()) {
          next.add(IntRange.between(overlap.upperBound() + 1, candidate.upperBound()));
        }
      }

      // Swap buffers
      final List<IntRange> swap = current;
      current = next;
      next = swap;
    }

    return List.copyOf(current);
  }
}
