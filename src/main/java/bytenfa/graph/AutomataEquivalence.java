package bytenfa.graph;

import bytenfa.graph.Automata.Transition;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structural equivalence of automata, up to node numbering.
 *
 * Two automata are equivalent if some bijection between their nodes maps
 * begin to begin, preserves finality, and maps the transitions of one
 * automaton exactly onto the transitions of the other (counting duplicates).
 *
 * The search tries node bijections one node at a time and backtracks, so the
 * worst case is factorial in the node count. It is meant for comparing small
 * automata in tests and refuses anything larger than {@link #MAX_NODES}.
 */
public final class AutomataEquivalence {

  private AutomataEquivalence() { }

  /**
   * Largest node count accepted by {@link #equivalent(Automata, Automata)}.
   */
  public static final int MAX_NODES = 32;

  /**
   * Check if two automata have the same structure up to node numbering.
   *
   * @param left first automaton
   * @param right second automaton
   * @return whether a node bijection relates the two automata
   * @throws IllegalArgumentException if the automata have more than {@link #MAX_NODES} nodes
   */
  public static boolean equivalent(Automata left, Automata right) {
    return equivalent(left, right, MAX_NODES);
  }

  /**
   * Check if two automata have the same structure up to node numbering.
   *
   * @param left first automaton
   * @param right second automaton
   * @param maxNodes largest node count to attempt a search on
   * @return whether a node bijection relates the two automata
   * @throws IllegalArgumentException if the automata have more than {@code maxNodes} nodes
   */
  public static boolean equivalent(Automata left, Automata right, int maxNodes) {
    final int nodes = left.nodeCount();
    if (nodes != right.nodeCount()) {
      return false;
    }
    if (nodes > maxNodes) {
      throw new IllegalArgumentException(
        "Equivalence search is limited to " + maxNodes + " nodes, got " + nodes
      );
    }

    final Map<Transition, Long> leftTransitions = multiset(left);
    final Map<Transition, Long> rightTransitions = multiset(right);
    if (size(leftTransitions) != size(rightTransitions)
        || leftTransitions.size() != rightTransitions.size()) {
      return false;
    }
    if (nodes == 0) {
      return leftTransitions.equals(rightTransitions);
    }

    final var search = new Search(left, right, leftTransitions, rightTransitions);
    return search.run();
  }

  private static Map<Transition, Long> multiset(Automata automata) {
    return automata
      .transitions()
      .collect(Collectors.groupingBy(t -> t, HashMap::new, Collectors.counting()));
  }

  private static long size(Map<Transition, Long> multiset) {
    return multiset.values().stream().mapToLong(Long::longValue).sum();
  }

  /**
   * Backtracking search over partial node bijections.
   *
   * Left nodes are assigned in breadth-first order from the begin node (which
   * has only one possible image), so that most nodes are adjacent to one that
   * is already assigned. A candidate image is skipped if it disagrees on
   * finality or on in and out degree, or if some transition between assigned
   * nodes has no image with the same multiplicity.
   */
  private static final class Search {

    private final Automata left;
    private final Automata right;
    private final Map<Transition, Long> leftTransitions;
    private final Map<Transition, Long> rightTransitions;

    private final int[] leftOut;
    private final int[] leftIn;
    private final int[] rightOut;
    private final int[] rightIn;

    // Distinct left transitions touching each left node
    private final List<List<Transition>> incident;

    // Order in which the left nodes get assigned
    private final int[] order;

    // `mapping[l]` is the right node assigned to left node `l`
    private final int[] mapping;
    private final boolean[] assigned;
    private final boolean[] used;

    Search(
      Automata left,
      Automata right,
      Map<Transition, Long> leftTransitions,
      Map<Transition, Long> rightTransitions
    ) {
      this.left = left;
      this.right = right;
      this.leftTransitions = leftTransitions;
      this.rightTransitions = rightTransitions;

      final int nodes = left.nodeCount();
      leftOut = new int[nodes];
      leftIn = new int[nodes];
      rightOut = new int[nodes];
      rightIn = new int[nodes];
      degrees(leftTransitions, leftOut, leftIn);
      degrees(rightTransitions, rightOut, rightIn);

      incident = new ArrayList<>(nodes);
      for (int node = 0; node < nodes; node++) {
        incident.add(new ArrayList<>());
      }
      for (Transition transition : leftTransitions.keySet()) {
        incident.get(transition.from()).add(transition);
        if (transition.to() != transition.from()) {
          incident.get(transition.to()).add(transition);
        }
      }

      order = breadthFirstOrder(left.begin(), nodes);
      mapping = new int[nodes];
      assigned = new boolean[nodes];
      used = new boolean[nodes];
    }

    private static void degrees(Map<Transition, Long> transitions, int[] out, int[] in) {
      transitions.forEach((transition, count) -> {
        out[transition.from()] += count;
        in[transition.to()] += count;
      });
    }

    /**
     * Nodes reachable from {@code start} (ignoring direction) in breadth-first
     * order, followed by the unreachable nodes in index order.
     */
    private int[] breadthFirstOrder(int start, int nodes) {
      final int[] output = new int[nodes];
      final boolean[] seen = new boolean[nodes];
      final var queue = new ArrayDeque<Integer>();
      queue.add(start);
      seen[start] = true;

      int next = 0;
      while (!queue.isEmpty()) {
        final int node = queue.remove();
        output[next++] = node;
        for (Transition transition : incident.get(node)) {
          final int neighbour = transition.from() == node ? transition.to() : transition.from();
          if (!seen[neighbour]) {
            seen[neighbour] = true;
            queue.add(neighbour);
          }
        }
      }
      for (int node = 0; node < nodes; node++) {
        if (!seen[node]) {
          output[next++] = node;
        }
      }
      return output;
    }

    boolean run() {
      return assign(0);
    }

    private boolean assign(int position) {
      if (position == order.length) {
        return true;
      }

      final int leftNode = order[position];
      for (int rightNode = 0; rightNode < mapping.length; rightNode++) {
        if (used[rightNode]) {
          continue;
        }
        if (position == 0 && rightNode != right.begin()) {
          continue;
        }
        if (left.isFinal(leftNode) != right.isFinal(rightNode)) {
          continue;
        }
        if (leftOut[leftNode] != rightOut[rightNode] || leftIn[leftNode] != rightIn[rightNode]) {
          continue;
        }

        used[rightNode] = true;
        assigned[leftNode] = true;
        mapping[leftNode] = rightNode;
        if (incidentTransitionsMatch(leftNode) && assign(position + 1)) {
          return true;
        }
        assigned[leftNode] = false;
        used[rightNode] = false;
      }
      return false;
    }

    /**
     * Check the transitions between the freshly assigned node and the nodes
     * assigned before it.
     *
     * Once every node is assigned, each distinct left transition has been
     * checked once. Since both multisets have the same size, the image of the
     * left multiset is then exactly the right multiset.
     */
    private boolean incidentTransitionsMatch(int leftNode) {
      for (Transition transition : incident.get(leftNode)) {
        if (!assigned[transition.from()] || !assigned[transition.to()]) {
          continue;
        }
        final Transition image = transition.relabelled(mapping);
        final Long expected = leftTransitions.get(transition);
        if (!expected.equals(rightTransitions.get(image))) {
          return false;
        }
      }
      return true;
    }
  }
}
