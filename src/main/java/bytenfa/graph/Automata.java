package bytenfa.graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Stack;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Read-only view of an automaton over bytes.
 *
 * This is the surface exposed to anything that needs to inspect automata
 * without depending on how they were built: a determinizer, a visualizer, or
 * tests comparing automata produced by different code paths.
 *
 * Nodes are dense indices in {@code 0 until nodeCount()}.
 */
public interface Automata extends DotGraph {

  /**
   * Tag carried by transitions that have no tag.
   */
  int NO_TAG = -1;

  /**
   * Transition between two nodes.
   *
   * @param from source node
   * @param to target node
   * @param codeUnit byte consumed, or empty for an epsilon transition
   * @param tag marker carried by an epsilon transition ({@link #NO_TAG} otherwise)
   */
  record Transition(int from, int to, OptionalInt codeUnit, int tag) {

    public static Transition ofByte(int from, int to, int codeUnit) {
      return new Transition(from, to, OptionalInt.of(codeUnit), NO_TAG);
    }

    public static Transition epsilon(int from, int to) {
      return new Transition(from, to, OptionalInt.empty(), NO_TAG);
    }

    public static Transition epsilon(int from, int to, int tag) {
      return new Transition(from, to, OptionalInt.empty(), tag);
    }

    public boolean isEpsilon() {
      return codeUnit.isEmpty();
    }

    /**
     * Same transition with both endpoints relabelled.
     *
     * @param relabel new index for each node
     */
    public Transition relabelled(int[] relabel) {
      return new Transition(relabel[from], relabel[to], codeUnit, tag);
    }
  }

  /**
   * Index of the initial node.
   */
  int begin();

  /**
   * Number of nodes.
   */
  int nodeCount();

  /**
   * Is the node accepting?
   *
   * @param node node index
   */
  boolean isFinal(int node);

  /**
   * All transitions, epsilon and byte-consuming.
   *
   * A byte-consuming transition over several bytes is listed once per byte.
   */
  Stream<Transition> transitions();

  /**
   * Check if the two automata have the same structure up to node numbering.
   *
   * This is a brute-force search meant for test-sized automata.
   *
   * @see AutomataEquivalence#equivalent(Automata, Automata)
   * @param other automaton to compare to
   * @return whether there is a node bijection matching every transition
   */
  default boolean isEquivalentTo(Automata other) {
    return AutomataEquivalence.equivalent(this, other);
  }

  /**
   * Does the automaton accept the full input?
   *
   * @param input bytes to feed through the automaton
   */
  default boolean accepts(byte[] input) {
    return accepts(input, false);
  }

  /**
   * Does the automaton accept the full input?
   *
   * Runs a plain subset simulation: tags are ignored and the run succeeds if
   * any final node is reachable once all of the input has been consumed.
   *
   * @param input bytes to feed through the automaton
   * @param printDebugInfo print to STDERR a trace of what is happening
   */
  default boolean accepts(byte[] input, boolean printDebugInfo) {
    final var outgoing = IntStream
      .range(0, nodeCount())
      .<List<Transition>>mapToObj(i -> new ArrayList<Transition>())
      .collect(Collectors.toList());
    transitions().forEach(t -> outgoing.get(t.from()).add(t));

    BitSet current = new BitSet(nodeCount());
    current.set(begin());
    epsilonClose(current, outgoing);

    if (printDebugInfo) {
      System.err.println("[Automata] starting run on " + input.length + " bytes at " + current);
    }

    for (byte b : input) {
      final int codeUnit = b & 0xFF;
      final var next = new BitSet(nodeCount());
      for (int node = current.nextSetBit(0); node >= 0; node = current.nextSetBit(node + 1)) {
        for (Transition t : outgoing.get(node)) {
          if (t.codeUnit().isPresent() && t.codeUnit().getAsInt() == codeUnit) {
            next.set(t.to());
          }
        }
      }
      epsilonClose(next, outgoing);
      current = next;

      if (printDebugInfo) {
        System.err.println(String.format("[Automata] after 0x%02X: %s", codeUnit, current));
      }
      if (current.isEmpty()) {
        return false;
      }
    }

    for (int node = current.nextSetBit(0); node >= 0; node = current.nextSetBit(node + 1)) {
      if (isFinal(node)) {
        if (printDebugInfo) {
          System.err.println("[Automata] accepting at " + node);
        }
        return true;
      }
    }
    return false;
  }

  /**
   * Add to a set of nodes all nodes reachable from it via epsilon transitions.
   */
  private static void epsilonClose(BitSet nodes, List<List<Transition>> outgoing) {
    final var toVisit = new Stack<Integer>();
    nodes.stream().forEach(toVisit::push);
    while (!toVisit.isEmpty()) {
      for (Transition t : outgoing.get(toVisit.pop())) {
        if (t.isEpsilon() && !nodes.get(t.to())) {
          nodes.set(t.to());
          toVisit.push(t.to());
        }
      }
    }
  }

  @Override
  default int initialVertex() {
    return begin();
  }

  @Override
  default Stream<DotGraph.Vertex> vertices() {
    return IntStream
      .range(0, nodeCount())
      .mapToObj(id -> new DotGraph.Vertex(id, isFinal(id)));
  }

  /**
   * Byte transitions between the same pair of nodes are merged into one edge
   * labelled by their {@link Charset}.
   */
  @Override
  default Stream<DotGraph.Edge> dotEdges() {
    record Endpoints(int from, int to) { }

    final var edges = new ArrayList<DotGraph.Edge>();
    final Map<Endpoints, Charset> byteEdges = new LinkedHashMap<>();
    transitions().forEach(t -> {
      if (t.isEpsilon()) {
        final String label = t.tag() == NO_TAG ? "&epsilon;" : "&epsilon; / " + t.tag();
        edges.add(new DotGraph.Edge(t.from(), t.to(), label));
      } else {
        byteEdges.merge(
          new Endpoints(t.from(), t.to()),
          Charset.ofByte(t.codeUnit().getAsInt()),
          Charset::union
        );
      }
    });
    byteEdges.forEach((endpoints, charset) ->
      edges.add(new DotGraph.Edge(endpoints.from(), endpoints.to(), charset.dotLabel()))
    );
    return edges.stream();
  }
}
