package bytenfa.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;

/**
 * Uncooked tagged non-deterministic finite state automaton over bytes.
 *
 * This is a Thompson-style fragment: it has exactly one initial node and
 * exactly one accepting node, and it is grown by combining it with other
 * fragments. Transitions are either byte-consuming (labelled with a
 * {@link Charset}) or epsilon transitions carrying an opaque integer tag.
 * Tags are not interpreted here; {@link #NO_TAG} marks plain epsilon
 * transitions.
 *
 * Nodes are dense indices in {@code 0 until nodeCount()}. When two fragments
 * are combined, the indices of the operand are shifted past the receiver's
 * indices, so node spaces never collide.
 *
 * Combinators mutate the receiver and return it. Their operand is only read.
 */
public final class UTnfa implements Automata {

  /**
   * Byte-consuming transition.
   *
   * @param from source node
   * @param to target node
   * @param charset bytes accepted by the transition
   */
  public record ByteEdge(int from, int to, Charset charset) {

    ByteEdge shifted(int offset) {
      return new ByteEdge(from + offset, to + offset, charset);
    }
  }

  /**
   * Transition consuming no input.
   *
   * @param from source node
   * @param to target node
   * @param tag marker emitted when following the transition
   */
  public record EpsilonEdge(int from, int to, int tag) {

    EpsilonEdge shifted(int offset) {
      return new EpsilonEdge(from + offset, to + offset, tag);
    }
  }

  private int nodeCount;
  private int begin;
  private int end;
  private final ArrayList<ByteEdge> byteEdges;
  private final ArrayList<EpsilonEdge> epsilonEdges;

  private UTnfa(
    int nodeCount,
    int begin,
    int end,
    ArrayList<ByteEdge> byteEdges,
    ArrayList<EpsilonEdge> epsilonEdges
  ) {
    this.nodeCount = nodeCount;
    this.begin = begin;
    this.end = end;
    this.byteEdges = byteEdges;
    this.epsilonEdges = epsilonEdges;
  }

  /**
   * Fragment matching only the empty input.
   */
  public static UTnfa empty() {
    return new UTnfa(1, 0, 0, new ArrayList<>(), new ArrayList<>());
  }

  /**
   * Fragment matching any single byte in the set.
   *
   * @param charset accepted bytes (if empty, the fragment accepts nothing)
   */
  public static UTnfa charset(Charset charset) {
    final var byteEdges = new ArrayList<ByteEdge>();
    byteEdges.add(new ByteEdge(0, 1, charset));
    return new UTnfa(2, 0, 1, byteEdges, new ArrayList<>());
  }

  /**
   * Fragment matching the empty input while emitting a tag.
   *
   * @param tag opaque marker
   */
  public static UTnfa tag(int tag) {
    final var epsilonEdges = new ArrayList<EpsilonEdge>();
    epsilonEdges.add(new EpsilonEdge(0, 1, tag));
    return new UTnfa(2, 0, 1, new ArrayList<>(), epsilonEdges);
  }

  /**
   * Fragment matching exactly the given byte sequence.
   *
   * @param bytes bytes to match, in order
   */
  public static UTnfa literal(byte[] bytes) {
    if (bytes.length == 0) {
      return empty();
    }
    final UTnfa output = charset(Charset.ofByte(bytes[0] & 0xFF));
    for (int i = 1; i < bytes.length; i++) {
      output.concat(charset(Charset.ofByte(bytes[i] & 0xFF)));
    }
    return output;
  }

  /**
   * Deep copy of this fragment.
   */
  public UTnfa copy() {
    return new UTnfa(
      nodeCount,
      begin,
      end,
      new ArrayList<>(byteEdges),
      new ArrayList<>(epsilonEdges)
    );
  }

  /**
   * Match this fragment followed immediately by another.
   *
   * @param other fragment to match afterwards
   * @return this fragment
   */
  public UTnfa concat(UTnfa other) {
    final int otherBegin = other.begin;
    final int otherEnd = other.end;
    final int offset = merge(other);
    epsilonEdges.add(new EpsilonEdge(end, otherBegin + offset, NO_TAG));
    end = otherEnd + offset;
    assert invariantsHold();
    return this;
  }

  /**
   * Match either this fragment or another.
   *
   * @param other alternative fragment
   * @return this fragment
   */
  public UTnfa union(UTnfa other) {
    final int otherBegin = other.begin;
    final int otherEnd = other.end;
    final int offset = merge(other);
    prependNode();
    epsilonEdges.add(new EpsilonEdge(begin, otherBegin + offset, NO_TAG));
    appendNode();
    epsilonEdges.add(new EpsilonEdge(otherEnd + offset, end, NO_TAG));
    assert invariantsHold();
    return this;
  }

  /**
   * Match zero or more repetitions of this fragment.
   *
   * @return this fragment
   */
  public UTnfa kleene() {
    prependNode();
    appendNode();
    epsilonEdges.add(new EpsilonEdge(end, begin, NO_TAG));
    end = begin;
    assert invariantsHold();
    return this;
  }

  /**
   * Match this fragment or the empty input.
   *
   * @return this fragment
   */
  public UTnfa optional() {
    return union(empty());
  }

  /**
   * Copy the nodes and edges of another fragment into this one.
   *
   * The copied indices are all shifted by the node count of this fragment
   * before they are added. The begin and end of this fragment are unchanged.
   *
   * @param other fragment to copy in (not modified)
   * @return offset to apply to the indices of {@code other}
   */
  private int merge(UTnfa other) {
    if (other == this) {
      other = other.copy();
    }
    final int offset = nodeCount;
    for (ByteEdge edge : other.byteEdges) {
      byteEdges.add(edge.shifted(offset));
    }
    for (EpsilonEdge edge : other.epsilonEdges) {
      epsilonEdges.add(edge.shifted(offset));
    }
    nodeCount += other.nodeCount;
    return offset;
  }

  /**
   * Add a fresh node leading into the current begin and make it the begin.
   */
  private void prependNode() {
    epsilonEdges.add(new EpsilonEdge(nodeCount, begin, NO_TAG));
    begin = nodeCount++;
  }

  /**
   * Add a fresh node following the current end and make it the end.
   */
  private void appendNode() {
    epsilonEdges.add(new EpsilonEdge(end, nodeCount, NO_TAG));
    end = nodeCount++;
  }

  private boolean invariantsHold() {
    if (begin < 0 || begin >= nodeCount || end < 0 || end >= nodeCount) {
      throw new IllegalStateException("begin " + begin + " or end " + end + " out of " + nodeCount + " nodes");
    }
    for (ByteEdge edge : byteEdges) {
      if (edge.from() < 0 || edge.from() >= nodeCount || edge.to() < 0 || edge.to() >= nodeCount) {
        throw new IllegalStateException("dangling " + edge + " in " + nodeCount + " nodes");
      }
    }
    for (EpsilonEdge edge : epsilonEdges) {
      if (edge.from() < 0 || edge.from() >= nodeCount || edge.to() < 0 || edge.to() >= nodeCount) {
        throw new IllegalStateException("dangling " + edge + " in " + nodeCount + " nodes");
      }
    }
    return true;
  }

  @Override
  public int begin() {
    return begin;
  }

  /**
   * Index of the only accepting node.
   */
  public int end() {
    return end;
  }

  @Override
  public int nodeCount() {
    return nodeCount;
  }

  @Override
  public boolean isFinal(int node) {
    return node == end;
  }

  public List<ByteEdge> byteEdges() {
    return Collections.unmodifiableList(byteEdges);
  }

  public List<EpsilonEdge> epsilonEdges() {
    return Collections.unmodifiableList(epsilonEdges);
  }

  @Override
  public Stream<Transition> transitions() {
    final Stream<Transition> consuming = byteEdges
      .stream()
      .flatMap(edge -> edge
        .charset()
        .stream()
        .mapToObj(b -> new Transition(edge.from(), edge.to(), OptionalInt.of(b), NO_TAG))
      );
    final Stream<Transition> epsilon = epsilonEdges
      .stream()
      .map(edge -> Transition.epsilon(edge.from(), edge.to(), edge.tag()));
    return Stream.concat(consuming, epsilon);
  }

  @Override
  public Stream<DotGraph.Edge> dotEdges() {
    final Stream<DotGraph.Edge> consuming = byteEdges
      .stream()
      .map(edge -> new DotGraph.Edge(edge.from(), edge.to(), edge.charset().dotLabel()));
    final Stream<DotGraph.Edge> epsilon = epsilonEdges
      .stream()
      .map(edge -> new DotGraph.Edge(
        edge.from(),
        edge.to(),
        edge.tag() == NO_TAG ? "&epsilon;" : "&epsilon; / " + edge.tag()
      ));
    return Stream.concat(consuming, epsilon);
  }

  @Override
  public String toString() {
    return "UTnfa[nodes=" + nodeCount + ", begin=" + begin + ", end=" + end
      + ", byteEdges=" + byteEdges + ", epsilonEdges=" + epsilonEdges + "]";
  }
}
