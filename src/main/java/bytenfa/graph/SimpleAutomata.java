package bytenfa.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Automaton spelled out as plain data.
 *
 * Used to write down expected automata directly, without going through the
 * combinators on {@link UTnfa}. Unlike {@code UTnfa}, there may be any number
 * of final nodes.
 */
public final class SimpleAutomata implements Automata {

  private final int nodeCount;
  private final int begin;
  private final Set<Integer> finals;
  private final List<Transition> transitions;

  /**
   * @param nodeCount number of nodes
   * @param begin initial node
   * @param finals accepting nodes
   * @param transitions all transitions
   * @throws IllegalArgumentException if there are no nodes, if any node index
   *   is out of range, or if a transition consumes something other than a byte
   */
  public SimpleAutomata(
    int nodeCount,
    int begin,
    Set<Integer> finals,
    List<Transition> transitions
  ) {
    if (nodeCount < 1) {
      throw new IllegalArgumentException("An automaton needs at least its begin node, got " + nodeCount + " nodes");
    }
    if (begin < 0 || begin >= nodeCount) {
      throw new IllegalArgumentException("Begin node " + begin + " out of " + nodeCount + " nodes");
    }
    for (int node : finals) {
      if (node < 0 || node >= nodeCount) {
        throw new IllegalArgumentException("Final node " + node + " out of " + nodeCount + " nodes");
      }
    }
    for (Transition transition : transitions) {
      if (transition.from() < 0 || transition.from() >= nodeCount
          || transition.to() < 0 || transition.to() >= nodeCount) {
        throw new IllegalArgumentException("Transition " + transition + " out of " + nodeCount + " nodes");
      }
      if (transition.codeUnit().isPresent()
          && (transition.codeUnit().getAsInt() < 0 || transition.codeUnit().getAsInt() > 0xFF)) {
        throw new IllegalArgumentException("Transition " + transition + " consumes a non-byte code unit");
      }
    }

    this.nodeCount = nodeCount;
    this.begin = begin;
    this.finals = Set.copyOf(finals);
    this.transitions = List.copyOf(transitions);
  }

  /**
   * Same automaton, with an extra accepting node.
   *
   * @param node node to mark as accepting
   */
  public SimpleAutomata withFinal(int node) {
    final var newFinals = new HashSet<>(finals);
    newFinals.add(node);
    return new SimpleAutomata(nodeCount, begin, newFinals, transitions);
  }

  /**
   * Same automaton, with an extra transition.
   *
   * @param transition transition to add
   */
  public SimpleAutomata withTransition(Transition transition) {
    final var newTransitions = new ArrayList<>(transitions);
    newTransitions.add(transition);
    return new SimpleAutomata(nodeCount, begin, finals, newTransitions);
  }

  /**
   * Same automaton, with one transition replaced.
   *
   * @param index position of the transition in {@link #transitionList}
   * @param transition replacement
   */
  public SimpleAutomata withTransition(int index, Transition transition) {
    final var newTransitions = new ArrayList<>(transitions);
    newTransitions.set(index, transition);
    return new SimpleAutomata(nodeCount, begin, finals, newTransitions);
  }

  @Override
  public int begin() {
    return begin;
  }

  @Override
  public int nodeCount() {
    return nodeCount;
  }

  @Override
  public boolean isFinal(int node) {
    return finals.contains(node);
  }

  public Set<Integer> finals() {
    return finals;
  }

  public List<Transition> transitionList() {
    return transitions;
  }

  @Override
  public Stream<Transition> transitions() {
    return transitions.stream();
  }

  @Override
  public String toString() {
    return "SimpleAutomata[nodes=" + nodeCount + ", begin=" + begin + ", finals=" + finals
      + ", transitions=" + transitions + "]";
  }
}
