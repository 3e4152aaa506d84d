package bytenfa.graph;

import static org.assertj.core.api.Assertions.assertThat;

import bytenfa.graph.Automata.Transition;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UTnfaTest {

  private static byte[] bytes(String ascii) {
    return ascii.getBytes(StandardCharsets.ISO_8859_1);
  }

  private static UTnfa ch(char c) {
    return UTnfa.charset(Charset.ofByte(c));
  }

  /**
   * Check that every edge endpoint is a node of the fragment.
   */
  private static void assertWellFormed(UTnfa nfa) {
    assertThat(nfa.begin()).isBetween(0, nfa.nodeCount() - 1);
    assertThat(nfa.end()).isBetween(0, nfa.nodeCount() - 1);
    nfa.transitions().forEach(t -> {
      assertThat(t.from()).isBetween(0, nfa.nodeCount() - 1);
      assertThat(t.to()).isBetween(0, nfa.nodeCount() - 1);
    });
  }

  @Test
  void emptyHasOneFinalNode() {
    final UTnfa empty = UTnfa.empty();
    assertThat(empty.nodeCount()).isEqualTo(1);
    assertThat(empty.begin()).isEqualTo(empty.end());
    assertThat(empty.isFinal(empty.begin())).isTrue();
    assertThat(empty.transitions()).isEmpty();
    assertThat(empty.accepts(new byte[0])).isTrue();
    assertThat(empty.accepts(bytes("a"))).isFalse();
  }

  @Test
  void charsetAcceptsExactlyItsBytes() {
    final Charset charset = Charset.range('a', 'f').union(Charset.of(0x00, 0x80, 0xFF));
    final UTnfa nfa = UTnfa.charset(charset);
    for (int b = 0; b < 256; b++) {
      assertThat(nfa.accepts(new byte[] { (byte) b })).as("byte %d", b).isEqualTo(charset.contains(b));
    }
    assertThat(nfa.accepts(new byte[0])).isFalse();
    assertThat(nfa.accepts(bytes("aa"))).isFalse();
  }

  @Test
  void charsetListsOneTransitionPerByte() {
    final UTnfa nfa = UTnfa.charset(Charset.range('x', 'z'));
    assertThat(nfa.transitions()).containsExactlyInAnyOrder(
      Transition.ofByte(0, 1, 'x'),
      Transition.ofByte(0, 1, 'y'),
      Transition.ofByte(0, 1, 'z')
    );
  }

  @Test
  void tagIsEpsilonWithMarker() {
    final UTnfa nfa = UTnfa.tag(7);
    assertThat(nfa.epsilonEdges()).containsExactly(new UTnfa.EpsilonEdge(0, 1, 7));
    assertThat(nfa.byteEdges()).isEmpty();
    assertThat(nfa.accepts(new byte[0])).isTrue();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
  }

  @Test
  @DisplayName("concat shifts the operand and links end to begin")
  void concatStructure() {
    final UTnfa nfa = ch('a').concat(ch('b'));
    assertWellFormed(nfa);
    assertThat(nfa.nodeCount()).isEqualTo(4);
    assertThat(nfa.begin()).isEqualTo(0);
    assertThat(nfa.end()).isEqualTo(3);
    assertThat(nfa.byteEdges()).containsExactly(
      new UTnfa.ByteEdge(0, 1, Charset.ofByte('a')),
      new UTnfa.ByteEdge(2, 3, Charset.ofByte('b'))
    );
    assertThat(nfa.epsilonEdges()).containsExactly(new UTnfa.EpsilonEdge(1, 2, UTnfa.NO_TAG));
  }

  @Test
  void concatAcceptsSequences() {
    final UTnfa ab = ch('a').union(ch('b'));
    final UTnfa cd = ch('c').concat(ch('d'));
    final UTnfa nfa = ab.concat(cd);
    assertWellFormed(nfa);

    assertThat(nfa.accepts(bytes("acd"))).isTrue();
    assertThat(nfa.accepts(bytes("bcd"))).isTrue();
    assertThat(nfa.accepts(bytes("ab"))).isFalse();
    assertThat(nfa.accepts(bytes("cd"))).isFalse();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
    assertThat(nfa.accepts(bytes("acdd"))).isFalse();
  }

  @Test
  void combinatorsLeaveOperandUntouched() {
    final UTnfa operand = ch('b').concat(UTnfa.tag(3));
    final UTnfa before = operand.copy();

    ch('a').concat(operand);
    ch('a').union(operand);

    assertThat(operand.nodeCount()).isEqualTo(before.nodeCount());
    assertThat(operand.begin()).isEqualTo(before.begin());
    assertThat(operand.end()).isEqualTo(before.end());
    assertThat(operand.byteEdges()).isEqualTo(before.byteEdges());
    assertThat(operand.epsilonEdges()).isEqualTo(before.epsilonEdges());
  }

  @Test
  void tagsPassThroughMerges() {
    final UTnfa nfa = UTnfa.tag(0).concat(ch('x')).concat(UTnfa.tag(1));
    assertWellFormed(nfa);
    assertThat(nfa.epsilonEdges())
      .extracting(UTnfa.EpsilonEdge::tag)
      .containsExactlyInAnyOrder(0, 1, UTnfa.NO_TAG, UTnfa.NO_TAG);
    assertThat(nfa.accepts(bytes("x"))).isTrue();
  }

  @Test
  @DisplayName("union adds a fresh begin and a fresh end")
  void unionStructure() {
    final UTnfa nfa = ch('a').union(ch('b'));
    assertWellFormed(nfa);

    final var expected = new SimpleAutomata(
      6,
      0,
      Set.of(5),
      List.of(
        Transition.epsilon(0, 1),
        Transition.epsilon(0, 3),
        Transition.ofByte(1, 2, 'a'),
        Transition.ofByte(3, 4, 'b'),
        Transition.epsilon(2, 5),
        Transition.epsilon(4, 5)
      )
    );
    assertThat(nfa.isEquivalentTo(expected)).isTrue();
  }

  @Test
  void unionAcceptsEither() {
    final UTnfa nfa = ch('a').concat(ch('b')).union(ch('c'));
    assertThat(nfa.accepts(bytes("ab"))).isTrue();
    assertThat(nfa.accepts(bytes("c"))).isTrue();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
    assertThat(nfa.accepts(bytes("abc"))).isFalse();
    assertThat(nfa.accepts(new byte[0])).isFalse();
  }

  @Test
  void unionWithItself() {
    final UTnfa nfa = ch('a');
    nfa.union(nfa);
    assertWellFormed(nfa);
    assertThat(nfa.nodeCount()).isEqualTo(6);
    assertThat(nfa.accepts(bytes("a"))).isTrue();
    assertThat(nfa.accepts(bytes("aa"))).isFalse();
  }

  @Test
  void concatWithItself() {
    final UTnfa nfa = ch('a');
    nfa.concat(nfa);
    assertWellFormed(nfa);
    assertThat(nfa.accepts(bytes("aa"))).isTrue();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
  }

  @Test
  @DisplayName("kleene wraps the fragment and collapses end onto begin")
  void kleeneStructure() {
    final UTnfa nfa = ch('a').kleene();
    assertWellFormed(nfa);
    assertThat(nfa.nodeCount()).isEqualTo(4);
    assertThat(nfa.end()).isEqualTo(nfa.begin());

    final var expected = new SimpleAutomata(
      4,
      2,
      Set.of(2),
      List.of(
        Transition.ofByte(0, 1, 'a'),
        Transition.epsilon(2, 0),
        Transition.epsilon(1, 3),
        Transition.epsilon(3, 2)
      )
    );
    assertThat(nfa.isEquivalentTo(expected)).isTrue();
  }

  @Test
  void kleeneAcceptsRepetitions() {
    final UTnfa nfa = ch('a').concat(ch('b')).kleene();
    assertThat(nfa.accepts(new byte[0])).isTrue();
    assertThat(nfa.accepts(bytes("ab"))).isTrue();
    assertThat(nfa.accepts(bytes("ababab"))).isTrue();
    assertThat(nfa.accepts(bytes("aba"))).isFalse();
    assertThat(nfa.accepts(bytes("ba"))).isFalse();
  }

  @Test
  void kleeneOfEmptyAcceptsOnlyEmpty() {
    final UTnfa nfa = UTnfa.empty().kleene();
    assertThat(nfa.accepts(new byte[0])).isTrue();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
  }

  @Test
  void optionalAcceptsFragmentOrEmpty() {
    final UTnfa nfa = ch('a').concat(ch('b')).optional();
    assertWellFormed(nfa);
    assertThat(nfa.accepts(new byte[0])).isTrue();
    assertThat(nfa.accepts(bytes("ab"))).isTrue();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
    assertThat(nfa.accepts(bytes("abab"))).isFalse();
  }

  @Test
  void optionalIsUnionWithEmpty() {
    final UTnfa optional = ch('a').optional();
    final UTnfa union = ch('a').union(UTnfa.empty());
    assertThat(optional.isEquivalentTo(union)).isTrue();
  }

  @Test
  void nestedConstruction() {
    // (a|b)*c?
    final UTnfa nfa = ch('a').union(ch('b')).kleene().concat(ch('c').optional());
    assertWellFormed(nfa);
    assertThat(nfa.accepts(new byte[0])).isTrue();
    assertThat(nfa.accepts(bytes("abba"))).isTrue();
    assertThat(nfa.accepts(bytes("abbac"))).isTrue();
    assertThat(nfa.accepts(bytes("c"))).isTrue();
    assertThat(nfa.accepts(bytes("cc"))).isFalse();
    assertThat(nfa.accepts(bytes("ca"))).isFalse();
  }

  @Test
  void literalMatchesExactBytes() {
    final UTnfa nfa = UTnfa.literal(bytes("let"));
    assertThat(nfa.accepts(bytes("let"))).isTrue();
    assertThat(nfa.accepts(bytes("le"))).isFalse();
    assertThat(nfa.accepts(bytes("lets"))).isFalse();
    assertThat(UTnfa.literal(new byte[0]).isEquivalentTo(UTnfa.empty())).isTrue();
  }

  @Test
  void emptyCharsetAcceptsNothing() {
    final UTnfa nfa = UTnfa.charset(Charset.empty());
    assertThat(nfa.accepts(new byte[0])).isFalse();
    assertThat(nfa.accepts(bytes("a"))).isFalse();
    assertThat(nfa.transitions()).isEmpty();
  }

  @Test
  void copyIsIndependent() {
    final UTnfa original = ch('a');
    final UTnfa copy = original.copy();
    copy.concat(ch('b'));
    assertThat(original.nodeCount()).isEqualTo(2);
    assertThat(copy.nodeCount()).isEqualTo(4);
  }
}
