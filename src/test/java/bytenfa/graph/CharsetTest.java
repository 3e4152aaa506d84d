package bytenfa.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import bytenfa.util.IntRange;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class CharsetTest {

  @Test
  void emptyContainsNothing() {
    final Charset empty = Charset.empty();
    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.cardinality()).isZero();
    assertThat(empty.stream().toArray()).isEmpty();
    assertThat(IntStream.range(0, 256).noneMatch(empty::contains)).isTrue();
  }

  @Test
  void singleByte() {
    final Charset a = Charset.ofByte('a');
    assertThat(a.contains('a')).isTrue();
    assertThat(a.contains('b')).isFalse();
    assertThat(a.cardinality()).isEqualTo(1);
    assertThat(Charset.ofByte(0xFF).contains(0xFF)).isTrue();
    assertThat(Charset.ofByte(0).contains(0)).isTrue();
  }

  @Test
  void digitRangeIteratesInOrder() {
    final var bytes = new ArrayList<Byte>();
    for (int b : Charset.range('1', '9')) {
      bytes.add((byte) b);
    }
    final byte[] expected = "123456789".getBytes(StandardCharsets.US_ASCII);
    assertThat(bytes).hasSize(expected.length);
    for (int i = 0; i < expected.length; i++) {
      assertThat(bytes.get(i)).isEqualTo(expected[i]);
    }
  }

  @Test
  void fullRangeIteratesEveryByte() {
    assertThat(Charset.range(0, 255).stream().toArray())
      .isEqualTo(IntStream.rangeClosed(0, 255).toArray());
    assertThat(Charset.range(0, 255)).isEqualTo(Charset.FULL);
  }

  @Test
  void invertedRangeIsEmpty() {
    assertThat(Charset.range('z', 'a').isEmpty()).isTrue();
    assertThat(Charset.range('z', 'a')).isEqualTo(Charset.EMPTY);
  }

  @Test
  void iterationIsRestartable() {
    final Charset charset = Charset.of(3, 64, 65, 200);
    assertThat(charset.stream().toArray()).containsExactly(3, 64, 65, 200);
    assertThat(charset.stream().toArray()).containsExactly(3, 64, 65, 200);
    assertThat(charset).containsExactly(3, 64, 65, 200);
  }

  @Test
  void containsAgreesWithIteration() {
    final Charset charset = Charset.range(0x30, 0x39)
      .union(Charset.range(0x7E, 0x82))
      .union(Charset.of(0, 63, 64, 127, 128, 191, 192, 255));
    final var members = charset.stream().boxed().toList();
    for (int b = 0; b < 256; b++) {
      assertThat(members.contains(b)).as("byte %d", b).isEqualTo(charset.contains(b));
    }
    assertThat(members).hasSize(charset.cardinality());
  }

  @Test
  void unionLaws() {
    final Charset a = Charset.range('a', 'f');
    final Charset b = Charset.range('d', 'k');
    final Charset c = Charset.of(0, 0x80, 0xFF);

    assertThat(a.union(b)).isEqualTo(b.union(a));
    assertThat(a.union(b).union(c)).isEqualTo(a.union(b.union(c)));
    assertThat(a.union(a)).isEqualTo(a);
    assertThat(a.union(Charset.EMPTY)).isEqualTo(a);
    assertThat(a.union(b)).isEqualTo(Charset.range('a', 'k'));
    assertThat(a.union(b).hashCode()).isEqualTo(Charset.range('a', 'k').hashCode());
  }

  @Test
  void intersection() {
    assertThat(Charset.range('a', 'f').intersection(Charset.range('d', 'k')))
      .isEqualTo(Charset.range('d', 'f'));
    assertThat(Charset.range('a', 'c').intersection(Charset.range('x', 'z')).isEmpty()).isTrue();
  }

  @Test
  void rangesAreMaximalRuns() {
    final Charset charset = Charset.range(0, 10).union(Charset.range(12, 12)).union(Charset.range(250, 255));
    assertThat(charset.ranges()).containsExactly(
      IntRange.between(0, 10),
      IntRange.single(12),
      IntRange.between(250, 255)
    );
    assertThat(charset.toString()).isEqualTo("Charset(0..10, 12, 250..255)");
  }

  @Test
  void rejectsValuesOutsideByteRange() {
    assertThatThrownBy(() -> Charset.ofByte(256)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Charset.range(-1, 3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Charset.FULL.contains(300)).isInstanceOf(IllegalArgumentException.class);
  }
}
