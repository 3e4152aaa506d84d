package bytenfa.graph;

import java.util.stream.Stream;

/**
 * Automata which can be rendered using the DOT language.
 *
 * Vertices are identified by their node index. One extra invisible vertex is
 * emitted with an arrow pointing at the initial node.
 */
public interface DotGraph {

  /**
   * Vertex in the dot graph.
   *
   * @param id node index
   * @param accepting is this an accepting state?
   */
  record Vertex(int id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from node where the edge starts
   * @param to node where the edge ends
   * @param label HTML label on the edge
   */
  record Edge(int from, int to, String label) { }

  /**
   * Node at which the automaton starts.
   */
  int initialVertex();

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge> dotEdges();

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(escapeId(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  \"_start\" [shape = none, label = <>];\n");

    final Iterable<Vertex> vs = () -> vertices().iterator();
    for (Vertex vertex : vs) {
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder
        .append("  ").append(escapeId(Integer.toString(vertex.id())))
        .append(" [shape = ").append(shape)
        .append(", label = <").append(vertex.id()).append(">];\n");
    }

    builder
      .append("  \"_start\" -> ")
      .append(escapeId(Integer.toString(initialVertex())))
      .append(";\n");

    final Iterable<Edge> es = () -> dotEdges().iterator();
    for (Edge edge : es) {
      builder
        .append("  ").append(escapeId(Integer.toString(edge.from())))
        .append(" -> ").append(escapeId(Integer.toString(edge.to())))
        .append(" [label = <").append(edge.label()).append(">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
