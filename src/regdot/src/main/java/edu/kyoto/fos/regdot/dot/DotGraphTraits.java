package edu.kyoto.fos.regdot.dot;

import soot.toolkits.graph.DirectedGraph;

import java.io.IOException;

/**
 * Describes how {@link GraphWriter} should print a graph of type {@code G} whose nodes are of
 * type {@code N}.
 */
public interface DotGraphTraits<G, N> {
  String getGraphName(G graph);

  /**
   * @return the nodes and edges to print, in printing order
   */
  DirectedGraph<N> getNodes(G graph);

  /**
   * @return a token that identifies {@code node} in the output, unique within the graph
   */
  String getNodeIdentifier(N node);

  String getNodeLabel(N node, G graph);

  default String getNodeAttributes(N node, G graph) {
    return "";
  }

  /**
   * @return extra edge attributes, or the empty string for none
   */
  default String getEdgeAttributes(N src, N dst, G graph) {
    return "";
  }

  /**
   * Called after all nodes and edges have been written, to add anything that does not fit the
   * node/edge scheme.
   */
  default void addCustomGraphFeatures(G graph, GraphWriter<G, N> writer) throws IOException {
  }
}
