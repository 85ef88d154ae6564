package edu.kyoto.fos.regdot.dot;

import soot.toolkits.graph.DirectedGraph;

import java.io.IOException;
import java.util.Objects;

/**
 * Writes a graph in the dot notation, asking a {@link DotGraphTraits} for names, labels and
 * attributes.
 */
public class GraphWriter<G, N> {
  private final Appendable out;
  private final G graph;
  private final DotGraphTraits<G, N> traits;

  public GraphWriter(final Appendable out, final G graph, final DotGraphTraits<G, N> traits) {
    this.out = Objects.requireNonNull(out, "out");
    this.graph = graph;
    this.traits = traits;
  }

  public Appendable getOStream() {
    return out;
  }

  public GraphWriter<G, N> indent(int n) throws IOException {
    for(int i = 0; i < n; i++) {
      out.append(' ');
    }
    return this;
  }

  public void writeGraph() throws IOException {
    writeHeader(traits.getGraphName(graph));
    writeNodes();
    traits.addCustomGraphFeatures(graph, this);
    writeFooter();
  }

  void writeHeader(String title) throws IOException {
    out.append("digraph ").append(DotStrings.quote(title)).append(" {\n");
    out.append("\tlabel=").append(DotStrings.quote(title)).append(";\n");
    out.append("\n");
  }

  void writeNodes() throws IOException {
    DirectedGraph<N> nodes = traits.getNodes(graph);
    for(N n : nodes) {
      writeNode(n);
      for(N s : nodes.getSuccsOf(n)) {
        writeEdge(n, s);
      }
    }
  }

  void writeNode(N node) throws IOException {
    out.append("\t").append(traits.getNodeIdentifier(node)).append(" [shape=record,");
    String attrs = traits.getNodeAttributes(node, graph);
    if(!attrs.isEmpty()) {
      out.append(attrs).append(",");
    }
    out.append("label=\"{").append(DotStrings.escapeRecordLabel(traits.getNodeLabel(node, graph))).append("}\"];\n");
  }

  void writeEdge(N src, N dst) throws IOException {
    out.append("\t").append(traits.getNodeIdentifier(src)).append(" -> ").append(traits.getNodeIdentifier(dst));
    String attrs = traits.getEdgeAttributes(src, dst, graph);
    if(!attrs.isEmpty()) {
      out.append("[").append(attrs).append("]");
    }
    out.append(";\n");
  }

  void writeFooter() throws IOException {
    out.append("}\n");
  }
}
