package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import edu.kyoto.fos.regdot.dot.DotGraphTraits;
import edu.kyoto.fos.regdot.dot.GraphWriter;
import edu.kyoto.fos.regdot.region.Region;
import edu.kyoto.fos.regdot.region.RegionInfo;
import edu.kyoto.fos.regdot.region.RegionNode;
import soot.toolkits.graph.DirectedGraph;

import java.io.IOException;

/**
 * Labels, edge attributes and region clusters of the region graph.
 */
public class RegionGraphTraits implements DotGraphTraits<RegionInfo, RegionNode> {
  public static final String GRAPH_NAME = "Region Graph";
  // printing whole regions as single nodes is not supported
  public static final String SUBREGION_LABEL = "Not implemented";
  public static final String BACKEDGE_ATTRIBUTES = "constraint=false";
  // clusters are nested below the writer's own indentation
  static final int CLUSTER_BASE_DEPTH = 4;

  private final RenderOptions options;

  public RegionGraphTraits(final RenderOptions options) {
    this.options = options;
  }

  @Override public String getGraphName(final RegionInfo graph) {
    return GRAPH_NAME;
  }

  @Override public DirectedGraph<RegionNode> getNodes(final RegionInfo graph) {
    return graph.asGraph();
  }

  @Override public String getNodeIdentifier(final RegionNode node) {
    switch(node.getKind()) {
      case BLOCK:
        return blockId(node.getBlock());
      case SUBREGION:
        return "Region" + node.getRegion().getId();
      default:
        throw new IllegalStateException("Unknown node kind " + node.getKind());
    }
  }

  public static String blockId(BasicBlock bb) {
    return "Node" + bb.getId();
  }

  @Override public String getNodeLabel(final RegionNode node, final RegionInfo graph) {
    switch(node.getKind()) {
      case BLOCK:
        BasicBlock bb = node.getBlock();
        if(options.labelMode() == LabelMode.SIMPLE) {
          return bb.getName();
        }
        return bb.getContents() + "\n";
      case SUBREGION:
        return SUBREGION_LABEL;
      default:
        throw new IllegalStateException("Unknown node kind " + node.getKind());
    }
  }

  /**
   * Edges back to a loop header from inside the loop must not take part in ranking, otherwise
   * the layout engine sees a cycle.
   */
  @Override public String getEdgeAttributes(final RegionNode src, final RegionNode dst, final RegionInfo ri) {
    if(src.isSubRegion() || dst.isSubRegion()) {
      return "";
    }
    BasicBlock srcBB = src.getBlock();
    BasicBlock destBB = dst.getBlock();

    Region r = ri.getRegionFor(destBB);
    // climb to the outermost region headed by destBB
    while(r.getParent() != null && r.getParent().getEntry().equals(destBB)) {
      r = r.getParent();
    }
    if(r.getEntry().equals(destBB) && ri.contains(r, srcBB)) {
      return BACKEDGE_ATTRIBUTES;
    }
    return "";
  }

  @Override public void addCustomGraphFeatures(final RegionInfo ri, final GraphWriter<RegionInfo, RegionNode> gw) throws IOException {
    gw.getOStream().append("\tcolorscheme = \"").append(ClusterStyle.COLOR_SCHEME).append("\";\n");
    new RegionClusterPrinter(ri, options.onlySimpleRegions(), RegionGraphTraits::blockId)
        .printRegionCluster(ri.getTopLevelRegion(), gw, CLUSTER_BASE_DEPTH);
  }
}
