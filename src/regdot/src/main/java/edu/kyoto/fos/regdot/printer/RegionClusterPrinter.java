package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import edu.kyoto.fos.regdot.dot.GraphWriter;
import edu.kyoto.fos.regdot.region.Region;
import edu.kyoto.fos.regdot.region.RegionInfo;
import fj.P;
import fj.P2;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Prints one nested {@code subgraph cluster_} per region so that every block is drawn inside the
 * clusters of all regions that contain it.
 *
 * <p>The tree is walked with an explicit stack: a region is opened the first time its frame is on
 * top of the stack, and closed, after its own blocks, the second time.
 */
public class RegionClusterPrinter {
  private final RegionInfo ri;
  private final boolean onlySimpleRegions;
  private final Function<BasicBlock, String> nodeIds;

  public RegionClusterPrinter(final RegionInfo ri, final boolean onlySimpleRegions, final Function<BasicBlock, String> nodeIds) {
    this.ri = ri;
    this.onlySimpleRegions = onlySimpleRegions;
    this.nodeIds = nodeIds;
  }

  public static String clusterName(Region r) {
    return "cluster_" + r.getId();
  }

  public void printRegionCluster(final Region root, final GraphWriter<?, ?> gw, final int baseDepth) throws IOException {
    Deque<P2<Region, Integer>> stack = new ArrayDeque<>();
    Set<Region> opened = Collections.newSetFromMap(new IdentityHashMap<>());
    stack.push(P.p(root, baseDepth));
    while(!stack.isEmpty()) {
      P2<Region, Integer> top = stack.peek();
      Region r = top._1();
      int depth = top._2();
      if(opened.add(r)) {
        open(r, gw, depth);
        List<Region> children = r.getSubRegions();
        for(int i = children.size() - 1; i >= 0; i--) {
          stack.push(P.p(children.get(i), depth + 1));
        }
      } else {
        stack.pop();
        close(r, gw, depth);
      }
    }
  }

  private void open(Region r, GraphWriter<?, ?> gw, int depth) throws IOException {
    Appendable o = gw.getOStream();
    ClusterStyle style = ClusterStyle.of(r, onlySimpleRegions);
    gw.indent(2 * depth);
    o.append("subgraph ").append(clusterName(r)).append(" {\n");
    gw.indent(2 * (depth + 1));
    o.append("label = \"\";\n");
    gw.indent(2 * (depth + 1));
    o.append("style = ").append(style.getStyle()).append(";\n");
    gw.indent(2 * (depth + 1));
    o.append("color = ").append(String.valueOf(style.getColor())).append(";\n");
  }

  private void close(Region r, GraphWriter<?, ?> gw, int depth) throws IOException {
    Appendable o = gw.getOStream();
    for(BasicBlock bb : r.getBlocks()) {
      // blocks of subregions are declared by the subregion
      if(ri.getRegionFor(bb) == r) {
        gw.indent(2 * (depth + 1));
        o.append(nodeIds.apply(bb)).append(";\n");
      }
    }
    gw.indent(2 * depth);
    o.append("}\n");
  }
}
