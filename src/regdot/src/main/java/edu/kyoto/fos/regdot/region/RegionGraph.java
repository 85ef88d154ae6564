package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import soot.toolkits.graph.DirectedGraph;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

// flat, block level view of a region tree
public class RegionGraph implements DirectedGraph<RegionNode> {
  private final RegionInfo ri;
  private final DirectedGraph<BasicBlock> cfg;

  public RegionGraph(final RegionInfo ri) {
    this.ri = ri;
    this.cfg = ri.getGraph();
  }

  @Override public List<RegionNode> getHeads() {
    return lift(cfg.getHeads());
  }

  @Override public List<RegionNode> getTails() {
    return lift(cfg.getTails());
  }

  @Override public List<RegionNode> getPredsOf(final RegionNode s) {
    return lift(cfg.getPredsOf(s.getBlock()));
  }

  @Override public List<RegionNode> getSuccsOf(final RegionNode s) {
    return lift(cfg.getSuccsOf(s.getBlock()));
  }

  @Override public int size() {
    return cfg.size();
  }

  @Override public Iterator<RegionNode> iterator() {
    Iterator<BasicBlock> it = cfg.iterator();
    return new Iterator<>() {
      @Override public boolean hasNext() {
        return it.hasNext();
      }

      @Override public RegionNode next() {
        return ri.getBBNode(it.next());
      }
    };
  }

  private List<RegionNode> lift(List<BasicBlock> blocks) {
    return blocks.stream().map(ri::getBBNode).collect(Collectors.toList());
  }
}
