package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import soot.toolkits.graph.DirectedGraph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The region tree of one function together with the control flow graph it partitions.
 */
public class RegionInfo {
  private final DirectedGraph<BasicBlock> cfg;
  private final Region topLevelRegion;
  private final Map<BasicBlock, Region> bbMap = new HashMap<>();
  private final Map<BasicBlock, RegionNode> bbNodes = new HashMap<>();

  public RegionInfo(final DirectedGraph<BasicBlock> cfg, final Region topLevelRegion) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.topLevelRegion = Objects.requireNonNull(topLevelRegion, "topLevelRegion");
    Set<Region> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Region> worklist = new ArrayDeque<>();
    worklist.push(topLevelRegion);
    while(!worklist.isEmpty()) {
      Region r = worklist.pop();
      if(!seen.add(r)) {
        continue;
      }
      r.getBlocks().forEach(bb -> bbMap.putIfAbsent(bb, r));
      r.getSubRegions().forEach(worklist::push);
    }
  }

  public DirectedGraph<BasicBlock> getGraph() {
    return cfg;
  }

  public Region getTopLevelRegion() {
    return topLevelRegion;
  }

  /**
   * @return the innermost region containing {@code bb}, or null if no region claims it
   */
  public Region getRegionFor(final BasicBlock bb) {
    return bbMap.get(bb);
  }

  public boolean contains(final Region r, final BasicBlock bb) {
    Region inner = getRegionFor(bb);
    return inner != null && r.contains(inner);
  }

  public RegionNode getBBNode(final BasicBlock bb) {
    return bbNodes.computeIfAbsent(bb, RegionNode::forBlock);
  }

  public RegionGraph asGraph() {
    return new RegionGraph(this);
  }

  /**
   * Checks the ownership invariants of the tree against the control flow graph.
   *
   * @throws MalformedRegionTreeException on the first violation found
   */
  public void verifyAnalysis() {
    if(topLevelRegion.getParent() != null) {
      throw new MalformedRegionTreeException("Top level region " + topLevelRegion + " has parent " + topLevelRegion.getParent());
    }
    Set<Region> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Region> worklist = new ArrayDeque<>();
    seen.add(topLevelRegion);
    worklist.push(topLevelRegion);
    while(!worklist.isEmpty()) {
      Region r = worklist.pop();
      for(Region c : r.getSubRegions()) {
        if(!seen.add(c)) {
          throw new MalformedRegionTreeException("Region " + c + " is reachable twice (cycle below " + r + ")");
        }
        if(c.getParent() != r) {
          throw new MalformedRegionTreeException("Region " + c + " is a child of " + r + " but points to parent " + c.getParent());
        }
        worklist.push(c);
      }
      for(BasicBlock bb : r.getBlocks()) {
        Region owner = bbMap.get(bb);
        if(owner != r) {
          throw new MalformedRegionTreeException("Block " + bb.getName() + " is claimed by both " + owner + " and " + r);
        }
      }
    }
    for(BasicBlock bb : cfg) {
      if(!bbMap.containsKey(bb)) {
        throw new MalformedRegionTreeException("Block " + bb.getName() + " is not contained in any region");
      }
    }
  }

  public String dump() {
    StringBuilder sb = new StringBuilder();
    topLevelRegion.printAt(0, sb);
    return sb.toString();
  }
}
