package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import edu.kyoto.fos.regdot.cfg.Loop;
import edu.kyoto.fos.regdot.cfg.LoopTree;
import fj.P;
import fj.P2;
import soot.toolkits.graph.DirectedGraph;
import soot.toolkits.graph.DominatorsFinder;
import soot.toolkits.graph.MHGDominatorsFinder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds a region tree out of the natural loops of a block graph: the whole function is the top
 * level region and every loop is a region headed by its loop header.
 */
public class LoopRegionBuilder {
  private final DirectedGraph<BasicBlock> bbg;
  private final LoopTree lt;

  public LoopRegionBuilder(final DirectedGraph<BasicBlock> bbg) {
    this(bbg, naturalLoops(bbg));
  }

  public LoopRegionBuilder(final DirectedGraph<BasicBlock> bbg, final LoopTree lt) {
    this.bbg = bbg;
    this.lt = lt;
  }

  /**
   * Finds the natural loops of {@code bbg}. An edge {@code latch -> header} is a back edge when
   * the header dominates the latch; the loop of a header is the header plus every block that
   * reaches one of its latches without passing through the header. All back edges into the same
   * header form a single loop.
   */
  public static LoopTree naturalLoops(DirectedGraph<BasicBlock> bbg) {
    DominatorsFinder<BasicBlock> df = new MHGDominatorsFinder<>(bbg);
    Map<BasicBlock, List<BasicBlock>> latches = new TreeMap<>();
    for(BasicBlock bb : bbg) {
      for(BasicBlock succ : bbg.getSuccsOf(bb)) {
        if(df.isDominatedBy(bb, succ)) {
          latches.computeIfAbsent(succ, k -> new ArrayList<>()).add(bb);
        }
      }
    }
    Map<BasicBlock, Set<BasicBlock>> bodies = new TreeMap<>();
    latches.forEach((header, ls) -> bodies.put(header, loopBody(bbg, header, ls)));
    return new LoopTree(bodies);
  }

  // walks predecessors back from the latches, stopping at the header
  private static Set<BasicBlock> loopBody(DirectedGraph<BasicBlock> bbg, BasicBlock header, List<BasicBlock> latches) {
    Set<BasicBlock> body = new HashSet<>();
    Deque<BasicBlock> worklist = new ArrayDeque<>(latches);
    while(!worklist.isEmpty()) {
      BasicBlock b = worklist.pop();
      if(b.equals(header) || !body.add(b)) {
        continue;
      }
      worklist.addAll(bbg.getPredsOf(b));
    }
    return body;
  }

  public RegionInfo build() {
    List<BasicBlock> heads = bbg.getHeads();
    if(heads.isEmpty()) {
      throw new IllegalArgumentException("Graph has no entry block");
    }
    // the top level region is never simple, it has no exit
    Region top = new Region(heads.get(0), false);
    Map<Loop, Region> regions = new HashMap<>();
    Deque<P2<Loop, Region>> worklist = new ArrayDeque<>();
    for(Loop l : lt.outermostLoops()) {
      worklist.add(P.p(l, top));
    }
    while(!worklist.isEmpty()) {
      P2<Loop, Region> it = worklist.pop();
      Loop l = it._1();
      Region r = it._2().addSubRegion(new Region(l.getHeader(), isSimple(l)));
      regions.put(l, r);
      for(Loop c : lt.getChildren(l)) {
        worklist.add(P.p(c, r));
      }
    }
    TreeSet<BasicBlock> ordered = new TreeSet<>();
    bbg.forEach(ordered::add);
    for(BasicBlock bb : ordered) {
      lt.innermostLoop(bb).map(regions::get).orElse(top).addBlock(bb);
    }
    return new RegionInfo(bbg, top);
  }

  private boolean isSimple(Loop l) {
    long entering = bbg.getPredsOf(l.getHeader()).stream().filter(p -> !l.contains(p)).count();
    long leaving = 0;
    for(BasicBlock bb : l.all()) {
      leaving += bbg.getSuccsOf(bb).stream().filter(s -> !l.contains(s)).count();
    }
    return entering == 1 && leaving == 1;
  }
}
