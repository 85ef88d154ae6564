package edu.kyoto.fos.regdot.cfg;

import soot.Body;
import soot.toolkits.graph.BriefUnitGraph;

import java.util.stream.Collectors;

public class CFGReconstructor {
  private final BasicBlockGraph bbg;

  public CFGReconstructor(Body b) {
    BriefUnitGraph ug = new BriefUnitGraph(b);
    this.bbg = new BasicBlockGraph(ug, new BasicBlockMapper(b, ug));
  }

  public BasicBlockGraph getBasicBlockGraph() {
    return bbg;
  }

  public String dump() {
    StringBuilder sb = new StringBuilder();
    for(BasicBlock bb : bbg) {
      sb.append(bb.getName()).append(" -> ")
          .append(bbg.getSuccsOf(bb).stream().map(BasicBlock::getName).collect(Collectors.joining(", ")))
          .append("\n");
    }
    return sb.toString();
  }
}
