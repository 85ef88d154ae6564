package edu.kyoto.fos.regdot.cfg;

import soot.Unit;
import soot.toolkits.graph.DirectedGraph;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

// the unit graph seen at basic block granularity
public class BasicBlockGraph implements DirectedGraph<BasicBlock> {
  private final DirectedGraph<Unit> ug;
  private final BasicBlockMapper bbm;

  public BasicBlockGraph(DirectedGraph<Unit> ug, BasicBlockMapper bbm) {
    this.ug = ug;
    this.bbm = bbm;
  }

  @Override public List<BasicBlock> getHeads() {
    return ug.getHeads().stream().map(bbm::getBlockByHead).collect(Collectors.toList());
  }

  @Override public List<BasicBlock> getTails() {
    return ug.getTails().stream().map(bbm::getBlockByTail).collect(Collectors.toList());
  }

  @Override public List<BasicBlock> getPredsOf(final BasicBlock s) {
    return ug.getPredsOf(s.getHead()).stream().map(bbm::getBlockByTail).collect(Collectors.toList());
  }

  @Override public List<BasicBlock> getSuccsOf(final BasicBlock s) {
    return ug.getSuccsOf(s.getTail()).stream().map(bbm::getBlockByHead).collect(Collectors.toList());
  }

  @Override public int size() {
    return this.bbm.size();
  }

  @Override public Iterator<BasicBlock> iterator() {
    return bbm.iterator();
  }
}
