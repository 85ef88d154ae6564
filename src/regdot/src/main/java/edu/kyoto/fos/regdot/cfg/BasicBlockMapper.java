package edu.kyoto.fos.regdot.cfg;

import soot.Body;
import soot.Unit;
import soot.toolkits.graph.DirectedGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

// splits a unit graph into basic blocks, keyed by their first and last unit
public class BasicBlockMapper implements Iterable<BasicBlock> {
  private final Map<Unit, BasicBlock> hdMap = new LinkedHashMap<>();
  private final Map<Unit, BasicBlock> tlMap = new LinkedHashMap<>();

  public BasicBlockMapper(final Body b, final DirectedGraph<Unit> ug) {
    Set<Unit> start = new HashSet<>();
    // join points always open a new block
    for(Unit u : b.getUnits()) {
      if(ug.getPredsOf(u).size() > 1) {
        start.add(u);
      }
    }
    LinkedList<Unit> worklist = new LinkedList<>(ug.getHeads());
    Set<Unit> visited = new HashSet<>();
    while(!worklist.isEmpty()) {
      Unit u = worklist.pop();
      if(!visited.add(u)) {
        continue;
      }
      List<Unit> currChain = new ArrayList<>();
      currChain.add(u);
      Unit it = u;
      while(true) {
        List<Unit> succs = ug.getSuccsOf(it);
        if(succs.size() != 1 || start.contains(succs.get(0)) || visited.contains(succs.get(0))) {
          // terminal
          worklist.addAll(succs);
          break;
        }
        it = succs.get(0);
        visited.add(it);
        currChain.add(it);
      }
      BasicBlock bb = new BasicBlock(currChain);
      hdMap.put(bb.getHead(), bb);
      tlMap.put(bb.getTail(), bb);
    }
  }

  public int size() {
    return hdMap.size();
  }

  public BasicBlock getBlockByHead(final Unit unit) {
    assert hdMap.containsKey(unit) : unit;
    return hdMap.get(unit);
  }

  public BasicBlock getBlockByTail(final Unit unit) {
    assert tlMap.containsKey(unit) : unit;
    return tlMap.get(unit);
  }

  @Override public Iterator<BasicBlock> iterator() {
    return hdMap.values().iterator();
  }
}
