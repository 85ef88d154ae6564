package edu.kyoto.fos.regdot.cfg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

public class LoopTree {
  private final Map<BasicBlock, Loop> headerMap = new TreeMap<>();
  private final Map<Loop, Loop> parentRelation = new HashMap<>();
  private final Map<Loop, List<Loop>> childRelation = new HashMap<>();
  private final Map<BasicBlock, List<Loop>> containingLoops = new HashMap<>();

  public LoopTree(final Map<BasicBlock, Set<BasicBlock>> loopMap) {
    loopMap.forEach((hd, body) -> headerMap.put(hd, new Loop(hd, body)));
    this.headerMap.values().forEach(l -> {
      l.all().forEach(bb -> containingLoops.computeIfAbsent(bb, k -> new ArrayList<>()).add(l));
      childRelation.put(l, new ArrayList<>());
    });
    // innermost first
    containingLoops.values().forEach(ls -> ls.sort(Comparator.comparingInt(Loop::size)));
    this.headerMap.values().forEach(l -> {
      // natural loops with distinct headers are either nested or disjoint, so the
      // smallest other loop holding our header is the immediately enclosing one
      containingLoops.get(l.getHeader()).stream()
          .filter(o -> o != l)
          .findFirst()
          .ifPresent(p -> {
            parentRelation.put(l, p);
            childRelation.get(p).add(l);
          });
    });
    childRelation.values().forEach(cs -> cs.sort(Comparator.comparing(Loop::getHeader)));
  }

  public List<Loop> containingLoops(BasicBlock b) {
    return Collections.unmodifiableList(this.containingLoops.getOrDefault(b, Collections.emptyList()));
  }

  public Optional<Loop> innermostLoop(BasicBlock b) {
    return containingLoops(b).stream().findFirst();
  }

  public Optional<Loop> getParent(Loop l) {
    return Optional.ofNullable(parentRelation.get(l));
  }

  public List<Loop> getChildren(Loop l) {
    return Collections.unmodifiableList(childRelation.getOrDefault(l, Collections.emptyList()));
  }

  public List<Loop> outermostLoops() {
    List<Loop> toReturn = new ArrayList<>();
    headerMap.values().stream().filter(l -> !parentRelation.containsKey(l)).forEach(toReturn::add);
    return toReturn;
  }

  public Collection<Loop> loops() {
    return Collections.unmodifiableCollection(headerMap.values());
  }

  public boolean isLoopHeader(final BasicBlock head) {
    return headerMap.containsKey(head);
  }
}
