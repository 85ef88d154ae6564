package edu.kyoto.fos.regdot;

import soot.toolkits.graph.DirectedGraph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

// insertion ordered graph for tests
public class SimpleGraph<N> implements DirectedGraph<N> {
  private final Map<N, List<N>> succs = new LinkedHashMap<>();
  private final Map<N, List<N>> preds = new LinkedHashMap<>();

  public N addNode(N n) {
    succs.putIfAbsent(n, new ArrayList<>());
    preds.putIfAbsent(n, new ArrayList<>());
    return n;
  }

  public SimpleGraph<N> addEdge(N from, N to) {
    addNode(from);
    addNode(to);
    succs.get(from).add(to);
    preds.get(to).add(from);
    return this;
  }

  @Override public List<N> getHeads() {
    return succs.keySet().stream().filter(n -> preds.get(n).isEmpty()).collect(Collectors.toList());
  }

  @Override public List<N> getTails() {
    return succs.keySet().stream().filter(n -> succs.get(n).isEmpty()).collect(Collectors.toList());
  }

  @Override public List<N> getPredsOf(final N s) {
    return preds.get(s);
  }

  @Override public List<N> getSuccsOf(final N s) {
    return succs.get(s);
  }

  @Override public int size() {
    return succs.size();
  }

  @Override public Iterator<N> iterator() {
    return succs.keySet().iterator();
  }
}
