package edu.kyoto.fos.regdot.cfg;

import soot.Unit;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public final class BasicBlock implements Comparable<BasicBlock> {
  // soot may run body transformers on several threads
  private static final AtomicInteger idCounter = new AtomicInteger();
  public final int id = idCounter.getAndIncrement();

  public final List<Unit> units;

  public BasicBlock(List<Unit> units) {
    assert !units.isEmpty();
    this.units = units;
  }

  public Unit getTail() {
    return units.get(units.size() - 1);
  }

  public Unit getHead() {
    return units.get(0);
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return "bb" + id;
  }

  // name, then one statement per line
  public String getContents() {
    return getName() + ":\n" + this.units.stream()
        .map(u -> "  " + u)
        .collect(Collectors.joining("\n"));
  }

  @Override public boolean equals(final Object o) {
    if(o == null) {
      return false;
    }
    if(!(o instanceof BasicBlock)) {
      return false;
    }
    return this.id == ((BasicBlock) o).id;
  }

  @Override public int hashCode() {
    return id;
  }

  @Override public int compareTo(final BasicBlock basicBlock) {
    return Integer.compare(this.getId(), basicBlock.getId());
  }

  @Override public String toString() {
    return getName() + ":{" + getHead() + "->" + getTail() + "}";
  }
}
