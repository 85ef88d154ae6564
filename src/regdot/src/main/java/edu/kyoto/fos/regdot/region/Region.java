package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.Printable;
import edu.kyoto.fos.regdot.cfg.BasicBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single entry subgraph of a control flow graph, one node of the region tree.
 *
 * <p>A region owns its children and the blocks for which it is the innermost region; blocks of
 * descendant regions are not listed here. The parent link is a back reference only. Regions are
 * assembled by a region analysis and must not change while they are printed.
 */
public class Region implements Printable {
  private static final AtomicInteger idCounter = new AtomicInteger();
  private final int id = idCounter.getAndIncrement();

  private final BasicBlock entry;
  private final boolean simple;
  private Region parent;
  private final List<Region> children = new ArrayList<>();
  private final Set<BasicBlock> blocks = new LinkedHashSet<>();

  public Region(final BasicBlock entry, final boolean simple) {
    this.entry = Objects.requireNonNull(entry, "entry");
    this.simple = simple;
  }

  public int getId() {
    return id;
  }

  public BasicBlock getEntry() {
    return entry;
  }

  /**
   * @return true if exactly one edge enters and exactly one edge leaves this region
   */
  public boolean isSimple() {
    return simple;
  }

  public Region getParent() {
    return parent;
  }

  public boolean isTopLevelRegion() {
    return parent == null;
  }

  public List<Region> getSubRegions() {
    return Collections.unmodifiableList(children);
  }

  public Set<BasicBlock> getBlocks() {
    return Collections.unmodifiableSet(blocks);
  }

  public Region addSubRegion(final Region child) {
    Objects.requireNonNull(child, "child");
    child.parent = this;
    children.add(child);
    return child;
  }

  public Region addBlock(final BasicBlock bb) {
    blocks.add(Objects.requireNonNull(bb, "bb"));
    return this;
  }

  // root is at depth 0
  public int getDepth() {
    int depth = 0;
    for(Region p = parent; p != null; p = p.parent) {
      depth++;
    }
    return depth;
  }

  /**
   * @return true if {@code r} is this region or one of its descendants
   */
  public boolean contains(final Region r) {
    for(Region it = r; it != null; it = it.parent) {
      if(it == this) {
        return true;
      }
    }
    return false;
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    indent(level, b).append("[").append(getDepth()).append("] ").append(entry.getName());
    if(simple) {
      b.append(" (simple)");
    }
    b.append("\n");
    for(Region c : children) {
      c.printAt(level + 1, b);
    }
  }

  @Override public String toString() {
    return "region" + id + "@" + entry.getName();
  }
}
