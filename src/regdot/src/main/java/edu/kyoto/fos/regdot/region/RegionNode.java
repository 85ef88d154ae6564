package edu.kyoto.fos.regdot.region;

import edu.kyoto.fos.regdot.cfg.BasicBlock;

import java.util.Objects;

/**
 * A node of the region graph: either a single basic block or a whole region treated as one node.
 * Consumers switch on {@link #getKind()}.
 */
public final class RegionNode {
  public enum Kind {
    BLOCK,
    SUBREGION
  }

  private final Kind kind;
  private final BasicBlock block;
  private final Region region;

  private RegionNode(final Kind kind, final BasicBlock block, final Region region) {
    this.kind = kind;
    this.block = block;
    this.region = region;
  }

  public static RegionNode forBlock(BasicBlock bb) {
    return new RegionNode(Kind.BLOCK, Objects.requireNonNull(bb, "bb"), null);
  }

  public static RegionNode forSubregion(Region r) {
    return new RegionNode(Kind.SUBREGION, null, Objects.requireNonNull(r, "r"));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isSubRegion() {
    return kind == Kind.SUBREGION;
  }

  public BasicBlock getBlock() {
    if(kind != Kind.BLOCK) {
      throw new IllegalStateException("Not a block node: " + this);
    }
    return block;
  }

  public Region getRegion() {
    if(kind != Kind.SUBREGION) {
      throw new IllegalStateException("Not a subregion node: " + this);
    }
    return region;
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final RegionNode that = (RegionNode) o;
    return kind == that.kind && Objects.equals(block, that.block) && region == that.region;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, block, region == null ? 0 : region.getId());
  }

  @Override public String toString() {
    return kind == Kind.BLOCK ? block.getName() : region.toString();
  }
}
