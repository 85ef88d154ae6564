package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.region.Region;

/**
 * Fill mode and color of a region cluster. Colors index the 12 color "paired12" scheme: each
 * nesting depth gets a pair, the lighter color for filled clusters and the darker one for outlines.
 */
public final class ClusterStyle {
  public static final String COLOR_SCHEME = "paired12";
  public static final int PALETTE_SIZE = 12;

  private final boolean filled;
  private final int color;

  private ClusterStyle(final boolean filled, final int color) {
    this.filled = filled;
    this.color = color;
  }

  public static ClusterStyle of(Region r, boolean onlySimpleRegions) {
    boolean filled = !onlySimpleRegions || r.isSimple();
    int base = r.getDepth() * 2 % PALETTE_SIZE;
    return new ClusterStyle(filled, base + (filled ? 1 : 2));
  }

  public boolean isFilled() {
    return filled;
  }

  public String getStyle() {
    return filled ? "filled" : "solid";
  }

  // in [1, 12]
  public int getColor() {
    return color;
  }

  @Override public String toString() {
    return getStyle() + "/" + color;
  }
}
