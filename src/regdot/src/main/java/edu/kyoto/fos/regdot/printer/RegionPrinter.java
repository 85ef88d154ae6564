package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.dot.GraphWriter;
import edu.kyoto.fos.regdot.region.RegionInfo;

import java.io.IOException;
import java.util.Objects;

/**
 * Renders the region tree of a function as a dot graph.
 */
public class RegionPrinter {
  private final RenderOptions options;

  public RegionPrinter(final RenderOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public String print(final RegionInfo ri) {
    ri.verifyAnalysis();
    StringBuilder sb = new StringBuilder();
    try {
      new GraphWriter<>(sb, ri, new RegionGraphTraits(options)).writeGraph();
    } catch (IOException e) {
      // StringBuilder.append does not throw
      throw new AssertionError(e);
    }
    return sb.toString();
  }

  /**
   * Renders {@code ri} completely before writing anything to {@code out}; a malformed tree leaves
   * {@code out} untouched.
   *
   * @throws edu.kyoto.fos.regdot.region.MalformedRegionTreeException if the tree fails verification
   * @throws IOException if writing to {@code out} fails
   */
  public void print(final RegionInfo ri, final Appendable out) throws IOException {
    String text = print(ri);
    out.append(text);
  }
}
