package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.Fixtures;
import edu.kyoto.fos.regdot.SimpleGraph;
import edu.kyoto.fos.regdot.cfg.BasicBlock;
import edu.kyoto.fos.regdot.region.Region;
import edu.kyoto.fos.regdot.region.RegionInfo;
import edu.kyoto.fos.regdot.region.RegionNode;
import org.junit.Test;

import static org.junit.Assert.*;

public class RegionGraphTraitsTest {
  private final RegionGraphTraits complete = new RegionGraphTraits(RenderOptions.defaults());
  private final RegionGraphTraits simple = new RegionGraphTraits(RenderOptions.defaults().withLabelMode(LabelMode.SIMPLE));

  private static String attrs(RegionGraphTraits t, RegionInfo ri, BasicBlock src, BasicBlock dst) {
    return t.getEdgeAttributes(ri.getBBNode(src), ri.getBBNode(dst), ri);
  }

  @Test
  public void testLoopBackEdge() {
    BasicBlock h = Fixtures.block(), body = Fixtures.block(), pre = Fixtures.block();
    SimpleGraph<BasicBlock> g = new SimpleGraph<>();
    g.addEdge(pre, h).addEdge(h, body).addEdge(body, h);
    Region root = new Region(pre, false).addBlock(pre);
    root.addSubRegion(new Region(h, true)).addBlock(h).addBlock(body);
    RegionInfo ri = new RegionInfo(g, root);

    assertEquals("constraint=false", attrs(complete, ri, body, h));
    assertEquals("", attrs(complete, ri, h, body));
    assertEquals("", attrs(complete, ri, pre, h));
  }

  @Test
  public void testClimbsToOutermostRegionWithSameEntry() {
    // outer and inner are both headed by h; src only lives in outer
    BasicBlock h = Fixtures.block(), inBody = Fixtures.block(), src = Fixtures.block(), pre = Fixtures.block();
    SimpleGraph<BasicBlock> g = new SimpleGraph<>();
    g.addEdge(pre, h).addEdge(h, inBody).addEdge(inBody, src).addEdge(src, h);
    Region root = new Region(pre, false).addBlock(pre);
    Region outer = root.addSubRegion(new Region(h, false)).addBlock(src);
    outer.addSubRegion(new Region(h, true)).addBlock(h).addBlock(inBody);
    RegionInfo ri = new RegionInfo(g, root);
    ri.verifyAnalysis();

    assertEquals("constraint=false", attrs(complete, ri, src, h));
    assertEquals("constraint=false", attrs(complete, ri, inBody, h));
  }

  @Test
  public void testEdgeBetweenSiblingsIsPlain() {
    BasicBlock a = Fixtures.block(), b = Fixtures.block(), c = Fixtures.block();
    SimpleGraph<BasicBlock> g = new SimpleGraph<>();
    g.addEdge(a, b).addEdge(b, c);
    Region root = new Region(a, false).addBlock(a);
    root.addSubRegion(new Region(b, true)).addBlock(b);
    root.addSubRegion(new Region(c, true)).addBlock(c);
    RegionInfo ri = new RegionInfo(g, root);
    assertEquals("", attrs(complete, ri, b, c));
    assertEquals("", attrs(complete, ri, a, b));
  }

  @Test
  public void testSubregionNodes() {
    BasicBlock a = Fixtures.block();
    SimpleGraph<BasicBlock> g = new SimpleGraph<>();
    g.addNode(a);
    Region root = new Region(a, false).addBlock(a);
    RegionInfo ri = new RegionInfo(g, root);
    RegionNode sub = RegionNode.forSubregion(root);

    assertEquals(RegionGraphTraits.SUBREGION_LABEL, complete.getNodeLabel(sub, ri));
    assertEquals(RegionGraphTraits.SUBREGION_LABEL, simple.getNodeLabel(sub, ri));
    assertEquals("", complete.getEdgeAttributes(sub, ri.getBBNode(a), ri));
    assertEquals("", complete.getEdgeAttributes(ri.getBBNode(a), sub, ri));
    assertEquals("Region" + root.getId(), complete.getNodeIdentifier(sub));
  }

  @Test
  public void testBlockLabels() {
    BasicBlock bb = Fixtures.block(7);
    SimpleGraph<BasicBlock> g = new SimpleGraph<>();
    g.addNode(bb);
    RegionInfo ri = new RegionInfo(g, new Region(bb, false).addBlock(bb));
    RegionNode n = ri.getBBNode(bb);

    assertEquals(bb.getName(), simple.getNodeLabel(n, ri));
    assertEquals(bb.getName() + ":\n  x = 7\n  return\n", complete.getNodeLabel(n, ri));
    assertEquals("Node" + bb.getId(), complete.getNodeIdentifier(n));
  }
}
