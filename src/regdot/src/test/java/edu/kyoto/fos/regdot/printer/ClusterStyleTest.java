package edu.kyoto.fos.regdot.printer;

import edu.kyoto.fos.regdot.Fixtures;
import edu.kyoto.fos.regdot.region.Region;
import org.junit.Test;

import static org.junit.Assert.*;

public class ClusterStyleTest {

  private static Region chain(int depth, boolean simple) {
    Region r = new Region(Fixtures.block(), false);
    for(int i = 0; i < depth; i++) {
      r = r.addSubRegion(new Region(Fixtures.block(), simple && i == depth - 1));
    }
    return r;
  }

  @Test
  public void testRootWithDefaults() {
    ClusterStyle s = ClusterStyle.of(chain(0, false), false);
    assertEquals(1, s.getColor());
    assertTrue(s.isFilled());
    assertEquals("filled", s.getStyle());
  }

  @Test
  public void testOnlySimpleRegions() {
    ClusterStyle nonSimple = ClusterStyle.of(chain(1, false), true);
    assertFalse(nonSimple.isFilled());
    assertEquals("solid", nonSimple.getStyle());
    assertEquals(4, nonSimple.getColor());

    ClusterStyle simple = ClusterStyle.of(chain(1, true), true);
    assertTrue(simple.isFilled());
    assertEquals(3, simple.getColor());
  }

  @Test
  public void testColorsWrapAndStayInPalette() {
    for(int depth = 0; depth < 20; depth++) {
      for(boolean only : new boolean[] { false, true }) {
        int color = ClusterStyle.of(chain(depth, false), only).getColor();
        assertTrue(color >= 1 && color <= ClusterStyle.PALETTE_SIZE);
      }
    }
    assertEquals(1, ClusterStyle.of(chain(6, false), false).getColor());
    assertEquals(12, ClusterStyle.of(chain(5, false), true).getColor());
  }
}
