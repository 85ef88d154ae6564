package edu.kyoto.fos.regdot;

import edu.kyoto.fos.regdot.pass.RegionPass;
import soot.Main;
import soot.PackManager;

/**
 * Runs Soot with the region printing phases added to the jimple transformation pack. Use
 * {@code -p jtp.dotregionsonly on} (or {@code viewregions}, {@code viewregionsonly}) to switch
 * on the other variants.
 */
public class Regdot {
  public static void main(String[] args) {
    RegionPass.registerAll(PackManager.v().getPack(RegionPass.PACK));
    Main.main(args);
  }
}
