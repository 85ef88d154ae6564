package edu.kyoto.fos.regdot.pass;

import edu.kyoto.fos.regdot.cfg.CFGReconstructor;
import edu.kyoto.fos.regdot.printer.LabelMode;
import edu.kyoto.fos.regdot.printer.OutputMode;
import edu.kyoto.fos.regdot.printer.RegionPrinter;
import edu.kyoto.fos.regdot.printer.RenderOptions;
import edu.kyoto.fos.regdot.region.LoopRegionBuilder;
import edu.kyoto.fos.regdot.region.RegionInfo;
import soot.Body;
import soot.BodyTransformer;
import soot.Pack;
import soot.PhaseOptions;
import soot.SootMethod;
import soot.Transform;
import soot.options.Options;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the region graph of every method body to a dot file, and optionally opens it.
 */
public class RegionPass extends BodyTransformer {
  public static final String PACK = "jtp";
  public static final String DECLARED_OPTIONS = "enabled only-simple-regions output-dir viewer config";

  public enum Kind {
    DOT_REGIONS("dotregions", LabelMode.COMPLETE, OutputMode.PRINT, true),
    DOT_REGIONS_ONLY("dotregionsonly", LabelMode.SIMPLE, OutputMode.PRINT, false),
    VIEW_REGIONS("viewregions", LabelMode.COMPLETE, OutputMode.VIEW, false),
    VIEW_REGIONS_ONLY("viewregionsonly", LabelMode.SIMPLE, OutputMode.VIEW, false);

    public final String phase;
    public final LabelMode labelMode;
    public final OutputMode outputMode;
    public final boolean enabledByDefault;

    Kind(final String phase, final LabelMode labelMode, final OutputMode outputMode, final boolean enabledByDefault) {
      this.phase = phase;
      this.labelMode = labelMode;
      this.outputMode = outputMode;
      this.enabledByDefault = enabledByDefault;
    }

    public String phaseName() {
      return PACK + "." + phase;
    }
  }

  private final Kind kind;

  public RegionPass(final Kind kind) {
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public Transform toTransform() {
    Transform t = new Transform(kind.phaseName(), this);
    t.setDeclaredOptions(DECLARED_OPTIONS);
    t.setDefaultOptions("enabled:" + kind.enabledByDefault);
    return t;
  }

  public static void registerAll(Pack jtp) {
    for(Kind k : Kind.values()) {
      jtp.add(new RegionPass(k).toTransform());
    }
  }

  @Override protected void internalTransform(final Body b, final String phaseName, final Map<String, String> options) {
    RenderOptions opts = optionsFor(options);
    Path file = render(b, opts);
    if(opts.outputMode() == OutputMode.VIEW) {
      try {
        int exit = new GraphViewer(opts.viewer()).display(file);
        if(exit != 0) {
          System.err.println("Viewer exited with status " + exit + " on " + file);
        }
      } catch (IOException e) {
        System.err.println("Error viewing graph " + file + ": " + e.getMessage());
      }
    }
  }

  RenderOptions optionsFor(final Map<String, String> options) {
    RenderOptions opts = RenderOptions.defaults();
    String config = PhaseOptions.getString(options, "config");
    if(!config.isEmpty()) {
      try {
        opts = RenderOptions.load(Paths.get(config));
      } catch (IOException e) {
        throw new UncheckedIOException("Could not read render options from " + config, e);
      }
    }
    // the phase decides what is printed and how
    opts = opts.withLabelMode(kind.labelMode).withOutputMode(kind.outputMode);
    if(options.containsKey("only-simple-regions")) {
      opts = opts.withOnlySimpleRegions(PhaseOptions.getBoolean(options, "only-simple-regions"));
    }
    String dir = PhaseOptions.getString(options, "output-dir");
    if(!dir.isEmpty()) {
      opts = opts.withOutputDirectory(Paths.get(dir));
    }
    String viewer = PhaseOptions.getString(options, "viewer");
    if(!viewer.isEmpty()) {
      opts = opts.withViewer(viewer);
    }
    return opts;
  }

  Path render(final Body b, final RenderOptions opts) {
    CFGReconstructor cfg = new CFGReconstructor(b);
    RegionInfo ri = new LoopRegionBuilder(cfg.getBasicBlockGraph()).build();
    if(Options.v().verbose()) {
      System.out.println("Blocks of " + b.getMethod().getSignature() + ":");
      System.out.println(cfg.dump());
      System.out.println(ri.dump());
    }
    Path file = opts.outputDirectory().resolve(fileNameFor(b.getMethod()));
    System.out.println("Writing '" + file + "'...");
    write(ri, opts, file);
    return file;
  }

  // the file is only opened once the graph has been rendered
  static void write(final RegionInfo ri, final RenderOptions opts, final Path file) {
    String text = new RegionPrinter(opts).print(ri);
    try {
      Files.createDirectories(file.toAbsolutePath().getParent());
      Files.write(file, text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Error writing " + file, e);
    }
  }

  static String fileNameFor(SootMethod m) {
    String sub = sanitise(m.getSubSignature());
    String name = "reg." + m.getDeclaringClass().getName() + "." + sub;
    List<SootMethod> siblings = new ArrayList<>(m.getDeclaringClass().getMethods());
    // overloads may sanitise to the same name, tell them apart by declaration index
    long clashes = siblings.stream().filter(o -> sanitise(o.getSubSignature()).equals(sub)).count();
    if(clashes > 1) {
      name += "." + siblings.indexOf(m);
    }
    return name + ".dot";
  }

  private static String sanitise(String subSignature) {
    return subSignature.replaceAll("[^A-Za-z0-9_.$]+", "_");
  }
}
