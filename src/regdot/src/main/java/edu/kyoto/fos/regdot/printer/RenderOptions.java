package edu.kyoto.fos.regdot.printer;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of one render. Instances are immutable; the {@code with} methods return copies.
 */
public final class RenderOptions {
  public static final String ONLY_SIMPLE_REGIONS = "onlySimpleRegions";
  public static final String LABEL_MODE = "labelMode";
  public static final String OUTPUT_MODE = "outputMode";
  public static final String OUTPUT_DIRECTORY = "outputDirectory";
  public static final String VIEWER = "viewer";
  private static final Set<String> KEYS = Set.of(ONLY_SIMPLE_REGIONS, LABEL_MODE, OUTPUT_MODE, OUTPUT_DIRECTORY, VIEWER);

  private final boolean onlySimpleRegions;
  private final LabelMode labelMode;
  private final OutputMode outputMode;
  private final Path outputDirectory;
  private final String viewer;

  public RenderOptions(boolean onlySimpleRegions, LabelMode labelMode, OutputMode outputMode, Path outputDirectory, String viewer) {
    this.onlySimpleRegions = onlySimpleRegions;
    this.labelMode = Objects.requireNonNull(labelMode, "labelMode");
    this.outputMode = Objects.requireNonNull(outputMode, "outputMode");
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.viewer = Objects.requireNonNull(viewer, "viewer");
  }

  public static RenderOptions defaults() {
    return new RenderOptions(false, LabelMode.COMPLETE, OutputMode.PRINT, Paths.get("."), "xdg-open");
  }

  public static RenderOptions load(Path yamlFile) throws IOException {
    try(Reader r = Files.newBufferedReader(yamlFile, StandardCharsets.UTF_8)) {
      return load(r);
    }
  }

  public static RenderOptions load(Reader yaml) {
    return defaults().overlay(yaml);
  }

  /**
   * Applies the settings of a YAML mapping on top of this one.
   */
  public RenderOptions overlay(Reader yaml) {
    Object doc = new Yaml().load(yaml);
    if(doc == null) {
      return this;
    }
    if(!(doc instanceof Map)) {
      throw new IllegalArgumentException("Render options must be a mapping, got: " + doc);
    }
    RenderOptions toReturn = this;
    for(Map.Entry<?, ?> e : ((Map<?, ?>) doc).entrySet()) {
      String key = String.valueOf(e.getKey());
      if(!KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown render option " + key + ", expected one of " + KEYS);
      }
      String value = String.valueOf(e.getValue());
      switch(key) {
        case ONLY_SIMPLE_REGIONS:
          toReturn = toReturn.withOnlySimpleRegions(parseBoolean(key, e.getValue()));
          break;
        case LABEL_MODE:
          toReturn = toReturn.withLabelMode(parseEnum(LabelMode.class, key, value));
          break;
        case OUTPUT_MODE:
          toReturn = toReturn.withOutputMode(parseEnum(OutputMode.class, key, value));
          break;
        case OUTPUT_DIRECTORY:
          toReturn = toReturn.withOutputDirectory(Paths.get(value));
          break;
        default:
          toReturn = toReturn.withViewer(value);
      }
    }
    return toReturn;
  }

  private static boolean parseBoolean(String key, Object value) {
    if(value instanceof Boolean) {
      return (Boolean) value;
    }
    throw new IllegalArgumentException("Render option " + key + " must be true or false, got: " + value);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> klass, String key, String value) {
    try {
      return Enum.valueOf(klass, value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Bad value " + value + " for render option " + key, e);
    }
  }

  public boolean onlySimpleRegions() {
    return onlySimpleRegions;
  }

  public LabelMode labelMode() {
    return labelMode;
  }

  public OutputMode outputMode() {
    return outputMode;
  }

  public Path outputDirectory() {
    return outputDirectory;
  }

  public String viewer() {
    return viewer;
  }

  public RenderOptions withOnlySimpleRegions(boolean v) {
    return new RenderOptions(v, labelMode, outputMode, outputDirectory, viewer);
  }

  public RenderOptions withLabelMode(LabelMode v) {
    return new RenderOptions(onlySimpleRegions, v, outputMode, outputDirectory, viewer);
  }

  public RenderOptions withOutputMode(OutputMode v) {
    return new RenderOptions(onlySimpleRegions, labelMode, v, outputDirectory, viewer);
  }

  public RenderOptions withOutputDirectory(Path v) {
    return new RenderOptions(onlySimpleRegions, labelMode, outputMode, v, viewer);
  }

  public RenderOptions withViewer(String v) {
    return new RenderOptions(onlySimpleRegions, labelMode, outputMode, outputDirectory, v);
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final RenderOptions that = (RenderOptions) o;
    return onlySimpleRegions == that.onlySimpleRegions && labelMode == that.labelMode && outputMode == that.outputMode
        && outputDirectory.equals(that.outputDirectory) && viewer.equals(that.viewer);
  }

  @Override public int hashCode() {
    return Objects.hash(onlySimpleRegions, labelMode, outputMode, outputDirectory, viewer);
  }

  @Override public String toString() {
    return "RenderOptions{" + ONLY_SIMPLE_REGIONS + "=" + onlySimpleRegions + ", " + LABEL_MODE + "=" + labelMode
        + ", " + OUTPUT_MODE + "=" + outputMode + ", " + OUTPUT_DIRECTORY + "=" + outputDirectory + ", " + VIEWER + "=" + viewer + "}";
  }
}
