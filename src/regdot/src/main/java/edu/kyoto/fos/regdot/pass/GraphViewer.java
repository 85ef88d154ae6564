package edu.kyoto.fos.regdot.pass;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// opens a written dot file in an external viewer
public class GraphViewer {
  private final String command;

  public GraphViewer(final String command) {
    this.command = command;
  }

  List<String> commandLine(Path file) {
    List<String> toReturn = new ArrayList<>(Arrays.asList(command.trim().split("\\s+")));
    toReturn.add(file.toString());
    return toReturn;
  }

  /**
   * Runs the viewer on {@code file} and waits for it to exit.
   *
   * @return the exit status of the viewer
   * @throws IOException if the viewer cannot be started, or the wait is interrupted
   */
  public int display(Path file) throws IOException {
    System.out.println("Trying '" + String.join(" ", commandLine(file)) + "'...");
    Process p = new ProcessBuilder(commandLine(file)).inheritIO().start();
    try {
      return p.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for " + command, e);
    }
  }
}
