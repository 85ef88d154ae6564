package edu.kyoto.fos.regdot;

public interface Printable {
  void printAt(int level, StringBuilder b);
  // two spaces per level
  default StringBuilder indent(int i, StringBuilder b) {
    for(int j = 0; j < i; j++) {
      b.append("  ");
    }
    return b;
  }
}
