package edu.kyoto.fos.regdot.printer;

public enum OutputMode {
  PRINT,
  VIEW
}
