package edu.kyoto.fos.regdot.printer;

public enum LabelMode {
  // block name only
  SIMPLE,
  // block name and statements
  COMPLETE
}
