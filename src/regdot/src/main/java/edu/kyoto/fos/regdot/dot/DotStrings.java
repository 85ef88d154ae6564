package edu.kyoto.fos.regdot.dot;

public final class DotStrings {
  private DotStrings() {
  }

  /**
   * Escapes text for use inside a quoted record label. Line breaks become left justified breaks.
   */
  public static String escapeRecordLabel(String label) {
    StringBuilder sb = new StringBuilder(label.length());
    for(int i = 0; i < label.length(); i++) {
      char c = label.charAt(i);
      switch(c) {
        case '\n':
          sb.append("\\l");
          break;
        case '\r':
          break;
        case '\t':
          sb.append("  ");
          break;
        case '\\':
        case '"':
        case '{':
        case '}':
        case '<':
        case '>':
        case '|':
          sb.append('\\').append(c);
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  public static String quote(String s) {
    return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
