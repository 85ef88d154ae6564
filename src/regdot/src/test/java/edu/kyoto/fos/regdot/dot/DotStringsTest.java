package edu.kyoto.fos.regdot.dot;

import org.junit.Test;

import static org.junit.Assert.*;

public class DotStringsTest {

  @Test
  public void testRecordLabel() {
    assertEquals("bb1:\\l  if i \\>= 10 goto return\\l", DotStrings.escapeRecordLabel("bb1:\n  if i >= 10 goto return\n"));
    assertEquals("\\{a\\|b\\}", DotStrings.escapeRecordLabel("{a|b}"));
    assertEquals("say \\\"hi\\\"", DotStrings.escapeRecordLabel("say \"hi\""));
    assertEquals("a\\\\b", DotStrings.escapeRecordLabel("a\\b"));
    assertEquals("a  b", DotStrings.escapeRecordLabel("a\tb\r"));
  }

  @Test
  public void testQuote() {
    assertEquals("\"Region Graph\"", DotStrings.quote("Region Graph"));
    assertEquals("\"a\\\"b\"", DotStrings.quote("a\"b"));
  }
}
