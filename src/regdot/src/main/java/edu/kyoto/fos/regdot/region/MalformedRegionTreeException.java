package edu.kyoto.fos.regdot.region;

/**
 * Raised when a region tree handed to the printer breaks the ownership contract of the
 * region analysis: a cycle in the parent chain, a block claimed twice, or a block owned by nobody.
 */
public class MalformedRegionTreeException extends IllegalStateException {
  public MalformedRegionTreeException(final String message) {
    super(message);
  }
}
