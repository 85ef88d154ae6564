package edu.kyoto.fos.regdot.cfg;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public class Loop {
  private final BasicBlock header;
  private final Set<BasicBlock> all;
  private final Set<BasicBlock> body;

  public Loop(final BasicBlock header, final Set<BasicBlock> body) {
    this.header = header;
    this.all = new HashSet<>(body);
    this.all.add(header);
    this.body = Collections.unmodifiableSet(new HashSet<>(body));
  }

  // without the header
  public Collection<BasicBlock> body() {
    return body;
  }

  public Collection<BasicBlock> all() {
    return Collections.unmodifiableSet(all);
  }

  public boolean contains(BasicBlock bb) {
    return all.contains(bb);
  }

  public int size() {
    return all.size();
  }

  public BasicBlock getHeader() {
    return header;
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final Loop loop = (Loop) o;
    return Objects.equals(header, loop.header) && Objects.equals(body, loop.body);
  }

  @Override public int hashCode() {
    return Objects.hash(header, body);
  }

  @Override public String toString() {
    return "loop@" + header.getName();
  }
}
