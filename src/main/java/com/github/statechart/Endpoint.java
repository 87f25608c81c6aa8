package com.github.statechart;

import java.util.Objects;

/**
 * One end of a transition: either a named state or one of the pseudostate markers. Pseudostates
 * are never states, so they carry no entry/exit behavior.
 *
 * A named endpoint becomes resolved during validation, at which point {@link #getOwner()} names
 * the composite whose region holds the state, or null for the top level. A history endpoint
 * names the composite whose history it resumes; the bare {@code [H]} form gets that name during
 * validation.
 */
public final class Endpoint {
  private static final Endpoint INITIAL = new Endpoint(Kind.INITIAL, null, null, true);
  private static final Endpoint FINAL = new Endpoint(Kind.FINAL, null, null, true);

  private final Kind kind;
  private final String name;
  private final String owner;
  private final boolean resolved;

  public static enum Kind {
    NAMED, INITIAL, FINAL, HISTORY;
  }

  public static Endpoint named(final String name) {
    return new Endpoint(Kind.NAMED, Objects.requireNonNull(name), null, false);
  }

  public static Endpoint initial() {
    return INITIAL;
  }

  public static Endpoint finalState() {
    return FINAL;
  }

  /**
   * History of the given composite, or of the enclosing composite when the name is null.
   */
  public static Endpoint history(final String composite) {
    return new Endpoint(Kind.HISTORY, composite, null, false);
  }

  Endpoint resolvedIn(final String resolvedName, final String resolvedOwner) {
    return new Endpoint(kind, resolvedName, resolvedOwner, true);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean is(final Kind other) {
    return kind == other;
  }

  public String getName() {
    return name;
  }

  public String getOwner() {
    return owner;
  }

  public boolean isResolved() {
    return resolved;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Endpoint)) {
      return false;
    }
    final Endpoint other = (Endpoint) obj;
    return kind == other.kind && resolved == other.resolved && Objects.equals(name, other.name)
        && Objects.equals(owner, other.owner);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, owner, resolved);
  }

  @Override
  public String toString() {
    switch (kind) {
      case INITIAL:
      case FINAL:
        return "[*]";
      case HISTORY:
        return name == null ? "[H]" : name + "[H]";
      default:
        return owner == null ? name : owner + "." + name;
    }
  }

  private Endpoint(final Kind kind, final String name, final String owner, final boolean resolved) {
    this.kind = kind;
    this.name = name;
    this.owner = owner;
    this.resolved = resolved;
  }
}
