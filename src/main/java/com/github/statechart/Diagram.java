package com.github.statechart;

import java.util.Objects;

/**
 * Root of the abstract syntax tree: the top-level region plus the diagram name taken from the
 * {@code @startuml} line. Built once per compilation and sealed after validation.
 */
public final class Diagram extends Region {
  private final String name;

  Diagram(final String name) {
    this.name = name;
  }

  /**
   * Diagram title, null when the start marker carries none.
   */
  public String getName() {
    return name;
  }

  @Override
  public String getOwnerName() {
    return null;
  }

  public boolean isValidated() {
    return isSealed();
  }

  /**
   * Looks up the state an endpoint resolved to, null for pseudostates or unresolved endpoints.
   */
  public State lookup(final Endpoint endpoint) {
    if (!endpoint.isResolved()) {
      return null;
    }
    switch (endpoint.getKind()) {
      case NAMED:
        if (endpoint.getOwner() == null) {
          return getState(endpoint.getName());
        }
        final State owner = getState(endpoint.getOwner());
        return owner == null || !owner.isComposite() ? null
            : owner.getComposite().getState(endpoint.getName());
      case HISTORY:
        return getState(endpoint.getName());
      default:
        return null;
    }
  }

  @Override
  public boolean equals(final Object obj) {
    return super.equals(obj) && Objects.equals(name, ((Diagram) obj).name);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Objects.hashCode(name);
  }

  @Override
  public String toString() {
    return "Diagram [name=" + name + ", states=" + getStates().keySet() + ", transitions="
        + getTransitions().size() + "]";
  }
}
