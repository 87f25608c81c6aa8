package com.github.statechart;

import java.util.Objects;

/**
 * A transition as declared in the diagram. Event, guard and action are opaque text: the compiler
 * never interprets them, the generator hands them through to the emitted machine.
 *
 * Endpoints are rewritten once, by the validator, to their resolved form. After the owning diagram
 * is sealed a transition no longer changes.
 */
public final class Transition {
  private Endpoint source;
  private Endpoint target;
  private final String event;
  private final String guard;
  private final String action;
  private final String scope;
  private final int lineNumber;
  private final String rawText;
  private boolean sealed;

  Transition(final Statement statement, final String scope) {
    this.source = statement.getSource();
    this.target = statement.getTarget();
    this.event = statement.getEvent();
    this.guard = statement.getGuard();
    this.action = statement.getLabel();
    this.scope = scope;
    this.lineNumber = statement.getLineNumber();
    this.rawText = statement.getRawText();
  }

  public Endpoint getSource() {
    return source;
  }

  public Endpoint getTarget() {
    return target;
  }

  public String getEvent() {
    return event;
  }

  public String getGuard() {
    return guard;
  }

  public String getAction() {
    return action;
  }

  /**
   * Name of the composite whose block declares this transition, null for the top level.
   */
  public String getScope() {
    return scope;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getRawText() {
    return rawText;
  }

  public boolean isInitial() {
    return source.is(Endpoint.Kind.INITIAL);
  }

  void resolve(final Endpoint resolvedSource, final Endpoint resolvedTarget) {
    if (sealed) {
      throw new IllegalStateException("Transition at line " + lineNumber + " is sealed");
    }
    this.source = resolvedSource;
    this.target = resolvedTarget;
  }

  void seal() {
    sealed = true;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    final Transition other = (Transition) obj;
    return lineNumber == other.lineNumber && Objects.equals(source, other.source)
        && Objects.equals(target, other.target) && Objects.equals(event, other.event)
        && Objects.equals(guard, other.guard) && Objects.equals(action, other.action)
        && Objects.equals(scope, other.scope);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, event, guard, action, scope, lineNumber);
  }

  @Override
  public String toString() {
    return "Transition [line=" + lineNumber + ", source=" + source + ", target=" + target
        + ", event=" + event + ", guard=" + guard + ", action=" + action + "]";
  }
}
