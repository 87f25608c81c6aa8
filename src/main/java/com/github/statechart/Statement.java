package com.github.statechart;

/**
 * One classified line of diagram text. Only the fields meaningful for the statement's type are
 * set, everything else is null.
 */
public final class Statement {
  private final Type type;
  private final int lineNumber;
  private final String rawText;
  private final String name;
  private final Endpoint source;
  private final Endpoint target;
  private final String event;
  private final String guard;
  private final String label;
  private final State.ActionKind actionKind;

  public static enum Type {
    DIAGRAM_START, STATE_DECL, COMPOSITE_OPEN, COMPOSITE_CLOSE, TRANSITION, INTERNAL_ACTION,
    IGNORABLE;
  }

  static Statement diagramStart(final int lineNumber, final String rawText, final String name) {
    return new Statement(Type.DIAGRAM_START, lineNumber, rawText, name, null, null, null, null,
        null, null);
  }

  static Statement stateDecl(final int lineNumber, final String rawText, final String name) {
    return new Statement(Type.STATE_DECL, lineNumber, rawText, name, null, null, null, null, null,
        null);
  }

  static Statement compositeOpen(final int lineNumber, final String rawText, final String name) {
    return new Statement(Type.COMPOSITE_OPEN, lineNumber, rawText, name, null, null, null, null,
        null, null);
  }

  static Statement compositeClose(final int lineNumber, final String rawText) {
    return new Statement(Type.COMPOSITE_CLOSE, lineNumber, rawText, null, null, null, null, null,
        null, null);
  }

  static Statement transition(final int lineNumber, final String rawText, final Endpoint source,
      final Endpoint target, final String event, final String guard, final String action) {
    return new Statement(Type.TRANSITION, lineNumber, rawText, null, source, target, event, guard,
        action, null);
  }

  static Statement internalAction(final int lineNumber, final String rawText, final String state,
      final State.ActionKind kind, final String label) {
    return new Statement(Type.INTERNAL_ACTION, lineNumber, rawText, state, null, null, null, null,
        label, kind);
  }

  static Statement ignorable(final int lineNumber, final String rawText) {
    return new Statement(Type.IGNORABLE, lineNumber, rawText, null, null, null, null, null, null,
        null);
  }

  public Type getType() {
    return type;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getRawText() {
    return rawText;
  }

  /**
   * State name for declarations, block opens and internal actions; diagram title for the start
   * marker.
   */
  public String getName() {
    return name;
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

  /**
   * Effect action of a transition or the label of an internal action.
   */
  public String getLabel() {
    return label;
  }

  public State.ActionKind getActionKind() {
    return actionKind;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("Statement [").append(type).append(", line=")
        .append(lineNumber);
    if (name != null) {
      builder.append(", name=").append(name);
    }
    if (source != null) {
      builder.append(", ").append(source).append("-->").append(target);
      builder.append(", event=").append(event).append(", guard=").append(guard);
    }
    if (label != null) {
      builder.append(", label=").append(label);
    }
    if (actionKind != null) {
      builder.append(", kind=").append(actionKind);
    }
    return builder.append("]").toString();
  }

  private Statement(final Type type, final int lineNumber, final String rawText, final String name,
      final Endpoint source, final Endpoint target, final String event, final String guard,
      final String label, final State.ActionKind actionKind) {
    this.type = type;
    this.lineNumber = lineNumber;
    this.rawText = rawText;
    this.name = name;
    this.source = source;
    this.target = target;
    this.event = event;
    this.guard = guard;
    this.label = label;
    this.actionKind = actionKind;
  }
}
