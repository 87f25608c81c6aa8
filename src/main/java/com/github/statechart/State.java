package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A state of the diagram. Its name is unique within its parent region only. Action labels are
 * opaque; several lines of the same kind accumulate in declaration order.
 */
public final class State {
  private final String name;
  private final int lineNumber;
  private final Map<ActionKind, List<Action>> actions = new EnumMap<>(ActionKind.class);
  private Composite composite;
  private boolean sealed;

  /**
   * Kinds of internal actions a state may declare.
   */
  public static enum ActionKind {
    ENTRY, EXIT, DO;

    static ActionKind fromKeyword(final String keyword) {
      return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
  }

  /**
   * One internal action line: the opaque label plus where it was declared.
   */
  public static final class Action {
    private final String label;
    private final int lineNumber;
    private final String rawText;

    Action(final String label, final int lineNumber, final String rawText) {
      this.label = label;
      this.lineNumber = lineNumber;
      this.rawText = rawText;
    }

    public String getLabel() {
      return label;
    }

    public int getLineNumber() {
      return lineNumber;
    }

    public String getRawText() {
      return rawText;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Action)) {
        return false;
      }
      final Action other = (Action) obj;
      return label.equals(other.label) && lineNumber == other.lineNumber;
    }

    @Override
    public int hashCode() {
      return Objects.hash(label, lineNumber);
    }

    @Override
    public String toString() {
      return "Action [label=" + label + ", line=" + lineNumber + "]";
    }
  }

  State(final String name, final int lineNumber) {
    this.name = name;
    this.lineNumber = lineNumber;
    for (final ActionKind kind : ActionKind.values()) {
      actions.put(kind, new ArrayList<>());
    }
  }

  public String getName() {
    return name;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public List<Action> getActions(final ActionKind kind) {
    return Collections.unmodifiableList(actions.get(kind));
  }

  public List<String> getActionLabels(final ActionKind kind) {
    final List<String> labels = new ArrayList<>();
    for (final Action action : actions.get(kind)) {
      labels.add(action.getLabel());
    }
    return labels;
  }

  public boolean isComposite() {
    return composite != null;
  }

  /**
   * The region of this state, null for a simple state.
   */
  public Composite getComposite() {
    return composite;
  }

  void addAction(final ActionKind kind, final String label, final int actionLine,
      final String rawText) {
    checkNotSealed();
    actions.get(kind).add(new Action(label, actionLine, rawText));
  }

  Composite makeComposite() {
    checkNotSealed();
    composite = new Composite(name);
    return composite;
  }

  void seal() {
    sealed = true;
    if (composite != null) {
      composite.seal();
    }
  }

  private void checkNotSealed() {
    if (sealed) {
      throw new IllegalStateException("State " + name + " is sealed");
    }
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof State)) {
      return false;
    }
    final State other = (State) obj;
    return name.equals(other.name) && lineNumber == other.lineNumber
        && actions.equals(other.actions) && Objects.equals(composite, other.composite);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, lineNumber, actions);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", line=" + lineNumber + ", composite=" + isComposite() + "]";
  }
}
