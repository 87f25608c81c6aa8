package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A container of states and of the transitions declared inside it: the diagram itself or the
 * region of a composite state. States are kept in declaration order, and so are transitions since
 * their order decides which one fires.
 */
public abstract class Region {
  private final Map<String, State> states = new LinkedHashMap<>();
  private final List<Transition> transitions = new ArrayList<>();
  private boolean sealed;

  public Map<String, State> getStates() {
    return Collections.unmodifiableMap(states);
  }

  public List<Transition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public State getState(final String name) {
    return states.get(name);
  }

  /**
   * The single initial transition, once validation has established there is exactly one.
   */
  public Transition getInitialTransition() {
    for (final Transition transition : transitions) {
      if (transition.isInitial()) {
        return transition;
      }
    }
    return null;
  }

  /**
   * Name of the composite state owning this region, null for the diagram.
   */
  public abstract String getOwnerName();

  void addState(final State state) {
    checkNotSealed();
    states.put(state.getName(), state);
  }

  void addTransition(final Transition transition) {
    checkNotSealed();
    transitions.add(transition);
  }

  void seal() {
    sealed = true;
    for (final Transition transition : transitions) {
      transition.seal();
    }
    for (final State state : states.values()) {
      state.seal();
    }
  }

  boolean isSealed() {
    return sealed;
  }

  void checkNotSealed() {
    if (sealed) {
      throw new IllegalStateException("Region " + getOwnerName() + " is sealed");
    }
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final Region other = (Region) obj;
    return Objects.equals(getOwnerName(), other.getOwnerName())
        && new ArrayList<>(states.values()).equals(new ArrayList<>(other.states.values()))
        && transitions.equals(other.transitions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getOwnerName(), states.keySet(), transitions);
  }
}
