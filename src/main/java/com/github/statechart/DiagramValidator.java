package com.github.statechart;

import com.github.statechart.StatechartException.Code;

/**
 * Structural checks over a parsed diagram. The traversal is top-down (the top-level region first,
 * then every composite region in declaration order) and stops at the first violation.
 *
 * Validation also resolves transition endpoints. A named endpoint is looked up in the region that
 * declares the transition and then in the enclosing region, so a composite's children shadow
 * top-level states of the same name. Top-level transitions cannot see inside composites.
 */
final class DiagramValidator {

  void validate(final Diagram diagram) throws StatechartException {
    validateRegion(diagram, null);
    for (final State state : diagram.getStates().values()) {
      if (state.isComposite()) {
        validateRegion(state.getComposite(), diagram);
      }
    }
  }

  private void validateRegion(final Region region, final Diagram enclosing)
      throws StatechartException {
    Transition initial = null;
    for (final Transition transition : region.getTransitions()) {
      if (transition.isInitial()) {
        if (initial != null) {
          throw failure(Code.MULTIPLE_INITIAL_TRANSITIONS,
              describe(region) + " has more than one initial transition", transition);
        }
        initial = transition;
      }
    }
    if (initial == null) {
      final State owner = enclosing == null ? null : enclosing.getState(region.getOwnerName());
      throw new StatechartException(Code.NO_INITIAL_TRANSITION,
          describe(region) + " has no initial transition",
          owner == null ? 0 : owner.getLineNumber(), null);
    }

    for (final Transition transition : region.getTransitions()) {
      if (transition.isInitial()) {
        transition.resolve(transition.getSource(), resolveInitialTarget(region, transition));
      } else {
        transition.resolve(resolveNamed(transition.getSource(), region, enclosing, transition),
            resolveTarget(region, enclosing, transition));
      }
    }
  }

  private Endpoint resolveInitialTarget(final Region region, final Transition transition)
      throws StatechartException {
    final Endpoint target = transition.getTarget();
    if (!target.is(Endpoint.Kind.NAMED)) {
      throw failure(Code.UNSUPPORTED_CONSTRUCT,
          "Initial transition must target a state, not " + target, transition);
    }
    if (region.getState(target.getName()) == null) {
      throw failure(Code.UNRESOLVED_TRANSITION_ENDPOINT, "Initial transition target "
          + target.getName() + " is not declared in " + describe(region), transition);
    }
    return target.resolvedIn(target.getName(), region.getOwnerName());
  }

  private Endpoint resolveTarget(final Region region, final Diagram enclosing,
      final Transition transition) throws StatechartException {
    final Endpoint target = transition.getTarget();
    switch (target.getKind()) {
      case NAMED:
        return resolveNamed(target, region, enclosing, transition);
      case HISTORY:
        return resolveHistory(target, region, enclosing, transition);
      default:
        return target;
    }
  }

  private Endpoint resolveHistory(final Endpoint target, final Region region,
      final Diagram enclosing, final Transition transition) throws StatechartException {
    final Composite composite;
    if (target.getName() == null) {
      if (!(region instanceof Composite)) {
        throw failure(Code.HISTORY_ON_NON_COMPOSITE,
            "History target [H] is declared outside of any composite", transition);
      }
      composite = (Composite) region;
    } else {
      final Endpoint named =
          resolveNamed(Endpoint.named(target.getName()), region, enclosing, transition);
      final State state = named.getOwner() == null
          ? topLevel(region, enclosing).getState(named.getName())
          : region.getState(named.getName());
      if (!state.isComposite()) {
        throw failure(Code.HISTORY_ON_NON_COMPOSITE,
            "History target " + target + " names simple state " + state.getName(), transition);
      }
      composite = state.getComposite();
    }
    composite.enableHistory();
    return target.resolvedIn(composite.getOwnerName(), null);
  }

  private Endpoint resolveNamed(final Endpoint endpoint, final Region region,
      final Diagram enclosing, final Transition transition) throws StatechartException {
    if (region.getState(endpoint.getName()) != null) {
      return endpoint.resolvedIn(endpoint.getName(), region.getOwnerName());
    }
    if (enclosing != null && enclosing.getState(endpoint.getName()) != null) {
      return endpoint.resolvedIn(endpoint.getName(), enclosing.getOwnerName());
    }
    throw failure(Code.UNRESOLVED_TRANSITION_ENDPOINT,
        "Transition endpoint " + endpoint.getName() + " is not declared in a visible scope",
        transition);
  }

  private static Region topLevel(final Region region, final Diagram enclosing) {
    return enclosing == null ? region : enclosing;
  }

  private static String describe(final Region region) {
    return region.getOwnerName() == null ? "Top level" : "Composite " + region.getOwnerName();
  }

  private static StatechartException failure(final Code code, final String message,
      final Transition transition) {
    return new StatechartException(code, message, transition.getLineNumber(),
        transition.getRawText());
  }
}
