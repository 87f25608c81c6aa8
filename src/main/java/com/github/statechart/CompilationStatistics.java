package com.github.statechart;

/**
 * Simple statistics holder for one compilation run.
 */
public final class CompilationStatistics {
  private final long startMillis = System.currentTimeMillis();
  final String compilationId;
  int statements;
  int states;
  int composites;
  int transitions;
  int actionHooks;
  int degradations;
  int sourceLines;
  long elapsedMillis;

  CompilationStatistics(final String compilationId) {
    this.compilationId = compilationId;
  }

  public String getCompilationId() {
    return compilationId;
  }

  public int getStatements() {
    return statements;
  }

  /**
   * All declared states, composite children included.
   */
  public int getStates() {
    return states;
  }

  public int getComposites() {
    return composites;
  }

  public int getTransitions() {
    return transitions;
  }

  public int getActionHooks() {
    return actionHooks;
  }

  public int getDegradations() {
    return degradations;
  }

  public int getSourceLines() {
    return sourceLines;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  void finish() {
    elapsedMillis = System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "CompilationStatistics [compilationId=" + compilationId + ", statements=" + statements
        + ", states=" + states + ", composites=" + composites + ", transitions=" + transitions
        + ", actionHooks=" + actionHooks + ", degradations=" + degradations + ", sourceLines="
        + sourceLines + ", elapsedMillis=" + elapsedMillis + "]";
  }
}
