package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of a successful compilation: the generated source, the
 * fully qualified name of the class it declares, and the degradations the generator applied while
 * emitting it.
 *
 * Degradations are free-text actions or guards that could not be carried into the generated code
 * and were replaced by stubs. Each one is reported as a {@link StatechartException} value with a
 * generation-phase code and the line of the offending transition; none of them is ever thrown.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class CompilationResult {
  private final String source;
  private final String qualifiedClassName;
  private final List<StatechartException> degradations;
  private final CompilationStatistics statistics;

  CompilationResult(final String source, final String qualifiedClassName,
      final List<StatechartException> degradations, final CompilationStatistics statistics) {
    this.source = source;
    this.qualifiedClassName = qualifiedClassName;
    this.degradations = Collections.unmodifiableList(new ArrayList<>(degradations));
    this.statistics = statistics;
  }

  public String getSource() {
    return source;
  }

  public String getQualifiedClassName() {
    return qualifiedClassName;
  }

  public List<StatechartException> getDegradations() {
    return degradations;
  }

  public boolean isDegraded() {
    return !degradations.isEmpty();
  }

  public CompilationStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "CompilationResult [qualifiedClassName=" + qualifiedClassName + ", degradations="
        + degradations.size() + ", statistics=" + statistics + "]";
  }
}
