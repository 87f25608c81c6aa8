package com.github.statechart;

/**
 * Compiles statechart diagrams written in a PlantUML subset into self-contained Java state
 * machines.
 *
 * Notes for users:<br>
 * 1. a compiler instance holds nothing between runs, so one instance may serve concurrent
 * callers<br>
 * 2. every run is tagged with its own compilation id which prefixes its log lines and is reported
 * in the {@link CompilationStatistics}<br>
 * 3. the first error aborts a run and there is no partial output. Degradations are not errors:
 * they are reported with the result<br>
 */
public interface StatechartCompiler {

  /**
   * Classify, parse, validate and generate. Returns the generated source together with the
   * degradations applied while generating it.
   */
  CompilationResult compile(final String diagramText) throws StatechartException;

  /**
   * Classify, parse and validate only. The returned diagram is sealed.
   */
  Diagram parse(final String diagramText) throws StatechartException;

  /**
   * Reports the id of this compiler instance.
   */
  String getId();

  /**
   * Returns the config that this compiler is wired with.
   */
  CompilerConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class StatechartCompilerBuilder {
    private CompilerConfiguration config;

    public static StatechartCompilerBuilder newBuilder() {
      return new StatechartCompilerBuilder();
    }

    public StatechartCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    public StatechartCompiler build() {
      return new StatechartCompilerImpl(config);
    }

    private StatechartCompilerBuilder() {}
  }

}
