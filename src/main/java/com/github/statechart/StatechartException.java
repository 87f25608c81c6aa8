package com.github.statechart;

/**
 * Unified single exception that's thrown and handled by this compiler. The idea is to use the code
 * enum to encapsulate the various failure conditions of every phase. The same type also carries
 * the soft degradations the generator reports without aborting, see
 * {@link CompilationResult#getDegradations()}.
 *
 * A line number of 0 means the failure has no source location.
 */
public final class StatechartException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final int lineNumber;
  private final String rawText;

  public StatechartException(final Code code, final String message) {
    this(code, message, 0, null);
  }

  public StatechartException(final Code code, final String message, final int lineNumber,
      final String rawText) {
    super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
    this.code = code;
    this.lineNumber = lineNumber;
    this.rawText = rawText;
  }

  public Code getCode() {
    return code;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getRawText() {
    return rawText;
  }

  /**
   * The compilation phase that reports a code.
   */
  public static enum Phase {
    CLASSIFICATION, PARSING, VALIDATION, GENERATION, CONFIGURATION;
  }

  public static enum Code {
    // 1.
    SYNTAX_ERROR(Phase.CLASSIFICATION, "Line does not match any statechart production"),
    // 2.
    UNSUPPORTED_CONSTRUCT(Phase.CLASSIFICATION,
        "Construct is recognized but not part of the supported statechart subset"),
    // 3.
    UNKNOWN_STATE(Phase.PARSING, "Reference to a state that is not declared in any enclosing scope"),
    // 4.
    NESTED_COMPOSITE(Phase.PARSING, "Composite states cannot be nested inside composite states"),
    // 5.
    UNBALANCED_BLOCK(Phase.PARSING, "Composite block braces are not balanced"),
    // 6.
    DUPLICATE_STATE(Phase.PARSING, "State is declared twice in the same scope"),
    // 7.
    NO_INITIAL_TRANSITION(Phase.VALIDATION, "Scope has no initial transition"),
    // 8.
    MULTIPLE_INITIAL_TRANSITIONS(Phase.VALIDATION, "Scope has more than one initial transition"),
    // 9.
    UNRESOLVED_TRANSITION_ENDPOINT(Phase.VALIDATION,
        "Transition endpoint does not name a state visible from its declaration"),
    // 10.
    HISTORY_ON_NON_COMPOSITE(Phase.VALIDATION, "History target does not belong to a composite state"),
    // 11.
    ACTION_STUB(Phase.GENERATION, "Action label was emitted as a manual-implementation stub"),
    // 12.
    GUARD_STUB(Phase.GENERATION, "Guard expression was emitted as a manual-implementation stub"),
    // 13.
    IGNORED_LABEL(Phase.GENERATION, "Label text without meaning for this transition was ignored"),
    // 14.
    GENERATION_FAILURE(Phase.GENERATION, "Code generation met a structurally impossible diagram"),
    // 15.
    INVALID_COMPILER_CONFIG(Phase.CONFIGURATION, "Compiler configuration is invalid");

    private final Phase phase;
    private final String description;

    private Code(final Phase phase, final String description) {
      this.phase = phase;
      this.description = description;
    }

    public Phase getPhase() {
      return phase;
    }

    public String getDescription() {
      return description;
    }
  }

}
