package com.github.statechart;

import javax.lang.model.SourceVersion;

/**
 * This class encapsulates all the configuration parameters of the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If className is not set, the generated class is named after the diagram title and falls back
 * to {@value #DEFAULT_CLASS_NAME} for untitled diagrams.<br>
 * 2. contextType is the declared type of the context handed to guard expressions. Guards see it
 * as the variable {@code context}.<br>
 * 3. completionStepLimit bounds the number of completion transitions fired in a row before the
 * generated machine gives up; non-positive values select the default of
 * {@value #DEFAULT_COMPLETION_STEP_LIMIT}.<br>
 */
public final class CompilerConfiguration {
  public static final String DEFAULT_CLASS_NAME = "StateMachine";
  public static final String DEFAULT_CONTEXT_TYPE = "Object";
  public static final int DEFAULT_COMPLETION_STEP_LIMIT = 100;

  // nested type names the generated class declares for itself
  static final String STATE_ID_TYPE = "StateId";
  static final String TRANSITION_ROW_TYPE = "TransitionRow";
  static final String DEFERRED_EVENT_TYPE = "DeferredEvent";

  private final String className;
  private final String packageName;
  private final String contextType;
  private final int completionStepLimit;

  public String getClassName() {
    return className;
  }

  public String getPackageName() {
    return packageName;
  }

  public String getContextType() {
    return contextType;
  }

  public int getCompletionStepLimit() {
    return completionStepLimit;
  }

  public static CompilerConfiguration defaults() {
    return new CompilerConfiguration(null, null, null, 0);
  }

  public final static class CompilerConfigurationBuilder {
    private String className;
    private String packageName;
    private String contextType;
    private int completionStepLimit;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder className(final String className) {
      this.className = className;
      return this;
    }

    public CompilerConfigurationBuilder packageName(final String packageName) {
      this.packageName = packageName;
      return this;
    }

    public CompilerConfigurationBuilder contextType(final String contextType) {
      this.contextType = contextType;
      return this;
    }

    public CompilerConfigurationBuilder completionStepLimit(final int completionStepLimit) {
      this.completionStepLimit = completionStepLimit;
      return this;
    }

    public CompilerConfiguration build() throws StatechartException {
      final CompilerConfiguration config =
          new CompilerConfiguration(className, packageName, contextType, completionStepLimit);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  static boolean isUsableClassName(final String name) {
    return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name)
        && !STATE_ID_TYPE.equals(name) && !TRANSITION_ROW_TYPE.equals(name)
        && !DEFERRED_EVENT_TYPE.equals(name);
  }

  private void validate() throws StatechartException {
    final StringBuilder messages = new StringBuilder();
    if (className != null && !isUsableClassName(className)) {
      messages.append("className '").append(className)
          .append("' is not a usable Java class name. ");
    }
    if (packageName != null && !SourceVersion.isName(packageName)) {
      messages.append("packageName '").append(packageName)
          .append("' is not a valid Java package name. ");
    }
    if (contextType.trim().isEmpty()) {
      messages.append("contextType cannot be blank. ");
    } else if (SourceVersion.isKeyword(contextType.trim())) {
      // primitives cannot take the null context of start() and dispatch(String)
      messages.append("contextType '").append(contextType).append("' must be a reference type. ");
    }
    if (messages.length() > 0) {
      throw new StatechartException(StatechartException.Code.INVALID_COMPILER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [className=" + className + ", packageName=" + packageName
        + ", contextType=" + contextType + ", completionStepLimit=" + completionStepLimit + "]";
  }

  private CompilerConfiguration(final String className, final String packageName,
      final String contextType, final int completionStepLimit) {
    this.className = className;
    this.packageName = packageName;
    this.contextType = contextType == null ? DEFAULT_CONTEXT_TYPE : contextType;
    if (completionStepLimit <= 0) {
      this.completionStepLimit = DEFAULT_COMPLETION_STEP_LIMIT;
    } else {
      this.completionStepLimit = completionStepLimit;
    }
  }

}
