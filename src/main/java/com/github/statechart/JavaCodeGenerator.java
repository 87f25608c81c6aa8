package com.github.statechart;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.lang.model.SourceVersion;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StatechartException.Code;

/**
 * Lowers a validated {@link Diagram} into the source of one self-contained Java class that runs
 * the statechart. The emitted class depends on {@code java.base} only.
 *
 * Layout of the emitted class:<br>
 * 1. {@code StateId}, one enum constant per state; children are qualified with their composite<br>
 * 2. {@code TRANSITIONS}, the transition table in declaration order. Order is load-bearing: the
 * first matching row of the innermost active state wins<br>
 * 3. lookup switches for parents, composites, history-capable composites and initial rows<br>
 * 4. the fixed dispatch runtime (run-to-completion, exit/entry sequencing, history slots,
 * completion transitions)<br>
 * 5. switches that route guards, effects and entry/exit/do actions to user code<br>
 * 6. one overridable no-op hook per distinct action name<br>
 *
 * Guards are copied verbatim and actions become hook calls. Text that cannot be carried over
 * safely is replaced by a commented stub and reported as a degradation instead of failing the
 * compilation.
 */
public final class JavaCodeGenerator {
  private static final Logger logger =
      LogManager.getLogger(JavaCodeGenerator.class.getSimpleName());

  private static final Pattern HOOK_CALL =
      Pattern.compile("^(" + LineClassifier.NAME + ")\\s*(?:\\(\\s*\\))?$");

  // members of the emitted class and of Object that a hook must not shadow
  private static final Set<String> RESERVED_NAMES = new HashSet<>(Arrays.asList("start",
      "dispatch", "getActiveState", "isActive", "isFinished", "setTracer", "select", "complete",
      "fire", "exitTo", "enterFrom", "enter", "commonAncestor", "trace", "parentOf", "isComposite",
      "hasHistory", "initialTransitionOf", "guard", "effect", "onEntry", "onExit", "process",
      "drainDeferred", "getClass",
      "hashCode", "equals", "clone", "toString", "notify", "notifyAll", "wait", "finalize",
      CompilerConfiguration.STATE_ID_TYPE, CompilerConfiguration.TRANSITION_ROW_TYPE,
      CompilerConfiguration.DEFERRED_EVENT_TYPE));

  private static final String ROW_TYPE =
      "  private static final int TARGET_STATE = 0;\n"
      + "  private static final int TARGET_HISTORY = 1;\n"
      + "  private static final int TARGET_FINAL = 2;\n"
      + "\n"
      + "  private static final class TransitionRow {\n"
      + "    final int id;\n"
      + "    final StateId source;\n"
      + "    final String event;\n"
      + "    final boolean guarded;\n"
      + "    final int targetKind;\n"
      + "    final StateId target;\n"
      + "\n"
      + "    TransitionRow(final int id, final StateId source, final String event,\n"
      + "        final boolean guarded, final int targetKind, final StateId target) {\n"
      + "      this.id = id;\n"
      + "      this.source = source;\n"
      + "      this.event = event;\n"
      + "      this.guarded = guarded;\n"
      + "      this.targetKind = targetKind;\n"
      + "      this.target = target;\n"
      + "    }\n"
      + "  }\n";

  private static final String RUNTIME =
      "  private StateId active;\n"
      + "  private boolean started;\n"
      + "  private boolean finished;\n"
      + "  private boolean busy;\n"
      + "  // events dispatched by actions, processed once the current step completed\n"
      + "  private final java.util.ArrayDeque<DeferredEvent> deferred = new java.util.ArrayDeque<>();\n"
      + "  // one history slot per composite, indexed by ordinal\n"
      + "  private final StateId[] history = new StateId[StateId.values().length];\n"
      + "  private java.util.function.Consumer<String> tracer;\n"
      + "\n"
      + "  /**\n"
      + "   * Receives \"enter X\" and \"exit X\" for every state entered or exited, in order.\n"
      + "   */\n"
      + "  public synchronized void setTracer(final java.util.function.Consumer<String> tracer) {\n"
      + "    this.tracer = tracer;\n"
      + "  }\n"
      + "\n"
      + "  /**\n"
      + "   * The active leaf state, or a composite whose region reached its final state. Null before\n"
      + "   * start and after the machine finished.\n"
      + "   */\n"
      + "  public synchronized StateId getActiveState() {\n"
      + "    return active;\n"
      + "  }\n"
      + "\n"
      + "  /**\n"
      + "   * True for the active leaf and for the composite containing it.\n"
      + "   */\n"
      + "  public synchronized boolean isActive(final StateId state) {\n"
      + "    for (StateId current = active; current != null; current = parentOf(current)) {\n"
      + "      if (current == state) {\n"
      + "        return true;\n"
      + "      }\n"
      + "    }\n"
      + "    return false;\n"
      + "  }\n"
      + "\n"
      + "  public synchronized boolean isFinished() {\n"
      + "    return finished;\n"
      + "  }\n"
      + "\n"
      + "  public void start() {\n"
      + "    start(null);\n"
      + "  }\n"
      + "\n"
      + "  /**\n"
      + "   * Fires the top-level initial transition. Only entry actions run.\n"
      + "   */\n"
      + "  public synchronized void start(final %CONTEXT% context) {\n"
      + "    if (started) {\n"
      + "      throw new IllegalStateException(\"State machine is already started\");\n"
      + "    }\n"
      + "    started = true;\n"
      + "    busy = true;\n"
      + "    try {\n"
      + "      final TransitionRow initial = TRANSITIONS[initialTransitionOf(null)];\n"
      + "      effect(initial.id);\n"
      + "      enterFrom(null, initial.target);\n"
      + "      complete(context);\n"
      + "      drainDeferred();\n"
      + "    } finally {\n"
      + "      deferred.clear();\n"
      + "      busy = false;\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  public boolean dispatch(final String event) {\n"
      + "    return dispatch(event, null);\n"
      + "  }\n"
      + "\n"
      + "  /**\n"
      + "   * Processes one event to completion. Returns true iff a transition fired. An event\n"
      + "   * dispatched from within an action is queued and processed after the current one; that\n"
      + "   * call returns false.\n"
      + "   */\n"
      + "  public synchronized boolean dispatch(final String event, final %CONTEXT% context) {\n"
      + "    if (!started) {\n"
      + "      throw new IllegalStateException(\"State machine is not started\");\n"
      + "    }\n"
      + "    if (finished || event == null) {\n"
      + "      return false;\n"
      + "    }\n"
      + "    if (busy) {\n"
      + "      deferred.add(new DeferredEvent(event, context));\n"
      + "      return false;\n"
      + "    }\n"
      + "    busy = true;\n"
      + "    try {\n"
      + "      final boolean fired = process(event, context);\n"
      + "      drainDeferred();\n"
      + "      return fired;\n"
      + "    } finally {\n"
      + "      deferred.clear();\n"
      + "      busy = false;\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  private boolean process(final String event, final %CONTEXT% context) {\n"
      + "    final TransitionRow selected = select(event, context);\n"
      + "    if (selected == null) {\n"
      + "      return false;\n"
      + "    }\n"
      + "    fire(selected);\n"
      + "    complete(context);\n"
      + "    return true;\n"
      + "  }\n"
      + "\n"
      + "  private void drainDeferred() {\n"
      + "    while (!finished && !deferred.isEmpty()) {\n"
      + "      final DeferredEvent next = deferred.poll();\n"
      + "      process(next.event, next.context);\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  // innermost state first, declaration order within a state; a null event selects\n"
      + "  // completion transitions\n"
      + "  private TransitionRow select(final String event, final %CONTEXT% context) {\n"
      + "    for (StateId scope = active; scope != null; scope = parentOf(scope)) {\n"
      + "      for (final TransitionRow row : TRANSITIONS) {\n"
      + "        if (row.source == scope\n"
      + "            && (event == null ? row.event == null : event.equals(row.event))\n"
      + "            && (!row.guarded || guard(row.id, context))) {\n"
      + "          return row;\n"
      + "        }\n"
      + "      }\n"
      + "      if (event == null) {\n"
      + "        // a composite completes only once its region reached the final state\n"
      + "        return null;\n"
      + "      }\n"
      + "    }\n"
      + "    return null;\n"
      + "  }\n"
      + "\n"
      + "  private void complete(final %CONTEXT% context) {\n"
      + "    for (int step = 0; !finished; step++) {\n"
      + "      final TransitionRow selected = select(null, context);\n"
      + "      if (selected == null) {\n"
      + "        return;\n"
      + "      }\n"
      + "      if (step == COMPLETION_STEP_LIMIT) {\n"
      + "        throw new IllegalStateException(\n"
      + "            \"Completion transitions did not settle within \" + COMPLETION_STEP_LIMIT\n"
      + "                + \" steps\");\n"
      + "      }\n"
      + "      fire(selected);\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  private void fire(final TransitionRow row) {\n"
      + "    if (row.targetKind == TARGET_FINAL) {\n"
      + "      final StateId region = parentOf(row.source);\n"
      + "      exitTo(region);\n"
      + "      effect(row.id);\n"
      + "      if (region == null) {\n"
      + "        active = null;\n"
      + "        finished = true;\n"
      + "      } else {\n"
      + "        active = region;\n"
      + "        history[region.ordinal()] = null;\n"
      + "      }\n"
      + "      return;\n"
      + "    }\n"
      + "    StateId target = row.target;\n"
      + "    if (row.targetKind == TARGET_HISTORY && history[target.ordinal()] != null) {\n"
      + "      target = history[target.ordinal()];\n"
      + "    }\n"
      + "    final StateId common = commonAncestor(row.source, target);\n"
      + "    exitTo(common);\n"
      + "    effect(row.id);\n"
      + "    enterFrom(common, target);\n"
      + "  }\n"
      + "\n"
      + "  private void exitTo(final StateId ancestor) {\n"
      + "    while (active != null && active != ancestor) {\n"
      + "      final StateId exiting = active;\n"
      + "      trace(\"exit \" + exiting);\n"
      + "      onExit(exiting);\n"
      + "      active = parentOf(exiting);\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  private void enterFrom(final StateId ancestor, final StateId target) {\n"
      + "    final java.util.ArrayDeque<StateId> path = new java.util.ArrayDeque<>();\n"
      + "    for (StateId state = target; state != null && state != ancestor;\n"
      + "        state = parentOf(state)) {\n"
      + "      path.push(state);\n"
      + "    }\n"
      + "    while (!path.isEmpty()) {\n"
      + "      enter(path.pop());\n"
      + "    }\n"
      + "    if (isComposite(target)) {\n"
      + "      final TransitionRow initial = TRANSITIONS[initialTransitionOf(target)];\n"
      + "      effect(initial.id);\n"
      + "      enter(initial.target);\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  private void enter(final StateId state) {\n"
      + "    active = state;\n"
      + "    final StateId parent = parentOf(state);\n"
      + "    if (parent != null && hasHistory(parent)) {\n"
      + "      history[parent.ordinal()] = state;\n"
      + "    }\n"
      + "    trace(\"enter \" + state);\n"
      + "    onEntry(state);\n"
      + "  }\n"
      + "\n"
      + "  // innermost composite strictly containing both states, null for the top level\n"
      + "  private static StateId commonAncestor(final StateId source, final StateId target) {\n"
      + "    for (StateId candidate = parentOf(source); candidate != null;\n"
      + "        candidate = parentOf(candidate)) {\n"
      + "      for (StateId container = parentOf(target); container != null;\n"
      + "          container = parentOf(container)) {\n"
      + "        if (container == candidate) {\n"
      + "          return candidate;\n"
      + "        }\n"
      + "      }\n"
      + "    }\n"
      + "    return null;\n"
      + "  }\n"
      + "\n"
      + "  private void trace(final String message) {\n"
      + "    if (tracer != null) {\n"
      + "      tracer.accept(message);\n"
      + "    }\n"
      + "  }\n"
      + "\n"
      + "  private static final class DeferredEvent {\n"
      + "    final String event;\n"
      + "    final %CONTEXT% context;\n"
      + "\n"
      + "    DeferredEvent(final String event, final %CONTEXT% context) {\n"
      + "      this.event = event;\n"
      + "      this.context = context;\n"
      + "    }\n"
      + "  }\n";

  private final CompilerConfiguration config;

  public JavaCodeGenerator(final CompilerConfiguration config) {
    this.config = config == null ? CompilerConfiguration.defaults() : config;
  }

  public CompilationResult generate(final Diagram diagram) throws StatechartException {
    return generate(diagram, new CompilationStatistics(UUID.randomUUID().toString()));
  }

  CompilationResult generate(final Diagram diagram, final CompilationStatistics statistics)
      throws StatechartException {
    if (diagram == null || !diagram.isValidated()) {
      throw new StatechartException(Code.GENERATION_FAILURE,
          "Diagram " + diagram + " was not validated");
    }
    final Emitter emitter = new Emitter(diagram, statistics);
    final String source = emitter.emit();
    statistics.states = emitter.constants.size();
    statistics.transitions = emitter.rows.size();
    statistics.actionHooks = emitter.hooks.size();
    statistics.degradations = emitter.degradations.size();
    statistics.sourceLines = source.split("\n", -1).length - 1;
    final String qualifiedName = config.getPackageName() == null ? emitter.className
        : config.getPackageName() + "." + emitter.className;
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(statistics) + "Generated " + qualifiedName + " with "
          + statistics.sourceLines + " lines");
    }
    return new CompilationResult(source, qualifiedName, emitter.degradations, statistics);
  }

  String resolveClassName(final Diagram diagram) {
    if (config.getClassName() != null) {
      return config.getClassName();
    }
    if (CompilerConfiguration.isUsableClassName(diagram.getName())) {
      return diagram.getName();
    }
    return CompilerConfiguration.DEFAULT_CLASS_NAME;
  }

  /**
   * A guard can be embedded when it cannot escape the return statement it is placed in.
   */
  static boolean isEmbeddableGuard(final String guard) {
    if (guard.contains(";") || guard.contains("{") || guard.contains("}")
        || guard.contains("//") || guard.contains("/*") || guard.contains("\\u")) {
      return false;
    }
    int parentheses = 0;
    int brackets = 0;
    char quote = 0;
    for (int index = 0; index < guard.length(); index++) {
      final char current = guard.charAt(index);
      if (quote != 0) {
        if (current == '\\') {
          index++;
        } else if (current == quote) {
          quote = 0;
        }
        continue;
      }
      switch (current) {
        case '"':
        case '\'':
          quote = current;
          break;
        case '(':
          parentheses++;
          break;
        case ')':
          parentheses--;
          break;
        case '[':
          brackets++;
          break;
        case ']':
          brackets--;
          break;
        default:
          break;
      }
      if (parentheses < 0 || brackets < 0) {
        return false;
      }
    }
    return quote == 0 && parentheses == 0 && brackets == 0;
  }

  static String javaString(final String text) {
    if (text == null) {
      return "null";
    }
    final StringBuilder builder = new StringBuilder("\"");
    for (int index = 0; index < text.length(); index++) {
      final char current = text.charAt(index);
      switch (current) {
        case '\\':
          builder.append("\\\\");
          break;
        case '"':
          builder.append("\\\"");
          break;
        case '\t':
          builder.append("\\t");
          break;
        default:
          if (current < 0x20) {
            builder.append(String.format("\\u%04x", (int) current));
          } else {
            builder.append(current);
          }
      }
    }
    return builder.append('"').toString();
  }

  // user text placed in comments must neither end the comment nor form a unicode escape
  static String commentText(final String text) {
    return text.trim().replace("\\", "\\\\").replace("*/", "* /").replace('\r', ' ')
        .replace('\n', ' ');
  }

  private static String prefix(final CompilationStatistics statistics) {
    return "[c:" + statistics.getCompilationId() + "] ";
  }

  /**
   * Per-run emission state. A generator instance itself holds nothing between runs.
   */
  private final class Emitter {
    private final Diagram diagram;
    private final CompilationStatistics statistics;
    private final String className;
    private final StringBuilder out = new StringBuilder();
    private final Map<State, String> constants = new IdentityHashMap<>();
    private final List<State> orderedStates = new ArrayList<>();
    private final List<Transition> rows = new ArrayList<>();
    private final Map<String, String> hooks = new LinkedHashMap<>();
    private final List<StatechartException> degradations = new ArrayList<>();

    private Emitter(final Diagram diagram, final CompilationStatistics statistics) {
      this.diagram = diagram;
      this.statistics = statistics;
      this.className = resolveClassName(diagram);
    }

    private String emit() throws StatechartException {
      assignConstants();
      collectRows();

      final String title = diagram.getName() == null ? className : diagram.getName();
      line("// Generated by statechart-compiler from \"" + commentText(title)
          + "\". Edit the diagram and regenerate instead of changing this file.");
      if (config.getPackageName() != null) {
        line("package " + config.getPackageName() + ";");
      }
      line("");
      line("/**");
      line(" * State machine for the \"" + commentText(title) + "\" statechart.");
      line(" *");
      line(" * <p>Call {@link #start()} once, then {@link #dispatch(String)} events. Actions are");
      line(" * protected no-op hooks meant to be overridden.");
      line(" */");
      line("public class " + className + " {");
      line("");
      emitStateIds();
      line("");
      line("  private static final int COMPLETION_STEP_LIMIT = " + config.getCompletionStepLimit()
          + ";");
      line("");
      out.append(ROW_TYPE);
      line("");
      emitTransitionTable();
      line("");
      emitLookups();
      out.append(RUNTIME.replace("%CONTEXT%", config.getContextType()));
      line("");
      emitGuards();
      line("");
      emitEffects();
      line("");
      emitStateActions(State.ActionKind.EXIT, "onExit");
      line("");
      emitStateActions(null, "onEntry");
      emitHooks();
      line("}");
      return out.toString();
    }

    private void assignConstants() {
      final Set<String> used = new HashSet<>();
      for (final State state : diagram.getStates().values()) {
        addConstant(state, state.getName(), used);
        if (state.isComposite()) {
          statistics.composites++;
          for (final State child : state.getComposite().getStates().values()) {
            addConstant(child, state.getName() + "_" + child.getName(), used);
          }
        }
      }
    }

    private void addConstant(final State state, final String base, final Set<String> used) {
      String candidate = SourceVersion.isKeyword(base) ? base + "_" : base;
      for (int suffix = 2; used.contains(candidate); suffix++) {
        candidate = base + "_" + suffix;
      }
      used.add(candidate);
      constants.put(state, candidate);
      orderedStates.add(state);
    }

    private void collectRows() {
      rows.addAll(diagram.getTransitions());
      for (final State state : diagram.getStates().values()) {
        if (state.isComposite()) {
          rows.addAll(state.getComposite().getTransitions());
        }
      }
      // stable, so transitions sharing a line keep their region order
      rows.sort(Comparator.comparingInt(Transition::getLineNumber));
    }

    private void emitStateIds() {
      line("  /**");
      line("   * Every declared state. Children carry their composite's name as prefix.");
      line("   */");
      line("  public enum " + CompilerConfiguration.STATE_ID_TYPE + " {");
      for (int index = 0; index < orderedStates.size(); index++) {
        final State state = orderedStates.get(index);
        line("    " + constants.get(state) + (index < orderedStates.size() - 1 ? "," : ""));
      }
      line("  }");
    }

    private void emitTransitionTable() throws StatechartException {
      line("  // declaration order; the first matching row of the innermost active state fires");
      line("  private static final TransitionRow[] TRANSITIONS = {");
      for (int id = 0; id < rows.size(); id++) {
        final Transition transition = rows.get(id);
        final String source =
            transition.isInitial() ? "null" : stateRef(diagram.lookup(transition.getSource()),
                transition);
        String event = transition.getEvent();
        boolean guarded = transition.getGuard() != null;
        if (transition.isInitial() && (event != null || guarded)) {
          degrade(Code.IGNORED_LABEL, "Event and guard of initial transition ignored", transition);
          event = null;
          guarded = false;
        }
        final String targetKind;
        final String target;
        switch (transition.getTarget().getKind()) {
          case FINAL:
            targetKind = "TARGET_FINAL";
            target = "null";
            break;
          case HISTORY:
            targetKind = "TARGET_HISTORY";
            target = stateRef(diagram.lookup(transition.getTarget()), transition);
            break;
          default:
            targetKind = "TARGET_STATE";
            target = stateRef(diagram.lookup(transition.getTarget()), transition);
            break;
        }
        line("    new TransitionRow(" + id + ", " + source + ", "
            + javaString(event) + ", " + guarded + ", " + targetKind + ", " + target + ")"
            + (id < rows.size() - 1 ? "," : "") + " // line " + transition.getLineNumber() + ": "
            + commentText(transition.getRawText()));
      }
      line("  };");
    }

    private void emitLookups() throws StatechartException {
      line("  private static StateId parentOf(final StateId state) {");
      line("    switch (state) {");
      for (final State state : diagram.getStates().values()) {
        if (state.isComposite() && !state.getComposite().getStates().isEmpty()) {
          for (final State child : state.getComposite().getStates().values()) {
            line("      case " + constants.get(child) + ":");
          }
          line("        return StateId." + constants.get(state) + ";");
        }
      }
      line("      default:");
      line("        return null;");
      line("    }");
      line("  }");
      line("");
      emitPredicate("isComposite", false);
      line("");
      emitPredicate("hasHistory", true);
      line("");
      line("  private static int initialTransitionOf(final StateId composite) {");
      line("    if (composite == null) {");
      line("      return " + rowOf(initialOf(diagram)) + ";");
      line("    }");
      line("    switch (composite) {");
      for (final State state : diagram.getStates().values()) {
        if (state.isComposite()) {
          line("      case " + constants.get(state) + ":");
          line("        return " + rowOf(initialOf(state.getComposite())) + ";");
        }
      }
      line("      default:");
      line("        throw new IllegalArgumentException(composite + \" is not a composite state\");");
      line("    }");
      line("  }");
      line("");
    }

    private void emitPredicate(final String method, final boolean historyOnly) {
      line("  private static boolean " + method + "(final StateId state) {");
      line("    switch (state) {");
      boolean any = false;
      for (final State state : diagram.getStates().values()) {
        if (state.isComposite() && (!historyOnly || state.getComposite().hasHistory())) {
          line("      case " + constants.get(state) + ":");
          any = true;
        }
      }
      if (any) {
        line("        return true;");
      }
      line("      default:");
      line("        return false;");
      line("    }");
      line("  }");
    }

    private void emitGuards() {
      final String contextType = config.getContextType();
      line("  private boolean guard(final int transition, final " + contextType + " context) {");
      line("    switch (transition) {");
      for (int id = 0; id < rows.size(); id++) {
        final Transition transition = rows.get(id);
        if (transition.getGuard() == null || transition.isInitial()) {
          continue;
        }
        line("      case " + id + ":");
        if (isEmbeddableGuard(transition.getGuard())) {
          line("        return (" + transition.getGuard() + ");");
        } else {
          degrade(Code.GUARD_STUB, "Guard [" + transition.getGuard()
              + "] cannot be embedded and never holds until implemented", transition);
          line("        // guard [" + commentText(transition.getGuard())
              + "] requires a manual implementation");
          line("        return false;");
        }
      }
      line("      default:");
      line("        return true;");
      line("    }");
      line("  }");
    }

    private void emitEffects() {
      line("  private void effect(final int transition) {");
      line("    switch (transition) {");
      for (int id = 0; id < rows.size(); id++) {
        final Transition transition = rows.get(id);
        if (transition.getAction() == null) {
          continue;
        }
        line("      case " + id + ":");
        line("        " + actionCall(transition.getAction(), transition.getLineNumber(),
            transition.getRawText()));
        line("        break;");
      }
      line("      default:");
      line("        break;");
      line("    }");
      line("  }");
    }

    /**
     * Exit actions for {@code EXIT}; entry then do actions when kind is null.
     */
    private void emitStateActions(final State.ActionKind kind, final String method) {
      line("  private void " + method + "(final StateId state) {");
      line("    switch (state) {");
      for (final State state : orderedStates) {
        final List<State.Action> actions = new ArrayList<>();
        if (kind == null) {
          actions.addAll(state.getActions(State.ActionKind.ENTRY));
          actions.addAll(state.getActions(State.ActionKind.DO));
        } else {
          actions.addAll(state.getActions(kind));
        }
        if (actions.isEmpty()) {
          continue;
        }
        line("      case " + constants.get(state) + ":");
        for (final State.Action action : actions) {
          line("        " + actionCall(action.getLabel(), action.getLineNumber(),
              action.getRawText()));
        }
        line("        break;");
      }
      line("      default:");
      line("        break;");
      line("    }");
      line("  }");
    }

    private void emitHooks() {
      for (final Map.Entry<String, String> hook : hooks.entrySet()) {
        line("");
        line("  /**");
        line("   * Action \"" + commentText(hook.getValue()) + "\". Override to implement it.");
        line("   */");
        line("  protected void " + hook.getKey() + "() {");
        line("  }");
      }
    }

    private String actionCall(final String label, final int lineNumber, final String rawText) {
      final Matcher matcher = HOOK_CALL.matcher(label.trim());
      if (matcher.matches()) {
        final String name = matcher.group(1);
        if (!SourceVersion.isKeyword(name) && !RESERVED_NAMES.contains(name)
            && !name.equals(className)) {
          if (!hooks.containsKey(name)) {
            hooks.put(name, label.trim());
          }
          return name + "();";
        }
      }
      degrade(Code.ACTION_STUB, "Action '" + label + "' is not a plain hook name", lineNumber,
          rawText);
      return "// action \"" + commentText(label) + "\" requires a manual implementation";
    }

    private Transition initialOf(final Region region) throws StatechartException {
      final Transition initial = region.getInitialTransition();
      if (initial == null) {
        throw new StatechartException(Code.GENERATION_FAILURE,
            "Region " + region.getOwnerName() + " of " + diagram + " has no initial transition");
      }
      return initial;
    }

    private int rowOf(final Transition transition) {
      for (int id = 0; id < rows.size(); id++) {
        if (rows.get(id) == transition) {
          return id;
        }
      }
      throw new IllegalStateException(transition + " is not in the transition table");
    }

    private String stateRef(final State state, final Transition transition)
        throws StatechartException {
      if (state == null || !constants.containsKey(state)) {
        throw new StatechartException(Code.GENERATION_FAILURE,
            "Unresolved endpoint in " + transition, transition.getLineNumber(),
            transition.getRawText());
      }
      return "StateId." + constants.get(state);
    }

    private void degrade(final Code code, final String message, final Transition transition) {
      degrade(code, message, transition.getLineNumber(), transition.getRawText());
    }

    private void degrade(final Code code, final String message, final int lineNumber,
        final String rawText) {
      final StatechartException degradation =
          new StatechartException(code, message, lineNumber, rawText);
      degradations.add(degradation);
      logger.warn(prefix(statistics) + degradation.getMessage());
    }

    private void line(final String text) {
      out.append(text).append('\n');
    }
  }
}
