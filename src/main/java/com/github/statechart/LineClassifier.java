package com.github.statechart;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StatechartException.Code;

/**
 * Turns raw diagram text into classified statements, one per line. Matching is syntax-directed on
 * the fixed separators of the notation; a line that matches nothing fails with
 * {@link Code#SYNTAX_ERROR} and a line that matches a construct outside the supported subset fails
 * with {@link Code#UNSUPPORTED_CONSTRUCT}.
 *
 * Instances hold no state between calls and may be shared.
 */
public final class LineClassifier {
  private static final Logger logger = LogManager.getLogger(LineClassifier.class.getSimpleName());

  static final String NAME = "[\\p{L}_][\\p{L}\\p{Nd}_]*";
  private static final String ENDPOINT = "\\[\\*\\]|\\[H\\*?\\]|" + NAME + "(?:\\[H\\*?\\])?";
  private static final String ARROW = "-+(?:up|down|left|right|u|d|l|r)?-*>";

  private static final Pattern START_MARKER = Pattern.compile("^@startuml(?:\\s+(.*))?$");
  private static final Pattern END_MARKER = Pattern.compile("^@enduml\\b.*$");
  private static final Pattern STATE = Pattern.compile("^state\\s+(?:\"[^\"]*\"\\s+as\\s+)?(" + NAME
      + ")\\s*(<<[^>]*>>)?\\s*(?:#\\S+)?\\s*(\\{)?$");
  private static final Pattern TRANSITION = Pattern.compile(
      "^(" + ENDPOINT + ")\\s*" + ARROW + "\\s*(" + ENDPOINT + ")\\s*(?::(.*))?$");
  private static final Pattern INTERNAL_ACTION =
      Pattern.compile("^(" + NAME + ")\\s*:\\s*((?i:entry|exit|do))\\s*[:/]\\s*(.*)$");
  private static final Pattern DIRECTIVE = Pattern.compile(
      "^(?:scale|skinparam|hide|show|title|caption|header|footer|allowmixing|left to right direction|top to bottom direction)\\b.*$");
  private static final Pattern SKINPARAM_BLOCK = Pattern.compile("^skinparam\\b.*\\{$");
  private static final Pattern REGION_SEPARATOR = Pattern.compile("^(?:-{2,}|\\|{2,})$");
  private static final Pattern HISTORY_SUFFIX = Pattern.compile("^(" + NAME + ")\\[H\\]$");

  // multi-line constructs whose content is skipped
  private static enum Skip {
    NONE, BLOCK_COMMENT, NOTE, LEGEND, SKINPARAM;
  }

  public List<Statement> classify(final String text) throws StatechartException {
    if (text == null) {
      throw new StatechartException(Code.SYNTAX_ERROR, "Diagram text is null");
    }
    final String[] lines = text.split("\r?\n", -1);
    final boolean delimited = hasStartMarker(lines);
    final List<Statement> statements = new ArrayList<>(lines.length);
    boolean inBody = !delimited;
    boolean ended = false;
    Skip skip = Skip.NONE;

    for (int index = 0; index < lines.length; index++) {
      final int lineNumber = index + 1;
      final String rawText = lines[index];
      final String line = rawText.trim();

      if (ended || (!inBody && !START_MARKER.matcher(line).matches())) {
        statements.add(Statement.ignorable(lineNumber, rawText));
        continue;
      }
      if (skip != Skip.NONE) {
        if (endsSkip(skip, line)) {
          skip = Skip.NONE;
        }
        statements.add(Statement.ignorable(lineNumber, rawText));
        continue;
      }

      final Matcher start = START_MARKER.matcher(line);
      if (start.matches()) {
        inBody = true;
        final String title = start.group(1) == null ? null : start.group(1).trim();
        statements.add(Statement.diagramStart(lineNumber, rawText,
            title == null || title.isEmpty() ? null : title));
        continue;
      }
      if (END_MARKER.matcher(line).matches()) {
        ended = true;
        statements.add(Statement.ignorable(lineNumber, rawText));
        continue;
      }

      skip = startsSkip(line);
      if (skip != Skip.NONE || isIgnorable(line)) {
        statements.add(Statement.ignorable(lineNumber, rawText));
        continue;
      }

      statements.add(classifyLine(line, lineNumber, rawText, statements));
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Classified " + lines.length + " lines into " + statements.size()
          + " statements");
    }
    return statements;
  }

  private Statement classifyLine(final String line, final int lineNumber, final String rawText,
      final List<Statement> previous) throws StatechartException {
    if ("}".equals(line)) {
      return Statement.compositeClose(lineNumber, rawText);
    }
    if ("{".equals(line)) {
      return braceOnOwnLine(lineNumber, rawText, previous);
    }
    if (REGION_SEPARATOR.matcher(line).matches()) {
      throw new StatechartException(Code.UNSUPPORTED_CONSTRUCT,
          "Orthogonal regions are not supported", lineNumber, rawText);
    }
    if (line.contains("[H*]")) {
      throw new StatechartException(Code.UNSUPPORTED_CONSTRUCT, "Deep history is not supported",
          lineNumber, rawText);
    }

    Matcher matcher = STATE.matcher(line);
    if (matcher.matches()) {
      if (matcher.group(2) != null) {
        throw new StatechartException(Code.UNSUPPORTED_CONSTRUCT,
            "Stereotyped state " + matcher.group(2) + " is not supported", lineNumber, rawText);
      }
      return matcher.group(3) != null
          ? Statement.compositeOpen(lineNumber, rawText, matcher.group(1))
          : Statement.stateDecl(lineNumber, rawText, matcher.group(1));
    }

    matcher = TRANSITION.matcher(line);
    if (matcher.matches()) {
      final Endpoint source = endpoint(matcher.group(1), true, lineNumber, rawText);
      final Endpoint target = endpoint(matcher.group(2), false, lineNumber, rawText);
      final String[] label = splitLabel(matcher.group(3), lineNumber, rawText);
      return Statement.transition(lineNumber, rawText, source, target, label[0], label[1],
          label[2]);
    }

    matcher = INTERNAL_ACTION.matcher(line);
    if (matcher.matches()) {
      final String label = matcher.group(3).trim();
      if (label.isEmpty()) {
        throw new StatechartException(Code.SYNTAX_ERROR,
            "Internal action of " + matcher.group(1) + " has no label", lineNumber, rawText);
      }
      return Statement.internalAction(lineNumber, rawText, matcher.group(1),
          State.ActionKind.fromKeyword(matcher.group(2)), label);
    }

    if (DIRECTIVE.matcher(line).matches()) {
      return Statement.ignorable(lineNumber, rawText);
    }
    throw new StatechartException(Code.SYNTAX_ERROR, "Unrecognized statement: " + line, lineNumber,
        rawText);
  }

  /**
   * A lone opening brace turns the state declared on the previous statement line into a block.
   */
  private Statement braceOnOwnLine(final int lineNumber, final String rawText,
      final List<Statement> previous) throws StatechartException {
    for (int index = previous.size() - 1; index >= 0; index--) {
      final Statement statement = previous.get(index);
      if (statement.getType() == Statement.Type.IGNORABLE) {
        continue;
      }
      if (statement.getType() == Statement.Type.STATE_DECL) {
        previous.set(index, Statement.compositeOpen(statement.getLineNumber(),
            statement.getRawText(), statement.getName()));
        return Statement.ignorable(lineNumber, rawText);
      }
      break;
    }
    throw new StatechartException(Code.SYNTAX_ERROR, "Opening brace does not follow a state",
        lineNumber, rawText);
  }

  private static Endpoint endpoint(final String text, final boolean source, final int lineNumber,
      final String rawText) throws StatechartException {
    if ("[*]".equals(text)) {
      return source ? Endpoint.initial() : Endpoint.finalState();
    }
    final Matcher history = HISTORY_SUFFIX.matcher(text);
    if ("[H]".equals(text) || history.matches()) {
      if (source) {
        throw new StatechartException(Code.UNSUPPORTED_CONSTRUCT,
            "History pseudostate cannot be a transition source", lineNumber, rawText);
      }
      return Endpoint.history(history.matches() ? history.group(1) : null);
    }
    return Endpoint.named(text);
  }

  /**
   * Splits {@code event [guard] / action} into its three optional parts.
   */
  static String[] splitLabel(final String label, final int lineNumber, final String rawText)
      throws StatechartException {
    final String[] parts = new String[3];
    if (label == null) {
      return parts;
    }
    final String text = label.trim();
    final int slash = actionSeparator(text);
    final String head = slash < 0 ? text : text.substring(0, slash);
    if (slash >= 0) {
      parts[2] = emptyToNull(text.substring(slash + 1));
    }
    final int open = head.indexOf('[');
    if (open < 0) {
      parts[0] = emptyToNull(head);
      return parts;
    }
    final int close = head.lastIndexOf(']');
    if (close < open) {
      throw new StatechartException(Code.SYNTAX_ERROR, "Guard bracket is not closed", lineNumber,
          rawText);
    }
    parts[0] = emptyToNull(head.substring(0, open));
    parts[1] = emptyToNull(head.substring(open + 1, close));
    final String rest = head.substring(close + 1).trim();
    if (!rest.isEmpty()) {
      throw new StatechartException(Code.SYNTAX_ERROR, "Unexpected text after guard: " + rest,
          lineNumber, rawText);
    }
    return parts;
  }

  /**
   * Index of the first slash outside guard brackets, -1 when the label has no action.
   */
  private static int actionSeparator(final String text) {
    int depth = 0;
    for (int index = 0; index < text.length(); index++) {
      switch (text.charAt(index)) {
        case '[':
          depth++;
          break;
        case ']':
          depth--;
          break;
        case '/':
          if (depth <= 0) {
            return index;
          }
          break;
        default:
          break;
      }
    }
    return -1;
  }

  private static String emptyToNull(final String text) {
    final String trimmed = text.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static boolean hasStartMarker(final String[] lines) {
    for (final String line : lines) {
      if (START_MARKER.matcher(line.trim()).matches()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isIgnorable(final String line) {
    return line.isEmpty() || line.charAt(0) == '\'' || line.charAt(0) == '!'
        || line.startsWith("/'") || line.startsWith("note ");
  }

  private static Skip startsSkip(final String line) {
    if (line.startsWith("/'")) {
      return line.indexOf("'/", 2) >= 0 ? Skip.NONE : Skip.BLOCK_COMMENT;
    }
    if (SKINPARAM_BLOCK.matcher(line).matches()) {
      return Skip.SKINPARAM;
    }
    if (line.equals("legend") || line.startsWith("legend ")) {
      return Skip.LEGEND;
    }
    if (line.startsWith("note ") && line.indexOf(':') < 0 && line.indexOf('"') < 0) {
      return Skip.NOTE;
    }
    return Skip.NONE;
  }

  private static boolean endsSkip(final Skip skip, final String line) {
    switch (skip) {
      case BLOCK_COMMENT:
        return line.endsWith("'/");
      case NOTE:
        return line.equals("end note") || line.equals("endnote");
      case LEGEND:
        return line.equals("endlegend") || line.equals("end legend");
      case SKINPARAM:
        return line.equals("}");
      default:
        return true;
    }
  }
}
