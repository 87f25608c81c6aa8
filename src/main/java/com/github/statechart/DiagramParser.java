package com.github.statechart;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StatechartException.Code;

/**
 * Builds the {@link Diagram} from classified statements. Nesting is tracked with an explicit stack
 * of regions: the diagram sits at the bottom and an open composite block sits on top of it. Since
 * only one level of nesting is supported the stack never grows beyond two frames.
 *
 * The finished tree is handed to the {@link DiagramValidator} and sealed, so callers only ever see
 * validated, immutable diagrams.
 */
public final class DiagramParser {
  private static final Logger logger = LogManager.getLogger(DiagramParser.class.getSimpleName());

  private final DiagramValidator validator = new DiagramValidator();

  public Diagram parse(final List<Statement> statements) throws StatechartException {
    final Diagram diagram = new Diagram(diagramName(statements));
    final Deque<Region> scopes = new ArrayDeque<>();
    final Deque<Statement> openBlocks = new ArrayDeque<>();
    scopes.push(diagram);

    for (final Statement statement : statements) {
      final Region current = scopes.peek();
      switch (statement.getType()) {
        case STATE_DECL:
          declare(current, statement);
          break;
        case COMPOSITE_OPEN:
          scopes.push(open(current, statement, scopes.size()));
          openBlocks.push(statement);
          break;
        case COMPOSITE_CLOSE:
          if (scopes.size() == 1) {
            throw new StatechartException(Code.UNBALANCED_BLOCK,
                "Closing brace without an open composite block", statement.getLineNumber(),
                statement.getRawText());
          }
          scopes.pop();
          openBlocks.pop();
          break;
        case TRANSITION:
          current.addTransition(new Transition(statement, current.getOwnerName()));
          break;
        case INTERNAL_ACTION:
          attachAction(scopes, statement);
          break;
        default:
          break;
      }
    }

    if (!openBlocks.isEmpty()) {
      final Statement unclosed = openBlocks.peek();
      throw new StatechartException(Code.UNBALANCED_BLOCK,
          "Composite block of " + unclosed.getName() + " is never closed",
          unclosed.getLineNumber(), unclosed.getRawText());
    }

    validator.validate(diagram);
    diagram.seal();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed and validated " + diagram);
    }
    return diagram;
  }

  private static String diagramName(final List<Statement> statements) {
    for (final Statement statement : statements) {
      if (statement.getType() == Statement.Type.DIAGRAM_START) {
        return statement.getName();
      }
    }
    return null;
  }

  private static State declare(final Region region, final Statement statement)
      throws StatechartException {
    if (region.getState(statement.getName()) != null) {
      throw new StatechartException(Code.DUPLICATE_STATE,
          "State " + statement.getName() + " is already declared in this scope",
          statement.getLineNumber(), statement.getRawText());
    }
    final State state = new State(statement.getName(), statement.getLineNumber());
    region.addState(state);
    return state;
  }

  /**
   * Opens the block of a state. Opening a block of an undeclared state declares it; a state
   * declared earlier without a block may be opened once.
   */
  private static Composite open(final Region region, final Statement statement, final int depth)
      throws StatechartException {
    if (depth > 1) {
      throw new StatechartException(Code.NESTED_COMPOSITE,
          "Composite " + statement.getName() + " cannot be nested inside composite "
              + region.getOwnerName(),
          statement.getLineNumber(), statement.getRawText());
    }
    State state = region.getState(statement.getName());
    if (state == null) {
      state = declare(region, statement);
    } else if (state.isComposite()) {
      throw new StatechartException(Code.DUPLICATE_STATE,
          "Composite block of " + statement.getName() + " is declared twice",
          statement.getLineNumber(), statement.getRawText());
    }
    return state.makeComposite();
  }

  private static void attachAction(final Deque<Region> scopes, final Statement statement)
      throws StatechartException {
    for (final Region region : scopes) {
      final State state = region.getState(statement.getName());
      if (state != null) {
        state.addAction(statement.getActionKind(), statement.getLabel(),
            statement.getLineNumber(), statement.getRawText());
        return;
      }
    }
    throw new StatechartException(Code.UNKNOWN_STATE,
        "Action refers to undeclared state " + statement.getName(), statement.getLineNumber(),
        statement.getRawText());
  }
}
