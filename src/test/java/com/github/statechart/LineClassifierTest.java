package com.github.statechart;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of LineClassifier.
 */
public class LineClassifierTest {
  private final LineClassifier classifier = new LineClassifier();

  @Test
  public void testStatementKinds() throws StatechartException {
    final List<Statement> statements = classifier.classify("@startuml Laundry\n"
        + "' a comment\n"
        + "state Open\n"
        + "state Closed {\n"
        + "  [*] --> Wash\n"
        + "  Wash : entry / fillDrum\n"
        + "}\n"
        + "Open -> Closed : close\n"
        + "@enduml\n");
    assertEquals(10, statements.size());
    assertEquals(Statement.Type.DIAGRAM_START, statements.get(0).getType());
    assertEquals("Laundry", statements.get(0).getName());
    assertEquals(Statement.Type.IGNORABLE, statements.get(1).getType());
    assertEquals(Statement.Type.STATE_DECL, statements.get(2).getType());
    assertEquals("Open", statements.get(2).getName());
    assertEquals(Statement.Type.COMPOSITE_OPEN, statements.get(3).getType());
    assertEquals(Statement.Type.TRANSITION, statements.get(4).getType());
    assertEquals(Endpoint.Kind.INITIAL, statements.get(4).getSource().getKind());
    assertEquals(Statement.Type.INTERNAL_ACTION, statements.get(5).getType());
    assertEquals(State.ActionKind.ENTRY, statements.get(5).getActionKind());
    assertEquals("fillDrum", statements.get(5).getLabel());
    assertEquals(Statement.Type.COMPOSITE_CLOSE, statements.get(6).getType());
    assertEquals(Statement.Type.TRANSITION, statements.get(7).getType());
    assertEquals("close", statements.get(7).getEvent());
    assertEquals(8, statements.get(7).getLineNumber());
    // @enduml and the trailing empty line
    assertEquals(Statement.Type.IGNORABLE, statements.get(8).getType());
    assertEquals(Statement.Type.IGNORABLE, statements.get(9).getType());
  }

  @Test
  public void testArrowVariants() throws StatechartException {
    for (final String arrow : new String[] {"->", "-->", "--->", "-up->", "-down->", "-l->",
        "-right-->"}) {
      final List<Statement> statements = classifier.classify("A " + arrow + " B : go");
      assertEquals(arrow, Statement.Type.TRANSITION, statements.get(0).getType());
      assertEquals(arrow, "A", statements.get(0).getSource().getName());
      assertEquals(arrow, "B", statements.get(0).getTarget().getName());
    }
  }

  @Test
  public void testEndpoints() throws StatechartException {
    final List<Statement> statements =
        classifier.classify("A --> [*]\nB --> [H]\nC --> D[H] : resume");
    assertEquals(Endpoint.Kind.FINAL, statements.get(0).getTarget().getKind());
    assertEquals(Endpoint.Kind.HISTORY, statements.get(1).getTarget().getKind());
    assertNull(statements.get(1).getTarget().getName());
    assertEquals(Endpoint.Kind.HISTORY, statements.get(2).getTarget().getKind());
    assertEquals("D", statements.get(2).getTarget().getName());
  }

  @Test
  public void testLabelSplitting() throws StatechartException {
    assertArrayEquals(new String[] {"ev", null, null}, LineClassifier.splitLabel(" ev ", 1, ""));
    assertArrayEquals(new String[] {"ev", "x > 1", "act"},
        LineClassifier.splitLabel("ev [x > 1] / act", 1, ""));
    assertArrayEquals(new String[] {null, "done", null},
        LineClassifier.splitLabel("[done]", 1, ""));
    assertArrayEquals(new String[] {null, null, "act()"},
        LineClassifier.splitLabel("/ act()", 1, ""));
    assertArrayEquals(new String[] {"ev", "a[0] > 1", null},
        LineClassifier.splitLabel("ev [a[0] > 1]", 1, ""));
    assertArrayEquals(new String[3], LineClassifier.splitLabel(null, 1, ""));
    // brackets after the slash belong to the action
    assertArrayEquals(new String[] {"ev", null, "arr[0]"},
        LineClassifier.splitLabel("ev / arr[0]", 1, ""));
    assertArrayEquals(new String[] {"ev", "x / 2 > 1", "log[i]"},
        LineClassifier.splitLabel("ev [x / 2 > 1] / log[i]", 1, ""));

    final Statement statement = classifier.classify("A --> B : ev / arr[0]").get(0);
    assertEquals("ev", statement.getEvent());
    assertNull(statement.getGuard());
    assertEquals("arr[0]", statement.getLabel());
  }

  @Test
  public void testIgnoredContent() throws StatechartException {
    final List<Statement> statements = classifier.classify("title ignored\n"
        + "@startuml\n"
        + "hide empty description\n"
        + "skinparam state {\n"
        + "  BackgroundColor white\n"
        + "}\n"
        + "/' block\n"
        + "   comment '/\n"
        + "note left of A\n"
        + "  some text\n"
        + "end note\n"
        + "note right of A : inline\n"
        + "!include foo.puml\n"
        + "state A\n"
        + "@enduml\n"
        + "garbage after end");
    for (final Statement statement : statements) {
      if (statement.getLineNumber() == 2) {
        assertEquals(Statement.Type.DIAGRAM_START, statement.getType());
      } else if (statement.getLineNumber() == 14) {
        assertEquals(Statement.Type.STATE_DECL, statement.getType());
      } else {
        assertEquals(statement.toString(), Statement.Type.IGNORABLE, statement.getType());
      }
    }
  }

  @Test
  public void testBraceOnOwnLine() throws StatechartException {
    final List<Statement> statements = classifier.classify("state Closed\n{\n}");
    assertEquals(Statement.Type.COMPOSITE_OPEN, statements.get(0).getType());
    assertEquals(Statement.Type.IGNORABLE, statements.get(1).getType());
    assertEquals(Statement.Type.COMPOSITE_CLOSE, statements.get(2).getType());
  }

  @Test
  public void testQuotedStateAndColor() throws StatechartException {
    final List<Statement> statements =
        classifier.classify("state \"Long Name\" as Short #LightBlue\nstate Über {");
    assertEquals("Short", statements.get(0).getName());
    assertEquals(Statement.Type.STATE_DECL, statements.get(0).getType());
    assertEquals("Über", statements.get(1).getName());
    assertEquals(Statement.Type.COMPOSITE_OPEN, statements.get(1).getType());
  }

  @Test
  public void testFailures() {
    expectFailure("A ~~ B", Code.SYNTAX_ERROR, 1);
    expectFailure("state A\n{\n}\n{", Code.SYNTAX_ERROR, 4);
    expectFailure("A --> B : ev [unclosed", Code.SYNTAX_ERROR, 1);
    expectFailure("A --> B : ev [g] trailing", Code.SYNTAX_ERROR, 1);
    expectFailure("state A {\n  --\n}", Code.UNSUPPORTED_CONSTRUCT, 2);
    expectFailure("A --> B[H*]", Code.UNSUPPORTED_CONSTRUCT, 1);
    expectFailure("A[H] --> B", Code.UNSUPPORTED_CONSTRUCT, 1);
    expectFailure("state A <<choice>>", Code.UNSUPPORTED_CONSTRUCT, 1);
    expectFailure("A : entry /   ", Code.SYNTAX_ERROR, 1);
  }

  private void expectFailure(final String text, final Code code, final int lineNumber) {
    try {
      classifier.classify(text);
      fail("Expected " + code + " for: " + text);
    } catch (StatechartException problem) {
      assertEquals(text, code, problem.getCode());
      assertEquals(text, lineNumber, problem.getLineNumber());
    }
  }
}
