package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of validation and endpoint resolution.
 */
public class DiagramValidatorTest {
  private final LineClassifier classifier = new LineClassifier();
  private final DiagramParser parser = new DiagramParser();

  @Test
  public void testChildShadowsTopLevelState() throws StatechartException {
    final Diagram diagram = parse("state Idle\n"
        + "state Busy {\n"
        + "  state Idle\n"
        + "  state Working\n"
        + "  [*] --> Idle\n"
        + "  Working --> Idle : pause\n"
        + "  Idle --> Done : quit\n"
        + "}\n"
        + "state Done\n"
        + "[*] --> Idle\n"
        + "Idle --> Busy : go\n");
    final Composite busy = diagram.getState("Busy").getComposite();
    final Transition pause = busy.getTransitions().get(1);
    assertEquals("Busy", pause.getTarget().getOwner());
    assertSame(busy.getState("Idle"), diagram.lookup(pause.getTarget()));

    // Done is only declared at the top level, so the child transition leaves the composite
    final Transition quit = busy.getTransitions().get(2);
    assertNull(quit.getTarget().getOwner());
    assertSame(diagram.getState("Done"), diagram.lookup(quit.getTarget()));
    assertTrue(quit.getTarget().isResolved());
  }

  @Test
  public void testHistoryTargets() throws StatechartException {
    final Diagram diagram = parse("state On {\n"
        + "  state Idle\n"
        + "  state Brewing\n"
        + "  [*] --> Idle\n"
        + "  Idle --> Brewing : brew\n"
        + "  Brewing --> [H] : reset\n"
        + "}\n"
        + "state Off {\n"
        + "  state Sleeping\n"
        + "  [*] --> Sleeping\n"
        + "}\n"
        + "state Paused\n"
        + "[*] --> On\n"
        + "On --> Paused : pause\n"
        + "Paused --> On[H] : resume\n");
    assertTrue(diagram.getState("On").getComposite().hasHistory());
    assertTrue(!diagram.getState("Off").getComposite().hasHistory());
    final Transition resume = diagram.getTransitions().get(2);
    assertEquals(Endpoint.Kind.HISTORY, resume.getTarget().getKind());
    assertSame(diagram.getState("On"), diagram.lookup(resume.getTarget()));
  }

  @Test
  public void testInitialTransitions() {
    expectFailure("state A\nstate B", Code.NO_INITIAL_TRANSITION, 0);
    expectFailure("state A\nstate B\n[*] --> A\n[*] --> B", Code.MULTIPLE_INITIAL_TRANSITIONS, 4);
    expectFailure("state A\n[*] --> A\nstate C {\n  state D\n}", Code.NO_INITIAL_TRANSITION, 3);
    expectFailure("state A\n[*] --> [*]", Code.UNSUPPORTED_CONSTRUCT, 2);
    expectFailure("state A\n[*] --> B", Code.UNRESOLVED_TRANSITION_ENDPOINT, 2);
    // an initial transition cannot enter a child of another region
    expectFailure("state C {\n  state D\n  [*] --> D\n}\n[*] --> D",
        Code.UNRESOLVED_TRANSITION_ENDPOINT, 5);
  }

  @Test
  public void testUnresolvedEndpoints() {
    expectFailure("state A\n[*] --> A\nA --> Missing : go", Code.UNRESOLVED_TRANSITION_ENDPOINT, 3);
    expectFailure("state A\n[*] --> A\nMissing --> A : go", Code.UNRESOLVED_TRANSITION_ENDPOINT, 3);
    // top-level transitions cannot see inside a composite
    expectFailure("state A\nstate C {\n  state D\n  [*] --> D\n}\n[*] --> A\nA --> D : go",
        Code.UNRESOLVED_TRANSITION_ENDPOINT, 7);
  }

  @Test
  public void testHistoryOnNonComposite() {
    expectFailure("state A\n[*] --> A\nA --> [H] : back", Code.HISTORY_ON_NON_COMPOSITE, 3);
    expectFailure("state A\nstate B\n[*] --> A\nA --> B[H] : back",
        Code.HISTORY_ON_NON_COMPOSITE, 4);
  }

  private Diagram parse(final String text) throws StatechartException {
    return parser.parse(classifier.classify(text));
  }

  private void expectFailure(final String text, final Code code, final int lineNumber) {
    try {
      parse(text);
      fail("Expected " + code + " for: " + text);
    } catch (StatechartException problem) {
      assertEquals(text, code, problem.getCode());
      assertEquals(text, lineNumber, problem.getLineNumber());
    }
  }
}
