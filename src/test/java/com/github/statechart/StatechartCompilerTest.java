package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.statechart.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.statechart.StatechartCompiler.StatechartCompilerBuilder;
import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of the compiler facade and its configuration.
 */
public class StatechartCompilerTest {

  @Test
  public void testCompile() throws Exception {
    final StatechartCompiler compiler = StatechartCompilerBuilder.newBuilder().build();
    assertNotNull(compiler.getId());
    assertNull(compiler.getConfiguration().getClassName());
    assertEquals(CompilerConfiguration.DEFAULT_CONTEXT_TYPE,
        compiler.getConfiguration().getContextType());

    final CompilationResult first =
        compiler.compile(GeneratedMachineTest.resource("/diagrams/coffee-machine.puml"));
    final CompilationResult second =
        compiler.compile(GeneratedMachineTest.resource("/diagrams/coffee-machine.puml"));
    assertEquals(first.getSource(), second.getSource());
    assertNotEquals(first.getStatistics().getCompilationId(),
        second.getStatistics().getCompilationId());

    final CompilationStatistics statistics = first.getStatistics();
    // start marker, 5 declarations, block open and close, 10 transitions, 3 actions
    assertEquals(21, statistics.getStatements());
    assertEquals(6, statistics.getStates());
    assertEquals(1, statistics.getComposites());
    assertEquals(10, statistics.getTransitions());
    assertEquals(3, statistics.getActionHooks());
    assertTrue(statistics.getElapsedMillis() >= 0);
  }

  @Test
  public void testParseOnly() throws StatechartException {
    final StatechartCompiler compiler = StatechartCompilerBuilder.newBuilder().build();
    final Diagram diagram = compiler.parse(DiagramParserTest.LAUNDRY);
    assertTrue(diagram.isValidated());
    assertEquals(compiler.parse(DiagramParserTest.LAUNDRY), diagram);
  }

  @Test
  public void testFirstErrorAborts() {
    final StatechartCompiler compiler = StatechartCompilerBuilder.newBuilder().build();
    try {
      compiler.compile("state A\n[*] --> A\nA --> B : go\nA ~~ C");
      fail("Expected a syntax error");
    } catch (StatechartException problem) {
      // classification runs over the whole text before the tree is built
      assertEquals(Code.SYNTAX_ERROR, problem.getCode());
      assertEquals(4, problem.getLineNumber());
      assertEquals("A ~~ C", problem.getRawText());
      assertTrue(problem.getMessage().startsWith("line 4: "));
    }
  }

  @Test
  public void testConfiguration() throws StatechartException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .className("Machine").packageName("org.example").contextType("String")
        .completionStepLimit(-3).build();
    assertEquals("Machine", config.getClassName());
    assertEquals("org.example", config.getPackageName());
    assertEquals("String", config.getContextType());
    assertEquals(CompilerConfiguration.DEFAULT_COMPLETION_STEP_LIMIT,
        config.getCompletionStepLimit());
    assertEquals(config, StatechartCompilerBuilder.newBuilder().config(config).build()
        .getConfiguration());
  }

  @Test
  public void testInvalidConfiguration() {
    expectInvalid(CompilerConfigurationBuilder.newBuilder().className("1st"), "className");
    expectInvalid(CompilerConfigurationBuilder.newBuilder().className("StateId"), "className");
    expectInvalid(CompilerConfigurationBuilder.newBuilder().className("enum"), "className");
    expectInvalid(CompilerConfigurationBuilder.newBuilder().packageName("org..example"),
        "packageName");
    expectInvalid(CompilerConfigurationBuilder.newBuilder().contextType(" "), "contextType");
    expectInvalid(CompilerConfigurationBuilder.newBuilder().contextType("int"), "contextType");

    // all problems are reported at once
    try {
      CompilerConfigurationBuilder.newBuilder().className("a-b").packageName("1x").build();
      fail("Expected an invalid configuration");
    } catch (StatechartException problem) {
      assertTrue(problem.getMessage().contains("className"));
      assertTrue(problem.getMessage().contains("packageName"));
    }
  }

  private static void expectInvalid(final CompilerConfigurationBuilder builder,
      final String field) {
    try {
      builder.build();
      fail("Expected an invalid " + field);
    } catch (StatechartException problem) {
      assertEquals(Code.INVALID_COMPILER_CONFIG, problem.getCode());
      assertEquals(StatechartException.Phase.CONFIGURATION, problem.getCode().getPhase());
      assertTrue(problem.getMessage(), problem.getMessage().contains(field));
    }
  }
}
