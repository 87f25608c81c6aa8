package com.github.statechart;

import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wires {@link LineClassifier}, {@link DiagramParser} and {@link JavaCodeGenerator} into one
 * pipeline run per call.
 */
final class StatechartCompilerImpl implements StatechartCompiler {
  private static final Logger logger =
      LogManager.getLogger(StatechartCompilerImpl.class.getSimpleName());

  private final String compilerId = UUID.randomUUID().toString();
  private final CompilerConfiguration config;
  private final LineClassifier classifier = new LineClassifier();
  private final DiagramParser parser = new DiagramParser();
  private final JavaCodeGenerator generator;

  StatechartCompilerImpl(final CompilerConfiguration config) {
    this.config = config == null ? CompilerConfiguration.defaults() : config;
    this.generator = new JavaCodeGenerator(this.config);
    logDebug(compilerId, null, "Created compiler with " + this.config);
  }

  @Override
  public CompilationResult compile(final String diagramText) throws StatechartException {
    final CompilationStatistics statistics =
        new CompilationStatistics(UUID.randomUUID().toString());
    logInfo(compilerId, statistics.getCompilationId(), "Compiling diagram");
    try {
      final Diagram diagram = parse(diagramText, statistics);
      final CompilationResult result = generator.generate(diagram, statistics);
      statistics.finish();
      if (result.isDegraded()) {
        logWarning(compilerId, statistics.getCompilationId(), "Compiled "
            + result.getQualifiedClassName() + " with " + statistics.getDegradations()
            + " degradations");
      }
      logInfo(compilerId, statistics.getCompilationId(), statistics.toString());
      return result;
    } catch (StatechartException problem) {
      logError(compilerId, statistics.getCompilationId(), "Compilation failed", problem);
      throw problem;
    }
  }

  @Override
  public Diagram parse(final String diagramText) throws StatechartException {
    final CompilationStatistics statistics =
        new CompilationStatistics(UUID.randomUUID().toString());
    try {
      final Diagram diagram = parse(diagramText, statistics);
      statistics.finish();
      logDebug(compilerId, statistics.getCompilationId(), statistics.toString());
      return diagram;
    } catch (StatechartException problem) {
      logError(compilerId, statistics.getCompilationId(), "Parsing failed", problem);
      throw problem;
    }
  }

  private Diagram parse(final String diagramText, final CompilationStatistics statistics)
      throws StatechartException {
    final List<Statement> statements = classifier.classify(diagramText);
    for (final Statement statement : statements) {
      if (statement.getType() != Statement.Type.IGNORABLE) {
        statistics.statements++;
      }
    }
    logDebug(compilerId, statistics.getCompilationId(),
        "Classified " + statistics.getStatements() + " statements");
    final Diagram diagram = parser.parse(statements);
    logDebug(compilerId, statistics.getCompilationId(), "Validated " + diagram);
    return diagram;
  }

  @Override
  public String getId() {
    return compilerId;
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  private static void logError(final String compilerId, final String compilationId,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compilationId).append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String compilerId, final String compilationId,
      final String message) {
    logger.warn(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compilationId).append("] ").append(message).toString());
  }

  private static void logInfo(final String compilerId, final String compilationId,
      final String message) {
    logger.info(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compilationId).append("] ").append(message).toString());
  }

  private static void logDebug(final String compilerId, final String compilationId,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(compilerId).append("][c:")
          .append(compilationId).append("] ").append(message).toString());
    }
  }
}
