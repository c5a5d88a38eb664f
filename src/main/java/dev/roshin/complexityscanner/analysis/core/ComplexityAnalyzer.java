package dev.roshin.complexityscanner.analysis.core;

import com.google.common.collect.ImmutableSortedMap;
import dev.roshin.complexityscanner.analysis.complexity.ComplexityRun;
import dev.roshin.complexityscanner.analysis.complexity.RunResult;
import dev.roshin.complexityscanner.analysis.complexity.WalkSummary;
import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import dev.roshin.complexityscanner.analysis.diagnostics.Diagnostics;
import dev.roshin.complexityscanner.analysis.diagnostics.LoggingDiagnostics;
import dev.roshin.complexityscanner.analysis.model.AnalysisMetadata;
import dev.roshin.complexityscanner.analysis.model.AnalysisReport;
import dev.roshin.complexityscanner.analysis.pom.PomAnalyzer;
import dev.roshin.complexityscanner.analysis.pom.ProjectSources;
import dev.roshin.complexityscanner.analysis.spoon.SpoonModelBuilder;
import dev.roshin.complexityscanner.analysis.spoon.SpoonTranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.reflect.CtModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Main entry point for complexity analysis of Java sources.
 * Uses Spoon for AST parsing; each call to {@link #analyze} is one independent run
 * with its own diagnostics engine and result map.
 */
public class ComplexityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final PomAnalyzer pomAnalyzer;
    private final SpoonModelBuilder modelBuilder;
    private final Supplier<? extends Diagnostics> diagnosticsFactory;

    public ComplexityAnalyzer() {
        this(LoggingDiagnostics::new);
    }

    /**
     * @param diagnosticsFactory creates the diagnostics engine for each run
     */
    public ComplexityAnalyzer(Supplier<? extends Diagnostics> diagnosticsFactory) {
        this.pomAnalyzer = new PomAnalyzer();
        this.modelBuilder = new SpoonModelBuilder();
        this.diagnosticsFactory = diagnosticsFactory;
    }

    /**
     * Computes per-function complexity for the given sources and writes the report file.
     *
     * @param sourcePath a Java file, a source directory or a Maven project root
     * @param config     analysis configuration
     * @return complexities and run metadata; an error report if the sources cannot be parsed
     * @throws IllegalArgumentException if the path or its source directory does not exist
     */
    public AnalysisReport analyze(Path sourcePath, AnalysisConfig config) {
        log.info("Starting complexity analysis of: {}", sourcePath);
        LocalDateTime startTime = LocalDateTime.now();
        long startMs = System.currentTimeMillis();

        validateSource(sourcePath);
        ProjectSources sources = pomAnalyzer.resolveSources(sourcePath);
        for (Path root : sources.sourceRoots()) {
            if (!Files.exists(root)) {
                throw new IllegalArgumentException("Source directory does not exist: " + root);
            }
        }

        CtModel model;
        try {
            model = modelBuilder.build(sources.sourceRoots(), config);
        } catch (Exception e) {
            log.error("Failed to build Spoon model", e);
            return createErrorReport(sourcePath, startTime, startMs, config,
                    "Failed to parse sources: " + e.getMessage());
        }

        ComplexityRun run = new ComplexityRun(config, diagnosticsFactory.get());
        RunResult result = run.execute(new SpoonTranslationUnit(sources.name(), model));

        AnalysisMetadata metadata = buildMetadata(sources, result, startMs);
        log.info("Analysis completed: {}", metadata);

        return new AnalysisReport(sourcePath, startTime, result.complexities(), metadata);
    }

    /**
     * Validates that the input exists.
     */
    private void validateSource(Path sourcePath) {
        if (sourcePath == null) {
            throw new IllegalArgumentException("Source path must not be null");
        }
        if (!Files.exists(sourcePath)) {
            throw new IllegalArgumentException("Source path does not exist: " + sourcePath);
        }
        if (Files.isRegularFile(sourcePath) && !sourcePath.toString().endsWith(".java")) {
            throw new IllegalArgumentException("Not a Java source file: " + sourcePath);
        }
        log.debug("Source validation passed: {}", sourcePath);
    }

    /**
     * Counts Java source files under the given roots.
     */
    private int countJavaFiles(List<Path> roots) {
        int total = 0;
        for (Path root : roots) {
            try (Stream<Path> files = Files.walk(root)) {
                total += (int) files
                        .filter(Files::isRegularFile)
                        .filter(p -> p.toString().endsWith(".java"))
                        .count();
            } catch (IOException e) {
                log.warn("Could not count Java files under {}", root, e);
            }
        }
        return total;
    }

    private AnalysisMetadata buildMetadata(ProjectSources sources, RunResult result, long startMs) {
        WalkSummary summary = result.summary();
        List<String> warnings = new ArrayList<>(summary.warnings());
        if (!result.reportWritten()) {
            warnings.add("Report could not be written to " + result.reportPath());
        }

        return new AnalysisMetadata(
                countJavaFiles(sources.sourceRoots()),
                summary.functionsAnalyzed(),
                summary.declarationsExcluded(),
                summary.declarationsWithoutBody(),
                summary.anomalies(),
                summary.overwrittenNames(),
                List.copyOf(warnings),
                Duration.ofMillis(System.currentTimeMillis() - startMs),
                result.reportPath(),
                result.reportWritten(),
                false
        );
    }

    /**
     * Creates an error report when the sources cannot be parsed.
     */
    private AnalysisReport createErrorReport(Path sourcePath, LocalDateTime startTime, long startMs,
                                             AnalysisConfig config, String errorMessage) {
        AnalysisMetadata metadata = new AnalysisMetadata(
                0, 0, 0, 0, 0, 0,
                List.of("CRITICAL: " + errorMessage),
                Duration.ofMillis(System.currentTimeMillis() - startMs),
                config.reportPath(),
                false,
                true // hadErrors
        );

        return new AnalysisReport(sourcePath, startTime, ImmutableSortedMap.of(), metadata);
    }
}
