package dev.roshin.complexityscanner.analysis.complexity;

import dev.roshin.complexityscanner.analysis.ast.TranslationUnit;
import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import dev.roshin.complexityscanner.analysis.diagnostics.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One analysis pass over a translation unit: walk the tree into a fresh
 * {@link ComplexityMap}, then write the report.
 */
public class ComplexityRun {
    private static final Logger log = LoggerFactory.getLogger(ComplexityRun.class);

    private final AnalysisConfig config;
    private final FunctionWalker walker;
    private final ComplexityReportWriter reportWriter;

    public ComplexityRun(AnalysisConfig config, Diagnostics diagnostics) {
        this(config, new FunctionWalker(new ComplexityCalculator(), new HeaderFilter(config), diagnostics),
                new ComplexityReportWriter());
    }

    ComplexityRun(AnalysisConfig config, FunctionWalker walker, ComplexityReportWriter reportWriter) {
        this.config = config;
        this.walker = walker;
        this.reportWriter = reportWriter;
    }

    /**
     * Analyzes the unit and persists the report to {@link AnalysisConfig#reportPath()}.
     */
    public RunResult execute(TranslationUnit unit) {
        log.info("Analyzing translation unit: {}", unit.name());

        ComplexityMap complexities = new ComplexityMap();
        WalkSummary summary = walker.walk(unit, complexities);
        boolean written = reportWriter.write(complexities, config.reportPath());

        log.info("Translation unit {} done: {}", unit.name(), summary);
        return new RunResult(complexities.snapshot(), summary, config.reportPath(), written);
    }
}
