package dev.roshin.complexityscanner;

import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import dev.roshin.complexityscanner.analysis.core.ComplexityAnalyzer;
import dev.roshin.complexityscanner.analysis.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Command line entry point.
 * <pre>
 * complexityscanner &lt;source-path&gt; [report-path]
 * </pre>
 */
public class ComplexityScannerApp {
    private static final Logger log = LoggerFactory.getLogger(ComplexityScannerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: complexityscanner <source-path> [report-path]");
            return EXIT_USAGE;
        }

        AnalysisConfig config = AnalysisConfig.DEFAULT;
        if (args.length == 2) {
            config = config.withReportPath(Path.of(args[1]));
        }

        AnalysisReport report;
        try {
            report = new ComplexityAnalyzer().analyze(Path.of(args[0]), config);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (report.metadata().hadErrors() || !report.metadata().reportWritten()) {
            log.error("Analysis did not complete: {}", report.metadata().warnings());
            return EXIT_FAILED;
        }
        System.out.printf("%d function(s) analyzed, report written to %s%n",
                report.complexities().size(), report.metadata().reportPath());
        return EXIT_OK;
    }
}
