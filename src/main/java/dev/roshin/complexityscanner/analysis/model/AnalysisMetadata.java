package dev.roshin.complexityscanner.analysis.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Contains metadata and statistics about the analysis run.
 *
 * @param totalFilesScanned       Number of Java source files handed to the parser
 * @param functionsAnalyzed       Functions whose complexity was computed
 * @param declarationsExcluded    Declarations skipped as header, system or location-less code
 * @param declarationsWithoutBody Abstract, interface and other body-less declarations
 * @param anomalies               Definitions whose body was unexpectedly missing
 * @param overwrittenNames        Results replaced by a later function of the same name
 * @param warnings                Warnings generated during analysis
 * @param analysisTime            Duration of the analysis
 * @param reportPath              Where the report file was written
 * @param reportWritten           Whether the report file was written
 * @param hadErrors               Whether the sources could not be analyzed at all
 */
public record AnalysisMetadata(
        int totalFilesScanned,
        int functionsAnalyzed,
        int declarationsExcluded,
        int declarationsWithoutBody,
        int anomalies,
        int overwrittenNames,
        List<String> warnings,
        Duration analysisTime,
        Path reportPath,
        boolean reportWritten,
        boolean hadErrors
) {
    @Override
    public String toString() {
        return String.format(
                "Analysis: %d files, %d functions analyzed, %d excluded, %d without body in %s. " +
                        "Report: %s (%s). Warnings: %d, Errors: %s",
                totalFilesScanned, functionsAnalyzed, declarationsExcluded, declarationsWithoutBody,
                analysisTime, reportPath, reportWritten ? "written" : "not written", warnings.size(), hadErrors
        );
    }
}
