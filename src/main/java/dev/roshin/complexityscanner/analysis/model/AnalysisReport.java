package dev.roshin.complexityscanner.analysis.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.OptionalInt;
import java.util.SortedMap;

/**
 * The complete output of a complexity analysis run.
 *
 * @param sourcePath        The analyzed file, directory or Maven project
 * @param analysisTimestamp When the analysis was performed
 * @param complexities      Cyclomatic complexity per function name, in name order
 * @param metadata          Statistics, warnings, and diagnostic information
 */
public record AnalysisReport(
        Path sourcePath,
        LocalDateTime analysisTimestamp,
        SortedMap<String, Integer> complexities,
        AnalysisMetadata metadata
) {
    public OptionalInt complexityOf(String functionName) {
        Integer value = complexities.get(functionName);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * Highest complexity of any function, or 0 if nothing was analyzed.
     */
    public int maxComplexity() {
        return complexities.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    @Override
    public String toString() {
        return String.format(
                "AnalysisReport[source=%s, timestamp=%s, functions=%d, max=%d]",
                sourcePath.getFileName(), analysisTimestamp, complexities.size(), maxComplexity()
        );
    }
}
