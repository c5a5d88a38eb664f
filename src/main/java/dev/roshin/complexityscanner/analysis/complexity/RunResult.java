package dev.roshin.complexityscanner.analysis.complexity;

import java.nio.file.Path;
import java.util.SortedMap;

/**
 * Outcome of one {@link ComplexityRun}.
 *
 * @param complexities  Recorded complexities in name order
 * @param summary       Walk counters and warnings
 * @param reportPath    Where the report was meant to be written
 * @param reportWritten Whether the report file was written completely
 */
public record RunResult(
        SortedMap<String, Integer> complexities,
        WalkSummary summary,
        Path reportPath,
        boolean reportWritten
) {
}
