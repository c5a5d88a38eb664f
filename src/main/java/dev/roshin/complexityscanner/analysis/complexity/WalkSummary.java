package dev.roshin.complexityscanner.analysis.complexity;

import java.util.List;

/**
 * Counters collected while walking one translation unit.
 *
 * @param functionsAnalyzed       Functions whose complexity was computed and recorded
 * @param declarationsExcluded    Declarations rejected by the header/system filter
 * @param declarationsWithoutBody Declarations that are not definitions
 * @param anomalies               Definitions whose body turned out to be missing
 * @param overwrittenNames        Recorded names that replaced an earlier entry
 * @param warnings                Elements that failed and were skipped
 */
public record WalkSummary(
        int functionsAnalyzed,
        int declarationsExcluded,
        int declarationsWithoutBody,
        int anomalies,
        int overwrittenNames,
        List<String> warnings
) {
    @Override
    public String toString() {
        return String.format(
                "%d analyzed, %d excluded, %d without body, %d anomalies, %d overwritten, %d warnings",
                functionsAnalyzed, declarationsExcluded, declarationsWithoutBody,
                anomalies, overwrittenNames, warnings.size()
        );
    }
}
