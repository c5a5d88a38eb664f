package dev.roshin.complexityscanner.analysis.complexity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Writes a {@link ComplexityMap} as a plain text report, one function per line:
 * <pre>
 * Function: &lt;name&gt;, Cyclomatic Complexity: &lt;value&gt;
 * </pre>
 * Lines follow the map's name order and the file is replaced on every write.
 */
public class ComplexityReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ComplexityReportWriter.class);

    /**
     * Formats a single report line, without the line terminator.
     */
    public static String formatLine(String functionName, int complexity) {
        return "Function: " + functionName + ", Cyclomatic Complexity: " + complexity;
    }

    /**
     * Writes the report. Failure is logged once and reported through the return value;
     * it never propagates.
     *
     * @return true if the whole report was written
     */
    public boolean write(ComplexityMap complexities, Path reportPath) {
        try (BufferedWriter writer = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (Map.Entry<String, Integer> entry : complexities.orderedEntries()) {
                writer.write(formatLine(entry.getKey(), entry.getValue()));
                writer.write('\n');
            }
        } catch (IOException e) {
            log.error("Error writing complexity report {}: {}", reportPath, e.getMessage());
            return false;
        }

        log.info("Wrote {} function(s) to {}", complexities.size(), reportPath);
        return true;
    }
}
