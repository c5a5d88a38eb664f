package dev.roshin.complexityscanner.analysis.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration parameters for a complexity analysis run.
 *
 * @param reportPath        File the complexity report is written to.
 *                          Default: results.cy in the working directory
 * @param headerExtensions  File name suffixes whose declarations are never analyzed.
 *                          Default: .h, .hh, .hpp, .hxx
 * @param systemDirectories Directories treated like system include paths; declarations under them are excluded.
 *                          Default: none
 * @param complianceLevel   Java source level handed to the parser. Default: 17
 */
public record AnalysisConfig(
        Path reportPath,
        Set<String> headerExtensions,
        List<Path> systemDirectories,
        int complianceLevel
) {
    public static final Path DEFAULT_REPORT_PATH = Path.of("results.cy");

    public static final Set<String> DEFAULT_HEADER_EXTENSIONS = ImmutableSet.of(".h", ".hh", ".hpp", ".hxx");

    /**
     * Default configuration.
     */
    public static final AnalysisConfig DEFAULT = new AnalysisConfig(
            DEFAULT_REPORT_PATH, DEFAULT_HEADER_EXTENSIONS, List.of(), 17);

    /**
     * Creates a config with validation.
     */
    public AnalysisConfig {
        if (reportPath == null) {
            throw new IllegalArgumentException("reportPath must not be null");
        }
        if (headerExtensions == null) {
            throw new IllegalArgumentException("headerExtensions must not be null");
        }
        for (String extension : headerExtensions) {
            if (extension == null || extension.isBlank()) {
                throw new IllegalArgumentException("header extensions must not be blank, got: " + headerExtensions);
            }
        }
        if (complianceLevel < 8) {
            throw new IllegalArgumentException("complianceLevel must be 8 or higher, got: " + complianceLevel);
        }
        headerExtensions = ImmutableSet.copyOf(headerExtensions);
        systemDirectories = systemDirectories == null ? ImmutableList.of() : ImmutableList.copyOf(systemDirectories);
    }

    /**
     * Returns a copy writing its report to the given path.
     */
    public AnalysisConfig withReportPath(Path path) {
        return new AnalysisConfig(path, headerExtensions, systemDirectories, complianceLevel);
    }

    /**
     * Returns a copy excluding declarations found in the given directories.
     */
    public AnalysisConfig withSystemDirectories(Collection<Path> directories) {
        return new AnalysisConfig(reportPath, headerExtensions, List.copyOf(directories), complianceLevel);
    }

    /**
     * Returns a copy with a different set of header suffixes.
     */
    public AnalysisConfig withHeaderExtensions(Collection<String> extensions) {
        return new AnalysisConfig(reportPath, extensions == null ? null : new LinkedHashSet<>(extensions), systemDirectories, complianceLevel);
    }

    public AnalysisConfig withComplianceLevel(int level) {
        return new AnalysisConfig(reportPath, headerExtensions, systemDirectories, level);
    }
}
