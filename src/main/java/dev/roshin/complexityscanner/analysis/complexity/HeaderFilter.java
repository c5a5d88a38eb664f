package dev.roshin.complexityscanner.analysis.complexity;

import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;
import dev.roshin.complexityscanner.analysis.ast.FunctionDeclaration;
import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a declaration belongs to user code that should be analyzed.
 * Declarations in system code, in header files or without a usable location are excluded.
 */
public class HeaderFilter {
    private static final Logger log = LoggerFactory.getLogger(HeaderFilter.class);

    private final Set<String> headerExtensions;
    private final List<Path> systemDirectories;

    public HeaderFilter(AnalysisConfig config) {
        this.headerExtensions = config.headerExtensions();
        this.systemDirectories = config.systemDirectories().stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
    }

    /**
     * Returns true if the declaration must not contribute to the report.
     */
    public boolean isExcluded(FunctionDeclaration declaration) {
        DeclarationLocation location;
        try {
            location = declaration.location();
        } catch (RuntimeException e) {
            log.debug("Could not resolve location of {}: {}", safeName(declaration), e.getMessage());
            return true;
        }

        if (location == null || !location.isValid()) {
            log.trace("No valid location for {}, skipping", safeName(declaration));
            return true;
        }
        if (location.systemHeader()) {
            return true;
        }
        return isHeaderFile(location.filePath()) || isUnderSystemDirectory(location.filePath());
    }

    /**
     * Checks the file name against the configured header suffixes.
     */
    public boolean isHeaderFile(String filePath) {
        for (String extension : headerExtensions) {
            if (filePath.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private boolean isUnderSystemDirectory(String filePath) {
        if (systemDirectories.isEmpty()) {
            return false;
        }
        Path file;
        try {
            file = Path.of(filePath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.debug("Unparseable path '{}': {}", filePath, e.getMessage());
            return false;
        }
        for (Path directory : systemDirectories) {
            if (file.startsWith(directory)) {
                return true;
            }
        }
        return false;
    }

    private String safeName(FunctionDeclaration declaration) {
        try {
            return declaration.displayName();
        } catch (RuntimeException e) {
            return "<unnamed>";
        }
    }
}
