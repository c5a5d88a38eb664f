package dev.roshin.complexityscanner.analysis.spoon;

import dev.roshin.complexityscanner.analysis.config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.Launcher;
import spoon.reflect.CtModel;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the Spoon AST model for a set of source roots.
 */
public class SpoonModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(SpoonModelBuilder.class);

    /**
     * Parses every Java file under the given roots.
     *
     * @param sourceRoots source files or directories
     * @param config      analysis configuration, used for the compliance level
     * @return the built model
     * @throws IllegalArgumentException if no source root is given
     * @throws RuntimeException         if Spoon cannot parse the sources
     */
    public CtModel build(List<Path> sourceRoots, AnalysisConfig config) {
        if (sourceRoots.isEmpty()) {
            throw new IllegalArgumentException("At least one source root is required");
        }
        log.info("Building Spoon model for: {}", sourceRoots);

        Launcher launcher = new Launcher();
        launcher.getEnvironment().setComplianceLevel(config.complianceLevel());
        launcher.getEnvironment().setNoClasspath(true); // Work without full classpath
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setShouldCompile(false);
        launcher.getEnvironment().setCommentEnabled(false); // Comments never carry decisions

        for (Path root : sourceRoots) {
            launcher.addInputResource(root.toString());
        }

        try {
            CtModel model = launcher.buildModel();
            log.info("Spoon model built successfully: {} types", model.getAllTypes().size());
            return model;
        } catch (Exception e) {
            log.error("Failed to build Spoon model", e);
            throw new RuntimeException("Source parsing failed: " + e.getMessage(), e);
        }
    }
}
