package dev.roshin.complexityscanner.analysis.pom;

import com.google.common.collect.ImmutableList;
import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves what to parse for an input path. A directory holding a pom.xml is treated as
 * a Maven project and its main source directory is read from the pom.
 */
public class PomAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PomAnalyzer.class);

    static final String POM_FILE = "pom.xml";
    static final String SRC_MAIN_JAVA = "src/main/java";

    private static final List<String> BASEDIR_PROPERTIES = List.of("${project.basedir}", "${basedir}", "${pom.basedir}");

    /**
     * Resolves source roots and a unit name for {@code path}.
     *
     * @param path a Java source file, a source directory or a Maven project directory
     */
    public ProjectSources resolveSources(Path path) {
        Path fileName = path.toAbsolutePath().normalize().getFileName();
        String defaultName = fileName == null ? path.toString() : fileName.toString();

        if (!Files.isDirectory(path)) {
            return new ProjectSources(defaultName, ImmutableList.of(path));
        }

        Path pomFile = path.resolve(POM_FILE);
        if (!Files.exists(pomFile)) {
            log.debug("No pom.xml in {}, using it as a plain source directory", path);
            return new ProjectSources(defaultName, ImmutableList.of(path));
        }

        MavenXpp3Reader reader = new MavenXpp3Reader();
        try (FileReader fileReader = new FileReader(pomFile.toFile())) {
            Model model = reader.read(fileReader);

            String name = model.getArtifactId() != null ? model.getArtifactId() : defaultName;
            Build build = model.getBuild();
            String sourceDirectory = build != null && build.getSourceDirectory() != null
                    ? build.getSourceDirectory()
                    : SRC_MAIN_JAVA;
            log.debug("Maven project {} uses source directory {}", name, sourceDirectory);

            return new ProjectSources(name, ImmutableList.of(resolveSourceDirectory(path, sourceDirectory)));
        } catch (Exception e) {
            log.error("Failed to parse pom.xml, falling back to {}", SRC_MAIN_JAVA, e);
            return new ProjectSources(defaultName, ImmutableList.of(path.resolve(SRC_MAIN_JAVA)));
        }
    }

    /**
     * Expands the basedir properties in a pom source directory and resolves it against the project root.
     * Falls back to src/main/java when the result does not exist.
     */
    Path resolveSourceDirectory(Path projectRoot, String sourceDirectory) {
        String basedir = projectRoot.toAbsolutePath().normalize().toString();
        String expanded = sourceDirectory;
        for (String property : BASEDIR_PROPERTIES) {
            expanded = expanded.replace(property, basedir);
        }

        Path resolved;
        try {
            resolved = projectRoot.resolve(expanded);
        } catch (InvalidPathException e) {
            log.warn("Invalid source directory '{}' in pom.xml, using {}", sourceDirectory, SRC_MAIN_JAVA);
            return projectRoot.resolve(SRC_MAIN_JAVA);
        }
        if (!Files.isDirectory(resolved)) {
            log.warn("Source directory {} from pom.xml does not exist, using {}", resolved, SRC_MAIN_JAVA);
            return projectRoot.resolve(SRC_MAIN_JAVA);
        }
        return resolved;
    }
}
