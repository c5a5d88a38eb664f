package dev.roshin.complexityscanner.analysis.pom;

import java.nio.file.Path;
import java.util.List;

/**
 * Sources to analyze as one translation unit.
 *
 * @param name        Unit name: the Maven artifactId, or the input file/directory name
 * @param sourceRoots Source files or directories handed to the parser
 */
public record ProjectSources(
        String name,
        List<Path> sourceRoots
) {
}
