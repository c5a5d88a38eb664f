package dev.roshin.complexityscanner.analysis.ast;

/**
 * Source position of a declaration.
 *
 * @param filePath     Path of the file that defines the declaration
 * @param line         1-based line number, or a non-positive value when unknown
 * @param column       1-based column number, or a non-positive value when unknown
 * @param systemHeader True if the declaration comes from system or library code
 */
public record DeclarationLocation(
        String filePath,
        int line,
        int column,
        boolean systemHeader
) {
    /**
     * Location inside a regular user source file.
     */
    public static DeclarationLocation of(String filePath, int line, int column) {
        return new DeclarationLocation(filePath, line, column, false);
    }

    public boolean isValid() {
        return filePath != null && !filePath.isBlank() && line > 0;
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", filePath, line, column);
    }
}
