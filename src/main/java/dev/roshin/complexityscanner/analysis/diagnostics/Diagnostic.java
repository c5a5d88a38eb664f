package dev.roshin.complexityscanner.analysis.diagnostics;

import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;

/**
 * A rendered diagnostic as emitted by {@link LoggingDiagnostics}.
 *
 * @param location Location the diagnostic points at
 * @param severity Severity of the registered message
 * @param message  Template with arguments substituted
 */
public record Diagnostic(
        DeclarationLocation location,
        Severity severity,
        String message
) {
    @Override
    public String toString() {
        return String.format("%s: %s: %s", location, severity.label(), message);
    }
}
