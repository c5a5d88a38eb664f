package dev.roshin.complexityscanner.analysis.diagnostics;

import dev.roshin.complexityscanner.analysis.ast.DeclarationLocation;

/**
 * Diagnostics channel owned by the host. Each analysis run receives its own instance.
 */
public interface Diagnostics {

    /**
     * Registers a message template and returns the handle used to emit it.
     * Registering the same severity and template twice returns an equal handle.
     *
     * @param severity severity of every emission
     * @param template template with {@code {}} placeholders
     */
    DiagnosticId registerCustomMessage(Severity severity, String template);

    /**
     * Emits one diagnostic bound to a source location.
     *
     * @param location  where the diagnostic points
     * @param id        handle obtained from {@link #registerCustomMessage}
     * @param arguments values substituted into the template placeholders
     */
    void report(DeclarationLocation location, DiagnosticId id, Object... arguments);
}
