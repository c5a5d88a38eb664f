package dev.roshin.complexityscanner.analysis.diagnostics;

/**
 * Handle for a custom message registered with a {@link Diagnostics} engine.
 *
 * @param id       Engine-assigned identifier, unique per engine
 * @param severity Severity every emission of this message carries
 * @param template Message template with SLF4J-style {@code {}} placeholders
 */
public record DiagnosticId(
        int id,
        Severity severity,
        String template
) {
}
