package dev.roshin.complexityscanner.analysis.diagnostics;

/**
 * Severity attached to a registered diagnostic message.
 */
public enum Severity {
    REMARK,
    NOTE,
    WARNING,
    ERROR;

    /**
     * Lower-case label used when rendering, e.g. "remark".
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
