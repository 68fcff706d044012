package org.hackvm.translator.diagnostics;

import org.hackvm.translator.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or warning)
 * that was reported while translating a VM program.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the input where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents translation. */
        ERROR,
        /** A warning that does not prevent translation. */
        WARNING
    }

    /**
     * Creates a diagnostic positioned at the given instruction.
     */
    public static Diagnostic of(Type type, String message, SourceInfo source) {
        return new Diagnostic(type, message, source.fileName(), source.lineNumber());
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
