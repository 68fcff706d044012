package org.hackvm.translator.diagnostics;

import org.hackvm.translator.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors and warnings)
 * that occur while translating a VM program.
 * <p>
 * This decouples reporting from the translation logic itself.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error at the given instruction.
     *
     * @param message The error message.
     * @param source  The instruction the error belongs to.
     */
    public void reportError(String message, SourceInfo source) {
        diagnostics.add(Diagnostic.of(Diagnostic.Type.ERROR, message, source));
    }

    /**
     * Reports a warning at the given instruction.
     *
     * @param message The warning message.
     * @param source  The instruction the warning belongs to.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(Diagnostic.of(Diagnostic.Type.WARNING, message, source));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return count(Diagnostic.Type.ERROR) > 0;
    }

    /**
     * Counts the diagnostics of the given type.
     *
     * @param type The type to count.
     * @return The number of diagnostics of that type.
     */
    public long count(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
