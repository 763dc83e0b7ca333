package org.snapeval.compiler.diagnostics;

import org.snapeval.compiler.api.EvaluationErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one expression request. This is the caller-supplied error
 * sink the surrounding tool renders as a human-readable compile or evaluation error.
 * <p>
 * Not thread-safe; each request owns its own engine.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error with the category label of its code.
     *
     * @param code    The error code.
     * @param message The error message.
     */
    public void reportError(EvaluationErrorCode code, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code.getCategory(), message));
    }

    /**
     * Adds context to the errors reported so far.
     *
     * @param message The note.
     */
    public void reportNote(String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.NOTE, "", message));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics as a single newline-separated string.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
