package org.snapeval.compiler.diagnostics;

/**
 * A single diagnostic message produced while compiling or evaluating an expression.
 *
 * @param type     The severity of the diagnostic.
 * @param category The category label, e.g. {@code TypeMismatch}; empty for context notes.
 * @param message  The human-readable message.
 */
public record Diagnostic(
        Type type,
        String category,
        String message
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** A failure of the expression. */
        ERROR,
        /** Context attached to an error, e.g. which sub-expression failed. */
        NOTE
    }

    @Override
    public String toString() {
        return category.isEmpty()
                ? String.format("[%s] %s", type, message)
                : String.format("[%s] %s: %s", type, category, message);
    }
}
