package org.snapeval.compiler;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.diagnostics.Diagnostic;
import org.snapeval.runtime.value.DebugObject;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of one expression: either its value or the error code and the diagnostics
 * describing why it failed.
 *
 * @param expression  The rendered expression tree.
 * @param value       The value, {@code null} on failure.
 * @param errorCode   The error code, {@code null} on success.
 * @param diagnostics Every diagnostic reported while compiling and evaluating.
 */
public record ExpressionResult(
        String expression,
        DebugObject value,
        EvaluationErrorCode errorCode,
        List<Diagnostic> diagnostics
) {
    public ExpressionResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ExpressionResult success(String expression, DebugObject value, List<Diagnostic> diagnostics) {
        return new ExpressionResult(expression, value, null, diagnostics);
    }

    public static ExpressionResult failure(String expression, EvaluationErrorCode errorCode, List<Diagnostic> diagnostics) {
        return new ExpressionResult(expression, null, errorCode, diagnostics);
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public Optional<DebugObject> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * @return The diagnostics as the error text shown to the user, one per line.
     */
    public String diagnosticsText() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? expression + " = " + value
                : expression + " failed with " + errorCode + ": " + diagnosticsText();
    }
}
