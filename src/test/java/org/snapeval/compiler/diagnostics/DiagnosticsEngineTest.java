package org.snapeval.compiler.diagnostics;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void errorsCarryTheCategoryOfTheirCode() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        diagnostics.reportError(EvaluationErrorCode.ARITHMETIC_OVERFLOW, ErrorMessages.ARITHMETIC_OVERFLOW);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).containsExactly(
                new Diagnostic(Diagnostic.Type.ERROR, "ArithmeticOverflow", ErrorMessages.ARITHMETIC_OVERFLOW));
    }

    @Test
    void notesAloneAreNotErrors() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        diagnostics.reportNote(ErrorMessages.FAILED_TO_EVAL_FIRST_SUB_EXPR);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.summary()).isEqualTo("[NOTE] Failed to evaluate the first sub-expression.");
    }

    @Test
    void summaryKeepsReportingOrder() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportError(EvaluationErrorCode.EVALUATION_FAILED, "Variable is optimized away");
        diagnostics.reportNote(ErrorMessages.FAILED_TO_EVAL_SECOND_SUB_EXPR);

        assertThat(diagnostics.summary()).isEqualTo(
                "[ERROR] EvaluationFailed: Variable is optimized away\n"
                        + "[NOTE] Failed to evaluate the second sub-expression.");
    }

    @Test
    void diagnosticsViewIsReadOnly() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThatThrownBy(() -> diagnostics.getDiagnostics().add(new Diagnostic(Diagnostic.Type.NOTE, "", "x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
