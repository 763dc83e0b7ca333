package org.snapeval.compiler.api;

/**
 * Defines unique, testable error codes for everything that can fail while compiling or
 * evaluating an expression. Each code carries the category label written to diagnostics.
 */
public enum EvaluationErrorCode {
    // region Compile errors
    /** Operand kinds cannot be combined under the operator. */
    TYPE_MISMATCH("TypeMismatch"),
    /** The operator is valid but not implemented for these operand kinds. */
    EXPRESSION_NOT_SUPPORTED("ExpressionNotSupported"),
    /** An identifier does not name a variable visible in the current frame. */
    UNKNOWN_IDENTIFIER("UnknownIdentifier"),
    /** A member call does not resolve to a method of the instance type. */
    UNKNOWN_METHOD("UnknownMethod"),
    // endregion

    // region Evaluation errors
    /** Integral division or modulo by zero. */
    DIVISION_BY_ZERO("DivisionByZero"),
    /** Signed integral minimum value divided by -1. */
    ARITHMETIC_OVERFLOW("ArithmeticOverflow"),
    /** A remote evaluation reported an exception or could not complete. */
    EVALUATION_FAILED("EvaluationFailed"),
    /** An evaluation was requested while another one is outstanding. */
    COORDINATOR_BUSY("CoordinatorBusy"),
    /** The operation needs a runtime feature that is disabled. */
    NOT_IMPLEMENTED("NotImplemented");
    // endregion

    private final String category;

    EvaluationErrorCode(String category) {
        this.category = category;
    }

    /**
     * @return The human-readable category label.
     */
    public String getCategory() {
        return category;
    }
}
