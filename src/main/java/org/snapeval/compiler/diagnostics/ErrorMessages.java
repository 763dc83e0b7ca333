package org.snapeval.compiler.diagnostics;

/**
 * Message texts shared by the expression evaluators.
 */
public final class ErrorMessages {

    public static final String OPERATOR_TYPE_MISMATCH = "Operator '%s' cannot be applied to operands of type '%s' and '%s'.";
    public static final String OPERATOR_NOT_SUPPORTED = "Operator '%s' is not supported for operands of type '%s' and '%s'.";
    public static final String FAILED_TO_EVAL_FIRST_SUB_EXPR = "Failed to evaluate the first sub-expression.";
    public static final String FAILED_TO_EVAL_SECOND_SUB_EXPR = "Failed to evaluate the second sub-expression.";
    public static final String DIVISION_BY_ZERO = "Division by zero.";
    public static final String ARITHMETIC_OVERFLOW = "Arithmetic operation resulted in an overflow.";
    public static final String EVALUATION_DISABLED = "Function evaluation is disabled.";
    public static final String EVALUATION_THREW = "Function evaluation threw an exception: %s";

    private ErrorMessages() {}
}
