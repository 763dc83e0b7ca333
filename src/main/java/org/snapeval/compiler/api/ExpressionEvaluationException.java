package org.snapeval.compiler.api;

import java.util.Optional;

/**
 * Thrown when evaluating a compiled expression fails. Failures of a child expression keep
 * their original code and gain the position of the operand they came from.
 */
public class ExpressionEvaluationException extends Exception {

    private final EvaluationErrorCode errorCode;
    private final OperandPosition operand;

    /**
     * @param errorCode The error category.
     * @param message   The detail message.
     */
    public ExpressionEvaluationException(EvaluationErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * @param errorCode The error category.
     * @param message   The detail message.
     * @param cause     The cause.
     */
    public ExpressionEvaluationException(EvaluationErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    private ExpressionEvaluationException(EvaluationErrorCode errorCode, String message,
                                          OperandPosition operand, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.operand = operand;
    }

    /**
     * Wraps a failure of a child expression, keeping its code.
     *
     * @param operand The operand that failed.
     * @param cause   The child's failure.
     * @return The wrapping exception.
     */
    public static ExpressionEvaluationException inOperand(OperandPosition operand,
                                                          ExpressionEvaluationException cause) {
        return new ExpressionEvaluationException(cause.getErrorCode(),
                String.format("%s operand: %s", operand == OperandPosition.FIRST ? "First" : "Second",
                        cause.getMessage()),
                operand, cause);
    }

    public EvaluationErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The operand this failure came from, empty if it was raised by the node itself.
     */
    public Optional<OperandPosition> getOperand() {
        return Optional.ofNullable(operand);
    }
}
