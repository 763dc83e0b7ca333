package org.snapeval.compiler.api;

/**
 * Thrown when an expression tree fails static type checking. No evaluation is attempted
 * for a tree that failed to compile.
 */
public class ExpressionCompilationException extends Exception {

    private final EvaluationErrorCode errorCode;

    /**
     * @param errorCode The error category.
     * @param message   The detail message.
     */
    public ExpressionCompilationException(EvaluationErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EvaluationErrorCode getErrorCode() {
        return errorCode;
    }
}
