package org.snapeval.runtime.target;

/**
 * Thrown when the debugging interface of the target runtime reports a failure.
 */
public class TargetRuntimeException extends Exception {

    /**
     * @param message The detail message.
     */
    public TargetRuntimeException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause   The cause.
     */
    public TargetRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
