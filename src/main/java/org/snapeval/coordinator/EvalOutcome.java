package org.snapeval.coordinator;

import org.snapeval.runtime.value.DebugObject;

/**
 * The result of one runtime-level evaluation.
 *
 * @param value           The returned value, or the thrown exception object.
 * @param exceptionThrown {@code true} if the evaluated code threw.
 */
public record EvalOutcome(DebugObject value, boolean exceptionThrown) {
}
