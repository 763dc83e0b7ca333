package org.snapeval.coordinator;

/**
 * States of the evaluation handshake between a worker thread and the debug-callback thread.
 */
public enum EvalState {
    /** No evaluation outstanding. */
    IDLE,
    /** A worker submitted an evaluation and is blocked until the runtime reports back. */
    EVAL_REQUESTED,
    /** The runtime finished the evaluation. */
    COMPLETED,
    /** The evaluated code threw. */
    EXCEPTION_THROWN,
    /** The target went away or the evaluation timed out. */
    ABORTED
}
