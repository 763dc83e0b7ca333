package org.snapeval.runtime.target;

/**
 * A thread of the target process that is suspended under debugger control.
 */
public interface IDebugThread {

    /**
     * @return The operating-system id of the thread.
     */
    long getId();

    /**
     * Creates a fresh evaluation object bound to this thread. Only valid while the thread is suspended.
     *
     * @return A new evaluation object.
     * @throws TargetRuntimeException if the runtime refuses to create the evaluation.
     */
    IDebugEval createEval() throws TargetRuntimeException;
}
