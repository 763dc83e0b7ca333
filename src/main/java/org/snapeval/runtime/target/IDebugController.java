package org.snapeval.runtime.target;

/**
 * Controls execution of the target process. Only the debug-callback thread may use it.
 */
public interface IDebugController {

    /**
     * Continues the target process, either so the runtime can execute a submitted evaluation
     * or because inspection of the current stop is finished.
     *
     * @throws TargetRuntimeException if the target could not be resumed.
     */
    void resume() throws TargetRuntimeException;
}
