package org.snapeval.runtime.target;

import org.snapeval.runtime.value.DebugObject;

import java.util.List;

/**
 * A single runtime-level evaluation on a target thread. The runtime supports only one
 * outstanding evaluation per thread.
 */
public interface IDebugEval {

    /**
     * Submits a function call. The call runs once the debugger resumes the target.
     *
     * @param function  The fully qualified function or property getter name.
     * @param arguments The arguments, starting with the instance for instance members.
     * @throws TargetRuntimeException if the runtime rejects the call.
     */
    void callFunction(String function, List<DebugObject> arguments) throws TargetRuntimeException;

    /**
     * Reads the outcome of a finished evaluation: the returned value, or the exception object
     * when the call threw.
     *
     * @return The result value.
     * @throws TargetRuntimeException if no result is available.
     */
    DebugObject getResult() throws TargetRuntimeException;
}
