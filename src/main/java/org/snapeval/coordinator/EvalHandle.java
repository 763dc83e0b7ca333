package org.snapeval.coordinator;

import org.snapeval.runtime.target.IDebugEval;
import org.snapeval.runtime.target.IDebugThread;
import org.snapeval.runtime.target.TargetRuntimeException;
import org.snapeval.runtime.value.DebugObject;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single-use token for one runtime-level evaluation, created by
 * {@link IEvalCoordinator#createEval()} and bound to the thread that was active at the time.
 * Waiting on a handle consumes it.
 */
public final class EvalHandle {

    private final IEvalCoordinator owner;
    private final IDebugThread thread;
    private final IDebugEval eval;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    EvalHandle(IEvalCoordinator owner, IDebugThread thread, IDebugEval eval) {
        this.owner = owner;
        this.thread = thread;
        this.eval = eval;
    }

    /**
     * Submits a function call on the bound thread.
     *
     * @param function  The fully qualified function name.
     * @param arguments The arguments, instance first.
     * @throws TargetRuntimeException if the runtime rejects the call.
     */
    public void callFunction(String function, List<DebugObject> arguments) throws TargetRuntimeException {
        eval.callFunction(function, arguments);
    }

    public IDebugThread getThread() {
        return thread;
    }

    IDebugEval getEval() {
        return eval;
    }

    IEvalCoordinator getOwner() {
        return owner;
    }

    /**
     * @return {@code true} exactly once, for the first caller.
     */
    boolean claim() {
        return consumed.compareAndSet(false, true);
    }
}
