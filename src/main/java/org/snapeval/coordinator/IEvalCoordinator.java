package org.snapeval.coordinator;

import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.runtime.target.IDebugThread;

/**
 * Coordinates runtime-level evaluations between the worker thread that evaluates an
 * expression and the debug-callback thread that controls the target process.
 * <p>
 * The target runtime only executes code while the debugger lets it run, and only the
 * callback thread may resume it. A worker that needs a function evaluated therefore submits
 * it, hands control to the callback thread (which resumes the target and returns from its
 * callback) and blocks until the runtime reports completion on the callback thread again.
 * At most one evaluation is outstanding per coordinator.
 */
public interface IEvalCoordinator {

    /**
     * Creates an evaluation bound to the active thread. Only valid while that thread is
     * suspended under debugger control.
     *
     * @return A single-use evaluation handle.
     * @throws ExpressionEvaluationException with {@code EVALUATION_FAILED} if no thread is
     *                                       active, an earlier evaluation of this stop was
     *                                       aborted or timed out, or the runtime refuses the
     *                                       evaluation.
     */
    EvalHandle createEval() throws ExpressionEvaluationException;

    /**
     * Called on the worker thread after submitting a call on {@code handle}. Signals the
     * callback thread that an evaluation is pending and blocks until it completes.
     *
     * @param handle The handle the call was submitted on.
     * @return The outcome of the evaluation.
     * @throws ExpressionEvaluationException {@code COORDINATOR_BUSY} if an evaluation is already
     *                                       pending or the handle was used, {@code NOT_IMPLEMENTED}
     *                                       if evaluation is disabled, {@code EVALUATION_FAILED} if
     *                                       the evaluation was aborted or timed out.
     * @throws InterruptedException          if the worker is interrupted while waiting.
     */
    EvalOutcome waitForEval(EvalHandle handle) throws ExpressionEvaluationException, InterruptedException;

    /**
     * Called on the callback thread when the runtime reports that the evaluation finished.
     *
     * @param thread The thread the evaluation ran on; it becomes the active thread.
     * @throws IllegalStateException if no evaluation is pending.
     */
    void signalFinishedEval(IDebugThread thread);

    /**
     * Called on the callback thread when the evaluated code threw.
     *
     * @throws IllegalStateException if no evaluation is pending.
     */
    void handleException();

    /**
     * Called on the callback thread: blocks until the worker either requested an evaluation
     * or finished reading all values.
     *
     * @return {@code false} if the ready signal did not arrive within the configured timeout.
     * @throws InterruptedException if the callback thread is interrupted while waiting.
     */
    boolean waitForReadySignal() throws InterruptedException;

    /**
     * Called on the worker thread once every value is read and no further evaluation will
     * be requested. The callback thread may then resume the target for good.
     */
    void signalFinishedPrinting();

    /**
     * @return {@code true} while a worker is blocked in {@link #waitForEval(EvalHandle)}.
     */
    boolean isWaitingForEval();

    void setEvaluationEnabled(boolean enabled);

    boolean isEvaluationEnabled();
}
