package org.snapeval.coordinator;

import com.typesafe.config.Config;
import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.diagnostics.ErrorMessages;
import org.snapeval.runtime.target.IDebugThread;
import org.snapeval.runtime.target.TargetRuntimeException;
import org.snapeval.runtime.value.DebugObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Monitor-based implementation of {@link IEvalCoordinator}.
 * <p>
 * All handshake state is guarded by a single monitor. The worker waits for
 * {@link EvalState#EVAL_REQUESTED} to be left, the callback thread waits for the ready flag;
 * both re-check their condition after every wake-up.
 *
 * <h3>Configuration</h3>
 * <pre>
 * enabled = true          # function evaluation allowed
 * eval-timeout = 30s      # longest a worker waits for one evaluation
 * ready-timeout = 60s     # longest the callback thread waits for the worker
 * </pre>
 */
public class EvalCoordinator implements IEvalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EvalCoordinator.class);

    private static final Duration DEFAULT_EVAL_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(60);

    private final Object monitor = new Object();
    private final Duration evalTimeout;
    private final Duration readyTimeout;

    private EvalState state = EvalState.IDLE;
    private EvalHandle pending;
    private IDebugThread activeThread;
    private boolean readyToPrint;
    private boolean finishedPrinting;
    private boolean abandonedEval;
    private boolean inspectionAborted;
    private String abortReason;
    private volatile boolean evaluationEnabled;

    /**
     * Creates a coordinator from the {@code snapeval.evaluation} configuration block.
     * Missing keys fall back to the defaults.
     *
     * @param options The evaluation options.
     */
    public EvalCoordinator(Config options) {
        this.evaluationEnabled = !options.hasPath("enabled") || options.getBoolean("enabled");
        this.evalTimeout = options.hasPath("eval-timeout") ? options.getDuration("eval-timeout") : DEFAULT_EVAL_TIMEOUT;
        this.readyTimeout = options.hasPath("ready-timeout") ? options.getDuration("ready-timeout") : DEFAULT_READY_TIMEOUT;
    }

    /**
     * Starts inspection of a new stop: makes {@code thread} the active thread and clears the
     * printing handshake. Called on the callback thread before a worker is started.
     *
     * @param thread The suspended thread.
     * @throws IllegalStateException if an evaluation is still pending.
     */
    public void beginInspection(IDebugThread thread) {
        Objects.requireNonNull(thread, "thread");
        synchronized (monitor) {
            if (state == EvalState.EVAL_REQUESTED) {
                throw new IllegalStateException("Cannot begin inspection while an evaluation is pending");
            }
            state = EvalState.IDLE;
            activeThread = thread;
            readyToPrint = false;
            finishedPrinting = false;
            abandonedEval = false;
            inspectionAborted = false;
            abortReason = null;
            log.debug("Inspection started on thread {}", thread.getId());
        }
    }

    @Override
    public EvalHandle createEval() throws ExpressionEvaluationException {
        IDebugThread thread;
        synchronized (monitor) {
            if (inspectionAborted) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                        "Evaluation aborted: " + abortReason);
            }
            thread = activeThread;
        }
        if (thread == null) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                    "No active debug thread, the target is not suspended");
        }
        try {
            return new EvalHandle(this, thread, thread.createEval());
        } catch (TargetRuntimeException e) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                    "Failed to create an evaluation on thread " + thread.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public EvalOutcome waitForEval(EvalHandle handle) throws ExpressionEvaluationException, InterruptedException {
        Objects.requireNonNull(handle, "handle");
        if (handle.getOwner() != this) {
            throw new IllegalArgumentException("Evaluation handle belongs to another coordinator");
        }

        EvalState finalState;
        String reason;
        synchronized (monitor) {
            if (!evaluationEnabled) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.NOT_IMPLEMENTED,
                        ErrorMessages.EVALUATION_DISABLED);
            }
            if (inspectionAborted) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                        "Evaluation aborted: " + abortReason);
            }
            if (state == EvalState.EVAL_REQUESTED) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.COORDINATOR_BUSY,
                        "Another evaluation is already pending on thread " + pending.getThread().getId());
            }
            if (!handle.claim()) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.COORDINATOR_BUSY,
                        "Evaluation handle was already used");
            }

            state = EvalState.EVAL_REQUESTED;
            pending = handle;
            readyToPrint = true;
            monitor.notifyAll();
            log.debug("Evaluation requested on thread {}", handle.getThread().getId());

            try {
                long deadline = System.nanoTime() + evalTimeout.toNanos();
                while (state == EvalState.EVAL_REQUESTED) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        log.warn("Evaluation on thread {} did not complete within {}, abandoning it",
                                handle.getThread().getId(), evalTimeout);
                        state = EvalState.ABORTED;
                        abandonPending("timed out after " + evalTimeout);
                        break;
                    }
                    TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
                }
            } catch (InterruptedException e) {
                log.debug("Worker interrupted while waiting for evaluation on thread {}", handle.getThread().getId());
                abandonPending("worker interrupted");
                resetToIdle();
                throw e;
            }

            finalState = state;
            reason = abortReason;
            resetToIdle();
        }

        return switch (finalState) {
            case COMPLETED -> new EvalOutcome(readResult(handle), false);
            case EXCEPTION_THROWN -> new EvalOutcome(readResult(handle), true);
            case ABORTED -> throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                    "Evaluation aborted: " + reason);
            default -> throw new IllegalStateException("Evaluation woke up in state " + finalState);
        };
    }

    // The target may still be running the abandoned call, so nothing else may be evaluated
    // on this stop: its late signal must not complete a newer request.
    private void abandonPending(String reason) {
        abortReason = reason;
        abandonedEval = true;
        inspectionAborted = true;
    }

    private void resetToIdle() {
        state = EvalState.IDLE;
        pending = null;
    }

    private DebugObject readResult(EvalHandle handle) throws ExpressionEvaluationException {
        try {
            return handle.getEval().getResult();
        } catch (TargetRuntimeException e) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                    "Failed to read the evaluation result: " + e.getMessage(), e);
        }
    }

    @Override
    public void signalFinishedEval(IDebugThread thread) {
        Objects.requireNonNull(thread, "thread");
        finish(EvalState.COMPLETED, thread);
    }

    @Override
    public void handleException() {
        finish(EvalState.EXCEPTION_THROWN, null);
    }

    private void finish(EvalState outcome, IDebugThread thread) {
        synchronized (monitor) {
            if (state != EvalState.EVAL_REQUESTED) {
                if (abandonedEval) {
                    log.warn("Ignoring {} for an evaluation the worker no longer waits for", outcome);
                    abandonedEval = false;
                    return;
                }
                throw new IllegalStateException("Evaluation signalled as " + outcome + " but none is pending (state " + state + ")");
            }
            state = outcome;
            if (thread != null) {
                activeThread = thread;
            }
            readyToPrint = false;
            log.debug("Evaluation finished with {}", outcome);
            monitor.notifyAll();
        }
    }

    @Override
    public boolean waitForReadySignal() throws InterruptedException {
        synchronized (monitor) {
            long deadline = System.nanoTime() + readyTimeout.toNanos();
            while (!readyToPrint) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Worker did not signal readiness within {}", readyTimeout);
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
            return true;
        }
    }

    @Override
    public void signalFinishedPrinting() {
        synchronized (monitor) {
            readyToPrint = true;
            finishedPrinting = true;
            log.debug("Worker finished reading values");
            monitor.notifyAll();
        }
    }

    /**
     * Releases every thread blocked in the handshake because the target process or thread
     * disappeared. A pending evaluation fails with {@code EVALUATION_FAILED}; later
     * {@link #createEval()} calls fail until the next {@link #beginInspection(IDebugThread)}.
     *
     * @param reason Why the inspection ended.
     */
    public void abort(String reason) {
        synchronized (monitor) {
            if (state == EvalState.EVAL_REQUESTED) {
                log.warn("Aborting pending evaluation: {}", reason);
                state = EvalState.ABORTED;
                abandonedEval = true;
            }
            abortReason = reason;
            inspectionAborted = true;
            activeThread = null;
            readyToPrint = true;
            monitor.notifyAll();
        }
    }

    @Override
    public boolean isWaitingForEval() {
        synchronized (monitor) {
            return state == EvalState.EVAL_REQUESTED;
        }
    }

    /**
     * @return {@code true} once the worker signalled that it finished reading values.
     */
    public boolean isFinishedPrinting() {
        synchronized (monitor) {
            return finishedPrinting;
        }
    }

    /**
     * @return The thread evaluations are currently bound to, or {@code null}.
     */
    public IDebugThread getActiveThread() {
        synchronized (monitor) {
            return activeThread;
        }
    }

    @Override
    public void setEvaluationEnabled(boolean enabled) {
        this.evaluationEnabled = enabled;
    }

    @Override
    public boolean isEvaluationEnabled() {
        return evaluationEnabled;
    }
}
