package org.snapeval.session;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.snapeval.compiler.CompiledExpression;
import org.snapeval.compiler.ExpressionEngine;
import org.snapeval.compiler.ExpressionResult;
import org.snapeval.coordinator.EvalCoordinator;
import org.snapeval.runtime.target.IDebugController;
import org.snapeval.runtime.target.IDebugThread;
import org.snapeval.runtime.target.TargetRuntimeException;
import org.snapeval.runtime.value.DebugObjectFactory;
import org.snapeval.runtime.value.IDebugObjectFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates a list of expressions every time the target stops at a breakpoint.
 * <p>
 * The debugger delivers its callbacks on a single callback thread, and the target only
 * executes function evaluations after that thread resumes it. Expressions are therefore
 * evaluated on a worker thread, while the callback methods of this class perform the
 * callback side of the {@link EvalCoordinator} handshake:
 * <ol>
 *   <li>{@link #onBreakpoint} starts the worker and waits for its ready signal.</li>
 *   <li>If the worker requested an evaluation, the target is resumed so the runtime runs it.
 *       The runtime then reports {@link #onEvalComplete} or {@link #onEvalException}.</li>
 *   <li>Once the worker finished all expressions the target is resumed for good.</li>
 * </ol>
 *
 * <h3>Configuration</h3>
 * <pre>
 * snapeval {
 *   evaluation { enabled = true, eval-timeout = 30s, ready-timeout = 60s }
 *   session { worker-threads = 1 }
 * }
 * </pre>
 */
public class BreakpointEvaluationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BreakpointEvaluationSession.class);

    private static final String EVALUATION_PATH = "snapeval.evaluation";
    private static final String WORKER_THREADS_PATH = "snapeval.session.worker-threads";

    private final EvalCoordinator coordinator;
    private final ExpressionEngine engine;
    private final IDebugObjectFactory factory;
    private final ExecutorService workers;

    private volatile CompletableFuture<List<ExpressionResult>> results = CompletableFuture.completedFuture(List.of());

    /**
     * Creates a session from the root application configuration.
     *
     * @param config The configuration, usually from {@code ConfigLoader.load()}.
     */
    public BreakpointEvaluationSession(Config config) {
        this(new EvalCoordinator(config.hasPath(EVALUATION_PATH) ? config.getConfig(EVALUATION_PATH) : ConfigFactory.empty()),
                new ExpressionEngine(),
                new DebugObjectFactory(),
                config.hasPath(WORKER_THREADS_PATH) ? config.getInt(WORKER_THREADS_PATH) : 1);
    }

    public BreakpointEvaluationSession(EvalCoordinator coordinator, ExpressionEngine engine,
                                       IDebugObjectFactory factory, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("worker-threads must be at least 1, was " + workerThreads);
        }
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.workers = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
    }

    /**
     * Called on the callback thread when the target stopped at a breakpoint.
     *
     * @param thread     The thread that hit the breakpoint.
     * @param controller Controls the target process.
     * @param requests   The expressions to evaluate, in order.
     * @return A future completing with one result per request, in request order.
     * @throws IllegalStateException if the previous stop is still being evaluated.
     */
    public CompletableFuture<List<ExpressionResult>> onBreakpoint(IDebugThread thread, IDebugController controller,
                                                                  List<ExpressionRequest> requests) {
        Objects.requireNonNull(controller, "controller");
        List<ExpressionRequest> batch = List.copyOf(requests);
        if (!results.isDone()) {
            throw new IllegalStateException("Previous breakpoint on thread " + thread.getId() + " is still being evaluated");
        }

        coordinator.beginInspection(thread);
        CompletableFuture<List<ExpressionResult>> future = new CompletableFuture<>();
        results = future;
        log.debug("Breakpoint on thread {}, evaluating {} expressions", thread.getId(), batch.size());
        workers.execute(() -> evaluateAll(batch, future));

        awaitWorkerAndResume(controller);
        return future;
    }

    /**
     * Called on the callback thread when the runtime finished a function evaluation.
     *
     * @param thread     The thread the evaluation ran on.
     * @param controller Controls the target process.
     */
    public void onEvalComplete(IDebugThread thread, IDebugController controller) {
        coordinator.signalFinishedEval(thread);
        awaitWorkerAndResume(controller);
    }

    /**
     * Called on the callback thread when the evaluated function threw.
     *
     * @param thread     The thread the evaluation ran on.
     * @param controller Controls the target process.
     */
    public void onEvalException(IDebugThread thread, IDebugController controller) {
        log.debug("Function evaluation threw on thread {}", thread.getId());
        coordinator.handleException();
        awaitWorkerAndResume(controller);
    }

    /**
     * Called when the debugger detaches or the target exits. Releases a worker waiting for an
     * evaluation that will never complete.
     */
    public void onDetach() {
        coordinator.abort("debugger detached from the target");
    }

    /**
     * @return The results of the most recent breakpoint.
     */
    public CompletableFuture<List<ExpressionResult>> getResults() {
        return results;
    }

    public EvalCoordinator getCoordinator() {
        return coordinator;
    }

    private void awaitWorkerAndResume(IDebugController controller) {
        try {
            if (!coordinator.waitForReadySignal()) {
                coordinator.abort("worker did not respond");
            }
            if (coordinator.isWaitingForEval()) {
                log.debug("Resuming target to run a function evaluation");
            } else {
                log.debug("Expressions evaluated, resuming target");
            }
            controller.resume();
        } catch (TargetRuntimeException e) {
            log.error("Failed to resume the target: {}", e.getMessage());
            log.debug("Resume failure", e);
            coordinator.abort("target could not be resumed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Callback thread interrupted while waiting for the worker");
            coordinator.abort("callback thread interrupted");
        }
    }

    private void evaluateAll(List<ExpressionRequest> batch, CompletableFuture<List<ExpressionResult>> future) {
        List<ExpressionResult> collected = new ArrayList<>(batch.size());
        try {
            for (ExpressionRequest request : batch) {
                CompiledExpression compiled = engine.compile(request.tree(), request.context());
                ExpressionResult result = compiled.evaluate(coordinator, factory);
                if (result.isSuccess()) {
                    log.debug("{} = {}", request.name(), result.value());
                } else {
                    log.debug("{} failed with {}", request.name(), result.errorCode());
                }
                collected.add(result);
            }
            future.complete(List.copyOf(collected));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Expression worker failed: {}", e.getMessage());
            log.debug("Expression worker failure", e);
            future.completeExceptionally(e);
        } finally {
            coordinator.signalFinishedPrinting();
        }
    }

    /**
     * Stops the worker threads, interrupting a worker that still waits for an evaluation.
     */
    @Override
    public void close() {
        coordinator.abort("session closed");
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Expression workers did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "snapeval-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
