package org.snapeval.compiler;

import org.snapeval.compiler.api.ExpressionCompilationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.expr.IExpressionEvaluator;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.IDebugObjectFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for compiling and evaluating expression trees. Every compilation gets a fresh
 * {@link DiagnosticsEngine}, so compiled expressions never share error output.
 */
public class ExpressionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEngine.class);

    /**
     * Runs the compile phase.
     *
     * @param tree    The root of the expression tree.
     * @param context The frame to compile against.
     * @return The compiled expression; check {@link CompiledExpression#isCompiled()}.
     */
    public CompiledExpression compile(IExpressionEvaluator tree, IExpressionContext context) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(context, "context");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            tree.compile(context, diagnostics);
            log.debug("Compiled {} to type {}", tree, tree.getStaticType().typeName());
            return new CompiledExpression(tree, diagnostics, null);
        } catch (ExpressionCompilationException e) {
            log.debug("Failed to compile {}: {}", tree, e.getMessage());
            if (!diagnostics.hasErrors()) {
                diagnostics.reportError(e.getErrorCode(), e.getMessage());
            }
            return new CompiledExpression(tree, diagnostics, e.getErrorCode());
        }
    }

    /**
     * Compiles and evaluates a tree in one step.
     *
     * @throws InterruptedException if the calling worker is interrupted during a runtime-level evaluation.
     */
    public ExpressionResult evaluate(IExpressionEvaluator tree, IExpressionContext context,
                                     IEvalCoordinator coordinator, IDebugObjectFactory factory) throws InterruptedException {
        return compile(tree, context).evaluate(coordinator, factory);
    }
}
