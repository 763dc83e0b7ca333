package org.snapeval.compiler;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.expr.IExpressionEvaluator;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.IDebugObjectFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * An expression tree after the compile phase, together with the diagnostics of that phase.
 * A tree that failed to compile can still be "evaluated"; it yields its compile failure.
 * Evaluate a compiled expression from one thread at a time.
 */
public final class CompiledExpression {

    private static final Logger log = LoggerFactory.getLogger(CompiledExpression.class);

    private final IExpressionEvaluator tree;
    private final DiagnosticsEngine diagnostics;
    private final EvaluationErrorCode compileError;

    CompiledExpression(IExpressionEvaluator tree, DiagnosticsEngine diagnostics, EvaluationErrorCode compileError) {
        this.tree = tree;
        this.diagnostics = diagnostics;
        this.compileError = compileError;
    }

    public boolean isCompiled() {
        return compileError == null;
    }

    /**
     * @return The compile error code, empty if the tree compiled.
     */
    public Optional<EvaluationErrorCode> getCompileError() {
        return Optional.ofNullable(compileError);
    }

    /**
     * @return The static result type, empty if the tree did not compile.
     */
    public Optional<TypeSignature> getStaticType() {
        return isCompiled() ? Optional.of(tree.getStaticType()) : Optional.empty();
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * Evaluates the tree against the live frame.
     *
     * @param coordinator The coordinator for runtime-level evaluations.
     * @param factory     Creates result values.
     * @return The value, or the failure with every diagnostic reported so far.
     * @throws InterruptedException if the calling worker is interrupted during a runtime-level evaluation.
     */
    public ExpressionResult evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory) throws InterruptedException {
        String rendered = tree.toString();
        if (!isCompiled()) {
            return ExpressionResult.failure(rendered, compileError, diagnostics.getDiagnostics());
        }
        try {
            DebugObject value = tree.evaluate(coordinator, factory, diagnostics);
            log.debug("{} evaluated to {}", rendered, value);
            return ExpressionResult.success(rendered, value, diagnostics.getDiagnostics());
        } catch (ExpressionEvaluationException e) {
            log.debug("{} failed to evaluate: {}", rendered, e.getMessage());
            return ExpressionResult.failure(rendered, e.getErrorCode(), diagnostics.getDiagnostics());
        }
    }

    @Override
    public String toString() {
        return tree.toString();
    }
}
