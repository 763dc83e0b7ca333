package org.snapeval.compiler.expr;

import org.snapeval.compiler.api.ExpressionCompilationException;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.IDebugObjectFactory;

/**
 * A node of a compiled expression tree.
 * <p>
 * Evaluation is two-phase. {@link #compile} type-checks the subtree without touching the
 * target process and selects the operation the node performs; {@link #evaluate} computes
 * the value against the live frame, possibly through a runtime-level evaluation. A node
 * exclusively owns its children. The tree is read-only during evaluation.
 */
public interface IExpressionEvaluator {

    /**
     * Type-checks this node and its children.
     *
     * @param context     The frame the expression is compiled against.
     * @param diagnostics Receives a human-readable description of every failure.
     * @throws ExpressionCompilationException if the subtree is ill-typed.
     */
    void compile(IExpressionContext context, DiagnosticsEngine diagnostics) throws ExpressionCompilationException;

    /**
     * Computes the value of a compiled node.
     *
     * @param coordinator The coordinator used for runtime-level evaluations.
     * @param factory     Creates result values.
     * @param diagnostics Receives a human-readable description of every failure.
     * @return The immutable result.
     * @throws ExpressionEvaluationException if the value cannot be computed.
     * @throws InterruptedException          if the worker is interrupted during a runtime-level evaluation.
     * @throws IllegalStateException         if the node was not compiled.
     */
    DebugObject evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory, DiagnosticsEngine diagnostics)
            throws ExpressionEvaluationException, InterruptedException;

    /**
     * @return The static type computed by the last successful {@link #compile}.
     */
    TypeSignature getStaticType();
}
