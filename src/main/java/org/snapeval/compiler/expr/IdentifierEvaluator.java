package org.snapeval.compiler.expr;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionCompilationException;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.IDebugObjectFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * A local variable, argument or field of the frame the expression is compiled against.
 */
public class IdentifierEvaluator implements IExpressionEvaluator {

    private final String name;
    private IExpressionContext context;
    private TypeSignature staticType = TypeSignature.OBJECT;

    public IdentifierEvaluator(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void compile(IExpressionContext context, DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        this.context = null;
        Optional<TypeSignature> type = context.resolveVariableType(name);
        if (type.isEmpty()) {
            String message = String.format("The name '%s' does not exist in the current context.", name);
            diagnostics.reportError(EvaluationErrorCode.UNKNOWN_IDENTIFIER, message);
            throw new ExpressionCompilationException(EvaluationErrorCode.UNKNOWN_IDENTIFIER, message);
        }
        this.staticType = type.get();
        this.context = context;
    }

    @Override
    public DebugObject evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory, DiagnosticsEngine diagnostics)
            throws ExpressionEvaluationException {
        if (context == null) {
            throw new IllegalStateException("Identifier '" + name + "' was not compiled");
        }
        try {
            return context.readVariable(name);
        } catch (ExpressionEvaluationException e) {
            diagnostics.reportError(e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    @Override
    public TypeSignature getStaticType() {
        return staticType;
    }

    @Override
    public String toString() {
        return name;
    }
}
