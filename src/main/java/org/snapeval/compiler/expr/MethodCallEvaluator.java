package org.snapeval.compiler.expr;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionCompilationException;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.api.RemoteMethod;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.diagnostics.ErrorMessages;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.EvalHandle;
import org.snapeval.coordinator.EvalOutcome;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.target.TargetRuntimeException;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.IDebugObjectFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parameterless instance method or property getter, e.g. {@code list.Count}, executed
 * inside the target process through the {@link IEvalCoordinator}.
 */
public class MethodCallEvaluator implements IExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MethodCallEvaluator.class);

    private final IExpressionEvaluator instance;
    private final String methodName;
    private RemoteMethod method;

    /**
     * @param instance   The expression the method is called on; owned by this node.
     * @param methodName The member name as the runtime knows it, e.g. {@code get_Count}.
     */
    public MethodCallEvaluator(IExpressionEvaluator instance, String methodName) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.methodName = Objects.requireNonNull(methodName, "methodName");
    }

    @Override
    public void compile(IExpressionContext context, DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        method = null;
        instance.compile(context, diagnostics);

        TypeSignature owner = instance.getStaticType();
        Optional<RemoteMethod> resolved = context.resolveMethod(owner, methodName);
        if (resolved.isEmpty()) {
            String message = String.format("'%s' does not contain a definition for '%s'.", owner.typeName(), methodName);
            diagnostics.reportError(EvaluationErrorCode.UNKNOWN_METHOD, message);
            throw new ExpressionCompilationException(EvaluationErrorCode.UNKNOWN_METHOD, message);
        }
        method = resolved.get();
    }

    @Override
    public DebugObject evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory, DiagnosticsEngine diagnostics)
            throws ExpressionEvaluationException, InterruptedException {
        if (method == null) {
            throw new IllegalStateException("Method call '" + methodName + "' was not compiled");
        }

        DebugObject target = instance.evaluate(coordinator, factory, diagnostics);

        try {
            if (!coordinator.isEvaluationEnabled()) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.NOT_IMPLEMENTED, ErrorMessages.EVALUATION_DISABLED);
            }

            EvalHandle handle = coordinator.createEval();
            try {
                handle.callFunction(method.qualifiedName(), List.of(target));
            } catch (TargetRuntimeException e) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                        "Failed to call " + method.qualifiedName() + ": " + e.getMessage(), e);
            }

            log.debug("Waiting for {} on thread {}", method.qualifiedName(), handle.getThread().getId());
            EvalOutcome outcome = coordinator.waitForEval(handle);
            if (outcome.exceptionThrown()) {
                throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED,
                        String.format(ErrorMessages.EVALUATION_THREW, outcome.value().getTypeName()));
            }
            return outcome.value();
        } catch (ExpressionEvaluationException e) {
            diagnostics.reportError(e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    @Override
    public TypeSignature getStaticType() {
        return method == null ? TypeSignature.OBJECT : method.returnType();
    }

    @Override
    public String toString() {
        return instance + "." + methodName + "()";
    }
}
