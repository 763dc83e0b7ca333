package org.snapeval.compiler;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.api.RemoteMethod;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.runtime.value.DebugObject;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An in-memory stack frame for tests.
 */
public class StubExpressionContext implements IExpressionContext {

    private final Map<String, DebugObject> variables = new HashMap<>();
    private final Map<String, String> unreadable = new HashMap<>();
    private final Map<String, RemoteMethod> methods = new HashMap<>();

    public StubExpressionContext withVariable(String name, DebugObject value) {
        variables.put(name, value);
        return this;
    }

    /**
     * Declares a variable whose type resolves but whose value cannot be read.
     */
    public StubExpressionContext withUnreadableVariable(String name, String reason) {
        unreadable.put(name, reason);
        return this;
    }

    public StubExpressionContext withMethod(String ownerType, String name, TypeSignature returnType) {
        methods.put(ownerType + "#" + name, new RemoteMethod(ownerType, name, returnType));
        return this;
    }

    @Override
    public Optional<TypeSignature> resolveVariableType(String name) {
        if (unreadable.containsKey(name)) {
            return Optional.of(TypeSignature.OBJECT);
        }
        DebugObject value = variables.get(name);
        return value == null
                ? Optional.empty()
                : Optional.of(new TypeSignature(value.getElementKind(), value.getTypeName()));
    }

    @Override
    public DebugObject readVariable(String name) throws ExpressionEvaluationException {
        if (unreadable.containsKey(name)) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.EVALUATION_FAILED, unreadable.get(name));
        }
        DebugObject value = variables.get(name);
        if (value == null) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.UNKNOWN_IDENTIFIER, "No variable " + name);
        }
        return value;
    }

    @Override
    public Optional<RemoteMethod> resolveMethod(TypeSignature owner, String name) {
        return Optional.ofNullable(methods.get(owner.typeName() + "#" + name));
    }
}
