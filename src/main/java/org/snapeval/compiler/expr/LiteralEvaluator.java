package org.snapeval.compiler.expr;

import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.DebugPrimitive;
import org.snapeval.runtime.value.DebugString;
import org.snapeval.runtime.value.IDebugObjectFactory;

import java.util.Objects;

/**
 * A constant such as {@code 42}, {@code 2.5} or {@code "abc"}.
 */
public class LiteralEvaluator implements IExpressionEvaluator {

    private final DebugObject value;
    private final TypeSignature staticType;

    /**
     * @param value The constant; its type is the static type of the node.
     */
    public LiteralEvaluator(DebugObject value) {
        this.value = Objects.requireNonNull(value, "value");
        this.staticType = new TypeSignature(value.getElementKind(), value.getTypeName());
    }

    public static LiteralEvaluator of(int value) {
        return new LiteralEvaluator(DebugPrimitive.ofInt32(value));
    }

    public static LiteralEvaluator of(long value) {
        return new LiteralEvaluator(DebugPrimitive.ofInt64(value));
    }

    public static LiteralEvaluator of(double value) {
        return new LiteralEvaluator(DebugPrimitive.ofFloat64(value));
    }

    public static LiteralEvaluator of(boolean value) {
        return new LiteralEvaluator(DebugPrimitive.ofBoolean(value));
    }

    public static LiteralEvaluator of(String value) {
        return new LiteralEvaluator(new DebugString(value));
    }

    @Override
    public void compile(IExpressionContext context, DiagnosticsEngine diagnostics) {
        // Nothing to resolve.
    }

    @Override
    public DebugObject evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory, DiagnosticsEngine diagnostics) {
        return value;
    }

    @Override
    public TypeSignature getStaticType() {
        return staticType;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
