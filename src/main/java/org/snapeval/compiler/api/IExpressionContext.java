package org.snapeval.compiler.api;

import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.runtime.value.DebugObject;

import java.util.Optional;

/**
 * The suspended stack frame an expression is compiled and evaluated against. Symbol
 * resolution and value reading live behind this interface.
 */
public interface IExpressionContext {

    /**
     * Resolves the static type of a local variable, argument or field visible in the frame.
     *
     * @param name The identifier.
     * @return The type, or empty if the name is unknown.
     */
    Optional<TypeSignature> resolveVariableType(String name);

    /**
     * Reads the live value of a variable.
     *
     * @param name The identifier, previously resolved by {@link #resolveVariableType(String)}.
     * @return The value.
     * @throws ExpressionEvaluationException if the value cannot be read.
     */
    DebugObject readVariable(String name) throws ExpressionEvaluationException;

    /**
     * Resolves a method or property getter on a type.
     *
     * @param owner The static type of the instance.
     * @param name  The member name.
     * @return The method, or empty if the type has no such member.
     */
    Optional<RemoteMethod> resolveMethod(TypeSignature owner, String name);
}
