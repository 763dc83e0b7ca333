package org.snapeval.compiler.api;

import org.snapeval.compiler.types.TypeSignature;

import java.util.Objects;

/**
 * A method or property getter of a type in the target process that can be invoked through
 * a runtime-level evaluation.
 *
 * @param ownerType    The declaring type name.
 * @param name         The member name, e.g. {@code get_Count}.
 * @param returnType   The static type of the returned value.
 */
public record RemoteMethod(String ownerType, String name, TypeSignature returnType) {

    public RemoteMethod {
        Objects.requireNonNull(ownerType, "ownerType");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
    }

    /**
     * @return The name the runtime uses to locate the function.
     */
    public String qualifiedName() {
        return ownerType + "." + name;
    }
}
