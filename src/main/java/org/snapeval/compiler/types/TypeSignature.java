package org.snapeval.compiler.types;

import org.snapeval.runtime.value.ElementKind;

import java.util.Objects;

/**
 * The static type of an expression node, computed by {@code compile}.
 *
 * @param elementKind The element kind of the result.
 * @param typeName    The display name of the result type.
 */
public record TypeSignature(ElementKind elementKind, String typeName) {

    public static final TypeSignature BOOLEAN = of(ElementKind.BOOLEAN);
    public static final TypeSignature OBJECT = of(ElementKind.OBJECT);
    public static final TypeSignature STRING = of(ElementKind.STRING);

    public TypeSignature {
        Objects.requireNonNull(elementKind, "elementKind");
        Objects.requireNonNull(typeName, "typeName");
    }

    /**
     * Creates the signature of a kind named after the kind itself.
     *
     * @param kind The element kind.
     * @return The signature.
     */
    public static TypeSignature of(ElementKind kind) {
        return new TypeSignature(kind, kind.getTypeName());
    }

    @Override
    public String toString() {
        return typeName;
    }
}
