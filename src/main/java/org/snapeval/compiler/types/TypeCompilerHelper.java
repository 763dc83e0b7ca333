package org.snapeval.compiler.types;

import org.snapeval.runtime.value.ElementKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Classification predicates over element kinds used during compilation.
 */
public final class TypeCompilerHelper {

    private static final Set<ElementKind> INTEGRAL = EnumSet.of(
            ElementKind.CHAR, ElementKind.I1, ElementKind.U1, ElementKind.I2, ElementKind.U2,
            ElementKind.I4, ElementKind.U4, ElementKind.I8, ElementKind.U8);

    private static final Set<ElementKind> SIGNED = EnumSet.of(
            ElementKind.I1, ElementKind.I2, ElementKind.I4, ElementKind.I8);

    private TypeCompilerHelper() {}

    /**
     * @param kind The element kind.
     * @return {@code true} for integral kinds, including {@code CHAR}.
     */
    public static boolean isIntegralType(ElementKind kind) {
        return INTEGRAL.contains(kind);
    }

    /**
     * @param kind The element kind.
     * @return {@code true} for integral and floating point kinds.
     */
    public static boolean isNumericalType(ElementKind kind) {
        return isIntegralType(kind) || kind == ElementKind.R4 || kind == ElementKind.R8;
    }

    /**
     * @param kind The element kind.
     * @return {@code true} for signed integral kinds.
     */
    public static boolean isSignedType(ElementKind kind) {
        return SIGNED.contains(kind);
    }
}
