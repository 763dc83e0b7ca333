package org.snapeval.compiler.types;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.DebugPrimitive;
import org.snapeval.runtime.value.DebugString;
import org.snapeval.runtime.value.ElementKind;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Numeric promotion rules and typed extraction of primitive payloads.
 * <p>
 * Promotion follows the binary numeric promotion of the inspected language. Extraction
 * accepts any value whose kind converts implicitly to the requested kind: signed values
 * sign-extend, unsigned values zero-extend.
 */
public final class NumericCompilerHelper {

    private static final Set<ElementKind> PROMOTED_TO_INT = EnumSet.of(
            ElementKind.CHAR, ElementKind.I1, ElementKind.U1, ElementKind.I2, ElementKind.U2);

    private static final Set<ElementKind> CONVERTIBLE_TO_INT32 = EnumSet.of(
            ElementKind.CHAR, ElementKind.I1, ElementKind.U1, ElementKind.I2, ElementKind.U2, ElementKind.I4);

    private static final Set<ElementKind> CONVERTIBLE_TO_UINT32 = EnumSet.of(
            ElementKind.CHAR, ElementKind.U1, ElementKind.U2, ElementKind.U4);

    private static final Set<ElementKind> CONVERTIBLE_TO_INT64 = EnumSet.of(
            ElementKind.CHAR, ElementKind.I1, ElementKind.U1, ElementKind.I2, ElementKind.U2,
            ElementKind.I4, ElementKind.U4, ElementKind.I8);

    private static final Set<ElementKind> CONVERTIBLE_TO_UINT64 = EnumSet.of(
            ElementKind.CHAR, ElementKind.U1, ElementKind.U2, ElementKind.U4, ElementKind.U8);

    private NumericCompilerHelper() {}

    /**
     * Computes the kind a binary numeric operation is performed in.
     * <ol>
     *   <li>either operand {@code R8}: {@code R8}</li>
     *   <li>either operand {@code R4}: {@code R4}</li>
     *   <li>either operand {@code U8}: {@code U8}, unless the other operand is signed</li>
     *   <li>either operand {@code I8}: {@code I8}</li>
     *   <li>either operand {@code U4}: {@code I8} if the other operand is signed, else {@code U4}</li>
     *   <li>otherwise {@code I4}</li>
     * </ol>
     *
     * @param first  The kind of the first operand.
     * @param second The kind of the second operand.
     * @return The promoted kind, or empty on a type mismatch.
     */
    public static Optional<ElementKind> binaryNumericalPromotion(ElementKind first, ElementKind second) {
        if (!TypeCompilerHelper.isNumericalType(first) || !TypeCompilerHelper.isNumericalType(second)) {
            return Optional.empty();
        }
        if (first == ElementKind.R8 || second == ElementKind.R8) {
            return Optional.of(ElementKind.R8);
        }
        if (first == ElementKind.R4 || second == ElementKind.R4) {
            return Optional.of(ElementKind.R4);
        }
        if (first == ElementKind.U8 || second == ElementKind.U8) {
            ElementKind other = first == ElementKind.U8 ? second : first;
            if (TypeCompilerHelper.isSignedType(other)) {
                return Optional.empty();
            }
            return Optional.of(ElementKind.U8);
        }
        if (first == ElementKind.I8 || second == ElementKind.I8) {
            return Optional.of(ElementKind.I8);
        }
        if (first == ElementKind.U4 || second == ElementKind.U4) {
            ElementKind other = first == ElementKind.U4 ? second : first;
            return Optional.of(TypeCompilerHelper.isSignedType(other) ? ElementKind.I8 : ElementKind.U4);
        }
        return Optional.of(ElementKind.I4);
    }

    /**
     * @param kind The element kind.
     * @return {@code true} for kinds narrower than {@code int} that widen to {@code I4} in arithmetic.
     */
    public static boolean isNumericallyPromotedToInt(ElementKind kind) {
        return PROMOTED_TO_INT.contains(kind);
    }

    /**
     * Extracts a boolean payload.
     *
     * @param object The value.
     * @return The payload.
     * @throws ExpressionEvaluationException if the value is not a boolean.
     */
    public static boolean extractBoolean(DebugObject object) throws ExpressionEvaluationException {
        DebugPrimitive primitive = requirePrimitive(object, EnumSet.of(ElementKind.BOOLEAN), "System.Boolean");
        return (Boolean) primitive.getValue();
    }

    public static int extractInt32(DebugObject object) throws ExpressionEvaluationException {
        return (int) integralValue(requirePrimitive(object, CONVERTIBLE_TO_INT32, "System.Int32"));
    }

    /**
     * Extracts an unsigned 32-bit payload.
     *
     * @param object The value.
     * @return The unsigned value in the bits of an {@code int}.
     * @throws ExpressionEvaluationException if the value does not convert implicitly.
     */
    public static int extractUInt32(DebugObject object) throws ExpressionEvaluationException {
        return (int) integralValue(requirePrimitive(object, CONVERTIBLE_TO_UINT32, "System.UInt32"));
    }

    public static long extractInt64(DebugObject object) throws ExpressionEvaluationException {
        return integralValue(requirePrimitive(object, CONVERTIBLE_TO_INT64, "System.Int64"));
    }

    /**
     * Extracts an unsigned 64-bit payload.
     *
     * @param object The value.
     * @return The unsigned value in the bits of a {@code long}.
     * @throws ExpressionEvaluationException if the value does not convert implicitly.
     */
    public static long extractUInt64(DebugObject object) throws ExpressionEvaluationException {
        return integralValue(requirePrimitive(object, CONVERTIBLE_TO_UINT64, "System.UInt64"));
    }

    public static float extractFloat32(DebugObject object) throws ExpressionEvaluationException {
        DebugPrimitive primitive = requireNumeric(object, "System.Single");
        return switch (primitive.getElementKind()) {
            case R4 -> (Float) primitive.getValue();
            case R8 -> throw mismatch(primitive, "System.Single");
            default -> (float) integralAsDouble(primitive);
        };
    }

    public static double extractFloat64(DebugObject object) throws ExpressionEvaluationException {
        DebugPrimitive primitive = requireNumeric(object, "System.Double");
        return switch (primitive.getElementKind()) {
            case R4 -> (Float) primitive.getValue();
            case R8 -> (Double) primitive.getValue();
            default -> integralAsDouble(primitive);
        };
    }

    /**
     * Extracts the content of a string value.
     *
     * @param object The value.
     * @return The text content.
     * @throws ExpressionEvaluationException if the value is not a string.
     */
    public static String extractText(DebugObject object) throws ExpressionEvaluationException {
        if (object instanceof DebugString string) {
            return string.getContent();
        }
        throw mismatch(object, "System.String");
    }

    /**
     * Returns the mathematical value of an integral primitive. {@code U8} values above
     * {@code Long.MAX_VALUE} come back as their bit pattern.
     */
    private static long integralValue(DebugPrimitive primitive) {
        Object value = primitive.getValue();
        return switch (primitive.getElementKind()) {
            case CHAR -> (Character) value;
            case I1 -> (Byte) value;
            case U1 -> Byte.toUnsignedLong((Byte) value);
            case I2 -> (Short) value;
            case U2 -> Short.toUnsignedLong((Short) value);
            case I4 -> (Integer) value;
            case U4 -> Integer.toUnsignedLong((Integer) value);
            case I8, U8 -> (Long) value;
            default -> throw new IllegalArgumentException("Not integral: " + primitive.getElementKind());
        };
    }

    private static double integralAsDouble(DebugPrimitive primitive) {
        long value = integralValue(primitive);
        if (primitive.getElementKind() == ElementKind.U8 && value < 0) {
            // unsigned conversion, the low bit is kept so rounding stays correct
            return ((double) ((value >>> 1) | (value & 1L))) * 2.0;
        }
        return value;
    }

    private static DebugPrimitive requireNumeric(DebugObject object, String target) throws ExpressionEvaluationException {
        if (object instanceof DebugPrimitive primitive
                && TypeCompilerHelper.isNumericalType(primitive.getElementKind())) {
            return primitive;
        }
        throw mismatch(object, target);
    }

    private static DebugPrimitive requirePrimitive(DebugObject object, Set<ElementKind> accepted, String target)
            throws ExpressionEvaluationException {
        if (object instanceof DebugPrimitive primitive && accepted.contains(primitive.getElementKind())) {
            return primitive;
        }
        throw mismatch(object, target);
    }

    private static ExpressionEvaluationException mismatch(DebugObject object, String target) {
        String actual = object == null ? "null" : object.getTypeName();
        return new ExpressionEvaluationException(EvaluationErrorCode.TYPE_MISMATCH,
                String.format("Cannot extract %s from a value of type %s", target, actual));
    }
}
