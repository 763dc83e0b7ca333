package org.snapeval.runtime.value;

import java.util.Objects;

/**
 * A primitive scalar value extracted from the target process.
 * <p>
 * Unsigned kinds are carried in the bit pattern of the signed Java type of the same width:
 * {@code U1} in a {@link Byte}, {@code U2} in a {@link Short}, {@code U4} in an {@link Integer}
 * and {@code U8} in a {@link Long}.
 */
public final class DebugPrimitive extends DebugObject {

    private final Object value;

    /**
     * Creates a primitive of the given kind.
     *
     * @param kind  A primitive element kind.
     * @param value The boxed payload; its Java type must match {@code kind}.
     * @throws IllegalArgumentException if {@code kind} is not primitive or the payload type does not match.
     */
    public DebugPrimitive(ElementKind kind, Object value) {
        super(kind);
        Objects.requireNonNull(value, "value");
        Class<?> expected = payloadType(kind);
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(String.format(
                    "Payload of type %s does not match element kind %s (expected %s)",
                    value.getClass().getSimpleName(), kind, expected.getSimpleName()));
        }
        this.value = value;
    }

    public static DebugPrimitive ofBoolean(boolean value) {
        return new DebugPrimitive(ElementKind.BOOLEAN, value);
    }

    public static DebugPrimitive ofInt32(int value) {
        return new DebugPrimitive(ElementKind.I4, value);
    }

    public static DebugPrimitive ofUInt32(int bits) {
        return new DebugPrimitive(ElementKind.U4, bits);
    }

    public static DebugPrimitive ofInt64(long value) {
        return new DebugPrimitive(ElementKind.I8, value);
    }

    public static DebugPrimitive ofUInt64(long bits) {
        return new DebugPrimitive(ElementKind.U8, bits);
    }

    public static DebugPrimitive ofFloat32(float value) {
        return new DebugPrimitive(ElementKind.R4, value);
    }

    public static DebugPrimitive ofFloat64(double value) {
        return new DebugPrimitive(ElementKind.R8, value);
    }

    /**
     * @return The boxed payload exactly as stored.
     */
    public Object getValue() {
        return value;
    }

    @Override
    public long getAddress() {
        return 0L;
    }

    /**
     * Returns the Java payload type used for a primitive element kind.
     *
     * @param kind The element kind.
     * @return The boxed Java class holding values of that kind.
     * @throws IllegalArgumentException if {@code kind} is not a primitive kind.
     */
    static Class<?> payloadType(ElementKind kind) {
        return switch (kind) {
            case BOOLEAN -> Boolean.class;
            case CHAR -> Character.class;
            case I1, U1 -> Byte.class;
            case I2, U2 -> Short.class;
            case I4, U4 -> Integer.class;
            case I8, U8 -> Long.class;
            case R4 -> Float.class;
            case R8 -> Double.class;
            default -> throw new IllegalArgumentException("Not a primitive element kind: " + kind);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DebugPrimitive other)) return false;
        return getElementKind() == other.getElementKind() && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getElementKind(), value);
    }

    @Override
    public String toString() {
        String rendered = switch (getElementKind()) {
            case U1 -> Integer.toString(Byte.toUnsignedInt((Byte) value));
            case U2 -> Integer.toString(Short.toUnsignedInt((Short) value));
            case U4 -> Integer.toUnsignedString((Integer) value);
            case U8 -> Long.toUnsignedString((Long) value);
            default -> value.toString();
        };
        return rendered + ":" + getTypeName();
    }
}
