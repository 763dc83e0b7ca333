package org.snapeval.compiler.types;

import org.snapeval.runtime.value.ElementKind;

/**
 * The scalar kinds binary operations are actually computed in after promotion.
 */
public enum ScalarKind {
    INT32(ElementKind.I4, 0x1f),
    UINT32(ElementKind.U4, 0x1f),
    INT64(ElementKind.I8, 0x3f),
    UINT64(ElementKind.U8, 0x3f),
    FLOAT32(ElementKind.R4, 0),
    FLOAT64(ElementKind.R8, 0);

    private final ElementKind elementKind;
    private final int shiftMask;

    ScalarKind(ElementKind elementKind, int shiftMask) {
        this.elementKind = elementKind;
        this.shiftMask = shiftMask;
    }

    public ElementKind getElementKind() {
        return elementKind;
    }

    /**
     * Returns the mask applied to a shift count: the low five bits for 32-bit kinds, the low
     * six bits for 64-bit kinds.
     *
     * @return The mask, {@code 0} for floating kinds.
     */
    public int getShiftMask() {
        return shiftMask;
    }

    public boolean isUnsigned() {
        return this == UINT32 || this == UINT64;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    /**
     * Maps a promoted element kind to its scalar kind.
     *
     * @param kind One of {@code I4, U4, I8, U8, R4, R8}.
     * @return The scalar kind.
     * @throws IllegalArgumentException for any other kind.
     */
    public static ScalarKind fromElementKind(ElementKind kind) {
        return switch (kind) {
            case I4 -> INT32;
            case U4 -> UINT32;
            case I8 -> INT64;
            case U8 -> UINT64;
            case R4 -> FLOAT32;
            case R8 -> FLOAT64;
            default -> throw new IllegalArgumentException("Not a promoted scalar kind: " + kind);
        };
    }
}
