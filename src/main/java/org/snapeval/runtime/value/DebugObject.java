package org.snapeval.runtime.value;

/**
 * A value observed in the target process: a primitive scalar, a string, or a composite reference.
 * <p>
 * Instances are immutable once created. They are freely shared between the evaluator, the
 * coordinator and whatever formats the value for display.
 */
public abstract class DebugObject {

    private final ElementKind elementKind;

    /**
     * @param elementKind The declared element kind of this value.
     */
    protected DebugObject(ElementKind elementKind) {
        this.elementKind = elementKind;
    }

    /**
     * @return The declared element kind of this value.
     */
    public ElementKind getElementKind() {
        return elementKind;
    }

    /**
     * Returns the identity of this value in the target process. Two values with the same
     * non-zero address refer to the same object.
     *
     * @return The address, or {@code 0} for values without identity.
     */
    public abstract long getAddress();

    /**
     * @return The display name of the declared type.
     */
    public String getTypeName() {
        return elementKind.getTypeName();
    }
}
