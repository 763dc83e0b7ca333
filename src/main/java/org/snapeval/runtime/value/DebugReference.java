package org.snapeval.runtime.value;

import java.util.Objects;

/**
 * A composite value (class instance, boxed value type or array) identified by its address.
 * A reference with address {@code 0} is the null reference.
 */
public final class DebugReference extends DebugObject {

    private final long address;
    private final String typeName;

    /**
     * @param kind     One of {@code CLASS}, {@code VALUETYPE}, {@code ARRAY} or {@code OBJECT}.
     * @param typeName The declared type name, e.g. {@code System.Collections.Generic.List`1}.
     * @param address  The address of the object, {@code 0} for null.
     */
    public DebugReference(ElementKind kind, String typeName, long address) {
        super(kind);
        if (kind != ElementKind.CLASS && kind != ElementKind.VALUETYPE
                && kind != ElementKind.ARRAY && kind != ElementKind.OBJECT) {
            throw new IllegalArgumentException("Not a composite element kind: " + kind);
        }
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.address = address;
    }

    public static DebugReference nullReference(String typeName) {
        return new DebugReference(ElementKind.CLASS, typeName, 0L);
    }

    @Override
    public long getAddress() {
        return address;
    }

    @Override
    public String getTypeName() {
        return typeName;
    }

    public boolean isNull() {
        return address == 0L;
    }

    @Override
    public String toString() {
        return isNull() ? "null:" + typeName : String.format("%s@0x%x", typeName, address);
    }
}
