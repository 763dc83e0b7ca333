package org.snapeval.runtime.value;

/**
 * The declared element kind of a value observed in the target process.
 * <p>
 * Mirrors the element types of the inspected runtime's type system. Each kind carries
 * the source-language type name used when a {@code TypeSignature} is rendered.
 */
public enum ElementKind {
    BOOLEAN("System.Boolean"),
    CHAR("System.Char"),
    I1("System.SByte"),
    U1("System.Byte"),
    I2("System.Int16"),
    U2("System.UInt16"),
    I4("System.Int32"),
    U4("System.UInt32"),
    I8("System.Int64"),
    U8("System.UInt64"),
    R4("System.Single"),
    R8("System.Double"),
    STRING("System.String"),
    CLASS("System.Object"),
    VALUETYPE("System.ValueType"),
    ARRAY("System.Array"),
    OBJECT("System.Object"),
    VOID("System.Void");

    private final String typeName;

    ElementKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return The fully qualified source-language name of this kind.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * @return {@code true} for kinds whose values are reference types with an identity.
     */
    public boolean isReference() {
        return this == STRING || this == CLASS || this == ARRAY || this == OBJECT;
    }
}
