package org.snapeval.runtime.value;

import java.util.Objects;

/**
 * A string object in the target process. The content is read once when the value is
 * created; the address keeps the identity of the backing object.
 */
public final class DebugString extends DebugObject {

    private final String content;
    private final long address;

    /**
     * Creates a string value that has no backing object, e.g. a literal or a computed result.
     *
     * @param content The text content.
     */
    public DebugString(String content) {
        this(content, 0L);
    }

    /**
     * @param content The text content.
     * @param address The address of the backing string object.
     */
    public DebugString(String content, long address) {
        super(ElementKind.STRING);
        this.content = Objects.requireNonNull(content, "content");
        this.address = address;
    }

    public String getContent() {
        return content;
    }

    @Override
    public long getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "\"" + content + "\":" + getTypeName();
    }
}
