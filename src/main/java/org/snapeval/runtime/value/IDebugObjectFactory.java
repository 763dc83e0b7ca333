package org.snapeval.runtime.value;

/**
 * Constructs result values produced by in-process evaluation.
 */
public interface IDebugObjectFactory {

    /**
     * Creates a primitive value.
     *
     * @param kind  A primitive element kind.
     * @param value The boxed payload matching {@code kind}.
     * @return The new value.
     */
    DebugObject createPrimitive(ElementKind kind, Object value);

    /**
     * Creates a boolean value.
     *
     * @param value The payload.
     * @return The new value.
     */
    DebugObject createBoolean(boolean value);

    /**
     * Creates a string value without a backing object in the target.
     *
     * @param content The text content.
     * @return The new value.
     */
    DebugObject createString(String content);
}
