package org.snapeval.runtime.value;

/**
 * Default {@link IDebugObjectFactory} creating plain in-process values.
 */
public class DebugObjectFactory implements IDebugObjectFactory {

    private static final DebugPrimitive TRUE = DebugPrimitive.ofBoolean(true);
    private static final DebugPrimitive FALSE = DebugPrimitive.ofBoolean(false);

    @Override
    public DebugObject createPrimitive(ElementKind kind, Object value) {
        return new DebugPrimitive(kind, value);
    }

    @Override
    public DebugObject createBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public DebugObject createString(String content) {
        return new DebugString(content);
    }
}
