package org.snapeval.runtime.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DebugPrimitiveTest {

    @Test
    void payloadMustMatchTheKind() {
        assertThatThrownBy(() -> new DebugPrimitive(ElementKind.I4, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("I4");
        assertThatThrownBy(() -> new DebugPrimitive(ElementKind.STRING, "abc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unsignedValuesRenderUnsigned() {
        assertThat(DebugPrimitive.ofUInt32(-1)).hasToString("4294967295:System.UInt32");
        assertThat(DebugPrimitive.ofUInt64(-1L)).hasToString("18446744073709551615:System.UInt64");
        assertThat(new DebugPrimitive(ElementKind.U1, (byte) 0xFF)).hasToString("255:System.Byte");
    }

    @Test
    void equalityIncludesTheKind() {
        assertThat(DebugPrimitive.ofInt32(1)).isEqualTo(DebugPrimitive.ofInt32(1));
        assertThat(DebugPrimitive.ofInt32(1)).isNotEqualTo(DebugPrimitive.ofUInt32(1));
    }

    @Test
    void primitivesHaveNoIdentity() {
        assertThat(DebugPrimitive.ofFloat64(1.5).getAddress()).isZero();
        assertThat(DebugReference.nullReference("Sample.Node").isNull()).isTrue();
        assertThat(new DebugString("abc", 0x20L).getAddress()).isEqualTo(0x20L);
    }

    @Test
    void factoryReusesBooleans() {
        DebugObjectFactory factory = new DebugObjectFactory();

        assertThat(factory.createBoolean(true)).isSameAs(factory.createBoolean(true));
        assertThat(factory.createPrimitive(ElementKind.I8, 5L)).isEqualTo(DebugPrimitive.ofInt64(5L));
        assertThat(factory.createString("x")).isInstanceOf(DebugString.class);
    }
}
