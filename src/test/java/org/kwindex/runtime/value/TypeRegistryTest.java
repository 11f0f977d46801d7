package org.kwindex.runtime.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.kwindex.runtime.index.IndexLookupException;
import org.kwindex.runtime.index.IndexType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TypeRegistryTest {

    @Test
    void testDefaultsContainIndexKind() {
        TypeRegistry registry = TypeRegistry.initializeWithDefaults();

        assertThat(registry.lookup("index")).containsSame(IndexType.INSTANCE);
        assertThat(registry.lookup("int")).isEmpty();
    }

    @Test
    void testDuplicateNameIsRejected() {
        TypeRegistry registry = TypeRegistry.initializeWithDefaults();
        registry.register(IndexType.INSTANCE);

        assertThatThrownBy(() -> registry.register(new ValueTest.RecordingIntType() {
            @Override
            public String name() {
                return "index";
            }
        })).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("index");
    }

    @Test
    void testGenericConversionToIndexFails() {
        TypeRegistry registry = TypeRegistry.initializeWithDefaults();
        ITypeDescriptor<?> indexType = registry.lookup("index").orElseThrow();
        Value value = Value.of("start");

        assertThatThrownBy(() -> value.convertTo(indexType))
                .isInstanceOfSatisfying(IndexLookupException.class, e ->
                        assertThat(e.getReason()).isEqualTo(IndexLookupException.Reason.UNSUPPORTED_CONVERSION))
                .hasMessage("can't convert value to index except via IndexResolver.resolve");
        assertThat(value.getInternalRep()).isEmpty();
    }
}
