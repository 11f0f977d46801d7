package org.kwindex.runtime.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Value}: text regeneration, interpretation replacement and the
 * descriptor dispatch for free/duplicate/stringify/convert.
 */
@Tag("unit")
class ValueTest {

    /**
     * Interpretation kind that parses decimal integers and records every descriptor call.
     */
    static class RecordingIntType implements ITypeDescriptor<int[]> {
        final List<String> calls = new ArrayList<>();

        @Override
        public String name() {
            return "int";
        }

        @Override
        public void free(int[] payload) {
            calls.add("free " + payload[0]);
        }

        @Override
        public int[] duplicate(int[] payload) {
            calls.add("dup " + payload[0]);
            return new int[]{payload[0]};
        }

        @Override
        public String updateString(int[] payload) {
            calls.add("string " + payload[0]);
            return Integer.toString(payload[0]);
        }

        @Override
        public int[] setFromAny(Value value) throws ValueConversionException {
            try {
                return new int[]{Integer.parseInt(value.getText())};
            } catch (NumberFormatException e) {
                throw new ValueConversionException("expected integer but got \"" + value.getText() + "\"");
            }
        }
    }

    private final RecordingIntType intType = new RecordingIntType();

    @Test
    void testPureStringHasNoInterpretation() {
        Value value = Value.of("hello");

        assertThat(value.getText()).isEqualTo("hello");
        assertThat(value.getInternalRep()).isEmpty();
        assertThat(value.getTypeName()).isNull();
    }

    @Test
    void testConvertInstallsInterpretationAndKeepsText() throws Exception {
        Value value = Value.of("42");

        int[] payload = value.convertTo(intType);

        assertThat(payload[0]).isEqualTo(42);
        assertThat(value.getTypeName()).isEqualTo("int");
        assertThat(value.getText()).isEqualTo("42");
        assertThat(value.convertTo(intType)).isSameAs(payload);
    }

    @Test
    void testFailedConversionLeavesValueUntouched() {
        Value value = Value.of("abc");

        assertThatThrownBy(() -> value.convertTo(intType))
                .isInstanceOf(ValueConversionException.class)
                .hasMessage("expected integer but got \"abc\"");
        assertThat(value.getInternalRep()).isEmpty();
    }

    @Test
    @DisplayName("Dropped text is regenerated through the descriptor on demand")
    void testTextRegeneratedLazily() throws Exception {
        Value value = Value.of("007");
        value.convertTo(intType);

        value.invalidateText();

        assertThat(value.hasText()).isFalse();
        assertThat(value.getText()).isEqualTo("7");
        assertThat(value.hasText()).isTrue();
        assertThat(intType.calls).containsExactly("string 7");
    }

    @Test
    void testInvalidateTextWithoutInterpretationIsRejected() {
        Value value = Value.of("x");

        assertThatThrownBy(value::invalidateText).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Installing a different interpretation frees the old one first")
    void testReplacingInterpretationFreesOldPayload() {
        Value value = Value.of("1");
        value.setInternalRep(intType, new int[]{1});

        value.setInternalRep(intType, new int[]{2});

        assertThat(intType.calls).containsExactly("free 1");
        assertThat(value.getInternalRep(intType)).hasValueSatisfying(p -> assertThat(p[0]).isEqualTo(2));
    }

    @Test
    void testReinstallingSamePayloadIsNoOp() {
        Value value = Value.of("1");
        int[] payload = {1};
        value.setInternalRep(intType, payload);

        value.setInternalRep(intType, payload);

        assertThat(intType.calls).isEmpty();
    }

    @Test
    @DisplayName("Replacing the only source of the text materializes it before freeing")
    void testReplacingKeepsRegeneratedText() {
        Value value = Value.of("5");
        value.setInternalRep(intType, new int[]{5});
        value.invalidateText();

        value.setInternalRep(intType, new int[]{6});

        assertThat(value.getText()).isEqualTo("5");
        assertThat(intType.calls).containsExactly("string 5", "free 5");
    }

    @Test
    void testDuplicateCopiesPayloadThroughDescriptor() {
        Value value = Value.of("3");
        int[] payload = {3};
        value.setInternalRep(intType, payload);

        Value copy = value.duplicate();

        assertThat(copy.getText()).isEqualTo("3");
        assertThat(copy.getInternalRep(intType)).hasValueSatisfying(p -> {
            assertThat(p).isNotSameAs(payload);
            assertThat(p[0]).isEqualTo(3);
        });
        assertThat(intType.calls).containsExactly("dup 3");
    }

    @Test
    void testSetTextFreesInterpretation() {
        Value value = Value.of("8");
        value.setInternalRep(intType, new int[]{8});

        value.setText("nine");

        assertThat(value.getText()).isEqualTo("nine");
        assertThat(value.getInternalRep()).isEmpty();
        assertThat(intType.calls).containsExactly("free 8");
    }

    @Test
    void testReleaseFreesAndKeepsText() {
        Value value = Value.of("4");
        value.setInternalRep(intType, new int[]{4});
        value.invalidateText();

        value.release();

        assertThat(value.getInternalRep()).isEmpty();
        assertThat(value.getText()).isEqualTo("4");
        assertThat(intType.calls).containsExactly("string 4", "free 4");
    }

    @Test
    void testHasCompatibleRepDoesNotMatchOtherKinds() {
        Value value = Value.of("4");
        value.setInternalRep(intType, new int[]{4});

        assertThat(value.hasCompatibleRep(intType, p -> p[0] == 4)).isTrue();
        assertThat(value.hasCompatibleRep(intType, p -> p[0] == 5)).isFalse();
        assertThat(value.hasCompatibleRep(new RecordingIntType(), p -> true)).isFalse();
    }
}
