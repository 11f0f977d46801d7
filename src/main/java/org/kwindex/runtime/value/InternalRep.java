package org.kwindex.runtime.value;

import java.util.Objects;

/**
 * A cached interpretation: a payload together with the descriptor that owns it.
 *
 * @param type    The descriptor of the interpretation kind.
 * @param payload The kind-specific payload.
 * @param <P>     The payload type.
 */
public record InternalRep<P>(ITypeDescriptor<P> type, P payload) {

    public InternalRep {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
    }

    void free() {
        type.free(payload);
    }

    InternalRep<P> duplicate() {
        return new InternalRep<>(type, type.duplicate(payload));
    }

    String updateString() {
        return type.updateString(payload);
    }
}
