package org.kwindex.runtime.value;

/**
 * Capability record for one kind of cached interpretation ("internal representation")
 * that a {@link Value} can carry next to its canonical text.
 * <p>
 * Every interpretation is installed together with its descriptor, and all mutation paths
 * (replace, duplicate, free, stringify) go through the descriptor. This keeps {@link Value}
 * agnostic of how many interpretation kinds exist.
 * <p>
 * Implementations are stateless singletons shared by every value of that kind and are
 * registered once in a {@link TypeRegistry}.
 *
 * @param <P> The payload type stored in the value's interpretation slot.
 */
public interface ITypeDescriptor<P> {

    /**
     * Gets the registry name of this interpretation kind (e.g., {@code "index"}).
     *
     * @return The kind name, never {@code null}.
     */
    String name();

    /**
     * Releases a payload that is being detached from its value.
     * <p>
     * Called exactly once per installed payload, before it is replaced or when the owning
     * value is released.
     *
     * @param payload The payload to release.
     */
    void free(P payload);

    /**
     * Creates an independent copy of a payload for a duplicated value.
     *
     * @param payload The source payload.
     * @return A payload that can be owned by another value.
     */
    P duplicate(P payload);

    /**
     * Regenerates the canonical text of a value from its payload.
     *
     * @param payload The payload of a value whose text was dropped.
     * @return The canonical text.
     */
    String updateString(P payload);

    /**
     * Converts a value from its text (or any other interpretation) into this kind.
     *
     * @param value The value to convert.
     * @return The new payload; the caller installs it on the value.
     * @throws ValueConversionException If the text cannot be converted without additional context.
     */
    P setFromAny(Value value) throws ValueConversionException;
}
