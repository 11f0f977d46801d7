package org.kwindex.runtime.value;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A dual-representation interpreter value: an optional canonical text plus an optional
 * cached interpretation ({@link InternalRep}). At least one of the two is always present.
 * <p>
 * The text is the source of truth. An interpretation is a cache derived from it and may be
 * replaced at any time by a different kind ("shimmering"). When the text has been dropped
 * via {@link #invalidateText()}, it is regenerated from the interpretation on demand.
 * <p>
 * Thread Safety: Not thread-safe. A value has a single owner; concurrent use of the same
 * value must be excluded by the caller.
 */
public final class Value {

    private String text;
    private InternalRep<?> internalRep;

    /**
     * Creates a pure string value with no interpretation.
     *
     * @param text The canonical text.
     */
    public Value(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    private Value(String text, InternalRep<?> internalRep) {
        this.text = text;
        this.internalRep = internalRep;
    }

    /**
     * Convenience factory for a pure string value.
     *
     * @param text The canonical text.
     * @return A new value.
     */
    public static Value of(String text) {
        return new Value(text);
    }

    /**
     * Gets the canonical text, regenerating it from the interpretation if it was dropped.
     *
     * @return The canonical text.
     * @throws IllegalStateException If the value has neither text nor an interpretation.
     */
    public String getText() {
        if (text == null) {
            if (internalRep == null) {
                throw new IllegalStateException("Value has neither text nor an internal representation");
            }
            text = internalRep.updateString();
        }
        return text;
    }

    /**
     * Checks whether the canonical text is currently materialized.
     *
     * @return {@code true} if {@link #getText()} would not need to regenerate the text.
     */
    public boolean hasText() {
        return text != null;
    }

    /**
     * Replaces the canonical text. Any interpretation is freed, since it was derived from
     * the old text.
     *
     * @param newText The new canonical text.
     */
    public void setText(String newText) {
        Objects.requireNonNull(newText, "newText");
        freeInternalRep();
        this.text = newText;
    }

    /**
     * Drops the canonical text so that it is regenerated from the interpretation on the
     * next {@link #getText()}. Used after the interpretation has been modified directly.
     *
     * @throws IllegalStateException If the value has no interpretation to regenerate from.
     */
    public void invalidateText() {
        if (internalRep == null) {
            throw new IllegalStateException("Cannot drop the text of a value without an internal representation");
        }
        text = null;
    }

    /**
     * Gets the current interpretation, if any.
     *
     * @return The interpretation, or empty for a pure string value.
     */
    public Optional<InternalRep<?>> getInternalRep() {
        return Optional.ofNullable(internalRep);
    }

    /**
     * Gets the payload of the current interpretation if it is of the given kind.
     * <p>
     * The payload is the live object owned by this value, not a copy. It may be updated in
     * place by the code that created it; it must not be installed on another value (use
     * {@link #duplicate()} to get a value with its own payload).
     *
     * @param type The interpretation kind.
     * @param <P>  The payload type of that kind.
     * @return The payload, or empty if the value carries no interpretation of that kind.
     */
    @SuppressWarnings("unchecked")
    public <P> Optional<P> getInternalRep(ITypeDescriptor<P> type) {
        if (internalRep != null && internalRep.type() == type) {
            return Optional.of((P) internalRep.payload());
        }
        return Optional.empty();
    }

    /**
     * Tests whether the value carries an interpretation of the given kind whose payload
     * satisfies the predicate, without exposing the payload to the caller.
     *
     * @param type      The interpretation kind.
     * @param reusable  Decides whether the payload answers the caller's query.
     * @param <P>       The payload type of that kind.
     * @return {@code true} if the cached interpretation can be reused.
     */
    public <P> boolean hasCompatibleRep(ITypeDescriptor<P> type, Predicate<? super P> reusable) {
        return getInternalRep(type).filter(reusable).isPresent();
    }

    /**
     * Installs an interpretation on this value.
     * <p>
     * If the value already carries exactly this payload under the same descriptor (the
     * payload was updated in place), nothing changes. Otherwise the old interpretation, if
     * any, is freed through its own descriptor before the new one is attached.
     *
     * @param type    The descriptor of the new interpretation.
     * @param payload The payload, owned by this value from now on. A payload must have a
     *                single owner: never pass one obtained from another value.
     * @param <P>     The payload type.
     */
    public <P> void setInternalRep(ITypeDescriptor<P> type, P payload) {
        if (internalRep != null && internalRep.type() == type && internalRep.payload() == payload) {
            return;
        }
        InternalRep<P> replacement = new InternalRep<>(type, payload);
        // the old interpretation may be the only source of the text
        getText();
        freeInternalRep();
        internalRep = replacement;
    }

    /**
     * Converts this value to the given interpretation kind using only the value itself.
     *
     * @param type The target kind.
     * @param <P>  The payload type of that kind.
     * @return The payload of the (possibly newly installed) interpretation.
     * @throws ValueConversionException If the kind cannot be derived from the text alone.
     */
    public <P> P convertTo(ITypeDescriptor<P> type) throws ValueConversionException {
        Optional<P> cached = getInternalRep(type);
        if (cached.isPresent()) {
            return cached.get();
        }
        P payload = type.setFromAny(this);
        setInternalRep(type, payload);
        return payload;
    }

    /**
     * Creates an independent copy of this value. The interpretation, if any, is copied
     * through its descriptor.
     *
     * @return The copy.
     */
    public Value duplicate() {
        return new Value(text, internalRep == null ? null : internalRep.duplicate());
    }

    /**
     * Releases this value's interpretation. The text is materialized first so that the
     * value stays readable.
     */
    public void release() {
        if (internalRep != null) {
            getText();
            freeInternalRep();
        }
    }

    /**
     * Gets the name of the current interpretation kind.
     *
     * @return The kind name, or {@code null} for a pure string value.
     */
    public String getTypeName() {
        return internalRep == null ? null : internalRep.type().name();
    }

    private void freeInternalRep() {
        if (internalRep != null) {
            InternalRep<?> old = internalRep;
            internalRep = null;
            old.free();
        }
    }

    @Override
    public String toString() {
        return getText();
    }
}
