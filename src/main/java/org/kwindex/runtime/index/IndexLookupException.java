package org.kwindex.runtime.index;

import org.kwindex.runtime.value.ValueConversionException;

/**
 * Thrown when a value cannot be resolved to a table entry. The message is the
 * user-facing error text, e.g. {@code bad option "x": must be get, set, or unset}.
 */
public class IndexLookupException extends ValueConversionException {

    /**
     * Why a lookup failed.
     */
    public enum Reason {
        /** No entry matched, including the empty-input case. */
        NO_MATCH,
        /** Several entries matched as abbreviations and none matched exactly. */
        AMBIGUOUS,
        /** An index conversion was requested without a table. */
        UNSUPPORTED_CONVERSION
    }

    private final Reason reason;

    public IndexLookupException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
