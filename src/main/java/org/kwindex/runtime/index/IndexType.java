package org.kwindex.runtime.index;

import org.kwindex.runtime.value.ITypeDescriptor;
import org.kwindex.runtime.value.Value;

/**
 * Descriptor of the "index" interpretation produced by {@link IndexResolver}.
 * <p>
 * The text of an index value regenerates to the full table entry, never to the
 * abbreviation the user typed. Generic conversion is impossible because it needs a table;
 * {@link #setFromAny(Value)} always fails.
 */
public final class IndexType implements ITypeDescriptor<IndexRep> {

    /**
     * The shared descriptor instance.
     */
    public static final IndexType INSTANCE = new IndexType();

    static final String NAME = "index";

    private IndexType() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void free(IndexRep payload) {
        // drop the table reference so a freed payload cannot pin the table
        payload.clear();
    }

    @Override
    public IndexRep duplicate(IndexRep payload) {
        return new IndexRep(payload.getTable(), payload.getStride(), payload.getIndex());
    }

    @Override
    public String updateString(IndexRep payload) {
        return payload.entry();
    }

    @Override
    public IndexRep setFromAny(Value value) throws IndexLookupException {
        throw new IndexLookupException(IndexLookupException.Reason.UNSUPPORTED_CONVERSION,
                "can't convert value to index except via IndexResolver.resolve");
    }

    @Override
    public String toString() {
        return NAME;
    }
}
