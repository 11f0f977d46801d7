package org.kwindex.runtime.index;

/**
 * Payload of the "index" interpretation: which table a value was resolved against, with
 * which stride, and the index of the matching entry.
 * <p>
 * Mutable so that a value re-resolved against another table can be updated in place.
 */
public final class IndexRep {

    private IndexTable table;
    private int stride;
    private int index;

    IndexRep(IndexTable table, int stride, int index) {
        set(table, stride, index);
    }

    void set(IndexTable table, int stride, int index) {
        this.table = table;
        this.stride = stride;
        this.index = index;
    }

    /**
     * Checks whether this cached lookup answers a query against the given table and stride.
     * The table is compared by identity, never by content.
     *
     * @param queryTable  The table of the query.
     * @param queryStride The stride of the query.
     * @return {@code true} if the cached index can be returned for the query.
     */
    public boolean matches(IndexTable queryTable, int queryStride) {
        return table == queryTable && stride == queryStride;
    }

    /**
     * Gets the resolved table entry; never an abbreviation.
     *
     * @return The keyword at the cached index.
     */
    public String entry() {
        return table.entryAt(stride, index);
    }

    public IndexTable getTable() {
        return table;
    }

    public int getStride() {
        return stride;
    }

    public int getIndex() {
        return index;
    }

    boolean isReleased() {
        return table == null;
    }

    void clear() {
        table = null;
    }

    @Override
    public String toString() {
        return "IndexRep{index=" + index + ", stride=" + stride + ", entry=" + (table == null ? "<freed>" : entry()) + "}";
    }
}
