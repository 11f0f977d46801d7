package org.kwindex.runtime.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered table of keywords that values are resolved against.
 * <p>
 * Entries live in a backing {@code Object[]} and are read with a stride: entry {@code i} is
 * the slot at {@code firstSlot + i * stride}. With the default stride of 1 the table is a
 * flat keyword array; a larger stride reads the keywords out of flattened records, for
 * example {@code {"get", getHandler, "set", setHandler, null}} with stride 2.
 * <p>
 * The table ends at the first {@code null} entry slot, or at the end of the backing array.
 * Entries are expected to be unique; if they are not, the first occurrence wins.
 * <p>
 * A table's identity is the key for cached lookups: two distinct tables with identical
 * keywords never share cached results. Tables must not be modified while values may hold
 * cached lookups against them.
 */
public final class IndexTable {

    /**
     * Slot distance between consecutive entries of a flat keyword array.
     */
    public static final int DEFAULT_STRIDE = 1;

    private final Object[] slots;
    private final int firstSlot;

    private IndexTable(Object[] slots, int firstSlot) {
        this.slots = slots;
        this.firstSlot = firstSlot;
    }

    /**
     * Creates a flat table from the given keywords.
     *
     * @param entries The keywords, in lookup order.
     * @return A new table, read with {@link #DEFAULT_STRIDE}.
     * @throws IllegalArgumentException If an entry is {@code null}.
     */
    public static IndexTable of(String... entries) {
        Object[] slots = Arrays.copyOf(entries, entries.length + 1, Object[].class);
        for (int i = 0; i < entries.length; i++) {
            if (entries[i] == null) {
                throw new IllegalArgumentException("Table entry " + i + " is null");
            }
        }
        return new IndexTable(slots, 0);
    }

    /**
     * Creates a flat table from the given keywords.
     *
     * @param entries The keywords, in lookup order.
     * @return A new table, read with {@link #DEFAULT_STRIDE}.
     */
    public static IndexTable of(List<String> entries) {
        return of(entries.toArray(new String[0]));
    }

    /**
     * Wraps an array of flattened records whose keyword is the first field of each record.
     * The array is used as is, not copied.
     *
     * @param slots The backing array.
     * @return A new table over the array.
     */
    public static IndexTable embedded(Object[] slots) {
        return embedded(slots, 0);
    }

    /**
     * Wraps an array of flattened records whose keyword sits at {@code firstSlot} within
     * each record. The array is used as is, not copied.
     *
     * @param slots     The backing array.
     * @param firstSlot The slot of the first keyword.
     * @return A new table over the array.
     */
    public static IndexTable embedded(Object[] slots, int firstSlot) {
        Objects.requireNonNull(slots, "slots");
        if (firstSlot < 0) {
            throw new IllegalArgumentException("First slot must not be negative: " + firstSlot);
        }
        return new IndexTable(slots, firstSlot);
    }

    /**
     * Gets the entry at the given index, or {@code null} if the index is at or beyond the
     * terminating sentinel.
     *
     * @param stride The slot distance between entries.
     * @param index  The entry index.
     * @return The keyword, or {@code null} at the end of the table.
     * @throws IllegalArgumentException If the stride is not positive or the slot holds a non-string.
     */
    public String entryAt(int stride, int index) {
        checkStride(stride);
        long slot = firstSlot + (long) index * stride;
        if (index < 0 || slot >= slots.length) {
            return null;
        }
        Object entry = slots[(int) slot];
        if (entry == null || entry instanceof String) {
            return (String) entry;
        }
        throw new IllegalArgumentException("Table slot " + slot + " holds a "
                + entry.getClass().getSimpleName() + ", not a keyword");
    }

    /**
     * Counts the entries before the sentinel.
     *
     * @param stride The slot distance between entries.
     * @return The number of entries.
     */
    public int size(int stride) {
        int count = 0;
        while (entryAt(stride, count) != null) {
            count++;
        }
        return count;
    }

    /**
     * Lists the entries before the sentinel, in lookup order.
     *
     * @param stride The slot distance between entries.
     * @return An unmodifiable list of keywords.
     */
    public List<String> entries(int stride) {
        List<String> result = new ArrayList<>();
        String entry;
        for (int i = 0; (entry = entryAt(stride, i)) != null; i++) {
            result.add(entry);
        }
        return Collections.unmodifiableList(result);
    }

    static void checkStride(int stride) {
        if (stride < 1) {
            throw new IllegalArgumentException("Stride must be positive: " + stride);
        }
    }

    @Override
    public String toString() {
        // the stride belongs to the caller, so only the layout is printed
        return "IndexTable[slots=" + slots.length + ", firstSlot=" + firstSlot + "]";
    }
}
