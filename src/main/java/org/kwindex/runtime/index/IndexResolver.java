package org.kwindex.runtime.index;

import org.kwindex.runtime.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a value's text to the index of a matching {@link IndexTable} entry and caches
 * the result on the value as an {@link IndexType} interpretation.
 * <p>
 * The matching algorithm:
 * <ol>
 *   <li><b>Cache hit:</b> if the value already holds an index interpretation for the same
 *       table object and stride, its index is returned without any comparison</li>
 *   <li>Empty text never matches, not even an empty entry</li>
 *   <li>The whole table is scanned in order. An identical entry ends the scan and always
 *       wins. An entry that the text is a proper prefix of counts as an abbreviation match
 *       and the scan continues</li>
 *   <li>Without an exact match, a single abbreviation is accepted unless {@code exact} is
 *       set; none or several are errors ({@code bad} / {@code ambiguous})</li>
 * </ol>
 * A failed lookup leaves the value untouched.
 * <p>
 * Thread Safety: Not thread-safe. Use one resolver per thread; values must not be shared
 * between threads while they are resolved.
 */
public class IndexResolver {

    private static final Logger log = LoggerFactory.getLogger(IndexResolver.class);

    private final Statistics statistics = new Statistics();

    /**
     * Resolves a value against a flat keyword table.
     *
     * @param value The value whose text is looked up; receives the cached result.
     * @param table The keywords.
     * @param label Word naming the looked-up thing in error messages (e.g., {@code "option"}).
     * @param exact Whether abbreviations are rejected.
     * @return The index of the matching entry.
     * @throws IndexLookupException If no entry, or more than one abbreviation, matches.
     */
    public int resolve(Value value, IndexTable table, String label, boolean exact) throws IndexLookupException {
        Optional<IndexRep> cached = value.getInternalRep(IndexType.INSTANCE);
        if (cached.isPresent() && cached.get().matches(table, IndexTable.DEFAULT_STRIDE)) {
            statistics.cacheHits++;
            return cached.get().getIndex();
        }
        return resolve(value, table, IndexTable.DEFAULT_STRIDE, label, exact);
    }

    /**
     * Resolves a value against a table whose entries are {@code stride} slots apart.
     *
     * @param value  The value whose text is looked up; receives the cached result.
     * @param table  The keywords.
     * @param stride The slot distance between entries, at least 1.
     * @param label  Word naming the looked-up thing in error messages (e.g., {@code "option"}).
     * @param exact  Whether abbreviations are rejected.
     * @return The index of the matching entry.
     * @throws IndexLookupException If no entry, or more than one abbreviation, matches.
     */
    public int resolve(Value value, IndexTable table, int stride, String label, boolean exact)
            throws IndexLookupException {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(label, "label");
        IndexTable.checkStride(stride);

        Optional<IndexRep> cached = value.getInternalRep(IndexType.INSTANCE);
        if (cached.isPresent() && cached.get().matches(table, stride)) {
            statistics.cacheHits++;
            if (log.isTraceEnabled()) {
                log.trace("Cached {} \"{}\" -> {}", label, value.getText(), cached.get().getIndex());
            }
            return cached.get().getIndex();
        }

        String key = value.getText();
        statistics.scans++;
        int index = -1;
        int numAbbrev = 0;
        boolean found = false;

        if (!key.isEmpty()) {
            String entry;
            for (int i = 0; (entry = table.entryAt(stride, i)) != null; i++) {
                statistics.comparisons++;
                if (entry.equals(key)) {
                    index = i;
                    found = true;
                    break;
                }
                if (entry.startsWith(key)) {
                    // keep scanning: a later exact match wins, a later abbreviation makes this ambiguous
                    numAbbrev++;
                    index = i;
                }
            }
            found = found || (!exact && numAbbrev == 1);
        }

        if (!found) {
            boolean ambiguous = numAbbrev > 1;
            String message = ChoiceList.errorMessage(ambiguous, label, key, table.entries(stride));
            log.debug("Lookup failed: {}", message);
            throw new IndexLookupException(
                    ambiguous ? IndexLookupException.Reason.AMBIGUOUS : IndexLookupException.Reason.NO_MATCH,
                    message);
        }

        if (cached.isPresent()) {
            cached.get().set(table, stride, index);
        } else {
            value.setInternalRep(IndexType.INSTANCE, new IndexRep(table, stride, index));
        }
        log.debug("Resolved {} \"{}\" -> {} ({})", label, key, index, table.entryAt(stride, index));
        return index;
    }

    /**
     * Gets the counters of this resolver.
     *
     * @return The live statistics object.
     */
    public Statistics getStatistics() {
        return statistics;
    }

    /**
     * Lookup counters, useful for verifying that cached lookups skip the table scan.
     */
    public static final class Statistics {
        private long cacheHits;
        private long scans;
        private long comparisons;

        /** @return Lookups answered from a value's cached interpretation. */
        public long getCacheHits() {
            return cacheHits;
        }

        /** @return Lookups that scanned the table. */
        public long getScans() {
            return scans;
        }

        /** @return Table entries compared against a value's text. */
        public long getComparisons() {
            return comparisons;
        }

        public void reset() {
            cacheHits = 0;
            scans = 0;
            comparisons = 0;
        }

        @Override
        public String toString() {
            return "cacheHits=" + cacheHits + ", scans=" + scans + ", comparisons=" + comparisons;
        }
    }
}
