package org.kwindex.runtime.usage;

import org.kwindex.runtime.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * Describes how an ensemble command rewrote its invocation before dispatching to an
 * implementation command, so usage errors can be reported in terms of what the user typed.
 * <p>
 * Example: the user types {@code dict get d k}; the ensemble dispatches to
 * {@code ::dict::get d k}. Here {@code sourceWords = [dict, get, d, k]},
 * {@code removedCount = 2} (words of the original invocation that were replaced) and
 * {@code insertedCount = 1} (words at the head of the implementation's argument list that
 * replaced them).
 *
 * @param sourceWords   The original invocation words.
 * @param removedCount  Number of leading source words that the rewrite replaced.
 * @param insertedCount Number of leading implementation arguments that the rewrite inserted.
 */
public record EnsembleRewrite(List<Value> sourceWords, int removedCount, int insertedCount) {

    public EnsembleRewrite {
        sourceWords = List.copyOf(Objects.requireNonNull(sourceWords, "sourceWords"));
        if (removedCount < 0 || removedCount > sourceWords.size()) {
            throw new IllegalArgumentException("Removed count " + removedCount
                    + " outside of source words (" + sourceWords.size() + ")");
        }
        if (insertedCount < 0) {
            throw new IllegalArgumentException("Inserted count must not be negative: " + insertedCount);
        }
    }
}
