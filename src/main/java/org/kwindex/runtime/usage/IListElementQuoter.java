package org.kwindex.runtime.usage;

/**
 * Quotes words so they read back as single list elements.
 */
public interface IListElementQuoter {

    /**
     * Checks whether a word must be quoted to survive as one list element.
     *
     * @param word The word.
     * @return {@code true} if {@link #quote(String)} would change the word.
     */
    boolean needsQuoting(String word);

    /**
     * Produces the list-element form of a word.
     *
     * @param word The word.
     * @return The word itself when no quoting is needed, otherwise its quoted form.
     */
    String quote(String word);
}
