package org.kwindex.runtime.index;

import java.util.List;

/**
 * Renders the list of valid choices in lookup error messages:
 * {@code a}, {@code a or b}, {@code a, b, or c}.
 */
public final class ChoiceList {

    private ChoiceList() {
    }

    private static StringBuilder appendTo(StringBuilder sb, List<String> choices) {
        int last = choices.size() - 1;
        for (int i = 0; i <= last; i++) {
            if (i > 0) {
                if (i < last) {
                    sb.append(", ");
                } else {
                    sb.append(last > 1 ? ", or " : " or ");
                }
            }
            sb.append(choices.get(i));
        }
        return sb;
    }

    /**
     * Renders the choices as a string.
     *
     * @param choices The choices, in table order.
     * @return The rendered list; empty for no choices.
     */
    public static String format(List<String> choices) {
        return appendTo(new StringBuilder(), choices).toString();
    }

    /**
     * Builds the full lookup error message.
     *
     * @param ambiguous Whether the failure was caused by several abbreviation matches.
     * @param label     The word describing what was looked up (e.g., {@code "option"}).
     * @param key       The text that failed to resolve.
     * @param choices   The valid choices.
     * @return e.g. {@code ambiguous option "s": must be get, set, or unset}.
     */
    public static String errorMessage(boolean ambiguous, String label, String key, List<String> choices) {
        return (ambiguous ? "ambiguous " : "bad ") + label + " \"" + key + "\": must be " + format(choices);
    }
}
