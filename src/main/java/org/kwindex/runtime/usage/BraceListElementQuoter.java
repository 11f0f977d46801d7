package org.kwindex.runtime.usage;

/**
 * Default list-element quoting: words containing whitespace or list-significant characters
 * are wrapped in braces; when braces cannot represent the word (unbalanced braces or a
 * trailing backslash), the special characters are escaped with backslashes instead.
 * The empty word becomes {@code {}}.
 * <p>
 * A closing bracket, or a double quote anywhere but at the start, does not make a word
 * special: {@code a]b} and {@code a"b} print as they are.
 */
public final class BraceListElementQuoter implements IListElementQuoter {

    /**
     * The shared instance.
     */
    public static final BraceListElementQuoter INSTANCE = new BraceListElementQuoter();

    private enum Style { VERBATIM, BRACES, BACKSLASHES }

    private BraceListElementQuoter() {
    }

    @Override
    public boolean needsQuoting(String word) {
        return scan(word) != Style.VERBATIM;
    }

    @Override
    public String quote(String word) {
        return switch (scan(word)) {
            case VERBATIM -> word;
            case BRACES -> "{" + word + "}";
            case BACKSLASHES -> escape(word);
        };
    }

    private static Style scan(String word) {
        if (word.isEmpty()) {
            return Style.BRACES;
        }
        boolean special = word.charAt(0) == '{' || word.charAt(0) == '"';
        boolean bracesUnusable = false;
        int nesting = 0;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            switch (c) {
                case '{' -> nesting++;
                case '}' -> {
                    nesting--;
                    if (nesting < 0) {
                        bracesUnusable = true;
                    }
                }
                case '[', '$', ';', ' ', '\f', '\n', '\r', '\t', '\u000B' -> special = true;
                case '\\' -> {
                    if (i + 1 == word.length() || word.charAt(i + 1) == '\n') {
                        bracesUnusable = true;
                    } else {
                        special = true;
                        i++;
                    }
                }
                default -> {
                }
            }
        }
        if (nesting != 0) {
            bracesUnusable = true;
        }
        if (bracesUnusable) {
            return Style.BACKSLASHES;
        }
        return special ? Style.BRACES : Style.VERBATIM;
    }

    private static String escape(String word) {
        StringBuilder sb = new StringBuilder(word.length() + 8);
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            switch (c) {
                case ']', '[', '$', ';', ' ', '\\', '"', '{', '}' -> sb.append('\\').append(c);
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u000B' -> sb.append("\\v");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
