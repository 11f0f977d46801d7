package org.kwindex.runtime.usage;

import org.kwindex.runtime.index.IndexRep;
import org.kwindex.runtime.index.IndexType;
import org.kwindex.runtime.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds "wrong # args" usage errors of the form
 * <pre>
 * wrong # args: should be "cmd sub ?arg? value"
 * </pre>
 * where the leading words come from the command's actual arguments and the rest from a
 * caller-supplied message.
 * <p>
 * Arguments that were resolved by {@link org.kwindex.runtime.index.IndexResolver} print as
 * the full table entry, so an abbreviated subcommand is reported under its real name. All
 * other arguments print their text, quoted as list elements where necessary.
 * <p>
 * When an {@link EnsembleRewrite} is active, the implementation's inserted leading
 * arguments are replaced by the words the user actually typed.
 */
public class WrongArgsFormatter {

    private static final Logger log = LoggerFactory.getLogger(WrongArgsFormatter.class);

    static final String PREFIX = "wrong # args: should be \"";
    static final String ALTERNATE_SEPARATOR = " or \"";

    private final IListElementQuoter quoter;
    private final boolean quoteLeadingWord;

    /**
     * Creates a formatter that quotes every word with the default brace quoting.
     */
    public WrongArgsFormatter() {
        this(BraceListElementQuoter.INSTANCE, true);
    }

    /**
     * Creates a formatter.
     *
     * @param quoter           The list-element quoting primitive.
     * @param quoteLeadingWord Whether the first printed word may be quoted. When {@code false}
     *                         the first word is always printed verbatim, which lets callers
     *                         pass a pre-formatted multi-word command prefix as one argument.
     */
    public WrongArgsFormatter(IListElementQuoter quoter, boolean quoteLeadingWord) {
        this.quoter = Objects.requireNonNull(quoter, "quoter");
        this.quoteLeadingWord = quoteLeadingWord;
    }

    /**
     * Formats a usage error.
     *
     * @param argv    The leading argument values to print.
     * @param rewrite The active ensemble rewrite, or {@code null}.
     * @param message Text printed after the arguments (e.g., {@code "?-nocase? pattern"}), or {@code null}.
     * @return {@code wrong # args: should be "<argv> <message>"}.
     */
    public String format(List<Value> argv, EnsembleRewrite rewrite, String message) {
        StringBuilder sb = new StringBuilder(PREFIX);
        appendUsage(sb, argv, rewrite, message);
        return sb.toString();
    }

    /**
     * Formats a usage error into the context's result. In alternate-usage mode the usage is
     * appended to the existing result as {@code  or "<argv> <message>"}.
     *
     * @param context The call context providing the rewrite and receiving the result.
     * @param argv    The leading argument values to print.
     * @param message Text printed after the arguments, or {@code null}.
     */
    public void wrongNumArgs(UsageContext context, List<Value> argv, String message) {
        StringBuilder sb;
        if (context.isAlternateUsage()) {
            sb = new StringBuilder(context.getResult()).append(ALTERNATE_SEPARATOR);
        } else {
            sb = new StringBuilder(PREFIX);
        }
        appendUsage(sb, argv, context.getEnsembleRewrite().orElse(null), message);
        context.setResult(sb.toString());
    }

    private void appendUsage(StringBuilder sb, List<Value> argv, EnsembleRewrite rewrite, String message) {
        int first = 0;
        int count = argv.size();
        boolean leading = true;

        if (rewrite != null) {
            // only rewrite when every inserted word is really among the arguments
            if (count >= rewrite.insertedCount()) {
                first = rewrite.insertedCount();
                count -= rewrite.insertedCount();
                int removed = rewrite.removedCount();
                for (int i = 0; i < removed; i++) {
                    // source words print as typed, even if they hold an index interpretation
                    appendWord(sb, rewrite.sourceWords().get(i).getText(), leading);
                    leading = false;
                    if (i < removed - 1 || count > 0 || message != null) {
                        sb.append(' ');
                    }
                }
            } else {
                log.debug("Skipping ensemble rewrite: {} arguments, {} inserted", count, rewrite.insertedCount());
            }
        }

        for (int i = 0; i < count; i++) {
            appendArg(sb, argv.get(first + i), leading);
            leading = false;
            if (i < count - 1 || message != null) {
                sb.append(' ');
            }
        }

        if (message != null) {
            sb.append(message);
        }
        sb.append('"');
    }

    private void appendArg(StringBuilder sb, Value arg, boolean leading) {
        // table entries never need quoting
        Optional<IndexRep> resolved = arg.getInternalRep(IndexType.INSTANCE);
        if (resolved.isPresent()) {
            sb.append(resolved.get().entry());
        } else {
            appendWord(sb, arg.getText(), leading);
        }
    }

    private void appendWord(StringBuilder sb, String word, boolean leading) {
        if ((quoteLeadingWord || !leading) && quoter.needsQuoting(word)) {
            sb.append(quoter.quote(word));
        } else {
            sb.append(word);
        }
    }
}
