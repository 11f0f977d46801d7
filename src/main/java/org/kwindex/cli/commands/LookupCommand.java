package org.kwindex.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.kwindex.cli.CommandLineInterface;
import org.kwindex.runtime.index.IndexLookupException;
import org.kwindex.runtime.index.IndexResolver;
import org.kwindex.runtime.index.IndexTable;
import org.kwindex.runtime.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that resolves words against a keyword table and prints the matching index,
 * or the lookup error text when a word does not resolve.
 * <p>
 * Each word is resolved twice to show that the second lookup is answered from the cache.
 */
@Command(
    name = "lookup",
    description = "Resolve words against a keyword table (unique abbreviations allowed)"
)
public class LookupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LookupCommand.class);

    @Option(
        names = {"-t", "--table"},
        required = true,
        split = ",",
        description = "Comma-separated keywords, in lookup order"
    )
    private List<String> keywords;

    @Option(
        names = {"--stride"},
        defaultValue = "1",
        description = "Lay the keywords out as records of this many slots (default: ${DEFAULT-VALUE})"
    )
    private int stride;

    @Option(
        names = {"-l", "--label"},
        description = "Word naming the looked-up thing in error messages (default: from configuration)"
    )
    private String label;

    @Option(
        names = {"--exact"},
        description = "Reject abbreviations"
    )
    private boolean exact;

    @Option(
        names = {"--stats"},
        description = "Print lookup statistics after resolving"
    )
    private boolean stats;

    @Parameters(arity = "1..*", paramLabel = "WORD", description = "Words to resolve")
    private List<String> words;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (stride < 1) {
            err.println("Error: --stride must be at least 1");
            return 2;
        }
        String effectiveLabel = label != null ? label : parent.getSettings().defaultLabel();
        IndexTable table = buildTable(keywords, stride);
        IndexResolver resolver = new IndexResolver();

        int failures = 0;
        for (String word : words) {
            Value value = Value.of(word);
            try {
                int index = resolver.resolve(value, table, stride, effectiveLabel, exact);
                resolver.resolve(value, table, stride, effectiveLabel, exact);
                out.printf("%s -> %d (%s)%n", word, index, table.entryAt(stride, index));
            } catch (IndexLookupException e) {
                failures++;
                err.println(e.getMessage());
            }
        }
        if (stats) {
            out.println(resolver.getStatistics());
        }
        log.debug("Resolved {} words, {} failed", words.size(), failures);
        return failures == 0 ? 0 : 1;
    }

    /**
     * Lays the keywords out as flattened records of {@code stride} slots, each starting with
     * the keyword and padded with its ordinal.
     */
    static IndexTable buildTable(List<String> keywords, int stride) {
        if (stride == IndexTable.DEFAULT_STRIDE) {
            return IndexTable.of(keywords);
        }
        Object[] slots = new Object[keywords.size() * stride + 1];
        for (int i = 0; i < keywords.size(); i++) {
            slots[i * stride] = keywords.get(i);
            for (int pad = 1; pad < stride; pad++) {
                slots[i * stride + pad] = i;
            }
        }
        return IndexTable.embedded(slots);
    }
}
