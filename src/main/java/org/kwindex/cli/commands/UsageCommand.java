package org.kwindex.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.kwindex.cli.CommandLineInterface;
import org.kwindex.runtime.RuntimeSettings;
import org.kwindex.runtime.index.IndexLookupException;
import org.kwindex.runtime.index.IndexResolver;
import org.kwindex.runtime.index.IndexTable;
import org.kwindex.runtime.usage.EnsembleRewrite;
import org.kwindex.runtime.usage.UsageContext;
import org.kwindex.runtime.usage.WrongArgsFormatter;
import org.kwindex.runtime.value.Value;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the "wrong # args" message a command would report for the given
 * words.
 * <p>
 * With {@code --table}, the second word is resolved as a subcommand first, so an
 * abbreviation is reported under its full name.
 */
@Command(
    name = "usage",
    description = "Render a wrong-number-of-arguments message for the given words"
)
public class UsageCommand implements Callable<Integer> {

    /**
     * Ensemble rewrite options; all three must be given together.
     */
    static class RewriteOptions {
        @Option(names = {"--source"}, required = true, split = ",",
            description = "Comma-separated words the user originally typed")
        List<String> sourceWords;

        @Option(names = {"--remove"}, required = true,
            description = "Number of leading source words replaced by the rewrite")
        int removed;

        @Option(names = {"--insert"}, required = true,
            description = "Number of leading WORDs inserted by the rewrite")
        int inserted;
    }

    @Option(
        names = {"-t", "--table"},
        split = ",",
        description = "Comma-separated subcommand table used to resolve the second word"
    )
    private List<String> subcommands;

    @Option(
        names = {"-m", "--message"},
        description = "Text printed after the words, e.g. \"?-nocase? pattern\""
    )
    private String message;

    @Option(
        names = {"--or"},
        description = "Alternative message; each one adds an 'or \"...\"' clause"
    )
    private List<String> alternatives = new ArrayList<>();

    @ArgGroup(exclusive = false, multiplicity = "0..1")
    RewriteOptions rewriteOptions;

    @Parameters(arity = "0..*", paramLabel = "WORD", description = "Leading words of the command")
    private List<String> words = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        RuntimeSettings settings = parent.getSettings();

        List<Value> argv = new ArrayList<>();
        for (String word : words) {
            argv.add(Value.of(word));
        }

        if (subcommands != null && argv.size() > 1) {
            try {
                new IndexResolver().resolve(argv.get(1), IndexTable.of(subcommands), "subcommand", false);
            } catch (IndexLookupException e) {
                err.println(e.getMessage());
                return 1;
            }
        }

        UsageContext context = new UsageContext();
        if (rewriteOptions != null) {
            List<Value> source = new ArrayList<>();
            for (String word : rewriteOptions.sourceWords) {
                source.add(Value.of(word));
            }
            try {
                context.setEnsembleRewrite(
                    new EnsembleRewrite(source, rewriteOptions.removed, rewriteOptions.inserted));
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return 2;
            }
        }

        WrongArgsFormatter formatter = settings.newFormatter();
        formatter.wrongNumArgs(context, argv, message);
        context.setAlternateUsage(true);
        for (String alternative : alternatives) {
            formatter.wrongNumArgs(context, argv, alternative);
        }
        out.println(context.getResult());
        return 0;
    }
}
