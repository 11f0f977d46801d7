package org.kwindex.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.kwindex.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the usage command.
 */
@Tag("unit")
public class UsageCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testPlainUsage() {
        int exitCode = execute("usage", "-m", "extra", "foo", "bar baz", "qux");

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("wrong # args: should be \"foo {bar baz} qux extra\"");
    }

    @Test
    void testAbbreviatedSubcommandPrintsResolvedName() {
        int exitCode = execute("usage", "-t", "start,stop,status", "-m", "name", "service", "star");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("wrong # args: should be \"service start name\"");
    }

    @Test
    void testUnknownSubcommandFails() {
        int exitCode = execute("usage", "-t", "start,stop", "service", "run");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("bad subcommand \"run\": must be start or stop");
    }

    @Test
    void testAlternativesAreJoined() {
        int exitCode = execute("usage", "-m", "ms ?script?", "--or", "cancel id", "after");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().trim())
            .isEqualTo("wrong # args: should be \"after ms ?script?\" or \"after cancel id\"");
    }

    @Test
    void testEnsembleRewrite() {
        int exitCode = execute("usage", "--source", "dict,get,d,k", "--remove", "2", "--insert", "1",
            "-m", "key ...", "::dict::get", "d");

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("wrong # args: should be \"dict get d key ...\"");
    }

    @Test
    void testInvalidRewriteCounts() {
        int exitCode = execute("usage", "--source", "dict", "--remove", "2", "--insert", "1", "x");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Removed count 2");
    }
}
