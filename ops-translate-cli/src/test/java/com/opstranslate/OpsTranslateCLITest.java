package com.opstranslate;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OpsTranslateCLI} option handling.
 */
class OpsTranslateCLITest {

    @Test
    void version_printsProjectVersion() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new OpsTranslateCLI());
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("ops-translate 1.0.0-SNAPSHOT");
    }

    @Test
    void globalOptions_areInheritedBySubcommands() {
        OpsTranslateCLI cli = new OpsTranslateCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("list", "parsers", "-v");

        assertThat(exitCode).isZero();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void unknownSubcommand_isRejected() {
        CommandLine commandLine = new CommandLine(new OpsTranslateCLI());
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("frobnicate")).isEqualTo(2);
    }
}
