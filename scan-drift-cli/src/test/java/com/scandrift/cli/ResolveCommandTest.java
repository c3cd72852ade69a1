package com.scandrift.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResolveCommand}.
 */
class ResolveCommandTest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void execute_nestedGroupUrl_printsCanonicalKey() {
        int exitCode = new CommandLine(new ResolveCommand())
            .execute("https://gitlab.com/group/sub/service/-/tree/develop");

        String output = outputStream.toString();
        assertThat(exitCode).isZero();
        assertThat(output).contains("  Platform: GITLAB");
        assertThat(output).contains("  Owner: group/sub");
        assertThat(output).contains("  Branch: develop");
        assertThat(output).contains("  Key: gitlab.com/group/sub/service");
    }

    @Test
    void execute_localPath_hasNoKey() {
        int exitCode = new CommandLine(new ResolveCommand()).execute("/home/ci/builds/service");

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).contains("  Key: (local path)");
    }

    @Test
    void execute_mixedReferences_reportsEachOne() {
        int exitCode = new CommandLine(new ResolveCommand())
            .execute("not a url", "git@github.com:acme/widgets.git");

        String output = outputStream.toString();
        assertThat(exitCode).isZero();
        assertThat(output).contains("not a url" + System.lineSeparator() + "  unresolvable");
        assertThat(output).contains("  Key: github.com/acme/widgets");
    }

    @Test
    void execute_noReferences_failsUsage() {
        CommandLine commandLine = new CommandLine(new ResolveCommand());
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute()).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
