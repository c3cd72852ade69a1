package com.scandrift;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanDriftCLI}.
 */
class ScanDriftCLITest {

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
        rootLogger().setLevel(Level.INFO);
    }

    @Test
    void execute_noSubcommand_printsBanner() {
        int exitCode = ScanDriftCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).contains("scan-drift - Scanner and source host reconciliation");
    }

    @Test
    void execute_quiet_suppressesBannerAndRaisesLogLevel() {
        int exitCode = ScanDriftCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).isEmpty();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void execute_verboseSubcommand_enablesDebugLogging() {
        int exitCode = ScanDriftCLI.commandLine().execute("-v", "resolve", "https://gitlab.com/team/app");

        assertThat(exitCode).isZero();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(outputStream.toString()).contains("  Key: gitlab.com/team/app");
    }

    @Test
    void commandLine_registersAllSubcommands() {
        CommandLine commandLine = ScanDriftCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("reconcile", "duplicates", "resolve", "list");
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
