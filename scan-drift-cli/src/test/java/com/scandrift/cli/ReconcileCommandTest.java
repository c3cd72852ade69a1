package com.scandrift.cli;

import com.scandrift.core.config.DriftConfig;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.renderer.GeneratedOutput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReconcileCommand}.
 */
class ReconcileCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream errStream;

    @BeforeEach
    void setUp() {
        errStream = new ByteArrayOutputStream();
        System.setErr(new PrintStream(errStream));
    }

    @AfterEach
    void tearDown() {
        System.setErr(originalErr);
    }

    @Test
    void parseArgs_defaults() {
        ReconcileCommand command = new ReconcileCommand();

        new CommandLine(command).parseArgs("--org-id", "org-1");

        assertThat(command.scanTool.orgId).isEqualTo("org-1");
        assertThat(command.formats).containsExactly("text", "csv", "json");
        assertThat(command.outputDir).isEqualTo(Path.of("scan-drift-report"));
        assertThat(command.dryRun).isFalse();
    }

    @Test
    void parseArgs_allOptions() {
        ReconcileCommand command = new ReconcileCommand();

        new CommandLine(command).parseArgs(
            "--group-id", "g1",
            "--snyk-token", "s3cret",
            "--snyk-region", "SNYK-EU-01",
            "--gitlab-url", "https://gitlab.example.com",
            "--gitlab-token", "glpat",
            "-o", "out",
            "-f", "json,csv",
            "--dry-run");

        assertThat(command.scanTool.groupId).isEqualTo("g1");
        assertThat(command.scanTool.token).isEqualTo("s3cret");
        assertThat(command.scanTool.region).isEqualTo("SNYK-EU-01");
        assertThat(command.gitlabUrl).isEqualTo("https://gitlab.example.com");
        assertThat(command.gitlabToken).isEqualTo("glpat");
        assertThat(command.outputDir).isEqualTo(Path.of("out"));
        assertThat(command.formats).containsExactly("json", "csv");
        assertThat(command.dryRun).isTrue();
    }

    @Test
    void execute_blankScannerToken_exitsWithConfigurationError() {
        int exitCode = new CommandLine(new ReconcileCommand()).execute(
            "--snyk-token", "",
            "--org-id", "org-1",
            "-c", tempDir.resolve("missing.yaml").toString(),
            "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errStream.toString()).contains("✗ A Snyk API token is required");
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void generateReports_selectedFormatsOnly_skipsUnknown() {
        ReconcileCommand command = new ReconcileCommand();
        new CommandLine(command).parseArgs("-f", "JSON, pdf ,text");

        GeneratedOutput output = command.generateReports(
            new ReconciliationResult(null, null, null, null, null, null), DriftConfig.defaults());

        assertThat(output.files()).extracting(GeneratedFile::relativePath)
            .containsExactly("scan-drift-report.json", "scan-drift-report.txt");
    }

    @Test
    void loadConfig_regionOverride_replacesConfiguredRegion() throws IOException {
        Path config = tempDir.resolve("scan-drift.yaml");
        Files.writeString(config, """
            scanTool:
              region: SNYK-US-02
            host:
              url: https://git.internal
            """);
        ScanToolOptions options = new ScanToolOptions();
        options.configPath = config;
        options.region = "SNYK-EU-01";

        DriftConfig loaded = options.loadConfig();

        assertThat(loaded.scanTool().region()).isEqualTo("SNYK-EU-01");
        assertThat(loaded.host().url()).isEqualTo("https://git.internal");
    }
}
