package com.scandrift.core.renderer.impl;

import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.renderer.GeneratedOutput;
import com.scandrift.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withReports_writesEachFile() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("scan-drift-report.txt", "text report", "text/plain"),
            new GeneratedFile("scan-drift-report.csv", "status,repo_key\n", "text/csv")));
        Path outputDir = tempDir.resolve("reports");

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(outputDir.resolve("scan-drift-report.txt"))).isEqualTo("text report");
        assertThat(Files.readString(outputDir.resolve("scan-drift-report.csv"))).isEqualTo("status,repo_key\n");
    }

    @Test
    void render_withNestedPath_createsDirectoryStructure() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("2024/run-1/report.json", "{}", "application/json")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("2024/run-1/report.json")).exists();
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("report.txt"), "old");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("report.txt", "new", "text/plain"))),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("report.txt"))).isEqualTo("new");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("../escape.txt", "nope", "text/plain")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("outside output directory");
        assertThat(tempDir.resolve("escape.txt")).doesNotExist();
    }
}
