package com.opstranslate.core.renderer.impl;

import com.opstranslate.core.renderer.GeneratedFile;
import com.opstranslate.core.renderer.GeneratedOutput;
import com.opstranslate.core.renderer.RenderContext;
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
    void render_withNestedPaths_createsDirectoriesAndWritesFiles() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("intents/provision.ps1.intent.yaml", "source: provision.ps1\n", "application/yaml"),
            new GeneratedFile("gap-report.yaml", "summary: {}\n", "application/yaml")));
        RenderContext context = new RenderContext(tempDir.toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        assertThat(tempDir.resolve("intents/provision.ps1.intent.yaml")).hasContent("source: provision.ps1");
        assertThat(Files.readString(tempDir.resolve("gap-report.yaml"))).isEqualTo("summary: {}\n");
    }

    @Test
    void render_missingOutputDirectory_isCreated() {
        // Given
        Path outputDir = tempDir.resolve("out/run1");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.yml", "- x\n", "application/yaml")));

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(outputDir.resolve("a.yml")).exists();
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("gap-report.yaml"), "stale content that is longer\n");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("gap-report.yaml", "fresh\n", "application/yaml")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("gap-report.yaml"))).isEqualTo("fresh\n");
    }

    @Test
    void render_nonAsciiContent_writesUtf8() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("msg.yml", "msg: Größe ✓\n", "application/yaml")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("msg.yml"))).isEqualTo("msg: Größe ✓\n");
    }

    @Test
    void render_pathEscapingOutputDirectory_throws() {
        // Given
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../escape.yml", "x", "application/yaml")));

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new RenderContext(outputDir.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("escape.yml")).doesNotExist();
    }
}
