package com.opstranslate.core.renderer.impl;

import com.opstranslate.core.renderer.GeneratedFile;
import com.opstranslate.core.renderer.GeneratedOutput;
import com.opstranslate.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withDefaults_printsHeaderBeforeEachFile() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("tasks/a.ps1.tasks.yml", "- name: Start VM\n", "application/yaml"),
            new GeneratedFile("gap-report.yaml", "entries: []", "application/yaml")));

        // When
        renderer.render(output, new RenderContext("./output", Map.of()));

        // Then
        String printed = outputStream.toString(StandardCharsets.UTF_8);
        String newline = System.lineSeparator();
        assertThat(printed).isEqualTo(
            "==> tasks/a.ps1.tasks.yml <==" + newline
                + "- name: Start VM\n"
                + "==> gap-report.yaml <==" + newline
                + "entries: []" + newline);
    }

    @Test
    void render_headersDisabled_printsContentOnly() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.yml", "x: 1\n", "application/yaml")));

        renderer.render(output, new RenderContext("./output", Map.of("console.showHeaders", "false")));

        assertThat(outputStream.toString(StandardCharsets.UTF_8)).isEqualTo("x: 1\n");
    }

    @Test
    void render_colorsEnabled_wrapsHeaderInAnsiCodes() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.yml", "x: 1\n", "application/yaml")));

        renderer.render(output, new RenderContext("./output", Map.of("console.colors", "true")));

        assertThat(outputStream.toString(StandardCharsets.UTF_8))
            .startsWith("\u001B[1m\u001B[36m==> a.yml <==\u001B[0m");
    }

    @Test
    void render_emptyOutput_printsNothing() {
        renderer.render(new GeneratedOutput(List.of()), new RenderContext("./output", Map.of()));

        assertThat(outputStream.size()).isZero();
    }
}
