package com.opstranslate.core.renderer.impl;

import com.opstranslate.core.renderer.GeneratedFile;
import com.opstranslate.core.renderer.GeneratedOutput;
import com.opstranslate.core.renderer.OutputRenderer;
import com.opstranslate.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated files below the output directory, overwriting existing files.
 *
 * <p>Paths that would resolve outside the output directory are rejected.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        logger.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
