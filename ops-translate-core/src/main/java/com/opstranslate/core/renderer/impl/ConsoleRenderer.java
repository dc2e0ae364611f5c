package com.opstranslate.core.renderer.impl;

import com.opstranslate.core.renderer.GeneratedFile;
import com.opstranslate.core.renderer.GeneratedOutput;
import com.opstranslate.core.renderer.OutputRenderer;
import com.opstranslate.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to a stream, used for dry runs.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colored headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print a header line per file ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        logger.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), useColors, showHeaders);

        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                String header = "==> " + file.relativePath() + " <==";
                out.println(useColors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
