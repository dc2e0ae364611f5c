package com.opstranslate.core.renderer;

/**
 * Writes the files produced by a translation run to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by id.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.opstranslate.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output.
     *
     * @param output files to render
     * @param context rendering settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
