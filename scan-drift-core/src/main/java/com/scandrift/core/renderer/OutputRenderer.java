package com.scandrift.core.renderer;

/**
 * Writes generated reports to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI), so a run can print its text report to
 * the console and write every format to disk with the same output.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.scandrift.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, lower case (e.g. "console", "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated report files
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
