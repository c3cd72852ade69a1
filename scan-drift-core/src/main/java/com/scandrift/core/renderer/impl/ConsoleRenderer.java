package com.scandrift.core.renderer.impl;

import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.renderer.GeneratedOutput;
import com.scandrift.core.renderer.OutputRenderer;
import com.scandrift.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that prints report files to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - Print a header line per file ("true"/"false", default: "false")</li>
 *   <li>{@code console.colors} - Color the headers with ANSI codes ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - Separator repeated between files (default: "=")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final String DEFAULT_SEPARATOR = "=";
    private static final int LINE_WIDTH = 80;

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        logger.debug("Printing {} report file(s) to console", output.files().size());

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                String color = useColors ? ANSI_BOLD + ANSI_CYAN : "";
                String reset = useColors ? ANSI_RESET : "";
                System.out.println(color + "File " + (i + 1) + "/" + output.files().size() + ": "
                    + file.relativePath() + reset);
            }
            System.out.println(file.content());
            if (i < output.files().size() - 1) {
                System.out.println(separator.repeat(Math.max(1, LINE_WIDTH / Math.max(1, separator.length()))));
            }
        }
    }
}
