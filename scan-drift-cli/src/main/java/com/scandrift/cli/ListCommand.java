package com.scandrift.cli;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scandrift.core.coverage.FilePattern;
import com.scandrift.core.coverage.SupportedFileTaxonomy;
import com.scandrift.core.renderer.OutputRenderer;
import com.scandrift.core.report.ReportGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command to list supported file patterns, report generators, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scan-drift list patterns
 * scan-drift list generators
 * scan-drift list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported file patterns, report generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: patterns, generators, or renderers"
    )
    String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "patterns", "pattern" -> listPatterns();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: patterns, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listPatterns() {
        System.out.println("Supported Files:");
        System.out.println();

        for (FilePattern pattern : SupportedFileTaxonomy.defaults().patterns()) {
            System.out.printf("  • %s (%s, %s)%n",
                pattern.pattern(), pattern.type().label(), pattern.type().category());
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Report Generators:");
        System.out.println();

        boolean found = false;
        for (ReportGenerator generator : ServiceLoader.load(ReportGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No report generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", renderer.getClass().getSimpleName(), renderer.getId());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
