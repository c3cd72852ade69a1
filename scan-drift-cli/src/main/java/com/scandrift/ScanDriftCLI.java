package com.scandrift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scandrift.cli.DuplicatesCommand;
import com.scandrift.cli.ListCommand;
import com.scandrift.cli.ReconcileCommand;
import com.scandrift.cli.ResolveCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for scan-drift.
 *
 * <p>scan-drift compares the repositories a security scanner tracks with the repositories a
 * source host actually has, and reports stale files, untracked manifests and duplicate projects.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code reconcile} - Join scanner targets with host repositories and report drift</li>
 *   <li>{@code duplicates} - List stale duplicate scanner projects</li>
 *   <li>{@code resolve} - Show the canonical key of repository references</li>
 *   <li>{@code list} - List supported files, report generators, or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 */
@Command(
    name = "scan-drift",
    mixinStandardHelpOptions = true,
    version = "scan-drift 1.0.0-SNAPSHOT",
    description = "Reconciles security scanner targets with source host repositories",
    subcommands = {
        ReconcileCommand.class,
        DuplicatesCommand.class,
        ResolveCommand.class,
        ListCommand.class
    }
)
public class ScanDriftCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScanDriftCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("scan-drift - Scanner and source host reconciliation");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'scan-drift --help' to see available commands");
        System.out.println("Use 'scan-drift <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ScanDriftCLI cli = new ScanDriftCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
