package com.scandrift.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.scandrift.core.config.ConfigLoader;
import com.scandrift.core.config.DriftConfig;

import picocli.CommandLine.Option;

/**
 * Scanning-tool connection and organization selection options shared by commands.
 */
public class ScanToolOptions {

    @Option(
        names = {"--snyk-token"},
        description = "Snyk API token (default: $SNYK_TOKEN)",
        defaultValue = "${env:SNYK_TOKEN}"
    )
    String token;

    @Option(
        names = {"--group-id"},
        description = "Use every organization of this Snyk group"
    )
    String groupId;

    @Option(
        names = {"--org-id"},
        description = "Use a single Snyk organization"
    )
    String orgId;

    @Option(
        names = {"--snyk-region"},
        description = "Snyk region, e.g. SNYK-US-01, SNYK-EU-01 (overrides config)"
    )
    String region;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    /**
     * Loads the configuration file and applies command-line overrides.
     *
     * @return effective configuration
     */
    DriftConfig loadConfig() {
        DriftConfig config = ConfigLoader.load(configPath);
        if (region == null || region.isBlank()) {
            return config;
        }
        return new DriftConfig(config.scanTool().withRegion(region), config.host(), config.http(),
            config.duplicates(), config.report());
    }
}
