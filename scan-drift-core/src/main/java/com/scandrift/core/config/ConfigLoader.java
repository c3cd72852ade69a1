package com.scandrift.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads scan-drift configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code scan-drift.yaml} into {@link DriftConfig} records.
 * If the file is missing, unreadable or invalid, returns {@link DriftConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DriftConfig config = ConfigLoader.load(Paths.get("scan-drift.yaml"));
 * RetryPolicy policy = config.http().retryPolicy();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "scan-drift.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link DriftConfig#defaults()}.
     *
     * @param configPath path to {@code scan-drift.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static DriftConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return DriftConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DriftConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DriftConfig config = YAML_MAPPER.readValue(configPath.toFile(), DriftConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DriftConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DriftConfig.defaults();
        }
    }
}
