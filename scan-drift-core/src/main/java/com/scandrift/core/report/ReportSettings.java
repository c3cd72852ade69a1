package com.scandrift.core.report;

import java.time.Instant;
import java.util.Map;

import com.scandrift.core.config.DriftConfig;

/**
 * Settings passed to report generators.
 *
 * @param limits output caps for the human-readable formats
 * @param generatedAt timestamp printed in report headers
 * @param customSettings generator-specific settings
 */
public record ReportSettings(
    DriftConfig.ReportConfig limits,
    Instant generatedAt,
    Map<String, Object> customSettings
) {
    public ReportSettings {
        if (limits == null) {
            limits = DriftConfig.ReportConfig.defaults();
        }
        if (generatedAt == null) {
            generatedAt = Instant.now();
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    public static ReportSettings defaults() {
        return new ReportSettings(null, null, Map.of());
    }

    public static ReportSettings of(DriftConfig.ReportConfig limits) {
        return new ReportSettings(limits, null, Map.of());
    }

    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
