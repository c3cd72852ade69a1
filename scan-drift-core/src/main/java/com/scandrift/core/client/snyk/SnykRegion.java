package com.scandrift.core.client.snyk;

import com.scandrift.core.config.DriftConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Snyk data-residency regions with their REST and web-app base URLs.
 */
public enum SnykRegion {
    SNYK_US_01("SNYK-US-01", "https://api.snyk.io/rest", "https://app.snyk.io"),
    SNYK_US_02("SNYK-US-02", "https://api.us.snyk.io/rest", "https://app.us.snyk.io"),
    SNYK_EU_01("SNYK-EU-01", "https://api.eu.snyk.io/rest", "https://app.eu.snyk.io"),
    SNYK_AU_01("SNYK-AU-01", "https://api.au.snyk.io/rest", "https://app.au.snyk.io");

    private final String code;
    private final String restBaseUrl;
    private final String webBaseUrl;

    SnykRegion(String code, String restBaseUrl, String webBaseUrl) {
        this.code = code;
        this.restBaseUrl = restBaseUrl;
        this.webBaseUrl = webBaseUrl;
    }

    public String code() {
        return code;
    }

    public String restBaseUrl() {
        return restBaseUrl;
    }

    public String webBaseUrl() {
        return webBaseUrl;
    }

    /**
     * Looks up a region by its code, ignoring case.
     *
     * @param code region code such as {@code SNYK-EU-01}
     * @return region
     * @throws DriftConfigurationException if the code is unknown
     */
    public static SnykRegion fromCode(String code) {
        String wanted = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(region -> region.code.equals(wanted))
            .findFirst()
            .orElseThrow(() -> new DriftConfigurationException("Unknown Snyk region '" + code + "', expected one of "
                + Arrays.stream(values()).map(SnykRegion::code).collect(Collectors.joining(", "))));
    }
}
