package com.scandrift.core.model;

import java.util.Locale;

/**
 * Source-hosting platform a repository reference points at.
 */
public enum Platform {
    GITLAB,
    GITHUB,
    BITBUCKET,
    LOCAL,
    UNKNOWN;

    /**
     * Guesses the platform from a host name.
     *
     * <p>Only well-known substrings are recognised; self-hosted instances with neutral host names
     * resolve to {@link #UNKNOWN} unless registered with the resolver as known hosts.
     *
     * @param host host name, may include a port
     * @return detected platform, never null
     */
    public static Platform fromHost(String host) {
        if (host == null || host.isBlank()) {
            return UNKNOWN;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        if (lower.contains("gitlab")) {
            return GITLAB;
        }
        if (lower.contains("github")) {
            return GITHUB;
        }
        if (lower.contains("bitbucket")) {
            return BITBUCKET;
        }
        return UNKNOWN;
    }
}
