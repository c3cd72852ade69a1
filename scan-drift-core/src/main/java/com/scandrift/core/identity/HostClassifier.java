package com.scandrift.core.identity;

import com.scandrift.core.model.Platform;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a {@link Platform} to a host name.
 *
 * <p>Explicitly registered hosts win; everything else falls back to {@link Platform#fromHost(String)}.
 * Registering the configured GitLab instance lets a neutral host such as {@code code.example.com}
 * resolve as GitLab.
 */
public final class HostClassifier {

    private final Map<String, Platform> knownHosts;

    private HostClassifier(Map<String, Platform> knownHosts) {
        this.knownHosts = Map.copyOf(knownHosts);
    }

    /**
     * Returns a classifier with no registered hosts.
     *
     * @return default classifier
     */
    public static HostClassifier defaults() {
        return new HostClassifier(Map.of());
    }

    /**
     * Returns a classifier that maps the given hosts to fixed platforms.
     *
     * @param hosts host name to platform
     * @return classifier
     */
    public static HostClassifier of(Map<String, Platform> hosts) {
        Map<String, Platform> normalized = new HashMap<>();
        hosts.forEach((host, platform) -> normalized.put(host.toLowerCase(Locale.ROOT), platform));
        return new HostClassifier(normalized);
    }

    /**
     * Classifies a host.
     *
     * @param host host name, any case
     * @return platform
     */
    public Platform classify(String host) {
        if (host == null) {
            return Platform.UNKNOWN;
        }
        Platform known = knownHosts.get(host.toLowerCase(Locale.ROOT));
        return known != null ? known : Platform.fromHost(host);
    }
}
