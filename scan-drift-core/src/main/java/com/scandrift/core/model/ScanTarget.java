package com.scandrift.core.model;

import java.util.Objects;

/**
 * A tracking target registered with the scanning tool.
 *
 * @param orgId owning organization id
 * @param targetId target id
 * @param displayName display name, falls back to the target id
 * @param sourceUrl repository URL the target was imported from, null for CLI-style targets
 * @param integrationType integration mechanism ({@code gitlab}, {@code cli}, ...), {@code unknown} if absent
 * @param identity resolved identity of {@code sourceUrl}, null when unresolvable
 */
public record ScanTarget(
    String orgId,
    String targetId,
    String displayName,
    String sourceUrl,
    String integrationType,
    RepoIdentity identity
) {
    public static final String UNKNOWN_INTEGRATION = "unknown";

    /**
     * Compact constructor with validation.
     */
    public ScanTarget {
        Objects.requireNonNull(orgId, "orgId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (displayName == null || displayName.isBlank()) {
            displayName = targetId;
        }
        if (integrationType == null || integrationType.isBlank()) {
            integrationType = UNKNOWN_INTEGRATION;
        }
    }

    /**
     * Returns true if the target carries a non-blank source URL.
     *
     * @return whether a source URL is present
     */
    public boolean hasSourceUrl() {
        return sourceUrl != null && !sourceUrl.isBlank();
    }

    /**
     * Returns a copy with the given resolved identity.
     *
     * @param resolved identity, may be null
     * @return new target
     */
    public ScanTarget withIdentity(RepoIdentity resolved) {
        return new ScanTarget(orgId, targetId, displayName, sourceUrl, integrationType, resolved);
    }
}
