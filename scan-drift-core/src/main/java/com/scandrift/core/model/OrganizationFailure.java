package com.scandrift.core.model;

import java.util.Objects;

/**
 * An organization whose targets could not be acquired.
 *
 * @param orgId organization id
 * @param reason human-readable reason (not found, access denied, request failed...)
 */
public record OrganizationFailure(String orgId, String reason) {

    /**
     * Compact constructor with validation.
     */
    public OrganizationFailure {
        Objects.requireNonNull(orgId, "orgId must not be null");
        if (reason == null) {
            reason = "unknown";
        }
    }
}
