package com.scandrift.core.client;

import java.util.Objects;

/**
 * Result of probing whether an organization can be read with the current credentials.
 *
 * @param orgId organization id
 * @param accessible whether any API version served the organization
 * @param reason why access failed, empty when accessible
 */
public record OrganizationAccess(
    String orgId,
    boolean accessible,
    String reason
) {
    public OrganizationAccess {
        Objects.requireNonNull(orgId, "orgId must not be null");
        if (reason == null) {
            reason = "";
        }
    }

    public static OrganizationAccess granted(String orgId) {
        return new OrganizationAccess(orgId, true, "");
    }

    public static OrganizationAccess denied(String orgId, String reason) {
        return new OrganizationAccess(orgId, false, reason);
    }
}
