package com.scandrift.core.catalog;

import com.scandrift.core.client.ScanToolApi;
import com.scandrift.core.config.DriftConfigurationException;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.Organization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Determines which organizations a run covers.
 *
 * <p>A single organization id, the organizations of a group, or every organization the credentials can see.
 * An empty selection is a configuration failure.
 */
public class OrganizationResolver {
    private static final Logger log = LoggerFactory.getLogger(OrganizationResolver.class);

    private final ScanToolApi scanTool;

    public OrganizationResolver(ScanToolApi scanTool) {
        this.scanTool = scanTool;
    }

    /**
     * Resolves the organizations to reconcile.
     *
     * @param groupId group to expand, may be null
     * @param orgId single organization, may be null
     * @return organization ids in listing order
     * @throws DriftConfigurationException if both selectors are given or nothing is resolvable
     */
    public List<String> resolve(String groupId, String orgId) {
        boolean hasGroup = groupId != null && !groupId.isBlank();
        boolean hasOrg = orgId != null && !orgId.isBlank();
        if (hasGroup && hasOrg) {
            throw new DriftConfigurationException("Specify either a group id or an organization id, not both");
        }
        if (hasOrg) {
            return List.of(orgId.trim());
        }

        FetchResult<Organization> organizations = hasGroup
            ? scanTool.listOrganizationsForGroup(groupId.trim())
            : scanTool.listOrganizations();
        if (!organizations.isComplete()) {
            log.warn("Organization listing ended {}: {}", organizations.status(), organizations.reason());
        }
        List<String> ids = organizations.items().stream()
            .map(Organization::id)
            .distinct()
            .collect(Collectors.toList());
        if (ids.isEmpty()) {
            throw new DriftConfigurationException(hasGroup
                ? "No organizations found for group " + groupId.trim()
                : "No organizations accessible with the supplied token");
        }
        log.info("Resolved {} organizations", ids.size());
        return ids;
    }
}
