package com.scandrift.core.client;

import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.Organization;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the security-scanning tool's organizations, targets and projects.
 *
 * <p>Listing operations return a {@link FetchResult} so callers can tell an empty listing from an
 * inaccessible one. Targets are returned without a resolved identity.
 */
public interface ScanToolApi {

    /**
     * Lists every organization the credentials can see.
     */
    FetchResult<Organization> listOrganizations();

    /**
     * Lists the organizations of a group.
     *
     * @param groupId group id
     */
    FetchResult<Organization> listOrganizationsForGroup(String groupId);

    /**
     * Probes read access to an organization.
     *
     * @param orgId organization id
     */
    OrganizationAccess checkOrganizationAccess(String orgId);

    /**
     * Lists an organization's targets restricted to the given integration types.
     *
     * @param orgId organization id
     * @param integrationTypes integration types to keep, empty for all
     */
    FetchResult<ScanTarget> listTargets(String orgId, List<String> integrationTypes);

    /**
     * Lists the projects of one target.
     *
     * @param orgId organization id
     * @param targetId target id
     */
    FetchResult<ScanProject> listProjectsForTarget(String orgId, String targetId);

    /**
     * Lists every project of an organization.
     *
     * @param orgId organization id
     */
    FetchResult<ScanProject> listProjects(String orgId);

    Optional<ScanProject> getProject(String orgId, String projectId);

    Optional<String> getTargetUrl(String orgId, String targetId);

    /**
     * Display name of an organization, or its id when the name cannot be read.
     */
    String getOrganizationName(String orgId);

    /**
     * Browser URL of a project in the scanning tool's web app.
     */
    String projectWebUrl(String orgId, String projectId);
}
