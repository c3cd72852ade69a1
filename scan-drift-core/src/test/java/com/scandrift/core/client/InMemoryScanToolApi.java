package com.scandrift.core.client;

import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.Organization;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scanner API backed by maps, for tests that do not exercise HTTP.
 */
public class InMemoryScanToolApi implements ScanToolApi {

    private final List<Organization> organizations = new ArrayList<>();
    private final Map<String, List<Organization>> groupOrganizations = new HashMap<>();
    private final Map<String, String> deniedOrganizations = new HashMap<>();
    private final Map<String, FetchResult<ScanTarget>> targets = new HashMap<>();
    private final Map<String, FetchResult<ScanProject>> projectsByTarget = new HashMap<>();
    private final Map<String, RuntimeException> projectFailures = new HashMap<>();
    private final List<String> projectListings = new ArrayList<>();

    public InMemoryScanToolApi organization(Organization organization) {
        organizations.add(organization);
        return this;
    }

    public InMemoryScanToolApi groupOrganization(String groupId, Organization organization) {
        groupOrganizations.computeIfAbsent(groupId, key -> new ArrayList<>()).add(organization);
        return this;
    }

    public InMemoryScanToolApi deny(String orgId, String reason) {
        deniedOrganizations.put(orgId, reason);
        return this;
    }

    public InMemoryScanToolApi targets(String orgId, ScanTarget... orgTargets) {
        targets.put(orgId, FetchResult.complete(List.of(orgTargets), "test", 200));
        return this;
    }

    public InMemoryScanToolApi targets(String orgId, FetchResult<ScanTarget> result) {
        targets.put(orgId, result);
        return this;
    }

    public InMemoryScanToolApi projects(String targetId, ScanProject... projects) {
        projectsByTarget.put(targetId, FetchResult.complete(List.of(projects), "test", 200));
        return this;
    }

    public InMemoryScanToolApi projects(String targetId, FetchResult<ScanProject> result) {
        projectsByTarget.put(targetId, result);
        return this;
    }

    public InMemoryScanToolApi failProjects(String targetId, RuntimeException error) {
        projectFailures.put(targetId, error);
        return this;
    }

    /** Target ids whose projects were requested, in call order. */
    public List<String> projectListings() {
        return projectListings;
    }

    @Override
    public FetchResult<Organization> listOrganizations() {
        return FetchResult.complete(organizations, "test", 200);
    }

    @Override
    public FetchResult<Organization> listOrganizationsForGroup(String groupId) {
        List<Organization> orgs = groupOrganizations.get(groupId);
        if (orgs == null) {
            return FetchResult.unavailable(404, "Group " + groupId + " not found");
        }
        return FetchResult.complete(orgs, "test", 200);
    }

    @Override
    public OrganizationAccess checkOrganizationAccess(String orgId) {
        String reason = deniedOrganizations.get(orgId);
        return reason == null ? OrganizationAccess.granted(orgId) : OrganizationAccess.denied(orgId, reason);
    }

    @Override
    public FetchResult<ScanTarget> listTargets(String orgId, List<String> integrationTypes) {
        return targets.getOrDefault(orgId, FetchResult.complete(List.of(), "test", 200));
    }

    @Override
    public FetchResult<ScanProject> listProjectsForTarget(String orgId, String targetId) {
        projectListings.add(targetId);
        RuntimeException error = projectFailures.get(targetId);
        if (error != null) {
            throw error;
        }
        return projectsByTarget.getOrDefault(targetId, FetchResult.complete(List.of(), "test", 200));
    }

    @Override
    public FetchResult<ScanProject> listProjects(String orgId) {
        List<ScanProject> all = new ArrayList<>();
        projectsByTarget.values().forEach(result -> result.items().stream()
            .filter(project -> orgId.equals(project.orgId()))
            .forEach(all::add));
        return FetchResult.complete(all, "test", 200);
    }

    @Override
    public Optional<ScanProject> getProject(String orgId, String projectId) {
        return projectsByTarget.values().stream()
            .flatMap(result -> result.items().stream())
            .filter(project -> project.id().equals(projectId))
            .findFirst();
    }

    @Override
    public Optional<String> getTargetUrl(String orgId, String targetId) {
        return Optional.ofNullable(targets.get(orgId))
            .flatMap(result -> result.items().stream()
                .filter(target -> target.targetId().equals(targetId))
                .findFirst())
            .map(ScanTarget::sourceUrl);
    }

    @Override
    public String getOrganizationName(String orgId) {
        return organizations.stream()
            .filter(org -> org.id().equals(orgId))
            .map(Organization::name)
            .findFirst()
            .orElse(orgId);
    }

    @Override
    public String projectWebUrl(String orgId, String projectId) {
        return "https://app.snyk.io/org/" + orgId + "/project/" + projectId;
    }
}
