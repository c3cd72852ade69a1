package com.scandrift.core.client.snyk;

import com.fasterxml.jackson.databind.JsonNode;
import com.scandrift.core.client.OrganizationAccess;
import com.scandrift.core.client.ScanToolApi;
import com.scandrift.core.config.DriftConfig.ApiVersions;
import com.scandrift.core.config.DriftConfigurationException;
import com.scandrift.core.fetch.FetchRequest;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.fetch.PaginatedFetcher;
import com.scandrift.core.fetch.PaginationStyle;
import com.scandrift.core.identity.UrlNormalizer;
import com.scandrift.core.model.Organization;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScanToolApi} backed by the Snyk REST API.
 *
 * <p>Every listing goes through {@link PaginatedFetcher} with the version list configured for that resource.
 * Target URLs, organization names and per-organization project listings are memoized for the lifetime of the
 * client, which is one run.
 *
 * <p>Usage:
 * <pre>
 * ScanToolApi snyk = SnykRestClient.builder()
 *     .fetcher(fetcher)
 *     .region(SnykRegion.fromCode("SNYK-EU-01"))
 *     .token(System.getenv("SNYK_TOKEN"))
 *     .build();
 * </pre>
 */
public class SnykRestClient implements ScanToolApi {
    private static final Logger log = LoggerFactory.getLogger(SnykRestClient.class);

    private static final String DATA = FetchRequest.JSON_API_ITEMS;

    private final PaginatedFetcher fetcher;
    private final String restBaseUrl;
    private final String webBaseUrl;
    private final Map<String, String> headers;
    private final ApiVersions versions;
    private final int pageSize;
    private final SnykResponseMapper mapper = new SnykResponseMapper();

    private final Map<String, Optional<String>> targetUrls = new HashMap<>();
    private final Map<String, String> organizationNames = new HashMap<>();
    private final Map<String, FetchResult<ScanProject>> organizationProjects = new HashMap<>();

    private SnykRestClient(Builder builder) {
        this.fetcher = Objects.requireNonNull(builder.fetcher, "fetcher must not be null");
        if (builder.token == null || builder.token.isBlank()) {
            throw new DriftConfigurationException("A Snyk API token is required (--snyk-token or SNYK_TOKEN)");
        }
        SnykRegion region = builder.region != null ? builder.region : SnykRegion.SNYK_US_01;
        this.restBaseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : region.restBaseUrl());
        this.webBaseUrl = region.webBaseUrl();
        this.headers = Map.of(
            "Authorization", "token " + builder.token.trim(),
            "Accept", "application/vnd.api+json");
        this.versions = builder.versions != null ? builder.versions : ApiVersions.defaults();
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : 100;
    }

    @Override
    public FetchResult<Organization> listOrganizations() {
        FetchRequest request = collection("/orgs", versions.organizations()).build();
        return fetcher.fetchAll(request).mapPresent(mapper::toOrganization);
    }

    @Override
    public FetchResult<Organization> listOrganizationsForGroup(String groupId) {
        FetchRequest request = collection("/groups/" + encode(groupId) + "/orgs", versions.groupOrganizations())
            .build();
        return fetcher.fetchAll(request).mapPresent(mapper::toOrganization);
    }

    @Override
    public OrganizationAccess checkOrganizationAccess(String orgId) {
        FetchRequest request = document("/orgs/" + encode(orgId), versions.organizationAccess());
        FetchResult<JsonNode> result = fetcher.fetchDocument(request);
        if (!result.isAvailable() || result.first().isEmpty()) {
            log.warn("Organization {} is not accessible: {}", orgId, result.reason());
            return OrganizationAccess.denied(orgId, result.reason().isEmpty()
                ? "Organization could not be read (HTTP " + result.httpStatus() + ")"
                : result.reason());
        }
        mapper.textAt(result.first().get(), "/data/attributes/name")
            .ifPresent(name -> organizationNames.putIfAbsent(orgId, name));
        log.debug("Organization {} accessible with version {}", orgId, result.version());
        return OrganizationAccess.granted(orgId);
    }

    @Override
    public FetchResult<ScanTarget> listTargets(String orgId, List<String> integrationTypes) {
        FetchRequest.Builder request = collection("/orgs/" + encode(orgId) + "/targets", versions.targets());
        if (integrationTypes != null && !integrationTypes.isEmpty()) {
            request.param("source_types", String.join(",", integrationTypes));
        }
        return fetcher.fetchAll(request.build()).mapPresent(node -> mapper.toTarget(orgId, node));
    }

    /**
     * {@inheritDoc}
     *
     * <p>When the per-target endpoint answers not-found, the organization's full project list is filtered instead:
     * a project belongs to the target if its target id matches, or, lacking a target id, if its target reference
     * or URL denotes the same repository as the target's URL.
     */
    @Override
    public FetchResult<ScanProject> listProjectsForTarget(String orgId, String targetId) {
        FetchRequest request = collection(
            "/orgs/" + encode(orgId) + "/targets/" + encode(targetId) + "/projects", versions.projects()).build();
        FetchResult<JsonNode> result = fetcher.fetchAll(request);

        if (result.status() == FetchStatus.UNAVAILABLE && result.httpStatus() == 404) {
            log.debug("Per-target projects unavailable for {}, filtering organization projects", targetId);
            return projectsOfTargetFromOrganization(orgId, targetId);
        }
        return result.mapPresent(node -> mapper.toProject(orgId, node)
            .map(project -> project.withOwner(project.orgId(), targetId)));
    }

    @Override
    public FetchResult<ScanProject> listProjects(String orgId) {
        return organizationProjects.computeIfAbsent(orgId, id -> {
            FetchRequest request = collection("/orgs/" + encode(id) + "/projects", versions.projects()).build();
            FetchResult<ScanProject> projects = fetcher.fetchAll(request)
                .mapPresent(node -> mapper.toProject(id, node));
            log.debug("Organization {} has {} projects ({})", id, projects.items().size(), projects.status());
            return projects;
        });
    }

    @Override
    public Optional<ScanProject> getProject(String orgId, String projectId) {
        FetchRequest request = document("/orgs/" + encode(orgId) + "/projects/" + encode(projectId),
            versions.projects());
        return fetcher.fetchDocument(request).first()
            .map(doc -> doc.get("data"))
            .flatMap(data -> mapper.toProject(orgId, data));
    }

    @Override
    public Optional<String> getTargetUrl(String orgId, String targetId) {
        return targetUrls.computeIfAbsent(orgId + "/" + targetId, key -> {
            FetchRequest request = document("/orgs/" + encode(orgId) + "/targets/" + encode(targetId),
                versions.targets());
            return fetcher.fetchDocument(request).first()
                .flatMap(doc -> mapper.textAt(doc, "/data/attributes/url"));
        });
    }

    @Override
    public String getOrganizationName(String orgId) {
        return organizationNames.computeIfAbsent(orgId, id -> {
            FetchRequest request = document("/orgs/" + encode(id), versions.organizations());
            return fetcher.fetchDocument(request).first()
                .flatMap(doc -> mapper.textAt(doc, "/data/attributes/name"))
                .orElse(id);
        });
    }

    @Override
    public String projectWebUrl(String orgId, String projectId) {
        return webBaseUrl + "/org/" + SnykResponseMapper.slug(getOrganizationName(orgId)) + "/project/" + projectId;
    }

    public String restBaseUrl() {
        return restBaseUrl;
    }

    private FetchResult<ScanProject> projectsOfTargetFromOrganization(String orgId, String targetId) {
        FetchResult<ScanProject> all = listProjects(orgId);
        Optional<String> targetUrl = Optional.empty();
        boolean targetUrlLoaded = false;

        List<ScanProject> matching = new ArrayList<>();
        for (ScanProject project : all.items()) {
            if (project.targetId() != null && !project.targetId().isBlank()) {
                if (project.targetId().equals(targetId)) {
                    matching.add(project);
                }
                continue;
            }
            String reference = project.targetReference() != null && !project.targetReference().isBlank()
                ? project.targetReference()
                : project.sourceUrl();
            if (reference == null || reference.isBlank()) {
                continue;
            }
            if (!targetUrlLoaded) {
                targetUrl = getTargetUrl(orgId, targetId);
                targetUrlLoaded = true;
            }
            if (targetUrl.isPresent() && UrlNormalizer.sameRepository(reference, targetUrl.get())) {
                log.debug("Matched project {} to target {} by URL", project.id(), targetId);
                matching.add(project.withOwner(project.orgId(), targetId));
            }
        }
        return all.withItems(matching);
    }

    private FetchRequest.Builder collection(String path, List<String> resourceVersions) {
        return FetchRequest.builder(restBaseUrl + path)
            .param("limit", String.valueOf(pageSize))
            .headers(headers)
            .versions(resourceVersions)
            .pagination(PaginationStyle.NEXT_LINK)
            .itemsPointer(DATA)
            .linkBase(restBaseUrl);
    }

    private FetchRequest document(String path, List<String> resourceVersions) {
        return FetchRequest.builder(restBaseUrl + path)
            .headers(headers)
            .versions(resourceVersions)
            .build();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PaginatedFetcher fetcher;
        private SnykRegion region;
        private String baseUrl;
        private String token;
        private ApiVersions versions;
        private int pageSize = 100;

        public Builder fetcher(PaginatedFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder region(SnykRegion region) {
            this.region = region;
            return this;
        }

        /**
         * Overrides the region's REST base URL.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder versions(ApiVersions versions) {
            this.versions = versions;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public SnykRestClient build() {
            return new SnykRestClient(this);
        }
    }
}
