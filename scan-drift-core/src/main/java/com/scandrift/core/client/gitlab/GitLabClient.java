package com.scandrift.core.client.gitlab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scandrift.core.client.HostApiException;
import com.scandrift.core.client.HostPlatformApi;
import com.scandrift.core.client.TreeEntry;
import com.scandrift.core.fetch.FetchRequest;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.fetch.PaginatedFetcher;
import com.scandrift.core.fetch.PaginationStyle;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.identity.UrlNormalizer;
import com.scandrift.core.model.HostRepository;
import com.scandrift.core.model.RepoIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HostPlatformApi} backed by the GitLab v4 REST API.
 *
 * <p>Works against gitlab.com and self-managed instances. Without a token only public projects are visible.
 */
public class GitLabClient implements HostPlatformApi {
    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);

    private static final String API_PATH = "/api/v4";

    private final PaginatedFetcher fetcher;
    private final String baseUrl;
    private final String host;
    private final Map<String, String> headers;
    private final int pageSize;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> defaultBranches = new HashMap<>();

    /**
     * Creates a client.
     *
     * @param fetcher fetcher carrying transport and retry policy
     * @param baseUrl instance URL such as {@code https://gitlab.com}
     * @param token personal access token, may be null or blank
     * @param pageSize items per page
     */
    public GitLabClient(PaginatedFetcher fetcher, String baseUrl, String token, int pageSize) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.host = HttpUrlParts.parse(this.baseUrl)
            .map(HttpUrlParts::host)
            .orElseThrow(() -> new IllegalArgumentException("Not an HTTP(S) URL: " + baseUrl));
        this.headers = token == null || token.isBlank()
            ? Map.of()
            : Map.of("Authorization", "Bearer " + token.trim());
        this.pageSize = pageSize > 0 ? pageSize : 100;
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public FetchResult<HostRepository> listRepositories() {
        FetchRequest request = FetchRequest.builder(baseUrl + API_PATH + "/projects")
            .param("membership", "true")
            .param("simple", "true")
            .param("archived", "false")
            .param("per_page", String.valueOf(pageSize))
            .param("order_by", "path")
            .headers(headers)
            .pagination(PaginationStyle.PAGE_HEADER)
            .build();
        FetchResult<HostRepository> result = fetcher.fetchAll(request).mapPresent(this::toRepository);
        log.debug("Listed {} repositories from {} ({})", result.items().size(), host, result.status());
        return result;
    }

    @Override
    public String getDefaultBranch(RepoIdentity identity) {
        return defaultBranches.computeIfAbsent(identity.fullPath(), path -> {
            FetchRequest request = FetchRequest.builder(projectUrl(identity)).headers(headers).build();
            return fetcher.fetchDocument(request).first()
                .map(doc -> doc.path("default_branch"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(branch -> !branch.isBlank())
                .orElse(RepoIdentity.DEFAULT_BRANCH);
        });
    }

    @Override
    public boolean fileExists(RepoIdentity identity, String path, String ref) {
        FetchRequest request = FetchRequest.builder(projectUrl(identity) + "/repository/files/" + encode(path))
            .param("ref", ref)
            .headers(headers)
            .build();
        FetchResult<JsonNode> result = fetcher.fetchDocument(request);
        if (result.isComplete()) {
            return true;
        }
        if (result.status() == FetchStatus.UNAVAILABLE && result.httpStatus() == 404) {
            return false;
        }
        throw new HostApiException("Cannot check " + path + "@" + ref + " in " + identity.fullPath() + ": "
            + result.reason(), result.httpStatus());
    }

    @Override
    public FetchResult<TreeEntry> repositoryTree(RepoIdentity identity, String ref) {
        FetchRequest request = FetchRequest.builder(projectUrl(identity) + "/repository/tree")
            .param("ref", ref)
            .param("recursive", "true")
            .param("per_page", String.valueOf(pageSize))
            .headers(headers)
            .pagination(PaginationStyle.PAGE_HEADER)
            .build();
        return fetcher.fetchAll(request).mapPresent(this::toTreeEntry);
    }

    private String projectUrl(RepoIdentity identity) {
        return baseUrl + API_PATH + "/projects/" + encode(identity.fullPath());
    }

    private Optional<HostRepository> toRepository(JsonNode node) {
        try {
            GitLabProject project = objectMapper.treeToValue(node, GitLabProject.class);
            if (project == null || project.pathWithNamespace() == null || project.pathWithNamespace().isBlank()) {
                return Optional.empty();
            }
            String webUrl = project.webUrl() == null ? "" : project.webUrl();
            return Optional.of(new HostRepository(project.id(), project.defaultBranch(), project.pathWithNamespace(),
                webUrl, UrlNormalizer.normalize(webUrl), project.archived()));
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed project entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<TreeEntry> toTreeEntry(JsonNode node) {
        try {
            GitLabTreeNode entry = objectMapper.treeToValue(node, GitLabTreeNode.class);
            if (entry == null || entry.path() == null || entry.path().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new TreeEntry(entry.path(), entry.name(), entry.type()));
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed tree entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
