package com.scandrift.core.client.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Project as listed by the GitLab v4 API.
 *
 * @param id numeric project id
 * @param pathWithNamespace {@code group[/subgroup...]/project}
 * @param defaultBranch default branch, absent for empty repositories
 * @param webUrl browser URL
 * @param archived archive flag, absent in simple listings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabProject(
    @JsonProperty("id") long id,
    @JsonProperty("path_with_namespace") String pathWithNamespace,
    @JsonProperty("default_branch") String defaultBranch,
    @JsonProperty("web_url") String webUrl,
    @JsonProperty("archived") boolean archived
) {}
