package com.scandrift.core.client.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of {@code GET /projects/:id/repository/tree}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabTreeNode(
    @JsonProperty("path") String path,
    @JsonProperty("name") String name,
    @JsonProperty("type") String type
) {}
