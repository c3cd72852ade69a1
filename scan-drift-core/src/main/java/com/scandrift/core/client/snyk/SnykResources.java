package com.scandrift.core.client.snyk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON:API resource shapes returned by the Snyk REST API.
 *
 * <p>Only the fields scan-drift reads are declared; everything else is ignored. Any field may be absent.
 */
public final class SnykResources {

    private SnykResources() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrgResource(
        @JsonProperty("id") String id,
        @JsonProperty("attributes") OrgAttributes attributes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrgAttributes(
        @JsonProperty("name") String name,
        @JsonProperty("slug") String slug
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TargetResource(
        @JsonProperty("id") String id,
        @JsonProperty("attributes") TargetAttributes attributes,
        @JsonProperty("relationships") TargetRelationships relationships
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TargetAttributes(
        @JsonProperty("display_name") String displayName,
        @JsonProperty("url") String url,
        @JsonProperty("type") String type
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TargetRelationships(
        @JsonProperty("integration") Relationship integration
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectResource(
        @JsonProperty("id") String id,
        @JsonProperty("attributes") ProjectAttributes attributes,
        @JsonProperty("relationships") ProjectRelationships relationships
    ) {}

    /**
     * Project attributes. {@code targetFiles} stays a raw node because its element type varies.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectAttributes(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("created") String created,
        @JsonProperty("origin") String origin,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("target_reference") String targetReference,
        @JsonProperty("url") String url,
        @JsonProperty("root") String root,
        @JsonProperty("target_file") String targetFile,
        @JsonProperty("target_file_path") String targetFilePath,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("path") String path,
        @JsonProperty("target_files") JsonNode targetFiles
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectRelationships(
        @JsonProperty("organization") Relationship organization,
        @JsonProperty("target") Relationship target
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Relationship(
        @JsonProperty("data") ResourceRef data
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceRef(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("attributes") RefAttributes attributes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RefAttributes(
        @JsonProperty("integration_type") String integrationType
    ) {}
}
