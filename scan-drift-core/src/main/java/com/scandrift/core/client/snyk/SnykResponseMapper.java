package com.scandrift.core.client.snyk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scandrift.core.client.snyk.SnykResources.OrgResource;
import com.scandrift.core.client.snyk.SnykResources.ProjectAttributes;
import com.scandrift.core.client.snyk.SnykResources.ProjectResource;
import com.scandrift.core.client.snyk.SnykResources.Relationship;
import com.scandrift.core.client.snyk.SnykResources.TargetResource;
import com.scandrift.core.model.Organization;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts Snyk JSON:API resources into domain records.
 *
 * <p>Resources that fail to bind or have no id are logged and skipped.
 */
final class SnykResponseMapper {
    private static final Logger log = LoggerFactory.getLogger(SnykResponseMapper.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    Optional<Organization> toOrganization(JsonNode node) {
        return bind(node, OrgResource.class)
            .filter(org -> hasText(org.id()))
            .map(org -> org.attributes() == null
                ? new Organization(org.id(), null, null)
                : new Organization(org.id(), org.attributes().name(), org.attributes().slug()));
    }

    Optional<ScanTarget> toTarget(String orgId, JsonNode node) {
        return bind(node, TargetResource.class)
            .filter(target -> hasText(target.id()))
            .map(target -> {
                String displayName = target.attributes() == null ? null : target.attributes().displayName();
                String url = target.attributes() == null ? null : target.attributes().url();
                return new ScanTarget(orgId, target.id(), displayName, url, integrationType(target), null);
            });
    }

    Optional<ScanProject> toProject(String orgId, JsonNode node) {
        return bind(node, ProjectResource.class)
            .filter(project -> hasText(project.id()))
            .map(project -> {
                ProjectAttributes attrs = project.attributes() != null
                    ? project.attributes()
                    : new ProjectAttributes(null, null, null, null, null, null, null, null, null, null, null, null,
                        null);
                String owner = project.relationships() == null ? null : refId(project.relationships().organization());
                String targetId = hasText(attrs.targetId())
                    ? attrs.targetId()
                    : project.relationships() == null ? null : refId(project.relationships().target());
                return new ScanProject(
                    project.id(),
                    attrs.name(),
                    attrs.type(),
                    parseCreated(attrs.created()),
                    hasText(owner) ? owner : orgId,
                    targetId,
                    attrs.targetReference(),
                    attrs.url(),
                    attrs.root(),
                    declaredFiles(attrs)
                );
            });
    }

    Optional<String> textAt(JsonNode document, String pointer) {
        JsonNode value = document.at(pointer);
        return value.isTextual() && !value.asText().isBlank() ? Optional.of(value.asText()) : Optional.empty();
    }

    /**
     * Declared file paths of a project: the single-path attributes in fixed order, then {@code target_files}.
     */
    static List<String> declaredFiles(ProjectAttributes attrs) {
        Set<String> files = new LinkedHashSet<>();
        for (String candidate : new String[] {attrs.targetFile(), attrs.targetFilePath(), attrs.filePath(),
                attrs.path()}) {
            if (hasText(candidate)) {
                files.add(candidate.trim());
            }
        }
        JsonNode many = attrs.targetFiles();
        if (many != null && many.isArray()) {
            many.forEach(entry -> {
                if (entry.isTextual() && !entry.asText().isBlank()) {
                    files.add(entry.asText().trim());
                }
            });
        }
        return new ArrayList<>(files);
    }

    /**
     * Parses an ISO-8601 timestamp, returning null when absent or malformed.
     */
    static Instant parseCreated(String created) {
        if (!hasText(created)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(created.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(created.trim());
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable creation time '{}'", created);
                return null;
            }
        }
    }

    static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replace(' ', '-').replace('_', '-');
    }

    private static String integrationType(TargetResource target) {
        if (target.relationships() != null && target.relationships().integration() != null) {
            SnykResources.ResourceRef ref = target.relationships().integration().data();
            if (ref != null && ref.attributes() != null && hasText(ref.attributes().integrationType())) {
                return ref.attributes().integrationType();
            }
        }
        return target.attributes() == null ? null : target.attributes().type();
    }

    private static String refId(Relationship relationship) {
        return relationship == null || relationship.data() == null ? null : relationship.data().id();
    }

    private <T> Optional<T> bind(JsonNode node, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
