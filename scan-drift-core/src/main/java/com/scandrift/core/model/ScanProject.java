package com.scandrift.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A single tracked file declaration registered under a target.
 *
 * @param id project id
 * @param name project name, typically {@code <repo>:<file path>}
 * @param type project type (package manager or scanner kind)
 * @param created creation timestamp, null if unknown
 * @param orgId owning organization id, may be null
 * @param targetId owning target id, may be null when the listing did not carry it
 * @param targetReference branch or reference the project was imported from, may be null
 * @param sourceUrl URL the project reports for its origin, may be null
 * @param root repository-relative root directory of the declared files, empty for the repository root
 * @param declaredFiles declared target file paths (zero, one or many)
 */
public record ScanProject(
    String id,
    String name,
    String type,
    Instant created,
    String orgId,
    String targetId,
    String targetReference,
    String sourceUrl,
    String root,
    List<String> declaredFiles
) {
    /**
     * Compact constructor with validation.
     */
    public ScanProject {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        if (type == null || type.isBlank()) {
            type = "unknown";
        }
        if (root == null) {
            root = "";
        }
        declaredFiles = declaredFiles == null ? List.of() : List.copyOf(declaredFiles);
    }

    /**
     * Returns a copy attributed to the given organization and target.
     *
     * @param newOrgId organization id
     * @param newTargetId target id
     * @return new project
     */
    public ScanProject withOwner(String newOrgId, String newTargetId) {
        return new ScanProject(id, name, type, created, newOrgId, newTargetId,
            targetReference, sourceUrl, root, declaredFiles);
    }
}
