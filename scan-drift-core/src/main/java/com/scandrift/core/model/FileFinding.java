package com.scandrift.core.model;

import java.util.Objects;

/**
 * Reporting detail for a declared file: where it was declared and whether it still exists.
 *
 * @param filePath resolved repository-relative path
 * @param declaredPath path as declared by the project
 * @param root project root directory
 * @param projectId declaring project id
 * @param projectName declaring project name
 * @param orgId organization id
 * @param orgName organization display name
 * @param projectUrl web URL of the project in the scanning tool
 * @param exists whether the file exists on the host
 */
public record FileFinding(
    String filePath,
    String declaredPath,
    String root,
    String projectId,
    String projectName,
    String orgId,
    String orgName,
    String projectUrl,
    boolean exists
) {
    /**
     * Compact constructor with validation.
     */
    public FileFinding {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        if (root == null) {
            root = "";
        }
        if (projectName == null) {
            projectName = "";
        }
        if (orgName == null) {
            orgName = orgId;
        }
        if (projectUrl == null) {
            projectUrl = "";
        }
    }
}
