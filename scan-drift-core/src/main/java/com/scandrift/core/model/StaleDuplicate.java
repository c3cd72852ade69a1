package com.scandrift.core.model;

import java.util.Objects;

/**
 * A project flagged stale because a newer project tracks the same file under the same target.
 *
 * @param project the stale project
 * @param reason reason text
 * @param duplicateOfId id of the canonical (newest) project
 * @param duplicateOfName name of the canonical project
 */
public record StaleDuplicate(
    ScanProject project,
    String reason,
    String duplicateOfId,
    String duplicateOfName
) {
    public static final String NEWER_VERSION_EXISTS = "Duplicate project - newer version exists";

    /**
     * Compact constructor with validation.
     */
    public StaleDuplicate {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(duplicateOfId, "duplicateOfId must not be null");
        if (reason == null) {
            reason = NEWER_VERSION_EXISTS;
        }
    }
}
