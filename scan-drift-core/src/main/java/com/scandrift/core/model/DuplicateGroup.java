package com.scandrift.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Projects under one target that share the same normalized sub-identifier.
 *
 * @param targetId target the projects belong to
 * @param identifier normalized sub-identifier (portion of the name after the separator)
 * @param canonical the newest project, kept
 * @param stale all other members, newest first
 */
public record DuplicateGroup(
    String targetId,
    String identifier,
    ScanProject canonical,
    List<StaleDuplicate> stale
) {
    /**
     * Compact constructor with validation.
     */
    public DuplicateGroup {
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(canonical, "canonical must not be null");
        stale = stale == null ? List.of() : List.copyOf(stale);
    }

    /**
     * Returns the number of projects in the group, canonical member included.
     *
     * @return group size
     */
    public int size() {
        return stale.size() + 1;
    }
}
