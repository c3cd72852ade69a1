package com.scandrift.core.model;

import java.util.Objects;

/**
 * An organization registered with the scanning tool.
 *
 * @param id organization id
 * @param name display name, falls back to the id
 * @param slug URL slug, may be null
 */
public record Organization(
    String id,
    String name,
    String slug
) {
    /**
     * Compact constructor with validation.
     */
    public Organization {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null || name.isBlank()) {
            name = id;
        }
    }
}
