package com.scandrift.core.model;

import java.util.Objects;

/**
 * One repository known to the hosting platform.
 *
 * @param id platform-assigned numeric id
 * @param defaultBranch default branch, null when the listing did not report one
 * @param fullPath {@code group[/subgroup...]/project}
 * @param webUrl web URL as reported by the platform
 * @param normalizedWebUrl web URL after scheme/host/suffix normalization, used for URL cross-matching
 * @param archived whether the repository is archived
 */
public record HostRepository(
    long id,
    String defaultBranch,
    String fullPath,
    String webUrl,
    String normalizedWebUrl,
    boolean archived
) {
    /**
     * Compact constructor with validation.
     */
    public HostRepository {
        Objects.requireNonNull(fullPath, "fullPath must not be null");
        if (defaultBranch != null && defaultBranch.isBlank()) {
            defaultBranch = null;
        }
        if (webUrl == null) {
            webUrl = "";
        }
        if (normalizedWebUrl == null) {
            normalizedWebUrl = "";
        }
    }
}
