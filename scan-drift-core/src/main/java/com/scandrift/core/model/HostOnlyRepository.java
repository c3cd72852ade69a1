package com.scandrift.core.model;

import java.util.Objects;

/**
 * A host repository that no target tracks.
 *
 * @param key canonical key
 * @param repository host catalog entry
 */
public record HostOnlyRepository(CanonicalKey key, HostRepository repository) {

    /**
     * Compact constructor with validation.
     */
    public HostOnlyRepository {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(repository, "repository must not be null");
    }
}
