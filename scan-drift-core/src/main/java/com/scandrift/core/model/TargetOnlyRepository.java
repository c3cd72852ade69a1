package com.scandrift.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A canonical key tracked by the scanning tool that the host does not know (stale tracking).
 *
 * @param key canonical key
 * @param targets targets mapped to the key, in discovery order
 */
public record TargetOnlyRepository(CanonicalKey key, List<ScanTarget> targets) {

    /**
     * Compact constructor with validation.
     */
    public TargetOnlyRepository {
        Objects.requireNonNull(key, "key must not be null");
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
