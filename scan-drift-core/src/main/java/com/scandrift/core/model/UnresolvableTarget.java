package com.scandrift.core.model;

import java.util.Objects;

/**
 * A target that could not be mapped to a canonical key.
 *
 * @param target the target
 * @param reason why it could not be resolved
 */
public record UnresolvableTarget(ScanTarget target, UnresolvableReason reason) {

    /**
     * Compact constructor with validation.
     */
    public UnresolvableTarget {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
