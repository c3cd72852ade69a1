package com.scandrift.core.catalog;

import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.UnresolvableReason;
import com.scandrift.core.model.UnresolvableTarget;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only accumulator for a {@link ScanTargetCatalog}.
 *
 * <p>{@link #add} appends to the key's list and never replaces earlier entries. Once {@link #freeze()} is called the
 * builder rejects further changes.
 */
public class ScanTargetCatalogBuilder {

    private final Map<CanonicalKey, List<ScanTarget>> targets = new LinkedHashMap<>();
    private final List<UnresolvableTarget> unresolvable = new ArrayList<>();
    private final List<OrganizationFailure> organizationFailures = new ArrayList<>();
    private boolean frozen;

    /**
     * Appends a target under a key.
     *
     * @param key canonical key of the tracked repository
     * @param target target to append
     * @return this builder
     * @throws IllegalArgumentException if the key is the unresolvable sentinel
     * @throws IllegalStateException if already frozen
     */
    public ScanTargetCatalogBuilder add(CanonicalKey key, ScanTarget target) {
        checkNotFrozen();
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (key.isUnresolvable()) {
            throw new IllegalArgumentException("Use addUnresolvable for targets without a canonical key");
        }
        targets.computeIfAbsent(key, k -> new ArrayList<>()).add(target);
        return this;
    }

    public ScanTargetCatalogBuilder addUnresolvable(ScanTarget target, UnresolvableReason reason) {
        checkNotFrozen();
        unresolvable.add(new UnresolvableTarget(target, reason));
        return this;
    }

    public ScanTargetCatalogBuilder recordOrganizationFailure(String orgId, String reason) {
        checkNotFrozen();
        organizationFailures.add(new OrganizationFailure(orgId, reason));
        return this;
    }

    public ScanTargetCatalog freeze() {
        checkNotFrozen();
        frozen = true;
        return new ScanTargetCatalog(targets, unresolvable, organizationFailures);
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Target catalog already frozen");
        }
    }
}
