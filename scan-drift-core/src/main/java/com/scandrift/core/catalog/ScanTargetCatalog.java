package com.scandrift.core.catalog;

import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.UnresolvableTarget;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable map from canonical key to the scan targets tracking that repository.
 *
 * <p>Lists keep discovery order. Targets whose reference could not be resolved sit under
 * {@link CanonicalKey#UNRESOLVABLE}, which {@link #keys()} never returns.
 */
public final class ScanTargetCatalog {

    private final Map<CanonicalKey, List<ScanTarget>> targets;
    private final List<UnresolvableTarget> unresolvable;
    private final List<OrganizationFailure> organizationFailures;

    ScanTargetCatalog(Map<CanonicalKey, List<ScanTarget>> targets, List<UnresolvableTarget> unresolvable,
                      List<OrganizationFailure> organizationFailures) {
        Map<CanonicalKey, List<ScanTarget>> copy = new LinkedHashMap<>();
        targets.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        this.targets = Collections.unmodifiableMap(copy);
        this.unresolvable = List.copyOf(unresolvable);
        this.organizationFailures = List.copyOf(organizationFailures);
    }

    public static ScanTargetCatalog empty() {
        return new ScanTargetCatalog(Map.of(), List.of(), List.of());
    }

    /**
     * Resolvable keys in canonical-key order.
     */
    public SortedSet<CanonicalKey> keys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(targets.keySet()));
    }

    /**
     * Targets for a key in discovery order, empty if none. The sentinel key yields the unresolvable targets.
     */
    public List<ScanTarget> targets(CanonicalKey key) {
        if (key.isUnresolvable()) {
            return unresolvable.stream().map(UnresolvableTarget::target).collect(Collectors.toUnmodifiableList());
        }
        return targets.getOrDefault(key, List.of());
    }

    public boolean contains(CanonicalKey key) {
        return targets.containsKey(key);
    }

    public List<UnresolvableTarget> unresolvable() {
        return unresolvable;
    }

    public List<OrganizationFailure> organizationFailures() {
        return organizationFailures;
    }

    public int size() {
        return targets.size();
    }

    public int targetCount() {
        return targets.values().stream().mapToInt(List::size).sum();
    }
}
