package com.scandrift.core.model;

import java.util.List;

/**
 * Structured outcome of joining the two catalogs.
 *
 * <p>{@code matched}, {@code targetOnly} and {@code hostOnly} partition the union of both catalogs'
 * keys. Unresolvable targets and organization failures sit outside that partition.
 *
 * @param matched repositories present in both catalogs, ordered by key
 * @param targetOnly keys only the scanning tool knows (left-only), ordered by key
 * @param hostOnly keys only the host knows (right-only), ordered by key
 * @param unresolvable targets that could not be resolved to a key
 * @param organizationFailures organizations whose targets could not be acquired
 * @param duplicateGroups all duplicate project groups found in matched repositories
 */
public record ReconciliationResult(
    List<MatchedRepository> matched,
    List<TargetOnlyRepository> targetOnly,
    List<HostOnlyRepository> hostOnly,
    List<UnresolvableTarget> unresolvable,
    List<OrganizationFailure> organizationFailures,
    List<DuplicateGroup> duplicateGroups
) {
    /**
     * Compact constructor with validation.
     */
    public ReconciliationResult {
        matched = matched == null ? List.of() : List.copyOf(matched);
        targetOnly = targetOnly == null ? List.of() : List.copyOf(targetOnly);
        hostOnly = hostOnly == null ? List.of() : List.copyOf(hostOnly);
        unresolvable = unresolvable == null ? List.of() : List.copyOf(unresolvable);
        organizationFailures = organizationFailures == null ? List.of() : List.copyOf(organizationFailures);
        duplicateGroups = duplicateGroups == null ? List.of() : List.copyOf(duplicateGroups);
    }

    /**
     * Returns the total number of stale files across matched repositories.
     *
     * @return stale file count
     */
    public int staleFileCount() {
        return matched.stream().mapToInt(m -> m.staleFiles().size()).sum();
    }

    /**
     * Returns the total number of untracked supported files across matched repositories.
     *
     * @return untracked file count
     */
    public int untrackedFileCount() {
        return matched.stream().mapToInt(m -> m.untrackedFiles().size()).sum();
    }

    /**
     * Returns the total number of stale duplicate projects.
     *
     * @return stale duplicate count
     */
    public int staleDuplicateCount() {
        return duplicateGroups.stream().mapToInt(g -> g.stale().size()).sum();
    }
}
