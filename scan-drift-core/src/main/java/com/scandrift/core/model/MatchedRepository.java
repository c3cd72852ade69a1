package com.scandrift.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Coverage outcome for a repository present in both catalogs.
 *
 * @param key canonical key
 * @param repository host catalog entry (authoritative for the default branch)
 * @param identity identity derived from the host entry
 * @param targets targets mapped to the key
 * @param projectCount number of distinct projects examined across all targets
 * @param trackedFiles declared files that exist, deduplicated, insertion order
 * @param staleFiles declared files that are missing, deduplicated, insertion order
 * @param supportedFiles supported files found in the repository tree
 * @param untrackedFiles supported file paths no project declares, sorted
 * @param trackedDetails per-declaration details for existing files
 * @param staleDetails per-declaration details for missing files
 * @param duplicates duplicate project groups among the repository's projects
 * @param errors host or scanning-tool errors met while evaluating the repository
 */
public record MatchedRepository(
    CanonicalKey key,
    HostRepository repository,
    RepoIdentity identity,
    List<ScanTarget> targets,
    int projectCount,
    List<TrackedFile> trackedFiles,
    List<TrackedFile> staleFiles,
    List<SupportedFile> supportedFiles,
    List<String> untrackedFiles,
    List<FileFinding> trackedDetails,
    List<FileFinding> staleDetails,
    List<DuplicateGroup> duplicates,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public MatchedRepository {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        targets = copy(targets);
        trackedFiles = copy(trackedFiles);
        staleFiles = copy(staleFiles);
        supportedFiles = copy(supportedFiles);
        untrackedFiles = copy(untrackedFiles);
        trackedDetails = copy(trackedDetails);
        staleDetails = copy(staleDetails);
        duplicates = copy(duplicates);
        errors = copy(errors);
    }

    /**
     * Returns true if the repository has any stale file, untracked supported file or duplicate.
     *
     * @return whether drift was detected
     */
    public boolean hasDrift() {
        return !staleFiles.isEmpty() || !untrackedFiles.isEmpty() || !duplicates.isEmpty();
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
