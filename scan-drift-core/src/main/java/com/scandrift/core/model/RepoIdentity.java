package com.scandrift.core.model;

import java.util.Objects;

/**
 * Canonical identity of a repository reference.
 *
 * <p>Produced by {@link com.scandrift.core.identity.RepoIdentityResolver} and never mutated afterwards.
 * Host names are lower-cased; owner and repository segments keep their original case.
 *
 * @param platform hosting platform
 * @param host host name (lower case, may carry a port)
 * @param owner owner path, may contain nested group segments ({@code group/sub/subsub})
 * @param repo repository name without {@code .git}
 * @param branch branch named by the reference, or {@code main} when none was given
 * @param ssh true if the reference used SSH remote syntax
 * @param local true if the reference is a local filesystem path
 */
public record RepoIdentity(
    Platform platform,
    String host,
    String owner,
    String repo,
    String branch,
    boolean ssh,
    boolean local
) {
    public static final String DEFAULT_BRANCH = "main";

    /**
     * Compact constructor with validation.
     */
    public RepoIdentity {
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(repo, "repo must not be null");
        if (owner == null) {
            owner = "";
        }
        if (branch == null || branch.isBlank()) {
            branch = DEFAULT_BRANCH;
        }
    }

    /**
     * Returns {@code owner/repo}, or just {@code repo} when there is no owner.
     *
     * @return full repository path
     */
    public String fullPath() {
        return owner.isEmpty() ? repo : owner + "/" + repo;
    }

    /**
     * Returns the join key for this identity.
     *
     * @return canonical key built from host and full path
     */
    public CanonicalKey canonicalKey() {
        return CanonicalKey.of(host, fullPath());
    }

    /**
     * Builds an identity for a repository known by its full path on a host.
     *
     * @param platform hosting platform
     * @param host host name
     * @param fullPath {@code owner[/subgroup...]/repo}
     * @param branch default branch, null for {@code main}
     * @return identity
     */
    public static RepoIdentity ofFullPath(Platform platform, String host, String fullPath, String branch) {
        String trimmed = CanonicalKey.trimSlashes(fullPath);
        int lastSlash = trimmed.lastIndexOf('/');
        String owner = lastSlash < 0 ? "" : trimmed.substring(0, lastSlash);
        String repo = lastSlash < 0 ? trimmed : trimmed.substring(lastSlash + 1);
        return new RepoIdentity(platform, host, owner, repo, branch, false, false);
    }
}
