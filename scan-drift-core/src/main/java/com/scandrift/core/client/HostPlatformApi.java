package com.scandrift.core.client;

import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.HostRepository;
import com.scandrift.core.model.RepoIdentity;

/**
 * Read access to the source-hosting platform.
 */
public interface HostPlatformApi {

    /**
     * Host name of the platform instance, lower case, used when a repository URL carries none.
     */
    String host();

    /**
     * Lists every non-archived repository the credentials are a member of.
     */
    FetchResult<HostRepository> listRepositories();

    /**
     * Default branch of a repository, {@link RepoIdentity#DEFAULT_BRANCH} when it cannot be read.
     */
    String getDefaultBranch(RepoIdentity identity);

    /**
     * Checks whether a file exists at a ref.
     *
     * @param identity repository
     * @param path repository-relative path
     * @param ref branch, tag or commit
     * @return true if present, false if the platform answers not-found
     * @throws HostApiException for any other non-success outcome
     */
    boolean fileExists(RepoIdentity identity, String path, String ref);

    /**
     * Full recursive file tree of a repository at a ref, across all pages.
     *
     * @param identity repository
     * @param ref branch, tag or commit
     */
    FetchResult<TreeEntry> repositoryTree(RepoIdentity identity, String ref);
}
