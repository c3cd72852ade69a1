package com.scandrift.core.identity;

import com.scandrift.core.model.RepoIdentity;

import java.util.Optional;

/**
 * Strategy that recognises one family of repository reference shapes.
 *
 * <p>Matchers are independent of each other: each inspects the whole reference and either claims it
 * or returns empty. {@link RepoIdentityResolver} tries them in a fixed priority order and stops at the
 * first match, so a matcher never needs to know which shapes other matchers handle.
 *
 * @see RepoIdentityResolver
 */
public interface RepoUrlMatcher {

    /**
     * Returns a short identifier used in logs (e.g. "ssh", "github").
     *
     * @return matcher id
     */
    String getId();

    /**
     * Attempts to resolve the reference.
     *
     * @param reference trimmed, non-empty reference string
     * @param hosts classifier used to assign a platform to the host
     * @return identity if this matcher recognises the shape, empty otherwise
     */
    Optional<RepoIdentity> match(String reference, HostClassifier hosts);
}
