package com.scandrift.core.identity;

import com.scandrift.core.identity.matcher.BitbucketUrlMatcher;
import com.scandrift.core.identity.matcher.GitHubUrlMatcher;
import com.scandrift.core.identity.matcher.LocalPathMatcher;
import com.scandrift.core.identity.matcher.NestedGroupUrlMatcher;
import com.scandrift.core.identity.matcher.SshRemoteMatcher;
import com.scandrift.core.model.RepoIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves repository reference strings in heterogeneous formats into a {@link RepoIdentity}.
 *
 * <p>Reference shapes overlap (an SSH remote contains a colon like a Windows path, a GitHub URL is also a
 * valid generic URL), so matchers run in a fixed priority order and the first one that claims the
 * reference wins:
 * <ol>
 *   <li>local filesystem paths ({@code file://} or absolute)</li>
 *   <li>SSH remotes ({@code user@host:owner/repo.git}, {@code ssh://user@host/owner/repo})</li>
 *   <li>github.com URLs</li>
 *   <li>bitbucket.org URLs</li>
 *   <li>any other HTTP(S) host, with nested groups of arbitrary depth</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RepoIdentityResolver resolver = RepoIdentityResolver.withKnownHosts(
 *     HostClassifier.of(Map.of("code.example.com", Platform.GITLAB)));
 *
 * resolver.resolve("https://code.example.com/team/backend/api/-/tree/develop")
 *     .map(RepoIdentity::canonicalKey);   // code.example.com/team/backend/api
 * }</pre>
 */
public class RepoIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(RepoIdentityResolver.class);

    private final List<RepoUrlMatcher> matchers;
    private final HostClassifier hosts;

    public RepoIdentityResolver(List<RepoUrlMatcher> matchers, HostClassifier hosts) {
        this.matchers = List.copyOf(matchers);
        this.hosts = hosts;
    }

    /**
     * Creates a resolver with the default matcher chain and no registered hosts.
     *
     * @return resolver
     */
    public static RepoIdentityResolver defaults() {
        return withKnownHosts(HostClassifier.defaults());
    }

    /**
     * Creates a resolver with the default matcher chain and the given host classifier.
     *
     * @param hosts host classifier
     * @return resolver
     */
    public static RepoIdentityResolver withKnownHosts(HostClassifier hosts) {
        return new RepoIdentityResolver(defaultMatchers(), hosts);
    }

    /**
     * Returns the default matcher chain in priority order.
     *
     * @return matchers
     */
    public static List<RepoUrlMatcher> defaultMatchers() {
        return List.of(
            new LocalPathMatcher(),
            new SshRemoteMatcher(),
            new GitHubUrlMatcher(),
            new BitbucketUrlMatcher(),
            new NestedGroupUrlMatcher()
        );
    }

    /**
     * Resolves a reference.
     *
     * @param reference URL or path, may be null or blank
     * @return identity, or empty when no matcher recognises the reference
     */
    public Optional<RepoIdentity> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        for (RepoUrlMatcher matcher : matchers) {
            Optional<RepoIdentity> identity = matcher.match(trimmed, hosts);
            if (identity.isPresent()) {
                log.debug("Resolved '{}' with matcher '{}' -> {}", trimmed, matcher.getId(), identity.get());
                return identity;
            }
        }
        log.debug("Could not resolve reference: {}", trimmed);
        return Optional.empty();
    }
}
