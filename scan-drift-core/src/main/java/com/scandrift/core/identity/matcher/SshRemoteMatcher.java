package com.scandrift.core.identity.matcher;

import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.identity.RepoUrlMatcher;
import com.scandrift.core.model.RepoIdentity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches SSH remotes in scp-like syntax ({@code git@host:group/sub/repo.git}) and URL syntax
 * ({@code ssh://git@host:22/group/repo.git}).
 *
 * <p>Everything but the last path segment becomes the owner, so nested groups survive. The SSH port is
 * discarded because it never appears in the web identity of the repository.
 */
public class SshRemoteMatcher implements RepoUrlMatcher {

    /** {@code user@host:path}; the path must not start with {@code //} to keep URLs out. */
    private static final Pattern SCP_LIKE = Pattern.compile("^[\\w.+-]+@([\\w.-]+):(?!//)(.+)$");

    /** {@code ssh://[user@]host[:port]/path}. */
    private static final Pattern SSH_URL = Pattern.compile("^(?i:ssh)://(?:[^@/]+@)?([\\w.-]+)(?::\\d+)?/(.+)$");

    @Override
    public String getId() {
        return "ssh";
    }

    @Override
    public Optional<RepoIdentity> match(String reference, HostClassifier hosts) {
        Matcher matcher = SSH_URL.matcher(reference);
        if (!matcher.matches()) {
            matcher = SCP_LIKE.matcher(reference);
            if (!matcher.matches()) {
                return Optional.empty();
            }
        }
        String host = matcher.group(1).toLowerCase(Locale.ROOT);
        List<String> segments = Arrays.stream(matcher.group(2).split("/"))
            .filter(s -> !s.isEmpty())
            .toList();
        if (segments.size() < 2) {
            return Optional.empty();
        }
        String repo = HttpUrlParts.stripGitSuffix(segments.get(segments.size() - 1));
        if (repo.isEmpty()) {
            return Optional.empty();
        }
        String owner = String.join("/", segments.subList(0, segments.size() - 1));
        return Optional.of(new RepoIdentity(
            hosts.classify(host), host, owner, repo, RepoIdentity.DEFAULT_BRANCH, true, false));
    }
}
