package com.scandrift.core.identity.matcher;

import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.identity.RepoUrlMatcher;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.RepoIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Matches {@code https://github.com/owner/repo[/tree|blob/<branch>/...]}.
 *
 * <p>GitHub has no nested groups: the owner is always the first segment.
 */
public class GitHubUrlMatcher implements RepoUrlMatcher {

    public static final String GITHUB_HOST = "github.com";

    @Override
    public String getId() {
        return "github";
    }

    @Override
    public Optional<RepoIdentity> match(String reference, HostClassifier hosts) {
        return HttpUrlParts.parse(reference)
            .filter(parts -> GITHUB_HOST.equals(parts.bareHost()))
            .filter(parts -> parts.segments().size() >= 2)
            .map(parts -> {
                List<String> segments = parts.segments();
                String repo = HttpUrlParts.stripGitSuffix(segments.get(1));
                String branch = null;
                if (segments.size() >= 4 && isBranchMarker(segments.get(2))) {
                    branch = segments.get(3);
                }
                return new RepoIdentity(Platform.GITHUB, GITHUB_HOST, segments.get(0), repo, branch, false, false);
            });
    }

    private static boolean isBranchMarker(String segment) {
        return "tree".equals(segment) || "blob".equals(segment);
    }
}
