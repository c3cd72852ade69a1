package com.scandrift.core.identity.matcher;

import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.identity.RepoUrlMatcher;
import com.scandrift.core.model.RepoIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Generic HTTP(S) matcher for GitLab and other self-hosted instances with nested groups.
 *
 * <p>The repository path ends where a branch marker starts: {@code /-/tree/<branch>},
 * {@code /-/blob/<branch>/...} or {@code /tree/<branch>}. All segments before the last one are the
 * owner, however deep the group hierarchy goes. Without a marker the branch is {@code main}.
 *
 * <p>Without the {@code /-/} separator the first {@code tree} or {@code blob} segment after the first two is taken
 * as the marker, so a group or project literally named {@code tree} or {@code blob} below that depth is read as a
 * branch reference.
 *
 * <p>github.com and bitbucket.org are excluded so this matcher never claims references that their
 * dedicated matchers rejected.
 */
public class NestedGroupUrlMatcher implements RepoUrlMatcher {

    private static final String GITLAB_SEPARATOR = "-";

    @Override
    public String getId() {
        return "nested-group";
    }

    @Override
    public Optional<RepoIdentity> match(String reference, HostClassifier hosts) {
        return HttpUrlParts.parse(reference)
            .filter(parts -> !GitHubUrlMatcher.GITHUB_HOST.equals(parts.bareHost()))
            .filter(parts -> !BitbucketUrlMatcher.BITBUCKET_HOST.equals(parts.bareHost()))
            .flatMap(parts -> toIdentity(parts, hosts));
    }

    private Optional<RepoIdentity> toIdentity(HttpUrlParts parts, HostClassifier hosts) {
        List<String> segments = parts.segments();
        int repoEnd = segments.size();
        String branch = null;

        int separator = segments.indexOf(GITLAB_SEPARATOR);
        if (separator >= 0) {
            repoEnd = separator;
            if (separator + 2 < segments.size() && isBranchMarker(segments.get(separator + 1))) {
                branch = segments.get(separator + 2);
            }
        } else {
            for (int i = 2; i + 1 < segments.size(); i++) {
                if (isBranchMarker(segments.get(i))) {
                    repoEnd = i;
                    branch = segments.get(i + 1);
                    break;
                }
            }
        }

        if (repoEnd < 2) {
            return Optional.empty();
        }
        List<String> repoPath = segments.subList(0, repoEnd);
        String repo = HttpUrlParts.stripGitSuffix(repoPath.get(repoPath.size() - 1));
        if (repo.isEmpty()) {
            return Optional.empty();
        }
        String owner = String.join("/", repoPath.subList(0, repoPath.size() - 1));
        return Optional.of(new RepoIdentity(
            hosts.classify(parts.host()), parts.host(), owner, repo, branch, false, false));
    }

    private static boolean isBranchMarker(String segment) {
        return "tree".equals(segment) || "blob".equals(segment);
    }
}
