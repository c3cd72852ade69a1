package com.scandrift.core.identity.matcher;

import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.identity.RepoUrlMatcher;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.RepoIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Matches {@code https://bitbucket.org/workspace/repo[/src|branch/<branch>/...]}.
 */
public class BitbucketUrlMatcher implements RepoUrlMatcher {

    public static final String BITBUCKET_HOST = "bitbucket.org";

    @Override
    public String getId() {
        return "bitbucket";
    }

    @Override
    public Optional<RepoIdentity> match(String reference, HostClassifier hosts) {
        return HttpUrlParts.parse(reference)
            .filter(parts -> BITBUCKET_HOST.equals(parts.bareHost()))
            .filter(parts -> parts.segments().size() >= 2)
            .map(parts -> {
                List<String> segments = parts.segments();
                String repo = HttpUrlParts.stripGitSuffix(segments.get(1));
                String branch = null;
                if (segments.size() >= 4 && ("src".equals(segments.get(2)) || "branch".equals(segments.get(2)))) {
                    branch = segments.get(3);
                }
                return new RepoIdentity(Platform.BITBUCKET, BITBUCKET_HOST, segments.get(0), repo, branch,
                    false, false);
            });
    }
}
