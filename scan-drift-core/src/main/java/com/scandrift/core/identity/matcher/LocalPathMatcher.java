package com.scandrift.core.identity.matcher;

import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.RepoUrlMatcher;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.RepoIdentity;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches local filesystem references: {@code file://} URLs and absolute POSIX or Windows paths.
 *
 * <p>The identity is the path itself: host {@code localhost}, the parent directories as owner and the
 * last path element as repository. Branch defaults to {@code main}.
 */
public class LocalPathMatcher implements RepoUrlMatcher {

    public static final String LOCAL_HOST = "localhost";

    private static final String FILE_SCHEME = "file://";
    private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

    @Override
    public String getId() {
        return "local";
    }

    @Override
    public Optional<RepoIdentity> match(String reference, HostClassifier hosts) {
        String path;
        if (reference.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length())) {
            path = reference.substring(FILE_SCHEME.length());
        } else if (reference.startsWith("/") || WINDOWS_ABSOLUTE.matcher(reference).matches()) {
            path = reference;
        } else {
            return Optional.empty();
        }

        String normalized = path.replace('\\', '/');
        while (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int lastSlash = normalized.lastIndexOf('/');
        String repo = lastSlash < 0 ? normalized : normalized.substring(lastSlash + 1);
        String owner = lastSlash <= 0 ? "" : stripLeadingSlashes(normalized.substring(0, lastSlash));
        if (repo.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RepoIdentity(
            Platform.LOCAL, LOCAL_HOST, owner, repo, RepoIdentity.DEFAULT_BRANCH, false, true));
    }

    private static String stripLeadingSlashes(String value) {
        int i = 0;
        while (i < value.length() && value.charAt(i) == '/') {
            i++;
        }
        return value.substring(i);
    }
}
