package com.scandrift.core.identity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposition of an {@code http(s)} repository URL into a lower-cased host and path segments.
 *
 * <p>User info, query and fragment are dropped, the scheme is ignored (both schemes resolve the same),
 * empty segments from doubled or trailing slashes disappear and a {@code .git} suffix on the last
 * segment is removed.
 *
 * @param host lower-cased host, including port if present
 * @param segments non-empty path segments
 */
public record HttpUrlParts(String host, List<String> segments) {

    private static final Pattern HTTP_URL = Pattern.compile(
        "^(?i:https?)://(?:[^@/?#]+@)?([^/?#]+)(/[^?#]*)?(?:[?#].*)?$"
    );

    public static final String GIT_SUFFIX = ".git";

    public HttpUrlParts {
        segments = List.copyOf(segments);
    }

    /**
     * Parses an HTTP(S) URL.
     *
     * @param reference candidate URL
     * @return parts, or empty if the reference is not an HTTP(S) URL
     */
    public static Optional<HttpUrlParts> parse(String reference) {
        Matcher matcher = HTTP_URL.matcher(reference);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String host = matcher.group(1).toLowerCase(Locale.ROOT);
        String path = matcher.group(2) == null ? "" : matcher.group(2);
        List<String> segments = new ArrayList<>(Arrays.stream(path.split("/"))
            .filter(s -> !s.isEmpty())
            .toList());
        if (!segments.isEmpty()) {
            int last = segments.size() - 1;
            segments.set(last, stripGitSuffix(segments.get(last)));
            if (segments.get(last).isEmpty()) {
                segments.remove(last);
            }
        }
        return Optional.of(new HttpUrlParts(host, segments));
    }

    public static String stripGitSuffix(String segment) {
        if (segment.toLowerCase(Locale.ROOT).endsWith(GIT_SUFFIX)) {
            return segment.substring(0, segment.length() - GIT_SUFFIX.length());
        }
        return segment;
    }

    /**
     * Returns the host without a leading {@code www.}.
     *
     * @return bare host
     */
    public String bareHost() {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
