package com.scandrift.core.identity;

import java.util.Objects;

/**
 * Normalizes repository web URLs so that two URLs for the same repository compare equal.
 *
 * <p>The scheme is forced to {@code https}, the host lower-cased, user info, query and fragment
 * dropped, a {@code .git} suffix and trailing slashes removed. Path case is preserved.
 *
 * <pre>{@code
 * UrlNormalizer.normalize("http://GitLab.com/g/sub/repo.git/");  // https://gitlab.com/g/sub/repo
 * }</pre>
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
        // Utility class
    }

    /**
     * Normalizes a web URL.
     *
     * @param url URL to normalize, may be null
     * @return normalized URL, the trimmed input if it is not an HTTP(S) URL, or an empty string for null
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return HttpUrlParts.parse(trimmed)
            .map(parts -> "https://" + parts.host()
                + (parts.segments().isEmpty() ? "" : "/" + String.join("/", parts.segments())))
            .orElse(trimmed);
    }

    /**
     * Checks whether two web URLs denote the same repository.
     *
     * @param first first URL
     * @param second second URL
     * @return true if both are non-blank and normalize to the same string
     */
    public static boolean sameRepository(String first, String second) {
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            return false;
        }
        return Objects.equals(normalize(first), normalize(second));
    }
}
