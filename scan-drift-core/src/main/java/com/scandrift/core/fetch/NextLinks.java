package com.scandrift.core.fetch;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns pagination links into absolute URLs.
 */
final class NextLinks {

    private NextLinks() {
    }

    /**
     * Resolves a next link that may be absolute, host-relative or path-relative.
     *
     * <p>Host-relative links are taken relative to the API base when one is given and the link does not
     * already carry the base path, so {@code /orgs?x} under {@code https://api.example.com/rest} becomes
     * {@code https://api.example.com/rest/orgs?x}.
     *
     * @param linkBase API base URL, may be null
     * @param currentUrl URL of the page that returned the link
     * @param link raw link
     * @return absolute URL
     * @throws IllegalArgumentException if the link is not a valid URI reference
     */
    static String resolve(String linkBase, String currentUrl, String link) {
        String trimmed = link.trim();
        URI linkUri = URI.create(trimmed);
        if (linkUri.isAbsolute()) {
            return trimmed;
        }
        if (trimmed.startsWith("/") && !trimmed.startsWith("//") && linkBase != null) {
            URI base = URI.create(linkBase);
            String basePath = stripTrailingSlash(base.getRawPath() == null ? "" : base.getRawPath());
            if (!basePath.isEmpty() && !trimmed.equals(basePath) && !trimmed.startsWith(basePath + "/")
                    && !trimmed.startsWith(basePath + "?")) {
                return base.resolve(basePath + trimmed).toString();
            }
            return base.resolve(trimmed).toString();
        }
        return URI.create(currentUrl).resolve(linkUri).toString();
    }

    /**
     * Returns the entries of {@code baseParams} whose names do not already appear in the URL's query.
     */
    static Map<String, String> missingParams(String url, Map<String, String> baseParams) {
        Set<String> present = queryNames(url);
        Map<String, String> missing = new LinkedHashMap<>();
        baseParams.forEach((name, value) -> {
            if (!present.contains(name)) {
                missing.put(name, value);
            }
        });
        return missing;
    }

    private static Set<String> queryNames(String url) {
        Set<String> names = new LinkedHashSet<>();
        String query = URI.create(url).getRawQuery();
        if (query == null || query.isEmpty()) {
            return names;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (!name.isEmpty()) {
                names.add(URLDecoder.decode(name, StandardCharsets.UTF_8));
            }
        }
        return names;
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
