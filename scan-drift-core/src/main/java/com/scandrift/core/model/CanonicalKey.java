package com.scandrift.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Join key shared by both inventories: {@code host/full_path}.
 *
 * <p>The host is lower-cased and stripped of any scheme; the path keeps its case and loses leading
 * and trailing slashes. Keys order lexicographically on their string value.
 *
 * @param value normalized key string
 */
public record CanonicalKey(String value) implements Comparable<CanonicalKey> {

    /**
     * Reserved key that routes targets into the unresolvable bucket of a target catalog.
     */
    public static final CanonicalKey UNRESOLVABLE = new CanonicalKey("__UNRESOLVABLE__");

    /**
     * Compact constructor with validation.
     */
    public CanonicalKey {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    /**
     * Builds a key from a host and a repository full path.
     *
     * @param host host name, optionally with {@code http://} or {@code https://} prefix
     * @param fullPath {@code owner[/subgroup...]/repo}
     * @return canonical key
     */
    public static CanonicalKey of(String host, String fullPath) {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(fullPath, "fullPath must not be null");
        String normalizedHost = trimSlashes(stripScheme(host.trim())).toLowerCase(Locale.ROOT);
        return new CanonicalKey(normalizedHost + "/" + trimSlashes(fullPath.trim()));
    }

    /**
     * Returns true for the unresolvable sentinel.
     *
     * @return whether this is {@link #UNRESOLVABLE}
     */
    public boolean isUnresolvable() {
        return UNRESOLVABLE.equals(this);
    }

    /**
     * Host part of the key, empty for the sentinel.
     */
    public String host() {
        int slash = value.indexOf('/');
        return isUnresolvable() || slash < 0 ? "" : value.substring(0, slash);
    }

    /**
     * Repository full path part of the key, empty for the sentinel.
     */
    public String fullPath() {
        int slash = value.indexOf('/');
        return isUnresolvable() || slash < 0 ? "" : value.substring(slash + 1);
    }

    @Override
    public int compareTo(CanonicalKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

    static String stripScheme(String host) {
        int idx = host.indexOf("://");
        return idx >= 0 ? host.substring(idx + 3) : host;
    }

    static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }
}
