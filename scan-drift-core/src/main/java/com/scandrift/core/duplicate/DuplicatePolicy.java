package com.scandrift.core.duplicate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * How a project name is reduced to the sub-identifier used for duplicate grouping.
 *
 * <p>The sub-identifier is the text after the first occurrence of {@code separator}, trimmed. With
 * {@code normalizePaths}, {@code .} segments and empty segments are dropped and {@code ..} removes the preceding
 * segment (or is dropped when there is none), so {@code ./a}, {@code a} and {@code ../x/../a} all reduce to
 * {@code a}.
 *
 * @param separator delimiter between the target part and the sub-identifier
 * @param normalizePaths whether to collapse relative path segments
 */
public record DuplicatePolicy(String separator, boolean normalizePaths) {

    public static final String DEFAULT_SEPARATOR = ":";

    public DuplicatePolicy {
        Objects.requireNonNull(separator, "separator must not be null");
        if (separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
    }

    public static DuplicatePolicy defaults() {
        return new DuplicatePolicy(DEFAULT_SEPARATOR, true);
    }

    /**
     * Extracts the sub-identifier of a project name.
     *
     * @param projectName project name
     * @return sub-identifier, empty when the name has no separator or nothing follows it
     */
    public Optional<String> identifierOf(String projectName) {
        if (projectName == null) {
            return Optional.empty();
        }
        int index = projectName.indexOf(separator);
        if (index < 0) {
            return Optional.empty();
        }
        String identifier = projectName.substring(index + separator.length()).trim();
        if (normalizePaths) {
            identifier = normalizePath(identifier);
        }
        return identifier.isEmpty() ? Optional.empty() : Optional.of(identifier);
    }

    static String normalizePath(String path) {
        String unified = path.replace('\\', '/');
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
                continue;
            }
            segments.addLast(segment);
        }
        String joined = String.join("/", segments);
        return unified.startsWith("/") && !joined.isEmpty() ? "/" + joined : joined;
    }
}
