package com.scandrift.core.coverage;

import com.scandrift.core.model.FileType;

import java.util.Locale;
import java.util.Objects;

/**
 * A basename pattern: an exact file name, or {@code *suffix} to match by suffix. Matching ignores case.
 *
 * @param pattern exact name or {@code *suffix}
 * @param type file type the pattern identifies
 */
public record FilePattern(String pattern, FileType type) {

    public FilePattern {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (pattern.isBlank() || "*".equals(pattern)) {
            throw new IllegalArgumentException("Pattern must name a file or a suffix: '" + pattern + "'");
        }
    }

    public boolean isWildcard() {
        return pattern.startsWith("*");
    }

    /**
     * Tests a basename against this pattern.
     *
     * @param basename file name without directories
     * @return true on match
     */
    public boolean matches(String basename) {
        if (basename == null || basename.isEmpty()) {
            return false;
        }
        String name = basename.toLowerCase(Locale.ROOT);
        String wanted = pattern.toLowerCase(Locale.ROOT);
        return isWildcard() ? name.endsWith(wanted.substring(1)) : name.equals(wanted);
    }
}
