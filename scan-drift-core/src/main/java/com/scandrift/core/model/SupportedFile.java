package com.scandrift.core.model;

import java.util.Objects;

/**
 * A file found in a repository tree whose name matches the supported-file taxonomy.
 *
 * @param path repository-relative path
 * @param type taxonomy type
 * @param pattern the taxonomy pattern that matched (e.g. {@code pom.xml} or {@code *.csproj})
 */
public record SupportedFile(String path, FileType type, String pattern) {

    /**
     * Compact constructor with validation.
     */
    public SupportedFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
