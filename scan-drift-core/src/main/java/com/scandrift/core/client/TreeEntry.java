package com.scandrift.core.client;

import java.util.Objects;

/**
 * One node of a repository file tree.
 *
 * @param path repository-relative path
 * @param name basename
 * @param type {@code blob} for files, {@code tree} for directories
 */
public record TreeEntry(
    String path,
    String name,
    String type
) {
    public static final String BLOB = "blob";

    public TreeEntry {
        Objects.requireNonNull(path, "path must not be null");
        if (name == null || name.isBlank()) {
            int slash = path.lastIndexOf('/');
            name = slash < 0 ? path : path.substring(slash + 1);
        }
        if (type == null) {
            type = "";
        }
    }

    public boolean isBlob() {
        return BLOB.equals(type);
    }
}
