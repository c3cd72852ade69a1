package com.scandrift.core.model;

import java.util.Objects;

/**
 * A file declared by a scanning-tool project, after joining it with the project's root.
 *
 * @param path repository-relative path
 * @param type taxonomy type, {@link FileType#UNRECOGNIZED} when the name is outside the taxonomy
 */
public record TrackedFile(String path, FileType type) {

    /**
     * Compact constructor with validation.
     */
    public TrackedFile {
        Objects.requireNonNull(path, "path must not be null");
        if (type == null) {
            type = FileType.UNRECOGNIZED;
        }
    }
}
