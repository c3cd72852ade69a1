package com.scandrift.core.model;

import java.util.Objects;

/**
 * Outcome of checking one declared file against the host repository.
 *
 * @param path resolved repository-relative path that was checked
 * @param root root directory the declared path was joined with
 * @param exists whether the file exists on the default branch
 */
public record FileCheck(String path, String root, boolean exists) {

    /**
     * Compact constructor with validation.
     */
    public FileCheck {
        Objects.requireNonNull(path, "path must not be null");
        if (root == null) {
            root = "";
        }
    }
}
