package com.scandrift.core.renderer;

import java.util.Objects;

/**
 * A generated report file.
 *
 * @param relativePath relative path for the file (e.g., "scan-drift-report.csv")
 * @param content file content
 * @param contentType MIME type
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
