package com.scandrift.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Reports produced by one reconciliation run, in generation order.
 *
 * @param files generated report files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns the reports with the given MIME type, such as {@code text/plain} for the console.
     *
     * @param contentType MIME type to keep
     * @return matching reports, possibly none
     */
    public GeneratedOutput ofContentType(String contentType) {
        return new GeneratedOutput(files.stream()
            .filter(file -> contentType.equals(file.contentType()))
            .toList());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
