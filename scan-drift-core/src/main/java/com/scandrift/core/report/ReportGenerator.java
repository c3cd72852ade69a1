package com.scandrift.core.report;

import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.renderer.GeneratedFile;

/**
 * Turns a {@link ReconciliationResult} into one report file.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Register them in
 * {@code META-INF/services/com.scandrift.core.report.ReportGenerator}. The generated file is
 * handed to an {@link com.scandrift.core.renderer.OutputRenderer} for output.
 */
public interface ReportGenerator {

    /** Base file name shared by all report formats. */
    String REPORT_BASE_NAME = "scan-drift-report";

    /**
     * Returns unique identifier for this generator, used by {@code --format}.
     *
     * @return lowercase identifier (e.g. "text", "csv", "json")
     */
    String getId();

    /**
     * Returns human-readable name for CLI listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the MIME type of generated content.
     *
     * @return content type
     */
    String getContentType();

    /**
     * Generates the report.
     *
     * @param result reconciliation outcome
     * @param settings limits and header timestamp
     * @return generated report file named {@code scan-drift-report.<extension>}
     */
    GeneratedFile generate(ReconciliationResult result, ReportSettings settings);

    /**
     * Returns the relative path of this generator's report.
     *
     * @return file name
     */
    default String fileName() {
        return REPORT_BASE_NAME + "." + getFileExtension();
    }
}
