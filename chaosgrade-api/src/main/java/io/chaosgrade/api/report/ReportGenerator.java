package io.chaosgrade.api.report;

import io.chaosgrade.api.scorecard.Scorecard;

import java.nio.file.Path;

/**
 * Renders a scorecard to a report file.
 * Implementations can produce JSON, Markdown, or any other format.
 */
public interface ReportGenerator {

    /**
     * Generate a report file from the scorecard.
     *
     * @param scorecard  the analyzed scorecard
     * @param outputPath path where the report file should be written
     * @return the path to the generated report
     */
    Path generate(Scorecard scorecard, Path outputPath);

    /**
     * @return the format name (e.g., "JSON", "Markdown")
     */
    String format();

    /**
     * @return the file name used when the caller only names a directory
     */
    String defaultFileName();
}
