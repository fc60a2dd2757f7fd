package io.chaosgrade.api.scorecard;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Run metadata. This is the only part of a scorecard that depends on the wall clock.
 *
 * @param logFile   the analyzed file, or null if none was found
 * @param linesRead number of raw lines read from the file
 * @param warning   set when no log data could be analyzed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScorecardMetadata(
        Instant generatedAt,
        String analyzerVersion,
        String logFile,
        int linesRead,
        String warning
) {

    public static final String ANALYZER_VERSION = "1.0.0";

    public static ScorecardMetadata analyzed(Instant generatedAt, String logFile, int linesRead) {
        return new ScorecardMetadata(generatedAt, ANALYZER_VERSION, logFile, linesRead, null);
    }

    public static ScorecardMetadata unavailable(Instant generatedAt, String logFile, String warning) {
        return new ScorecardMetadata(generatedAt, ANALYZER_VERSION, logFile, 0, warning);
    }
}
