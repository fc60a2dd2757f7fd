package io.chaosgrade.api.analysis;

import io.chaosgrade.api.scorecard.Scorecard;

/**
 * Analyzes one chaos-testing log and produces its scorecard.
 * <p>
 * Analysis never throws for a missing or unreadable log: the result is then an
 * empty scorecard graded {@code N/A} with a warning in its metadata.
 */
public interface Analyzer {

    /**
     * Run the full pipeline: locate, parse, correlate, aggregate, score.
     *
     * @return a fresh, immutable scorecard
     */
    Scorecard analyze();

    /**
     * @return the analyzer configuration
     */
    AnalyzerConfig config();
}
