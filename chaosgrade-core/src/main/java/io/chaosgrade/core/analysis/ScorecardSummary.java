package io.chaosgrade.core.analysis;

import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.scorecard.Grade;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the human-readable summary lines of a scorecard, in display order.
 */
public final class ScorecardSummary {

    public static final String NO_DATA_MESSAGE = "No log data available for analysis";

    static final int LOGIC_ERROR_PREVIEW = 3;

    private ScorecardSummary() {
    }

    public static Map<String, String> of(Metrics metrics, Grade grade) {
        MetricCounts counts = metrics.counts();
        Map<String, String> summary = new LinkedHashMap<>();

        summary.put("grade", grade.label());
        summary.put("resilience_score", format("%.1f/100", metrics.resilienceScore()));
        summary.put("tool_calls", format("Total: %d, Successful: %d, Failed: %d",
                counts.totalToolCalls(), counts.successfulToolCalls(), counts.failedToolCalls()));
        summary.put("fuzzing", format("Attempted: %d, Successful: %d",
                counts.fuzzingAttempts(), counts.fuzzingSuccessful()));
        summary.put("recovery", format("System recovered from %.1f%% of failures",
                metrics.rates().systemRecoveryRate()));
        summary.put("outcome", format("Completions: %d, Crashes: %d",
                counts.agentSuccessfulCompletion(), counts.agentCrashes()));

        if (counts.fuzzingAttempts() > 0) {
            long finished = counts.agentSuccessfulCompletion() + counts.agentCrashes();
            double survival = finished == 0 ? 0.0 : (double) counts.agentSuccessfulCompletion() / finished * 100.0;
            summary.put("protocol_attacks", format("System survived %.1f%% of protocol attacks", survival));
        } else {
            summary.put("protocol_attacks", "No protocol attacks detected");
        }

        if (counts.raceConditionsDetected() > 0) {
            summary.put("race_conditions", format(
                    "CRITICAL: %d race condition(s) detected - Agent called dependent tools before dependencies completed",
                    counts.raceConditionsDetected()));
            if (!counts.logicErrors().isEmpty()) {
                summary.put("logic_errors", counts.logicErrors().stream()
                        .limit(LOGIC_ERROR_PREVIEW)
                        .map(LogicError::description)
                        .collect(Collectors.joining("; ")));
            }
        } else {
            summary.put("race_conditions", "No race conditions detected");
        }

        return summary;
    }

    /**
     * Summary of a run that had no log data.
     */
    public static Map<String, String> empty() {
        Map<String, String> summary = new LinkedHashMap<>();
        summary.put("grade", Grade.NOT_AVAILABLE.label());
        summary.put("message", NO_DATA_MESSAGE);
        return summary;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
