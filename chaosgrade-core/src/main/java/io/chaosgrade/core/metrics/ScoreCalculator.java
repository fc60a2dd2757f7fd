package io.chaosgrade.core.metrics;

import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.metrics.Rates;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives rates and the weighted resilience score from raw counters.
 * <p>
 * The score weighs tool-call success and system recovery at 40% each and agent
 * completion at 20%. Success and recovery are capped at 100 inside the score
 * only; the reported rates stay uncapped.
 */
public class ScoreCalculator {

    static final double SUCCESS_WEIGHT = 0.4;
    static final double RECOVERY_WEIGHT = 0.4;
    static final double COMPLETION_WEIGHT = 0.2;

    public Metrics calculate(MetricCounts counts) {
        double successRate = percentage(counts.successfulToolCalls(), counts.totalToolCalls());
        double fuzzingRate = percentage(counts.fuzzingSuccessful(), counts.fuzzingAttempts());
        double retryRate = percentage(counts.successfulRetries(), counts.retryAttempts());

        // Nothing failed, so there was nothing to recover from.
        double recoveryRate = counts.failedToolCalls() == 0
                ? 100.0
                : percentage(counts.successfulRetries() + counts.agentSuccessfulCompletion(), counts.failedToolCalls());

        double score = SUCCESS_WEIGHT * Math.min(successRate, 100.0)
                + RECOVERY_WEIGHT * Math.min(recoveryRate, 100.0)
                + COMPLETION_WEIGHT * completionRate(counts);

        return new Metrics(counts, new Rates(successRate, fuzzingRate, recoveryRate, retryRate, round2(score)));
    }

    static double completionRate(MetricCounts counts) {
        if (counts.agentCrashes() == 0) {
            return 100.0;
        }
        return percentage(counts.agentSuccessfulCompletion(),
                counts.agentSuccessfulCompletion() + counts.agentCrashes());
    }

    static double percentage(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole * 100.0;
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
