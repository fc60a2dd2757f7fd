package io.chaosgrade.api.metrics;

/**
 * Percentages derived from {@link MetricCounts}, plus the weighted resilience score.
 * Rates are not capped; the score is rounded to two decimals.
 */
public record Rates(
        double toolCallSuccessRate,
        double fuzzingSuccessRate,
        double systemRecoveryRate,
        double retrySuccessRate,
        double resilienceScore
) {

    public static Rates zero() {
        return new Rates(0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
