package io.chaosgrade.api.metrics;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Objects;

/**
 * Counters and derived rates of one analysis run. Serialized as a single flat object.
 */
public record Metrics(
        @JsonUnwrapped MetricCounts counts,
        @JsonUnwrapped Rates rates
) {

    public Metrics {
        Objects.requireNonNull(counts, "counts");
        Objects.requireNonNull(rates, "rates");
    }

    public static Metrics empty() {
        return new Metrics(MetricCounts.zero(), Rates.zero());
    }

    public double resilienceScore() {
        return rates.resilienceScore();
    }
}
