package io.chaosgrade.core.metrics;

import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.metrics.Tally;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreCalculatorTest {

    private final ScoreCalculator calculator = new ScoreCalculator();

    @Test
    void shouldTreatRecoveryAsCompleteWithoutFailures() {
        Metrics metrics = calculator.calculate(counts(10, 10, 0, 0, 0, 0, 0));

        assertThat(metrics.rates().systemRecoveryRate()).isEqualTo(100.0);
        assertThat(metrics.resilienceScore()).isEqualTo(100.0);
    }

    @Test
    void shouldScoreZeroDenominatorsAsZeroExceptRecovery() {
        Metrics metrics = calculator.calculate(MetricCounts.zero());

        assertThat(metrics.rates().toolCallSuccessRate()).isZero();
        assertThat(metrics.rates().fuzzingSuccessRate()).isZero();
        assertThat(metrics.rates().retrySuccessRate()).isZero();
        assertThat(metrics.rates().systemRecoveryRate()).isEqualTo(100.0);
        // 0.4 * 0 + 0.4 * 100 + 0.2 * 100
        assertThat(metrics.resilienceScore()).isEqualTo(60.0);
    }

    @Test
    void shouldWeighSuccessRecoveryAndCompletion() {
        // success 8/10 = 80, recovery (1 + 1) / 4 = 50, completion 1 / (1 + 1) = 50
        Metrics metrics = calculator.calculate(counts(10, 8, 4, 2, 1, 1, 1));

        assertThat(metrics.rates().toolCallSuccessRate()).isEqualTo(80.0);
        assertThat(metrics.rates().systemRecoveryRate()).isEqualTo(50.0);
        assertThat(metrics.rates().retrySuccessRate()).isEqualTo(50.0);
        assertThat(metrics.resilienceScore()).isEqualTo(62.0);
    }

    @Test
    void shouldCapRatesInsideScoreOnly() {
        // 12 successes on 10 calls, 5 recoveries for 1 failure
        Metrics metrics = calculator.calculate(counts(10, 12, 1, 4, 4, 1, 0));

        assertThat(metrics.rates().toolCallSuccessRate()).isEqualTo(120.0);
        assertThat(metrics.rates().systemRecoveryRate()).isEqualTo(500.0);
        assertThat(metrics.resilienceScore()).isEqualTo(100.0);
    }

    @Test
    void shouldRoundScoreToTwoDecimals() {
        // success 2/3 = 66.666..., score = 26.666... + 40 + 20
        Metrics metrics = calculator.calculate(counts(3, 2, 0, 0, 0, 0, 0));

        assertThat(metrics.rates().toolCallSuccessRate()).isCloseTo(66.6667, within(0.001));
        assertThat(metrics.resilienceScore()).isEqualTo(86.67);
    }

    @Test
    void shouldComputeFuzzingRate() {
        MetricCounts counts = new MetricCounts(0, 0, 0, 4, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                Tally.empty(), Tally.empty(), Tally.empty(), List.of());

        assertThat(calculator.calculate(counts).rates().fuzzingSuccessRate()).isEqualTo(25.0);
    }

    @Test
    void shouldKeepCountsUnchanged() {
        MetricCounts counts = counts(10, 8, 4, 2, 1, 1, 1);

        assertThat(calculator.calculate(counts).counts()).isSameAs(counts);
    }

    private static MetricCounts counts(long total, long successful, long failed, long retries,
                                       long successfulRetries, long completions, long crashes) {
        return new MetricCounts(total, successful, failed, 0, 0, retries, successfulRetries,
                crashes, completions, 0, 0, 0, 0, 0,
                Tally.empty(), Tally.empty(), Tally.empty(), List.of());
    }
}
