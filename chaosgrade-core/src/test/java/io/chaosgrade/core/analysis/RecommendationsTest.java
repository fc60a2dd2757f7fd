package io.chaosgrade.core.analysis;

import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.metrics.Tally;
import io.chaosgrade.api.scorecard.Grade;
import io.chaosgrade.core.metrics.ScoreCalculator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationsTest {

    private final ScoreCalculator calculator = new ScoreCalculator();

    @Test
    void shouldAffirmHealthyRun() {
        Metrics metrics = calculator.calculate(counts(10, 10, 0, 0, 0, 1, 0, 0, 0, List.of()));

        assertThat(Recommendations.of(metrics, Grade.A)).containsExactly(Recommendations.GOOD_RESILIENCE);
    }

    @Test
    void shouldListEveryTriggeredRuleInOrder() {
        LogicError race = LogicError.raceCondition("race", "search_flights", "book_ticket",
                "2025-01-15T10:00:00Z", 404, false, true);
        // success 2/10, recovery 0/8, one crash, fuzzing 1/4, no retries, one race
        Metrics metrics = calculator.calculate(counts(10, 2, 8, 0, 0, 0, 1, 4, 1, List.of(race)));

        assertThat(Recommendations.of(metrics, Grade.F)).containsExactly(
                Recommendations.LOW_RESILIENCE,
                Recommendations.TOOL_ERROR_HANDLING,
                Recommendations.RETRY_LOGIC,
                Recommendations.EXCEPTION_HANDLING,
                Recommendations.FUZZING_CONFIGURATION,
                Recommendations.MISSING_RETRIES,
                Recommendations.RACE_SEQUENTIAL_EXECUTION,
                Recommendations.RACE_DEPENDENCY_VALIDATION);
    }

    @Test
    void shouldNotBlameFuzzingWhenNoneWasAttempted() {
        Metrics metrics = calculator.calculate(counts(10, 10, 0, 0, 0, 1, 0, 0, 0, List.of()));

        assertThat(Recommendations.of(metrics, Grade.A)).doesNotContain(Recommendations.FUZZING_CONFIGURATION);
    }

    @Test
    void shouldNotAskForRetriesWhenRetriesHappened() {
        Metrics metrics = calculator.calculate(counts(10, 6, 4, 3, 3, 1, 0, 0, 0, List.of()));

        assertThat(Recommendations.of(metrics, Grade.fromScore(metrics.resilienceScore())))
                .doesNotContain(Recommendations.MISSING_RETRIES)
                .contains(Recommendations.TOOL_ERROR_HANDLING);
    }

    @Test
    void shouldOnlyAskForLogWhenNothingWasAnalyzed() {
        assertThat(Recommendations.of(Metrics.empty(), Grade.NOT_AVAILABLE))
                .containsExactly(Recommendations.SUPPLY_LOG_FILE);
    }

    private static MetricCounts counts(long total, long successful, long failed, long retries, long successfulRetries,
                                       long completions, long crashes, long fuzzing, long fuzzingSuccessful,
                                       List<LogicError> logicErrors) {
        return new MetricCounts(total, successful, failed, fuzzing, fuzzingSuccessful, retries, successfulRetries,
                crashes, completions, logicErrors.size(), 0, 0, 0, 0,
                Tally.empty(), Tally.empty(), Tally.empty(), logicErrors);
    }
}
