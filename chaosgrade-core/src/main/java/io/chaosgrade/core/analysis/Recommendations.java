package io.chaosgrade.core.analysis;

import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.metrics.Rates;
import io.chaosgrade.api.scorecard.Grade;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based advice derived from a scored run. Rules fire independently and
 * appear in a fixed order.
 */
public final class Recommendations {

    public static final String LOW_RESILIENCE =
            "**Critical**: System resilience is low. Implement error handling and retry logic.";
    public static final String TOOL_ERROR_HANDLING =
            "Improve tool call error handling. Many tool calls are failing.";
    public static final String RETRY_LOGIC =
            "Implement retry logic. System is not recovering from failures effectively.";
    public static final String EXCEPTION_HANDLING =
            "Add exception handling. Agent is crashing on errors.";
    public static final String FUZZING_CONFIGURATION =
            "Fuzzing is not being applied effectively. Check proxy configuration.";
    public static final String MISSING_RETRIES =
            "No retry attempts detected. Consider implementing retry mechanisms.";
    public static final String RACE_SEQUENTIAL_EXECUTION =
            "**CRITICAL**: Race condition detected! Agent is calling dependent tools before dependencies complete. "
                    + "Implement sequential tool execution or dependency validation before calling dependent tools.";
    public static final String RACE_DEPENDENCY_VALIDATION =
            "**Solution**: Ensure tools that depend on other tools' results wait for those results. "
                    + "For example, `book_ticket` should only be called after `search_flights` returns a valid `flight_id`.";
    public static final String GOOD_RESILIENCE =
            "System shows good resilience. Continue monitoring and testing.";
    public static final String SUPPLY_LOG_FILE =
            "No log data was analyzed. Run a chaos session and point the analyzer at its proxy log.";

    static final double SUCCESS_RATE_THRESHOLD = 70.0;
    static final double RECOVERY_RATE_THRESHOLD = 50.0;
    static final double FUZZING_RATE_THRESHOLD = 50.0;

    private Recommendations() {
    }

    public static List<String> of(Metrics metrics, Grade grade) {
        if (grade == Grade.NOT_AVAILABLE) {
            return List.of(SUPPLY_LOG_FILE);
        }

        MetricCounts counts = metrics.counts();
        Rates rates = metrics.rates();
        List<String> recommendations = new ArrayList<>();

        if (grade.isFailing()) {
            recommendations.add(LOW_RESILIENCE);
        }
        if (rates.toolCallSuccessRate() < SUCCESS_RATE_THRESHOLD) {
            recommendations.add(TOOL_ERROR_HANDLING);
        }
        if (rates.systemRecoveryRate() < RECOVERY_RATE_THRESHOLD) {
            recommendations.add(RETRY_LOGIC);
        }
        if (counts.agentCrashes() > 0) {
            recommendations.add(EXCEPTION_HANDLING);
        }
        if (counts.fuzzingAttempts() > 0 && rates.fuzzingSuccessRate() < FUZZING_RATE_THRESHOLD) {
            recommendations.add(FUZZING_CONFIGURATION);
        }
        if (counts.retryAttempts() == 0 && counts.failedToolCalls() > 0) {
            recommendations.add(MISSING_RETRIES);
        }
        if (counts.raceConditionsDetected() > 0) {
            recommendations.add(RACE_SEQUENTIAL_EXECUTION);
            recommendations.add(RACE_DEPENDENCY_VALIDATION);
        }

        if (recommendations.isEmpty()) {
            recommendations.add(GOOD_RESILIENCE);
        }
        return recommendations;
    }
}
