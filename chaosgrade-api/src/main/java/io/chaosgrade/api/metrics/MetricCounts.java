package io.chaosgrade.api.metrics;

import java.util.List;

/**
 * Raw counters accumulated over one analysis run, before any rate is derived.
 */
public record MetricCounts(
        long totalToolCalls,
        long successfulToolCalls,
        long failedToolCalls,
        long fuzzingAttempts,
        long fuzzingSuccessful,
        long retryAttempts,
        long successfulRetries,
        long agentCrashes,
        long agentSuccessfulCompletion,
        long raceConditionsDetected,
        long agentToAgentDisruptions,
        long messageMutations,
        long consensusDelays,
        long agentIsolations,
        Tally toolCallErrors,
        Tally fuzzingTypes,
        Tally swarmCommunicationErrors,
        List<LogicError> logicErrors
) {

    public MetricCounts {
        toolCallErrors = toolCallErrors == null ? Tally.empty() : toolCallErrors;
        fuzzingTypes = fuzzingTypes == null ? Tally.empty() : fuzzingTypes;
        swarmCommunicationErrors = swarmCommunicationErrors == null ? Tally.empty() : swarmCommunicationErrors;
        logicErrors = logicErrors == null ? List.of() : List.copyOf(logicErrors);
    }

    /**
     * @return all counters at zero, no tallies, no logic errors
     */
    public static MetricCounts zero() {
        return new MetricCounts(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
                Tally.empty(), Tally.empty(), Tally.empty(), List.of());
    }
}
