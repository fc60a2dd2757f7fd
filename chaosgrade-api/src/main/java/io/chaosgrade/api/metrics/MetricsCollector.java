package io.chaosgrade.api.metrics;

/**
 * Accumulates the counters of one analysis run.
 * <p>
 * An instance is created per run and passed explicitly to every extraction and
 * correlation step. The default implementation stores counters in Micrometer.
 */
public interface MetricsCollector {

    /**
     * Record an outgoing tool call.
     */
    void recordToolCall();

    /**
     * Record a successful (HTTP 200) response.
     */
    void recordSuccess();

    /**
     * Record a failed tool call (error line or HTTP status of 400 and above).
     */
    void recordFailure();

    /**
     * Count one tool-call error of the given kind, e.g. {@code not_found}.
     */
    void recordToolError(String errorType);

    /**
     * Record a fuzzing attempt of the given kind.
     *
     * @param fuzzType   the fuzzing kind, e.g. {@code schema_violation}
     * @param successful whether the injection actually altered the payload
     */
    void recordFuzzing(String fuzzType, boolean successful);

    void recordRetry();

    /**
     * Record a retry that was followed by a successful response.
     */
    void recordSuccessfulRetry();

    void recordCompletion();

    void recordCrash();

    /**
     * Record agent-to-agent (swarm) traffic touched by the interception layer.
     */
    void recordAgentToAgentDisruption();

    /**
     * Count one swarm communication error under the given key, e.g. {@code swarm_error_503}.
     */
    void recordSwarmError(String key);

    void recordMessageMutation();

    void recordConsensusDelay();

    void recordAgentIsolation();

    /**
     * Record a detected race condition.
     */
    void recordLogicError(LogicError error);

    /**
     * @return an immutable view of all counters recorded so far
     */
    MetricCounts snapshot();
}
