package io.chaosgrade.core.metrics;

import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.MetricsCollector;
import io.chaosgrade.api.metrics.Tally;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default metrics collector using Micrometer.
 * <p>
 * Plain counters are registered eagerly so a run without any matching line still
 * reports zero. Open-keyed tallies are counters sharing one name and differing in
 * the {@code kind} tag; they are registered on first increment, which keeps the
 * snapshot in first-seen order. Not thread-safe: one instance serves one run.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

    public static final String TOOL_CALLS = "chaosgrade.tool.calls";
    public static final String TOOL_CALLS_SUCCESS = "chaosgrade.tool.calls.success";
    public static final String TOOL_CALLS_FAILURE = "chaosgrade.tool.calls.failure";
    public static final String TOOL_ERRORS = "chaosgrade.tool.errors";
    public static final String FUZZING_ATTEMPTS = "chaosgrade.fuzzing.attempts";
    public static final String FUZZING_SUCCESSFUL = "chaosgrade.fuzzing.successful";
    public static final String FUZZING_TYPES = "chaosgrade.fuzzing.types";
    public static final String RETRIES = "chaosgrade.retries";
    public static final String RETRIES_SUCCESSFUL = "chaosgrade.retries.successful";
    public static final String COMPLETIONS = "chaosgrade.agent.completions";
    public static final String CRASHES = "chaosgrade.agent.crashes";
    public static final String RACE_CONDITIONS = "chaosgrade.race.conditions";
    public static final String SWARM_DISRUPTIONS = "chaosgrade.swarm.disruptions";
    public static final String SWARM_ERRORS = "chaosgrade.swarm.errors";
    public static final String SWARM_MESSAGE_MUTATIONS = "chaosgrade.swarm.message.mutations";
    public static final String SWARM_CONSENSUS_DELAYS = "chaosgrade.swarm.consensus.delays";
    public static final String SWARM_AGENT_ISOLATIONS = "chaosgrade.swarm.agent.isolations";

    public static final String KIND_TAG = "kind";

    private final MeterRegistry registry;

    private final Counter toolCalls;
    private final Counter toolCallsSuccess;
    private final Counter toolCallsFailure;
    private final Counter fuzzingAttempts;
    private final Counter fuzzingSuccessful;
    private final Counter retries;
    private final Counter retriesSuccessful;
    private final Counter completions;
    private final Counter crashes;
    private final Counter raceConditions;
    private final Counter swarmDisruptions;
    private final Counter messageMutations;
    private final Counter consensusDelays;
    private final Counter agentIsolations;

    private final Map<String, Counter> toolErrors = new LinkedHashMap<>();
    private final Map<String, Counter> fuzzingTypes = new LinkedHashMap<>();
    private final Map<String, Counter> swarmErrors = new LinkedHashMap<>();
    private final List<LogicError> logicErrors = new ArrayList<>();

    public MicrometerMetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerMetricsCollector(MeterRegistry registry) {
        this.registry = registry;
        this.toolCalls = counter(TOOL_CALLS, "Outgoing tool calls");
        this.toolCallsSuccess = counter(TOOL_CALLS_SUCCESS, "Successful responses");
        this.toolCallsFailure = counter(TOOL_CALLS_FAILURE, "Failed tool calls");
        this.fuzzingAttempts = counter(FUZZING_ATTEMPTS, "Fuzzing attempts");
        this.fuzzingSuccessful = counter(FUZZING_SUCCESSFUL, "Fuzzing injections that altered the payload");
        this.retries = counter(RETRIES, "Retry attempts");
        this.retriesSuccessful = counter(RETRIES_SUCCESSFUL, "Retries followed by a successful response");
        this.completions = counter(COMPLETIONS, "Agent completions");
        this.crashes = counter(CRASHES, "Agent crashes");
        this.raceConditions = counter(RACE_CONDITIONS, "Detected race conditions");
        this.swarmDisruptions = counter(SWARM_DISRUPTIONS, "Agent-to-agent traffic touched by chaos");
        this.messageMutations = counter(SWARM_MESSAGE_MUTATIONS, "Mutated agent-to-agent messages");
        this.consensusDelays = counter(SWARM_CONSENSUS_DELAYS, "Delayed consensus rounds");
        this.agentIsolations = counter(SWARM_AGENT_ISOLATIONS, "Isolated agents");
    }

    @Override
    public void recordToolCall() {
        toolCalls.increment();
    }

    @Override
    public void recordSuccess() {
        toolCallsSuccess.increment();
    }

    @Override
    public void recordFailure() {
        toolCallsFailure.increment();
    }

    @Override
    public void recordToolError(String errorType) {
        tallyCounter(toolErrors, TOOL_ERRORS, errorType).increment();
    }

    @Override
    public void recordFuzzing(String fuzzType, boolean successful) {
        fuzzingAttempts.increment();
        if (successful) {
            fuzzingSuccessful.increment();
        }
        tallyCounter(fuzzingTypes, FUZZING_TYPES, fuzzType).increment();
    }

    @Override
    public void recordRetry() {
        retries.increment();
    }

    @Override
    public void recordSuccessfulRetry() {
        retriesSuccessful.increment();
    }

    @Override
    public void recordCompletion() {
        completions.increment();
    }

    @Override
    public void recordCrash() {
        crashes.increment();
    }

    @Override
    public void recordAgentToAgentDisruption() {
        swarmDisruptions.increment();
    }

    @Override
    public void recordSwarmError(String key) {
        tallyCounter(swarmErrors, SWARM_ERRORS, key).increment();
    }

    @Override
    public void recordMessageMutation() {
        messageMutations.increment();
    }

    @Override
    public void recordConsensusDelay() {
        consensusDelays.increment();
    }

    @Override
    public void recordAgentIsolation() {
        agentIsolations.increment();
    }

    @Override
    public void recordLogicError(LogicError error) {
        raceConditions.increment();
        logicErrors.add(error);
    }

    @Override
    public MetricCounts snapshot() {
        return new MetricCounts(
                count(toolCalls),
                count(toolCallsSuccess),
                count(toolCallsFailure),
                count(fuzzingAttempts),
                count(fuzzingSuccessful),
                count(retries),
                count(retriesSuccessful),
                count(crashes),
                count(completions),
                count(raceConditions),
                count(swarmDisruptions),
                count(messageMutations),
                count(consensusDelays),
                count(agentIsolations),
                tally(toolErrors),
                tally(fuzzingTypes),
                tally(swarmErrors),
                logicErrors
        );
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(registry);
    }

    private Counter tallyCounter(Map<String, Counter> counters, String name, String kind) {
        return counters.computeIfAbsent(kind, k ->
                Counter.builder(name)
                        .tag(KIND_TAG, k)
                        .register(registry));
    }

    private static long count(Counter counter) {
        return (long) counter.count();
    }

    private static Tally tally(Map<String, Counter> counters) {
        Map<String, Long> counts = new LinkedHashMap<>();
        counters.forEach((kind, counter) -> counts.put(kind, count(counter)));
        return Tally.of(counts);
    }
}
