package io.chaosgrade.core.metrics;

import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricCounts;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerMetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MicrometerMetricsCollector(registry);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // --- Construction ---

    @Test
    void shouldCreateWithDefaultRegistry() {
        assertThat(new MicrometerMetricsCollector().registry()).isNotNull();
    }

    @Test
    void shouldExposeProvidedRegistry() {
        assertThat(collector.registry()).isSameAs(registry);
    }

    @Test
    void shouldRegisterPlainCountersEagerly() {
        Counter toolCalls = registry.find(MicrometerMetricsCollector.TOOL_CALLS).counter();

        assertThat(toolCalls).isNotNull();
        assertThat(toolCalls.count()).isZero();
        assertThat(collector.snapshot()).isEqualTo(MetricCounts.zero());
    }

    // --- Counters ---

    @Test
    void shouldCountToolCallOutcomes() {
        collector.recordToolCall();
        collector.recordToolCall();
        collector.recordSuccess();
        collector.recordFailure();

        assertThat(registry.find(MicrometerMetricsCollector.TOOL_CALLS).counter().count()).isEqualTo(2.0);
        MetricCounts counts = collector.snapshot();
        assertThat(counts.totalToolCalls()).isEqualTo(2);
        assertThat(counts.successfulToolCalls()).isEqualTo(1);
        assertThat(counts.failedToolCalls()).isEqualTo(1);
    }

    @Test
    void shouldCountRetriesAndOutcomes() {
        collector.recordRetry();
        collector.recordRetry();
        collector.recordSuccessfulRetry();
        collector.recordCompletion();
        collector.recordCrash();

        MetricCounts counts = collector.snapshot();
        assertThat(counts.retryAttempts()).isEqualTo(2);
        assertThat(counts.successfulRetries()).isEqualTo(1);
        assertThat(counts.agentSuccessfulCompletion()).isEqualTo(1);
        assertThat(counts.agentCrashes()).isEqualTo(1);
    }

    // --- Tallies ---

    @Test
    void shouldTagToolErrorsByKind() {
        collector.recordToolError("not_found");
        collector.recordToolError("timeout");
        collector.recordToolError("not_found");

        Counter notFound = registry.find(MicrometerMetricsCollector.TOOL_ERRORS)
                .tag(MicrometerMetricsCollector.KIND_TAG, "not_found")
                .counter();
        assertThat(notFound.count()).isEqualTo(2.0);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.toolCallErrors().keys()).containsExactly("not_found", "timeout");
        assertThat(counts.toolCallErrors().count("server_error")).isZero();
    }

    @Test
    void shouldTallyFuzzingTypesAndSuccesses() {
        collector.recordFuzzing("schema_violation", true);
        collector.recordFuzzing("schema_violation", false);
        collector.recordFuzzing("null_injection", true);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.fuzzingAttempts()).isEqualTo(3);
        assertThat(counts.fuzzingSuccessful()).isEqualTo(2);
        assertThat(counts.fuzzingTypes().count("schema_violation")).isEqualTo(2);
        assertThat(counts.fuzzingTypes().count("null_injection")).isEqualTo(1);
    }

    @Test
    void shouldTrackSwarmCounters() {
        collector.recordAgentToAgentDisruption();
        collector.recordSwarmError("swarm_error_503");
        collector.recordMessageMutation();
        collector.recordConsensusDelay();
        collector.recordAgentIsolation();

        MetricCounts counts = collector.snapshot();
        assertThat(counts.agentToAgentDisruptions()).isEqualTo(1);
        assertThat(counts.swarmCommunicationErrors().count("swarm_error_503")).isEqualTo(1);
        assertThat(counts.messageMutations()).isEqualTo(1);
        assertThat(counts.consensusDelays()).isEqualTo(1);
        assertThat(counts.agentIsolations()).isEqualTo(1);
    }

    @Test
    void shouldRecordLogicErrorsInOrder() {
        LogicError first = LogicError.raceCondition("first", "search_flights", "book_ticket",
                "2025-01-15T10:00:00Z", 404, false, true);
        LogicError second = LogicError.raceCondition("second", "search_flights", "book_ticket",
                "2025-01-15T10:00:05Z", 400, true, true);

        collector.recordLogicError(first);
        collector.recordLogicError(second);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.raceConditionsDetected()).isEqualTo(2);
        assertThat(counts.logicErrors()).containsExactly(first, second);
        assertThat(registry.find(MicrometerMetricsCollector.RACE_CONDITIONS).counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldTakeIndependentSnapshots() {
        collector.recordToolCall();
        MetricCounts before = collector.snapshot();

        collector.recordToolCall();

        assertThat(before.totalToolCalls()).isEqualTo(1);
        assertThat(collector.snapshot().totalToolCalls()).isEqualTo(2);
    }
}
