package io.chaosgrade.core.parse;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.event.LogRecord;
import io.chaosgrade.api.metrics.MetricsCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts events from structured records written by the interception layer.
 * <p>
 * Besides tool calls, responses and fuzzing, this tracks agent-to-agent (swarm)
 * traffic, which only structured records can describe.
 */
public class StructuredEventExtractor {

    public List<Event> extract(LogRecord record, MetricsCollector collector) {
        List<Event> events = new ArrayList<>();
        String chaos = record.chaosAppliedText();

        Optional<String> toolName = resolveToolName(record);
        if (toolName.isPresent() && "POST".equals(record.method())) {
            collector.recordToolCall();
            events.add(new Event.ToolCall(record.line(), record.timestamp(), record.url(), toolName.get()));
        }

        if (record.statusCode() != null) {
            int statusCode = record.statusCode();
            if (statusCode == 200) {
                collector.recordSuccess();
            } else if (statusCode >= 400) {
                collector.recordFailure();
                collector.recordToolError(Classifier.errorTypeOfStatus(statusCode));
            }
            events.add(new Event.Response(record.line(), record.timestamp(), statusCode));
        }

        if (record.fuzzed() || chaos.contains("fuzzing") || chaos.contains("mcp")) {
            String fuzzType = Classifier.fuzzTypeOfChaos(chaos);
            collector.recordFuzzing(fuzzType, record.fuzzed());
            events.add(new Event.Fuzzing(record.line(), record.timestamp(), fuzzType, record.fuzzed() ? 1 : 0));
        }

        if (record.isAgentToAgent()) {
            recordSwarmTraffic(record, chaos, collector);
        }

        return events;
    }

    /**
     * The declared tool name, or one inferred from the endpoint path.
     */
    public static Optional<String> resolveToolName(LogRecord record) {
        if (record.toolName() != null && !record.toolName().isEmpty()) {
            return Optional.of(record.toolName());
        }
        return Classifier.toolNameOfEndpoint(record.url());
    }

    private void recordSwarmTraffic(LogRecord record, String chaos, MetricsCollector collector) {
        collector.recordAgentToAgentDisruption();

        if (record.trafficSubtype() != null && !record.trafficSubtype().isEmpty()) {
            collector.recordSwarmError("swarm_" + record.trafficSubtype());
        }

        if (chaos.contains("swarm_disruption") || chaos.contains("message_mutation")) {
            collector.recordMessageMutation();
        }
        if (chaos.contains("consensus_delay")) {
            collector.recordConsensusDelay();
        }
        if (chaos.contains("agent_isolation")) {
            collector.recordAgentIsolation();
        }

        if (record.statusCode() != null && record.statusCode() >= 400) {
            collector.recordSwarmError("swarm_error_" + record.statusCode());
        }
    }
}
