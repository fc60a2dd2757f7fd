package io.chaosgrade.api.scorecard;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.metrics.Metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete, immutable result of analyzing one log file.
 * <p>
 * Built once per run. Every report is rendered from the same instance so the
 * JSON and Markdown outputs always agree.
 *
 * @param summary         human-readable lines keyed by metric name, in display order
 * @param recommendations rule-based advice derived from the metrics
 * @param toolCalls       the most recent tool calls
 * @param events          the most recent events of any kind
 */
public record Scorecard(
        ScorecardMetadata metadata,
        Metrics metrics,
        Grade grade,
        Map<String, String> summary,
        List<String> recommendations,
        List<Event.ToolCall> toolCalls,
        List<Event> events
) {

    public Scorecard {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(grade, "grade");
        summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        recommendations = List.copyOf(recommendations);
        toolCalls = List.copyOf(toolCalls);
        events = List.copyOf(events);
    }

    /**
     * @return true if a log file was actually analyzed
     */
    @JsonIgnore
    public boolean isAvailable() {
        return grade != Grade.NOT_AVAILABLE;
    }
}
