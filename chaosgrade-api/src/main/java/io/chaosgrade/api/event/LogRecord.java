package io.chaosgrade.api.event;

import java.util.List;
import java.util.Locale;

/**
 * A structured request/response record written by the interception layer.
 * <p>
 * {@code chaosApplied} is normalized at the boundary: a single string becomes a
 * one-element list, an absent value an empty list.
 */
public record LogRecord(
        int line,
        String timestamp,
        String method,
        String url,
        Integer statusCode,
        String toolName,
        List<String> chaosApplied,
        boolean fuzzed,
        String agentRole,
        String trafficType,
        String trafficSubtype
) {

    public static final String UNKNOWN_TRAFFIC = "UNKNOWN";
    public static final String AGENT_TO_AGENT = "AGENT_TO_AGENT";

    public LogRecord {
        method = method == null ? "" : method;
        url = url == null ? "" : url;
        chaosApplied = chaosApplied == null ? List.of() : List.copyOf(chaosApplied);
        trafficType = trafficType == null ? UNKNOWN_TRAFFIC : trafficType;
    }

    /**
     * @return the applied chaos strategies, lowercased and comma-joined, for substring matching
     */
    public String chaosAppliedText() {
        return String.join(",", chaosApplied).toLowerCase(Locale.ROOT);
    }

    public boolean isAgentToAgent() {
        return AGENT_TO_AGENT.equals(trafficType);
    }
}
