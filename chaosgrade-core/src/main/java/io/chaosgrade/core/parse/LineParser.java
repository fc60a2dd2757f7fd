package io.chaosgrade.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chaosgrade.api.event.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies log lines as structured records or free text.
 * <p>
 * A line is structured only if it decodes to a JSON object with a {@code timestamp}
 * key. Decode failures, non-object JSON and objects without a timestamp all fall
 * back to free text, so a malformed line never aborts the analysis.
 */
public class LineParser {

    private static final Logger log = LoggerFactory.getLogger(LineParser.class);

    static final String TIMESTAMP = "timestamp";

    private final ObjectMapper objectMapper;

    public LineParser() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param rawLine    the line as read from the file
     * @param lineNumber its 1-based position in the file
     * @return the classified line, or empty if the line is blank
     */
    public Optional<ParsedLine> parse(String rawLine, int lineNumber) {
        String line = rawLine.strip();
        if (line.isEmpty()) {
            return Optional.empty();
        }

        JsonNode node = decode(line);
        if (node != null && node.isObject() && node.has(TIMESTAMP)) {
            return Optional.of(new ParsedLine.Structured(toRecord(node, lineNumber)));
        }
        return Optional.of(new ParsedLine.FreeText(lineNumber, line));
    }

    private JsonNode decode(String line) {
        if (line.charAt(0) != '{') {
            return null;
        }
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Could not parse log line as JSON: {}", abbreviate(line));
            return null;
        }
    }

    static LogRecord toRecord(JsonNode node, int lineNumber) {
        return new LogRecord(
                lineNumber,
                text(node, TIMESTAMP),
                text(node, "method"),
                text(node, "url"),
                statusCode(node.get("status_code")),
                text(node, "tool_name"),
                chaosApplied(node.get("chaos_applied")),
                node.path("fuzzed").asBoolean(false),
                text(node, "agent_role"),
                text(node, "traffic_type"),
                text(node, "traffic_subtype")
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Integer statusCode(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual() && value.asText().matches("\\d{1,9}")) {
            return Integer.parseInt(value.asText());
        }
        return null;
    }

    private static List<String> chaosApplied(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isArray()) {
            List<String> strategies = new ArrayList<>();
            for (JsonNode element : value) {
                if (!element.isNull()) {
                    strategies.add(element.asText());
                }
            }
            return strategies;
        }
        String single = value.asText();
        return single.isEmpty() ? List.of() : List.of(single);
    }

    private static String abbreviate(String line) {
        return line.length() <= 50 ? line : line.substring(0, 50) + "...";
    }
}
