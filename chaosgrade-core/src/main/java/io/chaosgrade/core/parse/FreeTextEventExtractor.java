package io.chaosgrade.core.parse;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.metrics.MetricsCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts events from legacy free-text log lines using trigger phrases.
 * <p>
 * Every trigger is checked independently, so one line can yield several events,
 * e.g. a retry line that also mentions an error.
 */
public class FreeTextEventExtractor {

    static final int MAX_MESSAGE_LENGTH = 200;

    private static final Pattern POST_URL = Pattern.compile("POST\\s+(\\S+)");
    private static final Pattern FIELDS_FUZZED = Pattern.compile("(\\d{1,9})\\s+fields?\\s+fuzzed");
    private static final Pattern RESPONSE_STATUS = Pattern.compile("Response:\\s*(\\d{1,9})");

    public List<Event> extract(int lineNumber, String line, MetricsCollector collector) {
        List<Event> events = new ArrayList<>();
        String lower = line.toLowerCase(Locale.ROOT);
        String timestamp = TimestampExtractor.extract(line);

        if (line.contains("HTTP Tool") && line.contains("POST")) {
            Matcher url = POST_URL.matcher(line);
            if (url.find()) {
                collector.recordToolCall();
                events.add(new Event.ToolCall(lineNumber, timestamp, url.group(1), Classifier.toolTypeOfUrl(url.group(1))));
            }
        }

        if (line.contains("Schema-aware fuzzing") || line.contains("MCP protocol fuzzing")) {
            events.add(fuzzing(lineNumber, timestamp, line, collector));
        }

        if (lower.contains("error")) {
            String errorType = Classifier.errorTypeOfText(line);
            collector.recordToolError(errorType);
            collector.recordFailure();
            events.add(new Event.Error(lineNumber, timestamp, errorType, truncate(line)));
        }

        if (lower.contains("retry")) {
            collector.recordRetry();
            events.add(new Event.Retry(lineNumber, timestamp));
        }

        if (line.contains("Agent processing complete") || line.contains("Workflow Complete")) {
            collector.recordCompletion();
            events.add(new Event.Completion(lineNumber, timestamp));
        }

        if (line.contains("Exception") || line.contains("Traceback") || lower.contains("crash")) {
            collector.recordCrash();
            events.add(new Event.Crash(lineNumber, timestamp, truncate(line)));
        }

        if (line.contains("Response:") && (line.contains("200") || line.contains("400") || line.contains("500"))) {
            Matcher status = RESPONSE_STATUS.matcher(line);
            if (status.find()) {
                int statusCode = Integer.parseInt(status.group(1));
                if (statusCode == 200) {
                    collector.recordSuccess();
                } else if (statusCode >= 400) {
                    collector.recordFailure();
                }
                events.add(new Event.Response(lineNumber, timestamp, statusCode));
            }
        }

        return events;
    }

    private Event.Fuzzing fuzzing(int lineNumber, String timestamp, String line, MetricsCollector collector) {
        String fuzzType = Classifier.fuzzTypeOfText(line);
        Matcher fields = FIELDS_FUZZED.matcher(line);
        int fieldsFuzzed = fields.find() ? Integer.parseInt(fields.group(1)) : 0;

        collector.recordFuzzing(fuzzType, fieldsFuzzed > 0);
        return new Event.Fuzzing(lineNumber, timestamp, fuzzType, fieldsFuzzed);
    }

    private static String truncate(String line) {
        return line.length() <= MAX_MESSAGE_LENGTH ? line : line.substring(0, MAX_MESSAGE_LENGTH);
    }
}
