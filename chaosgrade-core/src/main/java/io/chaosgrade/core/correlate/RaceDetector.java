package io.chaosgrade.core.correlate;

import io.chaosgrade.api.analysis.DependencyRule;
import io.chaosgrade.api.event.LogRecord;
import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricsCollector;
import io.chaosgrade.core.parse.StructuredEventExtractor;
import io.chaosgrade.core.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flags dependent tool calls that failed while their dependency was not yet
 * satisfied.
 * <p>
 * For each {@link DependencyRule}, a consumer call at time T with status 400 or
 * 404 is flagged if no producer call succeeded strictly before T, or if some
 * producer call lies within the simultaneity window of T. A consumer called with
 * an input that was always invalid satisfies the same condition; the detector
 * reports a signal, not a proven race.
 * <p>
 * Only structured records with a tool name and a parseable timestamp take part.
 */
public class RaceDetector {

    private static final Logger log = LoggerFactory.getLogger(RaceDetector.class);

    private static final Set<Integer> DEPENDENCY_FAILURE_CODES = Set.of(400, 404);

    private final List<DependencyRule> rules;
    private final Duration simultaneityWindow;

    public RaceDetector(List<DependencyRule> rules, Duration simultaneityWindow) {
        this.rules = List.copyOf(rules);
        this.simultaneityWindow = simultaneityWindow;
    }

    /**
     * @return the race conditions found, in rule order then call order
     */
    public List<LogicError> detect(EventStream stream, MetricsCollector collector) {
        Map<String, List<TimedCall>> callsByTool = timedCalls(stream.records());
        List<LogicError> errors = new ArrayList<>();

        for (DependencyRule rule : rules) {
            List<TimedCall> producers = callsByTool.getOrDefault(rule.producer(), List.of());
            for (TimedCall consumer : callsByTool.getOrDefault(rule.consumer(), List.of())) {
                check(rule, consumer, producers).ifPresent(error -> {
                    collector.recordLogicError(error);
                    errors.add(error);
                    log.debug("Race condition detected: {} ({} at {}, status {})", error.description(),
                            rule.consumer(), error.dependentCallTime(), error.dependentCallStatus());
                });
            }
        }
        return errors;
    }

    private Optional<LogicError> check(DependencyRule rule, TimedCall consumer, List<TimedCall> producers) {
        if (consumer.statusCode() == null || !DEPENDENCY_FAILURE_CODES.contains(consumer.statusCode())) {
            return Optional.empty();
        }

        boolean dependencyAvailable = producers.stream()
                .anyMatch(p -> p.time().isBefore(consumer.time())
                        && p.statusCode() != null && p.statusCode() == 200);
        boolean simultaneous = producers.stream()
                .anyMatch(p -> Duration.between(p.time(), consumer.time()).abs().compareTo(simultaneityWindow) < 0);

        if (dependencyAvailable && !simultaneous) {
            return Optional.empty();
        }
        return Optional.of(LogicError.raceCondition(
                rule.description(),
                rule.producer(),
                rule.consumer(),
                consumer.timestamp(),
                consumer.statusCode(),
                dependencyAvailable,
                simultaneous));
    }

    private Map<String, List<TimedCall>> timedCalls(List<LogRecord> records) {
        Map<String, List<TimedCall>> callsByTool = new HashMap<>();
        for (LogRecord record : records) {
            Optional<String> toolName = StructuredEventExtractor.resolveToolName(record);
            if (toolName.isEmpty() || record.timestamp() == null) {
                continue;
            }
            Optional<OffsetDateTime> time = parseTimestamp(record.timestamp());
            if (time.isEmpty()) {
                log.debug("Skipping record on line {} with unparseable timestamp '{}'", record.line(), record.timestamp());
                continue;
            }
            callsByTool.computeIfAbsent(toolName.get(), k -> new ArrayList<>())
                    .add(new TimedCall(record.timestamp(), time.get(), record.statusCode()));
        }
        return callsByTool;
    }

    /**
     * Parse an ISO-8601 timestamp. {@code Z} and numeric offsets are honoured, a
     * space may replace the {@code T}, and a timestamp without offset is taken as UTC.
     */
    static Optional<OffsetDateTime> parseTimestamp(String value) {
        String text = value.strip();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime);
            }
            return Optional.of(((LocalDateTime) parsed).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // timestamp is the text as logged; time is its parsed instant.
    private record TimedCall(String timestamp, OffsetDateTime time, Integer statusCode) {}
}
