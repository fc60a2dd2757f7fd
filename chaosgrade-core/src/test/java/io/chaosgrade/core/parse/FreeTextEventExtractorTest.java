package io.chaosgrade.core.parse;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.core.metrics.MicrometerMetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FreeTextEventExtractorTest {

    private FreeTextEventExtractor extractor;
    private MicrometerMetricsCollector collector;

    @BeforeEach
    void setUp() {
        extractor = new FreeTextEventExtractor();
        collector = new MicrometerMetricsCollector();
    }

    @Test
    void shouldExtractToolCallWithTimestamp() {
        List<Event> events = extractor.extract(1,
                "2024-03-11 09:15:42 INFO HTTP Tool POST http://localhost:8001/search_flights", collector);

        assertThat(events).containsExactly(new Event.ToolCall(1, "2024-03-11 09:15:42",
                "http://localhost:8001/search_flights", Classifier.SEARCH_FLIGHTS));
        assertThat(collector.snapshot().totalToolCalls()).isEqualTo(1);
    }

    @Test
    void shouldClassifyBookingUrl() {
        List<Event> events = extractor.extract(1, "HTTP Tool POST http://localhost:8001/book", collector);

        assertThat(events).singleElement()
                .isInstanceOfSatisfying(Event.ToolCall.class,
                        call -> assertThat(call.toolName()).isEqualTo(Classifier.BOOK_TICKET));
    }

    @Test
    void shouldClassifyOtherFlightUrlWithUsDateTimestamp() {
        List<Event> events = extractor.extract(2,
                "01/15/2025 10:00:00 HTTP Tool POST http://localhost:8001/flight_status", collector);

        assertThat(events).containsExactly(new Event.ToolCall(2, "01/15/2025 10:00:00",
                "http://localhost:8001/flight_status", Classifier.FLIGHT_RELATED));
    }

    @Test
    void shouldPreferIsoTimestampOverBracketedTime() {
        List<Event> events = extractor.extract(5, "[09:59:58] 2025-01-15T10:00:01 retry scheduled", collector);

        assertThat(events).containsExactly(new Event.Retry(5, "2025-01-15T10:00:01"));
    }

    @Test
    void shouldClassifyNetworkError() {
        List<Event> events = extractor.extract(6, "Error: Network unreachable", collector);

        assertThat(events).singleElement()
                .isInstanceOfSatisfying(Event.Error.class,
                        error -> assertThat(error.errorType()).isEqualTo(Classifier.NETWORK_ERROR));
        assertThat(collector.snapshot().toolCallErrors().count(Classifier.NETWORK_ERROR)).isEqualTo(1);
    }

    @Test
    void shouldEmitSeveralEventsForOneLine() {
        List<Event> events = extractor.extract(3, "[09:15:42] Retry after error: 404 Not Found", collector);

        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isInstanceOfSatisfying(Event.Error.class, error -> {
            assertThat(error.errorType()).isEqualTo(Classifier.NOT_FOUND);
            assertThat(error.timestamp()).isEqualTo("09:15:42");
        });
        assertThat(events.get(1)).isEqualTo(new Event.Retry(3, "09:15:42"));

        MetricCounts counts = collector.snapshot();
        assertThat(counts.failedToolCalls()).isEqualTo(1);
        assertThat(counts.retryAttempts()).isEqualTo(1);
        assertThat(counts.toolCallErrors().count(Classifier.NOT_FOUND)).isEqualTo(1);
    }

    @Test
    void shouldMatchErrorAndRetryCaseInsensitively() {
        extractor.extract(1, "ERROR: connection timeout", collector);
        extractor.extract(2, "RETRYING call", collector);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.toolCallErrors().count(Classifier.TIMEOUT)).isEqualTo(1);
        assertThat(counts.retryAttempts()).isEqualTo(1);
    }

    @Test
    void shouldExtractFuzzingWithFieldCount() {
        List<Event> events = extractor.extract(4,
                "Schema-aware fuzzing applied: type_mismatch on 3 fields fuzzed", collector);

        assertThat(events).containsExactly(new Event.Fuzzing(4, null, Classifier.TYPE_MISMATCH, 3));
        MetricCounts counts = collector.snapshot();
        assertThat(counts.fuzzingAttempts()).isEqualTo(1);
        assertThat(counts.fuzzingSuccessful()).isEqualTo(1);
        assertThat(counts.fuzzingTypes().count(Classifier.TYPE_MISMATCH)).isEqualTo(1);
    }

    @Test
    void shouldCountFuzzingWithoutFieldsAsUnsuccessful() {
        extractor.extract(1, "MCP protocol fuzzing: nothing to mutate", collector);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.fuzzingAttempts()).isEqualTo(1);
        assertThat(counts.fuzzingSuccessful()).isZero();
        assertThat(counts.fuzzingTypes().count(Classifier.UNKNOWN)).isEqualTo(1);
    }

    @Test
    void shouldExtractCompletionAndCrash() {
        extractor.extract(1, "Agent processing complete", collector);
        extractor.extract(2, "Workflow Complete", collector);
        extractor.extract(3, "Traceback (most recent call last):", collector);
        extractor.extract(4, "agent crashed unexpectedly", collector);

        MetricCounts counts = collector.snapshot();
        assertThat(counts.agentSuccessfulCompletion()).isEqualTo(2);
        assertThat(counts.agentCrashes()).isEqualTo(2);
    }

    @Test
    void shouldExtractResponses() {
        List<Event> ok = extractor.extract(1, "Response: 200 OK", collector);
        List<Event> failed = extractor.extract(2, "Response: 500", collector);

        assertThat(ok).containsExactly(new Event.Response(1, null, 200));
        assertThat(failed).containsExactly(new Event.Response(2, null, 500));

        MetricCounts counts = collector.snapshot();
        assertThat(counts.successfulToolCalls()).isEqualTo(1);
        assertThat(counts.failedToolCalls()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreResponsesWithoutTrackedStatus() {
        assertThat(extractor.extract(1, "Response: 302 Found", collector)).isEmpty();
    }

    @Test
    void shouldTruncateLongMessages() {
        String line = "error " + "x".repeat(300);

        List<Event> events = extractor.extract(1, line, collector);

        assertThat(events).singleElement()
                .isInstanceOfSatisfying(Event.Error.class,
                        error -> assertThat(error.message()).hasSize(FreeTextEventExtractor.MAX_MESSAGE_LENGTH));
    }

    @Test
    void shouldIgnoreUnrelatedLines() {
        assertThat(extractor.extract(1, "Starting proxy on port 8080", collector)).isEmpty();
        assertThat(collector.snapshot()).isEqualTo(new MicrometerMetricsCollector().snapshot());
    }
}
