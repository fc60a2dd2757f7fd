package io.chaosgrade.core.correlate;

import io.chaosgrade.core.metrics.MicrometerMetricsCollector;
import io.chaosgrade.core.stream.EventStream;
import io.chaosgrade.core.stream.EventStreamReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryCorrelatorTest {

    private MicrometerMetricsCollector collector;
    private RetryCorrelator correlator;

    @BeforeEach
    void setUp() {
        collector = new MicrometerMetricsCollector();
        correlator = new RetryCorrelator(10);
    }

    @Test
    void shouldCreditSuccessFiveLinesLater() {
        EventStream stream = read(logWithSuccessAfter(5, 12));

        assertThat(correlator.correlate(stream, collector)).isEqualTo(1);
        assertThat(collector.snapshot().successfulRetries()).isEqualTo(1);
    }

    @Test
    void shouldNotCreditSuccessElevenLinesLater() {
        EventStream stream = read(logWithSuccessAfter(11, 14));

        assertThat(correlator.correlate(stream, collector)).isZero();
        assertThat(collector.snapshot().successfulRetries()).isZero();
    }

    @Test
    void shouldIncludeNinthLineAndExcludeTenth() {
        assertThat(new RetryCorrelator(10).correlate(read(logWithSuccessAfter(9, 12)), collector)).isEqualTo(1);
        assertThat(new RetryCorrelator(10).correlate(read(logWithSuccessAfter(10, 12)), new MicrometerMetricsCollector()))
                .isZero();
    }

    @Test
    void shouldSearchUpToLastLineOfFile() {
        List<String> lines = List.of("starting", "Retrying call", "waiting", "Response: 200 OK");

        assertThat(correlator.correlate(read(lines), collector)).isEqualTo(1);
    }

    @Test
    void shouldCreditEachRetryAtMostOnce() {
        List<String> lines = List.of("Retrying call", "Response: 200 OK", "Response: 200 OK");

        assertThat(correlator.correlate(read(lines), collector)).isEqualTo(1);
    }

    @Test
    void shouldCreditEveryRetrySharingOneSuccess() {
        List<String> lines = List.of("Retrying call", "Retrying again", "Response: 200 OK");

        assertThat(correlator.correlate(read(lines), collector)).isEqualTo(2);
        assertThat(collector.snapshot().retryAttempts()).isEqualTo(2);
    }

    @Test
    void shouldHonourConfiguredWindow() {
        EventStream stream = read(logWithSuccessAfter(3, 8));

        assertThat(new RetryCorrelator(3).correlate(stream, collector)).isZero();
        assertThat(new RetryCorrelator(4).correlate(stream, collector)).isEqualTo(1);
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new RetryCorrelator(0)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * A retry on line 1 and a successful response {@code offset} lines below it.
     */
    private static List<String> logWithSuccessAfter(int offset, int totalLines) {
        List<String> lines = new ArrayList<>();
        lines.add("Retrying request to upstream");
        for (int i = 2; i <= totalLines; i++) {
            lines.add(i == offset + 1 ? "Response: 200 OK" : "processing step " + i);
        }
        return lines;
    }

    private EventStream read(List<String> lines) {
        return new EventStreamReader().read(lines, collector);
    }
}
