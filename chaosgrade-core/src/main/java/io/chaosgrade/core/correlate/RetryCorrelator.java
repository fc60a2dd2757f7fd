package io.chaosgrade.core.correlate;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.metrics.MetricsCollector;
import io.chaosgrade.core.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks retries that were followed by a successful response.
 * <p>
 * A retry at line N counts as successful if {@code "Response: 200"} appears on any
 * raw line from N through N + window - 1, clipped at the end of the file. This is
 * line proximity, not causality: an unrelated success close by also counts.
 */
public class RetryCorrelator {

    private static final Logger log = LoggerFactory.getLogger(RetryCorrelator.class);

    static final String SUCCESS_MARKER = "Response: 200";

    private final int windowLines;

    public RetryCorrelator(int windowLines) {
        if (windowLines <= 0) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.windowLines = windowLines;
    }

    /**
     * @return the number of retries credited with a success
     */
    public int correlate(EventStream stream, MetricsCollector collector) {
        int successful = 0;
        for (Event.Retry retry : stream.eventsOf(Event.Retry.class)) {
            int last = Math.min(retry.line() + windowLines - 1, stream.lineCount());
            for (int lineNumber = retry.line(); lineNumber <= last; lineNumber++) {
                if (stream.rawLine(lineNumber).contains(SUCCESS_MARKER)) {
                    collector.recordSuccessfulRetry();
                    successful++;
                    break;
                }
            }
        }
        log.debug("{} of {} retries followed by a successful response", successful,
                stream.eventsOf(Event.Retry.class).size());
        return successful;
    }
}
