package io.chaosgrade.core.stream;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.event.LogRecord;
import io.chaosgrade.api.metrics.MetricsCollector;
import io.chaosgrade.core.parse.FreeTextEventExtractor;
import io.chaosgrade.core.parse.LineParser;
import io.chaosgrade.core.parse.ParsedLine;
import io.chaosgrade.core.parse.StructuredEventExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * First pass over the log: routes every line through the structured or the
 * free-text extractor and collects the resulting events in order.
 */
public class EventStreamReader {

    private static final Logger log = LoggerFactory.getLogger(EventStreamReader.class);

    private final LineParser lineParser;
    private final StructuredEventExtractor structuredExtractor;
    private final FreeTextEventExtractor freeTextExtractor;

    public EventStreamReader() {
        this(new LineParser(), new StructuredEventExtractor(), new FreeTextEventExtractor());
    }

    public EventStreamReader(LineParser lineParser,
                             StructuredEventExtractor structuredExtractor,
                             FreeTextEventExtractor freeTextExtractor) {
        this.lineParser = lineParser;
        this.structuredExtractor = structuredExtractor;
        this.freeTextExtractor = freeTextExtractor;
    }

    public EventStream read(List<String> rawLines, MetricsCollector collector) {
        List<Event> events = new ArrayList<>();
        List<LogRecord> records = new ArrayList<>();

        for (int i = 0; i < rawLines.size(); i++) {
            Optional<ParsedLine> parsed = lineParser.parse(rawLines.get(i), i + 1);
            if (parsed.isEmpty()) {
                continue;
            }
            if (parsed.get() instanceof ParsedLine.Structured structured) {
                records.add(structured.record());
                events.addAll(structuredExtractor.extract(structured.record(), collector));
            } else if (parsed.get() instanceof ParsedLine.FreeText text) {
                events.addAll(freeTextExtractor.extract(text.line(), text.text(), collector));
            }
        }

        log.debug("Extracted {} events from {} lines ({} structured records)",
                events.size(), rawLines.size(), records.size());
        return new EventStream(events, rawLines, records);
    }
}
