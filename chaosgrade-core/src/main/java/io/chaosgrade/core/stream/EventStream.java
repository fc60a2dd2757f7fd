package io.chaosgrade.core.stream;

import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.event.LogRecord;

import java.util.List;

/**
 * The result of the first pass over a log file: events in line order, the raw
 * lines kept for windowed lookback, and the structured records kept for
 * cross-record correlation.
 */
public final class EventStream {

    private final List<Event> events;
    private final List<String> rawLines;
    private final List<LogRecord> records;

    public EventStream(List<Event> events, List<String> rawLines, List<LogRecord> records) {
        this.events = List.copyOf(events);
        this.rawLines = List.copyOf(rawLines);
        this.records = List.copyOf(records);
    }

    public List<Event> events() {
        return events;
    }

    public List<LogRecord> records() {
        return records;
    }

    public int lineCount() {
        return rawLines.size();
    }

    /**
     * @param lineNumber 1-based line number
     * @return the line exactly as read from the file
     */
    public String rawLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > rawLines.size()) {
            throw new IndexOutOfBoundsException("Line " + lineNumber + " outside 1.." + rawLines.size());
        }
        return rawLines.get(lineNumber - 1);
    }

    /**
     * @return all events of the given kind, in line order
     */
    public <T extends Event> List<T> eventsOf(Class<T> kind) {
        return events.stream()
                .filter(kind::isInstance)
                .map(kind::cast)
                .toList();
    }

    /**
     * @return the last {@code limit} elements of the list, or all of them if there are fewer
     */
    public static <T> List<T> lastN(List<T> items, int limit) {
        return items.subList(Math.max(0, items.size() - limit), items.size());
    }
}
