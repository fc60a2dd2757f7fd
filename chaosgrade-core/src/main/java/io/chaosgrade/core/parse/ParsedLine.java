package io.chaosgrade.core.parse;

import io.chaosgrade.api.event.LogRecord;

/**
 * One non-empty log line, classified as a structured record or free text.
 */
public sealed interface ParsedLine {

    int line();

    /**
     * A JSON object carrying a {@code timestamp} key.
     */
    record Structured(LogRecord record) implements ParsedLine {
        @Override
        public int line() {
            return record.line();
        }
    }

    /**
     * Anything else: legacy log output matched by heuristics. The text is trimmed.
     */
    record FreeText(int line, String text) implements ParsedLine {}
}
