package io.chaosgrade.core.parse;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a timestamp inside a free-text log line.
 */
final class TimestampExtractor {

    // Tried in order; the first match wins.
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2}[\\sT]\\d{2}:\\d{2}:\\d{2})"),
            Pattern.compile("(\\d{2}/\\d{2}/\\d{4}\\s\\d{2}:\\d{2}:\\d{2})"),
            Pattern.compile("\\[(\\d{2}:\\d{2}:\\d{2})]")
    );

    private TimestampExtractor() {}

    /**
     * @return the timestamp text, or null if the line has none
     */
    static String extract(String line) {
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
