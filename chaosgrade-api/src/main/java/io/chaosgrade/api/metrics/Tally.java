package io.chaosgrade.api.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable open-keyed counter map. Keys keep the order in which they were first
 * counted; any key that was never counted reads as zero.
 */
public final class Tally {

    private static final Tally EMPTY = new Tally(Map.of());

    private final Map<String, Long> counts;

    private Tally(Map<String, Long> counts) {
        this.counts = counts;
    }

    public static Tally empty() {
        return EMPTY;
    }

    public static Tally of(Map<String, Long> counts) {
        Objects.requireNonNull(counts);
        if (counts.isEmpty()) {
            return EMPTY;
        }
        return new Tally(Collections.unmodifiableMap(new LinkedHashMap<>(counts)));
    }

    public long count(String key) {
        return counts.getOrDefault(key, 0L);
    }

    public Set<String> keys() {
        return counts.keySet();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @JsonValue
    public Map<String, Long> asMap() {
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Tally other && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
