package io.chaosgrade.api.analysis;

/**
 * Declares that calls to {@code consumer} depend on a prior successful call to {@code producer}.
 * Used by race detection to pair tool calls.
 */
public record DependencyRule(String producer, String consumer, String description) {

    /**
     * Booking a ticket needs a flight id returned by a flight search.
     */
    public static final DependencyRule SEARCH_BEFORE_BOOK = new DependencyRule(
            "search_flights", "book_ticket",
            "book_ticket called before search_flights completed or with invalid flight_id");

    public DependencyRule {
        if (producer == null || producer.isBlank()) {
            throw new IllegalArgumentException("Producer tool name must not be blank");
        }
        if (consumer == null || consumer.isBlank()) {
            throw new IllegalArgumentException("Consumer tool name must not be blank");
        }
        if (producer.equals(consumer)) {
            throw new IllegalArgumentException("A tool cannot depend on itself: " + producer);
        }
        if (description == null || description.isBlank()) {
            description = consumer + " called before " + producer + " completed or with invalid input";
        }
    }

    public static DependencyRule of(String producer, String consumer) {
        return new DependencyRule(producer, consumer, null);
    }
}
