package io.chaosgrade.core.parse;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Substring rules shared by the free-text and structured extractors: tool names,
 * error kinds and fuzzing kinds. Rules are checked in priority order; the first hit wins.
 */
public final class Classifier {

    public static final String SEARCH_FLIGHTS = "search_flights";
    public static final String BOOK_TICKET = "book_ticket";
    public static final String LLM_REQUEST = "llm_request";
    public static final String FLIGHT_RELATED = "flight_related";
    public static final String UNKNOWN = "unknown";

    public static final String VALIDATION_ERROR = "validation_error";
    public static final String NOT_FOUND = "not_found";
    public static final String SERVER_ERROR = "server_error";
    public static final String TIMEOUT = "timeout";
    public static final String NETWORK_ERROR = "network_error";

    public static final String SCHEMA_VIOLATION = "schema_violation";
    public static final String TYPE_MISMATCH = "type_mismatch";
    public static final String NULL_INJECTION = "null_injection";
    public static final String GARBAGE_VALUE = "garbage_value";

    private static final List<String> FUZZ_TYPES = List.of(SCHEMA_VIOLATION, TYPE_MISMATCH, NULL_INJECTION, GARBAGE_VALUE);

    private Classifier() {}

    /**
     * Tool type of a URL seen in a free-text tool call line.
     */
    public static String toolTypeOfUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains(SEARCH_FLIGHTS)) {
            return SEARCH_FLIGHTS;
        } else if (lower.contains(BOOK_TICKET) || lower.contains("book")) {
            return BOOK_TICKET;
        } else if (lower.contains("flight")) {
            return FLIGHT_RELATED;
        }
        return UNKNOWN;
    }

    /**
     * Tool name inferred from the endpoint path of a structured record.
     */
    public static Optional<String> toolNameOfEndpoint(String url) {
        if (url == null || url.isEmpty()) {
            return Optional.empty();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("/search_flights")) {
            return Optional.of(SEARCH_FLIGHTS);
        } else if (lower.contains("/book_ticket") || lower.contains("/book")) {
            return Optional.of(BOOK_TICKET);
        } else if (lower.contains("/api/") || lower.contains("/v1/chat")) {
            return Optional.of(LLM_REQUEST);
        }
        return Optional.empty();
    }

    /**
     * Error kind of a free-text error line.
     */
    public static String errorTypeOfText(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (line.contains("400") || line.contains("Bad Request")) {
            return VALIDATION_ERROR;
        } else if (line.contains("404") || line.contains("Not Found")) {
            return NOT_FOUND;
        } else if (line.contains("500") || line.contains("Internal Server Error")) {
            return SERVER_ERROR;
        } else if (lower.contains("timeout")) {
            return TIMEOUT;
        } else if (lower.contains("network")) {
            return NETWORK_ERROR;
        }
        return UNKNOWN;
    }

    /**
     * Error kind of a failing HTTP status.
     */
    public static String errorTypeOfStatus(int statusCode) {
        if (statusCode == 400) {
            return VALIDATION_ERROR;
        } else if (statusCode == 404) {
            return NOT_FOUND;
        } else if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        return UNKNOWN;
    }

    /**
     * Fuzzing kind named verbatim in a free-text fuzzing line.
     */
    public static String fuzzTypeOfText(String line) {
        for (String fuzzType : FUZZ_TYPES) {
            if (line.contains(fuzzType)) {
                return fuzzType;
            }
        }
        return UNKNOWN;
    }

    /**
     * Fuzzing kind of a normalized (lowercase, comma-joined) chaos strategy list.
     */
    public static String fuzzTypeOfChaos(String chaosApplied) {
        if (chaosApplied.contains(SCHEMA_VIOLATION)) {
            return SCHEMA_VIOLATION;
        } else if (chaosApplied.contains(TYPE_MISMATCH)) {
            return TYPE_MISMATCH;
        } else if (chaosApplied.contains("null")) {
            return NULL_INJECTION;
        } else if (chaosApplied.contains("garbage")) {
            return GARBAGE_VALUE;
        }
        return UNKNOWN;
    }
}
