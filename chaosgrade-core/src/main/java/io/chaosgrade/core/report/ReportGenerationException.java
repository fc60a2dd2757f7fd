package io.chaosgrade.core.report;

/**
 * Thrown when a report file cannot be written.
 */
public class ReportGenerationException extends RuntimeException {

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
