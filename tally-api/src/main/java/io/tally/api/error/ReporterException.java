package io.tally.api.error;

/**
 * Base type for every error a reporter run can end with.
 */
public class ReporterException extends RuntimeException {

    public ReporterException(String message) {
        super(message);
    }

    public ReporterException(String message, Throwable cause) {
        super(message, cause);
    }
}
