package io.tally.api.error;

/**
 * The reporter was misconfigured or driven out of order. Raised before any output is produced.
 */
public class ReporterConfigurationException extends ReporterException {

    public ReporterConfigurationException(String message) {
        super(message);
    }

    public ReporterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
