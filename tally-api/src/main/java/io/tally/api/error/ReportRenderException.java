package io.tally.api.error;

/**
 * A module report could not be rendered. Fatal for the run.
 */
public class ReportRenderException extends ReporterException {

    public ReportRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
