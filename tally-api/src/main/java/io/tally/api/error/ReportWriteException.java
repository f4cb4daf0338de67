package io.tally.api.error;

import java.nio.file.Path;

public class ReportWriteException extends ReporterException {

    public ReportWriteException(Path file, Throwable cause) {
        super("Failed to write report to " + file, cause);
    }
}
