package io.tally.api.error;

import java.nio.file.Path;

/**
 * The output directory could not be created. No report file is written.
 */
public class DirectoryCreationException extends ReporterException {

    public DirectoryCreationException(Path directory, Throwable cause) {
        super("Failed to create output directory " + directory + ": " + cause.getMessage(), cause);
    }
}
