package io.tally.api.assertion;

/**
 * An error captured outside this JVM, for example read back from an event log.
 * Its stack trace is only available as text, and its original type as a name.
 */
public interface ExternalError {

    /**
     * @return the original error type name (e.g., "TypeError")
     */
    String typeName();

    /**
     * @return the original stack trace text, header line included
     */
    String stack();
}
