package io.tally.api.config;

/**
 * Destination for the reporter's console lines.
 */
@FunctionalInterface
public interface LogSink {

    void log(String line);

    static LogSink stdout() {
        return System.out::println;
    }
}
