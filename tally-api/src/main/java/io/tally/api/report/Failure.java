package io.tally.api.report;

/**
 * The failure recorded for a test case, taken from its first failing assertion.
 *
 * @param message   assertion message, null when the assertion had none
 * @param backtrace stack trace text of the underlying error
 * @param type      simple class name of the underlying error
 */
public record Failure(String message, String backtrace, String type) {}
