package io.tally.api.assertion;

/**
 * One pass/fail check performed inside a test case.
 * <p>
 * Assertions are produced by the test-execution engine and handed to the reporter
 * in the order they were evaluated. A failed assertion usually carries the error
 * that caused it; the reporter only looks at the error's type and stack trace.
 */
public interface Assertion {

    /**
     * @return true if this check did not hold
     */
    boolean failed();

    /**
     * @return the error raised by the failed check, or null when none was captured
     */
    Throwable error();

    /**
     * @return the human-readable message attached to the check, may be null
     */
    String message();

    static Assertion pass(String message) {
        return new Recorded(false, message, null);
    }

    static Assertion fail(String message, Throwable error) {
        return new Recorded(true, message, error);
    }

    /**
     * Plain value implementation used by engines that do not carry their own type.
     */
    record Recorded(boolean failed, String message, Throwable error) implements Assertion {}
}
