package io.tally.api.error;

/**
 * Reports were written, but at least one assertion of the run failed.
 */
public class TestFailuresException extends ReporterException {

    private final int failures;
    private final int total;

    public TestFailuresException(int failures, int total) {
        super("We have got test failures.");
        this.failures = failures;
        this.total = total;
    }

    public int failures() {
        return failures;
    }

    public int total() {
        return total;
    }
}
