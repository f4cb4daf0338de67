package io.tally.api.report;

import java.util.Optional;

/**
 * Outcome of one executed test function.
 *
 * @param name    test name
 * @param failure the recorded failure, null when the test passed cleanly
 */
public record TestCaseReport(String name, Failure failure) {

    public TestCaseReport {
        if (name == null) {
            throw new IllegalArgumentException("Test case name must not be null");
        }
    }

    public static TestCaseReport passed(String name) {
        return new TestCaseReport(name, null);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<Failure> failureIfAny() {
        return Optional.ofNullable(failure);
    }
}
