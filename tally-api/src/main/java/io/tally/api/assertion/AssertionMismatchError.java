package io.tally.api.assertion;

import java.util.Objects;

/**
 * Structured comparison failure raised by equality and truthiness helpers.
 * <p>
 * Any {@link AssertionError} is reported as a JUnit failure; this subtype also
 * keeps both sides of the comparison so the reporter can print them in the
 * backtrace header.
 */
public class AssertionMismatchError extends AssertionError {

    private final transient Object actual;
    private final transient Object expected;
    private final String operator;

    public AssertionMismatchError(String message, Object actual, Object expected, String operator) {
        super(message, null);
        this.actual = actual;
        this.expected = expected;
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public static AssertionMismatchError equal(Object actual, Object expected) {
        return new AssertionMismatchError(actual + " == " + expected, actual, expected, "==");
    }

    public static AssertionMismatchError notEqual(Object actual, Object expected) {
        return new AssertionMismatchError(actual + " != " + expected, actual, expected, "!=");
    }

    public Object actual() {
        return actual;
    }

    public Object expected() {
        return expected;
    }

    public String operator() {
        return operator;
    }
}
