package io.tally.core.model;

/**
 * The two categories of the JUnit report convention.
 */
public enum FailureKind {

    /** An expectation did not hold. */
    FAILURE,

    /** The test broke: a thrown exception, a timeout, a programming error. */
    ERROR;

    /**
     * Any {@link AssertionError} counts as a failure, everything else (including
     * a failed assertion that carries no error at all) as an error.
     */
    public static FailureKind of(Throwable error) {
        return error instanceof AssertionError ? FAILURE : ERROR;
    }
}
