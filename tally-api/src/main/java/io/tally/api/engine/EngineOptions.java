package io.tally.api.engine;

/**
 * Options handed to the test-execution engine for one run.
 *
 * @param testspec     optional test-name filter, passed through unchanged
 * @param testFullSpec optional fully qualified test-name filter, passed through unchanged
 * @param listener     lifecycle callbacks for the run
 */
public record EngineOptions(String testspec, String testFullSpec, TestLifecycleListener listener) {

    public EngineOptions {
        if (listener == null) {
            throw new IllegalArgumentException("Listener must not be null");
        }
    }
}
