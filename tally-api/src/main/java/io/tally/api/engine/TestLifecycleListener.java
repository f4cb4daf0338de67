package io.tally.api.engine;

import io.tally.api.assertion.AssertionList;

/**
 * Callbacks the test-execution engine invokes over one run.
 * <p>
 * Engines call zero or more groups of {@code moduleStart} followed by
 * {@code testDone} for each test in that module, then {@code done} exactly once.
 * Calls are serial; implementations are not required to be thread-safe.
 */
public interface TestLifecycleListener {

    /**
     * A module (suite) started. Subsequent tests belong to it.
     */
    void moduleStart(String name);

    /**
     * A test in the current module finished.
     *
     * @param name       test name
     * @param assertions the assertions evaluated by the test, in order
     */
    void testDone(String name, AssertionList assertions);

    /**
     * The run finished.
     *
     * @param assertions every assertion of the run, with the total duration
     */
    void done(AssertionList assertions);
}
