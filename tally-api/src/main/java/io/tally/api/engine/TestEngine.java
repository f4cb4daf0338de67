package io.tally.api.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * The external component that discovers and runs tests.
 * <p>
 * The reporter never executes tests itself; it registers a
 * {@link TestLifecycleListener} through {@link EngineOptions} and lets the engine
 * drive it. Engines may emit events on any thread, synchronously or after the
 * dispatch method returns.
 */
public interface TestEngine {

    /**
     * Run the tests found in the given files.
     *
     * @param files   absolute paths of test files
     * @param options filters and lifecycle callbacks
     */
    void runFiles(List<Path> files, EngineOptions options);

    /**
     * Run every module the engine knows about.
     *
     * @param options filters and lifecycle callbacks
     */
    void runModules(EngineOptions options);
}
