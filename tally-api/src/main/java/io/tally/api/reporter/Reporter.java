package io.tally.api.reporter;

import io.tally.api.config.ReporterConfig;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs tests through an engine and reports their results.
 */
public interface Reporter {

    /**
     * Start a run.
     * <p>
     * The returned future completes once, after every report has been written.
     * It completes exceptionally with a {@link io.tally.api.error.ReporterException}
     * when the configuration is invalid, a report cannot be produced, or any
     * assertion of the run failed.
     *
     * @param files  test files to run; empty to run every module the engine knows
     * @param config run configuration
     * @return future completing when the run and its reports are finished
     */
    CompletableFuture<Void> run(List<String> files, ReporterConfig config);

    /**
     * @return a short description of the report format
     */
    String info();
}
