package io.tally.core.runtime;

import io.tally.api.assertion.AssertionList;
import io.tally.api.config.ReporterConfig;
import io.tally.api.engine.EngineOptions;
import io.tally.api.engine.TestEngine;
import io.tally.api.engine.TestLifecycleListener;
import io.tally.api.error.ReportWriteException;
import io.tally.api.error.ReporterConfigurationException;
import io.tally.api.error.TestFailuresException;
import io.tally.api.report.ModuleReport;
import io.tally.api.report.ReportRenderer;
import io.tally.api.reporter.Reporter;
import io.tally.core.fs.DirectoryEnsurer;
import io.tally.core.fs.PathResolver;
import io.tally.core.fs.ReportFileNamer;
import io.tally.core.fs.ReportFileNamer.ReportFile;
import io.tally.core.metrics.ReporterMetrics;
import io.tally.core.model.FailureNormalizer;
import io.tally.core.model.ReportModelBuilder;
import io.tally.core.report.JUnitXmlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tests through a {@link TestEngine} and writes one JUnit XML file per module.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = ReporterConfig.create().output("build/test-reports");
 *
 * try (var reporter = new JUnitReporter(engine)) {
 *     reporter.run(List.of(), config).get();
 * }
 * }</pre>
 * <p>
 * The engine drives a {@link ReportModelBuilder}; when it signals {@code done}
 * the output directory is created, every module is rendered and written in
 * parallel, and a summary line goes to the configured sink. The returned future
 * completes once: normally when every assertion passed, otherwise with the
 * configuration, directory, render, write, or test-failure error.
 */
public class JUnitReporter implements Reporter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JUnitReporter.class);

    static final String NO_OUTPUT_MESSAGE = "Error: No output directory defined.\n"
            + "\tEither add an \"output\" property to your config file, or\n"
            + "\tuse the --output command line option.";

    private final TestEngine engine;
    private final ReportRenderer renderer;
    private final DirectoryEnsurer directoryEnsurer;
    private final ReporterMetrics metrics;
    private final ExecutorService executor;
    private final PathResolver pathResolver;
    private final FailureNormalizer normalizer = new FailureNormalizer();
    private final ReportFileNamer fileNamer = new ReportFileNamer();

    public JUnitReporter(TestEngine engine) {
        this(engine, new JUnitXmlRenderer(), new ReporterMetrics());
    }

    public JUnitReporter(TestEngine engine, ReportRenderer renderer, ReporterMetrics metrics) {
        this(engine, renderer, metrics, newWriterPool(), new PathResolver());
    }

    private JUnitReporter(TestEngine engine, ReportRenderer renderer, ReporterMetrics metrics,
                          ExecutorService executor, PathResolver pathResolver) {
        this(engine, renderer, new DirectoryEnsurer(executor), metrics, executor, pathResolver);
    }

    public JUnitReporter(TestEngine engine, ReportRenderer renderer, DirectoryEnsurer directoryEnsurer,
                         ReporterMetrics metrics, ExecutorService executor, PathResolver pathResolver) {
        this.engine = engine;
        this.renderer = renderer;
        this.directoryEnsurer = directoryEnsurer;
        this.metrics = metrics;
        this.executor = executor;
        this.pathResolver = pathResolver;
    }

    @Override
    public CompletableFuture<Void> run(List<String> files, ReporterConfig config) {
        CompletableFuture<Void> result = new CompletableFuture<>();

        if (config == null || !config.hasOutput()) {
            result.completeExceptionally(new ReporterConfigurationException(NO_OUTPUT_MESSAGE));
            return result;
        }

        Path output;
        try {
            output = pathResolver.resolve(config.output());
        } catch (InvalidPathException e) {
            result.completeExceptionally(
                    new ReporterConfigurationException("Invalid output directory: " + e.getMessage(), e));
            return result;
        }
        log.info("Starting run, reports go to {}", output);

        ReportModelBuilder builder = new ReportModelBuilder(normalizer, metrics,
                (reports, assertions) -> writeReports(reports, assertions, output, config, result));
        EngineOptions options = new EngineOptions(config.testspec(), config.testFullSpec(),
                new RunListener(builder, result));

        try {
            if (files != null && !files.isEmpty()) {
                List<Path> paths = files.stream().map(pathResolver::resolve).toList();
                engine.runFiles(paths, options);
            } else {
                engine.runModules(options);
            }
        } catch (RuntimeException e) {
            log.error("Test engine failed", e);
            result.completeExceptionally(e);
        }
        return result;
    }

    @Override
    public String info() {
        return "jUnit XML test reports";
    }

    public ReporterMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private void writeReports(List<ModuleReport> reports, AssertionList assertions, Path output,
                              ReporterConfig config, CompletableFuture<Void> result) {
        if (result.isDone()) {
            log.warn("Run already ended with an error, skipping report generation");
            return;
        }

        directoryEnsurer.ensure(output)
                .thenCompose(dir -> writeAll(reports, dir, config))
                .whenComplete((written, error) -> {
                    if (error != null) {
                        result.completeExceptionally(unwrap(error));
                        return;
                    }
                    log.info("{} report(s) written to {}", written, output);
                    try {
                        printSummary(assertions, config);
                    } catch (RuntimeException e) {
                        log.error("Failed to print run summary", e);
                        result.completeExceptionally(e);
                        return;
                    }

                    if (assertions.failures() > 0) {
                        result.completeExceptionally(new TestFailuresException(assertions.failures(), assertions.size()));
                    } else {
                        result.complete(null);
                    }
                });
    }

    private CompletableFuture<Integer> writeAll(List<ModuleReport> reports, Path directory, ReporterConfig config) {
        List<ReportFile> files = fileNamer.assign(reports, directory, renderer.extension());
        List<CompletableFuture<Void>> writes = new ArrayList<>(files.size());

        for (ReportFile file : files) {
            config.log().log("Writing " + file.path());
            writes.add(CompletableFuture.runAsync(() -> write(file), executor));
        }
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]))
                .thenApply(v -> files.size());
    }

    private void write(ReportFile file) {
        long start = System.nanoTime();
        String rendered = renderer.render(file.report());
        try {
            Files.writeString(file.path(), rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException(file.path(), e);
        }
        metrics.recordReportWritten(Duration.ofNanos(System.nanoTime() - start));
        log.debug("Report written: {}", file.path());
    }

    private static void printSummary(AssertionList assertions, ReporterConfig config) {
        if (assertions.failures() > 0) {
            config.log().log("\n" + bold(error("FAILURES: ", config), config)
                    + assertions.failures() + "/" + assertions.size()
                    + " assertions failed (" + assertions.duration() + "ms)");
        } else {
            config.log().log("\n" + bold(ok("OK: ", config), config)
                    + assertions.size() + " assertions (" + assertions.duration() + "ms)");
        }
    }

    private static String error(String str, ReporterConfig config) {
        return config.errorPrefix() + str + config.errorSuffix();
    }

    private static String ok(String str, ReporterConfig config) {
        return config.okPrefix() + str + config.okSuffix();
    }

    private static String bold(String str, ReporterConfig config) {
        return config.boldPrefix() + str + config.boldSuffix();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ExecutorService newWriterPool() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tally-report-writer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Forwards engine events to the builder. An event the builder rejects ends
     * the run with that error before it propagates back to the engine.
     */
    private static final class RunListener implements TestLifecycleListener {

        private final ReportModelBuilder builder;
        private final CompletableFuture<Void> result;

        RunListener(ReportModelBuilder builder, CompletableFuture<Void> result) {
            this.builder = builder;
            this.result = result;
        }

        @Override
        public void moduleStart(String name) {
            try {
                builder.moduleStart(name);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        }

        @Override
        public void testDone(String name, AssertionList assertions) {
            try {
                builder.testDone(name, assertions);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        }

        @Override
        public void done(AssertionList assertions) {
            try {
                builder.done(assertions);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        }
    }
}
