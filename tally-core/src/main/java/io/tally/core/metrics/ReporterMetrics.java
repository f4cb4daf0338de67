package io.tally.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tally.core.model.FailureKind;

import java.time.Duration;

/**
 * Micrometer meters for reporter runs.
 * Counts test outcomes by category and times every report file written.
 */
public class ReporterMetrics {

    public static final String TESTS = "tally.tests";
    public static final String REPORTS_WRITTEN = "tally.reports.written";
    public static final String REPORT_WRITE_TIME = "tally.report.write.time";

    private final MeterRegistry registry;
    private final Counter passed;
    private final Counter failures;
    private final Counter errors;
    private final Counter reportsWritten;
    private final Timer writeTimer;

    public ReporterMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ReporterMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.passed = testCounter("passed");
        this.failures = testCounter("failure");
        this.errors = testCounter("error");
        this.reportsWritten = Counter.builder(REPORTS_WRITTEN)
                .description("Report files written")
                .register(registry);
        this.writeTimer = Timer.builder(REPORT_WRITE_TIME)
                .description("Time to render and write one report file")
                .register(registry);
    }

    /**
     * @param kind category of the test's failure, null when the test passed
     */
    public void recordTest(FailureKind kind) {
        if (kind == null) {
            passed.increment();
        } else if (kind == FailureKind.FAILURE) {
            failures.increment();
        } else {
            errors.increment();
        }
    }

    public void recordReportWritten(Duration duration) {
        writeTimer.record(duration);
        reportsWritten.increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter testCounter(String outcome) {
        return Counter.builder(TESTS)
                .tag("outcome", outcome)
                .register(registry);
    }
}
