package io.tally.core.model;

import io.tally.api.assertion.Assertion;
import io.tally.api.assertion.AssertionList;
import io.tally.api.engine.TestLifecycleListener;
import io.tally.api.error.ReporterConfigurationException;
import io.tally.api.report.ModuleReport;
import io.tally.api.report.TestCaseReport;
import io.tally.core.metrics.ReporterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects lifecycle events of one run into one {@link ModuleReport} per module.
 * <p>
 * Tests are attributed to the most recently started module. Starting a module
 * under a name that was already seen replaces the earlier record. Once
 * {@link #done(AssertionList)} fires the model is frozen and handed to the
 * {@link CompletionHandler}; later events are rejected.
 */
public class ReportModelBuilder implements TestLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(ReportModelBuilder.class);

    private final Map<String, ModuleState> modules = new LinkedHashMap<>();
    private final FailureNormalizer normalizer;
    private final ReporterMetrics metrics;
    private final CompletionHandler completionHandler;

    private String currentModuleKey;
    private boolean finished;

    public ReportModelBuilder(CompletionHandler completionHandler) {
        this(new FailureNormalizer(), new ReporterMetrics(), completionHandler);
    }

    public ReportModelBuilder(FailureNormalizer normalizer, ReporterMetrics metrics,
                              CompletionHandler completionHandler) {
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.completionHandler = completionHandler;
    }

    @Override
    public synchronized void moduleStart(String name) {
        checkNotFinished();
        if (name == null) {
            throw new ReporterConfigurationException("Module name must not be null");
        }
        if (modules.containsKey(name)) {
            log.warn("Module '{}' started again, previous results are discarded", name);
        }
        modules.put(name, new ModuleState(name));
        currentModuleKey = name;
    }

    @Override
    public synchronized void testDone(String name, AssertionList assertions) {
        checkNotFinished();
        if (currentModuleKey == null) {
            throw new ReporterConfigurationException(
                    "Test '" + name + "' finished before any module started");
        }
        ModuleState module = modules.get(currentModuleKey);
        TestCaseReport testcase = TestCaseReport.passed(name);
        FailureKind kind = null;

        for (Assertion a : assertions) {
            if (a.failed()) {
                testcase = new TestCaseReport(name, normalizer.normalize(a));
                kind = FailureKind.of(a.error());
                break;
            }
        }

        module.record(testcase, kind);
        metrics.recordTest(kind);
    }

    @Override
    public void done(AssertionList assertions) {
        List<ModuleReport> reports;
        synchronized (this) {
            checkNotFinished();
            finished = true;
            reports = snapshot();
        }
        log.debug("Run finished: {} modules, {}", reports.size(), assertions);
        completionHandler.onRunComplete(reports, assertions);
    }

    /**
     * @return the module reports collected so far, in module start order
     */
    public synchronized List<ModuleReport> reports() {
        return snapshot();
    }

    private List<ModuleReport> snapshot() {
        List<ModuleReport> reports = new ArrayList<>(modules.size());
        modules.values().forEach(m -> reports.add(m.toReport()));
        return List.copyOf(reports);
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("Run already finished, no further events are accepted");
        }
    }

    /**
     * Receives the frozen model when the run is done.
     */
    @FunctionalInterface
    public interface CompletionHandler {

        void onRunComplete(List<ModuleReport> reports, AssertionList assertions);
    }

    private static final class ModuleState {

        private final String name;
        private final List<TestCaseReport> testcases = new ArrayList<>();
        private int errorCount;
        private int failureCount;
        private int tests;

        ModuleState(String name) {
            this.name = name;
        }

        void record(TestCaseReport testcase, FailureKind kind) {
            if (kind == FailureKind.FAILURE) {
                failureCount++;
            } else if (kind == FailureKind.ERROR) {
                errorCount++;
            }
            tests++;
            testcases.add(testcase);
        }

        ModuleReport toReport() {
            return new ModuleReport(name, errorCount, failureCount, tests, testcases);
        }
    }
}
