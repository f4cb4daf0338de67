package io.tally.api.report;

import java.util.List;

/**
 * Finalized results of one test module, serialized into one XML file.
 * Test cases are kept in completion order.
 */
public record ModuleReport(
        String name,
        int errorCount,
        int failureCount,
        int tests,
        List<TestCaseReport> testcases
) {

    public ModuleReport {
        if (name == null) {
            throw new IllegalArgumentException("Module name must not be null");
        }
        if (errorCount < 0 || failureCount < 0 || tests < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (errorCount + failureCount > tests) {
            throw new IllegalArgumentException(
                    "errors + failures (" + (errorCount + failureCount) + ") exceed tests (" + tests + ")");
        }
        testcases = List.copyOf(testcases);
    }
}
