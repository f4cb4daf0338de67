package io.tally.core.replay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One line of a recorded event log.
 *
 * @param event      {@code moduleStart}, {@code testDone} or {@code done}
 * @param name       module or test name
 * @param assertions assertions of a {@code testDone} event
 * @param duration   run duration of a {@code done} event, in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventRecord(String event, String name, List<AssertionRecord> assertions, Long duration) {

    public static final String MODULE_START = "moduleStart";
    public static final String TEST_DONE = "testDone";
    public static final String DONE = "done";

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AssertionRecord(boolean failed, String message, ErrorRecord error) {}

    /**
     * @param kind     {@code assertion} for expectation mismatches, anything else for errors
     * @param operator comparison operator; together with actual/expected marks a structured mismatch
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorRecord(String kind, String type, String message, String stack,
                              Object actual, Object expected, String operator) {

        public boolean isAssertion() {
            return "assertion".equalsIgnoreCase(kind);
        }
    }
}
