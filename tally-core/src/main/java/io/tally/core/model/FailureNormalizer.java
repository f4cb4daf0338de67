package io.tally.core.model;

import io.tally.api.assertion.Assertion;
import io.tally.api.assertion.AssertionMismatchError;
import io.tally.api.assertion.ExternalError;
import io.tally.api.report.Failure;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the reportable failure from a failed assertion.
 * <p>
 * For comparison failures the first line of the backtrace is replaced by
 * {@code Type: actual operator expected}, so CI tools show both sides without
 * opening the stack trace. Multi-line values put each part on its own line.
 */
public class FailureNormalizer {

    private static final Pattern FIRST_FRAME = Pattern.compile("\n[ \t]+at ");

    public Failure normalize(Assertion assertion) {
        Throwable error = assertion.error();
        String message = assertion.message();
        if (message == null && error != null) {
            message = error.getMessage();
        }
        if (error == null) {
            return new Failure(message, "", null);
        }

        String backtrace = backtraceOf(error);
        if (error instanceof AssertionMismatchError mismatch) {
            backtrace = withComparisonHeader(typeNameOf(error), mismatch, backtrace);
        }
        return new Failure(message, backtrace, simpleTypeNameOf(error));
    }

    static String backtraceOf(Throwable error) {
        if (error instanceof ExternalError external) {
            return external.stack() == null ? "" : external.stack();
        }
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString().replace(System.lineSeparator(), "\n").stripTrailing();
    }

    private static String withComparisonHeader(String typeName, AssertionMismatchError mismatch, String backtrace) {
        String actual = inspect(mismatch.actual());
        String expected = inspect(mismatch.expected());
        boolean multiline = actual.contains("\n") || expected.contains("\n");
        String spacing = multiline ? "\n" : " ";

        String header = typeName + ":" + spacing + actual + spacing + mismatch.operator() + spacing + expected;
        Matcher frames = FIRST_FRAME.matcher(backtrace);
        return frames.find() ? header + backtrace.substring(frames.start()) : header;
    }

    static String inspect(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "'" + value.toString().replace("'", "\\'") + "'";
        }
        if (value instanceof Object[] array) {
            return Arrays.deepToString(array);
        }
        if (value.getClass().isArray()) {
            return Arrays.deepToString(new Object[]{value}).replaceAll("^\\[|]$", "");
        }
        return String.valueOf(value).stripTrailing();
    }

    private static String typeNameOf(Throwable error) {
        if (error instanceof ExternalError external && external.typeName() != null) {
            return external.typeName();
        }
        return error.getClass().getName();
    }

    private static String simpleTypeNameOf(Throwable error) {
        if (error instanceof ExternalError external && external.typeName() != null) {
            return external.typeName();
        }
        return error.getClass().getSimpleName();
    }
}
