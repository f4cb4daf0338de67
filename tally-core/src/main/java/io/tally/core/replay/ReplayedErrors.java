package io.tally.core.replay;

import io.tally.api.assertion.AssertionMismatchError;
import io.tally.api.assertion.ExternalError;
import io.tally.core.replay.EventRecord.ErrorRecord;

/**
 * Rebuilds throwables from recorded errors, keeping the recorded type name and stack text.
 */
final class ReplayedErrors {

    private ReplayedErrors() {}

    static Throwable from(ErrorRecord record) {
        if (record == null) {
            return null;
        }
        if (record.isAssertion()) {
            if (record.operator() != null) {
                return new ReplayedMismatch(record);
            }
            return new ReplayedAssertion(record);
        }
        return new ReplayedError(record);
    }

    private static String recordedTypeName(ErrorRecord record, String fallback) {
        return record.type() != null ? record.type() : fallback;
    }

    static final class ReplayedError extends RuntimeException implements ExternalError {

        private final String typeName;
        private final String stack;

        ReplayedError(ErrorRecord record) {
            super(record.message(), null, false, false);
            this.typeName = recordedTypeName(record, "Error");
            this.stack = record.stack();
        }

        @Override
        public String typeName() { return typeName; }

        @Override
        public String stack() { return stack; }
    }

    static final class ReplayedAssertion extends AssertionError implements ExternalError {

        private final String typeName;
        private final String stack;

        ReplayedAssertion(ErrorRecord record) {
            super(record.message(), null);
            this.typeName = recordedTypeName(record, "AssertionError");
            this.stack = record.stack();
        }

        @Override
        public String typeName() { return typeName; }

        @Override
        public String stack() { return stack; }
    }

    static final class ReplayedMismatch extends AssertionMismatchError implements ExternalError {

        private final String typeName;
        private final String stack;

        ReplayedMismatch(ErrorRecord record) {
            super(record.message(), record.actual(), record.expected(), record.operator());
            this.typeName = recordedTypeName(record, "AssertionError");
            this.stack = record.stack();
        }

        @Override
        public String typeName() { return typeName; }

        @Override
        public String stack() { return stack; }
    }
}
