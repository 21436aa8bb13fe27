package com.di.logsift.ingest;

/**
 * Result of parsing one raw input line. Expected problems (filtered or malformed lines) are
 * reported here instead of being thrown.
 */
public record LineOutcome(Status status, String id, RawLogRecord record, String reason) {

    public enum Status {
        /** Empty after stripping; not counted anywhere. */
        BLANK,
        /** Rejected by the admission token filter or the level/exception check. */
        SKIPPED_SAFE,
        /** Not a JSON object, or extraction failed. */
        MALFORMED,
        ACCEPTED
    }

    private static final LineOutcome BLANK_LINE = new LineOutcome(Status.BLANK, null, null, null);
    private static final LineOutcome SKIPPED = new LineOutcome(Status.SKIPPED_SAFE, null, null, null);

    public static LineOutcome blank() {
        return BLANK_LINE;
    }

    public static LineOutcome skipped() {
        return SKIPPED;
    }

    public static LineOutcome malformed(String reason) {
        return new LineOutcome(Status.MALFORMED, null, null, reason);
    }

    public static LineOutcome accepted(String id, RawLogRecord record) {
        return new LineOutcome(Status.ACCEPTED, id, record, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
