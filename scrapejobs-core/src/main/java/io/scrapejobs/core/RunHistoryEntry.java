package io.scrapejobs.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One execution attempt. Entries are appended to a job's history and never changed afterwards.
 *
 * @param attemptNumber 1 for the first attempt of an occurrence, incremented per retry
 * @param errorSummary  null on success
 */
public record RunHistoryEntry(
        int attemptNumber,
        Instant startedAt,
        Instant finishedAt,
        RunOutcome outcome,
        String errorSummary
) {
    public static final String INTERRUPTED = "interrupted";
    public static final String CANCELLED = "cancelled";

    public RunHistoryEntry {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static RunHistoryEntry success(int attemptNumber, Instant startedAt, Instant finishedAt) {
        return new RunHistoryEntry(attemptNumber, startedAt, finishedAt, RunOutcome.SUCCESS, null);
    }

    public static RunHistoryEntry failure(int attemptNumber, Instant startedAt, Instant finishedAt, String errorSummary) {
        return new RunHistoryEntry(attemptNumber, startedAt, finishedAt, RunOutcome.FAILURE, errorSummary);
    }

    public static RunHistoryEntry interrupted(int attemptNumber, Instant at) {
        return failure(attemptNumber, at, at, INTERRUPTED);
    }

    public boolean succeeded() {
        return outcome == RunOutcome.SUCCESS;
    }
}
