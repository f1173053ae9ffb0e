package io.scrapejobs.core;

import java.time.Instant;
import java.util.List;

/**
 * Final result of executing one due occurrence, retries included.
 *
 * @param errorSummary error of the last attempt; null on success
 */
public record ExecutionReport(
        String jobId,
        RunOutcome outcome,
        List<RunHistoryEntry> attempts,
        String errorSummary,
        Instant startedAt,
        Instant finishedAt
) {
    public ExecutionReport {
        attempts = List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    public boolean succeeded() {
        return outcome == RunOutcome.SUCCESS;
    }
}
