package io.scrapejobs.core;

import java.time.Instant;

/**
 * @param lastTickAt null until the first tick ran
 */
public record SchedulerStatus(
        boolean running,
        int activeJobCount,
        Instant lastTickAt
) {
}
