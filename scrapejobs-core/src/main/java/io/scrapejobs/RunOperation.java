package io.scrapejobs;

import io.scrapejobs.core.RunRequest;
import io.scrapejobs.core.RunResult;

/**
 * Runs a named scrape configuration. Supplied by the application; the scheduler treats it as opaque.
 *
 * <p>Throwing and returning {@link RunResult#failed(String)} are equivalent: both count as a failed,
 * retryable attempt. Implementations that can be aborted should honor thread interruption.
 */
@FunctionalInterface
public interface RunOperation {
    RunResult run(RunRequest request) throws Exception;
}
