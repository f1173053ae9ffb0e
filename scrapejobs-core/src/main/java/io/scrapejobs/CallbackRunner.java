package io.scrapejobs;

import io.scrapejobs.core.CallbackContext;

/**
 * Fire-and-forget dispatch of a job's {@code onSuccess}/{@code onFailure} command.
 * Implementations must not throw; the result never affects the job's outcome.
 */
public interface CallbackRunner {
    void fire(String command, CallbackContext context);
}
