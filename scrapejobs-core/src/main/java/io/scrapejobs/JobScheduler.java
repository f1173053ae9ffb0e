package io.scrapejobs;

import io.scrapejobs.core.SchedulerStatus;

/**
 * The control loop that dispatches due jobs.
 */
public interface JobScheduler {

    /**
     * Runs recovery, then starts ticking.
     *
     * @return false if a scheduler was already running against the store
     */
    boolean start();

    /**
     * Stops dispatching. Graceful stop waits for in-flight runs; {@code force} cancels them and waits
     * at most the configured force-stop timeout.
     */
    void stop(boolean force);

    boolean isRunning();

    SchedulerStatus status();

    default boolean restart() {
        stop(false);
        return start();
    }
}
