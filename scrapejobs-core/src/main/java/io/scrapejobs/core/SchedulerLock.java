package io.scrapejobs.core;

/**
 * Held by the one scheduler allowed to run against a store.
 */
public interface SchedulerLock {

    SchedulerLock NONE = () -> {
    };

    void release();
}
