package io.scrapejobs.config;

import io.scrapejobs.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>The scheduler only starts with the context when {@code scrapejobs.auto-start=true}, but a
 * scheduler started any other way (e.g. {@code scheduler start}) is still stopped on shutdown.
 */
public class ScrapeJobsLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final boolean autoStartup;

    public ScrapeJobsLifecycle(JobScheduler scheduler, boolean autoStartup) {
        this.scheduler = scheduler;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop(false);
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
