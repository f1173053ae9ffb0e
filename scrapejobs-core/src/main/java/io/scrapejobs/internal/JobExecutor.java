package io.scrapejobs.internal;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.RunOperation;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.ScrapeJob;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Runs one due occurrence of a job: invokes the {@link RunOperation}, retries failed attempts after
 * {@code retryDelaySeconds} and fires the job's callback once the outcome is final.
 *
 * <p>Attempts run on {@code workers}; a retry delay is a {@link ScheduledExecutorService} timer, so
 * a job waiting to retry holds no worker thread.
 */
public class JobExecutor {
    final RunOperation runOperation;
    final CallbackRunner callbackRunner;
    final Executor workers;
    final ScheduledExecutorService retryTimer;
    final Clock clock;
    final ZoneId zone;

    public JobExecutor(
            RunOperation runOperation,
            CallbackRunner callbackRunner,
            Executor workers,
            ScheduledExecutorService retryTimer,
            Clock clock,
            ZoneId zone
    ) {
        this.runOperation = Objects.requireNonNull(runOperation, "runOperation must not be null");
        this.callbackRunner = Objects.requireNonNull(callbackRunner, "callbackRunner must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.retryTimer = Objects.requireNonNull(retryTimer, "retryTimer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Starts executing {@code job} asynchronously.
     *
     * @param attemptListener called with each attempt's history entry as soon as the attempt ends,
     *                        in attempt order
     */
    public JobExecution execute(ScrapeJob job, Consumer<RunHistoryEntry> attemptListener) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(attemptListener, "attemptListener must not be null");
        JobExecution execution = new JobExecution(this, job, attemptListener);
        execution.begin();
        return execution;
    }
}
