package io.scrapejobs.internal;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.JobScheduler;
import io.scrapejobs.JobStore;
import io.scrapejobs.RunOperation;
import io.scrapejobs.config.ScrapeJobsProperties;
import io.scrapejobs.core.ExecutionReport;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.SchedulerLock;
import io.scrapejobs.core.SchedulerStatus;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls the {@link JobStore} for due jobs and hands them to a {@link JobExecutor}.
 *
 * <p>Threads:
 * <ul>
 *   <li>one poller thread ticking every {@code processEvery}</li>
 *   <li>a fixed pool of {@code maxConcurrency} workers running attempts</li>
 *   <li>one timer thread for retry delays</li>
 * </ul>
 *
 * <p>A job is claimed ({@code pending -> running}) in the store before it is handed to the
 * executor, and a job id already in flight is never dispatched again, so one job never runs twice
 * at the same time. The tick never waits for a job.
 *
 * <p>When the final outcome of a run cannot be written, the job keeps its in-flight slot with the
 * finished report, and every later tick tries the write again before it looks for due jobs.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobScheduler scheduler = new DefaultJobScheduler(props, store, runOperation, new ProcessCallbackRunner(),
 *         new ScheduleCalculator(), Clock.systemUTC());
 * scheduler.start();
 * ...
 * scheduler.stop(false);
 * }</pre>
 */
public class DefaultJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    private final ScrapeJobsProperties props;
    private final JobStore store;
    private final RunOperation runOperation;
    private final CallbackRunner callbackRunner;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final JobRecovery recovery;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ReentrantLock tickLock = new ReentrantLock();
    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private volatile Instant lastTickAt;
    private int systemErrorCount = 0;

    private ExecutorService workerPool;
    private ScheduledExecutorService retryTimer;
    private volatile JobExecutor executor;
    private SchedulerLock schedulerLock;
    private Thread pollerThread;

    /**
     * Slot of one dispatched job. A cancel request that comes before the execution is attached is
     * applied when it is attached.
     */
    static final class InFlight {
        private final Instant scheduledFor;
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        // attempt entries whose write failed, oldest first; guarded by this
        private final List<RunHistoryEntry> unrecorded = new ArrayList<>();
        private volatile ExecutionReport unsettled;
        // guarded by this
        private JobExecution execution;
        private boolean cancelRequested;

        InFlight(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
        }

        void attach(JobExecution e) {
            boolean cancelNow;
            synchronized (this) {
                execution = e;
                cancelNow = cancelRequested;
            }
            if (cancelNow) {
                e.cancel();
            }
        }

        void cancel() {
            JobExecution e;
            synchronized (this) {
                cancelRequested = true;
                e = execution;
            }
            if (e != null) {
                e.cancel();
            }
        }

        private synchronized List<RunHistoryEntry> pendingWith(RunHistoryEntry entry) {
            unrecorded.add(entry);
            return new ArrayList<>(unrecorded);
        }

        private synchronized List<RunHistoryEntry> pending() {
            return new ArrayList<>(unrecorded);
        }

        private synchronized void recorded(int count) {
            unrecorded.subList(0, count).clear();
        }
    }

    public DefaultJobScheduler(
            ScrapeJobsProperties props,
            JobStore store,
            RunOperation runOperation,
            CallbackRunner callbackRunner,
            ScheduleCalculator calculator,
            Clock clock
    ) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.runOperation = Objects.requireNonNull(runOperation, "runOperation must not be null");
        this.callbackRunner = Objects.requireNonNull(callbackRunner, "callbackRunner must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        props.validate();
        this.recovery = new JobRecovery(store, calculator, clock, props.getStorageRetryAttempts());
    }

    @Override
    public synchronized boolean start() {
        if (started.get()) {
            log.warn("Scheduler already running; start ignored");
            return false;
        }

        Optional<SchedulerLock> lock = store.tryLockScheduler();
        if (lock.isEmpty()) {
            log.warn("Another scheduler is already running against this job store; start ignored");
            return false;
        }
        schedulerLock = lock.get();

        log.info("Scheduler starting with processEvery={}, maxConcurrency={}, forceStopTimeout={}, zone={}",
                props.getProcessEvery(),
                props.getMaxConcurrency(),
                props.getForceStopTimeout(),
                calculator.zone());

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), threadFactory("scrapejobs.worker"));
        retryTimer = Executors.newSingleThreadScheduledExecutor(threadFactory("scrapejobs.retry"));
        executor = new JobExecutor(runOperation, callbackRunner, workerPool, retryTimer, clock, calculator.zone());

        try {
            recovery.recover();
        } catch (RuntimeException e) {
            log.error("Scheduler recovery failed msg={}", e.getMessage(), e);
        }

        started.set(true);
        systemErrorCount = 0;
        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("scrapejobs.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        log.info("Scheduler started successfully.");
        return true;
    }

    @Override
    public synchronized void stop(boolean force) {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Scheduler stopping force={} inFlight={}", force, inFlight.size());

        stopPoller();
        // a tick that was already past its start check finishes its dispatches first
        tickLock.lock();
        tickLock.unlock();

        List<InFlight> running = new ArrayList<>(inFlight.values());
        CompletableFuture<Void> all = CompletableFuture.allOf(
                running.stream().map(f -> f.done).toArray(CompletableFuture[]::new));
        try {
            if (force) {
                running.forEach(InFlight::cancel);
                all.get(props.getForceStopTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                all.get();
            }
        } catch (TimeoutException e) {
            log.warn("Scheduler force stop timed out after {}; {} job(s) did not observe cancellation",
                    props.getForceStopTimeout(), inFlight.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.forEach(InFlight::cancel);
        } catch (ExecutionException e) {
            log.error("Scheduler stop failed while waiting for jobs msg={}", e.getMessage(), e);
        }

        shutdownPools(force);
        settleUnsettled();
        if (!inFlight.isEmpty()) {
            log.warn("Scheduler stopped with {} unfinished or unsaved job(s); they are recovered on next start ids={}",
                    inFlight.size(), inFlight.keySet());
            inFlight.clear();
        }
        executor = null;

        if (schedulerLock != null) {
            schedulerLock.release();
            schedulerLock = null;
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public SchedulerStatus status() {
        int active = 0;
        for (InFlight slot : inFlight.values()) {
            if (slot.unsettled == null) {
                active++;
            }
        }
        return new SchedulerStatus(started.get(), active, lastTickAt);
    }

    /**
     * One pass over the due jobs. A failure on one job is logged and does not affect the others.
     */
    void tick() {
        tickLock.lock();
        try {
            if (executor == null) {
                throw new IllegalStateException("Scheduler is not running");
            }
            if (!started.get()) {
                return;
            }
            Instant now = nowInstant();
            lastTickAt = now;

            settleUnsettled();

            List<ScrapeJob> due = store.findDue(now);
            log.debug("Scheduler tick now={} due={} inFlight={}", now, due.size(), inFlight.size());

            for (ScrapeJob job : due) {
                String id = job.getId();
                if (inFlight.containsKey(id)) {
                    continue;
                }
                try {
                    if (job.isEnabled()) {
                        dispatch(id, now);
                    } else {
                        advanceDisabled(id, now);
                    }
                } catch (RuntimeException e) {
                    log.error("Scheduler failed to handle job id={} msg={}", id, e.getMessage(), e);
                }
            }
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private void dispatch(String id, Instant now) {
        int attempts = props.getStorageRetryAttempts();
        Optional<ScrapeJob> claimed = StorageRetry.call(attempts, "claim", id,
                () -> store.modify(id, j -> j.claim(now)));
        if (claimed.isEmpty()) {
            log.debug("Job no longer due, skipped id={}", id);
            return;
        }
        ScrapeJob job = claimed.get();
        Instant scheduledFor = job.getNextRun();

        InFlight slot = new InFlight(scheduledFor);
        inFlight.put(id, slot);
        log.info("Job dispatched id={} name={} config={} scheduledFor={}", id, job.displayName(), job.getConfigName(), scheduledFor);

        try {
            JobExecution execution = executor.execute(job, entry -> recordAttempt(id, slot, entry));
            slot.attach(execution);
            execution.result().whenComplete((report, error) -> {
                if (error != null) {
                    log.error("Job execution ended abnormally id={} msg={}", id, error.getMessage(), error);
                    inFlight.remove(id, slot);
                } else if (settle(id, slot, report)) {
                    inFlight.remove(id, slot);
                } else {
                    slot.unsettled = report;
                }
                slot.done.complete(null);
            });
        } catch (RuntimeException e) {
            inFlight.remove(id, slot);
            slot.done.complete(null);
            throw e;
        }
    }

    // Entries whose write failed are kept on the slot and written with the next attempt or the outcome.
    private void recordAttempt(String id, InFlight slot, RunHistoryEntry entry) {
        List<RunHistoryEntry> batch = slot.pendingWith(entry);
        try {
            StorageRetry.call(props.getStorageRetryAttempts(), "record attempt", id,
                    () -> store.modify(id, j -> {
                        batch.forEach(j::appendHistory);
                        return true;
                    }));
            slot.recorded(batch.size());
        } catch (RuntimeException e) {
            log.error("Failed to record attempt, kept for the outcome write id={} attempt={} unsaved={} msg={}",
                    id, entry.attemptNumber(), batch.size(), e.getMessage(), e);
        }
    }

    private void settleUnsettled() {
        for (Map.Entry<String, InFlight> e : inFlight.entrySet()) {
            InFlight slot = e.getValue();
            ExecutionReport report = slot.unsettled;
            if (report != null && settle(e.getKey(), slot, report)) {
                inFlight.remove(e.getKey(), slot);
            }
        }
    }

    /**
     * Writes the final outcome of a run.
     *
     * @return false if the write failed and has to be tried again
     */
    private boolean settle(String id, InFlight slot, ExecutionReport report) {
        Instant finishedAt = report.finishedAt();
        List<RunHistoryEntry> unrecorded = slot.pending();
        try {
            Optional<ScrapeJob> updated = StorageRetry.call(props.getStorageRetryAttempts(), "complete", id,
                    () -> store.modify(id, j -> {
                        if (j.getStatus() != JobStatus.RUNNING) {
                            return false;
                        }
                        unrecorded.forEach(j::appendHistory);
                        Instant base = laterOf(slot.scheduledFor, finishedAt);
                        Instant next = calculator.nextRunTime(j.getSchedule(), base).orElse(null);
                        j.completeOccurrence(report.outcome(), report.errorSummary(), finishedAt, next);
                        return true;
                    }));
            slot.recorded(unrecorded.size());
            if (updated.isEmpty()) {
                log.warn("Job finished but is no longer running in the store id={} outcome={}", id, report.outcome().value());
                return true;
            }
            ScrapeJob job = updated.get();
            log.info("Job finished id={} outcome={} attempts={} status={} nextRun={}",
                    id, report.outcome().value(), report.attemptCount(), job.getStatus().value(), job.getNextRun());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to persist job outcome, retrying on next tick id={} outcome={} msg={}",
                    id, report.outcome().value(), e.getMessage(), e);
            return false;
        }
    }

    // Disabled jobs keep their status; the next occurrence moves forward so re-enabling resumes from now.
    private void advanceDisabled(String id, Instant now) {
        StorageRetry.call(props.getStorageRetryAttempts(), "advance", id,
                () -> store.modify(id, j -> {
                    if (j.isEnabled()
                            || j.getStatus() == JobStatus.RUNNING
                            || j.getNextRun() == null
                            || j.getNextRun().isAfter(now)
                            || j.getSchedule() == null
                            || !j.getSchedule().isRecurring()) {
                        return false;
                    }
                    j.setNextRun(calculator.nextRunTime(j.getSchedule(), now).orElse(null));
                    log.debug("Disabled job skipped id={} nextRun={}", id, j.getNextRun());
                    return true;
                }));
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                tickIfRunning();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("scheduler tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void tickIfRunning() {
        tickLock.lock();
        try {
            if (started.get()) {
                tick();
            }
        } finally {
            tickLock.unlock();
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    // Interrupts the poller only between ticks so a store write is never interrupted.
    private void stopPoller() {
        Thread poller = pollerThread;
        pollerThread = null;
        if (poller == null) {
            return;
        }
        tickLock.lock();
        try {
            poller.interrupt();
        } finally {
            tickLock.unlock();
        }
        try {
            poller.join(props.getProcessEvery().toMillis() + 1_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void shutdownPools(boolean force) {
        if (retryTimer != null) {
            retryTimer.shutdownNow();
            retryTimer = null;
        }
        if (workerPool == null) {
            return;
        }
        if (force) {
            workerPool.shutdownNow();
            workerPool = null;
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(props.getForceStopTimeout().toSeconds(), TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        } finally {
            workerPool = null;
        }
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
