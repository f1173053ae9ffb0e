package io.scrapejobs.internal;

import io.scrapejobs.core.CallbackContext;
import io.scrapejobs.core.ExecutionReport;
import io.scrapejobs.core.JobExecutionException;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.RunOutcome;
import io.scrapejobs.core.RunRequest;
import io.scrapejobs.core.RunResult;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.OutputPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle on one in-flight occurrence. Completes exactly once, after the callback has been fired.
 */
public final class JobExecution {
    private static final Logger log = LoggerFactory.getLogger(JobExecution.class);
    private static final int MAX_ERROR_SUMMARY = 500;

    private final JobExecutor executor;
    private final Consumer<RunHistoryEntry> attemptListener;

    private final String jobId;
    private final String configName;
    private final String outputFormatOverride;
    private final String outputPathTemplate;
    private final int maxRetries;
    private final int retryDelaySeconds;
    private final String onSuccess;
    private final String onFailure;

    private final CompletableFuture<ExecutionReport> result = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final List<RunHistoryEntry> attempts = new ArrayList<>();

    // guarded by this
    private boolean cancelled;
    private Thread runner;
    private ScheduledFuture<?> pendingRetry;
    private int pendingAttempt;
    private Instant startedAt;
    private String outputPath;

    JobExecution(JobExecutor executor, ScrapeJob job, Consumer<RunHistoryEntry> attemptListener) {
        this.executor = executor;
        this.attemptListener = attemptListener;
        this.jobId = job.getId();
        this.configName = job.getConfigName();
        this.outputFormatOverride = job.getOutputFormatOverride();
        this.outputPathTemplate = job.getOutputPathOverride();
        this.maxRetries = Math.max(0, job.getMaxRetries());
        this.retryDelaySeconds = Math.max(0, job.getRetryDelaySeconds());
        this.onSuccess = job.getOnSuccess();
        this.onFailure = job.getOnFailure();
    }

    public String jobId() {
        return jobId;
    }

    public CompletableFuture<ExecutionReport> result() {
        return result;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Signals cancellation: interrupts a running attempt and drops a pending retry. A run operation
     * that ignores interruption still finishes; its attempt is recorded and no retry follows.
     */
    public void cancel() {
        int dropped = 0;
        synchronized (this) {
            if (cancelled || finished.get()) {
                return;
            }
            cancelled = true;
            if (runner != null) {
                runner.interrupt();
            }
            if (pendingRetry != null && pendingRetry.cancel(false)) {
                dropped = pendingAttempt;
                pendingRetry = null;
            }
        }
        log.info("Job execution cancelled jobId={}", jobId);
        if (dropped > 0) {
            finishCancelled(dropped);
        }
    }

    void begin() {
        submitAttempt(1);
    }

    private void submitAttempt(int attemptNumber) {
        try {
            executor.workers.execute(() -> runAttempt(attemptNumber));
        } catch (RejectedExecutionException e) {
            log.warn("Job attempt rejected by worker pool jobId={} attempt={}", jobId, attemptNumber);
            finishCancelled(attemptNumber);
        }
    }

    private void runAttempt(int attemptNumber) {
        RunRequest request;
        synchronized (this) {
            if (cancelled) {
                request = null;
            } else {
                runner = Thread.currentThread();
                Instant now = executor.clock.instant();
                if (startedAt == null) {
                    startedAt = now;
                    outputPath = OutputPaths.resolve(outputPathTemplate, LocalDate.ofInstant(now, executor.zone));
                }
                request = new RunRequest(jobId, configName, outputFormatOverride, outputPath, attemptNumber);
            }
        }
        if (request == null) {
            finishCancelled(attemptNumber);
            return;
        }

        Instant attemptStart = executor.clock.instant();
        log.debug("Job attempt started jobId={} config={} attempt={}", jobId, configName, attemptNumber);
        JobExecutionException failure = null;
        try {
            attempt(request);
        } catch (JobExecutionException e) {
            failure = e;
        } finally {
            synchronized (this) {
                runner = null;
            }
            // An interrupt that arrived after the run operation returned must not leak into the pool.
            Thread.interrupted();
        }
        Instant attemptEnd = executor.clock.instant();

        if (failure == null) {
            record(RunHistoryEntry.success(attemptNumber, attemptStart, attemptEnd));
            log.info("Job attempt succeeded jobId={} config={} attempt={}", jobId, configName, attemptNumber);
            finish(RunOutcome.SUCCESS, null);
            return;
        }

        String summary = summarize(failure);
        record(RunHistoryEntry.failure(attemptNumber, attemptStart, attemptEnd, summary));

        boolean stop;
        synchronized (this) {
            stop = cancelled;
        }
        if (stop) {
            log.warn("Job attempt failed after cancellation jobId={} attempt={} error={}", jobId, attemptNumber, summary);
            finish(RunOutcome.FAILURE, summary);
        } else if (attemptNumber <= maxRetries) {
            log.warn("Job attempt failed, retrying jobId={} attempt={} maxRetries={} retryDelaySeconds={} error={}",
                    jobId, attemptNumber, maxRetries, retryDelaySeconds, summary);
            scheduleRetry(attemptNumber + 1);
        } else {
            log.error("Job failed jobId={} config={} attempts={} error={}",
                    jobId, configName, attemptNumber, summary, failure);
            finish(RunOutcome.FAILURE, summary);
        }
    }

    private void attempt(RunRequest request) throws JobExecutionException {
        RunResult runResult;
        try {
            runResult = executor.runOperation.run(request);
        } catch (InterruptedException e) {
            throw new JobExecutionException(isCancelled() ? RunHistoryEntry.CANCELLED : RunHistoryEntry.INTERRUPTED, e);
        } catch (Exception e) {
            throw new JobExecutionException(describe(e), e);
        }
        if (runResult == null) {
            throw new JobExecutionException("run operation returned no result");
        }
        if (!runResult.success()) {
            String detail = runResult.errorDetail();
            throw new JobExecutionException(detail == null || detail.isBlank() ? "run failed" : detail);
        }
    }

    private void scheduleRetry(int nextAttempt) {
        if (retryDelaySeconds == 0) {
            submitAttempt(nextAttempt);
            return;
        }
        boolean scheduled = false;
        synchronized (this) {
            if (!cancelled) {
                try {
                    pendingAttempt = nextAttempt;
                    pendingRetry = executor.retryTimer.schedule(
                            () -> fireRetry(nextAttempt), retryDelaySeconds, TimeUnit.SECONDS);
                    scheduled = true;
                } catch (RejectedExecutionException e) {
                    log.warn("Job retry rejected by timer jobId={} attempt={}", jobId, nextAttempt);
                }
            }
        }
        if (!scheduled) {
            finishCancelled(nextAttempt);
        }
    }

    private void fireRetry(int attemptNumber) {
        synchronized (this) {
            pendingRetry = null;
        }
        submitAttempt(attemptNumber);
    }

    private void finishCancelled(int attemptNumber) {
        if (finished.get()) {
            return;
        }
        Instant now = executor.clock.instant();
        synchronized (this) {
            if (startedAt == null) {
                startedAt = now;
            }
        }
        record(RunHistoryEntry.failure(attemptNumber, now, now, RunHistoryEntry.CANCELLED));
        finish(RunOutcome.FAILURE, RunHistoryEntry.CANCELLED);
    }

    private void record(RunHistoryEntry entry) {
        synchronized (attempts) {
            attempts.add(entry);
        }
        try {
            attemptListener.accept(entry);
        } catch (RuntimeException e) {
            log.error("Failed to record attempt jobId={} attempt={} msg={}", jobId, entry.attemptNumber(), e.getMessage(), e);
        }
    }

    private void finish(RunOutcome outcome, String errorSummary) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        List<RunHistoryEntry> snapshot;
        synchronized (attempts) {
            snapshot = List.copyOf(attempts);
        }
        Instant begin;
        synchronized (this) {
            begin = startedAt;
        }
        Instant end = executor.clock.instant();

        String command = outcome == RunOutcome.SUCCESS ? onSuccess : onFailure;
        if (command != null && !command.isBlank()) {
            try {
                executor.callbackRunner.fire(command,
                        new CallbackContext(jobId, configName, outcome, snapshot.size(), errorSummary));
            } catch (RuntimeException e) {
                log.warn("Job callback failed jobId={} outcome={} msg={}", jobId, outcome.value(), e.getMessage(), e);
            }
        }

        result.complete(new ExecutionReport(jobId, outcome, snapshot, errorSummary, begin == null ? end : begin, end));
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }

    private static String summarize(JobExecutionException e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "run failed";
        }
        return msg.length() > MAX_ERROR_SUMMARY ? msg.substring(0, MAX_ERROR_SUMMARY) : msg;
    }
}
