package io.scrapejobs.internal;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.RunOperation;
import io.scrapejobs.core.CallbackContext;
import io.scrapejobs.core.ExecutionReport;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.RunOutcome;
import io.scrapejobs.core.RunRequest;
import io.scrapejobs.core.RunResult;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScrapeJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class JobExecutorTest {

    private static final Instant NOW = Instant.parse("2024-05-06T23:30:00Z");

    private ExecutorService workers;
    private ScheduledThreadPoolExecutor retryTimer;
    private CallbackRunner callbackRunner;
    private final List<RunHistoryEntry> recorded = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(2);
        retryTimer = new ScheduledThreadPoolExecutor(1);
        callbackRunner = mock(CallbackRunner.class);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        retryTimer.shutdownNow();
    }

    @Test
    void successfulRunShouldProduceSingleSuccessEntry() throws Exception {
        List<RunRequest> requests = new CopyOnWriteArrayList<>();
        ScrapeJob job = job(0, 0);
        job.setOutputFormatOverride("csv");

        ExecutionReport report = run(executor(req -> {
            requests.add(req);
            return RunResult.succeeded();
        }), job);

        assertEquals(RunOutcome.SUCCESS, report.outcome());
        assertEquals(1, report.attemptCount());
        assertNull(report.errorSummary());
        assertEquals(1, recorded.size());
        assertEquals(new RunRequest("job-1", "shop", "csv", null, 1), requests.get(0));
    }

    @Test
    void maxRetriesShouldBoundAttemptsToRetriesPlusOne() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        ExecutionReport report = run(executor(req -> {
            calls.incrementAndGet();
            return RunResult.failed("HTTP 503");
        }), job(2, 0));

        assertEquals(RunOutcome.FAILURE, report.outcome());
        assertEquals(3, calls.get());
        assertEquals(3, report.attemptCount());
        for (int i = 0; i < 3; i++) {
            RunHistoryEntry entry = report.attempts().get(i);
            assertEquals(i + 1, entry.attemptNumber());
            assertEquals(RunOutcome.FAILURE, entry.outcome());
            assertEquals("HTTP 503", entry.errorSummary());
        }
        assertEquals("HTTP 503", report.errorSummary());
        assertEquals(report.attempts(), recorded);
    }

    @Test
    void retryShouldStopAtFirstSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        ExecutionReport report = run(executor(req ->
                calls.incrementAndGet() == 1 ? RunResult.failed("flaky") : RunResult.succeeded()), job(3, 0));

        assertEquals(RunOutcome.SUCCESS, report.outcome());
        assertEquals(2, calls.get());
        assertEquals(RunOutcome.FAILURE, report.attempts().get(0).outcome());
        assertEquals(RunOutcome.SUCCESS, report.attempts().get(1).outcome());
    }

    @Test
    void thrownExceptionsAndNullResultsShouldBecomeFailures() throws Exception {
        ExecutionReport thrown = run(executor(req -> {
            throw new IllegalStateException("selector not found");
        }), job(0, 0));
        ExecutionReport empty = run(executor(req -> null), job(0, 0));
        ExecutionReport blank = run(executor(req -> RunResult.failed(" ")), job(0, 0));

        assertEquals("IllegalStateException: selector not found", thrown.errorSummary());
        assertEquals("run operation returned no result", empty.errorSummary());
        assertEquals("run failed", blank.errorSummary());
    }

    @Test
    void longErrorsShouldBeTruncated() throws Exception {
        ExecutionReport report = run(executor(req -> RunResult.failed("x".repeat(2000))), job(0, 0));

        assertEquals(500, report.errorSummary().length());
    }

    @Test
    void outputPathShouldResolveDateOnceForAllAttempts() throws Exception {
        List<RunRequest> requests = new CopyOnWriteArrayList<>();
        ScrapeJob job = job(1, 0);
        job.setOutputPathOverride("/out/shop-{date}.json");

        run(executor(req -> {
            requests.add(req);
            return RunResult.failed("nope");
        }), job);

        assertEquals(2, requests.size());
        assertEquals("/out/shop-2024-05-06.json", requests.get(0).outputPath());
        assertEquals("/out/shop-2024-05-06.json", requests.get(1).outputPath());
        assertEquals(2, requests.get(1).attemptNumber());
    }

    @Test
    void failureCallbackShouldFireOnceAndNotChangeOutcome() throws Exception {
        ScrapeJob job = job(1, 0);
        job.setOnSuccess("notify ok");
        job.setOnFailure("notify fail");
        doThrow(new IllegalStateException("callback exploded")).when(callbackRunner).fire(anyString(), any());

        ExecutionReport report = run(executor(req -> RunResult.failed("HTTP 500")), job);

        assertEquals(RunOutcome.FAILURE, report.outcome());
        ArgumentCaptor<CallbackContext> ctx = ArgumentCaptor.forClass(CallbackContext.class);
        verify(callbackRunner).fire(eq("notify fail"), ctx.capture());
        verify(callbackRunner, never()).fire(eq("notify ok"), any());
        assertEquals(2, ctx.getValue().attempts());
        assertEquals("HTTP 500", ctx.getValue().errorSummary());
        assertEquals(RunOutcome.FAILURE, ctx.getValue().outcome());
    }

    @Test
    void cancelDuringRetryDelayShouldFinishWithCancelledEntry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        JobExecution execution = executor(req -> {
            calls.incrementAndGet();
            return RunResult.failed("down");
        }).execute(job(1, 60), recorded::add);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> retryTimer.getQueue().size() == 1));
        execution.cancel();
        ExecutionReport report = execution.result().get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
        assertEquals(RunOutcome.FAILURE, report.outcome());
        assertEquals(2, report.attemptCount());
        assertEquals(2, report.attempts().get(1).attemptNumber());
        assertEquals(RunHistoryEntry.CANCELLED, report.errorSummary());
        assertTrue(execution.isCancelled());
    }

    @Test
    void cancelShouldInterruptRunningAttemptWithoutRetry() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        JobExecution execution = executor(req -> {
            calls.incrementAndGet();
            started.countDown();
            Thread.sleep(TimeUnit.MINUTES.toMillis(5));
            return RunResult.succeeded();
        }).execute(job(3, 0), recorded::add);

        assertTrue(started.await(5, TimeUnit.SECONDS));
        execution.cancel();
        ExecutionReport report = execution.result().get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
        assertEquals(1, report.attemptCount());
        assertEquals(RunHistoryEntry.CANCELLED, report.errorSummary());
    }

    private JobExecutor executor(RunOperation operation) {
        return new JobExecutor(operation, callbackRunner, workers, retryTimer,
                Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private ExecutionReport run(JobExecutor executor, ScrapeJob job) throws Exception {
        recorded.clear();
        return executor.execute(job, recorded::add).result().get(10, TimeUnit.SECONDS);
    }

    private static ScrapeJob job(int maxRetries, int retryDelaySeconds) {
        ScrapeJob job = new ScrapeJob();
        job.setId("job-1");
        job.setConfigName("shop");
        job.setSchedule(new ScheduleSpec.Daily(LocalTime.of(9, 0)));
        job.setMaxRetries(maxRetries);
        job.setRetryDelaySeconds(retryDelaySeconds);
        return job;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
