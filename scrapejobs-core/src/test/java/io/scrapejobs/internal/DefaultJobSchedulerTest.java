package io.scrapejobs.internal;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.JobStore;
import io.scrapejobs.RunOperation;
import io.scrapejobs.config.ScrapeJobsProperties;
import io.scrapejobs.core.ExecutionReport;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.RunOutcome;
import io.scrapejobs.core.RunResult;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.internal.file.FileJobStore;
import io.scrapejobs.utils.ScheduleCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class DefaultJobSchedulerTest {

    @TempDir
    Path dir;

    private FileJobStore store;
    private ScrapeJobsProperties props;
    private final ScheduleCalculator calculator = new ScheduleCalculator(ZoneOffset.UTC);
    private final CallbackRunner callbackRunner = mock(CallbackRunner.class);
    private final List<DefaultJobScheduler> schedulers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new FileJobStore(dir);
        props = new ScrapeJobsProperties();
        props.setProcessEvery(Duration.ofHours(1));
        props.setMaxConcurrency(2);
        props.setForceStopTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        for (DefaultJobScheduler s : schedulers) {
            s.stop(true);
        }
    }

    @Test
    void secondStartShouldBeRejected() {
        DefaultJobScheduler scheduler = scheduler(req -> RunResult.succeeded());
        DefaultJobScheduler rival = scheduler(req -> RunResult.succeeded());

        assertTrue(scheduler.start());
        assertFalse(scheduler.start());
        assertFalse(rival.start(), "the store lock belongs to the first scheduler");
        assertTrue(scheduler.status().running());
    }

    @Test
    void tickShouldRequireRunningScheduler() {
        DefaultJobScheduler scheduler = scheduler(req -> RunResult.succeeded());

        assertThrows(IllegalStateException.class, scheduler::tick);
    }

    @Test
    void jobStillRunningShouldNotBeDispatchedAgain() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        DefaultJobScheduler scheduler = startedScheduler(req -> {
            calls.incrementAndGet();
            release.await();
            return RunResult.succeeded();
        });
        store.create(job("slow", new ScheduleSpec.Hourly(0), Instant.now().minusSeconds(30), 0));

        scheduler.tick();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> calls.get() == 1));
        scheduler.tick();
        scheduler.tick();

        assertEquals(1, calls.get());
        assertEquals(JobStatus.RUNNING, store.get("slow").orElseThrow().getStatus());
        assertEquals(1, scheduler.status().activeJobCount());

        release.countDown();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status("slow") == JobStatus.PENDING));
        ScrapeJob done = store.get("slow").orElseThrow();
        assertEquals(1, done.getHistory().size());
        assertEquals(1, done.getRunCount());
        assertTrue(done.getNextRun().isAfter(done.getLastRun()));
    }

    @Test
    void pastOnceJobShouldRunOnceAndComplete() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DefaultJobScheduler scheduler = startedScheduler(req -> {
            calls.incrementAndGet();
            return RunResult.succeeded();
        });
        ScheduleSpec.Once spec = new ScheduleSpec.Once(LocalDate.of(2020, 1, 1), LocalTime.of(8, 0));
        store.create(job("once", spec, calculator.onceInstant(spec), 0));

        scheduler.tick();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status("once") == JobStatus.COMPLETED));
        scheduler.tick();
        ScrapeJob job = store.get("once").orElseThrow();
        assertNull(job.getNextRun());
        assertEquals(RunOutcome.SUCCESS, job.getLastOutcome());
        assertEquals(1, calls.get());
    }

    @Test
    void failingJobShouldRecordEveryAttemptAndStayScheduled() throws Exception {
        DefaultJobScheduler scheduler = startedScheduler(req -> RunResult.failed("HTTP 503"));
        store.create(job("flaky", new ScheduleSpec.Daily(LocalTime.of(3, 0)), Instant.now().minusSeconds(5), 2));

        scheduler.tick();

        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> status("flaky") == JobStatus.PENDING && !store.get("flaky").orElseThrow().getHistory().isEmpty()));
        ScrapeJob job = store.get("flaky").orElseThrow();
        assertEquals(3, job.getHistory().size());
        assertEquals(List.of(1, 2, 3), attemptNumbers(job.getHistory()));
        assertEquals(RunOutcome.FAILURE, job.getLastOutcome());
        assertEquals("HTTP 503", job.getLastError());
        assertEquals(0, job.getRunCount());
        assertTrue(job.getNextRun().isAfter(Instant.now()));
    }

    @Test
    void disabledRecurringJobShouldBeAdvancedWithoutRunning() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DefaultJobScheduler scheduler = startedScheduler(req -> {
            calls.incrementAndGet();
            return RunResult.succeeded();
        });
        ScrapeJob disabled = job("off", new ScheduleSpec.Hourly(30), Instant.now().minusSeconds(7200), 0);
        disabled.setEnabled(false);
        store.create(disabled);

        scheduler.tick();

        ScrapeJob job = store.get("off").orElseThrow();
        assertEquals(0, calls.get());
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertTrue(job.getNextRun().isAfter(Instant.now().minusSeconds(1)));
        assertTrue(job.getHistory().isEmpty());
    }

    @Test
    void startShouldRecoverOrphanedJobs() throws Exception {
        ScrapeJob orphan = job("orphan", new ScheduleSpec.Daily(LocalTime.of(9, 0)), Instant.now().minusSeconds(600), 0);
        orphan.setStatus(JobStatus.RUNNING);
        orphan.setRunningSince(Instant.now().minusSeconds(600));
        store.create(orphan);

        DefaultJobScheduler scheduler = scheduler(req -> RunResult.succeeded());
        assertTrue(scheduler.start());

        ScrapeJob job = store.get("orphan").orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(1, job.getHistory().size());
        assertEquals(RunHistoryEntry.INTERRUPTED, job.getHistory().get(0).errorSummary());
        assertTrue(job.getNextRun().isAfter(Instant.now()));
    }

    @Test
    void forceStopShouldCancelRunningJobs() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        DefaultJobScheduler scheduler = startedScheduler(req -> {
            started.countDown();
            Thread.sleep(TimeUnit.MINUTES.toMillis(5));
            return RunResult.succeeded();
        });
        store.create(job("stuck", new ScheduleSpec.Daily(LocalTime.of(9, 0)), Instant.now().minusSeconds(5), 3));
        scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        long begin = System.nanoTime();
        scheduler.stop(true);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(tookMs < 5_000, "force stop took " + tookMs + "ms");
        assertFalse(scheduler.isRunning());
        ScrapeJob job = store.get("stuck").orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(1, job.getHistory().size());
        assertEquals(RunHistoryEntry.CANCELLED, job.getLastError());
    }

    @Test
    void outcomeWriteFailureShouldBeRetriedOnLaterTicks() throws Exception {
        FailingJobStore flaky = new FailingJobStore(store);
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T09:00:30Z"), ZoneOffset.UTC);
        AtomicInteger calls = new AtomicInteger();
        // the attempt write and the outcome write each use up every retry
        DefaultJobScheduler scheduler = startedScheduler(flaky, clock, req -> {
            calls.incrementAndGet();
            flaky.failNextModifies(2 * props.getStorageRetryAttempts());
            return RunResult.succeeded();
        });
        store.create(job("hourly", new ScheduleSpec.Hourly(0), Instant.parse("2024-01-01T09:00:00Z"), 0));

        scheduler.tick();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> calls.get() == 1 && flaky.failuresLeft() == 0));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> scheduler.status().activeJobCount() == 0));
        assertEquals(JobStatus.RUNNING, status("hourly"));
        assertTrue(store.get("hourly").orElseThrow().getHistory().isEmpty());

        scheduler.tick();

        ScrapeJob job = store.get("hourly").orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), job.getNextRun());
        assertEquals(RunOutcome.SUCCESS, job.getLastOutcome());
        assertEquals(1, job.getRunCount());
        assertEquals(1, job.getHistory().size());
        assertEquals(RunOutcome.SUCCESS, job.getHistory().get(0).outcome());
        assertEquals(1, calls.get());
    }

    @Test
    void storeFailureOnOneJobShouldNotStopOthersInSameTick() throws Exception {
        FailingJobStore flaky = new FailingJobStore(store);
        Set<String> ran = ConcurrentHashMap.newKeySet();
        DefaultJobScheduler scheduler = startedScheduler(flaky, Clock.systemUTC(), req -> {
            ran.add(req.jobId());
            return RunResult.succeeded();
        });
        flaky.breakModifiesOf("broken");
        store.create(job("broken", new ScheduleSpec.Hourly(0), Instant.now().minusSeconds(60), 0));
        store.create(job("healthy", new ScheduleSpec.Hourly(0), Instant.now().minusSeconds(30), 0));

        scheduler.tick();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> store.get("healthy").orElseThrow().getRunCount() == 1));
        assertEquals(Set.of("healthy"), ran);
        assertEquals(props.getStorageRetryAttempts(), flaky.modifyCalls("broken"));
        assertEquals(JobStatus.PENDING, status("broken"));
        assertTrue(store.get("broken").orElseThrow().getHistory().isEmpty());

        flaky.heal("broken");
        scheduler.tick();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> store.get("broken").orElseThrow().getRunCount() == 1));
        assertEquals(Set.of("healthy", "broken"), ran);
    }

    @Test
    void gracefulStopShouldWaitForRunningJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DefaultJobScheduler scheduler = startedScheduler(req -> {
            started.countDown();
            release.await();
            return RunResult.succeeded();
        });
        store.create(job("long", new ScheduleSpec.Daily(LocalTime.of(9, 0)), Instant.now().minusSeconds(5), 0));
        scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Thread stopper = new Thread(() -> scheduler.stop(false));
        stopper.start();
        Thread.sleep(300);
        assertTrue(stopper.isAlive(), "stop(false) returned while the job was still running");
        assertEquals(JobStatus.RUNNING, status("long"));

        release.countDown();
        stopper.join(5_000);

        assertFalse(stopper.isAlive());
        assertFalse(scheduler.isRunning());
        ScrapeJob job = store.get("long").orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(RunOutcome.SUCCESS, job.getLastOutcome());
        assertEquals(1, job.getHistory().size());
    }

    @Test
    void gracefulStopShouldLetWaitingRetryFinish() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DefaultJobScheduler scheduler = startedScheduler(req ->
                calls.incrementAndGet() == 1 ? RunResult.failed("HTTP 502") : RunResult.succeeded());
        ScrapeJob retrying = job("retry", new ScheduleSpec.Daily(LocalTime.of(9, 0)), Instant.now().minusSeconds(5), 1);
        retrying.setRetryDelaySeconds(1);
        store.create(retrying);
        scheduler.tick();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> store.get("retry").orElseThrow().getHistory().size() == 1));

        scheduler.stop(false);

        assertEquals(2, calls.get());
        ScrapeJob job = store.get("retry").orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(List.of(1, 2), attemptNumbers(job.getHistory()));
        assertEquals(RunOutcome.SUCCESS, job.getLastOutcome());
        assertNull(job.getLastError());
    }

    @Test
    void cancelRequestedBeforeExecutionIsAttachedShouldStillCancelIt() throws Exception {
        ExecutorService workers = Executors.newSingleThreadExecutor();
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            JobExecutor executor = new JobExecutor(req -> {
                release.await();
                return RunResult.succeeded();
            }, callbackRunner, workers, timer, Clock.systemUTC(), ZoneOffset.UTC);
            DefaultJobScheduler.InFlight slot = new DefaultJobScheduler.InFlight(null);

            slot.cancel();
            JobExecution execution = executor.execute(
                    job("late", new ScheduleSpec.Hourly(0), Instant.now(), 0), entry -> {
                    });
            slot.attach(execution);

            assertTrue(execution.isCancelled());
            ExecutionReport report = execution.result().get(5, TimeUnit.SECONDS);
            assertEquals(RunOutcome.FAILURE, report.outcome());
            assertEquals(RunHistoryEntry.CANCELLED, report.errorSummary());
        } finally {
            release.countDown();
            workers.shutdownNow();
            timer.shutdownNow();
        }
    }

    @Test
    void restartShouldAllowStartingAgain() {
        DefaultJobScheduler scheduler = startedScheduler(req -> RunResult.succeeded());

        scheduler.stop(false);
        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.start());
        assertTrue(scheduler.restart());
        assertTrue(scheduler.isRunning());
    }

    private DefaultJobScheduler scheduler(RunOperation operation) {
        return scheduler(store, Clock.systemUTC(), operation);
    }

    private DefaultJobScheduler scheduler(JobStore jobStore, Clock clock, RunOperation operation) {
        DefaultJobScheduler scheduler = new DefaultJobScheduler(props, jobStore, operation, callbackRunner, calculator, clock);
        schedulers.add(scheduler);
        return scheduler;
    }

    private DefaultJobScheduler startedScheduler(RunOperation operation) {
        return startedScheduler(store, Clock.systemUTC(), operation);
    }

    // Started and past its initial poller tick, so the test drives every further tick itself.
    private DefaultJobScheduler startedScheduler(JobStore jobStore, Clock clock, RunOperation operation) {
        DefaultJobScheduler scheduler = scheduler(jobStore, clock, operation);
        assertTrue(scheduler.start());
        try {
            assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> scheduler.status().lastTickAt() != null));
            // waits for the poller's tick to finish
            scheduler.tick();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return scheduler;
    }

    private JobStatus status(String id) {
        return store.get(id).orElseThrow().getStatus();
    }

    private static ScrapeJob job(String id, ScheduleSpec schedule, Instant nextRun, int maxRetries) {
        ScrapeJob job = new ScrapeJob();
        job.setId(id);
        job.setConfigName("shop");
        job.setSchedule(schedule);
        job.setNextRun(nextRun);
        job.setMaxRetries(maxRetries);
        job.setRetryDelaySeconds(0);
        return job;
    }

    private static List<Integer> attemptNumbers(List<RunHistoryEntry> history) {
        List<Integer> numbers = new ArrayList<>();
        for (RunHistoryEntry e : history) {
            numbers.add(e.attemptNumber());
        }
        return numbers;
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
