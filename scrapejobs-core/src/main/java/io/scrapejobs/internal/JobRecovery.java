package io.scrapejobs.internal;

import io.scrapejobs.JobStore;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.RecoveryReport;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Startup reconciliation. Jobs left {@code running} by a previous process go back to
 * {@code pending} with an "interrupted" history entry. Overdue jobs are left for the first tick,
 * which runs each of them once.
 */
public class JobRecovery {
    private static final Logger log = LoggerFactory.getLogger(JobRecovery.class);

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final int storageRetryAttempts;

    public JobRecovery(JobStore store, ScheduleCalculator calculator, Clock clock, int storageRetryAttempts) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.storageRetryAttempts = storageRetryAttempts;
    }

    public RecoveryReport recover() {
        Instant now = clock.instant();
        List<ScrapeJob> jobs = store.list();

        int orphans = 0;
        int overdue = 0;
        int failed = 0;
        for (ScrapeJob job : jobs) {
            String id = job.getId();
            try {
                if (job.getStatus() == JobStatus.RUNNING) {
                    Instant since = job.getRunningSince();
                    Optional<ScrapeJob> reset = StorageRetry.call(storageRetryAttempts, "recover", id,
                            () -> store.modify(id, j -> resetOrphan(j, now)));
                    if (reset.isPresent()) {
                        orphans++;
                        job = reset.get();
                        log.warn("Recovered orphaned job id={} config={} runningSince={} nextRun={}",
                                id, job.getConfigName(), since, job.getNextRun());
                    }
                }
                if (job.isDue(now)) {
                    overdue++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Recovery failed for job id={} msg={}", id, e.getMessage(), e);
            }
        }

        RecoveryReport report = new RecoveryReport(jobs.size(), orphans, overdue, failed);
        log.info("Recovery finished scanned={} orphansReset={} overdue={} failed={}",
                report.scanned(), report.orphansReset(), report.overdue(), report.failed());
        return report;
    }

    private boolean resetOrphan(ScrapeJob job, Instant now) {
        if (job.getStatus() != JobStatus.RUNNING) {
            return false;
        }
        job.recoverOrphan(now, nextAfterOrphan(job, now));
        return true;
    }

    // A once job keeps its instant so the interrupted run happens again on the first tick.
    private Instant nextAfterOrphan(ScrapeJob job, Instant now) {
        ScheduleSpec spec = job.getSchedule();
        if (spec instanceof ScheduleSpec.Once once) {
            return job.getNextRun() != null ? job.getNextRun() : calculator.onceInstant(once);
        }
        return calculator.nextRunTime(spec, now).orElse(null);
    }
}
