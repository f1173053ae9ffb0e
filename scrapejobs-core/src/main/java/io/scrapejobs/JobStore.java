package io.scrapejobs;

import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.SchedulerLock;
import io.scrapejobs.core.ScrapeJob;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Durable keyed storage for {@link ScrapeJob} records.
 *
 * <p>Writes to the same id are serialized; a write is durable once the call returns. Every
 * persistence failure surfaces as {@link io.scrapejobs.core.JobStorageException}.
 */
public interface JobStore {

    /**
     * Persists a new job. Assigns an id when the job has none.
     *
     * @throws IllegalArgumentException if a job with the same id exists
     */
    ScrapeJob create(ScrapeJob job);

    Optional<ScrapeJob> get(String id);

    /**
     * Replaces the whole stored record (last writer wins).
     *
     * @throws io.scrapejobs.core.JobNotFoundException if the job does not exist
     */
    ScrapeJob update(ScrapeJob job);

    /**
     * Atomic read-modify-write. {@code mutation} runs against the current stored record and
     * returns whether it changed anything; only then is the record written back.
     *
     * @return the stored record after the mutation, or empty if the job does not exist or the
     * mutation declined
     */
    Optional<ScrapeJob> modify(String id, Predicate<ScrapeJob> mutation);

    boolean delete(String id);

    List<ScrapeJob> list();

    /**
     * Jobs matching both filters; a null filter matches everything.
     */
    default List<ScrapeJob> filter(JobStatus status, String configName) {
        return list().stream()
                .filter(j -> status == null || j.getStatus() == status)
                .filter(j -> configName == null || configName.equals(j.getConfigName()))
                .collect(Collectors.toList());
    }

    /**
     * Jobs with {@code nextRun <= now} that are not running, enabled or not, oldest first.
     */
    default List<ScrapeJob> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return list().stream()
                .filter(j -> j.getStatus() != JobStatus.RUNNING)
                .filter(j -> j.getNextRun() != null && !j.getNextRun().isAfter(now))
                .sorted((a, b) -> a.getNextRun().compareTo(b.getNextRun()))
                .collect(Collectors.toList());
    }

    /**
     * Scans every stored record and quarantines the ones that cannot be read.
     */
    RepairReport repair();

    /**
     * Claims the right to run a scheduler against this store.
     *
     * @return empty if another scheduler holds it
     */
    default Optional<SchedulerLock> tryLockScheduler() {
        return Optional.of(SchedulerLock.NONE);
    }
}
