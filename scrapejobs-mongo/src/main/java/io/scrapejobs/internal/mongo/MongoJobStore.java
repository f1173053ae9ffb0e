package io.scrapejobs.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scrapejobs.JobStore;
import io.scrapejobs.core.JobNotFoundException;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.JobStorageException;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.RunOutcome;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.JobJson;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Each job is one document in {@code scrape_jobs}. Writes use the document {@code version}
 * for optimistic locking: {@link #modify} re-reads and re-applies its mutation when another writer
 * got in between, so no update is lost.
 *
 * <p>BSON dates hold milliseconds, so every instant of a job is truncated to milliseconds before it
 * is written. The job passed to a write method is updated in place and reads back equal.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    public static final String QUARANTINE_COLLECTION = "scrape_jobs_quarantine";
    private static final int MAX_WRITE_CONFLICTS = 16;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, JobJson.objectMapper(), Clock.tick(Clock.systemUTC(), Duration.ofMillis(1)));
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ScrapeJob create(ScrapeJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        }
        Instant now = clock.instant();
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(now);
        }
        job.touch(now);
        truncateInstants(job);

        ScrapeJobDocument doc = toDocument(job);
        doc.setVersion(null);
        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Job already exists: " + job.getId(), e);
        } catch (DataAccessException e) {
            throw new JobStorageException("Cannot create job " + job.getId(), e);
        }
        log.debug("Job created id={} config={}", job.getId(), job.getConfigName());
        return job;
    }

    @Override
    public Optional<ScrapeJob> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScrapeJobDocument doc = access("get " + id, () -> mongoTemplate.findById(id, ScrapeJobDocument.class));
        return Optional.ofNullable(doc).map(this::toJob);
    }

    /**
     * Whole-record replace. Retries on a version conflict with the latest version, so the last
     * writer wins.
     */
    @Override
    public ScrapeJob update(ScrapeJob job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = Objects.requireNonNull(job.getId(), "job.id must not be null");
        for (int i = 0; i < MAX_WRITE_CONFLICTS; i++) {
            ScrapeJobDocument current = access("get " + id, () -> mongoTemplate.findById(id, ScrapeJobDocument.class));
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            job.touch(clock.instant());
            truncateInstants(job);
            ScrapeJobDocument doc = toDocument(job);
            doc.setVersion(current.getVersion());
            try {
                mongoTemplate.save(doc);
                return job;
            } catch (OptimisticLockingFailureException e) {
                log.debug("Write conflict on update, retrying id={} attempt={}", id, i + 1);
            } catch (DataAccessException e) {
                throw new JobStorageException("Cannot update job " + id, e);
            }
        }
        throw new JobStorageException("Too many concurrent writes to job " + id);
    }

    @Override
    public Optional<ScrapeJob> modify(String id, Predicate<ScrapeJob> mutation) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mutation, "mutation must not be null");
        for (int i = 0; i < MAX_WRITE_CONFLICTS; i++) {
            ScrapeJobDocument current = access("get " + id, () -> mongoTemplate.findById(id, ScrapeJobDocument.class));
            if (current == null) {
                return Optional.empty();
            }
            ScrapeJob job = toJob(current);
            if (!mutation.test(job)) {
                return Optional.empty();
            }
            job.touch(clock.instant());
            truncateInstants(job);
            ScrapeJobDocument doc = toDocument(job);
            doc.setVersion(current.getVersion());
            try {
                mongoTemplate.save(doc);
                return Optional.of(job);
            } catch (OptimisticLockingFailureException e) {
                log.debug("Write conflict on modify, retrying id={} attempt={}", id, i + 1);
            } catch (DataAccessException e) {
                throw new JobStorageException("Cannot update job " + id, e);
            }
        }
        throw new JobStorageException("Too many concurrent writes to job " + id);
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        long deleted = access("delete " + id, () -> mongoTemplate.remove(q, ScrapeJobDocument.class).getDeletedCount());
        return deleted > 0;
    }

    @Override
    public List<ScrapeJob> list() {
        return readAll(new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id"))));
    }

    @Override
    public List<ScrapeJob> filter(JobStatus status, String configName) {
        Query q = new Query();
        if (status != null) {
            q.addCriteria(Criteria.where("status").is(status.value()));
        }
        if (configName != null) {
            q.addCriteria(Criteria.where("configName").is(configName));
        }
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        return readAll(q);
    }

    /**
     * Uses index {@code idx_due}: {@code nextRun <= now} and {@code status != running}, earliest first.
     */
    @Override
    public List<ScrapeJob> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(
                Criteria.where("nextRun").ne(null).lte(now)
                        .and("status").ne(JobStatus.RUNNING.value())
        );
        q.with(Sort.by(Sort.Order.asc("nextRun")));
        return readAll(q);
    }

    /**
     * Moves documents that cannot be mapped to a {@link ScrapeJob} into {@code scrape_jobs_quarantine}.
     */
    @Override
    public RepairReport repair() {
        List<Document> raw = access("scan", () -> mongoTemplate.findAll(Document.class, ScrapeJobDocument.COLLECTION));
        int valid = 0;
        int quarantined = 0;
        for (Document d : raw) {
            try {
                ScrapeJob job = toJob(mongoTemplate.getConverter().read(ScrapeJobDocument.class, d));
                if (job.getId() == null || job.getConfigName() == null || job.getSchedule() == null) {
                    throw new IllegalArgumentException("record is incomplete");
                }
                valid++;
            } catch (RuntimeException e) {
                Object id = d.get("_id");
                Document copy = new Document(d)
                        .append("quarantinedAt", Date.from(clock.instant()))
                        .append("quarantineReason", String.valueOf(e.getMessage()));
                copy.remove("_id");
                copy.append("originalId", id);
                access("quarantine " + id, () -> {
                    mongoTemplate.insert(copy, QUARANTINE_COLLECTION);
                    return mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), ScrapeJobDocument.COLLECTION);
                });
                quarantined++;
                log.warn("Quarantined unreadable job document id={} msg={}", id, e.getMessage());
            }
        }
        log.info("Job store repair finished collection={} scanned={} valid={} quarantined={}",
                ScrapeJobDocument.COLLECTION, raw.size(), valid, quarantined);
        return new RepairReport(raw.size(), valid, quarantined);
    }

    /**
     * Maps raw documents one at a time so a single unreadable document does not hide the others.
     */
    private List<ScrapeJob> readAll(Query q) {
        List<Document> raw = access("find", () -> mongoTemplate.find(q, Document.class, ScrapeJobDocument.COLLECTION));
        List<ScrapeJob> jobs = new ArrayList<>(raw.size());
        for (Document d : raw) {
            try {
                jobs.add(toJob(mongoTemplate.getConverter().read(ScrapeJobDocument.class, d)));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable job document id={} msg={}", d.get("_id"), e.getMessage());
            }
        }
        return jobs;
    }

    private <T> T access(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new JobStorageException("Mongo " + action + " failed: " + e.getMessage(), e);
        }
    }

    private static void truncateInstants(ScrapeJob job) {
        job.setLastRun(millis(job.getLastRun()));
        job.setNextRun(millis(job.getNextRun()));
        job.setRunningSince(millis(job.getRunningSince()));
        job.setCreatedAt(millis(job.getCreatedAt()));
        job.setUpdatedAt(millis(job.getUpdatedAt()));
        List<RunHistoryEntry> history = new ArrayList<>(job.getHistory().size());
        for (RunHistoryEntry e : job.getHistory()) {
            history.add(new RunHistoryEntry(e.attemptNumber(), millis(e.startedAt()), millis(e.finishedAt()),
                    e.outcome(), e.errorSummary()));
        }
        job.setHistory(history);
    }

    private static Instant millis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    ScrapeJobDocument toDocument(ScrapeJob job) {
        ScrapeJobDocument doc = new ScrapeJobDocument();
        doc.setId(job.getId());
        doc.setName(job.getName());
        doc.setConfigName(job.getConfigName());
        doc.setSchedule(job.getSchedule() == null ? null : objectMapper.convertValue(job.getSchedule(), MAP_TYPE));
        doc.setDescription(job.getDescription());
        doc.setOutputFormatOverride(job.getOutputFormatOverride());
        doc.setOutputPathOverride(job.getOutputPathOverride());
        doc.setMaxRetries(job.getMaxRetries());
        doc.setRetryDelaySeconds(job.getRetryDelaySeconds());
        doc.setOnSuccess(job.getOnSuccess());
        doc.setOnFailure(job.getOnFailure());
        doc.setEnabled(job.isEnabled());
        doc.setStatus(job.getStatus() == null ? null : job.getStatus().value());
        doc.setLastRun(job.getLastRun());
        doc.setNextRun(job.getNextRun());
        doc.setRunningSince(job.getRunningSince());
        doc.setCreatedAt(job.getCreatedAt());
        doc.setUpdatedAt(job.getUpdatedAt());
        doc.setRunCount(job.getRunCount());
        doc.setMaxRuns(job.getMaxRuns());
        doc.setLastOutcome(job.getLastOutcome() == null ? null : job.getLastOutcome().value());
        doc.setLastError(job.getLastError());

        List<ScrapeJobDocument.HistoryEntryDocument> history = new ArrayList<>(job.getHistory().size());
        for (RunHistoryEntry e : job.getHistory()) {
            ScrapeJobDocument.HistoryEntryDocument h = new ScrapeJobDocument.HistoryEntryDocument();
            h.setAttemptNumber(e.attemptNumber());
            h.setStartedAt(e.startedAt());
            h.setFinishedAt(e.finishedAt());
            h.setOutcome(e.outcome().value());
            h.setErrorSummary(e.errorSummary());
            history.add(h);
        }
        doc.setHistory(history);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScrapeJob)}.
     *
     * @throws JobStorageException if the document does not describe a valid job
     */
    ScrapeJob toJob(ScrapeJobDocument doc) {
        try {
            ScrapeJob job = new ScrapeJob();
            job.setId(doc.getId());
            job.setName(doc.getName());
            job.setConfigName(doc.getConfigName());
            job.setSchedule(doc.getSchedule() == null ? null : objectMapper.convertValue(doc.getSchedule(), ScheduleSpec.class));
            job.setDescription(doc.getDescription());
            job.setOutputFormatOverride(doc.getOutputFormatOverride());
            job.setOutputPathOverride(doc.getOutputPathOverride());
            job.setMaxRetries(doc.getMaxRetries());
            job.setRetryDelaySeconds(doc.getRetryDelaySeconds());
            job.setOnSuccess(doc.getOnSuccess());
            job.setOnFailure(doc.getOnFailure());
            job.setEnabled(doc.isEnabled());
            job.setStatus(doc.getStatus() == null ? JobStatus.PENDING : JobStatus.fromValue(doc.getStatus()));
            job.setLastRun(doc.getLastRun());
            job.setNextRun(doc.getNextRun());
            job.setRunningSince(doc.getRunningSince());
            job.setCreatedAt(doc.getCreatedAt());
            job.setUpdatedAt(doc.getUpdatedAt());
            job.setRunCount(doc.getRunCount());
            job.setMaxRuns(doc.getMaxRuns());
            job.setLastOutcome(doc.getLastOutcome() == null ? null : RunOutcome.fromValue(doc.getLastOutcome()));
            job.setLastError(doc.getLastError());

            List<RunHistoryEntry> history = new ArrayList<>();
            if (doc.getHistory() != null) {
                for (ScrapeJobDocument.HistoryEntryDocument h : doc.getHistory()) {
                    history.add(new RunHistoryEntry(
                            h.getAttemptNumber(),
                            h.getStartedAt(),
                            h.getFinishedAt(),
                            RunOutcome.fromValue(h.getOutcome()),
                            h.getErrorSummary()
                    ));
                }
            }
            job.setHistory(history);
            return job;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new JobStorageException("Unreadable job document " + doc.getId() + ": " + e.getMessage(), e);
        }
    }
}
