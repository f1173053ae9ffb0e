package io.scrapejobs.service;

import io.scrapejobs.JobStore;
import io.scrapejobs.config.ScrapeJobsProperties;
import io.scrapejobs.core.JobDefinition;
import io.scrapejobs.core.JobNotFoundException;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.JobUpdate;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.RunHistoryEntry;
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
 * Job management operations behind the command surface. Validation happens here, synchronously;
 * a job that reaches the store always has a schedule that fires.
 */
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStore store;
    private final ScheduleCalculator calculator;
    private final ScrapeJobsProperties props;
    private final Clock clock;

    public JobService(JobStore store, ScheduleCalculator calculator, ScrapeJobsProperties props, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @throws io.scrapejobs.core.InvalidScheduleException if the schedule never fires
     */
    public ScrapeJob create(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Instant now = clock.instant();
        ScheduleSpec schedule = definition.schedule();
        calculator.validate(schedule, now);

        ScrapeJob job = new ScrapeJob();
        job.setName(blankToNull(definition.name()));
        job.setConfigName(definition.configName());
        job.setSchedule(schedule);
        job.setDescription(blankToNull(definition.description()));
        job.setOutputFormatOverride(blankToNull(definition.outputFormatOverride()));
        job.setOutputPathOverride(blankToNull(definition.outputPathOverride()));
        job.setMaxRetries(definition.maxRetries() != null
                ? definition.maxRetries()
                : props.getDefaultMaxRetries());
        job.setRetryDelaySeconds(definition.retryDelaySeconds() != null
                ? definition.retryDelaySeconds()
                : (int) props.getDefaultRetryDelay().toSeconds());
        job.setOnSuccess(blankToNull(definition.onSuccess()));
        job.setOnFailure(blankToNull(definition.onFailure()));
        job.setEnabled(definition.enabled());
        job.setMaxRuns(definition.maxRuns());
        job.setStatus(JobStatus.PENDING);
        job.setNextRun(calculator.initialRunTime(schedule, now).orElse(null));
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        ScrapeJob created = store.create(job);
        log.info("Job created id={} name={} config={} schedule={} nextRun={}",
                created.getId(), created.displayName(), created.getConfigName(), schedule.describe(), created.getNextRun());
        return created;
    }

    public Optional<ScrapeJob> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.get(id);
    }

    public ScrapeJob getRequired(String id) {
        return get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * @param status     null for any status
     * @param configName null for any configuration
     */
    public List<ScrapeJob> list(JobStatus status, String configName) {
        return store.filter(status, blankToNull(configName));
    }

    public List<ScrapeJob> list() {
        return list(null, null);
    }

    /**
     * Applies the non-null fields of {@code update}. A new schedule recomputes {@code nextRun} from
     * now unless the job is running; status and history are never touched.
     */
    public ScrapeJob update(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            return getRequired(id);
        }
        Instant now = clock.instant();
        if (update.schedule() != null) {
            calculator.validate(update.schedule(), now);
        }

        ScrapeJob updated = store.modify(id, job -> {
            apply(job, update, now);
            return true;
        }).orElseThrow(() -> new JobNotFoundException(id));
        log.info("Job updated id={} schedule={} enabled={} nextRun={}",
                id, updated.getSchedule().describe(), updated.isEnabled(), updated.getNextRun());
        return updated;
    }

    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("Job deleted id={}", id);
        }
        return deleted;
    }

    /**
     * Queues the job for the next tick by setting {@code nextRun} to now.
     *
     * @throws IllegalStateException if the job is running
     */
    public ScrapeJob runNow(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Instant now = clock.instant();
        Optional<ScrapeJob> queued = store.modify(id, job -> {
            if (job.getStatus() == JobStatus.RUNNING) {
                return false;
            }
            job.setNextRun(now);
            return true;
        });
        if (queued.isPresent()) {
            log.info("Job queued to run now id={}", id);
            return queued.get();
        }
        getRequired(id);
        throw new IllegalStateException("Job is already running: " + id);
    }

    public List<RunHistoryEntry> history(String id) {
        return List.copyOf(getRequired(id).getHistory());
    }

    public RepairReport repair() {
        return store.repair();
    }

    public ScheduleCalculator calculator() {
        return calculator;
    }

    private void apply(ScrapeJob job, JobUpdate u, Instant now) {
        if (u.name() != null) {
            job.setName(blankToNull(u.name()));
        }
        if (u.configName() != null) {
            job.setConfigName(u.configName().trim());
        }
        if (u.schedule() != null) {
            job.setSchedule(u.schedule());
            if (job.getStatus() != JobStatus.RUNNING) {
                job.setNextRun(calculator.initialRunTime(u.schedule(), now).orElse(null));
            }
        }
        if (u.enabled() != null) {
            job.setEnabled(u.enabled());
        }
        if (u.maxRuns() != null) {
            job.setMaxRuns(u.maxRuns() == 0 ? null : u.maxRuns());
        }
        if (u.maxRetries() != null) {
            job.setMaxRetries(u.maxRetries());
        }
        if (u.retryDelaySeconds() != null) {
            job.setRetryDelaySeconds(u.retryDelaySeconds());
        }
        if (u.outputFormatOverride() != null) {
            job.setOutputFormatOverride(blankToNull(u.outputFormatOverride()));
        }
        if (u.outputPathOverride() != null) {
            job.setOutputPathOverride(blankToNull(u.outputPathOverride()));
        }
        if (u.onSuccess() != null) {
            job.setOnSuccess(blankToNull(u.onSuccess()));
        }
        if (u.onFailure() != null) {
            job.setOnFailure(blankToNull(u.onFailure()));
        }
        if (u.description() != null) {
            job.setDescription(blankToNull(u.description()));
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
