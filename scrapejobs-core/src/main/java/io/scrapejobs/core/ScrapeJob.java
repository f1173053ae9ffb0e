package io.scrapejobs.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persistent job record: a schedule, an execution policy and the mutable run state.
 *
 * <p>Status transitions go through {@link #claim(Instant)}, {@link #completeOccurrence} and
 * {@link #recoverOrphan}; there is no way from {@code pending} to {@code completed}/{@code failed}
 * without passing {@code running}.
 */
public class ScrapeJob {

    private String id;
    private String name;
    private String configName;
    private ScheduleSpec schedule;

    private String description;
    private String outputFormatOverride;
    private String outputPathOverride;

    private int maxRetries;
    private int retryDelaySeconds;
    private String onSuccess;
    private String onFailure;

    private boolean enabled = true;
    private JobStatus status = JobStatus.PENDING;

    private Instant lastRun;
    private Instant nextRun;
    private Instant runningSince;
    private Instant createdAt;
    private Instant updatedAt;

    private int runCount;
    private Integer maxRuns;
    private RunOutcome lastOutcome;
    private String lastError;

    private List<RunHistoryEntry> history = new ArrayList<>();

    public ScrapeJob() {
    }

    /**
     * Dispatch predicate: enabled, not already running and {@code nextRun <= now}.
     */
    public boolean isDue(Instant now) {
        return enabled
                && status != JobStatus.RUNNING
                && nextRun != null
                && !nextRun.isAfter(now);
    }

    /**
     * {@code pending -> running} when the job is due.
     *
     * @return false (and no change) if the job is not due at {@code now}
     */
    public boolean claim(Instant now) {
        if (!isDue(now)) {
            return false;
        }
        status = JobStatus.RUNNING;
        runningSince = now;
        touch(now);
        return true;
    }

    public void appendHistory(RunHistoryEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        history.add(entry);
    }

    /**
     * Records the final outcome of the running occurrence.
     *
     * <p>With a further occurrence the job rests in {@code pending}; otherwise it stays
     * {@code completed} or {@code failed}. Reaching {@code maxRuns} ends the schedule.
     */
    public void completeOccurrence(RunOutcome outcome, String errorSummary, Instant finishedAt, Instant nextOccurrence) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        if (status != JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + id + " is not running (status=" + status.value() + ")");
        }

        lastRun = runningSince != null ? runningSince : finishedAt;
        lastOutcome = outcome;
        Instant next = nextOccurrence;
        if (outcome == RunOutcome.SUCCESS) {
            runCount++;
            lastError = null;
            if (maxRuns != null && runCount >= maxRuns) {
                next = null;
            }
        } else {
            lastError = errorSummary;
        }

        nextRun = next;
        runningSince = null;
        if (next != null) {
            status = JobStatus.PENDING;
        } else {
            status = outcome == RunOutcome.SUCCESS ? JobStatus.COMPLETED : JobStatus.FAILED;
        }
        touch(finishedAt);
    }

    /**
     * Resets a job left {@code running} by a previous process and appends an "interrupted" entry.
     */
    public void recoverOrphan(Instant now, Instant nextOccurrence) {
        if (status != JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + id + " is not running (status=" + status.value() + ")");
        }
        Instant since = runningSince != null ? runningSince : now;
        int attempt = 1;
        for (RunHistoryEntry e : history) {
            if (!e.startedAt().isBefore(since)) {
                attempt++;
            }
        }
        history.add(RunHistoryEntry.interrupted(attempt, now));

        status = JobStatus.PENDING;
        nextRun = nextOccurrence;
        runningSince = null;
        lastOutcome = RunOutcome.FAILURE;
        lastError = RunHistoryEntry.INTERRUPTED;
        touch(now);
    }

    /**
     * Moves {@code updatedAt} forward, never backwards.
     */
    public void touch(Instant now) {
        if (now == null) {
            return;
        }
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    @JsonIgnore
    public String displayName() {
        return name != null && !name.isBlank() ? name : configName;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getConfigName() {
        return configName;
    }

    public void setConfigName(String configName) {
        this.configName = configName;
    }

    public ScheduleSpec getSchedule() {
        return schedule;
    }

    public void setSchedule(ScheduleSpec schedule) {
        this.schedule = schedule;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getOutputFormatOverride() {
        return outputFormatOverride;
    }

    public void setOutputFormatOverride(String outputFormatOverride) {
        this.outputFormatOverride = outputFormatOverride;
    }

    public String getOutputPathOverride() {
        return outputPathOverride;
    }

    public void setOutputPathOverride(String outputPathOverride) {
        this.outputPathOverride = outputPathOverride;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryDelaySeconds() {
        return retryDelaySeconds;
    }

    public void setRetryDelaySeconds(int retryDelaySeconds) {
        this.retryDelaySeconds = retryDelaySeconds;
    }

    public String getOnSuccess() {
        return onSuccess;
    }

    public void setOnSuccess(String onSuccess) {
        this.onSuccess = onSuccess;
    }

    public String getOnFailure() {
        return onFailure;
    }

    public void setOnFailure(String onFailure) {
        this.onFailure = onFailure;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }

    public Instant getRunningSince() {
        return runningSince;
    }

    public void setRunningSince(Instant runningSince) {
        this.runningSince = runningSince;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public int getRunCount() {
        return runCount;
    }

    public void setRunCount(int runCount) {
        this.runCount = runCount;
    }

    public Integer getMaxRuns() {
        return maxRuns;
    }

    public void setMaxRuns(Integer maxRuns) {
        this.maxRuns = maxRuns;
    }

    public RunOutcome getLastOutcome() {
        return lastOutcome;
    }

    public void setLastOutcome(RunOutcome lastOutcome) {
        this.lastOutcome = lastOutcome;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public List<RunHistoryEntry> getHistory() {
        return history;
    }

    public void setHistory(List<RunHistoryEntry> history) {
        this.history = history == null ? new ArrayList<>() : new ArrayList<>(history);
    }
}
