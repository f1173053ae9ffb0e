package io.scrapejobs.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for persisted scrape jobs.
 *
 * <p>The schedule is kept as the same tagged map the file store writes
 * ({@code {"type": "weekly", "dayOfWeek": 0, "time": "09:00:00"}}).
 */
@Document(collection = ScrapeJobDocument.COLLECTION)
public class ScrapeJobDocument {
    public static final String COLLECTION = "scrape_jobs";

    @Id
    private String id;

    @Version
    private Long version;

    private String name;
    private String configName;
    private Map<String, Object> schedule;
    private String description;
    private String outputFormatOverride;
    private String outputPathOverride;

    private int maxRetries;
    private int retryDelaySeconds;
    private String onSuccess;
    private String onFailure;

    private boolean enabled;
    private String status;

    private Instant lastRun;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRun;

    private Instant runningSince;
    private Instant createdAt;
    private Instant updatedAt;

    private int runCount;
    private Integer maxRuns;
    private String lastOutcome;
    private String lastError;

    private List<HistoryEntryDocument> history = new ArrayList<>();

    public ScrapeJobDocument() {
    }

    /**
     * One element of {@code history}.
     */
    public static class HistoryEntryDocument {
        private int attemptNumber;
        private Instant startedAt;
        private Instant finishedAt;
        private String outcome;
        private String errorSummary;

        public HistoryEntryDocument() {
        }

        public int getAttemptNumber() {
            return attemptNumber;
        }

        public void setAttemptNumber(int attemptNumber) {
            this.attemptNumber = attemptNumber;
        }

        public Instant getStartedAt() {
            return startedAt;
        }

        public void setStartedAt(Instant startedAt) {
            this.startedAt = startedAt;
        }

        public Instant getFinishedAt() {
            return finishedAt;
        }

        public void setFinishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
        }

        public String getOutcome() {
            return outcome;
        }

        public void setOutcome(String outcome) {
            this.outcome = outcome;
        }

        public String getErrorSummary() {
            return errorSummary;
        }

        public void setErrorSummary(String errorSummary) {
            this.errorSummary = errorSummary;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
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

    public Map<String, Object> getSchedule() {
        return schedule;
    }

    public void setSchedule(Map<String, Object> schedule) {
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
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

    public String getLastOutcome() {
        return lastOutcome;
    }

    public void setLastOutcome(String lastOutcome) {
        this.lastOutcome = lastOutcome;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public List<HistoryEntryDocument> getHistory() {
        return history;
    }

    public void setHistory(List<HistoryEntryDocument> history) {
        this.history = history;
    }
}
