package io.scrapejobs.core;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Immutable create request produced by {@link Builder#build()}.
 * This is a pure data object with no persistence logic.
 *
 * <p>{@code maxRetries} and {@code retryDelaySeconds} may be null, meaning "use the configured default".
 */
public record JobDefinition(

        // identity
        String name,
        String configName,

        // scheduling
        ScheduleSpec schedule,
        boolean enabled,
        Integer maxRuns,

        // execution policy
        Integer maxRetries,
        Integer retryDelaySeconds,
        String outputFormatOverride,
        String outputPathOverride,
        String onSuccess,
        String onFailure,

        String description
) {

    public static Builder builder(String configName) {
        return new Builder(configName);
    }

    /**
     * Fluent builder. Exactly one schedule method ({@code once}, {@code hourly}, {@code daily},
     * {@code weekly}, {@code monthly}, {@code cron}) must be called.
     */
    public static final class Builder {
        private final String configName;
        private String name;
        private ScheduleSpec schedule;
        private boolean enabled = true;
        private Integer maxRuns;
        private Integer maxRetries;
        private Integer retryDelaySeconds;
        private String outputFormatOverride;
        private String outputPathOverride;
        private String onSuccess;
        private String onFailure;
        private String description;

        private Builder(String configName) {
            Objects.requireNonNull(configName, "configName must not be null");
            if (configName.isBlank()) {
                throw new IllegalArgumentException("configName must not be blank");
            }
            this.configName = configName.trim();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schedule(ScheduleSpec schedule) {
            Objects.requireNonNull(schedule, "schedule must not be null");
            if (this.schedule != null) {
                throw new InvalidScheduleException("exactly one schedule must be given; already set: " + this.schedule.describe());
            }
            this.schedule = schedule;
            return this;
        }

        public Builder once(LocalDate date, LocalTime time) {
            return schedule(new ScheduleSpec.Once(date, time));
        }

        public Builder hourly(int minute) {
            return schedule(new ScheduleSpec.Hourly(minute));
        }

        public Builder daily(LocalTime time) {
            return schedule(new ScheduleSpec.Daily(time));
        }

        public Builder weekly(int dayOfWeek, LocalTime time) {
            return schedule(new ScheduleSpec.Weekly(dayOfWeek, time));
        }

        public Builder monthly(int dayOfMonth, LocalTime time) {
            return schedule(new ScheduleSpec.Monthly(dayOfMonth, time));
        }

        public Builder cron(String cronExpression) {
            return schedule(new ScheduleSpec.Custom(cronExpression));
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxRuns(Integer maxRuns) {
            if (maxRuns != null && maxRuns < 1) {
                throw new IllegalArgumentException("maxRuns must be >= 1");
            }
            this.maxRuns = maxRuns;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            if (maxRetries != null && maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelaySeconds(Integer retryDelaySeconds) {
            if (retryDelaySeconds != null && retryDelaySeconds < 0) {
                throw new IllegalArgumentException("retryDelaySeconds must be >= 0");
            }
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder outputFormatOverride(String outputFormatOverride) {
            this.outputFormatOverride = outputFormatOverride;
            return this;
        }

        public Builder outputPathOverride(String outputPathOverride) {
            this.outputPathOverride = outputPathOverride;
            return this;
        }

        public Builder onSuccess(String onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(String onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public JobDefinition build() {
            if (schedule == null) {
                throw new InvalidScheduleException("exactly one schedule must be given; none was set");
            }
            return new JobDefinition(
                    name,
                    configName,
                    schedule,
                    enabled,
                    maxRuns,
                    maxRetries,
                    retryDelaySeconds,
                    outputFormatOverride,
                    outputPathOverride,
                    onSuccess,
                    onFailure,
                    description
            );
        }
    }
}
