package io.scrapejobs.core;

/**
 * Partial update of a job's definition. A null field leaves the stored value alone; a blank
 * string clears an optional text field. Status, timestamps and history cannot be changed here.
 */
public record JobUpdate(
        String name,
        String configName,
        ScheduleSpec schedule,
        Boolean enabled,
        Integer maxRuns,
        Integer maxRetries,
        Integer retryDelaySeconds,
        String outputFormatOverride,
        String outputPathOverride,
        String onSuccess,
        String onFailure,
        String description
) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return name == null && configName == null && schedule == null && enabled == null
                && maxRuns == null && maxRetries == null && retryDelaySeconds == null
                && outputFormatOverride == null && outputPathOverride == null
                && onSuccess == null && onFailure == null && description == null;
    }

    public static final class Builder {
        private String name;
        private String configName;
        private ScheduleSpec schedule;
        private Boolean enabled;
        private Integer maxRuns;
        private Integer maxRetries;
        private Integer retryDelaySeconds;
        private String outputFormatOverride;
        private String outputPathOverride;
        private String onSuccess;
        private String onFailure;
        private String description;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder configName(String configName) {
            if (configName != null && configName.isBlank()) {
                throw new IllegalArgumentException("configName must not be blank");
            }
            this.configName = configName;
            return this;
        }

        public Builder schedule(ScheduleSpec schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxRuns(Integer maxRuns) {
            if (maxRuns != null && maxRuns < 0) {
                throw new IllegalArgumentException("maxRuns must be >= 0 (0 clears the limit)");
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

        public JobUpdate build() {
            return new JobUpdate(
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
