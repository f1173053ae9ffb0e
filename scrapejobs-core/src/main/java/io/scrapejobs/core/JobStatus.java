package io.scrapejobs.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Persisted job status.
 *
 * <p>{@code PENDING} is the resting state of recurring jobs; {@code COMPLETED} and {@code FAILED}
 * are only kept when no further occurrence exists.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
