package io.scrapejobs.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunOutcome {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunOutcome fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        return RunOutcome.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
