package io.scrapejobs.core;

import java.util.Locale;

/**
 * Tag of a {@link ScheduleSpec} variant. The lowercase value is the JSON discriminator
 * and the command-line spelling.
 */
public enum ScheduleType {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduleType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleException("schedule type must not be blank");
        }
        try {
            return ScheduleType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException("Unknown schedule type: " + value
                    + " (expected once, hourly, daily, weekly, monthly or custom)");
        }
    }
}
