package io.scrapejobs.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.scrapejobs.utils.CronSchedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * When a job fires. A closed set of variants; {@link io.scrapejobs.utils.ScheduleCalculator}
 * holds one calculation per variant.
 *
 * <p>Times are wall-clock times in the scheduler's local zone.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScheduleSpec.Once.class, name = "once"),
        @JsonSubTypes.Type(value = ScheduleSpec.Hourly.class, name = "hourly"),
        @JsonSubTypes.Type(value = ScheduleSpec.Daily.class, name = "daily"),
        @JsonSubTypes.Type(value = ScheduleSpec.Weekly.class, name = "weekly"),
        @JsonSubTypes.Type(value = ScheduleSpec.Monthly.class, name = "monthly"),
        @JsonSubTypes.Type(value = ScheduleSpec.Custom.class, name = "custom")
})
public sealed interface ScheduleSpec permits ScheduleSpec.Once, ScheduleSpec.Hourly, ScheduleSpec.Daily,
        ScheduleSpec.Weekly, ScheduleSpec.Monthly, ScheduleSpec.Custom {

    @JsonIgnore
    ScheduleType type();

    @JsonIgnore
    default boolean isRecurring() {
        return type() != ScheduleType.ONCE;
    }

    /**
     * Human readable form used by listings, e.g. {@code "weekly MON 09:00"}.
     */
    String describe();

    record Once(LocalDate date, LocalTime time) implements ScheduleSpec {
        public Once {
            if (date == null) {
                throw new InvalidScheduleException("once schedule requires a date");
            }
            if (time == null) {
                throw new InvalidScheduleException("once schedule requires a time");
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.ONCE;
        }

        @Override
        public String describe() {
            return "once " + date + " " + time;
        }
    }

    record Hourly(int minute) implements ScheduleSpec {
        public Hourly {
            if (minute < 0 || minute > 59) {
                throw new InvalidScheduleException("hourly minute must be within 0..59: " + minute);
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.HOURLY;
        }

        @Override
        public String describe() {
            return String.format("hourly at :%02d", minute);
        }
    }

    record Daily(LocalTime time) implements ScheduleSpec {
        public Daily {
            if (time == null) {
                throw new InvalidScheduleException("daily schedule requires a time");
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.DAILY;
        }

        @Override
        public String describe() {
            return "daily " + time;
        }
    }

    /**
     * @param dayOfWeek 0 = Monday .. 6 = Sunday
     */
    record Weekly(int dayOfWeek, LocalTime time) implements ScheduleSpec {
        public Weekly {
            if (dayOfWeek < 0 || dayOfWeek > 6) {
                throw new InvalidScheduleException("weekly dayOfWeek must be within 0 (Monday)..6 (Sunday): " + dayOfWeek);
            }
            if (time == null) {
                throw new InvalidScheduleException("weekly schedule requires a time");
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.WEEKLY;
        }

        @Override
        public String describe() {
            return "weekly " + DayOfWeek.of(dayOfWeek + 1).name().substring(0, 3) + " " + time;
        }
    }

    /**
     * Days past the end of a short month fire on that month's last day.
     */
    record Monthly(int dayOfMonth, LocalTime time) implements ScheduleSpec {
        public Monthly {
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new InvalidScheduleException("monthly dayOfMonth must be within 1..31: " + dayOfMonth);
            }
            if (time == null) {
                throw new InvalidScheduleException("monthly schedule requires a time");
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.MONTHLY;
        }

        @Override
        public String describe() {
            return "monthly day " + dayOfMonth + " " + time;
        }
    }

    /**
     * Standard 5-field cron: {@code minute hour day-of-month month day-of-week}.
     */
    record Custom(String cronExpression) implements ScheduleSpec {
        public Custom {
            if (cronExpression == null || cronExpression.isBlank()) {
                throw new InvalidScheduleException("custom schedule requires a cron expression");
            }
            cronExpression = cronExpression.trim().replaceAll("\\s+", " ");
            CronSchedule.parse(cronExpression);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.CUSTOM;
        }

        @Override
        public String describe() {
            return "cron " + cronExpression;
        }
    }
}
