package io.scrapejobs.utils;

import io.scrapejobs.core.InvalidScheduleException;
import io.scrapejobs.core.ScheduleSpec;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes when a {@link ScheduleSpec} fires next.
 *
 * <p>All wall-clock arithmetic happens in one {@link ZoneId} (local time by default), so a
 * daylight-saving change can move a job by an hour. Every calculation is closed form: a start far
 * in the past costs the same as one a second ago.
 */
public final class ScheduleCalculator {

    private final ZoneId zone;

    public ScheduleCalculator() {
        this(ZoneId.systemDefault());
    }

    public ScheduleCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Smallest matching instant strictly after {@code from}, or empty for a {@code Once}
     * schedule whose instant is not after {@code from}.
     */
    public Optional<Instant> nextRunTime(ScheduleSpec spec, Instant from) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(from, "from must not be null");

        ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
        return switch (spec.type()) {
            case ONCE -> {
                Instant at = onceInstant((ScheduleSpec.Once) spec);
                yield at.isAfter(from) ? Optional.of(at) : Optional.empty();
            }
            case HOURLY -> Optional.of(nextHourly((ScheduleSpec.Hourly) spec, base, from));
            case DAILY -> Optional.of(nextDaily((ScheduleSpec.Daily) spec, base, from));
            case WEEKLY -> Optional.of(nextWeekly((ScheduleSpec.Weekly) spec, base, from));
            case MONTHLY -> Optional.of(nextMonthly((ScheduleSpec.Monthly) spec, base, from));
            case CUSTOM -> CronSchedule.parse(((ScheduleSpec.Custom) spec).cronExpression()).nextAfter(from, zone);
        };
    }

    /**
     * First {@code nextRun} of a new job. A {@code Once} schedule keeps its instant even when it
     * already passed, so the job fires on the first tick.
     */
    public Optional<Instant> initialRunTime(ScheduleSpec spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec instanceof ScheduleSpec.Once once) {
            return Optional.of(onceInstant(once));
        }
        return nextRunTime(spec, now);
    }

    /**
     * Rejects a recurring schedule that never produces an occurrence (e.g. {@code 0 0 30 2 *}).
     */
    public void validate(ScheduleSpec spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.isRecurring() && nextRunTime(spec, now).isEmpty()) {
            throw new InvalidScheduleException("Schedule never fires: " + spec.describe());
        }
    }

    public Instant onceInstant(ScheduleSpec.Once once) {
        return ZonedDateTime.of(once.date(), once.time(), zone).toInstant();
    }

    private Instant nextHourly(ScheduleSpec.Hourly spec, ZonedDateTime base, Instant from) {
        ZonedDateTime candidate = base.truncatedTo(ChronoUnit.HOURS).withMinute(spec.minute());
        if (!candidate.toInstant().isAfter(from)) {
            candidate = candidate.plusHours(1);
        }
        return candidate.toInstant();
    }

    private Instant nextDaily(ScheduleSpec.Daily spec, ZonedDateTime base, Instant from) {
        LocalDate day = base.toLocalDate();
        Instant candidate = at(day, spec.time());
        if (!candidate.isAfter(from)) {
            candidate = at(day.plusDays(1), spec.time());
        }
        return candidate;
    }

    private Instant nextWeekly(ScheduleSpec.Weekly spec, ZonedDateTime base, Instant from) {
        DayOfWeek target = DayOfWeek.of(spec.dayOfWeek() + 1);
        LocalDate day = base.toLocalDate().with(TemporalAdjusters.nextOrSame(target));
        Instant candidate = at(day, spec.time());
        if (!candidate.isAfter(from)) {
            candidate = at(day.plusWeeks(1), spec.time());
        }
        return candidate;
    }

    private Instant nextMonthly(ScheduleSpec.Monthly spec, ZonedDateTime base, Instant from) {
        YearMonth month = YearMonth.from(base);
        Instant candidate = at(clampDay(month, spec.dayOfMonth()), spec.time());
        if (!candidate.isAfter(from)) {
            candidate = at(clampDay(month.plusMonths(1), spec.dayOfMonth()), spec.time());
        }
        return candidate;
    }

    private static LocalDate clampDay(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    // Times inside a DST gap shift forward by the gap length.
    private Instant at(LocalDate day, LocalTime time) {
        return ZonedDateTime.of(day, time, zone).toInstant();
    }
}
