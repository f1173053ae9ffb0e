package io.scrapejobs.utils;

import io.scrapejobs.core.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Standard 5-field cron ({@code minute hour day-of-month month day-of-week}) evaluated with the
 * Quartz {@link CronExpression} engine.
 *
 * <p>Translation to Quartz syntax:
 * <ul>
 *   <li>a seconds field {@code 0} is prepended</li>
 *   <li>day-of-week {@code 0-7} (Sunday = 0 or 7) and names {@code SUN..SAT} are expanded and
 *   shifted to Quartz's {@code 1-7}</li>
 *   <li>Quartz needs {@code ?} in one of the two day fields; when both day fields are restricted
 *   the expression is split in two and the earlier match wins (classic cron OR semantics)</li>
 * </ul>
 * Quartz-only syntax ({@code ?}, {@code L}, {@code W}, {@code #}) and 6-field input are rejected.
 */
public final class CronSchedule {

    private static final Pattern NUMERIC_FIELD = Pattern.compile("^[0-9*,/-]+$");
    private static final Pattern MONTH_FIELD = Pattern.compile("^[0-9A-Za-z*,/-]+$");
    private static final Pattern DOW_FIELD = Pattern.compile("^[0-9A-Za-z*,/-]+$");
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    private final String expression;
    private final List<String> quartzExpressions;

    private CronSchedule(String expression, List<String> quartzExpressions) {
        this.expression = expression;
        this.quartzExpressions = List.copyOf(quartzExpressions);
    }

    /**
     * Parses and validates a 5-field cron expression.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("cron expression must not be empty");
        }
        String s = expression.trim();
        String[] parts = s.split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + parts.length + ": " + s);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dom = parts[2];
        String month = parts[3];
        String dow = parts[4];

        requireMatches(minute, NUMERIC_FIELD, "minute", s);
        requireMatches(hour, NUMERIC_FIELD, "hour", s);
        requireMatches(dom, NUMERIC_FIELD, "day-of-month", s);
        requireMatches(month, MONTH_FIELD, "month", s);
        requireMatches(dow, DOW_FIELD, "day-of-week", s);

        TreeSet<Integer> days = expandDaysOfWeek(dow, s);
        boolean allDays = days.size() == 7;
        String quartzDow = toQuartzDayList(days);

        boolean domStar = dom.startsWith("*");
        boolean dowStar = dow.startsWith("*");

        List<String> quartz = new ArrayList<>(2);
        if (domStar && dowStar) {
            if (allDays) {
                quartz.add(join(minute, hour, dom, month, "?"));
            } else if ("*".equals(dom)) {
                quartz.add(join(minute, hour, "?", month, quartzDow));
            } else {
                throw new InvalidScheduleException("stepped day-of-month combined with stepped day-of-week is not supported: " + s);
            }
        } else if (domStar) {
            if (!"*".equals(dom)) {
                throw new InvalidScheduleException("stepped day-of-month combined with a day-of-week list is not supported: " + s);
            }
            quartz.add(join(minute, hour, "?", month, quartzDow));
        } else if (dowStar) {
            if (!allDays) {
                throw new InvalidScheduleException("stepped day-of-week combined with a day-of-month list is not supported: " + s);
            }
            quartz.add(join(minute, hour, dom, month, "?"));
        } else {
            quartz.add(join(minute, hour, dom, month, "?"));
            quartz.add(join(minute, hour, "?", month, quartzDow));
        }

        for (String q : quartz) {
            try {
                CronExpression.validateExpression(q);
            } catch (ParseException e) {
                throw new InvalidScheduleException("Invalid cron expression: " + s + " (" + e.getMessage() + ")", e);
            }
        }
        return new CronSchedule(s, quartz);
    }

    /**
     * Returns true if {@code expression} parses as a 5-field cron.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Next matching instant strictly after {@code from}, evaluated in {@code zone}.
     */
    public Optional<Instant> nextAfter(Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        Instant best = null;
        for (String q : quartzExpressions) {
            CronExpression exp;
            try {
                exp = new CronExpression(q);
            } catch (ParseException e) {
                throw new InvalidScheduleException("Invalid cron expression: " + expression, e);
            }
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            Date next = exp.getNextValidTimeAfter(Date.from(from));
            if (next != null && (best == null || next.toInstant().isBefore(best))) {
                best = next.toInstant();
            }
        }
        return Optional.ofNullable(best);
    }

    public String expression() {
        return expression;
    }

    /**
     * The equivalent Quartz expressions; two when both day fields are restricted.
     */
    public List<String> quartzExpressions() {
        return quartzExpressions;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static void requireMatches(String field, Pattern pattern, String name, String expression) {
        if (!pattern.matcher(field).matches()) {
            throw new InvalidScheduleException("Invalid " + name + " field '" + field + "' in cron expression: " + expression);
        }
    }

    // 0 = Sunday .. 6 = Saturday
    private static TreeSet<Integer> expandDaysOfWeek(String field, String expression) {
        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",", -1)) {
            if (item.isEmpty()) {
                throw new InvalidScheduleException("Empty day-of-week list item in cron expression: " + expression);
            }
            String range = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = parseNumber(item.substring(slash + 1), expression);
                if (step < 1) {
                    throw new InvalidScheduleException("day-of-week step must be >= 1 in cron expression: " + expression);
                }
            }

            int start;
            int end;
            if ("*".equals(range)) {
                start = 0;
                end = 6;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new InvalidScheduleException("Invalid day-of-week range '" + range + "' in cron expression: " + expression);
                }
                start = parseDay(bounds[0], expression);
                end = parseDay(bounds[1], expression);
                if (end < start) {
                    throw new InvalidScheduleException("Invalid day-of-week range '" + range + "' in cron expression: " + expression);
                }
            } else {
                start = parseDay(range, expression);
                end = slash >= 0 ? 7 : start;
            }

            for (int d = start; d <= end; d += step) {
                days.add(d % 7);
            }
        }
        return days;
    }

    private static int parseDay(String token, String expression) {
        String t = token.toUpperCase(Locale.ROOT);
        int named = DAY_NAMES.indexOf(t);
        if (named >= 0) {
            return named;
        }
        int d = parseNumber(t, expression);
        if (d < 0 || d > 7) {
            throw new InvalidScheduleException("day-of-week must be within 0..7: " + token + " in cron expression: " + expression);
        }
        return d;
    }

    private static int parseNumber(String token, String expression) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("Invalid number '" + token + "' in cron expression: " + expression, e);
        }
    }

    private static String toQuartzDayList(TreeSet<Integer> days) {
        List<String> values = new ArrayList<>(days.size());
        for (int d : days) {
            values.add(Integer.toString(d + 1));
        }
        return String.join(",", values);
    }

    private static String join(String minute, String hour, String dom, String month, String dow) {
        return String.join(" ", "0", minute, hour, dom, month, dow);
    }
}
