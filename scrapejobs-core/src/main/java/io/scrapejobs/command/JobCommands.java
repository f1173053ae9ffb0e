package io.scrapejobs.command;

import io.scrapejobs.JobScheduler;
import io.scrapejobs.core.InvalidScheduleException;
import io.scrapejobs.core.JobDefinition;
import io.scrapejobs.core.JobNotFoundException;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.JobStorageException;
import io.scrapejobs.core.JobUpdate;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScheduleType;
import io.scrapejobs.core.SchedulerStatus;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.service.JobService;

import java.io.PrintStream;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Text command surface: {@code job create|list|show|update|delete|run|logs|history|repair} and
 * {@code scheduler start|stop|status|restart}.
 *
 * <p>Options are {@code --name value} or {@code --name=value}. Exit codes: {@link #OK},
 * {@link #USER_ERROR} (unknown id, invalid schedule, storage failure) and {@link #USAGE_ERROR}.
 */
public class JobCommands {
    public static final int OK = 0;
    public static final int USER_ERROR = 1;
    public static final int USAGE_ERROR = 2;

    static final int DEFAULT_LOG_LIMIT = 20;
    private static final Set<String> BOOLEAN_FLAGS = Set.of("force", "disabled", "enable", "disable");
    private static final String TIME_PATTERN = "yyyy-MM-dd HH:mm";

    private final JobService jobService;
    private final JobScheduler scheduler;
    private final PrintStream out;
    private final PrintStream err;
    private final DateTimeFormatter timeFormat;

    public JobCommands(JobService jobService, JobScheduler scheduler, PrintStream out, PrintStream err) {
        this.jobService = Objects.requireNonNull(jobService, "jobService must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.timeFormat = DateTimeFormatter.ofPattern(TIME_PATTERN).withZone(jobService.calculator().zone());
    }

    private static final class UsageException extends RuntimeException {
        private UsageException(String message) {
            super(message);
        }
    }

    private record Args(List<String> positional, Map<String, String> options) {
        String option(String name) {
            return options.get(name);
        }

        boolean flag(String name) {
            return options.containsKey(name);
        }

        String requiredPositional(int index, String what) {
            if (positional.size() <= index) {
                throw new UsageException("missing " + what);
            }
            return positional.get(index);
        }
    }

    public int execute(String... argv) {
        if (argv == null || argv.length < 2) {
            printUsage();
            return USAGE_ERROR;
        }
        try {
            String group = argv[0];
            String action = argv[1];
            Args args = parse(argv);
            return switch (group) {
                case "job" -> job(action, args);
                case "scheduler" -> scheduler(action, args);
                default -> throw new UsageException("unknown command group: " + group);
            };
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            printUsage();
            return USAGE_ERROR;
        } catch (JobNotFoundException | InvalidScheduleException | IllegalStateException | JobStorageException e) {
            err.println("error: " + e.getMessage());
            return USER_ERROR;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            err.println("error: " + e.getMessage());
            return USAGE_ERROR;
        }
    }

    private int job(String action, Args args) {
        return switch (action) {
            case "create" -> create(args);
            case "list" -> list(args);
            case "show" -> show(args.requiredPositional(0, "job id"));
            case "update" -> update(args.requiredPositional(0, "job id"), args);
            case "delete" -> delete(args.requiredPositional(0, "job id"));
            case "run" -> run(args.requiredPositional(0, "job id"));
            case "logs" -> logs(args.requiredPositional(0, "job id"), args);
            case "history" -> history(args.requiredPositional(0, "job id"));
            case "repair" -> repair();
            default -> throw new UsageException("unknown job command: " + action);
        };
    }

    private int scheduler(String action, Args args) {
        switch (action) {
            case "start" -> {
                if (scheduler.start()) {
                    out.println("Scheduler started.");
                } else {
                    out.println("Scheduler is already running.");
                }
            }
            case "stop" -> {
                if (!scheduler.isRunning()) {
                    out.println("Scheduler is not running.");
                    return OK;
                }
                scheduler.stop(args.flag("force"));
                out.println("Scheduler stopped.");
            }
            case "restart" -> {
                scheduler.restart();
                out.println("Scheduler restarted.");
            }
            case "status" -> {
                SchedulerStatus status = scheduler.status();
                out.println("running:     " + status.running());
                out.println("active jobs: " + status.activeJobCount());
                out.println("last tick:   " + format(status.lastTickAt()));
            }
            default -> throw new UsageException("unknown scheduler command: " + action);
        }
        return OK;
    }

    private int create(Args args) {
        String config = args.option("config");
        if (config == null || config.isBlank()) {
            throw new UsageException("--config is required");
        }
        ScheduleSpec schedule = scheduleFrom(args);
        if (schedule == null) {
            throw new UsageException("exactly one of --schedule-type or --cron is required");
        }

        JobDefinition.Builder builder = JobDefinition.builder(config)
                .schedule(schedule)
                .name(args.option("name"))
                .description(args.option("description"))
                .outputFormatOverride(args.option("output-format"))
                .outputPathOverride(args.option("output-path"))
                .onSuccess(args.option("on-success"))
                .onFailure(args.option("on-failure"))
                .maxRetries(intOption(args, "max-retries"))
                .retryDelaySeconds(intOption(args, "retry-delay"))
                .maxRuns(intOption(args, "max-runs"))
                .enabled(!args.flag("disabled"));

        ScrapeJob job = jobService.create(builder.build());
        out.println("Created job " + job.getId());
        out.println("next run: " + format(job.getNextRun()));
        return OK;
    }

    private int list(Args args) {
        String status = args.option("status");
        List<ScrapeJob> jobs = jobService.list(status == null ? null : JobStatus.fromValue(status), args.option("config"));
        if (jobs.isEmpty()) {
            out.println("No jobs found.");
            return OK;
        }
        String row = "%-36s  %-20s  %-20s  %-24s  %-9s  %-7s  %-16s  %-16s%n";
        out.printf(row, "ID", "NAME", "CONFIG", "SCHEDULE", "STATUS", "ENABLED", "NEXT RUN", "LAST RUN");
        for (ScrapeJob job : jobs) {
            out.printf(row,
                    job.getId(),
                    job.displayName(),
                    job.getConfigName(),
                    job.getSchedule().describe(),
                    job.getStatus().value(),
                    job.isEnabled() ? "yes" : "no",
                    format(job.getNextRun()),
                    format(job.getLastRun()));
        }
        return OK;
    }

    private int show(String id) {
        ScrapeJob job = jobService.getRequired(id);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", job.getId());
        fields.put("name", job.displayName());
        fields.put("config", job.getConfigName());
        fields.put("schedule", job.getSchedule().describe());
        fields.put("description", job.getDescription());
        fields.put("status", job.getStatus().value());
        fields.put("enabled", job.isEnabled());
        fields.put("next run", format(job.getNextRun()));
        fields.put("last run", format(job.getLastRun()));
        fields.put("last outcome", job.getLastOutcome() == null ? null : job.getLastOutcome().value());
        fields.put("last error", job.getLastError());
        fields.put("run count", job.getRunCount());
        fields.put("max runs", job.getMaxRuns());
        fields.put("max retries", job.getMaxRetries());
        fields.put("retry delay", job.getRetryDelaySeconds() + "s");
        fields.put("output format", job.getOutputFormatOverride());
        fields.put("output path", job.getOutputPathOverride());
        fields.put("on success", job.getOnSuccess());
        fields.put("on failure", job.getOnFailure());
        fields.put("created", format(job.getCreatedAt()));
        fields.put("updated", format(job.getUpdatedAt()));
        fields.forEach((k, v) -> out.printf("%-14s %s%n", k + ":", v == null ? "-" : v));
        return OK;
    }

    private int update(String id, Args args) {
        if (args.flag("enable") && args.flag("disable")) {
            throw new UsageException("--enable and --disable are mutually exclusive");
        }
        Boolean enabled = args.flag("enable") ? Boolean.TRUE : args.flag("disable") ? Boolean.FALSE : null;
        JobUpdate update = JobUpdate.builder()
                .name(args.option("name"))
                .configName(args.option("config"))
                .schedule(scheduleFrom(args))
                .enabled(enabled)
                .maxRuns(intOption(args, "max-runs"))
                .maxRetries(intOption(args, "max-retries"))
                .retryDelaySeconds(intOption(args, "retry-delay"))
                .outputFormatOverride(args.option("output-format"))
                .outputPathOverride(args.option("output-path"))
                .onSuccess(args.option("on-success"))
                .onFailure(args.option("on-failure"))
                .description(args.option("description"))
                .build();
        if (update.isEmpty()) {
            throw new UsageException("nothing to update");
        }
        ScrapeJob job = jobService.update(id, update);
        out.println("Updated job " + job.getId());
        out.println("next run: " + format(job.getNextRun()));
        return OK;
    }

    private int delete(String id) {
        if (!jobService.delete(id)) {
            throw new JobNotFoundException(id);
        }
        out.println("Deleted job " + id);
        return OK;
    }

    private int run(String id) {
        jobService.runNow(id);
        out.println("Job " + id + " queued to run now.");
        if (!scheduler.isRunning() && scheduler.start()) {
            out.println("Scheduler started.");
        }
        return OK;
    }

    private int logs(String id, Args args) {
        Integer limit = intOption(args, "limit");
        int n = limit == null ? DEFAULT_LOG_LIMIT : limit;
        if (n < 1) {
            throw new UsageException("--limit must be >= 1");
        }
        List<RunHistoryEntry> history = jobService.history(id);
        if (history.isEmpty()) {
            out.println("No runs recorded for job " + id + ".");
            return OK;
        }
        for (RunHistoryEntry e : history.subList(Math.max(0, history.size() - n), history.size())) {
            StringBuilder line = new StringBuilder()
                    .append(format(e.startedAt()))
                    .append(" attempt ").append(e.attemptNumber())
                    .append(' ').append(e.outcome().value().toUpperCase(Locale.ROOT));
            if (e.errorSummary() != null) {
                line.append(": ").append(e.errorSummary());
            }
            out.println(line);
        }
        return OK;
    }

    private int history(String id) {
        List<RunHistoryEntry> history = jobService.history(id);
        if (history.isEmpty()) {
            out.println("No runs recorded for job " + id + ".");
            return OK;
        }
        String row = "%-7s  %-16s  %-16s  %-8s  %s%n";
        out.printf(row, "ATTEMPT", "STARTED", "FINISHED", "OUTCOME", "ERROR");
        for (RunHistoryEntry e : history) {
            out.printf(row,
                    e.attemptNumber(),
                    format(e.startedAt()),
                    format(e.finishedAt()),
                    e.outcome().value(),
                    e.errorSummary() == null ? "" : e.errorSummary());
        }
        return OK;
    }

    private int repair() {
        RepairReport report = jobService.repair();
        out.printf("scanned=%d valid=%d quarantined=%d%n", report.scanned(), report.valid(), report.quarantined());
        return OK;
    }

    /**
     * @return null when neither --schedule-type nor --cron is given
     */
    private ScheduleSpec scheduleFrom(Args args) {
        String type = args.option("schedule-type");
        String cron = args.option("cron");
        if (type != null && cron != null && !ScheduleType.CUSTOM.value().equalsIgnoreCase(type.trim())) {
            throw new UsageException("--schedule-type and --cron are mutually exclusive");
        }
        if (cron != null) {
            return new ScheduleSpec.Custom(cron);
        }
        if (type == null) {
            return null;
        }
        ScheduleType scheduleType = ScheduleType.fromValue(type);
        return switch (scheduleType) {
            case ONCE -> new ScheduleSpec.Once(LocalDate.parse(required(args, "date")), time(args));
            case HOURLY -> new ScheduleSpec.Hourly(Integer.parseInt(required(args, "minute")));
            case DAILY -> new ScheduleSpec.Daily(time(args));
            case WEEKLY -> new ScheduleSpec.Weekly(dayOfWeek(required(args, "day-of-week")), time(args));
            case MONTHLY -> new ScheduleSpec.Monthly(Integer.parseInt(required(args, "day-of-month")), time(args));
            case CUSTOM -> new ScheduleSpec.Custom(required(args, "cron"));
        };
    }

    private static LocalTime time(Args args) {
        return LocalTime.parse(required(args, "time"));
    }

    // 0 = Monday, or a day name
    private static int dayOfWeek(String value) {
        String v = value.trim();
        if (v.matches("\\d+")) {
            return Integer.parseInt(v);
        }
        String upper = v.toUpperCase(Locale.ROOT);
        for (DayOfWeek d : DayOfWeek.values()) {
            if (d.name().equals(upper) || d.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ROOT).equals(upper)) {
                return d.getValue() - 1;
            }
        }
        throw new InvalidScheduleException("Unknown day of week: " + value);
    }

    private static String required(Args args, String name) {
        String v = args.option(name);
        if (v == null || v.isBlank()) {
            throw new UsageException("--" + name + " is required");
        }
        return v;
    }

    private static Integer intOption(Args args, String name) {
        String v = args.option(name);
        if (v == null) {
            return null;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be an integer: " + v);
        }
    }

    private String format(Instant instant) {
        return instant == null ? "-" : timeFormat.format(instant);
    }

    private static Args parse(String[] argv) {
        List<String> positional = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 2; i < argv.length; i++) {
            String a = argv[i];
            if (!a.startsWith("--")) {
                positional.add(a);
                continue;
            }
            String name = a.substring(2);
            if (name.isEmpty()) {
                throw new UsageException("empty option name");
            }
            int eq = name.indexOf('=');
            if (eq >= 0) {
                options.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (BOOLEAN_FLAGS.contains(name)) {
                options.put(name, "true");
            } else {
                if (i + 1 >= argv.length) {
                    throw new UsageException("missing value for --" + name);
                }
                options.put(name, argv[++i]);
            }
        }
        return new Args(positional, options);
    }

    private void printUsage() {
        err.println("usage:");
        err.println("  job create --config NAME (--schedule-type once|hourly|daily|weekly|monthly | --cron EXPR)");
        err.println("             [--date YYYY-MM-DD] [--time HH:MM] [--minute M] [--day-of-week 0-6|MON..SUN]");
        err.println("             [--day-of-month 1-31] [--name N] [--description D] [--output-format F]");
        err.println("             [--output-path P] [--max-retries N] [--retry-delay SECONDS] [--max-runs N]");
        err.println("             [--on-success CMD] [--on-failure CMD] [--disabled]");
        err.println("  job list [--status pending|running|completed|failed] [--config NAME]");
        err.println("  job show|delete|run|history ID");
        err.println("  job update ID [create options] [--enable|--disable]");
        err.println("  job logs ID [--limit N]");
        err.println("  job repair");
        err.println("  scheduler start|stop [--force]|status|restart");
    }
}
