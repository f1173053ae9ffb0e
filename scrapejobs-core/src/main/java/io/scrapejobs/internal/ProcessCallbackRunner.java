package io.scrapejobs.internal;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.core.CallbackContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs callback commands through the platform shell with the run's context in the environment.
 * Does not wait for the process; a non-zero exit is only logged.
 */
public class ProcessCallbackRunner implements CallbackRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCallbackRunner.class);

    private final List<String> shell;

    public ProcessCallbackRunner() {
        this(defaultShell());
    }

    ProcessCallbackRunner(List<String> shell) {
        this.shell = List.copyOf(Objects.requireNonNull(shell, "shell must not be null"));
    }

    @Override
    public void fire(String command, CallbackContext context) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(context, "context must not be null");
        start(command, context);
    }

    /**
     * Starts the process.
     *
     * @return the started process, or null if it could not be started
     */
    Process start(String command, CallbackContext context) {
        ProcessBuilder pb = new ProcessBuilder(commandLine(command));
        pb.environment().putAll(context.toEnvironment());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Callback could not be started jobId={} outcome={} command={} msg={}",
                    context.jobId(), context.outcome().value(), command, e.getMessage());
            return null;
        }
        log.debug("Callback started jobId={} outcome={} pid={}", context.jobId(), context.outcome().value(), process.pid());

        process.onExit().thenAccept(p -> {
            int exit = p.exitValue();
            if (exit != 0) {
                log.warn("Callback exited with non-zero status jobId={} outcome={} exit={} command={}",
                        context.jobId(), context.outcome().value(), exit, command);
            } else {
                log.debug("Callback finished jobId={} outcome={}", context.jobId(), context.outcome().value());
            }
        });
        return process;
    }

    private List<String> commandLine(String command) {
        List<String> cmd = new ArrayList<>(shell);
        cmd.add(command);
        return cmd;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    private static List<String> defaultShell() {
        return isWindows() ? List.of("cmd.exe", "/c") : List.of("/bin/sh", "-c");
    }

    private static File nullDevice() {
        return new File(isWindows() ? "NUL" : "/dev/null");
    }
}
