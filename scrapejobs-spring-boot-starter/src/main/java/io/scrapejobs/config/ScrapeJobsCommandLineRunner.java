package io.scrapejobs.config;

import io.scrapejobs.JobScheduler;
import io.scrapejobs.command.JobCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.util.concurrent.CountDownLatch;

/**
 * Runs the command given in the application arguments, e.g.
 * {@code java -jar app.jar job list --status failed}.
 *
 * <p>After a successful {@code scheduler start} the runner keeps the application alive until the
 * context is closed. The command's exit code is reported through {@link ExitCodeGenerator}.
 */
public class ScrapeJobsCommandLineRunner implements ApplicationRunner, ExitCodeGenerator, DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobsCommandLineRunner.class);

    private final JobCommands commands;
    private final JobScheduler scheduler;
    private final CountDownLatch shutdown = new CountDownLatch(1);
    private volatile int exitCode = JobCommands.OK;

    public ScrapeJobsCommandLineRunner(JobCommands commands, JobScheduler scheduler) {
        this.commands = commands;
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String[] argv = args.getSourceArgs();
        if (argv.length == 0) {
            return;
        }
        exitCode = commands.execute(argv);
        if (exitCode == JobCommands.OK && isSchedulerStart(argv) && scheduler.isRunning()) {
            log.info("Scheduler running in the foreground; stop the application to exit");
            shutdown.await();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void destroy() {
        shutdown.countDown();
    }

    private static boolean isSchedulerStart(String[] argv) {
        return argv.length >= 2 && "scheduler".equals(argv[0]) && ("start".equals(argv[1]) || "restart".equals(argv[1]));
    }
}
