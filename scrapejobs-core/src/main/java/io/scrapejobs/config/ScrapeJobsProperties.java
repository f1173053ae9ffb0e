package io.scrapejobs.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration for job storage and scheduler behavior.
 */
public class ScrapeJobsProperties {
    private boolean enabled = true;
    private StoreType store = StoreType.FILE;
    private Path storageDir = Paths.get(System.getProperty("user.home"), ".scrapejobs", "jobs");
    private int defaultMaxRetries = 3;
    private Duration defaultRetryDelay = Duration.ofSeconds(60);
    private Duration processEvery = Duration.ofSeconds(5);
    private int maxConcurrency = 4; // worker pool
    private Duration forceStopTimeout = Duration.ofSeconds(30);
    private int storageRetryAttempts = 3; // per job per tick
    private boolean autoStart = false;
    private boolean verbose = false;
    private boolean ensureIndexesOnStartup = false; // mongo store only
    private final CommandLine commandLine = new CommandLine();

    public enum StoreType {
        FILE,
        MONGO
    }

    public static class CommandLine {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Fails fast on values the scheduler cannot work with.
     */
    public void validate() {
        requirePositive(processEvery, "scrapejobs.processEvery");
        requirePositive(forceStopTimeout, "scrapejobs.forceStopTimeout");
        Objects.requireNonNull(defaultRetryDelay, "scrapejobs.defaultRetryDelay must not be null");
        if (defaultRetryDelay.isNegative()) {
            throw new IllegalArgumentException("scrapejobs.defaultRetryDelay must not be negative");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("scrapejobs.maxConcurrency must be >= 1");
        }
        if (storageRetryAttempts < 1) {
            throw new IllegalArgumentException("scrapejobs.storageRetryAttempts must be >= 1");
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("scrapejobs.defaultMaxRetries must be >= 0");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Path getStorageDir() {
        return storageDir;
    }

    public void setStorageDir(Path storageDir) {
        this.storageDir = storageDir;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getDefaultRetryDelay() {
        return defaultRetryDelay;
    }

    public void setDefaultRetryDelay(Duration defaultRetryDelay) {
        this.defaultRetryDelay = defaultRetryDelay;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getForceStopTimeout() {
        return forceStopTimeout;
    }

    public void setForceStopTimeout(Duration forceStopTimeout) {
        this.forceStopTimeout = forceStopTimeout;
    }

    public int getStorageRetryAttempts() {
        return storageRetryAttempts;
    }

    public void setStorageRetryAttempts(int storageRetryAttempts) {
        this.storageRetryAttempts = storageRetryAttempts;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public CommandLine getCommandLine() {
        return commandLine;
    }
}
