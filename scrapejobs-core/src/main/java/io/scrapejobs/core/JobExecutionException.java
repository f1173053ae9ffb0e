package io.scrapejobs.core;

/**
 * A single run attempt failed, either because the run operation threw or because it reported failure.
 * Every execution failure is retryable up to the job's {@code maxRetries}.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
