package io.scrapejobs.core;

/**
 * Persistence layer unavailable or a stored record unreadable.
 */
public class JobStorageException extends RuntimeException {

    public JobStorageException(String message) {
        super(message);
    }

    public JobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
