package io.scrapejobs.core;

/**
 * Thrown when a schedule cannot be accepted: a malformed cron expression, a field out of range,
 * a schedule that never fires, or a create request that does not name exactly one schedule.
 *
 * <p>Raised at creation/update time only. Dispatch never re-validates a stored schedule.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
