package io.scrapejobs.internal;

import io.scrapejobs.core.JobStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Bounded retry of a store call that failed with {@link JobStorageException}.
 */
final class StorageRetry {
    private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);
    private static final long BASE_DELAY_MS = 50L;

    private StorageRetry() {
    }

    static <T> T call(int attempts, String action, String jobId, Supplier<T> call) {
        int max = Math.max(1, attempts);
        JobStorageException last = null;
        for (int attempt = 1; attempt <= max; attempt++) {
            try {
                return call.get();
            } catch (JobStorageException e) {
                last = e;
                if (attempt < max) {
                    log.warn("Store call failed, retrying action={} jobId={} attempt={} msg={}",
                            action, jobId, attempt, e.getMessage());
                    try {
                        Thread.sleep(BASE_DELAY_MS * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw last;
    }
}
