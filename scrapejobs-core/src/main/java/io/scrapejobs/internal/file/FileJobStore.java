package io.scrapejobs.internal.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scrapejobs.JobStore;
import io.scrapejobs.core.JobNotFoundException;
import io.scrapejobs.core.JobStorageException;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.SchedulerLock;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.JobJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Stores one JSON document per job ({@code <id>.json}) in a directory.
 *
 * <p>Writes go to a temp file that is forced to disk and then renamed over the record, so a reader
 * never sees a half-written job. Writes to the same id are serialized with a per-id lock; this
 * covers the threads of one process. Cross-process exclusivity comes from
 * {@link #tryLockScheduler()}.
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    static final String SUFFIX = ".json";
    static final String QUARANTINE_DIR = "quarantine";
    static final String LOCK_FILE = ".scheduler.lock";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._-]+$");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileJobStore(Path directory) {
        this(directory, JobJson.objectMapper(), Clock.systemUTC());
    }

    public FileJobStore(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new JobStorageException("Cannot create job storage directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public ScrapeJob create(ScrapeJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        }
        String id = job.getId();
        Path file = pathFor(id);

        ReentrantLock lock = acquire(id);
        try {
            if (Files.exists(file)) {
                throw new IllegalArgumentException("Job already exists: " + id);
            }
            Instant now = clock.instant();
            if (job.getCreatedAt() == null) {
                job.setCreatedAt(now);
            }
            job.touch(now);
            write(file, job);
            log.debug("Job created id={} config={}", id, job.getConfigName());
            return job;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScrapeJob> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Path file = pathFor(id);
        ReentrantLock lock = acquire(id);
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(read(file));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ScrapeJob update(ScrapeJob job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = Objects.requireNonNull(job.getId(), "job.id must not be null");
        Path file = pathFor(id);
        ReentrantLock lock = acquire(id);
        try {
            if (!Files.exists(file)) {
                throw new JobNotFoundException(id);
            }
            job.touch(clock.instant());
            write(file, job);
            return job;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScrapeJob> modify(String id, Predicate<ScrapeJob> mutation) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(mutation, "mutation must not be null");
        Path file = pathFor(id);
        ReentrantLock lock = acquire(id);
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            ScrapeJob job = read(file);
            if (!mutation.test(job)) {
                return Optional.empty();
            }
            job.touch(clock.instant());
            write(file, job);
            return Optional.of(job);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Path file = pathFor(id);
        ReentrantLock lock = acquire(id);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.debug("Job deleted id={}", id);
            }
            locks.remove(id, lock);
            return deleted;
        } catch (IOException e) {
            throw new JobStorageException("Cannot delete job " + id, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * All readable jobs ordered by creation time. Unreadable files are skipped with a warning;
     * {@link #repair()} moves them aside.
     */
    @Override
    public List<ScrapeJob> list() {
        List<ScrapeJob> jobs = new ArrayList<>();
        for (Path file : jobFiles()) {
            try {
                jobs.add(objectMapper.readValue(file.toFile(), ScrapeJob.class));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable job file path={} msg={}", file, e.getMessage());
            }
        }
        jobs.sort(Comparator.comparing(ScrapeJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(ScrapeJob::getId));
        return jobs;
    }

    @Override
    public RepairReport repair() {
        int scanned = 0;
        int valid = 0;
        int quarantined = 0;
        Path quarantine = directory.resolve(QUARANTINE_DIR);
        for (Path file : jobFiles()) {
            String id = idOf(file);
            ReentrantLock lock = acquire(id);
            try {
                if (!Files.exists(file)) {
                    continue;
                }
                scanned++;
                if (isReadable(file, id)) {
                    valid++;
                } else {
                    quarantine(file, quarantine);
                    locks.remove(id, lock);
                    quarantined++;
                }
            } finally {
                lock.unlock();
            }
        }
        RepairReport report = new RepairReport(scanned, valid, quarantined);
        log.info("Job store repair finished dir={} scanned={} valid={} quarantined={}",
                directory, scanned, valid, quarantined);
        return report;
    }

    private boolean isReadable(Path file, String id) {
        try {
            ScrapeJob job = objectMapper.readValue(file.toFile(), ScrapeJob.class);
            if (job.getId() == null || !job.getId().equals(id) || job.getSchedule() == null
                    || job.getConfigName() == null) {
                log.warn("Job file is incomplete or does not match its name path={}", file);
                return false;
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Job file is unreadable path={} msg={}", file, e.getMessage());
            return false;
        }
    }

    private void quarantine(Path file, Path quarantine) {
        try {
            Files.createDirectories(quarantine);
            Path target = quarantine.resolve(file.getFileName().toString() + "." + clock.millis());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Quarantined job file path={} target={}", file, target);
        } catch (IOException e) {
            throw new JobStorageException("Cannot quarantine " + file, e);
        }
    }

    /**
     * Takes an exclusive OS lock on {@code .scheduler.lock} in the storage directory.
     */
    @Override
    public Optional<SchedulerLock> tryLockScheduler() {
        Path lockFile = directory.resolve(LOCK_FILE);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                return Optional.empty();
            }
            FileChannel held = channel;
            return Optional.of(() -> {
                try {
                    fileLock.release();
                    held.close();
                } catch (IOException e) {
                    log.warn("Failed to release scheduler lock path={} msg={}", lockFile, e.getMessage());
                }
            });
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel, lockFile);
            return Optional.empty();
        } catch (IOException e) {
            closeQuietly(channel, lockFile);
            throw new JobStorageException("Cannot open scheduler lock " + lockFile, e);
        }
    }

    private void closeQuietly(FileChannel channel, Path lockFile) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close scheduler lock channel path={} msg={}", lockFile, e.getMessage());
        }
    }

    /**
     * Locks the id's writer lock. {@link #delete} drops the entry, so a caller that was waiting on
     * a dropped lock goes round again and takes the current one.
     */
    private ReentrantLock acquire(String id) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(id) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int lockEntries() {
        return locks.size();
    }

    private Path pathFor(String id) {
        if (!SAFE_ID.matcher(id).matches() || id.startsWith(".")) {
            throw new IllegalArgumentException("Invalid job id: " + id);
        }
        return directory.resolve(id + SUFFIX);
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }

    private List<Path> jobFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            throw new JobStorageException("Cannot list job storage directory " + directory, e);
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    private ScrapeJob read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ScrapeJob.class);
        } catch (IOException e) {
            throw new JobStorageException("Cannot read job file " + file, e);
        }
    }

    private void write(Path file, ScrapeJob job) {
        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(job);
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new JobStorageException("Cannot write job " + job.getId(), e);
        }
    }
}
