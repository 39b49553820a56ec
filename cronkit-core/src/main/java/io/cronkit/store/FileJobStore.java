package io.cronkit.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.exception.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * {@link JobStore} persisted as a single JSON document.
 *
 * <p>The whole table is held in memory and every mutation rewrites the file: the new document is written and
 * fsynced to a temp file next to the target, then renamed over it atomically. A crash at any point leaves
 * either the previous or the new document on disk, never a partial one. In-memory state only changes after the
 * write succeeded, so a failed write leaves both views unchanged.
 *
 * <p>Layout:
 * <pre>
 * {
 *   "version": 1,
 *   "savedAt": "2026-01-01T00:00:00Z",
 *   "jobs":    { "&lt;jobId&gt;": { ...job... } },
 *   "history": { "&lt;jobId&gt;": [ oldest, ..., newest ] }
 * }
 * </pre>
 */
public class FileJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    public static final int STORE_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * The store file schema.
     */
    public record StoreFile(
            int version,
            Instant savedAt,
            Map<String, CronJob> jobs,
            Map<String, List<JobExecution>> history) {

        public static StoreFile empty() {
            return new StoreFile(STORE_VERSION, null, new LinkedHashMap<>(), new LinkedHashMap<>());
        }
    }

    private final Path path;
    private final int maxHistoryPerJob;

    private Map<String, CronJob> jobs;
    private Map<String, List<JobExecution>> history;

    /**
     * Opens the store, loading {@code path} if it exists.
     *
     * @param path             store file; parent directories are created on first write
     * @param maxHistoryPerJob retention per job; 0 keeps everything
     * @throws JobStoreException if the file exists but cannot be read or parsed
     */
    public FileJobStore(Path path, int maxHistoryPerJob) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        if (maxHistoryPerJob < 0) {
            throw new IllegalArgumentException("maxHistoryPerJob must not be negative");
        }
        this.maxHistoryPerJob = maxHistoryPerJob;

        StoreFile loaded = load(this.path);
        this.jobs = loaded.jobs();
        this.history = loaded.history();
        log.info("Cron job store opened path={} jobs={}", this.path, jobs.size());
    }

    public FileJobStore(Path path) {
        this(path, 0);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized CronJob create(CronJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.containsKey(job.id())) {
            throw new JobStoreException("Job already exists: " + job.id());
        }
        commitJobs(next -> next.put(job.id(), job));
        return job;
    }

    @Override
    public synchronized Optional<CronJob> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized List<CronJob> list() {
        return List.copyOf(jobs.values());
    }

    @Override
    public synchronized Optional<CronJob> findByName(String name) {
        return jobs.values().stream().filter(j -> j.name().equals(name)).findFirst();
    }

    @Override
    public synchronized CronJob update(String id, UnaryOperator<CronJob> mutator) {
        Objects.requireNonNull(mutator, "mutator must not be null");
        CronJob current = jobs.get(id);
        if (current == null) {
            throw new JobNotFoundException(id);
        }
        CronJob updated = mutator.apply(current);
        JobStore.checkSameId(id, updated);
        commitJobs(next -> next.put(id, updated));
        return updated;
    }

    @Override
    public synchronized void remove(String id) {
        if (!jobs.containsKey(id)) {
            throw new JobNotFoundException(id);
        }
        commitJobs(next -> next.remove(id));
    }

    @Override
    public synchronized void appendHistory(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        JobStore.checkFinished(execution);
        commitHistory(next -> {
            List<JobExecution> records = new ArrayList<>(next.getOrDefault(execution.jobId(), List.of()));
            records.add(execution);
            if (maxHistoryPerJob > 0 && records.size() > maxHistoryPerJob) {
                records = new ArrayList<>(records.subList(records.size() - maxHistoryPerJob, records.size()));
            }
            next.put(execution.jobId(), records);
        });
    }

    @Override
    public synchronized List<JobExecution> getHistory(String jobId, int limit) {
        JobStore.checkLimit(limit);
        List<JobExecution> records = history.getOrDefault(jobId, List.of());
        List<JobExecution> result = new ArrayList<>(Math.min(limit, records.size()));
        for (int i = records.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(records.get(i));
        }
        return result;
    }

    @Override
    public synchronized int purgeHistory(String jobId) {
        List<JobExecution> records = history.get(jobId);
        if (records == null) {
            return 0;
        }
        commitHistory(next -> next.remove(jobId));
        return records.size();
    }

    /* ================= persistence ================= */

    private void commitJobs(Consumer<Map<String, CronJob>> change) {
        Map<String, CronJob> next = new LinkedHashMap<>(jobs);
        change.accept(next);
        write(next, history);
        jobs = next;
    }

    private void commitHistory(Consumer<Map<String, List<JobExecution>>> change) {
        Map<String, List<JobExecution>> next = new LinkedHashMap<>(history);
        change.accept(next);
        write(jobs, next);
        history = next;
    }

    private void write(Map<String, CronJob> nextJobs, Map<String, List<JobExecution>> nextHistory) {
        StoreFile file = new StoreFile(STORE_VERSION, Instant.now(), nextJobs, nextHistory);
        Path tmp = null;
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] bytes = MAPPER.writeValueAsBytes(file);

            tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            log.debug("Saved cron job store path={} jobs={}", path, nextJobs.size());
        } catch (IOException e) {
            throw new JobStoreException("Failed to write cron job store " + path + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    /**
     * Load a store file. A missing or empty file is an empty store.
     *
     * @throws JobStoreException if the file cannot be read or parsed
     */
    static StoreFile load(Path path) {
        if (!Files.exists(path)) {
            log.debug("Cron job store file not found, starting empty: {}", path);
            return StoreFile.empty();
        }
        try {
            String content = Files.readString(path);
            if (content.isBlank()) {
                return StoreFile.empty();
            }
            StoreFile raw = MAPPER.readValue(content, StoreFile.class);
            if (raw.version() > STORE_VERSION) {
                throw new JobStoreException("Unsupported cron job store version " + raw.version() + " in " + path);
            }

            Map<String, CronJob> jobs = new LinkedHashMap<>();
            if (raw.jobs() != null) {
                for (Map.Entry<String, CronJob> entry : raw.jobs().entrySet()) {
                    CronJob job = entry.getValue();
                    if (job == null) {
                        log.warn("Skipping empty cron job entry: {}", entry.getKey());
                        continue;
                    }
                    jobs.put(job.id(), job);
                }
            }
            Map<String, List<JobExecution>> history = new LinkedHashMap<>();
            if (raw.history() != null) {
                raw.history().forEach((jobId, records) -> {
                    if (records != null) {
                        history.put(jobId, List.copyOf(records));
                    }
                });
            }
            return new StoreFile(STORE_VERSION, raw.savedAt(), jobs, history);
        } catch (IOException e) {
            throw new JobStoreException("Failed to load cron job store " + path + ": " + e.getMessage(), e);
        }
    }
}
