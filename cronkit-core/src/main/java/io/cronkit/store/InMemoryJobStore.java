package io.cronkit.store;

import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.exception.JobStoreException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ephemeral {@link JobStore}; nothing survives the process.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, CronJob> jobs = new LinkedHashMap<>();
    private final Map<String, Deque<JobExecution>> history = new HashMap<>();
    private final int maxHistoryPerJob;

    public InMemoryJobStore() {
        this(0);
    }

    /**
     * @param maxHistoryPerJob retention per job; 0 keeps everything
     */
    public InMemoryJobStore(int maxHistoryPerJob) {
        if (maxHistoryPerJob < 0) {
            throw new IllegalArgumentException("maxHistoryPerJob must not be negative");
        }
        this.maxHistoryPerJob = maxHistoryPerJob;
    }

    @Override
    public synchronized CronJob create(CronJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.containsKey(job.id())) {
            throw new JobStoreException("Job already exists: " + job.id());
        }
        jobs.put(job.id(), job);
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
        jobs.put(id, updated);
        return updated;
    }

    @Override
    public synchronized void remove(String id) {
        if (jobs.remove(id) == null) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public synchronized void appendHistory(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        JobStore.checkFinished(execution);
        Deque<JobExecution> records = history.computeIfAbsent(execution.jobId(), k -> new ArrayDeque<>());
        records.addLast(execution);
        while (maxHistoryPerJob > 0 && records.size() > maxHistoryPerJob) {
            records.removeFirst();
        }
    }

    @Override
    public synchronized List<JobExecution> getHistory(String jobId, int limit) {
        JobStore.checkLimit(limit);
        Deque<JobExecution> records = history.get(jobId);
        if (records == null) {
            return List.of();
        }
        List<JobExecution> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<JobExecution> it = records.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized int purgeHistory(String jobId) {
        Deque<JobExecution> removed = history.remove(jobId);
        return removed == null ? 0 : removed.size();
    }
}
