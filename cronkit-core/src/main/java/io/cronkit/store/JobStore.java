package io.cronkit.store;

import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable keyed collection of jobs and their execution history.
 *
 * <p>Every operation is atomic with respect to a single job id. History is append-only per job and
 * outlives the job itself: {@link #remove(String)} leaves it in place until {@link #purgeHistory(String)}.
 * Implementations may truncate the oldest records of a job beyond a configured retention limit.
 *
 * <p>I/O failures are reported as {@link io.cronkit.exception.JobStoreException}.
 */
public interface JobStore {

    /**
     * @throws io.cronkit.exception.JobStoreException if a job with the same id exists
     */
    CronJob create(CronJob job);

    Optional<CronJob> get(String id);

    /**
     * All jobs in insertion order.
     */
    List<CronJob> list();

    /**
     * First job (in {@link #list()} order) with the given name.
     */
    Optional<CronJob> findByName(String name);

    /**
     * Atomically replace a job with {@code mutator.apply(current)}. The mutator must keep the id and may be
     * invoked more than once by implementations that retry on conflict.
     *
     * @throws io.cronkit.exception.JobNotFoundException if no job has this id
     */
    CronJob update(String id, UnaryOperator<CronJob> mutator);

    /**
     * @throws io.cronkit.exception.JobNotFoundException if no job has this id
     */
    void remove(String id);

    /**
     * Append a finished execution to its job's history.
     */
    void appendHistory(JobExecution execution);

    /**
     * At most {@code limit} executions of a job, most recent first. Works for removed jobs.
     */
    List<JobExecution> getHistory(String jobId, int limit);

    /**
     * @return number of deleted records
     */
    int purgeHistory(String jobId);

    static void checkSameId(String id, CronJob updated) {
        if (updated == null) {
            throw new IllegalStateException("update mutator returned null for job " + id);
        }
        if (!id.equals(updated.id())) {
            throw new IllegalStateException("update mutator must not change the job id: " + id + " -> " + updated.id());
        }
    }

    static void checkFinished(JobExecution execution) {
        if (!execution.status().isTerminal()) {
            throw new IllegalArgumentException("only finished executions can be appended, got " + execution.status()
                    + " for execution " + execution.id());
        }
    }

    static void checkLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
    }
}
