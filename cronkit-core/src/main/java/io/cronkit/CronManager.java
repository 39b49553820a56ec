package io.cronkit;

import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobSpec;
import io.cronkit.core.JobUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs are persisted through a {@link io.cronkit.store.JobStore}; once {@link #start()} is called a background
 * tick evaluates every active job once per minute and dispatches the due ones. A job never has two executions
 * in flight: a due job that is still running is skipped for that minute, and {@link #runJob(String)} fails fast.
 *
 * <p>Typical usage:
 * <pre>{@code
 * manager.start();
 *
 * CronJob backup = manager.create("nightly-backup")
 *       .schedule("0 2 * * *")
 *       .command("tar czf /backups/db.tgz /var/lib/db")
 *       .timeout(Duration.ofMinutes(30))
 *       .save();
 *
 * manager.pauseJob(backup.id());
 * manager.stop();
 * }</pre>
 */
public interface CronManager extends AutoCloseable {

    /**
     * Start the tick loop. Idempotent.
     */
    void start();

    /**
     * Stop the tick loop and wait for running executions. Idempotent.
     */
    void stop();

    boolean isStarted();

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    JobBuilder create(String name);

    CronJob addJob(JobSpec spec);

    CronJob addJob(String name, String schedule, String command);

    CronJob addAgentJob(String name, String schedule, String prompt, AgentJobConfig config);

    List<CronJob> listJobs();

    /**
     * @throws io.cronkit.exception.JobNotFoundException if no job has this id
     */
    CronJob getJob(String id);

    /**
     * First job with the given name. Names are not unique.
     */
    Optional<CronJob> findJobByName(String name);

    CronJob pauseJob(String id);

    CronJob resumeJob(String id);

    CronJob updateJob(String id, JobUpdate update);

    /**
     * Remove the job. Its execution history is kept until {@link #purgeHistory(String)}.
     */
    void removeJob(String id);

    /**
     * Run the job now, regardless of its schedule and status, and wait for the result.
     *
     * @throws io.cronkit.exception.JobAlreadyRunningException if an execution is in flight
     */
    JobExecution runJob(String id);

    /**
     * Most recent executions first.
     */
    List<JobExecution> getHistory(String id, int limit);

    /**
     * Delete the execution history of a job, removed or not.
     *
     * @return number of deleted records
     */
    int purgeHistory(String id);

    boolean isRunning(String id);

    /**
     * The in-flight execution of a job, in RUNNING state.
     */
    Optional<JobExecution> currentExecution(String id);

    void setAgentExecutor(AgentExecutor executor);

    void addListener(CronEventListener listener);

    void removeListener(CronEventListener listener);

    @Override
    default void close() {
        stop();
    }
}
