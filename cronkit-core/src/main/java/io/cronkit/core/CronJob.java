package io.cronkit.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted scheduled job.
 *
 * <p>Immutable; every change produces a new instance through one of the {@code with*} methods.
 * The id is the only lookup key, names are labels and may repeat.
 *
 * @param id         generated identifier, stable for the job's lifetime
 * @param name       human readable label
 * @param schedule   cron expression text as validated on add/update
 * @param payload    what to run
 * @param status     ACTIVE or PAUSED
 * @param workingDir working directory for the payload; null means the scheduler workspace
 * @param env        extra environment variables for shell payloads
 * @param timeout    per-run deadline; null means none
 * @param timezone   IANA zone for due checks; null means the scheduler default
 * @param createdAt  creation time
 * @param updatedAt  last administrative change
 * @param nextRunAt  next fire time computed after the last change or run; null if unknown
 * @param lastRunAt  start time of the most recent execution
 * @param runCount   number of successful executions
 * @param failCount  number of unsuccessful executions
 */
public record CronJob(
        String id,
        String name,
        String schedule,
        JobPayload payload,
        JobStatus status,
        String workingDir,
        Map<String, String> env,
        Duration timeout,
        String timezone,
        Instant createdAt,
        Instant updatedAt,
        Instant nextRunAt,
        Instant lastRunAt,
        long runCount,
        long failCount
) {

    public CronJob {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(status, "status must not be null");
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    @JsonIgnore
    public JobType type() {
        return payload.kind();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    public CronJob withStatus(JobStatus newStatus, Instant at, Instant newNextRunAt) {
        return new CronJob(id, name, schedule, payload, newStatus, workingDir, env, timeout, timezone,
                createdAt, at, newNextRunAt, lastRunAt, runCount, failCount);
    }

    public CronJob withNextRunAt(Instant newNextRunAt) {
        return new CronJob(id, name, schedule, payload, status, workingDir, env, timeout, timezone,
                createdAt, updatedAt, newNextRunAt, lastRunAt, runCount, failCount);
    }

    public CronJob withDefinition(String newName,
                                  String newSchedule,
                                  JobPayload newPayload,
                                  String newWorkingDir,
                                  Map<String, String> newEnv,
                                  Duration newTimeout,
                                  String newTimezone,
                                  Instant at,
                                  Instant newNextRunAt) {
        return new CronJob(id, newName, newSchedule, newPayload, status, newWorkingDir, newEnv, newTimeout,
                newTimezone, createdAt, at, newNextRunAt, lastRunAt, runCount, failCount);
    }

    /**
     * Folds a finished execution into the run statistics.
     */
    public CronJob withRun(JobExecution execution, Instant newNextRunAt) {
        boolean ok = execution.status() == ExecutionStatus.SUCCESS;
        return new CronJob(id, name, schedule, payload, status, workingDir, env, timeout, timezone,
                createdAt, updatedAt, newNextRunAt, execution.startedAt(),
                ok ? runCount + 1 : runCount,
                ok ? failCount : failCount + 1);
    }
}
