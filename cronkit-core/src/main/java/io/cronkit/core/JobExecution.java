package io.cronkit.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of a job.
 *
 * <p>A record is created {@link ExecutionStatus#RUNNING} by {@link #started} and finished exactly once by
 * one of the terminal transitions; only finished records are appended to history.
 *
 * @param id         execution id
 * @param jobId      owning job
 * @param trigger    scheduled tick or manual run
 * @param startedAt  start time
 * @param finishedAt end time; null while running
 * @param stdout     captured standard output, or the agent response
 * @param stderr     captured standard error, or the agent error message
 * @param exitCode   process exit code; null for agent jobs and abnormal termination
 * @param status     outcome
 * @param error      failure reason, null on success
 */
public record JobExecution(
        String id,
        String jobId,
        ExecutionTrigger trigger,
        Instant startedAt,
        Instant finishedAt,
        String stdout,
        String stderr,
        Integer exitCode,
        ExecutionStatus status,
        String error
) {

    public JobExecution {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static JobExecution started(String jobId, ExecutionTrigger trigger, Instant startedAt) {
        return new JobExecution(UUID.randomUUID().toString(), jobId, trigger, startedAt, null,
                "", "", null, ExecutionStatus.RUNNING, null);
    }

    /**
     * Shell process finished; success iff exit code 0.
     */
    public JobExecution exited(Instant at, int code, String out, String err) {
        ExecutionStatus outcome = code == 0 ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILURE;
        String reason = code == 0 ? null : "Command exited with code " + code;
        return finish(at, out, err, code, outcome, reason);
    }

    /**
     * Agent executor returned a response.
     */
    public JobExecution answered(Instant at, String response) {
        return finish(at, response, "", null, ExecutionStatus.SUCCESS, null);
    }

    public JobExecution failed(Instant at, String reason) {
        return finish(at, stdout, reason, exitCode, ExecutionStatus.FAILURE, reason);
    }

    public JobExecution timedOut(Instant at, Duration limit, String out, String err) {
        return finish(at, out, err, null, ExecutionStatus.TIMEOUT, "Timed out after " + limit.toMillis() + "ms");
    }

    public JobExecution cancelled(Instant at, String reason) {
        return finish(at, stdout, stderr, null, ExecutionStatus.CANCELLED, reason);
    }

    private JobExecution finish(Instant at, String out, String err, Integer code, ExecutionStatus outcome,
                                String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " already finished with " + status);
        }
        return new JobExecution(id, jobId, trigger, startedAt, at, out, err, code, outcome, reason);
    }

    @JsonIgnore
    public Duration duration() {
        return finishedAt == null ? null : Duration.between(startedAt, finishedAt);
    }

    @JsonIgnore
    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
