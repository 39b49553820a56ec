package io.cronkit.internal.mongo;

import io.cronkit.core.ExecutionStatus;
import io.cronkit.core.ExecutionTrigger;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for one finished execution. The generated {@code _id} orders a job's history.
 */
@Document(collection = "cron_job_executions")
public class JobExecutionDocument {

    @Id
    private ObjectId id;

    private String executionId;
    private String jobId;
    private ExecutionTrigger trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private String stdout;
    private String stderr;
    private Integer exitCode;
    private ExecutionStatus status;
    private String error;

    public JobExecutionDocument() {
    }

    public ObjectId getId() {
        return id;
    }

    public void setId(ObjectId id) {
        this.id = id;
    }

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public ExecutionTrigger getTrigger() {
        return trigger;
    }

    public void setTrigger(ExecutionTrigger trigger) {
        this.trigger = trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getStdout() {
        return stdout;
    }

    public void setStdout(String stdout) {
        this.stdout = stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public void setStderr(String stderr) {
        this.stderr = stderr;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public void setExitCode(Integer exitCode) {
        this.exitCode = exitCode;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
