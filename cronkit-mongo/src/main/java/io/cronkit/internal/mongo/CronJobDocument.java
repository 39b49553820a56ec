package io.cronkit.internal.mongo;

import io.cronkit.core.JobStatus;
import io.cronkit.core.JobType;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted cron jobs.
 *
 * <p>The payload is flattened: {@code command} is set for SHELL jobs, {@code prompt} and the
 * {@code agent*} fields for AGENT jobs. {@code seq} preserves insertion order for listing.
 */
@Document(collection = "cron_jobs")
public class CronJobDocument {

    @Id
    private String id;

    @Version
    private Long version;

    private ObjectId seq;

    private String name;
    private String schedule;
    private JobType type;
    private JobStatus status;

    private String command;
    private String prompt;
    private String agentModel;
    private String agentApiKey;
    private String agentWorkspace;
    private String agentSystemPrompt;
    private String agentBaseUrl;

    private String workingDir;
    private Map<String, String> env;
    private Long timeoutMillis;
    private String timezone;

    private Instant createdAt;
    private Instant updatedAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lastRunAt;
    private long runCount;
    private long failCount;

    public CronJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public ObjectId getSeq() {
        return seq;
    }

    public void setSeq(ObjectId seq) {
        this.seq = seq;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = type;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getAgentModel() {
        return agentModel;
    }

    public void setAgentModel(String agentModel) {
        this.agentModel = agentModel;
    }

    public String getAgentApiKey() {
        return agentApiKey;
    }

    public void setAgentApiKey(String agentApiKey) {
        this.agentApiKey = agentApiKey;
    }

    public String getAgentWorkspace() {
        return agentWorkspace;
    }

    public void setAgentWorkspace(String agentWorkspace) {
        this.agentWorkspace = agentWorkspace;
    }

    public String getAgentSystemPrompt() {
        return agentSystemPrompt;
    }

    public void setAgentSystemPrompt(String agentSystemPrompt) {
        this.agentSystemPrompt = agentSystemPrompt;
    }

    public String getAgentBaseUrl() {
        return agentBaseUrl;
    }

    public void setAgentBaseUrl(String agentBaseUrl) {
        this.agentBaseUrl = agentBaseUrl;
    }

    public String getWorkingDir() {
        return workingDir;
    }

    public void setWorkingDir(String workingDir) {
        this.workingDir = workingDir;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public void setEnv(Map<String, String> env) {
        this.env = env;
    }

    public Long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(Long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    public long getFailCount() {
        return failCount;
    }

    public void setFailCount(long failCount) {
        this.failCount = failCount;
    }
}
