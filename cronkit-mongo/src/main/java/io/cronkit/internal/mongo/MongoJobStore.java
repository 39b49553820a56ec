package io.cronkit.internal.mongo;

import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobPayload;
import io.cronkit.core.ShellPayload;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.exception.JobStoreException;
import io.cronkit.store.JobStore;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * MongoDB-backed {@link JobStore}.
 *
 * <p>Jobs live in {@code cron_jobs}, history in {@code cron_job_executions}. Updates use optimistic
 * locking on the document version and retry the mutator on conflict, so several scheduler
 * processes may share one database without losing writes.
 */
public class MongoJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    static final int MAX_UPDATE_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final int maxHistoryPerJob;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, 0);
    }

    /**
     * @param maxHistoryPerJob retention per job; 0 keeps everything
     */
    public MongoJobStore(MongoTemplate mongoTemplate, int maxHistoryPerJob) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        if (maxHistoryPerJob < 0) {
            throw new IllegalArgumentException("maxHistoryPerJob must not be negative");
        }
        this.maxHistoryPerJob = maxHistoryPerJob;
    }

    @Override
    public CronJob create(CronJob job) {
        Objects.requireNonNull(job, "job must not be null");
        CronJobDocument doc = toDocument(job);
        doc.setSeq(new ObjectId());
        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            throw new JobStoreException("Job already exists: " + job.id(), e);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to insert job " + job.id() + ": " + e.getMessage(), e);
        }
        return job;
    }

    @Override
    public Optional<CronJob> get(String id) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, CronJobDocument.class)).map(MongoJobStore::toJob);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load job " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CronJob> list() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("seq")));
        try {
            return mongoTemplate.find(q, CronJobDocument.class).stream().map(MongoJobStore::toJob).toList();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to list jobs: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<CronJob> findByName(String name) {
        Query q = new Query(Criteria.where("name").is(name)).with(Sort.by(Sort.Order.asc("seq")));
        try {
            return Optional.ofNullable(mongoTemplate.findOne(q, CronJobDocument.class)).map(MongoJobStore::toJob);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to find job by name " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public CronJob update(String id, UnaryOperator<CronJob> mutator) {
        Objects.requireNonNull(mutator, "mutator must not be null");
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            CronJobDocument current;
            try {
                current = mongoTemplate.findById(id, CronJobDocument.class);
            } catch (DataAccessException e) {
                throw new JobStoreException("Failed to load job " + id + ": " + e.getMessage(), e);
            }
            if (current == null) {
                throw new JobNotFoundException(id);
            }

            CronJob updated = mutator.apply(toJob(current));
            JobStore.checkSameId(id, updated);

            CronJobDocument replacement = toDocument(updated);
            replacement.setSeq(current.getSeq());
            replacement.setVersion(current.getVersion());
            try {
                mongoTemplate.save(replacement);
                return updated;
            } catch (OptimisticLockingFailureException e) {
                log.debug("cron job update conflict id={} attempt={}", id, attempt);
            } catch (DataAccessException e) {
                throw new JobStoreException("Failed to update job " + id + ": " + e.getMessage(), e);
            }
        }
        throw new JobStoreException("Gave up updating job " + id + " after " + MAX_UPDATE_ATTEMPTS
                + " concurrent modifications");
    }

    @Override
    public void remove(String id) {
        long deleted;
        try {
            deleted = mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), CronJobDocument.class)
                    .getDeletedCount();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to remove job " + id + ": " + e.getMessage(), e);
        }
        if (deleted == 0) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public void appendHistory(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        JobStore.checkFinished(execution);
        try {
            mongoTemplate.insert(toDocument(execution));
            if (maxHistoryPerJob > 0) {
                trimHistory(execution.jobId());
            }
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to append execution " + execution.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<JobExecution> getHistory(String jobId, int limit) {
        JobStore.checkLimit(limit);
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("_id")))
                .limit(limit);
        try {
            return mongoTemplate.find(q, JobExecutionDocument.class).stream().map(MongoJobStore::toExecution).toList();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load history of job " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int purgeHistory(String jobId) {
        try {
            long deleted = mongoTemplate.remove(new Query(Criteria.where("jobId").is(jobId)), JobExecutionDocument.class)
                    .getDeletedCount();
            return (int) deleted;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to purge history of job " + jobId + ": " + e.getMessage(), e);
        }
    }

    private void trimHistory(String jobId) {
        Query stale = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("_id")))
                .skip(maxHistoryPerJob);
        stale.fields().include("_id");

        List<ObjectId> ids = new ArrayList<>();
        for (JobExecutionDocument d : mongoTemplate.find(stale, JobExecutionDocument.class)) {
            ids.add(d.getId());
        }
        if (ids.isEmpty()) {
            return;
        }
        long deleted = mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), JobExecutionDocument.class)
                .getDeletedCount();
        log.debug("cron job history trimmed jobId={} deleted={}", jobId, deleted);
    }

    /* ================= mapping ================= */

    static CronJobDocument toDocument(CronJob job) {
        CronJobDocument doc = new CronJobDocument();
        doc.setId(job.id());
        doc.setName(job.name());
        doc.setSchedule(job.schedule());
        doc.setType(job.type());
        doc.setStatus(job.status());

        JobPayload payload = job.payload();
        if (payload instanceof ShellPayload shell) {
            doc.setCommand(shell.command());
        } else if (payload instanceof AgentPayload agent) {
            AgentJobConfig config = agent.config();
            doc.setPrompt(agent.prompt());
            doc.setAgentModel(config.model());
            doc.setAgentApiKey(config.apiKey());
            doc.setAgentWorkspace(config.workspace());
            doc.setAgentSystemPrompt(config.systemPrompt());
            doc.setAgentBaseUrl(config.baseUrl());
        }

        doc.setWorkingDir(job.workingDir());
        doc.setEnv(job.env().isEmpty() ? null : job.env());
        doc.setTimeoutMillis(job.timeout() == null ? null : job.timeout().toMillis());
        doc.setTimezone(job.timezone());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        doc.setNextRunAt(job.nextRunAt());
        doc.setLastRunAt(job.lastRunAt());
        doc.setRunCount(job.runCount());
        doc.setFailCount(job.failCount());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(CronJob)}.
     */
    static CronJob toJob(CronJobDocument doc) {
        JobPayload payload = switch (doc.getType()) {
            case SHELL -> new ShellPayload(doc.getCommand());
            case AGENT -> new AgentPayload(doc.getPrompt(), new AgentJobConfig(
                    doc.getAgentModel(),
                    doc.getAgentApiKey(),
                    doc.getAgentWorkspace(),
                    doc.getAgentSystemPrompt(),
                    doc.getAgentBaseUrl()));
        };
        return new CronJob(
                doc.getId(),
                doc.getName(),
                doc.getSchedule(),
                payload,
                doc.getStatus(),
                doc.getWorkingDir(),
                doc.getEnv(),
                doc.getTimeoutMillis() == null ? null : Duration.ofMillis(doc.getTimeoutMillis()),
                doc.getTimezone(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getNextRunAt(),
                doc.getLastRunAt(),
                doc.getRunCount(),
                doc.getFailCount()
        );
    }

    static JobExecutionDocument toDocument(JobExecution execution) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setExecutionId(execution.id());
        doc.setJobId(execution.jobId());
        doc.setTrigger(execution.trigger());
        doc.setStartedAt(execution.startedAt());
        doc.setFinishedAt(execution.finishedAt());
        doc.setStdout(execution.stdout());
        doc.setStderr(execution.stderr());
        doc.setExitCode(execution.exitCode());
        doc.setStatus(execution.status());
        doc.setError(execution.error());
        return doc;
    }

    static JobExecution toExecution(JobExecutionDocument doc) {
        return new JobExecution(
                doc.getExecutionId(),
                doc.getJobId(),
                doc.getTrigger(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getStdout(),
                doc.getStderr(),
                doc.getExitCode(),
                doc.getStatus(),
                doc.getError()
        );
    }
}
