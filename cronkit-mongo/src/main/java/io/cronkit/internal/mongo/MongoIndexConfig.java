package io.cronkit.internal.mongo;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the cron job store.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code cronkit.store.mongo.ensure-indexes} is set;
 * in production they are usually managed by migrations or ops scripts.
 *
 * <h3>Collection {@code cron_jobs}</h3>
 * <ul>
 *   <li><b>idx_seq</b>: { seq: 1 } for listing in insertion order</li>
 *   <li><b>idx_name_seq</b>: { name: 1, seq: 1 } for lookup by name</li>
 * </ul>
 *
 * <h3>Collection {@code cron_job_executions}</h3>
 * <ul>
 *   <li><b>idx_job_history</b>: { jobId: 1, _id: -1 } for newest-first history reads and retention trimming</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.cron_jobs.createIndex({ seq: 1 }, { name: "idx_seq" });
 * db.cron_jobs.createIndex({ name: 1, seq: 1 }, { name: "idx_name_seq" });
 * db.cron_job_executions.createIndex({ jobId: 1, _id: -1 }, { name: "idx_job_history" });
 * </pre>
 */
public class MongoIndexConfig {

    public static final String IDX_SEQ = "idx_seq";
    public static final String IDX_NAME_SEQ = "idx_name_seq";
    public static final String IDX_JOB_HISTORY = "idx_job_history";

    private final MongoTemplate mongoTemplate;

    public MongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(seqIndex());
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(nameSeqIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobHistoryIndex());
    }

    public static Index seqIndex() {
        return new Index().on("seq", Sort.Direction.ASC).named(IDX_SEQ);
    }

    public static Index nameSeqIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .on("seq", Sort.Direction.ASC)
                .named(IDX_NAME_SEQ);
    }

    public static Index jobHistoryIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("_id", Sort.Direction.DESC)
                .named(IDX_JOB_HISTORY);
    }
}
