package io.cronkit.internal.mongo;

import com.mongodb.client.result.DeleteResult;
import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobStatus;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.exception.JobStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Failure handling that needs no database.
 */
class MongoJobStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoJobStore store = new MongoJobStore(mongoTemplate, 10);

    @Test
    void updateShouldGiveUpAfterRepeatedConflicts() {
        CronJobDocument doc = MongoJobStore.toDocument(agentJob());
        doc.setVersion(3L);
        when(mongoTemplate.findById("job-1", CronJobDocument.class)).thenReturn(doc);
        when(mongoTemplate.save(any(CronJobDocument.class))).thenThrow(new OptimisticLockingFailureException("stale"));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> store.update("job-1", j -> {
            calls.incrementAndGet();
            return j.withStatus(JobStatus.PAUSED, T0, null);
        })).isInstanceOf(JobStoreException.class).hasMessageContaining("job-1");

        assertThat(calls.get()).isEqualTo(MongoJobStore.MAX_UPDATE_ATTEMPTS);
    }

    @Test
    void updateOfMissingDocumentShouldBeNotFound() {
        when(mongoTemplate.findById("gone", CronJobDocument.class)).thenReturn(null);

        assertThatThrownBy(() -> store.update("gone", j -> j)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void removeOfMissingDocumentShouldBeNotFound() {
        when(mongoTemplate.remove(any(Query.class), eq(CronJobDocument.class))).thenReturn(DeleteResult.acknowledged(0));

        assertThatThrownBy(() -> store.remove("gone")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void duplicateKeyShouldBeStoreException() {
        when(mongoTemplate.insert(any(CronJobDocument.class))).thenThrow(new DuplicateKeyException("E11000"));

        assertThatThrownBy(() -> store.create(agentJob()))
                .isInstanceOf(JobStoreException.class)
                .hasMessage("Job already exists: job-1");
    }

    @Test
    void driverFailureShouldBeStoreException() {
        when(mongoTemplate.findById("job-1", CronJobDocument.class))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.get("job-1"))
                .isInstanceOf(JobStoreException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void agentPayloadShouldMapToFlatFields() {
        CronJob job = agentJob();

        CronJobDocument doc = MongoJobStore.toDocument(job);

        assertThat(doc.getPrompt()).isEqualTo("summarize alerts");
        assertThat(doc.getAgentModel()).isEqualTo("model-x");
        assertThat(doc.getAgentWorkspace()).isEqualTo("/srv/agent");
        assertThat(doc.getCommand()).isNull();
        assertThat(doc.getTimeoutMillis()).isEqualTo(120_000L);
        assertThat(MongoJobStore.toJob(doc)).isEqualTo(job);
    }

    @Test
    void negativeRetentionShouldBeRejected() {
        assertThatThrownBy(() -> new MongoJobStore(mongoTemplate, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    /* ================= helper ================= */

    private static CronJob agentJob() {
        return new CronJob("job-1", "alerts", "0 * * * *",
                new AgentPayload("summarize alerts", new AgentJobConfig("model-x", "key", "/srv/agent", null, null)),
                JobStatus.ACTIVE, null, Map.of("A", "1"), Duration.ofMinutes(2), null,
                T0, T0, T0.plusSeconds(3600), null, 0, 0);
    }
}
