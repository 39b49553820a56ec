package io.cronkit.store;

import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.ExecutionTrigger;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobStatus;
import io.cronkit.core.ShellPayload;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.exception.JobStoreException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavior every {@link JobStore} implementation must share.
 */
public abstract class JobStoreContractTest {

    protected static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    /**
     * @param maxHistoryPerJob retention per job; 0 keeps everything
     */
    protected abstract JobStore createStore(int maxHistoryPerJob);

    @Test
    void createdJobsShouldBeListedInInsertionOrder() {
        JobStore store = createStore(0);
        CronJob a = store.create(shellJob("a"));
        CronJob b = store.create(shellJob("b"));
        CronJob c = store.create(shellJob("c"));

        assertThat(store.list()).extracting(CronJob::id).containsExactly(a.id(), b.id(), c.id());
        assertThat(store.get(b.id())).contains(b);
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void createShouldRejectDuplicateId() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));

        assertThatThrownBy(() -> store.create(job)).isInstanceOf(JobStoreException.class);
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void everyFieldShouldSurviveStorage() {
        JobStore store = createStore(0);
        CronJob agent = new CronJob(
                UUID.randomUUID().toString(),
                "weekly-report",
                "0 9 * * 1",
                new AgentPayload("Summarize last week's incidents",
                        new AgentJobConfig("gpt-test", "sk-secret", "/srv/agent", "Be brief", "https://llm.local")),
                JobStatus.PAUSED,
                "/srv/reports",
                Map.of("REPORT_ENV", "prod", "LANG", "C"),
                Duration.ofMinutes(5),
                "Asia/Taipei",
                T0,
                T0.plusSeconds(30),
                Instant.parse("2026-01-05T01:00:00Z"),
                Instant.parse("2025-12-29T01:00:00.123Z"),
                7,
                2
        );
        store.create(agent);

        assertThat(store.get(agent.id())).contains(agent);
    }

    @Test
    void findByNameShouldReturnFirstOfDuplicateNames() {
        JobStore store = createStore(0);
        CronJob first = store.create(shellJob("backup"));
        store.create(shellJob("backup"));

        assertThat(store.findByName("backup")).contains(first);
        assertThat(store.findByName("restore")).isEmpty();
    }

    @Test
    void updateShouldReplaceJob() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));

        CronJob updated = store.update(job.id(), j -> j.withStatus(JobStatus.PAUSED, T0.plusSeconds(60), null));

        assertThat(updated.status()).isEqualTo(JobStatus.PAUSED);
        assertThat(updated.updatedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(store.get(job.id())).contains(updated);
    }

    @Test
    void updateOfUnknownJobShouldFail() {
        JobStore store = createStore(0);

        assertThatThrownBy(() -> store.update("missing", j -> j))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void updateMustNotChangeId() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));
        CronJob other = shellJob("b");

        assertThatThrownBy(() -> store.update(job.id(), j -> other))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(job.id())).contains(job);
    }

    @Test
    void removeShouldDeleteJob() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));

        store.remove(job.id());

        assertThat(store.get(job.id())).isEmpty();
        assertThat(store.list()).isEmpty();
        assertThatThrownBy(() -> store.remove(job.id())).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void historyShouldBeReturnedMostRecentFirst() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));
        JobExecution first = finished(job.id(), T0);
        JobExecution second = finished(job.id(), T0.plusSeconds(60));
        JobExecution third = failed(job.id(), T0.plusSeconds(120));

        store.appendHistory(first);
        store.appendHistory(second);
        store.appendHistory(third);

        assertThat(store.getHistory(job.id(), 10)).containsExactly(third, second, first);
        assertThat(store.getHistory(job.id(), 2)).containsExactly(third, second);
        assertThat(store.getHistory("other", 10)).isEmpty();
    }

    @Test
    void historyShouldRejectRunningExecution() {
        JobStore store = createStore(0);
        JobExecution running = JobExecution.started("job", ExecutionTrigger.MANUAL, T0);

        assertThatThrownBy(() -> store.appendHistory(running)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historyLimitMustBePositive() {
        JobStore store = createStore(0);

        assertThatThrownBy(() -> store.getHistory("job", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historyShouldOutliveRemovedJobUntilPurged() {
        JobStore store = createStore(0);
        CronJob job = store.create(shellJob("a"));
        store.appendHistory(finished(job.id(), T0));
        store.appendHistory(finished(job.id(), T0.plusSeconds(60)));

        store.remove(job.id());

        assertThat(store.getHistory(job.id(), 10)).hasSize(2);
        assertThat(store.purgeHistory(job.id())).isEqualTo(2);
        assertThat(store.getHistory(job.id(), 10)).isEmpty();
        assertThat(store.purgeHistory(job.id())).isZero();
    }

    @Test
    void retentionShouldDropOldestRecords() {
        JobStore store = createStore(3);
        CronJob job = store.create(shellJob("a"));
        for (int i = 0; i < 5; i++) {
            store.appendHistory(finished(job.id(), T0.plusSeconds(60L * i)));
        }

        List<JobExecution> history = store.getHistory(job.id(), 10);

        assertThat(history).extracting(JobExecution::startedAt).containsExactly(
                T0.plusSeconds(240), T0.plusSeconds(180), T0.plusSeconds(120));
    }

    @Test
    void executionFieldsShouldSurviveStorage() {
        JobStore store = createStore(0);
        JobExecution timedOut = JobExecution.started("job-1", ExecutionTrigger.SCHEDULED, T0)
                .timedOut(T0.plusMillis(1500), Duration.ofSeconds(1), "partial out", "partial err");
        JobExecution agent = JobExecution.started("job-1", ExecutionTrigger.MANUAL, T0.plusSeconds(60))
                .answered(T0.plusSeconds(61), "All systems nominal");

        store.appendHistory(timedOut);
        store.appendHistory(agent);

        assertThat(store.getHistory("job-1", 10)).containsExactly(agent, timedOut);
    }

    /* ================= fixtures ================= */

    protected static CronJob shellJob(String name) {
        return new CronJob(
                UUID.randomUUID().toString(),
                name,
                "*/5 * * * *",
                new ShellPayload("echo " + name),
                JobStatus.ACTIVE,
                null,
                Map.of(),
                null,
                null,
                T0,
                T0,
                T0.plusSeconds(300),
                null,
                0,
                0
        );
    }

    protected static JobExecution finished(String jobId, Instant startedAt) {
        return JobExecution.started(jobId, ExecutionTrigger.SCHEDULED, startedAt)
                .exited(startedAt.plusMillis(250), 0, "ok\n", "");
    }

    protected static JobExecution failed(String jobId, Instant startedAt) {
        return JobExecution.started(jobId, ExecutionTrigger.MANUAL, startedAt)
                .exited(startedAt.plusMillis(250), 2, "", "boom\n");
    }
}
