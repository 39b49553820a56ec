package io.cronkit.internal;

import io.cronkit.AgentExecutor;
import io.cronkit.config.SchedulerProperties;
import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.ExecutionStatus;
import io.cronkit.core.ExecutionTrigger;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobPayload;
import io.cronkit.core.JobStatus;
import io.cronkit.core.ShellPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobDispatcherTest {

    private static final AgentJobConfig AGENT = AgentJobConfig.of("test-model", "sk-test");

    @TempDir
    Path workspace;

    private SchedulerProperties props;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        props = new SchedulerProperties();
        props.setWorkspace(workspace.toString());
        dispatcher = new JobDispatcher(props, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void shellCommandShouldCaptureBothStreams() {
        JobExecution result = run(job(new ShellPayload("echo hello; echo oops 1>&2"), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("hello\n");
        assertThat(result.stderr()).isEqualTo("oops\n");
        assertThat(result.error()).isNull();
        assertThat(result.finishedAt()).isAfterOrEqualTo(result.startedAt());
    }

    @Test
    void nonZeroExitShouldBeFailure() {
        JobExecution result = run(job(new ShellPayload("echo partial; exit 3"), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("partial\n");
        assertThat(result.error()).isEqualTo("Command exited with code 3");
    }

    @Test
    void shellCommandShouldRunInWorkingDirWithEnv(@TempDir Path jobDir) throws Exception {
        JobExecution result = run(job(new ShellPayload("pwd; echo \"$GREETING\""),
                jobDir.toString(), Map.of("GREETING", "hi there"), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.stdout().lines()).containsExactly(jobDir.toRealPath().toString(), "hi there");
    }

    @Test
    void workspaceShouldBeDefaultWorkingDir() throws Exception {
        JobExecution result = run(job(new ShellPayload("pwd"), null, Map.of(), null));

        assertThat(result.stdout().trim()).isEqualTo(workspace.toRealPath().toString());
    }

    @Test
    void slowCommandShouldTimeOut() {
        long begin = System.nanoTime();
        JobExecution result = run(job(new ShellPayload("sleep 10"), null, Map.of(), Duration.ofMillis(300)));

        assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(result.exitCode()).isNull();
        assertThat(result.error()).isEqualTo("Timed out after 300ms");
        assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(8));
    }

    @Test
    void missingShellShouldBeFailureRecord() {
        props.setShell(workspace.resolve("no-such-shell").toString());

        JobExecution result = run(job(new ShellPayload("echo hi"), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(result.error()).startsWith("Failed to execute command");
    }

    @Test
    void outputShouldBeTruncated() {
        props.setMaxOutputChars(10);

        JobExecution result = run(job(new ShellPayload("printf '%0100d' 0"), null, Map.of(), null));

        assertThat(result.stdout()).isEqualTo("0000000000\n...[truncated]");
    }

    @Test
    void largeOutputShouldKeepOnlyTheHead() {
        props.setMaxOutputChars(10);

        JobExecution result = run(job(new ShellPayload("head -c 5000000 /dev/zero | tr '\\0' a; echo done 1>&2"),
                null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.stdout()).isEqualTo("aaaaaaaaaa\n...[truncated]");
        assertThat(result.stderr()).isEqualTo("done\n");
    }

    @Test
    void interruptedDispatchShouldBeCancelled() throws Exception {
        CronJob job = job(new ShellPayload("sleep 10"), null, Map.of(), null);
        AtomicReference<JobExecution> result = new AtomicReference<>();
        Thread worker = new Thread(() -> result.set(run(job)));

        worker.start();
        Thread.sleep(300);
        worker.interrupt();
        worker.join(5_000);

        assertThat(result.get()).isNotNull();
        assertThat(result.get().status()).isEqualTo(ExecutionStatus.CANCELLED);
    }

    @Test
    void agentResponseShouldBeStdout() throws Exception {
        AgentExecutor executor = mock(AgentExecutor.class);
        when(executor.execute(any(), eq("check disk usage"), anyString())).thenReturn("all good");
        dispatcher.setAgentExecutor(executor);

        JobExecution result = run(job(new AgentPayload("check disk usage", AGENT), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.stdout()).isEqualTo("all good");
        assertThat(result.exitCode()).isNull();
        verify(executor).execute(AGENT, "check disk usage", workspace.toString());
    }

    @Test
    void agentWorkspaceShouldOverrideWorkingDir() throws Exception {
        AgentExecutor executor = mock(AgentExecutor.class);
        when(executor.execute(any(), anyString(), anyString())).thenReturn("ok");
        dispatcher.setAgentExecutor(executor);
        AgentJobConfig config = new AgentJobConfig("m", "k", "/srv/agent", null, null);

        run(job(new AgentPayload("p", config), "/srv/job", Map.of(), null));

        verify(executor).execute(config, "p", "/srv/agent");
    }

    @Test
    void agentErrorShouldBeFailureRecord() throws Exception {
        AgentExecutor executor = mock(AgentExecutor.class);
        when(executor.execute(any(), anyString(), anyString())).thenThrow(new IllegalStateException("rate limited"));
        dispatcher.setAgentExecutor(executor);

        JobExecution result = run(job(new AgentPayload("p", AGENT), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(result.stderr()).contains("rate limited");
        assertThat(result.error()).contains("rate limited");
        assertThat(result.exitCode()).isNull();
    }

    @Test
    void agentJobWithoutExecutorShouldBeFailureRecord() {
        JobExecution result = run(job(new AgentPayload("p", AGENT), null, Map.of(), null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(result.error()).contains("No agent executor configured");
        assertThat(result.finishedAt()).isNotNull();
    }

    @Test
    void slowAgentShouldTimeOut() {
        dispatcher.setAgentExecutor((config, prompt, dir) -> {
            Thread.sleep(10_000);
            return "late";
        });

        JobExecution result = run(job(new AgentPayload("p", AGENT), null, Map.of(), Duration.ofMillis(200)));

        assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(result.stdout()).isEmpty();
    }

    @Test
    void agentWithTimeoutShouldStillReturnResponse() {
        dispatcher.setAgentExecutor((config, prompt, dir) -> "quick " + prompt);

        JobExecution result = run(job(new AgentPayload("reply", AGENT), null, Map.of(), Duration.ofSeconds(5)));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.stdout()).isEqualTo("quick reply");
    }

    /* ================= helper ================= */

    private JobExecution run(CronJob job) {
        return dispatcher.dispatch(job, JobExecution.started(job.id(), ExecutionTrigger.MANUAL, Instant.now()));
    }

    private static CronJob job(JobPayload payload, String workingDir, Map<String, String> env, Duration timeout) {
        Instant now = Instant.now();
        return new CronJob(UUID.randomUUID().toString(), "test", "* * * * *", payload, JobStatus.ACTIVE,
                workingDir, env, timeout, null, now, now, null, null, 0, 0);
    }
}
