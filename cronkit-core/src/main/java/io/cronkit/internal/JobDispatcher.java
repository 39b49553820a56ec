package io.cronkit.internal;

import io.cronkit.AgentExecutor;
import io.cronkit.config.SchedulerProperties;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobPayload;
import io.cronkit.core.ShellPayload;
import io.cronkit.exception.ExecutorNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes a job payload and turns the outcome into a finished {@link JobExecution}.
 *
 * <p>{@link #dispatch} never throws: process errors, executor failures, a missing agent executor and any
 * unexpected fault become a FAILURE record; an interrupt becomes CANCELLED and a per-job deadline TIMEOUT.
 */
public class JobDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private static final String TRUNCATED_MARKER = "\n...[truncated]";

    private final SchedulerProperties props;
    private final Clock clock;
    private final AtomicReference<AgentExecutor> agentExecutor = new AtomicReference<>();

    // stream pumps and deadline-bound agent calls
    private final ExecutorService ioPool;

    public JobDispatcher(SchedulerProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        AtomicInteger seq = new AtomicInteger();
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("cronkit.io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void setAgentExecutor(AgentExecutor executor) {
        agentExecutor.set(executor);
    }

    /**
     * Run {@code job} for the execution {@code started} and return the finished record.
     */
    public JobExecution dispatch(CronJob job, JobExecution started) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(started, "started must not be null");
        try {
            JobPayload payload = job.payload();
            if (payload instanceof ShellPayload shell) {
                return runShell(job, shell, started);
            }
            if (payload instanceof AgentPayload agent) {
                return runAgent(job, agent, started);
            }
            throw new IllegalStateException("Unsupported payload type: " + payload.getClass().getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("cron job interrupted name={} id={}", job.name(), job.id());
            return started.cancelled(now(), "Execution interrupted");
        } catch (ExecutorNotConfiguredException e) {
            log.error("cron agent job cannot run name={} id={} msg={}", job.name(), job.id(), e.getMessage());
            return started.failed(now(), e.getMessage());
        } catch (Throwable t) {
            log.error("cron job dispatch failed name={} id={} msg={}", job.name(), job.id(), t.getMessage(), t);
            return started.failed(now(), "Unexpected dispatch failure: " + describe(t));
        }
    }

    private JobExecution runShell(CronJob job, ShellPayload shell, JobExecution started) throws InterruptedException {
        String workingDir = workingDir(job);
        ProcessBuilder pb = new ProcessBuilder(props.getShell(), "-c", shell.command())
                .directory(new File(workingDir))
                .redirectErrorStream(false);
        pb.environment().putAll(job.env());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return started.failed(now(), "Failed to execute command: " + e.getMessage());
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("cron job stdin close failed id={} msg={}", job.id(), e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), ioPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), ioPool);

        try {
            Duration timeout = effectiveTimeout(job);
            if (timeout != null) {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    kill(process);
                    process.waitFor(5, TimeUnit.SECONDS);
                    log.warn("cron job timed out name={} id={} timeout={}", job.name(), job.id(), timeout);
                    return started.timedOut(now(), timeout, collect(stdout), collect(stderr));
                }
            } else {
                process.waitFor();
            }
            int exitCode = process.exitValue();
            return started.exited(now(), exitCode, collect(stdout), collect(stderr));
        } finally {
            if (process.isAlive()) {
                kill(process);
            }
        }
    }

    // children first, they would otherwise keep the output pipes open
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private JobExecution runAgent(CronJob job, AgentPayload agent, JobExecution started) throws InterruptedException {
        AgentExecutor executor = agentExecutor.get();
        if (executor == null) {
            throw new ExecutorNotConfiguredException(job.id());
        }
        String workingDir = agent.config().workspace() != null ? agent.config().workspace() : workingDir(job);

        Duration timeout = effectiveTimeout(job);
        try {
            String response;
            if (timeout == null) {
                response = executor.execute(agent.config(), agent.prompt(), workingDir);
            } else {
                Future<String> call = ioPool.submit(() -> executor.execute(agent.config(), agent.prompt(), workingDir));
                try {
                    response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    call.cancel(true);
                    log.warn("cron agent job timed out name={} id={} timeout={}", job.name(), job.id(), timeout);
                    return started.timedOut(now(), timeout, "", "");
                } catch (InterruptedException e) {
                    call.cancel(true);
                    throw e;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    return agentFailed(job, started, cause);
                }
            }
            return started.answered(now(), truncate(response == null ? "" : response));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            return agentFailed(job, started, e);
        }
    }

    private JobExecution agentFailed(CronJob job, JobExecution started, Throwable cause) {
        log.warn("cron agent job failed name={} id={} msg={}", job.name(), job.id(), cause.getMessage());
        return started.failed(now(), "Agent execution failed: " + describe(cause));
    }

    private String workingDir(CronJob job) {
        return job.workingDir() != null ? job.workingDir() : props.getWorkspace();
    }

    private static Duration effectiveTimeout(CronJob job) {
        Duration timeout = job.timeout();
        return timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
    }

    /**
     * Keeps the first {@code maxOutputChars} characters and discards the rest, reading to EOF so the child never
     * blocks on a full pipe.
     */
    private String drain(InputStream in) {
        int max = props.getMaxOutputChars();
        StringBuilder out = new StringBuilder(Math.min(max, 8192));
        boolean truncated = false;
        char[] buf = new char[8192];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                int room = max - out.length();
                if (n > room) {
                    out.append(buf, 0, room);
                    truncated = true;
                } else {
                    out.append(buf, 0, n);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return truncated ? out + TRUNCATED_MARKER : out.toString();
    }

    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }

    private String truncate(String text) {
        int max = props.getMaxOutputChars();
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + TRUNCATED_MARKER;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public void close() {
        ioPool.shutdownNow();
    }
}
