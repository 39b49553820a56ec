package io.cronkit.internal;

import io.cronkit.JobBuilder;
import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.AgentPayload;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobPayload;
import io.cronkit.core.JobSpec;
import io.cronkit.core.JobStatus;
import io.cronkit.core.ShellPayload;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link DefaultCronManager}.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String name;
    private final Function<JobSpec, CronJob> persister;

    private String schedule;
    private String timezone;
    private JobStatus initialStatus = JobStatus.ACTIVE;

    private JobPayload payload;
    private String workingDir;
    private final Map<String, String> env = new LinkedHashMap<>();
    private Duration timeout;

    public SimpleJobBuilder(String name, Function<JobSpec, CronJob> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder schedule(String cron) {
        this.schedule = Objects.requireNonNull(cron, "cron must not be null");
        return this;
    }

    @Override
    public JobBuilder command(String command) {
        this.payload = new ShellPayload(command);
        return this;
    }

    @Override
    public JobBuilder agent(String prompt, AgentJobConfig config) {
        this.payload = new AgentPayload(prompt, config);
        return this;
    }

    @Override
    public JobBuilder payload(JobPayload payload) {
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        return this;
    }

    @Override
    public JobBuilder workingDir(String workingDir) {
        Objects.requireNonNull(workingDir, "workingDir must not be null");
        if (workingDir.isBlank()) throw new IllegalArgumentException("workingDir must not be blank");
        this.workingDir = workingDir;
        return this;
    }

    @Override
    public JobBuilder env(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        env.forEach(this::env);
        return this;
    }

    @Override
    public JobBuilder env(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("env contains blank key");
        }
        if (value == null) {
            throw new IllegalArgumentException("env contains null value for key: " + key);
        }
        this.env.put(key, value);
        return this;
    }

    @Override
    public JobBuilder timeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.timeout = timeout;
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder paused() {
        this.initialStatus = JobStatus.PAUSED;
        return this;
    }

    @Override
    public JobSpec build() {
        if (schedule == null) {
            throw new IllegalStateException("schedule is required for job " + name);
        }
        if (payload == null) {
            throw new IllegalStateException("command or agent prompt is required for job " + name);
        }
        return new JobSpec(
                name,
                schedule,
                timezone,
                initialStatus,
                payload,
                workingDir,
                env,
                timeout
        );
    }

    @Override
    public CronJob save() {
        return persister.apply(build());
    }
}
