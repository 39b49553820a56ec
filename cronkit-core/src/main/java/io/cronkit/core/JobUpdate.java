package io.cronkit.core;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JobUpdate describes which attributes of a job to change.
 *
 * <p>Unset attributes keep their current value. The job status is never changed by an update; use
 * pause/resume for that. A zero {@link #timeout()} removes an existing deadline.
 */
public final class JobUpdate {

    private final String name;
    private final String schedule;
    private final JobPayload payload;
    private final String workingDir;
    private final Map<String, String> env;
    private final Duration timeout;
    private final String timezone;

    private JobUpdate(Builder b) {
        this.name = b.name;
        this.schedule = b.schedule;
        this.payload = b.payload;
        this.workingDir = b.workingDir;
        this.env = b.env == null ? null : Map.copyOf(b.env);
        this.timeout = b.timeout;
        this.timezone = b.timezone;
    }

    public String name() {
        return name;
    }

    /**
     * New cron expression text; re-parsed before the update is applied.
     */
    public String schedule() {
        return schedule;
    }

    public JobPayload payload() {
        return payload;
    }

    public String workingDir() {
        return workingDir;
    }

    public Map<String, String> env() {
        return env;
    }

    public Duration timeout() {
        return timeout;
    }

    public String timezone() {
        return timezone;
    }

    /**
     * Returns true if this update has no attribute set.
     */
    public boolean isEmpty() {
        return name == null
                && schedule == null
                && payload == null
                && workingDir == null
                && env == null
                && timeout == null
                && timezone == null;
    }

    public static JobUpdate ofSchedule(String schedule) {
        return builder().schedule(schedule).build();
    }

    public static JobUpdate ofPayload(JobPayload payload) {
        return builder().payload(payload).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String schedule;
        private JobPayload payload;
        private String workingDir;
        private Map<String, String> env;
        private Duration timeout;
        private String timezone;

        public Builder name(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
            return this;
        }

        public Builder payload(JobPayload payload) {
            this.payload = Objects.requireNonNull(payload, "payload must not be null");
            return this;
        }

        public Builder command(String command) {
            return payload(new ShellPayload(command));
        }

        public Builder workingDir(String workingDir) {
            this.workingDir = Objects.requireNonNull(workingDir, "workingDir must not be null");
            return this;
        }

        public Builder env(Map<String, String> env) {
            Objects.requireNonNull(env, "env must not be null");
            this.env = new LinkedHashMap<>(env);
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
            return this;
        }

        public JobUpdate build() {
            JobUpdate update = new JobUpdate(this);
            if (update.isEmpty()) {
                throw new IllegalStateException(
                        "JobUpdate must change at least one attribute: name, schedule, payload, workingDir, env, timeout or timezone"
                );
            }
            return update;
        }
    }
}
