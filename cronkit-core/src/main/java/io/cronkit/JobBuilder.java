package io.cronkit;

import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.CronJob;
import io.cronkit.core.JobPayload;
import io.cronkit.core.JobSpec;

import java.time.Duration;
import java.util.Map;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + validate + persist to the job store + register with the scheduler</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Cron expression, e.g. {@code "0 2 * * *"}. Required.
     */
    JobBuilder schedule(String cron);

    /**
     * Run a shell command when the job fires.
     */
    JobBuilder command(String command);

    /**
     * Send a prompt to the agent executor when the job fires.
     */
    JobBuilder agent(String prompt, AgentJobConfig config);

    JobBuilder payload(JobPayload payload);

    /**
     * Working directory. Defaults to the scheduler workspace.
     */
    JobBuilder workingDir(String workingDir);

    JobBuilder env(Map<String, String> env);

    JobBuilder env(String key, String value);

    /**
     * Per-run deadline. Without one a run may take as long as it needs.
     */
    JobBuilder timeout(Duration timeout);

    /**
     * IANA time zone id used to evaluate the schedule (e.g. "Asia/Taipei"). Null means the scheduler default.
     */
    JobBuilder timezone(String timezone);

    /**
     * Persist the job in PAUSED state.
     */
    JobBuilder paused();

    /**
     * Build an immutable job spec (not persisted).
     */
    JobSpec build();

    /**
     * Build + persist.
     */
    CronJob save();
}
