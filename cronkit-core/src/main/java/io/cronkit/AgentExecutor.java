package io.cronkit;

import io.cronkit.core.AgentJobConfig;

/**
 * Runs the prompt of an agent job.
 *
 * <p>Supplied by the host application through {@link CronManager#setAgentExecutor(AgentExecutor)}. A returned
 * value is recorded as a successful execution with the text as output; any thrown exception is recorded as a
 * failed execution.
 */
@FunctionalInterface
public interface AgentExecutor {

    String execute(AgentJobConfig config, String prompt, String workingDir) throws Exception;
}
