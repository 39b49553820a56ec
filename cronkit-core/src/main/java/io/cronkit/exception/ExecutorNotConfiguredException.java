package io.cronkit.exception;

/**
 * An agent job was dispatched while no {@link io.cronkit.AgentExecutor} was set.
 *
 * <p>Never escapes a dispatch: it is recorded as a failed execution.
 */
public class ExecutorNotConfiguredException extends CronKitException {

    public ExecutorNotConfiguredException(String jobId) {
        super("No agent executor configured for agent job " + jobId);
    }
}
