package io.cronkit.core;

import java.util.Objects;

/**
 * Sends {@code prompt} to the configured {@link io.cronkit.AgentExecutor}.
 */
public record AgentPayload(String prompt, AgentJobConfig config) implements JobPayload {

    public AgentPayload {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
    }

    @Override
    public JobType kind() {
        return JobType.AGENT;
    }

    @Override
    public String text() {
        return prompt;
    }
}
