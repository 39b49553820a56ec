package io.cronkit.core;

import java.util.Objects;

/**
 * Agent settings carried by an agent job and handed to the executor on every run.
 *
 * @param model        model identifier
 * @param apiKey       credential for the model provider
 * @param workspace    workspace directory for the agent; null means the job working directory
 * @param systemPrompt optional system prompt
 * @param baseUrl      optional provider base URL
 */
public record AgentJobConfig(
        String model,
        String apiKey,
        String workspace,
        String systemPrompt,
        String baseUrl
) {
    public AgentJobConfig {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(apiKey, "apiKey must not be null");
    }

    public static AgentJobConfig of(String model, String apiKey) {
        return new AgentJobConfig(model, apiKey, null, null, null);
    }

    /**
     * Masks the credential so the config can be logged.
     */
    @Override
    public String toString() {
        return "AgentJobConfig[model=" + model
                + ", apiKey=****"
                + ", workspace=" + workspace
                + ", systemPrompt=" + (systemPrompt == null ? null : "<" + systemPrompt.length() + " chars>")
                + ", baseUrl=" + baseUrl + "]";
    }
}
