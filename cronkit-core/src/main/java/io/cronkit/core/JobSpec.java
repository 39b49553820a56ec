package io.cronkit.core;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable job definition produced by {@code JobBuilder.build()}.
 * This is a pure data object with no persistence logic; the id and timestamps are assigned on save.
 */
public record JobSpec(

        // identity
        String name,

        // scheduling
        String schedule,
        String timezone,
        JobStatus initialStatus,

        // execution
        JobPayload payload,
        String workingDir,
        Map<String, String> env,
        Duration timeout
) {
    public JobSpec {
        env = env == null ? Map.of() : Map.copyOf(env);
        initialStatus = initialStatus == null ? JobStatus.ACTIVE : initialStatus;
    }
}
