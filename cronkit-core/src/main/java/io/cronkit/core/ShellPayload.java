package io.cronkit.core;

import java.util.Objects;

/**
 * Runs {@code command} through the configured shell ({@code sh -c} by default).
 */
public record ShellPayload(String command) implements JobPayload {

    public ShellPayload {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
    }

    @Override
    public JobType kind() {
        return JobType.SHELL;
    }

    @Override
    public String text() {
        return command;
    }
}
