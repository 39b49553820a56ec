package io.cronkit.core;

/**
 * Administrative status of a job. Only {@link #ACTIVE} jobs are considered by the scheduler tick.
 */
public enum JobStatus {
    ACTIVE,
    PAUSED
}
