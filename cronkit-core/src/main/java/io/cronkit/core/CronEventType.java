package io.cronkit.core;

public enum CronEventType {
    SCHEDULER_STARTED,
    SCHEDULER_STOPPED,
    JOB_ADDED,
    JOB_UPDATED,
    JOB_REMOVED,
    JOB_STARTED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_TIMEOUT,
    /** Due while a previous execution was still running. */
    JOB_SKIPPED
}
