package io.cronkit.core;

/**
 * What caused an execution: the scheduler tick or an explicit run request.
 */
public enum ExecutionTrigger {
    SCHEDULED,
    MANUAL
}
