package io.cronkit.core;

import java.time.Instant;

/**
 * Scheduler lifecycle and job event.
 *
 * @param type        what happened
 * @param jobId       affected job; null for scheduler events
 * @param executionId affected execution, if any
 * @param error       failure reason for failed/timed-out/skipped events
 * @param at          event time
 */
public record CronEvent(
        CronEventType type,
        String jobId,
        String executionId,
        String error,
        Instant at
) {
    public static CronEvent scheduler(CronEventType type, Instant at) {
        return new CronEvent(type, null, null, null, at);
    }

    public static CronEvent job(CronEventType type, String jobId, Instant at) {
        return new CronEvent(type, jobId, null, null, at);
    }

    public static CronEvent execution(CronEventType type, JobExecution execution, Instant at) {
        return new CronEvent(type, execution.jobId(), execution.id(), execution.error(), at);
    }
}
