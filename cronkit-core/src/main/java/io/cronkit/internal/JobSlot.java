package io.cronkit.internal;

import io.cronkit.core.CronJob;
import io.cronkit.core.JobExecution;
import io.cronkit.cron.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduler-side working copy of one job.
 *
 * <p>{@link #lock} guards the job copy, the parsed schedule, the fired-minute marker and the removed flag. The
 * running marker is independent: it is set under the lock before a dispatch starts and cleared by the dispatch
 * itself, which never holds the lock.
 */
final class JobSlot {

    final ReentrantLock lock = new ReentrantLock();

    private volatile CronJob job;
    private volatile CronExpression expression;
    private volatile ZoneId zone;
    private Instant lastFiredMinute;
    private boolean removed;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<JobExecution> current = new AtomicReference<>();

    JobSlot(CronJob job, CronExpression expression, ZoneId zone) {
        this.job = job;
        this.expression = expression;
        this.zone = zone;
    }

    CronJob job() {
        return job;
    }

    CronExpression expression() {
        return expression;
    }

    ZoneId zone() {
        return zone;
    }

    void replace(CronJob job, CronExpression expression, ZoneId zone) {
        this.job = job;
        this.expression = expression;
        this.zone = zone;
    }

    void replace(CronJob job) {
        this.job = job;
    }

    /**
     * Record that {@code minute} fired. False if it already did.
     */
    boolean markFired(Instant minute) {
        if (minute.equals(lastFiredMinute)) {
            return false;
        }
        lastFiredMinute = minute;
        return true;
    }

    boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        removed = true;
    }

    boolean tryMarkRunning() {
        return running.compareAndSet(false, true);
    }

    void begin(JobExecution execution) {
        current.set(execution);
    }

    void clearRunning() {
        current.set(null);
        running.set(false);
    }

    boolean isRunning() {
        return running.get();
    }

    JobExecution currentExecution() {
        return current.get();
    }
}
