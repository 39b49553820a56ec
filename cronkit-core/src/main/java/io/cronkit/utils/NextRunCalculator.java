package io.cronkit.utils;

import io.cronkit.cron.CronExpression;
import io.cronkit.exception.ScheduleExhaustedException;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Computes persisted scheduling fields for cron jobs.
 */
public final class NextRunCalculator {
    private NextRunCalculator() {
    }

    /**
     * Computes the next run time after an execution.
     *
     * @param expression the job schedule
     * @param zone       evaluation zone
     * @param firedAt    the scheduled minute the execution ran for; null for manual runs
     * @param finishedAt current execution finish time
     * @return next scheduled run time, or {@code null} if the schedule never fires again
     */
    public static Instant computeNextRunAt(
            CronExpression expression,
            ZoneId zone,
            Instant firedAt,
            Instant finishedAt
    ) {
        Instant baseInstant = laterOf(firedAt, finishedAt);
        try {
            return expression.nextFireAfter(baseInstant, zone);
        } catch (ScheduleExhaustedException e) {
            return null;
        }
    }

    /**
     * Resolve a job time zone, falling back to {@code fallback} when absent.
     *
     * @throws IllegalArgumentException if {@code timezone} is set but not a valid zone id
     */
    public static ZoneId resolveZone(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
    }

    /* ================= helper ================= */

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
