package io.cronkit.utils;

import io.cronkit.cron.CronExpression;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NextRunCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void computeNextRunAtShouldUseLaterOfFiredAndFinished() {
        Instant firedAt = Instant.parse("2026-01-01T00:05:00Z");
        Instant finishedAt = Instant.parse("2026-01-01T00:06:00Z");

        Instant next = NextRunCalculator.computeNextRunAt(
                CronExpression.parse("*/5 * * * *"),
                UTC,
                firedAt,
                finishedAt
        );

        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void longRunShouldNotReportMinutesItOverran() {
        Instant firedAt = Instant.parse("2026-01-01T00:05:00Z");
        Instant finishedAt = Instant.parse("2026-01-01T00:17:30Z");

        Instant next = NextRunCalculator.computeNextRunAt(
                CronExpression.parse("*/5 * * * *"), UTC, firedAt, finishedAt);

        assertEquals(Instant.parse("2026-01-01T00:20:00Z"), next);
    }

    @Test
    void manualRunShouldComputeFromFinishTime() {
        Instant next = NextRunCalculator.computeNextRunAt(
                CronExpression.parse("0 2 * * *"), UTC, null, Instant.parse("2026-01-01T01:00:00Z"));

        assertEquals(Instant.parse("2026-01-01T02:00:00Z"), next);
    }

    @Test
    void computeNextRunAtShouldReturnNullForExhaustedSchedule() {
        assertNull(NextRunCalculator.computeNextRunAt(
                CronExpression.parse("0 0 30 2 *"), UTC, null, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void resolveZoneShouldFallBackWhenAbsent() {
        assertEquals(UTC, NextRunCalculator.resolveZone(null, UTC));
        assertEquals(UTC, NextRunCalculator.resolveZone(" ", UTC));
        assertEquals(ZoneId.of("Asia/Taipei"), NextRunCalculator.resolveZone("Asia/Taipei", UTC));
    }

    @Test
    void resolveZoneShouldRejectUnknownZone() {
        assertThrows(IllegalArgumentException.class, () -> NextRunCalculator.resolveZone("Mars/Olympus", UTC));
    }
}
