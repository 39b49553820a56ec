package io.cronkit.cron;

import io.cronkit.exception.CronParseException;
import io.cronkit.exception.CronParseException.Reason;
import io.cronkit.exception.ScheduleExhaustedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronExpressionTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void dailyScheduleShouldOnlyBeDueOnItsMinute() {
        CronExpression cron = CronExpression.parse("0 2 * * *");

        assertTrue(cron.isDue(Instant.parse("2026-01-01T02:00:00Z"), UTC));
        assertTrue(cron.isDue(Instant.parse("2026-01-01T02:00:59.999Z"), UTC));
        assertFalse(cron.isDue(Instant.parse("2026-01-01T01:59:00Z"), UTC));
        assertFalse(cron.isDue(Instant.parse("2026-01-01T02:01:00Z"), UTC));
    }

    @Test
    void steppedWildcardShouldMatchMultiplesOfStep() {
        CronExpression cron = CronExpression.parse("*/5 * * * *");
        Instant hour = Instant.parse("2026-01-01T10:00:00Z");

        for (int minute = 0; minute < 60; minute++) {
            boolean due = cron.isDue(hour.plusSeconds(minute * 60L), UTC);
            assertEquals(minute % 5 == 0, due, "minute " + minute);
        }
    }

    @Test
    void steppedRangeShouldStartAtRangeStart() {
        CronExpression cron = CronExpression.parse("10-30/10 * * * *");
        Instant hour = Instant.parse("2026-01-01T10:00:00Z");

        assertFalse(cron.isDue(hour, UTC));
        assertTrue(cron.isDue(hour.plusSeconds(10 * 60), UTC));
        assertTrue(cron.isDue(hour.plusSeconds(20 * 60), UTC));
        assertTrue(cron.isDue(hour.plusSeconds(30 * 60), UTC));
        assertFalse(cron.isDue(hour.plusSeconds(40 * 60), UTC));
    }

    @Test
    void singleValueWithStepShouldRunToFieldMaximum() {
        CronExpression cron = CronExpression.parse("5/20 * * * *");
        Instant hour = Instant.parse("2026-01-01T10:00:00Z");

        assertTrue(cron.isDue(hour.plusSeconds(5 * 60), UTC));
        assertTrue(cron.isDue(hour.plusSeconds(25 * 60), UTC));
        assertTrue(cron.isDue(hour.plusSeconds(45 * 60), UTC));
        assertFalse(cron.isDue(hour.plusSeconds(50 * 60), UTC));
    }

    @Test
    void listShouldMatchAnyElement() {
        CronExpression cron = CronExpression.parse("0 8,12-13,*/20 * * *");

        assertTrue(cron.isDue(Instant.parse("2026-01-01T08:00:00Z"), UTC));
        assertTrue(cron.isDue(Instant.parse("2026-01-01T13:00:00Z"), UTC));
        assertTrue(cron.isDue(Instant.parse("2026-01-01T20:00:00Z"), UTC));
        assertFalse(cron.isDue(Instant.parse("2026-01-01T09:00:00Z"), UTC));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldBeOred() {
        // 15th of the month or any Monday
        CronExpression cron = CronExpression.parse("0 0 15 * 1");

        assertTrue(cron.isDue(Instant.parse("2026-03-15T00:00:00Z"), UTC), "Sunday the 15th");
        assertTrue(cron.isDue(Instant.parse("2026-03-16T00:00:00Z"), UTC), "Monday the 16th");
        assertFalse(cron.isDue(Instant.parse("2026-03-03T00:00:00Z"), UTC), "Tuesday the 3rd");
    }

    @Test
    void onlyRestrictedDayFieldShouldDecide() {
        CronExpression mondays = CronExpression.parse("0 0 * * 1");
        assertTrue(mondays.isDue(Instant.parse("2026-03-16T00:00:00Z"), UTC));
        assertFalse(mondays.isDue(Instant.parse("2026-03-15T00:00:00Z"), UTC));

        CronExpression fifteenth = CronExpression.parse("0 0 15 * *");
        assertTrue(fifteenth.isDue(Instant.parse("2026-03-15T00:00:00Z"), UTC));
        assertFalse(fifteenth.isDue(Instant.parse("2026-03-16T00:00:00Z"), UTC));
    }

    @Test
    void dueCheckShouldUseRequestedZone() {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        ZoneId taipei = ZoneId.of("Asia/Taipei");

        assertTrue(cron.isDue(Instant.parse("2026-01-01T01:00:00Z"), taipei));
        assertFalse(cron.isDue(Instant.parse("2026-01-01T09:00:00Z"), taipei));
    }

    @ParameterizedTest
    @CsvSource({
            "'30 14 * * *',   2026-01-01T14:29:59Z, 2026-01-01T14:30:00Z",
            "'30 14 * * *',   2026-01-01T14:30:00Z, 2026-01-02T14:30:00Z",
            "'*/15 * * * *',  2026-01-01T10:07:00Z, 2026-01-01T10:15:00Z",
            "'0 0 1 * *',     2026-01-31T23:59:00Z, 2026-02-01T00:00:00Z",
            "'0 0 15 * 1',    2026-03-03T00:00:00Z, 2026-03-09T00:00:00Z",
            "'0 0 29 2 *',    2026-03-01T00:00:00Z, 2028-02-29T00:00:00Z",
            "'59 23 31 12 *', 2026-12-31T23:59:00Z, 2027-12-31T23:59:00Z"
    })
    void nextFireAfterShouldFindFirstMatchingMinute(String expression, String after, String expected) {
        CronExpression cron = CronExpression.parse(expression);

        assertEquals(Instant.parse(expected), cron.nextFireAfter(Instant.parse(after), UTC));
    }

    @Test
    void nextFireAfterShouldSkipNonexistentLocalTime() {
        // 02:30 does not exist in New York on 2026-03-08
        CronExpression cron = CronExpression.parse("30 2 * * *");
        ZoneId newYork = ZoneId.of("America/New_York");

        Instant next = cron.nextFireAfter(Instant.parse("2026-03-07T08:00:00Z"), newYork);

        assertEquals(Instant.parse("2026-03-09T06:30:00Z"), next);
    }

    @Test
    void impossibleDateShouldExhaustSearch() {
        CronExpression cron = CronExpression.parse("0 0 30 2 *");

        ScheduleExhaustedException ex = assertThrows(ScheduleExhaustedException.class,
                () -> cron.nextFireAfter(Instant.parse("2026-01-01T00:00:00Z"), UTC));
        assertEquals("0 0 30 2 *", ex.expression());
    }

    @Test
    void outOfDomainMinuteShouldBeRejected() {
        CronParseException ex = assertThrows(CronParseException.class, () -> CronExpression.parse("99 * * * *"));

        assertEquals(Reason.OUT_OF_RANGE, ex.reason());
        assertEquals(CronField.MINUTE, ex.field());
        assertEquals("99 * * * *", ex.expression());
    }

    @ParameterizedTest
    @CsvSource({
            "'* * * *',        FIELD_COUNT,",
            "'* * * * * *',    FIELD_COUNT,",
            "'  ',             FIELD_COUNT,",
            "'* 24 * * *',     OUT_OF_RANGE,  HOUR",
            "'* * 0 * *',      OUT_OF_RANGE,  DAY_OF_MONTH",
            "'* * * 13 *',     OUT_OF_RANGE,  MONTH",
            "'* * * * 7',      OUT_OF_RANGE,  DAY_OF_WEEK",
            "'* * 99999999999 * *', OUT_OF_RANGE, DAY_OF_MONTH",
            "'30-10 * * * *',  INVALID_RANGE, MINUTE",
            "'*/0 * * * *',    INVALID_STEP,  MINUTE",
            "'*/x * * * *',    INVALID_STEP,  MINUTE",
            "'1-5/ * * * *',   INVALID_STEP,  MINUTE",
            "'a * * * *',      MALFORMED,     MINUTE",
            "'1,,2 * * * *',   MALFORMED,     MINUTE",
            "'* * * JAN *',    MALFORMED,     MONTH",
            "'-5 * * * *',     MALFORMED,     MINUTE",
            "'\u0665 * * * *', MALFORMED,     MINUTE",
            "'*/\u0665 * * * *', INVALID_STEP, MINUTE",
            "'1-2-3 * * * *',  MALFORMED,     MINUTE"
    })
    void invalidExpressionsShouldReportReasonAndField(String expression, Reason reason, CronField field) {
        CronParseException ex = assertThrows(CronParseException.class, () -> CronExpression.parse(expression));

        assertEquals(reason, ex.reason());
        assertEquals(field, ex.field());
    }

    @Test
    void nullExpressionShouldBeFieldCountError() {
        CronParseException ex = assertThrows(CronParseException.class, () -> CronExpression.parse(null));
        assertEquals(Reason.FIELD_COUNT, ex.reason());
        assertNull(ex.field());
    }

    @ParameterizedTest
    @ValueSource(strings = {"* * * * *", "0 2 * * *", " 0  2 * *  1-5 ", "0,30 */4 1-15/2 6 0"})
    void validExpressionsShouldBeRecognized(String expression) {
        assertTrue(CronExpression.isValid(expression));
    }

    @Test
    void canonicalFormShouldParseBackToSameSchedule() {
        CronExpression cron = CronExpression.parse("5/15  0-6 1,15 * 1-5");

        assertEquals("5-59/15 0-6 1,15 * 1-5", cron.toString());
        assertEquals(cron, CronExpression.parse(cron.toString()));
        assertEquals("5/15  0-6 1,15 * 1-5", cron.source());
    }

    @Test
    void fieldAccessorShouldExposeParsedMatchers() {
        CronExpression cron = CronExpression.parse("*/10 3 * * *");

        assertInstanceOf(FieldMatcher.Stepped.class, cron.field(CronField.MINUTE));
        assertEquals(new FieldMatcher.Single(3), cron.field(CronField.HOUR));
        assertTrue(cron.field(CronField.DAY_OF_MONTH).isWildcard());
        assertFalse(cron.field(CronField.MINUTE).isWildcard());
    }
}
