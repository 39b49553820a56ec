package io.cronkit.cron;

import io.cronkit.exception.CronParseException;
import io.cronkit.exception.CronParseException.Reason;
import io.cronkit.exception.ScheduleExhaustedException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed five-field cron expression: {@code minute hour day-of-month month day-of-week}.
 *
 * <p>Supported syntax per field:
 * <ul>
 *   <li>{@code *} any value</li>
 *   <li>{@code 5} a single value</li>
 *   <li>{@code 1-5} an inclusive range</li>
 *   <li>{@code *}/15, {@code 0-30/10}, {@code 5/15} stepped values</li>
 *   <li>{@code 1,3,10-12,*}/20 lists of any of the above</li>
 * </ul>
 *
 * <p>When both day-of-month and day-of-week are restricted, a day matches if <em>either</em>
 * matches (classic cron semantics); otherwise the restricted one alone decides.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class CronExpression {

    /**
     * How far {@link #nextFireAfter(Instant, ZoneId)} searches before giving up.
     */
    public static final int SEARCH_HORIZON_YEARS = 4;

    private final String source;
    private final FieldMatcher minutes;
    private final FieldMatcher hours;
    private final FieldMatcher daysOfMonth;
    private final FieldMatcher months;
    private final FieldMatcher daysOfWeek;

    private CronExpression(String source, List<FieldMatcher> fields) {
        this.source = source;
        this.minutes = fields.get(0);
        this.hours = fields.get(1);
        this.daysOfMonth = fields.get(2);
        this.months = fields.get(3);
        this.daysOfWeek = fields.get(4);
    }

    /**
     * Parse a cron expression.
     *
     * @throws CronParseException if the text is not a valid five-field expression
     */
    public static CronExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new CronParseException(text, null, Reason.FIELD_COUNT, "Cron expression must not be empty");
        }
        String trimmed = text.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length != 5) {
            throw new CronParseException(text, null, Reason.FIELD_COUNT,
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + parts.length + ": '" + trimmed + "'");
        }

        CronField[] order = CronField.values();
        List<FieldMatcher> fields = new ArrayList<>(5);
        for (int i = 0; i < parts.length; i++) {
            fields.add(parseField(trimmed, order[i], parts[i]));
        }
        return new CronExpression(trimmed, fields);
    }

    /**
     * Returns true if {@code text} parses.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (CronParseException e) {
            return false;
        }
    }

    /**
     * Whether the minute containing {@code instant} is a fire time in {@code zone}.
     */
    public boolean isDue(Instant instant, ZoneId zone) {
        Objects.requireNonNull(instant, "instant must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        return matches(instant.atZone(zone).truncatedTo(ChronoUnit.MINUTES));
    }

    /**
     * Whether {@code time}, truncated to the minute, is a fire time.
     */
    public boolean matches(ZonedDateTime time) {
        return minutes.matches(CronField.MINUTE.valueOf(time))
                && hours.matches(CronField.HOUR.valueOf(time))
                && months.matches(CronField.MONTH.valueOf(time))
                && dayMatches(time);
    }

    /**
     * First fire time strictly after the minute containing {@code after}.
     *
     * @throws ScheduleExhaustedException if nothing fires within {@value #SEARCH_HORIZON_YEARS} years
     */
    public Instant nextFireAfter(Instant after, ZoneId zone) {
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        ZonedDateTime t = after.atZone(zone).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime horizon = t.plusYears(SEARCH_HORIZON_YEARS);

        while (!t.isAfter(horizon)) {
            if (!months.matches(CronField.MONTH.valueOf(t))) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(t)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.matches(CronField.HOUR.valueOf(t))) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.matches(CronField.MINUTE.valueOf(t))) {
                t = t.plusMinutes(1);
                continue;
            }
            return t.toInstant();
        }
        throw new ScheduleExhaustedException(source, after, horizon.toInstant());
    }

    private boolean dayMatches(ZonedDateTime time) {
        boolean dom = daysOfMonth.matches(CronField.DAY_OF_MONTH.valueOf(time));
        boolean dow = daysOfWeek.matches(CronField.DAY_OF_WEEK.valueOf(time));
        if (!daysOfMonth.isWildcard() && !daysOfWeek.isWildcard()) {
            return dom || dow;
        }
        return dom && dow;
    }

    /**
     * The expression text this instance was parsed from (trimmed).
     */
    public String source() {
        return source;
    }

    public FieldMatcher field(CronField field) {
        return switch (field) {
            case MINUTE -> minutes;
            case HOUR -> hours;
            case DAY_OF_MONTH -> daysOfMonth;
            case MONTH -> months;
            case DAY_OF_WEEK -> daysOfWeek;
        };
    }

    /**
     * Canonical rendering; parses back into an expression with the same fire times.
     */
    @Override
    public String toString() {
        return String.join(" ",
                minutes.format(),
                hours.format(),
                daysOfMonth.format(),
                months.format(),
                daysOfWeek.format());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression other)) return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /* ================= parsing ================= */

    private static FieldMatcher parseField(String expression, CronField field, String token) {
        if (token.indexOf(',') < 0) {
            return parseElement(expression, field, token);
        }
        String[] items = token.split(",", -1);
        List<FieldMatcher> elements = new ArrayList<>(items.length);
        for (String item : items) {
            if (item.isEmpty()) {
                throw new CronParseException(expression, field, Reason.MALFORMED,
                        "Empty list element in " + field.label() + " field: '" + token + "'");
            }
            elements.add(parseElement(expression, field, item));
        }
        return new FieldMatcher.AnyOf(elements);
    }

    private static FieldMatcher parseElement(String expression, CronField field, String token) {
        int slash = token.indexOf('/');
        String base = slash < 0 ? token : token.substring(0, slash);
        Integer step = slash < 0 ? null : parseStep(expression, field, token.substring(slash + 1));

        if ("*".equals(base)) {
            return step == null
                    ? new FieldMatcher.Wildcard()
                    : new FieldMatcher.Stepped(field.min(), field.max(), step, true);
        }

        if (base.indexOf('-') >= 0) {
            String[] bounds = base.split("-", -1);
            if (bounds.length != 2 || bounds[0].isEmpty() || bounds[1].isEmpty()) {
                throw new CronParseException(expression, field, Reason.MALFORMED,
                        "Malformed range in " + field.label() + " field: '" + token + "'");
            }
            int from = parseValue(expression, field, bounds[0]);
            int to = parseValue(expression, field, bounds[1]);
            if (from > to) {
                throw new CronParseException(expression, field, Reason.INVALID_RANGE,
                        "Range start " + from + " is greater than end " + to + " in " + field.label() + " field");
            }
            return step == null
                    ? new FieldMatcher.Range(from, to)
                    : new FieldMatcher.Stepped(from, to, step, false);
        }

        int value = parseValue(expression, field, base);
        return step == null
                ? new FieldMatcher.Single(value)
                : new FieldMatcher.Stepped(value, field.max(), step, false);
    }

    private static int parseValue(String expression, CronField field, String raw) {
        if (raw.isEmpty() || !raw.chars().allMatch(CronExpression::isAsciiDigit)) {
            throw new CronParseException(expression, field, Reason.MALFORMED,
                    "Invalid " + field.label() + " value: '" + raw + "'");
        }
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            value = Integer.MAX_VALUE;
        }
        if (!field.contains(value)) {
            throw new CronParseException(expression, field, Reason.OUT_OF_RANGE,
                    "Value " + raw + " out of range for " + field.label() + " field ("
                            + field.min() + "-" + field.max() + ")");
        }
        return value;
    }

    private static int parseStep(String expression, CronField field, String raw) {
        if (raw.isEmpty() || !raw.chars().allMatch(CronExpression::isAsciiDigit)) {
            throw new CronParseException(expression, field, Reason.INVALID_STEP,
                    "Invalid step in " + field.label() + " field: '" + raw + "'");
        }
        int step;
        try {
            step = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            step = Integer.MAX_VALUE;
        }
        if (step <= 0) {
            throw new CronParseException(expression, field, Reason.INVALID_STEP,
                    "Step must be positive in " + field.label() + " field: '" + raw + "'");
        }
        return step;
    }

    private static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
