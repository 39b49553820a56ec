package io.cronkit.exception;

import io.cronkit.cron.CronField;

/**
 * Raised when a schedule expression cannot be parsed.
 *
 * <p>{@link #field()} is null for errors that concern the whole expression (wrong field count).
 */
public class CronParseException extends CronKitException {

    public enum Reason {
        FIELD_COUNT,
        OUT_OF_RANGE,
        INVALID_RANGE,
        INVALID_STEP,
        MALFORMED
    }

    private final String expression;
    private final CronField field;
    private final Reason reason;

    public CronParseException(String expression, CronField field, Reason reason, String message) {
        super(message);
        this.expression = expression;
        this.field = field;
        this.reason = reason;
    }

    public String expression() {
        return expression;
    }

    public CronField field() {
        return field;
    }

    public Reason reason() {
        return reason;
    }
}
