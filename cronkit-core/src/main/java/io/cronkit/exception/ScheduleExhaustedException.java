package io.cronkit.exception;

import java.time.Instant;

/**
 * A schedule has no fire time within the search horizon, e.g. {@code 0 0 30 2 *}.
 */
public class ScheduleExhaustedException extends CronKitException {

    private final String expression;

    public ScheduleExhaustedException(String expression, Instant after, Instant horizon) {
        super("Cron expression '" + expression + "' never fires between " + after + " and " + horizon);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
