package io.cronkit.cron;

import java.time.ZonedDateTime;

/**
 * The five positional fields of a cron expression with their value domains.
 */
public enum CronField {

    MINUTE("minute", 0, 59) {
        @Override
        public int valueOf(ZonedDateTime time) {
            return time.getMinute();
        }
    },
    HOUR("hour", 0, 23) {
        @Override
        public int valueOf(ZonedDateTime time) {
            return time.getHour();
        }
    },
    DAY_OF_MONTH("day-of-month", 1, 31) {
        @Override
        public int valueOf(ZonedDateTime time) {
            return time.getDayOfMonth();
        }
    },
    MONTH("month", 1, 12) {
        @Override
        public int valueOf(ZonedDateTime time) {
            return time.getMonthValue();
        }
    },
    /** 0 = Sunday. */
    DAY_OF_WEEK("day-of-week", 0, 6) {
        @Override
        public int valueOf(ZonedDateTime time) {
            return time.getDayOfWeek().getValue() % 7;
        }
    };

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    public abstract int valueOf(ZonedDateTime time);
}
