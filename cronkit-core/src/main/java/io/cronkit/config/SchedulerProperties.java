package io.cronkit.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    public static final Duration MAX_TICK_INTERVAL = Duration.ofMinutes(1);

    private Duration tickInterval = Duration.ofMinutes(1);
    private boolean alignToMinute = true; // tick right after each minute boundary, ignores tickInterval
    private int maxConcurrency = 8; // worker threads for scheduled runs
    private String defaultTimezone = "UTC";
    private String workspace = System.getProperty("user.dir");
    private String shell = "/bin/sh";
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private int maxHistoryPerJob = 100; // 0 = unlimited
    private int maxOutputChars = 64 * 1024;

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public boolean isAlignToMinute() {
        return alignToMinute;
    }

    public void setAlignToMinute(boolean alignToMinute) {
        this.alignToMinute = alignToMinute;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public String getWorkspace() {
        return workspace;
    }

    public void setWorkspace(String workspace) {
        this.workspace = workspace;
    }

    public String getShell() {
        return shell;
    }

    public void setShell(String shell) {
        this.shell = shell;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public int getMaxHistoryPerJob() {
        return maxHistoryPerJob;
    }

    public void setMaxHistoryPerJob(int maxHistoryPerJob) {
        this.maxHistoryPerJob = maxHistoryPerJob;
    }

    public int getMaxOutputChars() {
        return maxOutputChars;
    }

    public void setMaxOutputChars(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
    }

    /**
     * @throws IllegalArgumentException on the first invalid setting
     */
    public void validate() {
        Objects.requireNonNull(tickInterval, "cronkit.tickInterval must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("cronkit.tickInterval must be a positive duration");
        }
        if (tickInterval.compareTo(MAX_TICK_INTERVAL) > 0) {
            throw new IllegalArgumentException("cronkit.tickInterval must not exceed " + MAX_TICK_INTERVAL);
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("cronkit.maxConcurrency must be positive");
        }
        Objects.requireNonNull(shutdownGracePeriod, "cronkit.shutdownGracePeriod must not be null");
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("cronkit.shutdownGracePeriod must not be negative");
        }
        if (maxHistoryPerJob < 0) {
            throw new IllegalArgumentException("cronkit.maxHistoryPerJob must not be negative");
        }
        if (maxOutputChars <= 0) {
            throw new IllegalArgumentException("cronkit.maxOutputChars must be positive");
        }
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("cronkit.shell must not be blank");
        }
        zone();
    }

    public ZoneId zone() {
        try {
            return ZoneId.of(defaultTimezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("cronkit.defaultTimezone is not a valid zone id: " + defaultTimezone, e);
        }
    }
}
