package io.cronkit.config;

import io.cronkit.CronManager;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle.
 */
public class CronKitLifecycle implements SmartLifecycle {
    private final CronManager cronManager;
    private final boolean autoStart;
    private volatile boolean running = false;

    public CronKitLifecycle(CronManager cronManager, boolean autoStart) {
        this.cronManager = cronManager;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        cronManager.start();
        running = true;
    }

    @Override
    public void stop() {
        cronManager.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
