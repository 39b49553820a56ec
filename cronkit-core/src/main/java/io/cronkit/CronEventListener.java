package io.cronkit;

import io.cronkit.core.CronEvent;

@FunctionalInterface
public interface CronEventListener {

    /**
     * Called synchronously on the thread that produced the event. Exceptions are logged and ignored.
     */
    void onEvent(CronEvent event);
}
