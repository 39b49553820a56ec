package io.cronkit.internal;

import io.cronkit.CronEventListener;
import io.cronkit.core.CronEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

final class EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final List<CronEventListener> listeners = new CopyOnWriteArrayList<>();

    void add(CronEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    void remove(CronEventListener listener) {
        listeners.remove(listener);
    }

    void publish(CronEvent event) {
        for (CronEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("cron event listener failed type={} jobId={} msg={}",
                        event.type(), event.jobId(), e.getMessage(), e);
            }
        }
    }
}
