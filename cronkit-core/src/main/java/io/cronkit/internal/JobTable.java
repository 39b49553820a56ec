package io.cronkit.internal;

import io.cronkit.core.CronJob;
import io.cronkit.cron.CronExpression;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job id to {@link JobSlot} map shared by the tick loop and administrative calls.
 */
final class JobTable {

    private final ConcurrentHashMap<String, JobSlot> slots = new ConcurrentHashMap<>();

    JobSlot get(String id) {
        return slots.get(id);
    }

    /**
     * Install a slot for {@code job} unless one exists; returns the slot in the table.
     */
    JobSlot install(CronJob job, CronExpression expression, ZoneId zone) {
        return slots.computeIfAbsent(job.id(), id -> new JobSlot(job, expression, zone));
    }

    void remove(String id, JobSlot slot) {
        slots.remove(id, slot);
    }

    List<JobSlot> snapshot() {
        return List.copyOf(slots.values());
    }

    int size() {
        return slots.size();
    }
}
