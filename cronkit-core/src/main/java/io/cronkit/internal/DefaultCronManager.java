package io.cronkit.internal;

import io.cronkit.AgentExecutor;
import io.cronkit.CronEventListener;
import io.cronkit.CronManager;
import io.cronkit.JobBuilder;
import io.cronkit.config.SchedulerProperties;
import io.cronkit.core.AgentJobConfig;
import io.cronkit.core.CronEvent;
import io.cronkit.core.CronEventType;
import io.cronkit.core.CronJob;
import io.cronkit.core.ExecutionStatus;
import io.cronkit.core.ExecutionTrigger;
import io.cronkit.core.JobExecution;
import io.cronkit.core.JobSpec;
import io.cronkit.core.JobStatus;
import io.cronkit.core.JobUpdate;
import io.cronkit.cron.CronExpression;
import io.cronkit.exception.CronParseException;
import io.cronkit.exception.JobAlreadyRunningException;
import io.cronkit.exception.JobNotFoundException;
import io.cronkit.store.JobStore;
import io.cronkit.utils.NextRunCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DefaultCronManager is a {@link JobStore}-backed cron scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Minute-resolution cron schedules evaluated in a per-job time zone</li>
 *   <li>Shell and agent payloads dispatched on a bounded worker pool</li>
 *   <li>At most one in-flight execution per job, shared by scheduled and manual runs</li>
 * </ul>
 *
 * <p>Missed minutes are not replayed: after a restart {@code nextRunAt} is recomputed from the current time.
 */
public class DefaultCronManager implements CronManager {
    private static final Logger log = LoggerFactory.getLogger(DefaultCronManager.class);

    private final SchedulerProperties props;
    private final JobStore store;
    private final Clock clock;
    private final ZoneId defaultZone;
    private final JobDispatcher dispatcher;

    private final JobTable table = new JobTable();
    private final EventPublisher events = new EventPublisher();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object loadLock = new Object();
    private volatile boolean loaded;

    private ExecutorService workerPool;
    private Thread tickerThread;

    static final int MAX_CATCH_UP_MINUTES = 5;
    private static final Duration TICKER_JOIN_TIMEOUT = Duration.ofSeconds(10);

    private enum Claim { NONE, CLAIMED, SKIPPED }

    public DefaultCronManager(JobStore store, SchedulerProperties props) {
        this(store, props, Clock.systemUTC());
    }

    public DefaultCronManager(JobStore store, SchedulerProperties props, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        props.validate();
        this.defaultZone = props.zone();
        this.dispatcher = new JobDispatcher(props, clock);
    }

    /**
     * Load jobs and start the tick loop. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ensureLoaded();

        log.info("Cron scheduler starting with tickInterval={}, alignToMinute={}, maxConcurrency={}, defaultTimezone={}, jobs={}",
                props.getTickInterval(),
                props.isAlignToMinute(),
                props.getMaxConcurrency(),
                defaultZone,
                table.size());

        workers();

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickLoop);
            tickerThread.setName("cronkit.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }
        log.info("Cron scheduler started successfully.");
        events.publish(CronEvent.scheduler(CronEventType.SCHEDULER_STARTED, now()));
    }

    /**
     * Stop ticking and wait up to the grace period for running executions; stragglers are interrupted and
     * recorded as CANCELLED. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Cron scheduler stopping...");

        Thread ticker = tickerThread;
        tickerThread = null;
        if (ticker != null) {
            ticker.interrupt();
            joinTicker(ticker);
        }

        shutdownWorkers();

        log.info("Cron scheduler stopped successfully.");
        events.publish(CronEvent.scheduler(CronEventType.SCHEDULER_STOPPED, now()));
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    /**
     * Stop, then release the worker pool left by {@link #tick(Instant)} calls on a manager that was never
     * started, and the dispatcher threads.
     */
    @Override
    public void close() {
        stop();
        shutdownWorkers();
        dispatcher.close();
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, this::addJob);
    }

    @Override
    public CronJob addJob(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        Objects.requireNonNull(spec.schedule(), "schedule must not be null");
        Objects.requireNonNull(spec.payload(), "payload must not be null");
        Duration timeout = normalizeTimeout(spec.timeout());

        CronExpression expression = CronExpression.parse(spec.schedule());
        ZoneId zone = NextRunCalculator.resolveZone(spec.timezone(), defaultZone);
        Instant now = now();
        // fails fast on schedules that never fire
        Instant firstRun = expression.nextFireAfter(now, zone);

        ensureLoaded();
        boolean active = spec.initialStatus() == JobStatus.ACTIVE;
        CronJob job = new CronJob(
                UUID.randomUUID().toString(),
                spec.name(),
                expression.source(),
                spec.payload(),
                spec.initialStatus(),
                spec.workingDir(),
                spec.env(),
                timeout,
                spec.timezone(),
                now,
                now,
                active ? firstRun : null,
                null,
                0,
                0
        );
        store.create(job);
        table.install(job, expression, zone);

        log.info("Added cron job name={} id={} schedule={} type={} status={} nextRunAt={}",
                job.name(), job.id(), job.schedule(), job.type(), job.status(), job.nextRunAt());
        events.publish(CronEvent.job(CronEventType.JOB_ADDED, job.id(), now));
        return job;
    }

    @Override
    public CronJob addJob(String name, String schedule, String command) {
        return create(name)
                .schedule(schedule)
                .command(command)
                .save();
    }

    @Override
    public CronJob addAgentJob(String name, String schedule, String prompt, AgentJobConfig config) {
        return create(name)
                .schedule(schedule)
                .agent(prompt, config)
                .save();
    }

    @Override
    public List<CronJob> listJobs() {
        return store.list();
    }

    @Override
    public CronJob getJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public Optional<CronJob> findJobByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return store.findByName(name);
    }

    @Override
    public CronJob pauseJob(String id) {
        JobSlot slot = requireSlot(id);
        CronJob updated;
        slot.lock.lock();
        try {
            ensurePresent(id, slot);
            if (slot.job().status() == JobStatus.PAUSED) {
                return slot.job();
            }
            Instant at = now();
            updated = store.update(id, job -> job.withStatus(JobStatus.PAUSED, at, null));
            slot.replace(updated);
        } finally {
            slot.lock.unlock();
        }
        log.info("Paused cron job name={} id={}", updated.name(), id);
        events.publish(CronEvent.job(CronEventType.JOB_UPDATED, id, updated.updatedAt()));
        return updated;
    }

    @Override
    public CronJob resumeJob(String id) {
        JobSlot slot = requireSlot(id);
        CronJob updated;
        slot.lock.lock();
        try {
            ensurePresent(id, slot);
            if (slot.job().status() == JobStatus.ACTIVE) {
                return slot.job();
            }
            Instant at = now();
            Instant next = NextRunCalculator.computeNextRunAt(slot.expression(), slot.zone(), null, at);
            updated = store.update(id, job -> job.withStatus(JobStatus.ACTIVE, at, next));
            slot.replace(updated);
        } finally {
            slot.lock.unlock();
        }
        log.info("Resumed cron job name={} id={} nextRunAt={}", updated.name(), id, updated.nextRunAt());
        events.publish(CronEvent.job(CronEventType.JOB_UPDATED, id, updated.updatedAt()));
        return updated;
    }

    @Override
    public CronJob updateJob(String id, JobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            throw new IllegalArgumentException("JobUpdate must change at least one attribute");
        }
        CronExpression newExpression = update.schedule() == null ? null : CronExpression.parse(update.schedule());
        ZoneId newZone = update.timezone() == null ? null : NextRunCalculator.resolveZone(update.timezone(), defaultZone);

        JobSlot slot = requireSlot(id);
        CronJob updated;
        slot.lock.lock();
        try {
            ensurePresent(id, slot);
            CronExpression expression = newExpression != null ? newExpression : slot.expression();
            ZoneId zone = newZone != null ? newZone : slot.zone();
            Instant at = now();
            Instant next = expression.nextFireAfter(at, zone);

            updated = store.update(id, job -> job.withDefinition(
                    update.name() != null ? update.name() : job.name(),
                    expression.source(),
                    update.payload() != null ? update.payload() : job.payload(),
                    update.workingDir() != null ? update.workingDir() : job.workingDir(),
                    update.env() != null ? update.env() : job.env(),
                    update.timeout() != null ? normalizeTimeout(update.timeout()) : job.timeout(),
                    update.timezone() != null ? update.timezone() : job.timezone(),
                    at,
                    job.isActive() ? next : null
            ));
            slot.replace(updated, expression, zone);
        } finally {
            slot.lock.unlock();
        }
        log.info("Updated cron job name={} id={} schedule={} nextRunAt={}",
                updated.name(), id, updated.schedule(), updated.nextRunAt());
        events.publish(CronEvent.job(CronEventType.JOB_UPDATED, id, updated.updatedAt()));
        return updated;
    }

    @Override
    public void removeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ensureLoaded();
        JobSlot slot = table.get(id);
        if (slot == null) {
            // stored but never scheduled, e.g. a schedule that no longer parses
            store.remove(id);
            log.info("Removed unscheduled cron job id={}", id);
            events.publish(CronEvent.job(CronEventType.JOB_REMOVED, id, now()));
            return;
        }
        slot.lock.lock();
        try {
            ensurePresent(id, slot);
            store.remove(id);
            slot.markRemoved();
            table.remove(id, slot);
        } finally {
            slot.lock.unlock();
        }
        log.info("Removed cron job name={} id={} running={}", slot.job().name(), id, slot.isRunning());
        events.publish(CronEvent.job(CronEventType.JOB_REMOVED, id, now()));
    }

    @Override
    public JobExecution runJob(String id) {
        JobSlot slot = requireSlot(id);
        slot.lock.lock();
        try {
            ensurePresent(id, slot);
            if (!slot.tryMarkRunning()) {
                throw new JobAlreadyRunningException(id);
            }
        } finally {
            slot.lock.unlock();
        }
        return runAndRecord(slot, ExecutionTrigger.MANUAL, null);
    }

    @Override
    public List<JobExecution> getHistory(String id, int limit) {
        Objects.requireNonNull(id, "id must not be null");
        return store.getHistory(id, limit);
    }

    @Override
    public int purgeHistory(String id) {
        Objects.requireNonNull(id, "id must not be null");
        int purged = store.purgeHistory(id);
        log.info("Purged cron job history id={} records={}", id, purged);
        return purged;
    }

    @Override
    public boolean isRunning(String id) {
        JobSlot slot = table.get(id);
        return slot != null && slot.isRunning();
    }

    @Override
    public Optional<JobExecution> currentExecution(String id) {
        JobSlot slot = table.get(id);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.currentExecution());
    }

    @Override
    public void setAgentExecutor(AgentExecutor executor) {
        dispatcher.setAgentExecutor(executor);
    }

    @Override
    public void addListener(CronEventListener listener) {
        events.add(listener);
    }

    @Override
    public void removeListener(CronEventListener listener) {
        events.remove(listener);
    }

    /**
     * Evaluate every active job against the minute containing {@code now} and dispatch the due ones on the
     * worker pool. Each job fires at most once per minute however often this is called.
     *
     * @return one future per dispatched execution
     */
    public List<CompletableFuture<JobExecution>> tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        ensureLoaded();
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);

        List<CompletableFuture<JobExecution>> dispatched = new ArrayList<>();
        for (JobSlot slot : table.snapshot()) {
            try {
                Claim claim = claimDue(slot, minute);
                if (claim == Claim.SKIPPED) {
                    CronJob job = slot.job();
                    JobExecution inFlight = slot.currentExecution();
                    log.warn("cron job still running, skipping minute name={} id={} minute={}",
                            job.name(), job.id(), minute);
                    events.publish(new CronEvent(CronEventType.JOB_SKIPPED, job.id(),
                            inFlight == null ? null : inFlight.id(), "Previous execution still running", now()));
                } else if (claim == Claim.CLAIMED) {
                    dispatched.add(submit(slot, minute));
                }
            } catch (Exception e) {
                log.error("cron tick failed for job id={} msg={}", slot.job().id(), e.getMessage(), e);
            }
        }
        log.debug("Cron tick minute={} jobs={} dispatched={}", minute, table.size(), dispatched.size());
        return dispatched;
    }

    /* ================= tick internals ================= */

    private Claim claimDue(JobSlot slot, Instant minute) {
        slot.lock.lock();
        try {
            if (slot.isRemoved() || !slot.job().isActive()) {
                return Claim.NONE;
            }
            if (!slot.expression().isDue(minute, slot.zone())) {
                return Claim.NONE;
            }
            if (!slot.markFired(minute)) {
                return Claim.NONE;
            }
            return slot.tryMarkRunning() ? Claim.CLAIMED : Claim.SKIPPED;
        } finally {
            slot.lock.unlock();
        }
    }

    private CompletableFuture<JobExecution> submit(JobSlot slot, Instant minute) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> runAndRecord(slot, ExecutionTrigger.SCHEDULED, minute), workers());
        } catch (RejectedExecutionException e) {
            slot.clearRunning();
            throw e;
        }
    }

    private JobExecution runAndRecord(JobSlot slot, ExecutionTrigger trigger, Instant firedMinute) {
        CronJob job = slot.job();
        JobExecution finished;
        RuntimeException storeFailure;
        try {
            JobExecution running = JobExecution.started(job.id(), trigger, now());
            slot.begin(running);
            log.debug("cron job started name={} id={} trigger={} executionId={}",
                    job.name(), job.id(), trigger, running.id());
            events.publish(CronEvent.execution(CronEventType.JOB_STARTED, running, running.startedAt()));

            finished = dispatcher.dispatch(job, running);
            storeFailure = record(slot, finished, firedMinute);
        } finally {
            slot.clearRunning();
        }

        logOutcome(job, finished);
        events.publish(CronEvent.execution(outcomeEvent(finished.status()), finished, finished.finishedAt()));

        if (storeFailure != null && trigger == ExecutionTrigger.MANUAL) {
            throw storeFailure;
        }
        return finished;
    }

    /**
     * Append the execution to history and fold it into the job statistics.
     *
     * @return the first store failure, or null
     */
    private RuntimeException record(JobSlot slot, JobExecution finished, Instant firedMinute) {
        String id = finished.jobId();
        RuntimeException failure = null;
        try {
            store.appendHistory(finished);
        } catch (RuntimeException e) {
            log.error("cron history append failed id={} executionId={} msg={}", id, finished.id(), e.getMessage(), e);
            failure = e;
        }

        slot.lock.lock();
        try {
            if (slot.isRemoved()) {
                log.debug("cron job removed while running id={} executionId={}", id, finished.id());
                return failure;
            }
            Instant next = NextRunCalculator.computeNextRunAt(
                    slot.expression(), slot.zone(), firedMinute, finished.finishedAt());
            CronJob updated = store.update(id, job -> job.withRun(finished, job.isActive() ? next : null));
            slot.replace(updated);
        } catch (JobNotFoundException e) {
            log.debug("cron job vanished before its run was recorded id={}", id);
        } catch (RuntimeException e) {
            log.error("cron job stats update failed id={} executionId={} msg={}", id, finished.id(), e.getMessage(), e);
            if (failure == null) {
                failure = e;
            }
        } finally {
            slot.lock.unlock();
        }
        return failure;
    }

    private void logOutcome(CronJob job, JobExecution finished) {
        switch (finished.status()) {
            case SUCCESS -> log.info("cron job succeeded name={} id={} trigger={} durationMs={}",
                    job.name(), job.id(), finished.trigger(), finished.duration().toMillis());
            case TIMEOUT -> log.warn("cron job timed out name={} id={} trigger={} msg={}",
                    job.name(), job.id(), finished.trigger(), finished.error());
            default -> log.error("cron job failed name={} id={} trigger={} status={} exitCode={} msg={}",
                    job.name(), job.id(), finished.trigger(), finished.status(), finished.exitCode(), finished.error());
        }
    }

    private static CronEventType outcomeEvent(ExecutionStatus status) {
        return switch (status) {
            case SUCCESS -> CronEventType.JOB_COMPLETED;
            case TIMEOUT -> CronEventType.JOB_TIMEOUT;
            default -> CronEventType.JOB_FAILED;
        };
    }

    private void tickLoop() {
        Instant lastMinute = null;
        while (started.get()) {
            Instant target;
            try {
                target = sleepUntilNextTick();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (!started.get()) {
                break;
            }

            try {
                Instant current = clock.instant();
                lastMinute = tickSince(lastMinute, current.isBefore(target) ? target : current);
            } catch (Exception e) {
                log.error("cron tick failed msg={}", e.getMessage(), e);
            }
        }
    }

    /**
     * Tick every minute after {@code lastMinute} up to the minute of {@code now}, so a late wake-up does not
     * drop the minutes in between. Gaps longer than {@link #MAX_CATCH_UP_MINUTES} are treated as downtime and
     * only the current minute is evaluated.
     *
     * @return the minute of {@code now}
     */
    Instant tickSince(Instant lastMinute, Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (lastMinute != null && lastMinute.isBefore(minute)) {
            long gap = Duration.between(lastMinute, minute).toMinutes() - 1;
            if (gap > MAX_CATCH_UP_MINUTES) {
                log.warn("Cron scheduler fell behind, not replaying missed minutes from={} to={}", lastMinute, minute);
            } else {
                for (Instant m = lastMinute.plus(1, ChronoUnit.MINUTES); m.isBefore(minute); m = m.plus(1, ChronoUnit.MINUTES)) {
                    log.debug("Cron tick catching up minute={}", m);
                    tick(m);
                }
            }
        }
        tick(now);
        return minute;
    }

    private Instant sleepUntilNextTick() throws InterruptedException {
        Instant current = clock.instant();
        Instant target = props.isAlignToMinute()
                ? current.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES)
                : current.plus(props.getTickInterval());
        long millis = Duration.between(current, target).toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
        return target;
    }

    private void joinTicker(Thread ticker) {
        if (ticker == Thread.currentThread()) {
            return;
        }
        try {
            ticker.join(TICKER_JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (ticker.isAlive()) {
            log.warn("Cron ticker thread did not exit within {}", TICKER_JOIN_TIMEOUT);
        }
    }

    private void shutdownWorkers() {
        ExecutorService pool;
        synchronized (this) {
            pool = workerPool;
            workerPool = null;
        }
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(props.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cron scheduler grace period elapsed, cancelling running executions");
                pool.shutdownNow();
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Cron worker pool did not terminate");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private synchronized ExecutorService workers() {
        if (workerPool == null) {
            AtomicInteger seq = new AtomicInteger();
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("cronkit.worker-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    /* ================= helper ================= */

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (loadLock) {
            if (loaded) {
                return;
            }
            Instant now = now();
            for (CronJob job : store.list()) {
                CronExpression expression;
                ZoneId zone;
                try {
                    expression = CronExpression.parse(job.schedule());
                    zone = NextRunCalculator.resolveZone(job.timezone(), defaultZone);
                } catch (CronParseException | IllegalArgumentException e) {
                    log.error("cron job not scheduled, invalid definition name={} id={} msg={}",
                            job.name(), job.id(), e.getMessage());
                    continue;
                }
                table.install(refreshNextRun(job, expression, zone, now), expression, zone);
            }
            loaded = true;
            log.info("Loaded cron jobs count={}", table.size());
        }
    }

    private CronJob refreshNextRun(CronJob job, CronExpression expression, ZoneId zone, Instant now) {
        Instant next = job.isActive() ? NextRunCalculator.computeNextRunAt(expression, zone, null, now) : null;
        if (Objects.equals(next, job.nextRunAt())) {
            return job;
        }
        try {
            return store.update(job.id(), current -> current.withNextRunAt(next));
        } catch (RuntimeException e) {
            log.warn("cron job nextRunAt refresh failed name={} id={} msg={}", job.name(), job.id(), e.getMessage());
            return job.withNextRunAt(next);
        }
    }

    private JobSlot requireSlot(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ensureLoaded();
        JobSlot slot = table.get(id);
        if (slot == null) {
            throw new JobNotFoundException(id);
        }
        return slot;
    }

    private static void ensurePresent(String id, JobSlot slot) {
        if (slot.isRemoved()) {
            throw new JobNotFoundException(id);
        }
    }

    private static Duration normalizeTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero()) {
            return null;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return timeout;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
