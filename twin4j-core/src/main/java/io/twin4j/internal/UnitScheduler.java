package io.twin4j.internal;

import io.twin4j.errors.ConfigurationException;
import io.twin4j.utils.IntervalParser;
import org.quartz.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Fires one cron timer per registered unit.
 *
 * <p>A tick is dropped (and logged) when the unit's previous trigger is still executing or when the
 * busy check reports the unit as busy. The next fire time is always computed from the current time,
 * so ticks missed while the process was down or blocked are never replayed.
 */
public class UnitScheduler {
    private static final Logger log = LoggerFactory.getLogger(UnitScheduler.class);

    private final ZoneId zone;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicLong> skipped = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean cancelled = false;
    private volatile Predicate<String> busyCheck = name -> false;

    private ScheduledExecutorService timer;
    private ExecutorService triggerPool;

    private static final class Registration {
        final String unitName;
        final String expression;
        final CronExpression cron;
        final Runnable trigger;
        volatile Instant lastFireAt;
        volatile Instant plannedAt;
        volatile ScheduledFuture<?> next;

        Registration(String unitName, String expression, CronExpression cron, Runnable trigger) {
            this.unitName = unitName;
            this.expression = expression;
            this.cron = cron;
            this.trigger = trigger;
        }
    }

    public UnitScheduler(ZoneId zone) {
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    /**
     * @throws ConfigurationException on a malformed expression or a duplicate unit name
     */
    public void register(String unitName, String cronExpression, Runnable trigger) {
        Objects.requireNonNull(unitName, "unitName must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        CronExpression cron = IntervalParser.parseCron(cronExpression, zone);

        Registration registration = new Registration(unitName, cronExpression, cron, trigger);
        if (registrations.putIfAbsent(unitName, registration) != null) {
            throw new ConfigurationException("Unit already scheduled: " + unitName, Map.of("unitName", unitName));
        }
        skipped.put(unitName, new AtomicLong());
        if (started.get()) {
            scheduleNext(registration);
        }
        log.debug("Scheduler registered unit={} cron={}", unitName, cronExpression);
    }

    /**
     * Ticks for units reported busy by {@code check} are skipped.
     */
    public void setBusyCheck(Predicate<String> check) {
        this.busyCheck = Objects.requireNonNull(check, "check must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        cancelled = false;
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("twin.scheduler");
            t.setDaemon(true);
            return t;
        });
        triggerPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("twin.scheduler.trigger");
            t.setDaemon(true);
            return t;
        });
        registrations.values().forEach(this::scheduleNext);
        log.info("Scheduler started units={} zone={}", registrations.keySet(), zone);
    }

    /**
     * Cancels all timers and waits up to {@code grace} for in-flight triggers. Triggers are never interrupted.
     *
     * @return false when triggers were still running after {@code grace}
     */
    public boolean stop(Duration grace) {
        if (!started.compareAndSet(true, false)) {
            return true;
        }
        cancelled = true;
        for (Registration r : registrations.values()) {
            ScheduledFuture<?> next = r.next;
            if (next != null) {
                next.cancel(false);
            }
        }
        timer.shutdownNow();
        triggerPool.shutdown();

        boolean drained = true;
        try {
            drained = triggerPool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Scheduler stopped with triggers still running units={}", inFlight);
        } else {
            log.info("Scheduler stopped.");
        }
        return drained;
    }

    /**
     * Raised by {@link #stop(Duration)}; long-running triggers may poll it.
     */
    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isRegistered(String unitName) {
        return registrations.containsKey(unitName);
    }

    public long skippedTicks(String unitName) {
        AtomicLong count = skipped.get(unitName);
        return count == null ? 0 : count.get();
    }

    /**
     * Next fire time of the unit, or null when it is not scheduled.
     */
    public Instant nextFireTime(String unitName) {
        Registration r = registrations.get(unitName);
        return r == null ? null : IntervalParser.computeNextRunAt(r.cron, r.lastFireAt, nowInstant());
    }

    /**
     * Utility: current time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Runs one tick of the unit immediately, applying the same overlap rules as a timer tick.
     *
     * @return true when the trigger was started
     */
    boolean fire(String unitName) {
        Registration r = registrations.get(unitName);
        if (r == null || !started.get()) {
            return false;
        }
        Instant now = nowInstant();
        // the timer may wake a few ms early; never let the same slot fire twice
        Instant planned = r.plannedAt;
        r.lastFireAt = (planned != null && planned.isAfter(now)) ? planned : now;

        if (!inFlight.add(unitName)) {
            skip(r, "previous trigger still running");
            return false;
        }
        boolean busy;
        try {
            busy = busyCheck.test(unitName);
        } catch (RuntimeException e) {
            log.warn("Scheduler busy check failed unit={} msg={}", unitName, e.getMessage());
            busy = true;
        }
        if (busy) {
            inFlight.remove(unitName);
            skip(r, "unit busy");
            return false;
        }

        try {
            triggerPool.execute(() -> {
                try {
                    r.trigger.run();
                } catch (Exception e) {
                    log.error("Scheduler trigger failed unit={} msg={}", unitName, e.getMessage(), e);
                } finally {
                    inFlight.remove(unitName);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(unitName);
            log.debug("Scheduler tick rejected during shutdown unit={}", unitName);
            return false;
        }
    }

    private void skip(Registration r, String reason) {
        long count = skipped.get(r.unitName).incrementAndGet();
        log.info("Scheduler skipped tick unit={} reason={} skippedTotal={}", r.unitName, reason, count);
    }

    private void scheduleNext(Registration r) {
        if (!started.get()) {
            return;
        }
        Instant now = nowInstant();
        Instant next = IntervalParser.computeNextRunAt(r.cron, r.lastFireAt, now);
        if (next == null) {
            log.warn("Scheduler unit has no future fire time unit={} cron={}", r.unitName, r.expression);
            return;
        }
        r.plannedAt = next;
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        try {
            r.next = timer.schedule(() -> {
                try {
                    fire(r.unitName);
                } finally {
                    scheduleNext(r);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler timer rejected during shutdown unit={}", r.unitName);
        }
    }
}
