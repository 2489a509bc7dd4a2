package io.twin4j.internal;

import io.twin4j.UnitEventListener;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Triggers fusion units in {@code ON_SOURCE} or {@code BOTH} mode when their source producer stores a
 * record. Bursts of completions inside the unit's debounce window collapse into a single trigger.
 */
public class SourceTriggerDispatcher implements UnitEventListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SourceTriggerDispatcher.class);

    private final Map<String, List<UnitConfiguration>> bySource = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final Consumer<String> trigger;
    private final ScheduledExecutorService timer;

    /**
     * @param trigger invoked with the fusion unit name once its debounce window has elapsed
     */
    public SourceTriggerDispatcher(List<UnitConfiguration> units, Consumer<String> trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        for (UnitConfiguration unit : units) {
            if (unit.triggerMode().usesSourceEvents() && unit.source() != null) {
                bySource.computeIfAbsent(unit.source(), s -> new ArrayList<>()).add(unit);
            }
        }
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("twin.source-trigger");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean hasListeners() {
        return !bySource.isEmpty();
    }

    @Override
    public void onEvent(UnitEvent event) {
        if (event.type() != UnitEvent.Type.PRODUCER_COMPLETED) {
            return;
        }
        List<UnitConfiguration> dependents = bySource.get(event.unitName());
        if (dependents == null) {
            return;
        }
        log.debug("Source completed source={} dependents={}", event.unitName(), dependents.size());
        for (UnitConfiguration unit : dependents) {
            debounce(unit.name(), unit.debounce());
        }
    }

    private void debounce(String unitName, Duration window) {
        pending.compute(unitName, (name, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            DebouncedTrigger task = new DebouncedTrigger(name);
            try {
                task.future = timer.schedule(task, window.toMillis(), TimeUnit.MILLISECONDS);
                return task.future;
            } catch (RejectedExecutionException e) {
                log.debug("Source trigger rejected during shutdown unit={}", name);
                return null;
            }
        });
    }

    private final class DebouncedTrigger implements Runnable {
        private final String unitName;
        private volatile ScheduledFuture<?> future;

        DebouncedTrigger(String unitName) {
            this.unitName = unitName;
        }

        @Override
        public void run() {
            try {
                trigger.accept(unitName);
            } catch (Exception e) {
                log.error("Source trigger failed unit={} msg={}", unitName, e.getMessage(), e);
            } finally {
                // a burst that arrived while firing owns the slot now
                pending.remove(unitName, future);
            }
        }
    }

    @Override
    public void close() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
        timer.shutdownNow();
    }
}
