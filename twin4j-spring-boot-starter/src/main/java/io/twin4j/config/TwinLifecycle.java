package io.twin4j.config;

import io.twin4j.DigitalTwin;
import io.twin4j.errors.TwinException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the engine once the context is refreshed and stops it before the Mongo beans go away.
 *
 * <p>With {@code twin.auto-startup=false} the application calls {@link #start()} itself, e.g. after
 * its own warm-up. A failed start leaves the bean stopped so the context refresh fails.
 */
public class TwinLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TwinLifecycle.class);

    private final DigitalTwin digitalTwin;
    private final boolean autoStartup;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TwinLifecycle(DigitalTwin digitalTwin, boolean autoStartup) {
        this.digitalTwin = Objects.requireNonNull(digitalTwin, "digitalTwin must not be null");
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            digitalTwin.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            digitalTwin.stop();
        } catch (TwinException e) {
            log.error("Digital twin shutdown incomplete code={} context={} msg={}", e.code(), e.context(), e.getMessage());
            throw e;
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
