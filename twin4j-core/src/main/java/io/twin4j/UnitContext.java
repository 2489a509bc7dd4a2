package io.twin4j;

import io.twin4j.core.UnitEvent;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.storage.StorageService;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Collaborators handed to a unit for one run.
 */
public record UnitContext(
        DatabaseAdapter database,
        StorageService storage,
        Clock clock,
        UnitEventListener events,
        BooleanSupplier cancellation
) {
    public UnitContext {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(storage, "storage must not be null");
        clock = clock == null ? Clock.systemUTC() : clock;
        events = events == null ? UnitEventListener.NOOP : events;
        cancellation = cancellation == null ? () -> false : cancellation;
    }

    public static UnitContext of(DatabaseAdapter database, StorageService storage) {
        return new UnitContext(database, storage, null, null, null);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Raised when the engine is shutting down. Long-running units should poll it and return early.
     */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    public void publish(UnitEvent event) {
        events.onEvent(event);
    }
}
