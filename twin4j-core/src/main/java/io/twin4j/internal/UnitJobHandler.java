package io.twin4j.internal;

import io.twin4j.JobContext;
import io.twin4j.JobHandler;
import io.twin4j.Unit;
import io.twin4j.UnitContext;
import io.twin4j.UnitEventListener;
import io.twin4j.core.RunOutcome;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.storage.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs the unit named by the job on one of the unit queues.
 */
public class UnitJobHandler implements JobHandler<Void> {
    private static final Logger log = LoggerFactory.getLogger(UnitJobHandler.class);

    private final String queueName;
    private final UnitRegistry units;
    private final DatabaseAdapter database;
    private final StorageService storage;
    private final Clock clock;
    private final UnitEventListener events;

    public UnitJobHandler(String queueName, UnitRegistry units, DatabaseAdapter database, StorageService storage,
                          Clock clock, UnitEventListener events) {
        this.queueName = Objects.requireNonNull(queueName, "queueName must not be null");
        this.units = Objects.requireNonNull(units, "units must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.clock = clock;
        this.events = events;
    }

    @Override
    public String queueName() {
        return queueName;
    }

    @Override
    public Class<Void> dataClass() {
        return Void.class;
    }

    @Override
    public void execute(Void data, JobContext context) {
        Unit unit = units.getRequired(context.unitName());
        RunOutcome outcome = unit.run(new UnitContext(database, storage, clock, events, context::isCancelled));
        log.debug("unit run finished unit={} type={} trigger={} recordsWritten={}",
                unit.name(), unit.type(), context.trigger(), outcome.recordsWritten());
    }
}
