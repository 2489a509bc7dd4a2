package io.twin4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twin4j.DigitalTwin;
import io.twin4j.JobHandler;
import io.twin4j.Unit;
import io.twin4j.UnitEventListener;
import io.twin4j.config.TwinProperties;
import io.twin4j.core.HealthStatus;
import io.twin4j.core.JobHandlerRegistry;
import io.twin4j.core.JobPayload;
import io.twin4j.core.QueueNames;
import io.twin4j.core.QueueStats;
import io.twin4j.core.TriggerKind;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitEvent;
import io.twin4j.core.UnitType;
import io.twin4j.core.UploadRequest;
import io.twin4j.core.UploadTicket;
import io.twin4j.core.ValidationReport;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.TwinException;
import io.twin4j.errors.ValidationException;
import io.twin4j.health.HealthChecker;
import io.twin4j.health.HealthChecks;
import io.twin4j.storage.StorageService;
import io.twin4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default engine: units run through the {@link QueueManager}, timers come from the {@link UnitScheduler}
 * and source-triggered fusion units from the {@link SourceTriggerDispatcher}.
 *
 * <p>An instance is started once; after {@link #stop()} a new instance is needed.
 */
public class DefaultDigitalTwin implements DigitalTwin {
    private static final Logger log = LoggerFactory.getLogger(DefaultDigitalTwin.class);

    private final TwinProperties props;
    private final UnitRegistry units;
    private final DatabaseAdapter database;
    private final QueueManager queueManager;
    private final UnitScheduler scheduler;
    private final SourceTriggerDispatcher sourceTriggers;
    private final UploadProcessor uploadProcessor;
    private final HealthChecker healthChecker;
    private final List<UnitEventListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public DefaultDigitalTwin(TwinProperties props, List<? extends Unit> units, DatabaseAdapter database,
                              StorageService storage, JobStore jobStore, ObjectMapper objectMapper) {
        this(props, units, database, storage, jobStore, objectMapper, Clock.systemUTC());
    }

    public DefaultDigitalTwin(TwinProperties props, List<? extends Unit> units, DatabaseAdapter database,
                              StorageService storage, JobStore jobStore, ObjectMapper objectMapper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.units = new UnitRegistry(Objects.requireNonNull(units, "units must not be null"));
        this.database = Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(storage, "storage must not be null");
        Objects.requireNonNull(jobStore, "jobStore must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        this.sourceTriggers = new SourceTriggerDispatcher(
                this.units.configurations(),
                name -> enqueueRun(name, TriggerKind.SOURCE_EVENT)
        );
        UnitEventListener events = this::publish;

        List<JobHandler<?>> handlers = new ArrayList<>();
        for (String queue : List.of(QueueNames.COLLECTORS, QueueNames.HARVESTERS, QueueNames.PRIORITY)) {
            handlers.add(new UnitJobHandler(queue, this.units, database, storage, clock, events));
        }
        handlers.add(new UploadJobHandler(database, storage, clock));

        this.queueManager = new QueueManager(props, jobStore, new JobHandlerRegistry(handlers), objectMapper);
        this.uploadProcessor = new UploadProcessor(props, database, queueManager, objectMapper, clock);
        this.scheduler = new UnitScheduler(props.getTimezone() == null ? null : ZoneId.of(props.getTimezone()));
        this.scheduler.setBusyCheck(queueManager::isUnitBusy);

        this.healthChecker = new HealthChecker(clock);
        healthChecker.registerPing(HealthChecker.DATABASE, HealthChecks.database(database));
        healthChecker.registerPing(HealthChecker.QUEUE, HealthChecks.queue(queueManager));
        healthChecker.registerPing(HealthChecker.STORAGE, HealthChecks.storage(storage));
        healthChecker.setVersion(props.getVersion());
        healthChecker.setComponentCounts(Map.of(
                "producers", this.units.ofType(UnitType.PRODUCER).size(),
                "fusionUnits", this.units.ofType(UnitType.FUSION).size()
        ));
    }

    /**
     * Receives every unit completion event, after source triggers have been notified.
     */
    public void addEventListener(UnitEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void start() {
        if (stopped.get()) {
            throw new ConfigurationException("Engine was stopped and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            ValidationReport report = validateConfiguration();
            if (!report.valid()) {
                throw new ConfigurationException(
                        "Invalid configuration: " + describe(report),
                        Map.of("invalidUnits", report.invalidCount())
                );
            }

            ensureTables();
            queueManager.start();

            for (Unit unit : units.all()) {
                String cron = unit.getConfiguration().effectiveSchedule();
                if (cron != null) {
                    scheduler.register(unit.name(), cron, () -> enqueueRun(unit.name(), TriggerKind.SCHEDULE));
                }
            }
            scheduler.start();
        } catch (RuntimeException e) {
            if (queueManager.isRunning()) {
                abortStart(e);
            }
            started.set(false);
            throw e;
        }

        log.info("Digital twin started units={} workerId={}", units.size(), queueManager.workerId());
    }

    @Override
    public void stop() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        Duration grace = props.getShutdownTimeout();
        log.info("Digital twin stopping grace={}", grace);

        List<RuntimeException> errors = new ArrayList<>();
        if (!scheduler.stop(grace)) {
            log.warn("Scheduler triggers did not finish within grace={}", grace);
        }
        sourceTriggers.close();
        try {
            queueManager.close(grace);
        } catch (RuntimeException e) {
            errors.add(e);
        }
        try {
            database.close();
        } catch (RuntimeException e) {
            errors.add(e);
        }
        started.set(false);

        if (!errors.isEmpty()) {
            TwinException first = TwinException.wrap(errors.get(0), Map.of("operation", "stop"));
            for (int i = 1; i < errors.size(); i++) {
                first.addSuppressed(errors.get(i));
            }
            log.error("Digital twin stopped with errors count={} msg={}", errors.size(), first.getMessage());
            throw first;
        }
        log.info("Digital twin stopped.");
    }

    @Override
    public String trigger(String unitName) {
        if (!units.contains(unitName)) {
            throw new ValidationException("Unknown unit: " + unitName, Map.of("unitName", unitName));
        }
        return queueManager.enqueue(QueueNames.PRIORITY, JobPayload.of(unitName, TriggerKind.MANUAL));
    }

    @Override
    public UploadTicket submitUpload(UploadRequest request) {
        return uploadProcessor.submit(request);
    }

    @Override
    public Map<String, QueueStats> getQueueStats() {
        return queueManager.getQueueStats();
    }

    @Override
    public HealthStatus health() {
        return healthChecker.performCheck();
    }

    @Override
    public ValidationReport validateConfiguration() {
        List<ValidationReport.UnitValidation> results = new ArrayList<>();
        for (Unit unit : units.all()) {
            results.add(validateUnit(unit));
        }

        List<String> engineErrors = new ArrayList<>();
        for (String queue : QueueNames.ALL) {
            TwinProperties.QueueOptions options = props.queue(queue);
            if (options == null) {
                engineErrors.add("Queue " + queue + " has no options");
            } else if (options.getConcurrency() < 1 || options.getMaxAttempts() < 1) {
                engineErrors.add("Queue " + queue + " needs concurrency and maxAttempts >= 1");
            } else if (queue.equals(QueueNames.UPLOADS) && options.getMaxAttempts() != 1) {
                engineErrors.add("Queue " + queue + " must use maxAttempts = 1");
            }
        }
        if (props.getShutdownTimeout() == null || props.getShutdownTimeout().isNegative()) {
            engineErrors.add("twin.shutdownTimeout must not be negative");
        }
        return new ValidationReport(results, engineErrors);
    }

    public QueueManager queueManager() {
        return queueManager;
    }

    public UnitScheduler scheduler() {
        return scheduler;
    }

    private ValidationReport.UnitValidation validateUnit(Unit unit) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String name = "?";
        UnitType type = null;
        try {
            UnitConfiguration config = unit.getConfiguration();
            name = config.name();
            type = config.type();

            if (config.contentType().isBlank()) {
                errors.add("contentType must not be blank");
            }
            String cron = config.effectiveSchedule();
            if (cron != null) {
                try {
                    IntervalParser.parseCron(cron, null);
                } catch (ConfigurationException e) {
                    errors.add(e.getMessage());
                }
            }

            if (type == UnitType.PRODUCER) {
                if (cron == null) {
                    errors.add("Producer must specify a schedule");
                }
            } else {
                validateFusion(config, errors, warnings);
            }
        } catch (RuntimeException e) {
            log.warn("unit validation failed unit={} msg={}", name, e.getMessage());
            errors.add("Validation failed: " + TwinException.messageOf(e));
        }
        return new ValidationReport.UnitValidation(name, type, errors, warnings);
    }

    private void validateFusion(UnitConfiguration config, List<String> errors, List<String> warnings) {
        String source = config.source();
        if (source == null || source.isBlank()) {
            errors.add("Fusion unit must specify a source");
        } else if (!units.contains(source)) {
            warnings.add("Source '" + source + "' is not a registered unit");
        } else if (config.triggerMode().usesSourceEvents()
                && units.getRequired(source).type() != UnitType.PRODUCER) {
            warnings.add("Source '" + source + "' is not a producer, source-triggered runs will never fire");
        }
        if (config.dependenciesLimit().size() > config.dependencies().size()) {
            errors.add("dependenciesLimit has more entries than dependencies");
        }
        for (String dependency : config.dependencies()) {
            if (!units.contains(dependency)) {
                warnings.add("Dependency '" + dependency + "' is not a registered unit");
            }
        }
        if (config.sourceRangeMin() && config.sourceRange() == null) {
            warnings.add("sourceRangeMin has no effect without a sourceRange");
        }
    }

    // Workers already polling when a later start step failed; the engine cannot be restarted after this.
    private void abortStart(RuntimeException failure) {
        log.error("Digital twin start failed after queues started, shutting down msg={}", failure.getMessage());
        stopped.set(true);
        scheduler.stop(Duration.ZERO);
        sourceTriggers.close();
        try {
            queueManager.close(props.getShutdownTimeout());
        } catch (RuntimeException closeEx) {
            failure.addSuppressed(closeEx);
        }
    }

    private void ensureTables() {
        for (Unit unit : units.all()) {
            String table = unit.name();
            if (!database.doesTableExists(table)) {
                database.createTable(table);
                log.info("Created table name={}", table);
            } else if (props.isAutoMigration()) {
                List<String> applied = database.migrateTableSchema(table);
                if (!applied.isEmpty()) {
                    log.info("Migrated table name={} migrations={}", table, applied);
                }
            }
        }
    }

    private String enqueueRun(String unitName, TriggerKind trigger) {
        Unit unit = units.getRequired(unitName);
        return queueManager.enqueue(unit.type().defaultQueue(), JobPayload.of(unitName, trigger));
    }

    private void publish(UnitEvent event) {
        sourceTriggers.onEvent(event);
        for (UnitEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("event listener failed unit={} type={} msg={}", event.unitName(), event.type(), e.getMessage());
            }
        }
    }

    private static String describe(ValidationReport report) {
        List<String> parts = new ArrayList<>(report.engineErrors());
        for (ValidationReport.UnitValidation unit : report.units()) {
            for (String error : unit.errors()) {
                parts.add(unit.unitName() + ": " + error);
            }
        }
        return String.join("; ", parts);
    }
}
