package io.twin4j;

import io.twin4j.core.DataRecord;
import io.twin4j.core.Dependencies;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.RunOutcome;
import io.twin4j.core.SourceRange;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitEvent;
import io.twin4j.core.UnitType;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.StorageException;
import io.twin4j.errors.TwinException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit that joins its primary {@code source} stream with dependency streams and writes derived records.
 *
 * <p>Each run only considers primary records dated after the unit's own latest record ({@code lastRun}),
 * so successive runs never process the same primary record twice. Dependencies are resolved with
 * latest-before semantics against the anchor date of the run:
 * <ul>
 *   <li>single latest mode: anchor is the primary record's date, output is dated now</li>
 *   <li>window range: anchor and output date are the window end</li>
 *   <li>count range: anchor and output date are the last selected record's date</li>
 *   <li>multiple results: anchor is the last selected record, result {@code i} is dated at record {@code i}</li>
 * </ul>
 * A dependency with no record inside its lookback window is handed to {@link #harvest} as missing.
 */
public abstract class FusionUnit implements Unit {
    private static final Logger log = LoggerFactory.getLogger(FusionUnit.class);

    // Window mode, first run: start just before the first primary record.
    private static final Duration FIRST_WINDOW_OFFSET = Duration.ofSeconds(1);

    private final UnitConfiguration configuration;

    protected FusionUnit(UnitConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        if (configuration.type() != UnitType.FUSION) {
            throw new ConfigurationException(
                    "Unit '" + configuration.name() + "' is not a fusion configuration",
                    Map.of("unitName", configuration.name())
            );
        }
    }

    @Override
    public final UnitConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Computes derived payloads.
     *
     * @param sourceRecords selected primary records, ascending; a single element in latest mode
     * @param dependencies  resolved dependency records, possibly missing
     * @return payloads to persist; empty writes nothing
     */
    protected abstract List<byte[]> harvest(List<DataRecord> sourceRecords, Dependencies dependencies) throws Exception;

    @Override
    public final RunOutcome run(UnitContext context) {
        String name = configuration.name();
        String source = configuration.source();
        if (source == null || source.isBlank()) {
            throw new ConfigurationException(
                    "Fusion unit '" + name + "' must specify a source",
                    Map.of("unitName", name)
            );
        }

        try {
            return join(context, name, source);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("unitName", name);
            ctx.put("source", source);
            throw new StorageException(
                    "Fusion unit '" + name + "' failed: " + TwinException.messageOf(e),
                    ctx,
                    e
            );
        }
    }

    private RunOutcome join(UnitContext context, String name, String source) throws Exception {
        DatabaseAdapter db = context.database();
        Optional<DataRecord> own = db.getLatestByName(name);
        Instant lastRun = own.map(DataRecord::date).orElse(Instant.EPOCH);

        Selection selection = select(context, source, lastRun, own.isEmpty());
        if (selection == null) {
            log.debug("fusion run no-op unit={} source={} lastRun={}", name, source, lastRun);
            return RunOutcome.noop(name);
        }

        Dependencies dependencies = resolveDependencies(db, selection.anchor());
        List<byte[]> results = harvest(selection.records(), dependencies);
        if (results == null || results.isEmpty()) {
            log.debug("fusion harvest returned nothing unit={} records={}", name, selection.records().size());
            return RunOutcome.noop(name);
        }

        int written = 0;
        for (int i = 0; i < results.size(); i++) {
            byte[] payload = results.get(i);
            if (payload == null) {
                continue;
            }
            Instant date = outputDate(context, selection, i);
            String ref = context.storage().save(payload, name, configuration.extension());
            db.save(MetadataRow.of(name, configuration.contentType(), ref, date));
            written++;
            if (!configuration.multipleResults()) {
                break;
            }
        }

        log.debug("fusion run stored unit={} records={} anchor={} missingDependencies={}",
                name, written, selection.anchor(), missingCount(dependencies));
        if (written > 0) {
            context.publish(new UnitEvent(
                    UnitEvent.Type.FUSION_COMPLETED,
                    name,
                    context.now(),
                    Map.of("recordsWritten", written, "sourceRecords", selection.records().size())
            ));
        }
        return new RunOutcome(name, written);
    }

    /**
     * Returns null when the run has nothing to do.
     */
    private Selection select(UnitContext context, String source, Instant lastRun, boolean firstRun) {
        DatabaseAdapter db = context.database();
        SourceRange range = configuration.sourceRange();

        if (range == null) {
            if (configuration.multipleResults()) {
                List<DataRecord> records = db.getAfterDate(source, lastRun, Integer.MAX_VALUE);
                return records.isEmpty() ? null : Selection.ofLast(records, Mode.MULTIPLE);
            }
            Optional<DataRecord> latest = db.getLatestByName(source);
            if (latest.isEmpty() || !latest.get().date().isAfter(lastRun)) {
                return null;
            }
            return new Selection(List.of(latest.get()), latest.get().date(), Mode.LATEST);
        }

        if (!range.isWindow()) {
            int count = range.count();
            List<DataRecord> records = db.getAfterDate(source, lastRun, count);
            if (records.isEmpty() || (configuration.sourceRangeMin() && records.size() < count)) {
                return null;
            }
            return Selection.ofLast(records, configuration.multipleResults() ? Mode.MULTIPLE : Mode.RANGE);
        }

        Instant start = lastRun;
        List<DataRecord> next = db.getAfterDate(source, lastRun, 1);
        if (next.isEmpty()) {
            return null;
        }
        Instant firstAvailable = next.get(0).date();
        // First run, or a gap longer than the window: re-anchor just before the next record.
        if (firstRun || range.windowEnd(start).isBefore(firstAvailable)) {
            start = firstAvailable.minus(FIRST_WINDOW_OFFSET);
        }

        Instant end = range.windowEnd(start);
        if (configuration.sourceRangeMin() && end.isAfter(context.now())) {
            return null;
        }

        List<DataRecord> records = db.getByDateRange(source, start, end).stream()
                .filter(r -> r.date().isAfter(lastRun))
                .toList();
        if (records.isEmpty()) {
            return null;
        }
        return new Selection(records, end, configuration.multipleResults() ? Mode.MULTIPLE : Mode.RANGE);
    }

    private Dependencies resolveDependencies(DatabaseAdapter db, Instant anchor) {
        List<String> names = configuration.dependencies();
        Map<String, DataRecord> resolved = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            String dependency = names.get(i);
            Duration limit = configuration.dependencyLimit(i);

            DataRecord candidate = db.getLatestBefore(dependency, anchor).orElse(null);
            if (candidate != null && limit != null
                    && Duration.between(candidate.date(), anchor).compareTo(limit) > 0) {
                log.debug("dependency outside lookback window unit={} dependency={} candidate={} anchor={} limit={}",
                        configuration.name(), dependency, candidate.date(), anchor, limit);
                candidate = null;
            }
            resolved.put(dependency, candidate);
        }
        return Dependencies.of(resolved);
    }

    private Instant outputDate(UnitContext context, Selection selection, int index) {
        return switch (selection.mode()) {
            case LATEST -> context.now();
            case RANGE -> selection.anchor();
            case MULTIPLE -> index < selection.records().size()
                    ? selection.records().get(index).date()
                    : selection.anchor();
        };
    }

    private static long missingCount(Dependencies dependencies) {
        return dependencies.names().stream().filter(dependencies::isMissing).count();
    }

    private enum Mode {
        LATEST,
        RANGE,
        MULTIPLE
    }

    private record Selection(List<DataRecord> records, Instant anchor, Mode mode) {
        static Selection ofLast(List<DataRecord> records, Mode mode) {
            return new Selection(records, records.get(records.size() - 1).date(), mode);
        }
    }
}
