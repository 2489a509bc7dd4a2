package io.twin4j.database;

import io.twin4j.core.DataRecord;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadUpdate;
import io.twin4j.errors.DatabaseException;
import io.twin4j.storage.StorageService;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local {@link DatabaseAdapter}. Tables are sorted sets ordered by {@link DataRecord#CHRONOLOGICAL};
 * ids are per-table sequence numbers, so insertion order breaks date ties.
 */
public class InMemoryDatabaseAdapter implements DatabaseAdapter {

    private final StorageService storage;
    private final Map<String, Table> tables = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryDatabaseAdapter(StorageService storage) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
    }

    private static final class Table {
        final NavigableSet<DataRecord> rows = new ConcurrentSkipListSet<>(DataRecord.CHRONOLOGICAL);
        final Map<String, DataRecord> byId = new ConcurrentHashMap<>();
        final AtomicLong sequence = new AtomicLong();
    }

    @Override
    public boolean doesTableExists(String name) {
        ensureOpen();
        return tables.containsKey(name);
    }

    @Override
    public void createTable(String name) {
        ensureOpen();
        tables.putIfAbsent(name, new Table());
    }

    @Override
    public List<String> migrateTableSchema(String name) {
        requireTable(name);
        return List.of();
    }

    @Override
    public DataRecord save(MetadataRow row) {
        Table table = requireTable(row.streamName());
        String id = Long.toString(table.sequence.incrementAndGet());
        DataRecord record = DataRecord.builder()
                .id(id)
                .streamName(row.streamName())
                .date(row.date())
                .contentType(row.contentType())
                .blobRef(row.blobRef())
                .loader(loaderFor(row.blobRef()))
                .description(row.description())
                .source(row.source())
                .ownerId(row.ownerId())
                .filename(row.filename())
                .isPublic(row.isPublic())
                .uploadStatus(row.uploadStatus())
                .build();
        synchronized (table) {
            table.rows.add(record);
            table.byId.put(id, record);
        }
        return record;
    }

    @Override
    public Optional<DataRecord> getById(String name, String id) {
        Table table = tableOrNull(name);
        return table == null ? Optional.empty() : Optional.ofNullable(table.byId.get(id));
    }

    @Override
    public Optional<DataRecord> getLatestByName(String name) {
        Table table = tableOrNull(name);
        if (table == null || table.rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.rows.last());
    }

    @Override
    public Optional<DataRecord> getLatestBefore(String name, Instant beforeDate) {
        Table table = tableOrNull(name);
        if (table == null) {
            return Optional.empty();
        }
        return table.rows.descendingSet().stream()
                .filter(r -> !r.date().isAfter(beforeDate))
                .findFirst();
    }

    @Override
    public List<DataRecord> getByDateRange(String name, Instant start, Instant end) {
        Table table = tableOrNull(name);
        if (table == null) {
            return List.of();
        }
        return table.rows.stream()
                .filter(r -> !r.date().isBefore(start) && !r.date().isAfter(end))
                .collect(Collectors.toList());
    }

    @Override
    public List<DataRecord> getAfterDate(String name, Instant afterDate, int limit) {
        Table table = tableOrNull(name);
        if (table == null) {
            return List.of();
        }
        return table.rows.stream()
                .filter(r -> r.date().isAfter(afterDate))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public void updateUploadState(String name, String id, UploadUpdate update) {
        Table table = requireTable(name);
        synchronized (table) {
            DataRecord current = table.byId.get(id);
            if (current == null) {
                throw new DatabaseException("Record not found: " + name + "/" + id, Map.of("table", name, "id", id));
            }
            DataRecord.Builder next = current.toBuilder();
            if (update.status() != null) {
                next.uploadStatus(update.status())
                        .uploadError(update.status() == UploadStatus.FAILED ? update.uploadError() : null);
            }
            if (update.uploadJobId() != null) {
                next.uploadJobId(update.uploadJobId());
            }
            if (update.blobRef() != null) {
                next.blobRef(update.blobRef()).loader(loaderFor(update.blobRef()));
            }
            if (update.publicUrl() != null) {
                next.publicUrl(update.publicUrl());
            }
            DataRecord updated = next.build();
            table.rows.remove(current);
            table.rows.add(updated);
            table.byId.put(id, updated);
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private Supplier<byte[]> loaderFor(String blobRef) {
        return blobRef == null ? null : () -> storage.retrieve(blobRef);
    }

    private Table tableOrNull(String name) {
        ensureOpen();
        return tables.get(name);
    }

    private Table requireTable(String name) {
        Table table = tableOrNull(name);
        if (table == null) {
            throw new DatabaseException("Table does not exist: " + name, Map.of("table", name));
        }
        return table;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new DatabaseException("Database adapter is closed");
        }
    }
}
