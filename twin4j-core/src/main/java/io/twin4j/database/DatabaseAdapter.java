package io.twin4j.database;

import io.twin4j.core.DataRecord;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.UploadUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only metadata store, one table per stream.
 *
 * <p>"Latest" always means greatest date, ties broken by greatest id (see {@link DataRecord#CHRONOLOGICAL}).
 * Consistency of latest-record reads is the implementation's responsibility; callers hold no locks.
 */
public interface DatabaseAdapter extends AutoCloseable {

    boolean doesTableExists(String name);

    void createTable(String name);

    /**
     * Brings an existing table up to the current schema.
     *
     * @return descriptions of the migrations applied; empty when already current
     */
    List<String> migrateTableSchema(String name);

    DataRecord save(MetadataRow row);

    Optional<DataRecord> getById(String name, String id);

    Optional<DataRecord> getLatestByName(String name);

    /**
     * Latest record with {@code date <= beforeDate}.
     */
    Optional<DataRecord> getLatestBefore(String name, Instant beforeDate);

    /**
     * Records with {@code start <= date <= end}, ascending.
     */
    List<DataRecord> getByDateRange(String name, Instant start, Instant end);

    /**
     * First {@code limit} records with {@code date > afterDate}, ascending.
     */
    List<DataRecord> getAfterDate(String name, Instant afterDate, int limit);

    /**
     * Updates the upload fields of an asset record; the only mutation records ever see.
     */
    void updateUploadState(String name, String id, UploadUpdate update);

    @Override
    void close();
}
