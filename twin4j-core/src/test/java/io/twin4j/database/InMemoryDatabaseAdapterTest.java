package io.twin4j.database;

import io.twin4j.core.DataRecord;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.UploadStatus;
import io.twin4j.core.UploadUpdate;
import io.twin4j.errors.DatabaseException;
import io.twin4j.storage.LocalStorageService;
import io.twin4j.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDatabaseAdapterTest {

    @TempDir
    Path tempDir;

    private StorageService storage;
    private InMemoryDatabaseAdapter db;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(tempDir);
        db = new InMemoryDatabaseAdapter(storage);
        db.createTable("weather");
    }

    @Test
    void createTableShouldBeIdempotent() {
        db.save(row("10:00"));
        db.createTable("weather");

        assertTrue(db.doesTableExists("weather"));
        assertTrue(db.getLatestByName("weather").isPresent());
        assertTrue(db.migrateTableSchema("weather").isEmpty());
    }

    @Test
    void saveOnMissingTableShouldFail() {
        assertThatThrownBy(() -> db.save(MetadataRow.of("unknown", "text/plain", null, at("10:00"))))
                .isInstanceOf(DatabaseException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    void readsOnMissingTableShouldBeEmpty() {
        assertTrue(db.getLatestByName("unknown").isEmpty());
        assertTrue(db.getLatestBefore("unknown", at("10:00")).isEmpty());
        assertTrue(db.getAfterDate("unknown", Instant.EPOCH, 10).isEmpty());
        assertTrue(db.getByDateRange("unknown", Instant.EPOCH, at("10:00")).isEmpty());
    }

    @Test
    void latestShouldBeOrderedByDateNotInsertion() {
        db.save(row("12:00"));
        db.save(row("10:00"));

        assertEquals(at("12:00"), db.getLatestByName("weather").orElseThrow().date());
    }

    @Test
    void latestBeforeShouldBeInclusive() {
        db.save(row("11:00"));
        db.save(row("13:00"));

        assertEquals(at("13:00"), db.getLatestBefore("weather", at("13:00")).orElseThrow().date());
        assertEquals(at("11:00"), db.getLatestBefore("weather", at("12:59")).orElseThrow().date());
        assertTrue(db.getLatestBefore("weather", at("10:59")).isEmpty());
    }

    @Test
    void afterDateShouldBeExclusiveAscendingAndLimited() {
        db.save(row("12:00"));
        db.save(row("10:00"));
        db.save(row("11:00"));

        assertThat(db.getAfterDate("weather", at("10:00"), 10))
                .extracting(DataRecord::date)
                .containsExactly(at("11:00"), at("12:00"));
        assertThat(db.getAfterDate("weather", Instant.EPOCH, 2))
                .extracting(DataRecord::date)
                .containsExactly(at("10:00"), at("11:00"));
    }

    @Test
    void dateRangeShouldIncludeBothBounds() {
        db.save(row("10:00"));
        db.save(row("11:00"));
        db.save(row("12:00"));

        assertThat(db.getByDateRange("weather", at("10:00"), at("11:00")))
                .extracting(DataRecord::date)
                .containsExactly(at("10:00"), at("11:00"));
    }

    @Test
    void recordDataShouldBeLoadedLazilyFromStorage() {
        String ref = storage.save("21.5".getBytes(StandardCharsets.UTF_8), "weather", "txt");
        DataRecord saved = db.save(MetadataRow.of("weather", "text/plain", ref, at("10:00")));

        DataRecord loaded = db.getById("weather", saved.id()).orElseThrow();

        assertEquals("21.5", new String(loaded.data(), StandardCharsets.UTF_8));
    }

    @Test
    void uploadUpdatesShouldOnlyTouchProvidedFields() {
        DataRecord saved = db.save(new MetadataRow("weather", "model/gltf", null, at("10:00"),
                "scene", "drone", "owner-1", "scene.glb", true, UploadStatus.PENDING));

        db.updateUploadState("weather", saved.id(), UploadUpdate.processing("job-1"));
        db.updateUploadState("weather", saved.id(), UploadUpdate.failed("disk full"));
        DataRecord failed = db.getById("weather", saved.id()).orElseThrow();
        assertEquals(UploadStatus.FAILED, failed.uploadStatus());
        assertEquals("disk full", failed.uploadError());
        assertEquals("job-1", failed.uploadJobId());

        db.updateUploadState("weather", saved.id(), UploadUpdate.pending());
        db.updateUploadState("weather", saved.id(), UploadUpdate.jobId("job-2"));
        DataRecord retried = db.getById("weather", saved.id()).orElseThrow();
        assertEquals(UploadStatus.PENDING, retried.uploadStatus());
        assertNull(retried.uploadError());
        assertEquals("job-2", retried.uploadJobId());
        assertEquals("scene.glb", retried.filename());
        assertEquals(1, db.getByDateRange("weather", Instant.EPOCH, at("23:00")).size());
    }

    @Test
    void updateOfUnknownRecordShouldFail() {
        assertThatThrownBy(() -> db.updateUploadState("weather", "42", UploadUpdate.pending()))
                .isInstanceOf(DatabaseException.class);
    }

    @Test
    void closedAdapterShouldRejectCalls() {
        db.close();

        assertThatThrownBy(() -> db.doesTableExists("weather")).isInstanceOf(DatabaseException.class);
        assertThatThrownBy(() -> db.getLatestByName("weather")).isInstanceOf(DatabaseException.class);
        assertFalse(Thread.currentThread().isInterrupted());
    }

    private static MetadataRow row(String time) {
        return MetadataRow.of("weather", "application/json", null, at(time));
    }

    private static Instant at(String time) {
        return Instant.parse("2026-03-01T" + time + ":00Z");
    }
}
