package io.twin4j;

import io.twin4j.core.DataRecord;
import io.twin4j.core.RunOutcome;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitEvent;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.database.InMemoryDatabaseAdapter;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.StorageException;
import io.twin4j.storage.LocalStorageService;
import io.twin4j.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProducerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private DatabaseAdapter db;
    private StorageService storage;
    private final List<UnitEvent> events = new ArrayList<>();
    private UnitContext context;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(tempDir);
        db = new InMemoryDatabaseAdapter(storage);
        db.createTable("weather");
        context = new UnitContext(db, storage, Clock.fixed(NOW, ZoneOffset.UTC), events::add, null);
    }

    @Test
    void runShouldStoreOneRecordDatedNow() {
        byte[] payload = "{\"temp\":21.5}".getBytes(StandardCharsets.UTF_8);
        TestProducer producer = new TestProducer(() -> payload);

        RunOutcome outcome = producer.run(context);

        assertEquals(new RunOutcome("weather", 1), outcome);
        DataRecord record = db.getLatestByName("weather").orElseThrow();
        assertEquals(NOW, record.date());
        assertEquals("application/json", record.contentType());
        assertTrue(record.blobRef().startsWith("weather/"));
        assertTrue(record.blobRef().endsWith(".json"));
        assertArrayEquals(payload, record.data());

        assertEquals(1, events.size());
        UnitEvent event = events.get(0);
        assertEquals(UnitEvent.Type.PRODUCER_COMPLETED, event.type());
        assertEquals("weather", event.unitName());
        assertEquals(record.id(), event.data().get("recordId"));
        assertEquals(payload.length, event.data().get("bytesCollected"));
    }

    @Test
    void nullPayloadShouldSkipWithoutWriting() {
        TestProducer producer = new TestProducer(() -> null);

        RunOutcome outcome = producer.run(context);

        assertFalse(outcome.produced());
        assertTrue(db.getLatestByName("weather").isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void collectFailureShouldBeWrappedWithUnitName() {
        TestProducer producer = new TestProducer(() -> {
            throw new java.io.IOException("upstream timeout");
        });

        assertThatThrownBy(() -> producer.run(context))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("upstream timeout")
                .satisfies(e -> assertEquals("weather", ((StorageException) e).context().get("unitName")));
        assertTrue(db.getLatestByName("weather").isEmpty());
    }

    @Test
    void configurationErrorsShouldPassThroughUnwrapped() {
        TestProducer producer = new TestProducer(() -> {
            throw new ConfigurationException("api key missing");
        });

        assertThatThrownBy(() -> producer.run(context))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("api key missing");
    }

    @Test
    void missingTableShouldFailTheRun() {
        DatabaseAdapter empty = new InMemoryDatabaseAdapter(storage);
        TestProducer producer = new TestProducer(() -> new byte[]{1});

        assertThatThrownBy(() -> producer.run(UnitContext.of(empty, storage)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Table does not exist");
    }

    @Test
    void fusionConfigurationShouldBeRejected() {
        assertThatThrownBy(() -> new Producer(UnitConfiguration.fusion("x").source("y").build()) {
            @Override
            protected byte[] collect() {
                return null;
            }
        }).isInstanceOf(ConfigurationException.class);
    }

    static class TestProducer extends Producer {
        private final Callable<byte[]> collector;

        TestProducer(Callable<byte[]> collector) {
            super(UnitConfiguration.producer("weather")
                    .schedule("*/5 * * * *")
                    .contentType("application/json")
                    .extension("json")
                    .build());
            this.collector = collector;
        }

        @Override
        protected byte[] collect() throws Exception {
            return collector.call();
        }
    }
}
