package io.twin4j;

import io.twin4j.core.DataRecord;
import io.twin4j.core.Dependencies;
import io.twin4j.core.MetadataRow;
import io.twin4j.core.RunOutcome;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.database.InMemoryDatabaseAdapter;
import io.twin4j.errors.ConfigurationException;
import io.twin4j.errors.ErrorCode;
import io.twin4j.errors.StorageException;
import io.twin4j.storage.LocalStorageService;
import io.twin4j.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class FusionUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T15:00:00Z");

    @TempDir
    Path tempDir;

    private StorageService storage;
    private DatabaseAdapter db;
    private UnitContext context;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(tempDir);
        db = new InMemoryDatabaseAdapter(storage);
        for (String table : List.of("sensor", "weather", "fusion")) {
            db.createTable(table);
        }
        context = contextAt(NOW);
    }

    @Test
    void dependencyShouldResolveToLatestRecordBeforePrimary() {
        write("weather", "11:00", "w-11");
        write("weather", "13:00", "w-13");
        write("sensor", "14:00", "s-14");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .dependency("weather")
                .build());

        RunOutcome outcome = unit.run(context);

        assertEquals(1, outcome.recordsWritten());
        Dependencies deps = unit.calls.get(0).dependencies();
        assertTrue(deps.get("weather").isPresent());
        assertEquals(at("13:00"), deps.get("weather").get().date());
        assertEquals("w-13", text(deps.get("weather").get()));
    }

    @Test
    void dependencyOutsideLookbackWindowShouldBeMissing() {
        write("weather", "11:00", "w-11");
        write("weather", "13:00", "w-13");
        write("sensor", "14:00", "s-14");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .dependency("weather", Duration.ofMinutes(30))
                .build());

        RunOutcome outcome = unit.run(context);

        // the engine never aborts for a missing dependency
        assertEquals(1, outcome.recordsWritten());
        Dependencies deps = unit.calls.get(0).dependencies();
        assertTrue(deps.isMissing("weather"));
        assertTrue(deps.names().contains("weather"));
    }

    @Test
    void dependencyAtExactLimitShouldBeResolved() {
        write("weather", "13:30", "w-1330");
        write("sensor", "14:00", "s-14");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .dependency("weather", "30m")
                .build());

        unit.run(context);

        assertFalse(unit.calls.get(0).dependencies().isMissing("weather"));
    }

    @Test
    void stalePrimaryShouldBeSuccessfulNoop() {
        write("sensor", "14:00", "s-14");
        write("fusion", "14:30", "previous");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion").source("sensor").build());

        RunOutcome outcome = unit.run(context);

        assertFalse(outcome.produced());
        assertTrue(unit.calls.isEmpty());
        assertEquals(1, db.getByDateRange("fusion", Instant.EPOCH, NOW).size());
    }

    @Test
    void missingSourceShouldFailBeforeAnyAdapterCall() {
        DatabaseAdapter mockDb = mock(DatabaseAdapter.class);
        StorageService mockStorage = mock(StorageService.class);
        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion").dependency("weather").build());

        assertThatThrownBy(() -> unit.run(UnitContext.of(mockDb, mockStorage)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must specify a source");

        verifyNoInteractions(mockDb, mockStorage);
    }

    @Test
    void sameDatePrimariesShouldPickGreatestId() {
        for (int i = 1; i <= 10; i++) {
            write("sensor", "14:00", "s-" + i);
        }

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion").source("sensor").build());
        unit.run(context);

        DataRecord picked = unit.calls.get(0).sources().get(0);
        assertEquals("10", picked.id());
        assertEquals("s-10", text(picked));
    }

    @Test
    void successiveRunsShouldOnlySeeNewerPrimaries() {
        write("sensor", "14:00", "s-14");
        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion").source("sensor").build());

        assertEquals(1, unit.run(contextAt(at("14:05"))).recordsWritten());
        // output is dated at the run time, so the same primary is not picked again
        assertEquals(0, unit.run(contextAt(at("14:10"))).recordsWritten());

        write("sensor", "14:20", "s-1420");
        assertEquals(1, unit.run(contextAt(at("14:25"))).recordsWritten());

        assertEquals(2, unit.calls.size());
        assertEquals("s-1420", text(unit.calls.get(1).sources().get(0)));
        List<Instant> outputs = db.getByDateRange("fusion", Instant.EPOCH, NOW).stream()
                .map(DataRecord::date)
                .collect(Collectors.toList());
        assertEquals(List.of(at("14:05"), at("14:25")), outputs);
    }

    @Test
    void multipleResultsShouldDateEachOutputAtItsSource() {
        write("sensor", "10:00", "a");
        write("sensor", "11:00", "b");
        write("sensor", "12:00", "c");

        RecordingFusion unit = new RecordingFusion(
                UnitConfiguration.fusion("fusion").source("sensor").multipleResults(true).build(),
                (sources, deps) -> sources.stream()
                        .map(r -> ("out-" + text(r)).getBytes(StandardCharsets.UTF_8))
                        .collect(Collectors.toList())
        );

        RunOutcome outcome = unit.run(context);

        assertEquals(3, outcome.recordsWritten());
        List<DataRecord> outputs = db.getByDateRange("fusion", Instant.EPOCH, NOW);
        assertThat(outputs).extracting(DataRecord::date).containsExactly(at("10:00"), at("11:00"), at("12:00"));
        assertThat(outputs).extracting(FusionUnitTest::text).containsExactly("out-a", "out-b", "out-c");
    }

    @Test
    void countRangeShouldConsumeRecordsInOrder() {
        for (int m = 0; m < 5; m++) {
            write("sensor", "10:0" + m, "s" + m);
        }

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .sourceRange("3")
                .build());

        unit.run(context);
        unit.run(context);
        unit.run(context);

        assertEquals(2, unit.calls.size());
        assertThat(unit.calls.get(0).sources()).extracting(FusionUnitTest::text).containsExactly("s0", "s1", "s2");
        assertThat(unit.calls.get(1).sources()).extracting(FusionUnitTest::text).containsExactly("s3", "s4");
        assertThat(db.getByDateRange("fusion", Instant.EPOCH, NOW))
                .extracting(DataRecord::date)
                .containsExactly(at("10:02"), at("10:04"));
    }

    @Test
    void strictCountRangeShouldWaitForFullBatch() {
        write("sensor", "10:00", "s0");
        write("sensor", "10:01", "s1");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .sourceRange("3")
                .sourceRangeMin(true)
                .build());

        assertFalse(unit.run(context).produced());

        write("sensor", "10:02", "s2");
        assertTrue(unit.run(context).produced());
        assertEquals(3, unit.calls.get(0).sources().size());
    }

    @Test
    void windowRangeShouldDateOutputAtWindowEnd() {
        write("sensor", "10:00", "a");
        write("sensor", "10:20", "b");
        write("sensor", "10:50", "c");
        write("sensor", "11:10", "d");
        write("weather", "10:25", "w");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .sourceRange("30m")
                .dependency("weather")
                .build());

        for (int i = 0; i < 4; i++) {
            unit.run(context);
        }

        assertEquals(3, unit.calls.size());
        assertThat(unit.calls.get(0).sources()).extracting(FusionUnitTest::text).containsExactly("a", "b");
        assertThat(unit.calls.get(1).sources()).extracting(FusionUnitTest::text).containsExactly("c");
        assertThat(unit.calls.get(2).sources()).extracting(FusionUnitTest::text).containsExactly("d");
        assertThat(db.getByDateRange("fusion", Instant.EPOCH, NOW))
                .extracting(DataRecord::date)
                .containsExactly(at("10:29:59"), at("10:59:59"), at("11:29:59"));
        // dependencies resolve against the window end
        assertEquals("w", text(unit.calls.get(0).dependencies().require("weather")));
    }

    @Test
    void strictWindowShouldNotCloseBeforeItEnds() {
        write("sensor", "10:00", "a");

        RecordingFusion unit = new RecordingFusion(UnitConfiguration.fusion("fusion")
                .source("sensor")
                .sourceRange("30m")
                .sourceRangeMin(true)
                .build());

        assertFalse(unit.run(contextAt(at("10:15"))).produced());
        assertTrue(unit.run(contextAt(at("10:45"))).produced());
    }

    @Test
    void harvestFailureShouldBeWrappedWithUnitContext() {
        write("sensor", "14:00", "s-14");
        RecordingFusion unit = new RecordingFusion(
                UnitConfiguration.fusion("fusion").source("sensor").build(),
                (sources, deps) -> {
                    throw new IllegalStateException("model crashed");
                }
        );

        assertThatThrownBy(() -> unit.run(context))
                .isInstanceOfSatisfying(StorageException.class, e -> {
                    assertEquals(ErrorCode.STORAGE_ERROR, e.code());
                    assertEquals("fusion", e.context().get("unitName"));
                    assertEquals("sensor", e.context().get("source"));
                    assertThat(e.getCause()).hasMessage("model crashed");
                });
        assertTrue(db.getLatestByName("fusion").isEmpty());
    }

    @Test
    void emptyHarvestShouldWriteNothing() {
        write("sensor", "14:00", "s-14");
        RecordingFusion unit = new RecordingFusion(
                UnitConfiguration.fusion("fusion").source("sensor").build(),
                (sources, deps) -> List.of()
        );

        assertFalse(unit.run(context).produced());
        assertTrue(db.getLatestByName("fusion").isEmpty());
    }

    private UnitContext contextAt(Instant now) {
        return new UnitContext(db, storage, Clock.fixed(now, ZoneOffset.UTC), null, null);
    }

    private void write(String stream, String time, String payload) {
        String ref = storage.save(payload.getBytes(StandardCharsets.UTF_8), stream, "txt");
        db.save(MetadataRow.of(stream, "text/plain", ref, at(time)));
    }

    private static Instant at(String time) {
        String t = time.length() == 5 ? time + ":00" : time;
        return Instant.parse("2026-03-01T" + t + "Z");
    }

    private static String text(DataRecord record) {
        return new String(record.data(), StandardCharsets.UTF_8);
    }

    record Call(List<DataRecord> sources, Dependencies dependencies) {
    }

    static class RecordingFusion extends FusionUnit {
        final List<Call> calls = new ArrayList<>();
        private final BiFunction<List<DataRecord>, Dependencies, List<byte[]>> transform;

        RecordingFusion(UnitConfiguration configuration) {
            this(configuration, (sources, deps) -> List.of("fused".getBytes(StandardCharsets.UTF_8)));
        }

        RecordingFusion(UnitConfiguration configuration,
                        BiFunction<List<DataRecord>, Dependencies, List<byte[]>> transform) {
            super(configuration);
            this.transform = transform;
        }

        @Override
        protected List<byte[]> harvest(List<DataRecord> sourceRecords, Dependencies dependencies) {
            calls.add(new Call(sourceRecords, dependencies));
            return transform.apply(sourceRecords, dependencies);
        }
    }
}
