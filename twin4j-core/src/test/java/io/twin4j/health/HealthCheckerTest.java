package io.twin4j.health;

import io.twin4j.core.HealthCheck;
import io.twin4j.core.HealthStatus;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.errors.DatabaseException;
import io.twin4j.errors.StorageException;
import io.twin4j.storage.StorageService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthCheckerTest {

    private final HealthChecker checker = new HealthChecker(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void allChecksUpShouldBeHealthy() {
        checker.registerPing(HealthChecker.DATABASE, () -> {
        });
        checker.registerPing(HealthChecker.QUEUE, () -> {
        });
        checker.setVersion("1.2.3");
        checker.setComponentCounts(Map.of("producers", 2, "fusionUnits", 1));

        HealthStatus status = checker.performCheck();

        assertEquals(HealthStatus.Overall.HEALTHY, status.status());
        assertEquals("1.2.3", status.version());
        assertEquals(2, status.components().get("producers"));
        assertEquals(2, status.checks().size());
        assertNotNull(status.checks().get(HealthChecker.DATABASE).latencyMs());
    }

    @Test
    void databaseDownShouldBeUnhealthy() {
        DatabaseAdapter db = mock(DatabaseAdapter.class);
        when(db.doesTableExists("_health_check_ping")).thenThrow(new DatabaseException("connection refused"));
        checker.registerPing(HealthChecker.DATABASE, HealthChecks.database(db));
        checker.registerPing(HealthChecker.STORAGE, () -> {
        });

        HealthStatus status = checker.performCheck();

        assertEquals(HealthStatus.Overall.UNHEALTHY, status.status());
        HealthCheck database = status.checks().get(HealthChecker.DATABASE);
        assertFalse(database.isUp());
        assertEquals("connection refused", database.error());
        assertTrue(status.checks().get(HealthChecker.STORAGE).isUp());
    }

    @Test
    void otherCheckDownShouldBeDegraded() {
        StorageService storage = mock(StorageService.class);
        doThrow(new StorageException("bucket missing")).when(storage).checkConnection();
        checker.registerPing(HealthChecker.DATABASE, () -> {
        });
        checker.registerPing(HealthChecker.STORAGE, HealthChecks.storage(storage));

        HealthStatus status = checker.performCheck();

        assertEquals(HealthStatus.Overall.DEGRADED, status.status());
        assertEquals("bucket missing", status.checks().get(HealthChecker.STORAGE).error());
        verify(storage).checkConnection();
    }

    @Test
    void nullResultShouldBeReportedDown() {
        checker.registerCheck("custom", () -> null);

        HealthStatus status = checker.performCheck();

        assertEquals(HealthStatus.Overall.DEGRADED, status.status());
        assertEquals("Check returned no result", status.checks().get("custom").error());
    }

    @Test
    void customLatencyShouldBeKept() {
        checker.registerCheck("remote", () -> HealthCheck.up(42));

        assertEquals(42L, checker.performCheck().checks().get("remote").latencyMs());
    }

    @Test
    void removedCheckShouldNoLongerRun() {
        checker.registerCheck("custom", () -> HealthCheck.down(0, "boom"));
        assertTrue(checker.removeCheck("custom"));
        assertFalse(checker.removeCheck("custom"));

        HealthStatus status = checker.performCheck();

        assertEquals(HealthStatus.Overall.HEALTHY, status.status());
        assertTrue(checker.getCheckNames().isEmpty());
        assertEquals(0, status.uptimeSeconds());
    }
}
