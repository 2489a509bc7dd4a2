package io.twin4j.health;

import io.twin4j.core.HealthCheck;
import io.twin4j.core.HealthStatus;
import io.twin4j.errors.TwinException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Aggregates named checks into one {@link HealthStatus}.
 *
 * <p>A failing check is reported as DOWN and never propagated. The overall status is UNHEALTHY when
 * the {@value #DATABASE} check is down, DEGRADED when any other check is down, HEALTHY otherwise.
 */
public class HealthChecker {
    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    public static final String DATABASE = "database";
    public static final String QUEUE = "queue";
    public static final String STORAGE = "storage";

    private final Map<String, Supplier<HealthCheck>> checks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Instant startedAt;
    private volatile String version;
    private volatile Map<String, Integer> components = Map.of();

    public HealthChecker() {
        this(Clock.systemUTC());
    }

    public HealthChecker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
    }

    public void registerCheck(String name, Supplier<HealthCheck> check) {
        checks.put(Objects.requireNonNull(name, "name must not be null"), Objects.requireNonNull(check, "check must not be null"));
    }

    /**
     * Registers a check that is UP when {@code ping} returns normally.
     */
    public void registerPing(String name, Runnable ping) {
        Objects.requireNonNull(ping, "ping must not be null");
        registerCheck(name, () -> {
            ping.run();
            return HealthCheck.up(0);
        });
    }

    public boolean removeCheck(String name) {
        return checks.remove(name) != null;
    }

    public List<String> getCheckNames() {
        return List.copyOf(checks.keySet());
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public void setComponentCounts(Map<String, Integer> counts) {
        this.components = counts == null ? Map.of() : Map.copyOf(counts);
    }

    public HealthStatus performCheck() {
        Map<String, HealthCheck> results = new LinkedHashMap<>();
        for (Map.Entry<String, Supplier<HealthCheck>> entry : checks.entrySet()) {
            results.put(entry.getKey(), run(entry.getKey(), entry.getValue()));
        }

        boolean anyDown = results.values().stream().anyMatch(c -> !c.isUp());
        HealthCheck database = results.get(DATABASE);

        HealthStatus.Overall overall;
        if (database != null && !database.isUp()) {
            overall = HealthStatus.Overall.UNHEALTHY;
        } else if (anyDown) {
            overall = HealthStatus.Overall.DEGRADED;
        } else {
            overall = HealthStatus.Overall.HEALTHY;
        }

        Instant now = clock.instant();
        return new HealthStatus(
                overall,
                now,
                Duration.between(startedAt, now).getSeconds(),
                version,
                results,
                components
        );
    }

    private HealthCheck run(String name, Supplier<HealthCheck> check) {
        long start = System.nanoTime();
        try {
            HealthCheck result = check.get();
            long latency = elapsedMs(start);
            if (result == null) {
                return HealthCheck.down(latency, "Check returned no result");
            }
            return result.latencyMs() == null || result.latencyMs() == 0 ? result.withLatency(latency) : result;
        } catch (Exception e) {
            log.warn("health check failed name={} msg={}", name, e.getMessage());
            return HealthCheck.down(elapsedMs(start), TwinException.messageOf(e));
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
