package io.twin4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of all registered health checks.
 */
public record HealthStatus(
        Overall status,
        Instant timestamp,
        long uptimeSeconds,
        String version,
        Map<String, HealthCheck> checks,
        Map<String, Integer> components
) {
    public enum Overall {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }
}
