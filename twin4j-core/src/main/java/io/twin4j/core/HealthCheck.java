package io.twin4j.core;

/**
 * Outcome of one named health check.
 */
public record HealthCheck(
        Status status,
        Long latencyMs,
        String error
) {
    public enum Status {
        UP,
        DOWN
    }

    public static HealthCheck up(long latencyMs) {
        return new HealthCheck(Status.UP, latencyMs, null);
    }

    public static HealthCheck down(long latencyMs, String error) {
        return new HealthCheck(Status.DOWN, latencyMs, error);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public HealthCheck withLatency(long latencyMs) {
        return new HealthCheck(status, latencyMs, error);
    }
}
