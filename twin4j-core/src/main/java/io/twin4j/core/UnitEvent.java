package io.twin4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Notification emitted when a unit finishes a run that wrote data.
 */
public record UnitEvent(
        Type type,
        String unitName,
        Instant timestamp,
        Map<String, Object> data
) {
    public enum Type {
        PRODUCER_COMPLETED,
        FUSION_COMPLETED
    }

    public UnitEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
