package io.twin4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a job refers to: the unit (or stream) it works on, what triggered it and free-form metadata.
 */
public record JobPayload(
        String unitName,
        TriggerKind trigger,
        Map<String, Object> data
) {
    public JobPayload {
        Objects.requireNonNull(unitName, "unitName must not be null");
        if (unitName.isBlank()) {
            throw new IllegalArgumentException("unitName must not be blank");
        }
        Objects.requireNonNull(trigger, "trigger must not be null");
        data = (data == null || data.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Key of the per-unit mutex: the unit name, or {@code <stream>/<recordId>} for uploads so that
     * different assets of one stream can be ingested in parallel.
     */
    public String mutexKey() {
        Object recordId = data.get("recordId");
        if (trigger == TriggerKind.UPLOAD && recordId != null) {
            return unitName + "/" + recordId;
        }
        return unitName;
    }

    public static JobPayload of(String unitName, TriggerKind trigger) {
        return new JobPayload(unitName, trigger, Map.of());
    }
}
