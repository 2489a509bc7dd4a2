package io.twin4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency records resolved for one fusion run, keyed by stream name.
 *
 * <p>A dependency with no record inside its lookback window is present as a key but resolves to
 * {@link Optional#empty()}; the fusion unit decides whether it can proceed without it.
 */
public final class Dependencies {

    private final Map<String, DataRecord> byName;

    private Dependencies(Map<String, DataRecord> byName) {
        this.byName = byName;
    }

    public static Dependencies of(Map<String, DataRecord> resolved) {
        return new Dependencies(Collections.unmodifiableMap(new LinkedHashMap<>(resolved)));
    }

    public Optional<DataRecord> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Returns the record or throws when it is missing; convenience for units that cannot run without it.
     */
    public DataRecord require(String name) {
        DataRecord record = byName.get(name);
        if (record == null) {
            throw new IllegalStateException("Dependency '" + name + "' has no record inside its lookback window");
        }
        return record;
    }

    public boolean isMissing(String name) {
        return byName.get(name) == null;
    }

    public Set<String> names() {
        return byName.keySet();
    }

    public int size() {
        return byName.size();
    }
}
