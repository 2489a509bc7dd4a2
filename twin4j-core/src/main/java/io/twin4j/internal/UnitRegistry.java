package io.twin4j.internal;

import io.twin4j.Unit;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitType;
import io.twin4j.errors.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registered units by name, in registration order. Names are unique across producers and fusion units.
 */
public class UnitRegistry {

    private final Map<String, Unit> unitsByName;

    public UnitRegistry(List<? extends Unit> units) {
        Map<String, Unit> byName = new LinkedHashMap<>();
        for (Unit unit : units) {
            UnitConfiguration config = unit.getConfiguration();
            if (byName.putIfAbsent(config.name(), unit) != null) {
                throw new ConfigurationException("Duplicate unit name: " + config.name(), Map.of("unitName", config.name()));
            }
        }
        this.unitsByName = Collections.unmodifiableMap(byName);
    }

    public Optional<Unit> find(String name) {
        return Optional.ofNullable(unitsByName.get(name));
    }

    public Unit getRequired(String name) {
        Unit unit = unitsByName.get(name);
        if (unit == null) {
            throw new ConfigurationException("Unknown unit: " + name, Map.of("unitName", name));
        }
        return unit;
    }

    public boolean contains(String name) {
        return unitsByName.containsKey(name);
    }

    public Collection<Unit> all() {
        return unitsByName.values();
    }

    public List<Unit> ofType(UnitType type) {
        return unitsByName.values().stream()
                .filter(u -> u.type() == type)
                .collect(Collectors.toList());
    }

    public List<UnitConfiguration> configurations() {
        return unitsByName.values().stream()
                .map(Unit::getConfiguration)
                .collect(Collectors.toList());
    }

    public int size() {
        return unitsByName.size();
    }
}
