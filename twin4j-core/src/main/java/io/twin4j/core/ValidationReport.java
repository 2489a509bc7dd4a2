package io.twin4j.core;

import java.util.List;

/**
 * Per-unit configuration check results. One invalid unit never hides the others.
 */
public record ValidationReport(
        List<UnitValidation> units,
        List<String> engineErrors
) {
    public record UnitValidation(
            String unitName,
            UnitType type,
            List<String> errors,
            List<String> warnings
    ) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public ValidationReport {
        units = List.copyOf(units);
        engineErrors = List.copyOf(engineErrors);
    }

    public boolean valid() {
        return engineErrors.isEmpty() && units.stream().allMatch(UnitValidation::valid);
    }

    public long invalidCount() {
        return units.stream().filter(u -> !u.valid()).count();
    }

    public long warningCount() {
        return units.stream().mapToLong(u -> u.warnings().size()).sum();
    }
}
