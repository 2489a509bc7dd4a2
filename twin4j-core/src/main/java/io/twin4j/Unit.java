package io.twin4j;

import io.twin4j.core.RunOutcome;
import io.twin4j.core.UnitConfiguration;
import io.twin4j.core.UnitType;

/**
 * A schedulable piece of work that writes to the stream named after it.
 *
 * <p>Implementations extend {@link Producer} or {@link FusionUnit}; the engine dispatches on
 * {@link #type()}.
 */
public interface Unit {

    UnitConfiguration getConfiguration();

    default String name() {
        return getConfiguration().name();
    }

    default UnitType type() {
        return getConfiguration().type();
    }

    /**
     * Executes one run.
     *
     * @throws io.twin4j.errors.ConfigurationException on static misconfiguration (never retried)
     * @throws io.twin4j.errors.TwinException          on any other failure, already classified
     */
    RunOutcome run(UnitContext context);
}
