package io.twin4j;

import io.twin4j.core.UnitEvent;

@FunctionalInterface
public interface UnitEventListener {

    UnitEventListener NOOP = event -> {
    };

    void onEvent(UnitEvent event);
}
