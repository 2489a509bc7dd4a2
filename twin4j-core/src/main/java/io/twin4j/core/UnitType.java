package io.twin4j.core;

/**
 * Type tag of a registered unit. The engine dispatches on this tag, never on the runtime class.
 */
public enum UnitType {
    PRODUCER(QueueNames.COLLECTORS),
    FUSION(QueueNames.HARVESTERS);

    private final String defaultQueue;

    UnitType(String defaultQueue) {
        this.defaultQueue = defaultQueue;
    }

    public String defaultQueue() {
        return defaultQueue;
    }
}
