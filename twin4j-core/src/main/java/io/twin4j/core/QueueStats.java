package io.twin4j.core;

/**
 * Job counts of one queue, per state.
 */
public record QueueStats(
        long waiting,
        long active,
        long completed,
        long failed
) {
    public static QueueStats empty() {
        return new QueueStats(0, 0, 0, 0);
    }

    public long open() {
        return waiting + active;
    }
}
