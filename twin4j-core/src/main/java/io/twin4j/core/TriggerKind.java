package io.twin4j.core;

/**
 * What caused a job to be enqueued.
 */
public enum TriggerKind {
    SCHEDULE,
    SOURCE_EVENT,
    MANUAL,
    UPLOAD
}
