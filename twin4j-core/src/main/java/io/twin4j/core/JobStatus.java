package io.twin4j.core;

public enum JobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isOpen() {
        return this == WAITING || this == ACTIVE;
    }
}
