package io.twin4j.errors;

public enum ErrorCode {
    CONFIGURATION_ERROR(false),
    VALIDATION_ERROR(false),
    STORAGE_ERROR(true),
    DATABASE_ERROR(true),
    QUEUE_ERROR(true);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a job failing with this code may be attempted again by the queue manager.
     */
    public boolean retryable() {
        return retryable;
    }
}
