package io.twin4j.core;

import java.time.Instant;

/**
 * Snapshot of a queued unit of work as held by the job store.
 */
public record Job(

        // identity
        String jobId,
        String queueName,
        JobPayload payload,

        // state machine
        JobStatus status,
        int attempt,
        int maxAttempts,
        String lastError,

        // scheduling
        Instant runAt,
        Instant createdAt,
        Instant updatedAt,
        String lockedBy
) {

    public String unitName() {
        return payload.unitName();
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public Job claimed(String workerId, Instant at) {
        return new Job(jobId, queueName, payload, JobStatus.ACTIVE, attempt + 1, maxAttempts, lastError, runAt, createdAt, at, workerId);
    }

    public Job completed(Instant at) {
        return new Job(jobId, queueName, payload, JobStatus.COMPLETED, attempt, maxAttempts, null, runAt, createdAt, at, null);
    }

    public Job retryAt(Instant nextRunAt, String error, Instant at) {
        return new Job(jobId, queueName, payload, JobStatus.WAITING, attempt, maxAttempts, error, nextRunAt, createdAt, at, null);
    }

    public Job failed(String error, Instant at) {
        return new Job(jobId, queueName, payload, JobStatus.FAILED, attempt, maxAttempts, error, runAt, createdAt, at, null);
    }
}
