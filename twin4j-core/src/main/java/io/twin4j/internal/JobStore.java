package io.twin4j.internal;

import io.twin4j.core.Job;
import io.twin4j.core.JobPayload;
import io.twin4j.core.QueueStats;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of queued jobs.
 *
 * <p>Write-backs ({@code mark*}) are guarded by {@code workerId}: they only apply while the job is
 * still ACTIVE and locked by that worker, so a job force-failed during shutdown is never overwritten
 * by a late completion.
 */
public interface JobStore {

    /**
     * Throws when the backing broker is unreachable.
     */
    void ping();

    Job insert(String queueName, JobPayload payload, int maxAttempts, Instant runAt);

    /**
     * Atomically moves the oldest due WAITING job of {@code queueName} to ACTIVE, skipping jobs whose
     * mutex key is in {@code excludedKeys}. The returned job has its attempt counter incremented.
     */
    Optional<Job> claimNext(String queueName, Instant now, Set<String> excludedKeys, String workerId);

    boolean markCompleted(String jobId, String workerId, Instant at);

    boolean markRetry(String jobId, String workerId, Instant nextRunAt, String error, Instant at);

    boolean markFailed(String jobId, String workerId, String error, Instant at);

    QueueStats countByStatus(String queueName);

    /**
     * Number of WAITING or ACTIVE jobs holding {@code mutexKey}, across all queues.
     */
    long countOpenJobs(String mutexKey);

    Optional<Job> findById(String jobId);

    /**
     * Fails every job still ACTIVE under {@code workerId}.
     *
     * @return number of jobs failed
     */
    int failActive(String workerId, String error, Instant at);

    /**
     * Puts ACTIVE jobs locked by another worker back to WAITING. Used at startup to recover jobs
     * orphaned by a crashed process; assumes a single engine per job store.
     *
     * @return number of jobs requeued
     */
    int requeueOrphaned(String workerId, Instant at);

    boolean deleteById(String jobId);
}
