package io.twin4j.internal;

import io.twin4j.core.Job;
import io.twin4j.core.JobPayload;
import io.twin4j.core.JobStatus;
import io.twin4j.core.QueueStats;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link JobStore}. Jobs do not survive a restart.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> DUE_ORDER =
            Comparator.comparing(Job::runAt).thenComparing(Job::createdAt);

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public void ping() {
    }

    @Override
    public synchronized Job insert(String queueName, JobPayload payload, int maxAttempts, Instant runAt) {
        String id = UUID.randomUUID().toString();
        Job job = new Job(id, queueName, payload, JobStatus.WAITING, 0, maxAttempts, null, runAt, runAt, runAt, null);
        jobs.put(id, job);
        return job;
    }

    @Override
    public synchronized Optional<Job> claimNext(String queueName, Instant now, Set<String> excludedKeys, String workerId) {
        Optional<Job> due = jobs.values().stream()
                .filter(j -> j.status() == JobStatus.WAITING)
                .filter(j -> j.queueName().equals(queueName))
                .filter(j -> !j.runAt().isAfter(now))
                .filter(j -> !excludedKeys.contains(j.payload().mutexKey()))
                .min(DUE_ORDER);
        return due.map(j -> {
            Job claimed = j.claimed(workerId, now);
            jobs.put(j.jobId(), claimed);
            return claimed;
        });
    }

    @Override
    public boolean markCompleted(String jobId, String workerId, Instant at) {
        return updateLocked(jobId, workerId, j -> j.completed(at));
    }

    @Override
    public boolean markRetry(String jobId, String workerId, Instant nextRunAt, String error, Instant at) {
        return updateLocked(jobId, workerId, j -> j.retryAt(nextRunAt, error, at));
    }

    @Override
    public boolean markFailed(String jobId, String workerId, String error, Instant at) {
        return updateLocked(jobId, workerId, j -> j.failed(error, at));
    }

    @Override
    public synchronized QueueStats countByStatus(String queueName) {
        long waiting = 0, active = 0, completed = 0, failed = 0;
        for (Job j : jobs.values()) {
            if (!j.queueName().equals(queueName)) {
                continue;
            }
            switch (j.status()) {
                case WAITING -> waiting++;
                case ACTIVE -> active++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new QueueStats(waiting, active, completed, failed);
    }

    @Override
    public synchronized long countOpenJobs(String mutexKey) {
        return jobs.values().stream()
                .filter(j -> j.status().isOpen())
                .filter(j -> j.payload().mutexKey().equals(mutexKey))
                .count();
    }

    @Override
    public synchronized Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized int failActive(String workerId, String error, Instant at) {
        int count = 0;
        for (Job j : jobs.values()) {
            if (j.status() == JobStatus.ACTIVE && workerId.equals(j.lockedBy())) {
                jobs.put(j.jobId(), j.failed(error, at));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized int requeueOrphaned(String workerId, Instant at) {
        int count = 0;
        for (Job j : jobs.values()) {
            if (j.status() == JobStatus.ACTIVE && !workerId.equals(j.lockedBy())) {
                jobs.put(j.jobId(), j.retryAt(at, j.lastError(), at));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized boolean deleteById(String jobId) {
        return jobs.remove(jobId) != null;
    }

    private synchronized boolean updateLocked(String jobId, String workerId, UnaryOperator<Job> change) {
        Job current = jobs.get(jobId);
        if (current == null || current.status() != JobStatus.ACTIVE || !workerId.equals(current.lockedBy())) {
            return false;
        }
        jobs.put(jobId, change.apply(current));
        return true;
    }
}
